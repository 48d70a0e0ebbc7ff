package com.tuorg.programservice.service;

import com.tuorg.programservice.config.GenerationProperties;
import com.tuorg.programservice.model.ExperienceLevel;
import com.tuorg.programservice.model.ProgramGoal;
import com.tuorg.programservice.model.ProgramStructure;
import com.tuorg.programservice.model.ProgramTemplate;
import com.tuorg.programservice.model.WeekBlueprint;
import com.tuorg.programservice.model.WorkoutBlueprint;
import com.tuorg.programservice.repository.TemplateRepository;
import com.tuorg.programservice.repository.memory.InMemoryTemplateRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class TemplateSelectorTest {

    private InMemoryTemplateRepository repository;
    private TemplateSelector selector;

    @BeforeEach
    void setUp() {
        repository = new InMemoryTemplateRepository();
        selector = new TemplateSelector(repository, new GenerationProperties());
    }

    @Test
    void exactSessionsAndDurationWin() {
        repository.save(template("a", 3, 8, 0));
        repository.save(template("b", 4, 8, 0));

        Optional<TemplateMatch> match = selector.selectBestTemplate(ProgramGoal.HYPERTROPHY,
                ExperienceLevel.INTERMEDIATE, 4, 8);

        assertThat(match).isPresent();
        assertThat(match.get().getTemplate().getId()).isEqualTo("b");
        // base 20 + sessions 30 + duration 25
        assertThat(match.get().getScore()).isEqualTo(75.0);
        assertThat(match.get().getMatchReasons()).contains("Exact sessions match (4/week)", "Exact duration match (8 weeks)");
    }

    @Test
    void closeMatchesAndPopularityAddPartialScore() {
        TemplateMatch match = selector.score(template("c", 3, 10, 50), 4, 8);

        // 20 + 15 + 10 + 0.5 * 15
        assertThat(match.getScore()).isEqualTo(52.5);
        assertThat(match.getMatchReasons()).contains("Used 50 times");
    }

    @Test
    void popularityIsCapped() {
        TemplateMatch popular = selector.score(template("p", 3, 8, 500), 3, 8);
        TemplateMatch capped = selector.score(template("q", 3, 8, 100), 3, 8);

        assertThat(popular.getScore()).isEqualTo(capped.getScore()).isEqualTo(90.0);
    }

    @Test
    void tieGoesToFirstCandidate() {
        TemplateRepository repo = mock(TemplateRepository.class);
        when(repo.getByCriteria(any(), any(), any()))
                .thenReturn(List.of(template("first", 3, 8, 0), template("second", 3, 8, 0)));
        TemplateSelector tied = new TemplateSelector(repo, new GenerationProperties());

        Optional<TemplateMatch> match = tied.selectBestTemplate(ProgramGoal.HYPERTROPHY,
                ExperienceLevel.INTERMEDIATE, 3, 8);

        assertThat(match.get().getTemplate().getId()).isEqualTo("first");
    }

    @Test
    void noCandidatesOrFailingRepositoryGiveEmpty() {
        assertThat(selector.selectBestTemplate(ProgramGoal.ENDURANCE, ExperienceLevel.BEGINNER, 3, 8)).isEmpty();

        TemplateRepository broken = mock(TemplateRepository.class);
        when(broken.getByCriteria(any(), any(), any())).thenThrow(new IllegalStateException("db down"));
        TemplateSelector failing = new TemplateSelector(broken, new GenerationProperties());

        assertThat(failing.selectBestTemplate(ProgramGoal.STRENGTH, ExperienceLevel.ADVANCED, 4, 12)).isEmpty();
    }

    @Test
    void recordUsageIncrementsAndNeverThrows() {
        repository.save(template("used", 3, 8, 7));

        selector.recordUsage("used");

        assertThat(repository.getById("used").get().getUsageCount()).isEqualTo(8);
        assertThatCode(() -> selector.recordUsage("missing")).doesNotThrowAnyException();
        assertThatCode(() -> selector.recordUsage(null)).doesNotThrowAnyException();

        TemplateRepository broken = mock(TemplateRepository.class);
        doThrow(new IllegalStateException("db down")).when(broken).incrementUsageCount(anyString());
        assertThatCode(() -> new TemplateSelector(broken, new GenerationProperties()).recordUsage("x"))
                .doesNotThrowAnyException();
    }

    @Test
    void defaultStructureForThreeSessionsDependsOnGoal() {
        ProgramStructure strength = selector.getDefaultStructure(ProgramGoal.STRENGTH, ExperienceLevel.INTERMEDIATE, 3, 8);
        ProgramStructure endurance = selector.getDefaultStructure(ProgramGoal.ENDURANCE, ExperienceLevel.BEGINNER, 3, 8);

        assertThat(strength.getSplitType()).isEqualTo("push_pull_legs");
        assertThat(strength.workoutsForWeek(1)).extracting(WorkoutBlueprint::getWorkoutType)
                .containsExactly("push", "pull", "legs");
        assertThat(endurance.getSplitType()).isEqualTo("full_body");
        assertThat(endurance.getWeeks().get(0).getFocus()).isEqualTo("Muscular Endurance");
    }

    @Test
    void defaultStructureMatchesSessionCount() {
        ProgramStructure four = selector.getDefaultStructure(ProgramGoal.HYPERTROPHY, ExperienceLevel.INTERMEDIATE, 4, 8);
        ProgramStructure two = selector.getDefaultStructure(ProgramGoal.GENERAL_FITNESS, ExperienceLevel.BEGINNER, 2, 8);
        ProgramStructure one = selector.getDefaultStructure(ProgramGoal.GENERAL_FITNESS, ExperienceLevel.BEGINNER, 1, 2);
        ProgramStructure seven = selector.getDefaultStructure(ProgramGoal.STRENGTH, ExperienceLevel.ADVANCED, 7, 12);

        assertThat(four.getSplitType()).isEqualTo("upper_lower");
        assertThat(four.workoutsForWeek(1)).hasSize(4);
        assertThat(two.workoutsForWeek(1)).extracting(WorkoutBlueprint::getName)
                .containsExactly("Full Body A", "Full Body B");
        assertThat(one.workoutsForWeek(1)).hasSize(1);
        assertThat(one.getMesocycleLength()).isEqualTo(2);
        assertThat(seven.workoutsForWeek(1)).hasSize(7);
        assertThat(seven.workoutsForWeek(1).get(6).getDayOfWeek()).isEqualTo(7);
    }

    private static ProgramTemplate template(String id, int sessions, int weeks, int usage) {
        List<WorkoutBlueprint> workouts = new ArrayList<>();
        for (int i = 0; i < sessions; i++) {
            workouts.add(new WorkoutBlueprint(i + 1, "Day " + (i + 1), "full_body", List.of("chest"), 5, 60));
        }
        ProgramStructure structure = new ProgramStructure();
        structure.setSplitType("custom");
        structure.setWeeks(new ArrayList<>(List.of(new WeekBlueprint(1, "Build", workouts))));

        ProgramTemplate t = new ProgramTemplate();
        t.setId(id);
        t.setName("Template " + id);
        t.setGoal(ProgramGoal.HYPERTROPHY);
        t.setExperienceLevel(ExperienceLevel.INTERMEDIATE);
        t.setDurationWeeks(weeks);
        t.setStructure(structure);
        t.setUsageCount(usage);
        return t;
    }
}
