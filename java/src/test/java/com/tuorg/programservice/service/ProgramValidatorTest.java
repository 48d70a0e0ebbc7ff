package com.tuorg.programservice.service;

import com.tuorg.programservice.model.ExperienceLevel;
import com.tuorg.programservice.model.ProgramWeek;
import com.tuorg.programservice.model.ValidationCategory;
import com.tuorg.programservice.model.ValidationIssue;
import com.tuorg.programservice.model.ValidationResult;
import com.tuorg.programservice.model.ValidationSeverity;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.tuorg.programservice.support.GenerationFixtures.assignment;
import static com.tuorg.programservice.support.GenerationFixtures.week;
import static com.tuorg.programservice.support.GenerationFixtures.workout;
import static org.assertj.core.api.Assertions.assertThat;

class ProgramValidatorTest {

    private final ProgramValidator validator = new ProgramValidator(new EquipmentNormalizer(), new PeriodizationService());

    @Test
    void balancedProgramHasNoIssues() {
        List<ProgramWeek> weeks = List.of(week(1, false, workout("Upper",
                assignment("bench-press", 12, List.of("chest"), "barbell", "bench"),
                assignment("barbell-row", 12, List.of("lats"), "barbell"))));

        ValidationResult result = validator.validateProgram(weeks, List.of("barbell", "bench"),
                ExperienceLevel.INTERMEDIATE, List.of());

        assertThat(result.isValid()).isTrue();
        assertThat(result.getIssues()).isEmpty();
        assertThat(result.getSummary()).isEqualTo("Program validated successfully with no issues.");
    }

    @Test
    void unavailableEquipmentIsAnError() {
        List<ProgramWeek> weeks = List.of(week(1, false, workout("Legs",
                assignment("barbell-squat", 12, List.of("quadriceps"), "barbell", "squat_rack"))));

        ValidationResult result = validator.validateProgram(weeks, List.of("dumbbells"),
                ExperienceLevel.INTERMEDIATE, null);

        assertThat(result.isValid()).isFalse();
        ValidationIssue issue = result.byCategory(ValidationCategory.EQUIPMENT).get(0);
        assertThat(issue.getSeverity()).isEqualTo(ValidationSeverity.ERROR);
        assertThat(issue.getMessage()).isEqualTo("Exercise 'Barbell Squat' requires unavailable equipment: barbell, rack");
        assertThat(issue.getLocation()).isEqualTo("Week 1, Legs");
        assertThat(result.getSummary()).startsWith("Program invalid: 1 error(s)");
    }

    @Test
    void bodyweightExercisesPassWithAnyEquipment() {
        List<ProgramWeek> weeks = List.of(week(1, false, workout("Home",
                assignment("push-up", 12, List.of("chest")),
                assignment("inverted-row", 12, List.of("lats"), "bodyweight"))));

        ValidationResult result = validator.validateProgram(weeks, List.of(), ExperienceLevel.INTERMEDIATE, null);

        assertThat(result.byCategory(ValidationCategory.EQUIPMENT)).isEmpty();
        assertThat(result.isValid()).isTrue();
    }

    @Test
    void duplicateInsideOneWorkoutIsAnError() {
        List<ProgramWeek> weeks = List.of(week(1, false,
                workout("A", assignment("push-up", 6, List.of("chest")), assignment("push-up", 6, List.of("chest"))),
                workout("B", assignment("push-up", 6, List.of("chest")))));

        ValidationResult result = validator.validateProgram(weeks, List.of(), ExperienceLevel.INTERMEDIATE, null);

        List<ValidationIssue> duplicates = result.byCategory(ValidationCategory.UNIQUENESS);
        assertThat(duplicates).hasSize(1);
        assertThat(duplicates.get(0).getMessage()).isEqualTo("Duplicate exercise 'Push Up' in same workout");
        assertThat(duplicates.get(0).getLocation()).isEqualTo("Week 1, A");
        assertThat(result.isValid()).isFalse();
    }

    @Test
    void lowAndHighWeeklyVolumeAreWarnings() {
        List<ProgramWeek> weeks = List.of(week(1, false, workout("Mixed",
                assignment("fly", 4, List.of("chest")),
                assignment("squat", 20, List.of("quadriceps")),
                assignment("leg-curl", 14, List.of("hamstrings")),
                assignment("row", 12, List.of("lats")))));

        ValidationResult result = validator.validateProgram(weeks, List.of(), ExperienceLevel.INTERMEDIATE, null);

        assertThat(result.isValid()).isTrue();
        assertThat(result.byCategory(ValidationCategory.VOLUME)).extracting(ValidationIssue::getMessage)
                .containsExactlyInAnyOrder(
                        "Low volume for chest: 4 sets (minimum: 12)",
                        "High volume for quadriceps: 20 sets (maximum: 18)");
    }

    @Test
    void deloadWeeksUseHalvedVolumeBounds() {
        ProgramWeek normal = week(1, false, workout("A", assignment("press", 8, List.of("chest"))));
        ProgramWeek deload = week(2, true, workout("A", assignment("press", 8, List.of("chest"))));

        List<ValidationIssue> normalIssues = validator.checkVolume(List.of(normal), ExperienceLevel.INTERMEDIATE);
        List<ValidationIssue> deloadIssues = validator.checkVolume(List.of(deload), ExperienceLevel.INTERMEDIATE);

        assertThat(normalIssues).hasSize(1);
        assertThat(deloadIssues).isEmpty();
    }

    @Test
    void imbalanceIsReportedPerWeek() {
        ProgramWeek balanced = week(1, false, workout("Upper",
                assignment("press", 12, List.of("chest")), assignment("row", 12, List.of("lats"))));
        ProgramWeek lopsided = week(2, false, workout("Upper",
                assignment("press", 12, List.of("chest")), assignment("row", 6, List.of("lats"))));

        List<ValidationIssue> issues = validator.checkBalance(List.of(balanced, lopsided));

        assertThat(issues).hasSize(1);
        assertThat(issues.get(0).getMessage()).isEqualTo("Muscle imbalance detected: 12 push sets vs 6 pull sets");
        assertThat(issues.get(0).getLocation()).isEqualTo("Week 2");
        assertThat(issues.get(0).getSuggestion()).isEqualTo("Consider adding more pull exercises");
    }

    @Test
    void limitationKeywordsFlagTargetedMuscles() {
        List<ProgramWeek> weeks = List.of(week(1, false, workout("Legs",
                assignment("barbell-squat", 12, List.of("quadriceps", "glutes")),
                assignment("calf-raise", 12, List.of("calves")))));

        ValidationResult result = validator.validateProgram(weeks, List.of(), ExperienceLevel.INTERMEDIATE,
                List.of("Bad knee from running"));

        List<ValidationIssue> flagged = result.byCategory(ValidationCategory.LIMITATIONS);
        assertThat(flagged).hasSize(1);
        assertThat(flagged.get(0).getSeverity()).isEqualTo(ValidationSeverity.WARNING);
        assertThat(flagged.get(0).getMessage())
                .isEqualTo("Exercise 'Barbell Squat' may aggravate limitation: targets quadriceps");
    }

    @Test
    void warningsOnlyStillValidate() {
        List<ProgramWeek> weeks = List.of(week(1, false, workout("A", assignment("press", 4, List.of("chest")))));

        ValidationResult result = validator.validateProgram(weeks, List.of(), ExperienceLevel.INTERMEDIATE, null);

        assertThat(result.isValid()).isTrue();
        assertThat(result.getSummary()).isEqualTo("Program valid with 1 warning(s).");
    }

    @Test
    void singleWorkoutValidationSkipsWeeklyChecks() {
        ValidationResult result = validator.validateWorkout(
                workout("Push", assignment("bench", 2, List.of("chest"), "barbell")),
                List.of("dumbbells"), null);

        assertThat(result.isValid()).isFalse();
        assertThat(result.getIssues()).hasSize(1);
        assertThat(result.getSummary()).isEqualTo("Workout invalid: 1 issue(s)");
    }
}
