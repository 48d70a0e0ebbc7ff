package com.tuorg.programservice.service;

import com.tuorg.programservice.config.GenerationProperties;
import com.tuorg.programservice.model.ExperienceLevel;
import com.tuorg.programservice.model.ProgramGoal;
import com.tuorg.programservice.model.ProgramStructure;
import com.tuorg.programservice.model.ProgramTemplate;
import com.tuorg.programservice.model.WeekBlueprint;
import com.tuorg.programservice.model.WorkoutBlueprint;
import com.tuorg.programservice.repository.TemplateRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Picks the stored template that best fits a request, or synthesizes a
 * default split when none qualifies.
 */
@Service
public class TemplateSelector {

    private final Logger log = LoggerFactory.getLogger(TemplateSelector.class);
    private final TemplateRepository templateRepository;
    private final GenerationProperties.TemplateScoring scoring;

    public TemplateSelector(TemplateRepository templateRepository, GenerationProperties properties) {
        this.templateRepository = templateRepository;
        this.scoring = properties.getTemplateScoring();
    }

    /**
     * Highest scoring candidate; the first one seen wins a tie. Empty when the
     * repository has no candidates or cannot be reached.
     */
    public Optional<TemplateMatch> selectBestTemplate(ProgramGoal goal, ExperienceLevel experience,
                                                      int sessionsPerWeek, int durationWeeks) {
        List<ProgramTemplate> candidates;
        try {
            candidates = templateRepository.getByCriteria(goal, experience, durationWeeks);
        } catch (RuntimeException e) {
            log.warn("Template lookup failed for goal={}, experience={}: {}",
                    goal.getValue(), experience.getValue(), e.getMessage());
            return Optional.empty();
        }
        if (candidates == null || candidates.isEmpty()) {
            log.info("No templates found for goal={}, experience={}", goal.getValue(), experience.getValue());
            return Optional.empty();
        }

        TemplateMatch best = null;
        for (ProgramTemplate t : candidates) {
            TemplateMatch match = score(t, sessionsPerWeek, durationWeeks);
            if (best == null || match.getScore() > best.getScore()) best = match;
        }
        log.info("Selected template '{}' with score {}: {}", best.getTemplate().getName(),
                String.format("%.1f", best.getScore()), String.join(", ", best.getMatchReasons()));
        return Optional.of(best);
    }

    TemplateMatch score(ProgramTemplate template, int sessionsPerWeek, int durationWeeks) {
        List<String> reasons = new ArrayList<>();
        double score = scoring.getBase();
        reasons.add("Goal and experience match");

        int templateSessions = template.getStructure() == null ? 3 : template.getStructure().sessionsPerWeek();
        if (templateSessions == sessionsPerWeek) {
            score += scoring.getSessionsExact();
            reasons.add("Exact sessions match (" + sessionsPerWeek + "/week)");
        } else if (Math.abs(templateSessions - sessionsPerWeek) <= scoring.getSessionsTolerance()) {
            score += scoring.getSessionsClose();
            reasons.add("Close sessions match (" + templateSessions + " vs " + sessionsPerWeek + ")");
        }

        int templateDuration = template.getDurationWeeks();
        if (templateDuration == durationWeeks) {
            score += scoring.getDurationExact();
            reasons.add("Exact duration match (" + durationWeeks + " weeks)");
        } else if (Math.abs(templateDuration - durationWeeks) <= scoring.getDurationTolerance()) {
            score += scoring.getDurationClose();
            reasons.add("Close duration (" + templateDuration + " vs " + durationWeeks + " weeks)");
        }

        int usage = Math.max(0, template.getUsageCount());
        double popularity = Math.min(usage / (double) scoring.getPopularityCap(), 1.0);
        score += popularity * scoring.getPopularityMax();
        if (usage > 0) reasons.add("Used " + usage + " times");

        return new TemplateMatch(template, score, reasons);
    }

    /** Best-effort popularity bump. Never throws. */
    public void recordUsage(String templateId) {
        if (templateId == null) return;
        try {
            templateRepository.incrementUsageCount(templateId);
        } catch (RuntimeException e) {
            log.warn("Could not increment usage count for template {}: {}", templateId, e.getMessage());
        }
    }

    /**
     * Split keyed by sessions per week. Counts below three take the first
     * workouts of the full body split.
     */
    public ProgramStructure getDefaultStructure(ProgramGoal goal, ExperienceLevel experience,
                                                int sessionsPerWeek, int durationWeeks) {
        String splitType;
        List<WorkoutBlueprint> workouts;
        switch (sessionsPerWeek) {
            case 3:
                if (goal.isStrengthType()) {
                    splitType = "push_pull_legs";
                    workouts = pushPullLegs();
                } else {
                    splitType = "full_body";
                    workouts = fullBody();
                }
                break;
            case 4:
                splitType = "upper_lower";
                workouts = upperLower();
                break;
            case 5:
                splitType = "ppl_upper_lower";
                workouts = pplUpperLower();
                break;
            case 6:
                splitType = "ppl_twice";
                workouts = pplTwice();
                break;
            case 7:
                splitType = "ppl_twice_plus";
                workouts = pplTwice();
                workouts.add(new WorkoutBlueprint(7, "Arms & Core", "arms",
                        List.of("biceps", "triceps", "forearms", "core"), 6, 45));
                break;
            default:
                splitType = "full_body";
                workouts = fullBody();
                if (sessionsPerWeek >= 1 && sessionsPerWeek < workouts.size()) {
                    workouts = new ArrayList<>(workouts.subList(0, sessionsPerWeek));
                }
        }

        ProgramStructure structure = new ProgramStructure();
        structure.setSplitType(splitType);
        structure.setMesocycleLength(Math.min(4, durationWeeks));
        structure.setDeloadFrequency(4);
        structure.setWeeks(new ArrayList<>(List.of(new WeekBlueprint(1, focusForGoal(goal), workouts))));
        log.debug("Default structure {} for {} sessions ({} level)", splitType, sessionsPerWeek, experience.getValue());
        return structure;
    }

    static String focusForGoal(ProgramGoal goal) {
        if (goal == null) return "General Training";
        switch (goal) {
            case STRENGTH: return "Strength Development";
            case HYPERTROPHY: return "Muscle Building";
            case ENDURANCE: return "Muscular Endurance";
            case WEIGHT_LOSS: return "Fat Loss & Conditioning";
            case GENERAL_FITNESS: return "General Fitness";
            case SPORT_SPECIFIC: return "Sport Performance";
            default: return "General Training";
        }
    }

    private static List<WorkoutBlueprint> fullBody() {
        List<WorkoutBlueprint> w = new ArrayList<>();
        w.add(new WorkoutBlueprint(1, "Full Body A", "full_body",
                List.of("chest", "lats", "quadriceps", "hamstrings", "anterior_deltoid", "biceps", "triceps"), 6, 60));
        w.add(new WorkoutBlueprint(3, "Full Body B", "full_body",
                List.of("chest", "rhomboids", "glutes", "quadriceps", "rear_deltoid", "biceps", "triceps"), 6, 60));
        w.add(new WorkoutBlueprint(5, "Full Body C", "full_body",
                List.of("chest", "lats", "hamstrings", "calves", "anterior_deltoid", "core"), 6, 60));
        return w;
    }

    private static List<WorkoutBlueprint> pushPullLegs() {
        List<WorkoutBlueprint> w = new ArrayList<>();
        w.add(push(1, "Push Day"));
        w.add(pull(3, "Pull Day"));
        w.add(legs(5, "Legs Day"));
        return w;
    }

    private static List<WorkoutBlueprint> upperLower() {
        List<WorkoutBlueprint> w = new ArrayList<>();
        w.add(new WorkoutBlueprint(1, "Upper Body A", "upper", upperA(), 6, 60));
        w.add(lower(2, "Lower Body A"));
        w.add(new WorkoutBlueprint(4, "Upper Body B", "upper",
                List.of("chest", "rhomboids", "rear_deltoid", "triceps", "biceps"), 6, 60));
        w.add(lower(5, "Lower Body B"));
        return w;
    }

    private static List<WorkoutBlueprint> pplUpperLower() {
        List<WorkoutBlueprint> w = new ArrayList<>();
        w.add(push(1, "Push Day"));
        w.add(pull(2, "Pull Day"));
        w.add(legs(3, "Legs Day"));
        w.add(new WorkoutBlueprint(5, "Upper Body", "upper", upperA(), 6, 60));
        w.add(lower(6, "Lower Body"));
        return w;
    }

    private static List<WorkoutBlueprint> pplTwice() {
        List<WorkoutBlueprint> w = new ArrayList<>();
        w.add(push(1, "Push Day A"));
        w.add(pull(2, "Pull Day A"));
        w.add(legs(3, "Legs Day A"));
        w.add(push(4, "Push Day B"));
        w.add(pull(5, "Pull Day B"));
        w.add(legs(6, "Legs Day B"));
        return w;
    }

    private static List<String> upperA() {
        return List.of("chest", "lats", "anterior_deltoid", "triceps", "biceps");
    }

    private static WorkoutBlueprint push(int day, String name) {
        return new WorkoutBlueprint(day, name, "push", List.of("chest", "anterior_deltoid", "triceps"), 5, 60);
    }

    private static WorkoutBlueprint pull(int day, String name) {
        return new WorkoutBlueprint(day, name, "pull", List.of("lats", "rhomboids", "rear_deltoid", "biceps"), 5, 60);
    }

    private static WorkoutBlueprint legs(int day, String name) {
        return new WorkoutBlueprint(day, name, "legs", List.of("quadriceps", "hamstrings", "glutes", "calves"), 5, 60);
    }

    private static WorkoutBlueprint lower(int day, String name) {
        return new WorkoutBlueprint(day, name, "lower", List.of("quadriceps", "hamstrings", "glutes", "calves"), 5, 60);
    }
}
