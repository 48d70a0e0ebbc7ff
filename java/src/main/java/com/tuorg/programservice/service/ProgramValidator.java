package com.tuorg.programservice.service;

import com.tuorg.programservice.model.ExerciseAssignment;
import com.tuorg.programservice.model.ExperienceLevel;
import com.tuorg.programservice.model.ProgramWeek;
import com.tuorg.programservice.model.ProgramWorkout;
import com.tuorg.programservice.model.ValidationCategory;
import com.tuorg.programservice.model.ValidationIssue;
import com.tuorg.programservice.model.ValidationResult;
import com.tuorg.programservice.model.ValidationSeverity;
import com.tuorg.programservice.model.VolumeRange;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Safety and quality checks on a generated program. Equipment and
 * uniqueness problems are errors; volume, balance and limitation findings
 * are warnings.
 */
@Service
public class ProgramValidator {

    static final double MAX_BALANCE_RATIO = 1.5;

    private static final List<String> MAJOR_MUSCLES =
            List.of("chest", "lats", "quadriceps", "hamstrings", "glutes", "anterior_deltoid");

    private static final List<BalancePair> BALANCE_PAIRS = List.of(
            new BalancePair("push", Set.of("chest", "anterior_deltoid"),
                    "pull", Set.of("lats", "rhomboids", "rear_deltoid")),
            new BalancePair("quadriceps", Set.of("quadriceps"),
                    "hamstring/glute", Set.of("hamstrings", "glutes")),
            new BalancePair("biceps", Set.of("biceps"),
                    "triceps", Set.of("triceps"))
    );

    private static final Map<String, Set<String>> LIMITATION_MUSCLES = new LinkedHashMap<>();

    static {
        LIMITATION_MUSCLES.put("shoulder", Set.of("anterior_deltoid", "rear_deltoid", "lateral_deltoid"));
        LIMITATION_MUSCLES.put("back", Set.of("lats", "rhomboids", "erector_spinae", "lower_back"));
        LIMITATION_MUSCLES.put("knee", Set.of("quadriceps", "hamstrings"));
        LIMITATION_MUSCLES.put("hip", Set.of("hip_flexors", "glutes", "adductors"));
        LIMITATION_MUSCLES.put("wrist", Set.of("forearms"));
        LIMITATION_MUSCLES.put("elbow", Set.of("biceps", "triceps", "forearms"));
        LIMITATION_MUSCLES.put("ankle", Set.of("calves", "tibialis"));
    }

    private final EquipmentNormalizer equipmentNormalizer;
    private final PeriodizationService periodizationService;

    public ProgramValidator(EquipmentNormalizer equipmentNormalizer, PeriodizationService periodizationService) {
        this.equipmentNormalizer = equipmentNormalizer;
        this.periodizationService = periodizationService;
    }

    public ValidationResult validateProgram(List<ProgramWeek> weeks, List<String> availableEquipment,
                                            ExperienceLevel experience, List<String> limitations) {
        List<ValidationIssue> issues = new ArrayList<>();
        issues.addAll(checkEquipment(weeks, availableEquipment));
        issues.addAll(checkUniqueness(weeks));
        issues.addAll(checkVolume(weeks, experience));
        issues.addAll(checkBalance(weeks));
        if (limitations != null && !limitations.isEmpty()) {
            issues.addAll(checkLimitations(weeks, limitations));
        }
        return new ValidationResult(issues, summarize(issues));
    }

    /** Equipment, uniqueness and limitations for one workout. */
    public ValidationResult validateWorkout(ProgramWorkout workout, List<String> availableEquipment,
                                            List<String> limitations) {
        ProgramWeek wrapper = new ProgramWeek();
        wrapper.setWeekNumber(1);
        wrapper.setWorkouts(new ArrayList<>(List.of(workout)));
        List<ProgramWeek> weeks = List.of(wrapper);

        List<ValidationIssue> issues = new ArrayList<>();
        issues.addAll(checkEquipment(weeks, availableEquipment));
        issues.addAll(checkUniqueness(weeks));
        if (limitations != null && !limitations.isEmpty()) {
            issues.addAll(checkLimitations(weeks, limitations));
        }
        boolean valid = issues.stream().noneMatch(i -> i.getSeverity() == ValidationSeverity.ERROR);
        return new ValidationResult(issues,
                "Workout " + (valid ? "valid" : "invalid") + ": " + issues.size() + " issue(s)");
    }

    List<ValidationIssue> checkEquipment(List<ProgramWeek> weeks, List<String> availableEquipment) {
        Set<String> available = equipmentNormalizer.normalize(availableEquipment);
        List<ValidationIssue> issues = new ArrayList<>();
        for (ProgramWeek week : weeks) {
            for (ProgramWorkout workout : week.getWorkouts()) {
                for (ExerciseAssignment a : workout.getExercises()) {
                    Set<String> missing = equipmentNormalizer.missing(a.getEquipment(), available);
                    if (missing.isEmpty()) continue;
                    Set<String> usable = equipmentNormalizer.required(a.getEquipment());
                    usable.retainAll(available);
                    issues.add(new ValidationIssue(ValidationSeverity.ERROR, ValidationCategory.EQUIPMENT,
                            "Exercise '" + a.getExerciseName() + "' requires unavailable equipment: "
                                    + String.join(", ", missing),
                            location(week, workout),
                            "Replace with an exercise using: "
                                    + (usable.isEmpty() ? "bodyweight" : String.join(", ", usable))));
                }
            }
        }
        return issues;
    }

    List<ValidationIssue> checkUniqueness(List<ProgramWeek> weeks) {
        List<ValidationIssue> issues = new ArrayList<>();
        for (ProgramWeek week : weeks) {
            for (ProgramWorkout workout : week.getWorkouts()) {
                Set<String> seen = new HashSet<>();
                for (ExerciseAssignment a : workout.getExercises()) {
                    if (a.getExerciseId() == null || seen.add(a.getExerciseId())) continue;
                    issues.add(new ValidationIssue(ValidationSeverity.ERROR, ValidationCategory.UNIQUENESS,
                            "Duplicate exercise '" + a.getExerciseName() + "' in same workout",
                            location(week, workout),
                            "Replace duplicate with a variation or different exercise"));
                }
            }
        }
        return issues;
    }

    List<ValidationIssue> checkVolume(List<ProgramWeek> weeks, ExperienceLevel experience) {
        VolumeRange limits = periodizationService.getVolumeLimits(experience);
        List<ValidationIssue> issues = new ArrayList<>();
        for (ProgramWeek week : weeks) {
            Map<String, Integer> sets = weeklySets(week);
            VolumeRange bounds = week.isDeload() ? limits.halved() : limits;
            for (String muscle : MAJOR_MUSCLES) {
                int count = sets.getOrDefault(muscle, 0);
                String location = "Week " + week.getWeekNumber();
                if (count > 0 && count < bounds.getMin()) {
                    issues.add(new ValidationIssue(ValidationSeverity.WARNING, ValidationCategory.VOLUME,
                            "Low volume for " + muscle + ": " + count + " sets (minimum: " + bounds.getMin() + ")",
                            location, "Consider adding more " + muscle + " exercises"));
                } else if (count > bounds.getMax()) {
                    issues.add(new ValidationIssue(ValidationSeverity.WARNING, ValidationCategory.VOLUME,
                            "High volume for " + muscle + ": " + count + " sets (maximum: " + bounds.getMax() + ")",
                            location, "Consider reducing " + muscle + " volume to prevent overtraining"));
                }
            }
        }
        return issues;
    }

    List<ValidationIssue> checkBalance(List<ProgramWeek> weeks) {
        List<ValidationIssue> issues = new ArrayList<>();
        for (ProgramWeek week : weeks) {
            Map<String, Integer> sets = weeklySets(week);
            for (BalancePair pair : BALANCE_PAIRS) {
                int first = total(sets, pair.firstMuscles);
                int second = total(sets, pair.secondMuscles);
                if (first == 0 || second == 0) continue;
                double ratio = Math.max(first, second) / (double) Math.min(first, second);
                if (ratio <= MAX_BALANCE_RATIO) continue;
                String weaker = first > second ? pair.secondLabel : pair.firstLabel;
                issues.add(new ValidationIssue(ValidationSeverity.WARNING, ValidationCategory.BALANCE,
                        "Muscle imbalance detected: " + first + " " + pair.firstLabel + " sets vs "
                                + second + " " + pair.secondLabel + " sets",
                        "Week " + week.getWeekNumber(),
                        "Consider adding more " + weaker + " exercises"));
            }
        }
        return issues;
    }

    List<ValidationIssue> checkLimitations(List<ProgramWeek> weeks, List<String> limitations) {
        Set<String> avoid = new HashSet<>();
        for (String limitation : limitations) {
            if (limitation == null) continue;
            String text = limitation.toLowerCase(Locale.ROOT);
            LIMITATION_MUSCLES.forEach((keyword, muscles) -> {
                if (text.contains(keyword)) avoid.addAll(muscles);
            });
        }
        List<ValidationIssue> issues = new ArrayList<>();
        if (avoid.isEmpty()) return issues;

        for (ProgramWeek week : weeks) {
            for (ProgramWorkout workout : week.getWorkouts()) {
                for (ExerciseAssignment a : workout.getExercises()) {
                    Set<String> affected = new TreeSet<>(a.getPrimaryMuscles());
                    affected.retainAll(avoid);
                    if (affected.isEmpty()) continue;
                    issues.add(new ValidationIssue(ValidationSeverity.WARNING, ValidationCategory.LIMITATIONS,
                            "Exercise '" + a.getExerciseName() + "' may aggravate limitation: targets "
                                    + String.join(", ", affected),
                            location(week, workout),
                            "Consider replacing with a safer alternative"));
                }
            }
        }
        return issues;
    }

    static String summarize(List<ValidationIssue> issues) {
        long errors = issues.stream().filter(i -> i.getSeverity() == ValidationSeverity.ERROR).count();
        long warnings = issues.stream().filter(i -> i.getSeverity() == ValidationSeverity.WARNING).count();
        if (errors == 0 && warnings == 0) return "Program validated successfully with no issues.";
        if (errors == 0) return "Program valid with " + warnings + " warning(s).";
        return "Program invalid: " + errors + " error(s), " + warnings + " warning(s).";
    }

    private static Map<String, Integer> weeklySets(ProgramWeek week) {
        Map<String, Integer> sets = new HashMap<>();
        for (ProgramWorkout workout : week.getWorkouts()) {
            for (ExerciseAssignment a : workout.getExercises()) {
                for (String muscle : new LinkedHashSet<>(a.getPrimaryMuscles())) {
                    sets.merge(muscle, a.getSets(), Integer::sum);
                }
            }
        }
        return sets;
    }

    private static int total(Map<String, Integer> sets, Set<String> muscles) {
        int sum = 0;
        for (String m : muscles) sum += sets.getOrDefault(m, 0);
        return sum;
    }

    private static String location(ProgramWeek week, ProgramWorkout workout) {
        return "Week " + week.getWeekNumber() + ", " + (workout.getName() == null ? "Unknown" : workout.getName());
    }

    private static final class BalancePair {
        final String firstLabel;
        final Set<String> firstMuscles;
        final String secondLabel;
        final Set<String> secondMuscles;

        BalancePair(String firstLabel, Set<String> firstMuscles, String secondLabel, Set<String> secondMuscles) {
            this.firstLabel = firstLabel;
            this.firstMuscles = firstMuscles;
            this.secondLabel = secondLabel;
            this.secondMuscles = secondMuscles;
        }
    }
}
