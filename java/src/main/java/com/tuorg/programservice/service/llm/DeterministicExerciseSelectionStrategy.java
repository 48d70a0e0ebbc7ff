package com.tuorg.programservice.service.llm;

import com.tuorg.programservice.model.Exercise;
import com.tuorg.programservice.model.ProgramGoal;
import com.tuorg.programservice.model.SlotRequirements;
import com.tuorg.programservice.service.ExerciseSelector;
import com.tuorg.programservice.service.TrainingPrescriptionService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Rule-based selection. Never fails: explicit slots first, then one compound
 * per movement pattern of the workout type, then isolation fill, then the
 * remaining candidates compound-first by name.
 */
@Component("deterministicExerciseSelection")
public class DeterministicExerciseSelectionStrategy implements ExerciseSelectionStrategy {

    private final Logger log = LoggerFactory.getLogger(DeterministicExerciseSelectionStrategy.class);

    private static final Map<String, List<String>> WORKOUT_PATTERNS = Map.of(
            "push", List.of("push"),
            "pull", List.of("pull"),
            "legs", List.of("squat", "hinge"),
            "lower", List.of("squat", "hinge"),
            "upper", List.of("push", "pull"),
            "full_body", List.of("push", "pull", "squat", "hinge")
    );

    private static final Comparator<Exercise> COMPOUND_FIRST = Comparator
            .comparingInt((Exercise e) -> e.isCompound() ? 0 : 1)
            .thenComparing(e -> e.getName() == null ? "" : e.getName());

    private final ExerciseSelector exerciseSelector;
    private final TrainingPrescriptionService prescription;

    public DeterministicExerciseSelectionStrategy(ExerciseSelector exerciseSelector,
                                                  TrainingPrescriptionService prescription) {
        this.exerciseSelector = exerciseSelector;
        this.prescription = prescription;
    }

    @Override
    public ExerciseSelectionResponse selectExercises(ExerciseSelectionRequest request) {
        int count = Math.max(0, request.getExerciseCount());
        ProgramGoal goal = request.getGoal();
        boolean preferCompound = goal == ProgramGoal.STRENGTH
                || goal == ProgramGoal.HYPERTROPHY
                || goal == ProgramGoal.GENERAL_FITNESS;

        List<Exercise> selected = new ArrayList<>();
        Set<String> used = new HashSet<>();
        List<String> equipment = request.getEquipment();

        for (SlotRequirements slot : request.getSlots()) {
            if (selected.size() >= count) break;
            take(exerciseSelector.fillExerciseSlot(slot, equipment, used, request.getPlaceholderIds()), selected, used);
        }

        List<String> patterns = WORKOUT_PATTERNS.getOrDefault(request.getWorkoutType(), List.of());
        int compoundCount = preferCompound ? Math.max(2, count / 2) : 1;
        for (String pattern : patterns.subList(0, Math.min(compoundCount, patterns.size()))) {
            if (selected.size() >= count) break;
            SlotRequirements req = new SlotRequirements(pattern, request.getMuscleGroups(),
                    preferCompound ? Exercise.COMPOUND : null,
                    goal == ProgramGoal.STRENGTH ? Boolean.TRUE : null);
            take(exerciseSelector.fillExerciseSlot(req, equipment, used, request.getPlaceholderIds()), selected, used);
        }

        while (selected.size() < count) {
            SlotRequirements req = new SlotRequirements(null, request.getMuscleGroups(),
                    preferCompound ? Exercise.ISOLATION : null, null);
            if (!take(exerciseSelector.fillExerciseSlot(req, equipment, used, request.getPlaceholderIds()), selected, used)) {
                break;
            }
        }

        if (selected.size() < count) {
            List<Exercise> remaining = new ArrayList<>();
            for (Exercise ex : request.getAvailableExercises()) {
                if (!used.contains(ex.getId())) remaining.add(ex);
            }
            remaining.sort(COMPOUND_FIRST);
            for (Exercise ex : remaining) {
                if (selected.size() >= count) break;
                take(Optional.of(ex), selected, used);
            }
        }

        if (selected.size() < count) {
            log.warn("Only {} of {} exercises found for {} workout", selected.size(), count, request.getWorkoutType());
        }

        int sets = prescription.recommendedSets(goal, request.isDeload());
        String reps = prescription.recommendedReps(goal);
        int rest = prescription.recommendedRestSeconds(goal);

        ExerciseSelectionResponse response = new ExerciseSelectionResponse();
        List<ExerciseSelectionResponse.SelectedExercise> out = new ArrayList<>();
        for (int i = 0; i < selected.size(); i++) {
            out.add(ExerciseSelectionResponse.SelectedExercise.of(selected.get(i), i + 1, sets, reps, rest));
        }
        response.setExercises(out);
        return response;
    }

    private static boolean take(Optional<Exercise> candidate, List<Exercise> selected, Set<String> used) {
        if (candidate.isEmpty() || used.contains(candidate.get().getId())) return false;
        selected.add(candidate.get());
        used.add(candidate.get().getId());
        return true;
    }
}
