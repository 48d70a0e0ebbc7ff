package com.tuorg.programservice.repository.memory;

import com.tuorg.programservice.model.Exercise;
import com.tuorg.programservice.repository.ExerciseRepository;
import com.tuorg.programservice.service.EquipmentNormalizer;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/** Read-only exercise lookups over the classpath catalog. */
@Repository
public class CatalogExerciseRepository implements ExerciseRepository {

    private static final Map<String, List<String>> WORKOUT_TYPE_MUSCLES = Map.of(
            "push", List.of("chest", "anterior_deltoid", "triceps"),
            "pull", List.of("lats", "rhomboids", "biceps", "rear_deltoid"),
            "legs", List.of("quadriceps", "hamstrings", "glutes", "calves"),
            "lower", List.of("quadriceps", "hamstrings", "glutes", "calves"),
            "upper", List.of("chest", "lats", "anterior_deltoid", "rear_deltoid", "triceps", "biceps"),
            "full_body", List.of("chest", "lats", "quadriceps", "hamstrings", "glutes", "anterior_deltoid"),
            "arms", List.of("biceps", "triceps", "forearms", "core")
    );

    private final ExerciseCatalogCache catalog;
    private final EquipmentNormalizer equipmentNormalizer;

    public CatalogExerciseRepository(ExerciseCatalogCache catalog, EquipmentNormalizer equipmentNormalizer) {
        this.catalog = catalog;
        this.equipmentNormalizer = equipmentNormalizer;
    }

    @Override
    public Optional<Exercise> getById(String exerciseId) {
        if (exerciseId == null) return Optional.empty();
        return catalog.get().stream().filter(e -> exerciseId.equals(e.getId())).findFirst();
    }

    @Override
    public List<Exercise> search(List<String> muscleGroups, List<String> equipment, String movementPattern,
                                 String category, Boolean supports1rm, int limit) {
        Set<String> muscles = muscleGroups == null ? Set.of() : new HashSet<>(muscleGroups);
        Set<String> available = equipmentNormalizer.normalize(equipment);

        List<Exercise> out = new ArrayList<>();
        for (Exercise ex : catalog.get()) {
            if (out.size() >= limit) break;
            if (!muscles.isEmpty() && !overlaps(ex.getPrimaryMuscles(), muscles)) continue;
            if (!available.isEmpty()) {
                Set<String> needs = equipmentNormalizer.required(ex.getEquipment());
                if (!needs.isEmpty() && !overlaps(needs, available)) continue;
            }
            if (movementPattern != null && !movementPattern.isBlank()
                    && !movementPattern.equals(ex.getMovementPattern())) continue;
            if (category != null && !category.isBlank() && !category.equals(ex.getCategory())) continue;
            if (supports1rm != null && supports1rm != ex.isSupports1rm()) continue;
            out.add(ex);
        }
        return out;
    }

    @Override
    public List<Exercise> getForWorkoutType(String workoutType, List<String> equipment, int limit) {
        String key = workoutType == null ? "full_body" : workoutType.trim().toLowerCase(Locale.ROOT);
        Set<String> muscles = new HashSet<>(WORKOUT_TYPE_MUSCLES.getOrDefault(key, WORKOUT_TYPE_MUSCLES.get("full_body")));
        boolean anyEquipment = equipment == null || equipment.isEmpty();

        List<Exercise> out = new ArrayList<>();
        for (Exercise ex : catalog.get()) {
            if (out.size() >= limit) break;
            if (!overlaps(ex.getPrimaryMuscles(), muscles)) continue;
            if (!anyEquipment && !equipmentNormalizer.isSatisfiedBy(ex.getEquipment(), equipment)) continue;
            out.add(ex);
        }
        return out;
    }

    @Override
    public List<Exercise> getSimilarExercises(String exerciseId, int limit) {
        Exercise source = getById(exerciseId).orElse(null);
        if (source == null || source.getMovementPattern() == null || source.getPrimaryMuscles().isEmpty()) {
            return List.of();
        }
        Set<String> sourceMuscles = new HashSet<>(source.getPrimaryMuscles());
        Set<String> sourceEquipment = new HashSet<>(source.getEquipment());

        List<Exercise> candidates = new ArrayList<>();
        for (Exercise ex : catalog.get()) {
            if (Objects.equals(ex.getId(), exerciseId)) continue;
            if (!source.getMovementPattern().equals(ex.getMovementPattern())) continue;
            candidates.add(ex);
        }
        // List.sort is stable, so equal scores keep catalog order.
        candidates.sort(Comparator.comparingDouble(
                (Exercise ex) -> similarity(ex, sourceMuscles, source.getCategory(), sourceEquipment)).reversed());
        return candidates.size() > limit ? new ArrayList<>(candidates.subList(0, limit)) : candidates;
    }

    private static double similarity(Exercise ex, Set<String> sourceMuscles, String sourceCategory,
                                     Set<String> sourceEquipment) {
        double score = 0.0;
        score += intersection(ex.getPrimaryMuscles(), sourceMuscles) / (double) sourceMuscles.size() * 0.6;
        if (Objects.equals(ex.getCategory(), sourceCategory)) score += 0.3;
        if (!ex.getEquipment().isEmpty() && !sourceEquipment.isEmpty()) {
            score += intersection(ex.getEquipment(), sourceEquipment) / (double) sourceEquipment.size() * 0.1;
        }
        return score;
    }

    private static boolean overlaps(Iterable<String> values, Set<String> set) {
        for (String v : values) {
            if (set.contains(v)) return true;
        }
        return false;
    }

    private static int intersection(List<String> values, Set<String> set) {
        int n = 0;
        for (String v : new HashSet<>(values)) {
            if (set.contains(v)) n++;
        }
        return n;
    }
}
