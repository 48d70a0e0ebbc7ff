package com.tuorg.programservice.service;

import com.tuorg.programservice.config.GenerationProperties;
import com.tuorg.programservice.model.Exercise;
import com.tuorg.programservice.model.SlotRequirements;
import com.tuorg.programservice.repository.ExerciseRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Fills exercise slots from the catalog under equipment and movement
 * constraints, synthesizing a placeholder when nothing qualifies.
 */
@Service
public class ExerciseSelector {

    private final Logger log = LoggerFactory.getLogger(ExerciseSelector.class);

    private final ExerciseRepository exerciseRepository;
    private final EquipmentNormalizer equipmentNormalizer;
    private final GenerationProperties.ExerciseScoring weights;
    private final int searchLimit;
    // used by callers that do not pass their own run-scoped generator
    private final PlaceholderIdGenerator sharedIds = new PlaceholderIdGenerator();

    public ExerciseSelector(ExerciseRepository exerciseRepository, EquipmentNormalizer equipmentNormalizer,
                            GenerationProperties properties) {
        this.exerciseRepository = exerciseRepository;
        this.equipmentNormalizer = equipmentNormalizer;
        this.weights = properties.getExerciseScoring();
        this.searchLimit = properties.getExerciseSearchLimit();
    }

    public Optional<Exercise> fillExerciseSlot(SlotRequirements requirements, List<String> availableEquipment,
                                               Collection<String> excludeIds) {
        synchronized (sharedIds) {
            return fillExerciseSlot(requirements, availableEquipment, excludeIds, sharedIds);
        }
    }

    /**
     * Best qualifying exercise, or a placeholder. Empty only when the
     * requirements name neither a movement pattern nor target muscles and
     * nothing qualifies.
     */
    public Optional<Exercise> fillExerciseSlot(SlotRequirements requirements, List<String> availableEquipment,
                                               Collection<String> excludeIds, PlaceholderIdGenerator ids) {
        Set<String> exclude = excludeIds == null ? Set.of() : new HashSet<>(excludeIds);
        Set<String> available = equipmentNormalizer.normalize(availableEquipment);

        List<Exercise> candidates;
        try {
            candidates = exerciseRepository.search(
                    requirements.getTargetMuscles(),
                    available.isEmpty() ? null : new ArrayList<>(available),
                    requirements.getMovementPattern(),
                    requirements.getCategory(),
                    requirements.getSupports1rm(),
                    searchLimit);
        } catch (RuntimeException e) {
            log.warn("Exercise search failed, treating as no candidates: {}", e.getMessage());
            candidates = List.of();
        }

        Exercise best = null;
        double bestScore = Double.NEGATIVE_INFINITY;
        for (Exercise ex : candidates) {
            if (exclude.contains(ex.getId())) continue;
            if (!equipmentNormalizer.isSatisfiedBy(ex.getEquipment(), available)) continue;
            double score = score(ex, requirements);
            if (score > bestScore) {
                best = ex;
                bestScore = score;
            }
        }
        if (best != null) return Optional.of(best);
        return createPlaceholder(requirements, ids);
    }

    /** Similar exercises the user can perform with their equipment, source excluded. */
    public List<Exercise> getAlternatives(String exerciseId, List<String> availableEquipment, int limit) {
        if (limit <= 0) return List.of();
        Set<String> available = equipmentNormalizer.normalize(availableEquipment);
        List<Exercise> similar;
        try {
            similar = exerciseRepository.getSimilarExercises(exerciseId, limit * 2);
        } catch (RuntimeException e) {
            log.warn("Similar-exercise lookup failed for {}: {}", exerciseId, e.getMessage());
            return List.of();
        }
        List<Exercise> out = new ArrayList<>();
        for (Exercise ex : similar) {
            if (out.size() >= limit) break;
            if (exerciseId.equals(ex.getId())) continue;
            if (equipmentNormalizer.isSatisfiedBy(ex.getEquipment(), available)) out.add(ex);
        }
        return out;
    }

    double score(Exercise ex, SlotRequirements req) {
        double score = 0.0;
        List<String> target = req.getTargetMuscles();
        if (!target.isEmpty()) {
            Set<String> targetSet = new HashSet<>(target);
            long overlap = ex.getPrimaryMuscles().stream().distinct().filter(targetSet::contains).count();
            score += Math.min(overlap / (double) targetSet.size(), 1.0) * weights.getMuscleOverlap();
        }
        if (req.getCategory() != null && req.getCategory().equals(ex.getCategory())) {
            score += weights.getCategoryMatch();
        }
        if (req.hasMovementPattern() && req.getMovementPattern().equals(ex.getMovementPattern())) {
            score += weights.getMovementPatternMatch();
        }
        if (!req.getPreferredEquipment().isEmpty()) {
            Set<String> preferred = equipmentNormalizer.normalize(req.getPreferredEquipment());
            for (String item : equipmentNormalizer.required(ex.getEquipment())) {
                if (preferred.contains(item)) {
                    score += weights.getPreferredEquipment();
                    break;
                }
            }
        }
        if (req.getSupports1rm() != null && req.getSupports1rm() == ex.isSupports1rm()) {
            score += weights.getOneRepMaxMatch();
        }
        if (ex.isCompound()) score += weights.getCompoundBonus();
        return score;
    }

    private Optional<Exercise> createPlaceholder(SlotRequirements req, PlaceholderIdGenerator ids) {
        if (!req.hasMovementPattern() && !req.hasTargetMuscles()) return Optional.empty();

        List<String> parts = new ArrayList<>();
        if (req.hasMovementPattern()) parts.add(titleCase(req.getMovementPattern()));
        if (req.hasTargetMuscles()) parts.add(titleCase(req.getTargetMuscles().get(0)));
        parts.add("Exercise");
        String name = String.join(" ", parts);

        Exercise placeholder = new Exercise(ids.next(name), name, req.getTargetMuscles(), List.of(),
                req.getCategory() == null ? Exercise.COMPOUND : req.getCategory(),
                req.getMovementPattern(), Boolean.TRUE.equals(req.getSupports1rm()));
        placeholder.setPlaceholder(true);
        log.debug("No catalog match, using placeholder {}", placeholder.getId());
        return Optional.of(placeholder);
    }

    private static String titleCase(String raw) {
        StringBuilder sb = new StringBuilder();
        for (String word : raw.trim().split("[_\\s]+")) {
            if (word.isEmpty()) continue;
            if (sb.length() > 0) sb.append(' ');
            sb.append(word.substring(0, 1).toUpperCase(Locale.ROOT)).append(word.substring(1).toLowerCase(Locale.ROOT));
        }
        return sb.toString();
    }
}
