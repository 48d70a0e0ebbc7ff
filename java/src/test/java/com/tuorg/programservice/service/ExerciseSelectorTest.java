package com.tuorg.programservice.service;

import com.tuorg.programservice.config.GenerationProperties;
import com.tuorg.programservice.model.Exercise;
import com.tuorg.programservice.model.SlotRequirements;
import com.tuorg.programservice.repository.ExerciseRepository;
import com.tuorg.programservice.repository.memory.CatalogExerciseRepository;
import com.tuorg.programservice.repository.memory.ExerciseCatalogCache;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;
import java.util.Set;

import static com.tuorg.programservice.support.GenerationFixtures.exercise;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class ExerciseSelectorTest {

    private static final List<Exercise> CATALOG = List.of(
            exercise("bench-press", "push", "compound", List.of("chest"), List.of("barbell", "bench"), true),
            exercise("dumbbell-press", "push", "compound", List.of("chest", "anterior_deltoid"), List.of("dumbbells", "bench")),
            exercise("push-up", "push", "compound", List.of("chest"), List.of()),
            exercise("cable-fly", "push", "isolation", List.of("chest"), List.of("cables")),
            exercise("barbell-row", "pull", "compound", List.of("lats", "rhomboids"), List.of("barbell"), true),
            exercise("pull-up", "pull", "compound", List.of("lats"), List.of("pull_up_bar")));

    private final EquipmentNormalizer normalizer = new EquipmentNormalizer();
    private final ExerciseSelector selector = new ExerciseSelector(
            new CatalogExerciseRepository(ExerciseCatalogCache.of(CATALOG), normalizer), normalizer,
            new GenerationProperties());

    @Test
    void picksHighestScoringExercise() {
        SlotRequirements req = new SlotRequirements("push", List.of("chest"), "compound", true);

        Optional<Exercise> picked = selector.fillExerciseSlot(req, List.of("barbell", "bench", "dumbbells"), Set.of());

        assertThat(picked).map(Exercise::getId).contains("bench-press");
    }

    @Test
    void preferredEquipmentBreaksTheTie() {
        SlotRequirements req = new SlotRequirements("push", List.of("chest"), "compound", null)
                .withPreferredEquipment(List.of("dumbbell"));

        Optional<Exercise> picked = selector.fillExerciseSlot(req, List.of("barbell", "bench", "dumbbells"), Set.of());

        assertThat(picked).map(Exercise::getId).contains("dumbbell-press");
    }

    @Test
    void partialEquipmentMatchIsNotEnough() {
        SlotRequirements req = new SlotRequirements("push", List.of("chest"), "compound", null);

        Optional<Exercise> picked = selector.fillExerciseSlot(req, List.of("barbell"), Set.of());

        assertThat(picked).map(Exercise::getId).contains("push-up");
    }

    @Test
    void excludedExercisesFallBackToPlaceholder() {
        SlotRequirements req = new SlotRequirements("push", List.of("chest"), "compound", null);
        PlaceholderIdGenerator ids = new PlaceholderIdGenerator();

        Exercise picked = selector.fillExerciseSlot(req, List.of(), Set.of("push-up"), ids).orElseThrow();

        assertThat(picked.isPlaceholder()).isTrue();
        assertThat(picked.getName()).isEqualTo("Push Chest Exercise");
        assertThat(picked.getId()).isEqualTo("placeholder-push-chest-exercise-1");
        assertThat(picked.getEquipment()).isEmpty();
        assertThat(picked.getPrimaryMuscles()).containsExactly("chest");
        assertThat(ids.issuedCount()).isEqualTo(1);
    }

    @Test
    void emptyRequirementsWithoutMatchGiveNothing() {
        Optional<Exercise> picked = selector.fillExerciseSlot(new SlotRequirements(), List.of(), Set.of("push-up"));

        assertThat(picked).isEmpty();
    }

    @Test
    void searchFailureIsTreatedAsNoCandidates() {
        ExerciseRepository broken = mock(ExerciseRepository.class);
        when(broken.search(any(), any(), any(), any(), any(), anyInt())).thenThrow(new IllegalStateException("timeout"));
        ExerciseSelector failing = new ExerciseSelector(broken, normalizer, new GenerationProperties());

        Exercise picked = failing.fillExerciseSlot(new SlotRequirements("pull", List.of("lats"), null, null),
                List.of("barbell"), Set.of()).orElseThrow();

        assertThat(picked.isPlaceholder()).isTrue();
        assertThat(picked.getName()).isEqualTo("Pull Lats Exercise");
        assertThat(picked.getCategory()).isEqualTo(Exercise.COMPOUND);
    }

    @Test
    void alternativesShareThePatternAndFitTheEquipment() {
        List<Exercise> alternatives = selector.getAlternatives("bench-press", List.of("dumbbells", "bench"), 5);

        assertThat(alternatives).extracting(Exercise::getId).containsExactly("dumbbell-press", "push-up");
        assertThat(selector.getAlternatives("bench-press", List.of("dumbbells", "bench"), 1))
                .extracting(Exercise::getId).containsExactly("dumbbell-press");
        assertThat(selector.getAlternatives("bench-press", List.of(), 0)).isEmpty();
        assertThat(selector.getAlternatives("unknown", List.of("barbell"), 5)).isEmpty();
    }
}
