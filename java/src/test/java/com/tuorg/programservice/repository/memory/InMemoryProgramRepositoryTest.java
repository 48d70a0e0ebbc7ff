package com.tuorg.programservice.repository.memory;

import com.tuorg.programservice.exception.ProgramCreationException;
import com.tuorg.programservice.model.ProgramGoal;
import com.tuorg.programservice.model.ProgramWeek;
import com.tuorg.programservice.model.ProgramWorkout;
import com.tuorg.programservice.model.TrainingProgram;
import com.tuorg.programservice.repository.ProgramCreationResult;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static com.tuorg.programservice.support.GenerationFixtures.assignment;
import static com.tuorg.programservice.support.GenerationFixtures.week;
import static com.tuorg.programservice.support.GenerationFixtures.workout;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class InMemoryProgramRepositoryTest {

    @Test
    void atomicCreateStoresTheWholeTree() {
        InMemoryProgramRepository repository = new InMemoryProgramRepository();

        ProgramCreationResult result = repository.createProgramAtomic(program("p1", "user-1"), twoWeeks());

        assertThat(result.getProgramId()).isEqualTo("p1");
        assertThat(result.getWeekIds()).hasSize(2);
        assertThat(result.getWorkoutIds()).hasSize(3);

        TrainingProgram stored = repository.getById("p1").orElseThrow();
        assertThat(stored.getWeeks()).extracting(ProgramWeek::getWeekNumber).containsExactly(1, 2);
        assertThat(stored.getWeeks().get(0).getProgramId()).isEqualTo("p1");
        ProgramWorkout first = stored.getWeeks().get(0).getWorkouts().get(0);
        assertThat(first.getWeekId()).isEqualTo(stored.getWeeks().get(0).getId());
        assertThat(first.getExercises()).extracting(a -> a.getExerciseId()).containsExactly("push-up");
        assertThat(repository.count()).isEqualTo(1);
    }

    @Test
    void failureWhileStagingLeavesNothingBehind() {
        InMemoryProgramRepository repository = new InMemoryProgramRepository();
        List<ProgramWeek> weeks = twoWeeks();
        weeks.get(0).getWorkouts().get(0).setId("w-1");
        weeks.get(1).getWorkouts().get(0).setId("w-1");

        assertThatThrownBy(() -> repository.createProgramAtomic(program("p1", "user-1"), weeks))
                .isInstanceOf(ProgramCreationException.class)
                .hasMessageContaining("Duplicate program_workouts id: w-1");
        assertThat(repository.count()).isZero();
        assertThat(repository.getById("p1")).isEmpty();
        assertThat(repository.getByUser("user-1")).isEmpty();
    }

    @Test
    void rowIdsStayUniqueAcrossPrograms() {
        InMemoryProgramRepository repository = new InMemoryProgramRepository();
        List<ProgramWeek> first = twoWeeks();
        first.get(0).setId("week-a");
        repository.createProgramAtomic(program("p1", "user-1"), first);

        List<ProgramWeek> second = twoWeeks();
        second.get(1).setId("week-a");
        assertThatThrownBy(() -> repository.createProgramAtomic(program("p2", "user-1"), second))
                .isInstanceOf(ProgramCreationException.class)
                .hasMessageContaining("Duplicate program_weeks id: week-a");
        assertThat(repository.getById("p2")).isEmpty();
        assertThat(repository.count()).isEqualTo(1);
    }

    @Test
    void duplicateProgramIdIsRejected() {
        InMemoryProgramRepository repository = new InMemoryProgramRepository();
        repository.createProgramAtomic(program("p1", "user-1"), twoWeeks());

        assertThatThrownBy(() -> repository.createProgramAtomic(program("p1", "user-1"), twoWeeks()))
                .isInstanceOf(ProgramCreationException.class);
        assertThat(repository.count()).isEqualTo(1);
    }

    @Test
    void returnedProgramsAreCopies() {
        InMemoryProgramRepository repository = new InMemoryProgramRepository();
        repository.createProgramAtomic(program("p1", "user-1"), twoWeeks());

        TrainingProgram copy = repository.getById("p1").orElseThrow();
        copy.setName("changed");
        copy.getWeeks().clear();

        TrainingProgram again = repository.getById("p1").orElseThrow();
        assertThat(again.getName()).isEqualTo("Program p1");
        assertThat(again.getWeeks()).hasSize(2);
    }

    @Test
    void stepwiseCreationLinksWeeksAndWorkouts() {
        InMemoryProgramRepository repository = new InMemoryProgramRepository();
        TrainingProgram created = repository.create(program(null, "user-2"));
        assertThat(created.getId()).isNotBlank();

        ProgramWeek week = week(1, false);
        week.setProgramId(created.getId());
        ProgramWeek savedWeek = repository.createWeek(week);

        ProgramWorkout workout = workout("Push", assignment("push-up", 3, List.of("chest")));
        workout.setWeekId(savedWeek.getId());
        repository.createWorkout(workout);

        TrainingProgram stored = repository.getById(created.getId()).orElseThrow();
        assertThat(stored.getWeeks()).hasSize(1);
        assertThat(stored.getWeeks().get(0).getWorkouts()).extracting(ProgramWorkout::getName).containsExactly("Push");

        ProgramWeek orphan = week(1, false);
        orphan.setProgramId("missing");
        assertThatThrownBy(() -> repository.createWeek(orphan)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void programsByUserNewestFirst() {
        InMemoryProgramRepository repository = new InMemoryProgramRepository();
        TrainingProgram older = program("old", "user-3");
        older.setCreatedAt(Instant.parse("2024-01-01T00:00:00Z"));
        TrainingProgram newer = program("new", "user-3");
        newer.setCreatedAt(Instant.parse("2024-06-01T00:00:00Z"));
        repository.create(older);
        repository.create(newer);
        repository.create(program("other", "user-4"));

        assertThat(repository.getByUser("user-3")).extracting(TrainingProgram::getId).containsExactly("new", "old");
    }

    private static TrainingProgram program(String id, String userId) {
        TrainingProgram p = new TrainingProgram();
        p.setId(id);
        p.setUserId(userId);
        p.setName("Program " + id);
        p.setGoal(ProgramGoal.HYPERTROPHY);
        p.setDurationWeeks(2);
        p.setSessionsPerWeek(2);
        return p;
    }

    private static List<ProgramWeek> twoWeeks() {
        return List.of(
                week(1, false,
                        workout("Push", assignment("push-up", 3, List.of("chest"))),
                        workout("Pull", assignment("inverted-row", 3, List.of("lats")))),
                week(2, true,
                        workout("Full", assignment("bodyweight-squat", 2, List.of("quadriceps")))));
    }
}
