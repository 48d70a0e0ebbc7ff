package com.tuorg.programservice.repository.memory;

import com.tuorg.programservice.exception.ProgramCreationException;
import com.tuorg.programservice.model.ProgramWeek;
import com.tuorg.programservice.model.ProgramWorkout;
import com.tuorg.programservice.model.TrainingProgram;
import com.tuorg.programservice.repository.ProgramCreationResult;
import com.tuorg.programservice.repository.ProgramRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Program store kept in process memory. Stored and returned objects are
 * copies, so callers never share state with the store.
 *
 * <p>{@link #createProgramAtomic} stages every row first and publishes them
 * under one lock; a failure while staging leaves the store untouched.
 */
@Repository
public class InMemoryProgramRepository implements ProgramRepository {

    private final Logger log = LoggerFactory.getLogger(InMemoryProgramRepository.class);
    private final ReentrantLock lock = new ReentrantLock();

    private final Map<String, TrainingProgram> programs = new LinkedHashMap<>();
    // week id -> owning program id
    private final Map<String, String> weekOwners = new HashMap<>();
    private final Set<String> workoutIds = new HashSet<>();

    @Override
    public TrainingProgram create(TrainingProgram program) {
        lock.lock();
        try {
            TrainingProgram row = program.copy(false);
            if (row.getId() == null) row.setId(UUID.randomUUID().toString());
            if (row.getCreatedAt() == null) row.setCreatedAt(Instant.now());
            if (programs.containsKey(row.getId())) {
                throw new IllegalStateException("Duplicate programs id: " + row.getId());
            }
            programs.put(row.getId(), row);
            return row.copy(false);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Optional<TrainingProgram> getById(String programId) {
        lock.lock();
        try {
            TrainingProgram p = programs.get(programId);
            return p == null ? Optional.empty() : Optional.of(p.copy(true));
        } finally {
            lock.unlock();
        }
    }

    @Override
    public List<TrainingProgram> getByUser(String userId) {
        lock.lock();
        try {
            List<TrainingProgram> out = new ArrayList<>();
            for (TrainingProgram p : programs.values()) {
                if (p.getUserId() != null && p.getUserId().equals(userId)) out.add(p.copy(false));
            }
            out.sort(Comparator.comparing(TrainingProgram::getCreatedAt,
                    Comparator.nullsLast(Comparator.reverseOrder())));
            return out;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public ProgramWeek createWeek(ProgramWeek week) {
        lock.lock();
        try {
            TrainingProgram owner = programs.get(week.getProgramId());
            if (owner == null) throw new IllegalArgumentException("Unknown program " + week.getProgramId());
            ProgramWeek row = week.copy();
            if (row.getId() == null) row.setId(UUID.randomUUID().toString());
            requireUnused("program_weeks", weekOwners.keySet(), Set.of(), row.getId());
            owner.getWeeks().add(row);
            owner.getWeeks().sort(Comparator.comparingInt(ProgramWeek::getWeekNumber));
            weekOwners.put(row.getId(), owner.getId());
            return row.copy();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public ProgramWorkout createWorkout(ProgramWorkout workout) {
        lock.lock();
        try {
            ProgramWeek week = findWeek(workout.getWeekId());
            if (week == null) throw new IllegalArgumentException("Unknown week " + workout.getWeekId());
            ProgramWorkout row = workout.copy();
            if (row.getId() == null) row.setId(UUID.randomUUID().toString());
            requireUnused("program_workouts", workoutIds, Set.of(), row.getId());
            week.getWorkouts().add(row);
            workoutIds.add(row.getId());
            return row.copy();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public ProgramCreationResult createProgramAtomic(TrainingProgram program, List<ProgramWeek> weeksWithWorkouts) {
        lock.lock();
        try {
            TrainingProgram staged = program.copy(false);
            if (staged.getId() == null) staged.setId(UUID.randomUUID().toString());
            if (staged.getCreatedAt() == null) staged.setCreatedAt(Instant.now());
            if (programs.containsKey(staged.getId())) {
                throw new ProgramCreationException("Program " + staged.getId() + " already exists");
            }

            Set<String> weekIds = new LinkedHashSet<>();
            Set<String> stagedWorkoutIds = new LinkedHashSet<>();
            try {
                for (ProgramWeek week : weeksWithWorkouts) {
                    ProgramWeek stagedWeek = week.copy();
                    if (stagedWeek.getId() == null) stagedWeek.setId(UUID.randomUUID().toString());
                    stagedWeek.setProgramId(staged.getId());
                    requireUnused("program_weeks", weekOwners.keySet(), weekIds, stagedWeek.getId());
                    weekIds.add(stagedWeek.getId());
                    for (ProgramWorkout workout : stagedWeek.getWorkouts()) {
                        if (workout.getId() == null) workout.setId(UUID.randomUUID().toString());
                        workout.setWeekId(stagedWeek.getId());
                        requireUnused("program_workouts", workoutIds, stagedWorkoutIds, workout.getId());
                        stagedWorkoutIds.add(workout.getId());
                    }
                    staged.getWeeks().add(stagedWeek);
                }
            } catch (RuntimeException e) {
                log.warn("Atomic create of program {} rolled back: {}", staged.getId(), e.getMessage());
                throw new ProgramCreationException("Atomic program creation failed: " + e.getMessage(), e);
            }

            programs.put(staged.getId(), staged);
            for (String weekId : weekIds) weekOwners.put(weekId, staged.getId());
            workoutIds.addAll(stagedWorkoutIds);
            log.debug("Program {} committed with {} weeks, {} workouts",
                    staged.getId(), weekIds.size(), stagedWorkoutIds.size());
            return new ProgramCreationResult(staged.getId(), new ArrayList<>(weekIds), new ArrayList<>(stagedWorkoutIds));
        } finally {
            lock.unlock();
        }
    }

    public int count() {
        lock.lock();
        try {
            return programs.size();
        } finally {
            lock.unlock();
        }
    }

    // row ids are primary keys: unique across the store and within one staged tree
    private static void requireUnused(String table, Set<String> stored, Set<String> staged, String id) {
        if (stored.contains(id) || staged.contains(id)) {
            throw new IllegalStateException("Duplicate " + table + " id: " + id);
        }
    }

    private ProgramWeek findWeek(String weekId) {
        String programId = weekOwners.get(weekId);
        if (programId == null) return null;
        for (ProgramWeek w : programs.get(programId).getWeeks()) {
            if (w.getId().equals(weekId)) return w;
        }
        return null;
    }
}
