package com.tuorg.programservice.service;

import com.tuorg.programservice.dto.GenerateProgramRequest;
import com.tuorg.programservice.dto.GenerateProgramResponse;
import com.tuorg.programservice.exception.ProgramCreationException;
import com.tuorg.programservice.exception.ProgramGenerationException;
import com.tuorg.programservice.exception.ProgramPersistenceException;
import com.tuorg.programservice.exception.ProgramValidationException;
import com.tuorg.programservice.model.Exercise;
import com.tuorg.programservice.model.ExerciseAssignment;
import com.tuorg.programservice.model.ExperienceLevel;
import com.tuorg.programservice.model.PeriodizationModel;
import com.tuorg.programservice.model.ProgramGoal;
import com.tuorg.programservice.model.ProgramStatus;
import com.tuorg.programservice.model.ProgramStructure;
import com.tuorg.programservice.model.ProgramWeek;
import com.tuorg.programservice.model.ProgramWorkout;
import com.tuorg.programservice.model.TrainingProgram;
import com.tuorg.programservice.model.ValidationIssue;
import com.tuorg.programservice.model.ValidationResult;
import com.tuorg.programservice.model.WeekParameters;
import com.tuorg.programservice.model.WorkoutBlueprint;
import com.tuorg.programservice.repository.ExerciseRepository;
import com.tuorg.programservice.repository.ProgramCreationResult;
import com.tuorg.programservice.repository.ProgramRepository;
import com.tuorg.programservice.service.llm.ExerciseSelectionRequest;
import com.tuorg.programservice.service.llm.ExerciseSelectionResponse;
import com.tuorg.programservice.service.llm.ExerciseSelectionStrategy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Turns a generation request into a persisted program: template or default
 * split, periodization plan, exercise selection per workout, validation and
 * one atomic write.
 */
@Service
public class ProgramGenerator {

    private final Logger log = LoggerFactory.getLogger(ProgramGenerator.class);

    static final int CANDIDATE_LIMIT = 50;
    static final String DEFAULT_EQUIPMENT = "bodyweight";

    private final TemplateSelector templateSelector;
    private final PeriodizationService periodizationService;
    private final ProgramValidator validator;
    private final TrainingPrescriptionService prescription;
    private final ExerciseRepository exerciseRepository;
    private final ProgramRepository programRepository;
    private final BlockingCallExecutor executor;
    private final ExerciseSelectionStrategy fallbackStrategy;
    private final ExerciseSelectionStrategy llmStrategy;

    public ProgramGenerator(TemplateSelector templateSelector,
                            PeriodizationService periodizationService,
                            ProgramValidator validator,
                            TrainingPrescriptionService prescription,
                            ExerciseRepository exerciseRepository,
                            ProgramRepository programRepository,
                            BlockingCallExecutor executor,
                            @Qualifier("deterministicExerciseSelection") ExerciseSelectionStrategy fallbackStrategy,
                            @Qualifier("llmExerciseSelection") Optional<ExerciseSelectionStrategy> llmStrategy) {
        this.templateSelector = templateSelector;
        this.periodizationService = periodizationService;
        this.validator = validator;
        this.prescription = prescription;
        this.exerciseRepository = exerciseRepository;
        this.programRepository = programRepository;
        this.executor = executor;
        this.fallbackStrategy = fallbackStrategy;
        this.llmStrategy = llmStrategy.orElse(null);
    }

    /**
     * @throws IllegalArgumentException      for an unknown goal or out of range duration/frequency
     * @throws ProgramValidationException    when the generated program has error-level issues
     * @throws ProgramPersistenceException   when the atomic write failed
     * @throws ProgramGenerationException    for any other failure inside the pipeline
     */
    public GenerateProgramResponse generate(GenerateProgramRequest request, String userId) {
        ProgramGoal goal = ProgramGoal.fromValue(request.goal);
        ExperienceLevel experience = ExperienceLevel.fromValue(request.experienceLevel);
        int durationWeeks = requireRange("durationWeeks", request.durationWeeks, 1, 52);
        int sessionsPerWeek = requireRange("sessionsPerWeek", request.sessionsPerWeek, 1, 7);
        List<String> equipment = equipmentOrDefault(request.equipmentAvailable);
        List<String> limitations = InputSanitizer.sanitizeAll(request.limitations);
        if (limitations.size() > InputSanitizer.MAX_LIMITATIONS) {
            limitations = new ArrayList<>(limitations.subList(0, InputSanitizer.MAX_LIMITATIONS));
        }

        log.info("Generating program for user {}: goal={}, duration={}w, sessions={}/w, level={}",
                userId, goal.getValue(), durationWeeks, sessionsPerWeek, experience.getValue());
        long start = System.nanoTime();

        try {
            Run run = new Run(goal, experience, equipment, limitations);
            run.focusAreas = InputSanitizer.sanitizeAll(request.focusAreas);
            run.preferences = request.preferences;

            // 1) split
            ProgramStructure structure = resolveStructure(run, sessionsPerWeek, durationWeeks);

            // 2) periodization
            PeriodizationModel model = periodizationService.selectPeriodizationModel(goal, experience, durationWeeks);
            List<WeekParameters> plan = periodizationService.planProgression(durationWeeks, goal, experience, model);
            run.suggestions.add("Using " + model.getValue() + " periodization");
            List<Integer> deloads = plan.stream().filter(WeekParameters::isDeload)
                    .map(WeekParameters::getWeekNumber).collect(Collectors.toList());
            if (!deloads.isEmpty()) {
                run.suggestions.add("Deload weeks scheduled: " + deloads.stream()
                        .map(String::valueOf).collect(Collectors.joining(", ")));
            }

            // 3) weeks and workouts
            List<ProgramWeek> weeks = new ArrayList<>();
            for (WeekParameters params : plan) {
                weeks.add(buildWeek(run, structure, params));
            }
            if (run.llmFallbacks > 0) {
                run.suggestions.add("AI exercise selection was unavailable for " + run.llmFallbacks
                        + " workout(s); rule-based selection was used instead");
            }
            int placeholders = countPlaceholders(weeks);
            if (placeholders > 0) {
                run.suggestions.add(placeholders + " exercise slot(s) use generic placeholders;"
                        + " adding equipment would allow specific exercises");
            }

            // 4) validation, before anything is written
            ValidationResult validation = validator.validateProgram(weeks, equipment, experience, limitations);
            if (!validation.isValid()) {
                log.warn("Generated program failed validation: {}", validation.getSummary());
                throw new ProgramValidationException(validation);
            }
            run.suggestions.addAll(warningNotes(validation.getWarnings()));

            // 5) one atomic write
            TrainingProgram program = assembleProgram(request, userId, goal, experience, model, equipment, weeks);
            ProgramCreationResult created;
            try {
                created = executor.call("create program",
                        () -> programRepository.createProgramAtomic(program, program.getWeeks()));
            } catch (ProgramCreationException e) {
                log.error("Program persistence failed: {}", e.getMessage());
                throw new ProgramPersistenceException("Program persistence failed: " + e.getMessage(), e);
            }
            log.info("Created program {} ({} weeks, {} workouts)", created.getProgramId(),
                    created.getWeekIds().size(), created.getWorkoutIds().size());

            // 6) response
            double seconds = Math.round((System.nanoTime() - start) / 1_000_000.0) / 1000.0;
            GenerateProgramResponse.GenerationMetadata meta = new GenerateProgramResponse.GenerationMetadata();
            meta.templateId = run.templateId;
            meta.templateName = run.templateName;
            meta.periodizationModel = model.getValue();
            meta.generationTimeSeconds = Math.round(seconds * 100.0) / 100.0;
            meta.llmUsed = run.llmUsed;
            meta.llmFallbacks = run.llmFallbacks;
            meta.validationPassed = validation.isValid();
            meta.warningCount = validation.getWarnings().size();
            meta.placeholderCount = placeholders;

            log.info("Program generation completed in {}s", String.format(Locale.ROOT, "%.2f", seconds));
            return new GenerateProgramResponse(program, meta, run.suggestions);
        } catch (ProgramGenerationException e) {
            throw e;
        } catch (RuntimeException e) {
            log.error("Program generation failed: {}", e.toString(), e);
            throw new ProgramGenerationException("Program generation failed: " + e.getMessage(), e);
        }
    }

    public Optional<TrainingProgram> getProgram(String programId) {
        return executor.call("get program", () -> programRepository.getById(programId));
    }

    private ProgramStructure resolveStructure(Run run, int sessionsPerWeek, int durationWeeks) {
        Optional<TemplateMatch> match = executor.call("template selection",
                () -> templateSelector.selectBestTemplate(run.goal, run.experience, sessionsPerWeek, durationWeeks));
        if (match.isPresent()) {
            ProgramStructure structure = match.get().getTemplate().getStructure();
            if (structure != null && !structure.workoutsForWeek(1).isEmpty()) {
                run.templateId = match.get().getTemplate().getId();
                run.templateName = match.get().getTemplate().getName();
                run.suggestions.add("Using template: " + run.templateName);
                executor.call("record template usage", () -> {
                    templateSelector.recordUsage(run.templateId);
                    return null;
                });
                return structure;
            }
            log.warn("Template {} has no workouts, ignoring it", match.get().getTemplate().getId());
        }
        run.suggestions.add("Using default workout structure");
        return templateSelector.getDefaultStructure(run.goal, run.experience, sessionsPerWeek, durationWeeks);
    }

    private ProgramWeek buildWeek(Run run, ProgramStructure structure, WeekParameters params) {
        ProgramWeek week = new ProgramWeek();
        week.setWeekNumber(params.getWeekNumber());
        week.setFocus(weekFocus(params, run.goal));
        week.setIntensityPercentage(asPercentage(params.getIntensityPercent()));
        week.setVolumeModifier(params.getVolumeModifier());
        week.setDeload(params.isDeload());
        week.setNotes(params.getNotes());

        List<WorkoutBlueprint> blueprints = structure.workoutsForWeek(params.getWeekNumber());
        for (int i = 0; i < blueprints.size(); i++) {
            week.getWorkouts().add(buildWorkout(run, blueprints.get(i), i, params, week.getIntensityPercentage()));
        }
        return week;
    }

    private ProgramWorkout buildWorkout(Run run, WorkoutBlueprint blueprint, int index, WeekParameters params,
                                       int intensityPercentage) {
        String type = blueprint.getWorkoutType() == null ? "full_body" : blueprint.getWorkoutType();
        int slots = blueprint.slotCount();
        if (params.isDeload()) slots = Math.max(3, slots - 2);

        List<Exercise> candidates;
        try {
            candidates = executor.call("exercise lookup",
                    () -> exerciseRepository.getForWorkoutType(type, run.equipment, CANDIDATE_LIMIT));
        } catch (RuntimeException e) {
            log.warn("Exercise lookup failed for {} workout: {}", type, e.getMessage());
            candidates = List.of();
        }
        for (Exercise ex : candidates) run.placeholderIds.reserve(ex.getId());

        ExerciseSelectionRequest selection = new ExerciseSelectionRequest();
        selection.setWorkoutType(type);
        selection.setMuscleGroups(blueprint.getMuscleGroups());
        selection.setEquipment(run.equipment);
        selection.setExerciseCount(slots);
        selection.setIntensityPercent(params.getIntensityPercent());
        selection.setVolumeModifier(params.getVolumeModifier());
        selection.setAvailableExercises(candidates);
        selection.setUserLimitations(run.limitations);
        selection.setFocusAreas(run.focusAreas);
        selection.setPreferences(run.preferences);
        selection.setExperienceLevel(run.experience);
        selection.setGoal(run.goal);
        selection.setDeload(params.isDeload());
        selection.setSlots(blueprint.getSlots());
        selection.setPlaceholderIds(run.placeholderIds);

        ExerciseSelectionResponse response = selectExercises(run, selection);

        ProgramWorkout workout = new ProgramWorkout();
        workout.setDayOfWeek(Math.max(1, Math.min(7, blueprint.getDayOfWeek())));
        workout.setName(blueprint.getName() == null ? titleCase(type) + " Workout" : blueprint.getName());
        workout.setWorkoutType(type);
        workout.setTargetDurationMinutes(blueprint.getTargetDurationMinutes());
        workout.setSortOrder(index);
        workout.setNotes(response.getWorkoutNotes());

        for (ExerciseSelectionResponse.SelectedExercise sel : response.getExercises()) {
            Exercise ex = sel.getExercise();
            ExerciseAssignment assignment = ExerciseAssignment.of(ex, sel.getOrder(), sel.getSets(),
                    sel.getReps(), sel.getRestSeconds());
            String notes = sel.getNotes();
            if (ex.isSupports1rm() && !params.isDeload()) {
                String load = prescription.recommendedLoad(intensityPercentage);
                notes = notes == null || notes.isBlank() ? load : notes + " (" + load + ")";
            }
            assignment.setNotes(notes);
            workout.getExercises().add(assignment);
        }
        return workout;
    }

    // LLM first when configured and there is something to choose from; rule-based otherwise
    private ExerciseSelectionResponse selectExercises(Run run, ExerciseSelectionRequest selection) {
        if (llmStrategy != null && llmStrategy.isAvailable() && !selection.getAvailableExercises().isEmpty()) {
            try {
                ExerciseSelectionResponse response = executor.call("llm selection",
                        () -> llmStrategy.selectExercises(selection));
                run.llmUsed = true;
                return response;
            } catch (RuntimeException e) {
                run.llmFallbacks++;
                log.warn("LLM exercise selection failed for {} workout, using fallback: {}",
                        selection.getWorkoutType(), e.getMessage());
            }
        }
        return executor.call("rule-based selection", () -> fallbackStrategy.selectExercises(selection));
    }

    private TrainingProgram assembleProgram(GenerateProgramRequest request, String userId, ProgramGoal goal,
                                            ExperienceLevel experience, PeriodizationModel model,
                                            List<String> equipment, List<ProgramWeek> weeks) {
        TrainingProgram program = new TrainingProgram();
        program.setId(UUID.randomUUID().toString());
        program.setUserId(userId);
        program.setName(programName(goal, request.durationWeeks));
        program.setDescription(programDescription(goal, experience, request.durationWeeks, request.sessionsPerWeek));
        program.setGoal(goal);
        program.setPeriodizationModel(model);
        program.setDurationWeeks(request.durationWeeks);
        program.setSessionsPerWeek(request.sessionsPerWeek);
        program.setExperienceLevel(experience);
        program.setEquipmentAvailable(new ArrayList<>(equipment));
        program.setStatus(ProgramStatus.DRAFT);
        program.setCreatedAt(Instant.now());

        for (ProgramWeek week : weeks) {
            week.setId(UUID.randomUUID().toString());
            week.setProgramId(program.getId());
            for (ProgramWorkout workout : week.getWorkouts()) {
                workout.setId(UUID.randomUUID().toString());
                workout.setWeekId(week.getId());
            }
        }
        program.setWeeks(weeks);
        return program;
    }

    static String weekFocus(WeekParameters params, ProgramGoal goal) {
        if (params.isDeload()) return "Recovery & Deload";
        if (params.getPhase() != null) return params.getPhase().getFocusLabel();
        switch (goal) {
            case STRENGTH: return "Strength Development";
            case HYPERTROPHY: return "Muscle Building";
            case ENDURANCE: return "Endurance Training";
            case WEIGHT_LOSS: return "Fat Loss";
            case GENERAL_FITNESS: return "General Fitness";
            default: return "Training";
        }
    }

    static String programName(ProgramGoal goal, int durationWeeks) {
        String goalName;
        switch (goal) {
            case STRENGTH: goalName = "Strength"; break;
            case HYPERTROPHY: goalName = "Hypertrophy"; break;
            case ENDURANCE: goalName = "Endurance"; break;
            case WEIGHT_LOSS: goalName = "Fat Loss"; break;
            case GENERAL_FITNESS: goalName = "Fitness"; break;
            default: goalName = titleCase(goal.getValue());
        }
        return durationWeeks + "-Week " + goalName + " Program";
    }

    static String programDescription(ProgramGoal goal, ExperienceLevel experience, int durationWeeks,
                                     int sessionsPerWeek) {
        return "A " + durationWeeks + "-week " + goal.getValue().replace('_', ' ') + " program designed for "
                + experience.getValue() + " lifters, with " + sessionsPerWeek + " sessions per week.";
    }

    private static String titleCase(String raw) {
        StringBuilder sb = new StringBuilder();
        for (String word : raw.split("[_\\s]+")) {
            if (word.isEmpty()) continue;
            if (sb.length() > 0) sb.append(' ');
            sb.append(word.substring(0, 1).toUpperCase(Locale.ROOT)).append(word.substring(1).toLowerCase(Locale.ROOT));
        }
        return sb.toString();
    }

    private static List<String> equipmentOrDefault(List<String> requested) {
        List<String> out = new ArrayList<>();
        if (requested != null) {
            for (String item : requested) {
                if (item != null && !item.isBlank()) out.add(item.trim());
            }
        }
        if (out.isEmpty()) out.add(DEFAULT_EQUIPMENT);
        return out;
    }

    private static int requireRange(String field, Integer value, int min, int max) {
        if (value == null || value < min || value > max) {
            throw new IllegalArgumentException(field + " must be between " + min + " and " + max + ", got " + value);
        }
        return value;
    }

    static int asPercentage(double fraction) {
        return (int) Math.round(fraction * 100);
    }

    /** One "Note: ..." per distinct warning, listing every place it was raised. */
    static List<String> warningNotes(List<ValidationIssue> warnings) {
        Map<String, Set<String>> byMessage = new LinkedHashMap<>();
        for (ValidationIssue issue : warnings) {
            Set<String> locations = byMessage.computeIfAbsent(issue.getMessage(), k -> new LinkedHashSet<>());
            if (issue.getLocation() != null) locations.add(issue.getLocation());
        }
        List<String> notes = new ArrayList<>();
        for (Map.Entry<String, Set<String>> e : byMessage.entrySet()) {
            String where = e.getValue().isEmpty() ? "" : " (" + String.join("; ", e.getValue()) + ")";
            notes.add("Note: " + e.getKey() + where);
        }
        return notes;
    }

    private static int countPlaceholders(List<ProgramWeek> weeks) {
        int n = 0;
        for (ProgramWeek week : weeks) {
            for (ProgramWorkout workout : week.getWorkouts()) {
                for (ExerciseAssignment a : workout.getExercises()) {
                    if (a.isPlaceholder()) n++;
                }
            }
        }
        return n;
    }

    /** Mutable state of one generate call. */
    private static final class Run {
        final ProgramGoal goal;
        final ExperienceLevel experience;
        final List<String> equipment;
        final List<String> limitations;
        final PlaceholderIdGenerator placeholderIds = new PlaceholderIdGenerator();
        final List<String> suggestions = new ArrayList<>();
        List<String> focusAreas = new ArrayList<>();
        String preferences;
        String templateId;
        String templateName;
        boolean llmUsed;
        int llmFallbacks;

        Run(ProgramGoal goal, ExperienceLevel experience, List<String> equipment, List<String> limitations) {
            this.goal = goal;
            this.experience = experience;
            this.equipment = equipment;
            this.limitations = limitations;
        }
    }
}
