package com.tuorg.programservice.service.llm;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.tuorg.programservice.config.LlmProperties;
import com.tuorg.programservice.exception.ExerciseSelectionException;
import com.tuorg.programservice.model.Exercise;
import com.tuorg.programservice.service.InputSanitizer;
import com.tuorg.programservice.service.TrainingPrescriptionService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Asks an OpenAI-compatible chat-completions endpoint to pick exercises
 * from the candidate list. Every failure surfaces as
 * {@link ExerciseSelectionException}; there are no retries.
 */
@Component("llmExerciseSelection")
@ConditionalOnProperty(prefix = "program.llm", name = "enabled", havingValue = "true")
public class LlmExerciseSelectionStrategy implements ExerciseSelectionStrategy {

    private final Logger log = LoggerFactory.getLogger(LlmExerciseSelectionStrategy.class);

    static final int MIN_SETS = 1;
    static final int MAX_SETS = 10;
    static final int MIN_REST = 30;
    static final int MAX_REST = 300;

    private final LlmProperties properties;
    private final RestTemplate rest;
    private final LlmResponseParser parser;
    private final TrainingPrescriptionService prescription;
    private final Cache<String, ExerciseSelectionResponse> cache;

    @Autowired
    public LlmExerciseSelectionStrategy(LlmProperties properties, RestTemplateBuilder restTemplateBuilder,
                                        ObjectMapper mapper, TrainingPrescriptionService prescription) {
        this(properties,
                restTemplateBuilder
                        .setConnectTimeout(properties.getConnectTimeout())
                        .setReadTimeout(properties.getReadTimeout())
                        .build(),
                new LlmResponseParser(mapper),
                prescription);
    }

    LlmExerciseSelectionStrategy(LlmProperties properties, RestTemplate rest, LlmResponseParser parser,
                                 TrainingPrescriptionService prescription) {
        this.properties = properties;
        this.rest = rest;
        this.parser = parser;
        this.prescription = prescription;
        this.cache = Caffeine.newBuilder()
                .maximumSize(properties.getCacheMaxSize())
                .expireAfterWrite(properties.getCacheTtl())
                .build();
    }

    @Override
    public boolean isAvailable() {
        return properties.isConfigured();
    }

    @Override
    public ExerciseSelectionResponse selectExercises(ExerciseSelectionRequest request) {
        if (!isAvailable()) {
            throw new ExerciseSelectionException("LLM selection is not configured");
        }
        if (request.getAvailableExercises().isEmpty()) {
            throw new ExerciseSelectionException("No candidate exercises to choose from");
        }

        String key = cacheKey(request);
        ExerciseSelectionResponse cached = cache.getIfPresent(key);
        if (cached != null && coversCandidates(cached, request)) {
            log.debug("Using cached LLM selection for {}", key);
            return cached;
        }

        String body = call(ExercisePromptBuilder.buildUserPrompt(request));
        ExerciseSelectionResponse parsed;
        try {
            parsed = parser.parse(body);
        } catch (ExerciseSelectionException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new ExerciseSelectionException("Could not parse LLM response: " + e.getMessage(), e);
        }
        ExerciseSelectionResponse checked = check(parsed, request);
        cache.put(key, checked);
        return checked;
    }

    private String call(String userPrompt) {
        Map<String, Object> payload = new HashMap<>();
        payload.put("model", properties.getModel());
        payload.put("messages", List.of(
                Map.of("role", "system", "content", ExercisePromptBuilder.SYSTEM_PROMPT),
                Map.of("role", "user", "content", userPrompt)
        ));
        payload.put("temperature", properties.getTemperature());
        payload.put("max_tokens", properties.getMaxTokens());
        payload.put("response_format", Map.of("type", "json_object"));

        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        headers.setBearerAuth(properties.getApiKey());

        String url = properties.getBaseUrl().replaceAll("/+$", "") + "/chat/completions";
        log.debug("Calling LLM model={} prompt length={} chars", properties.getModel(), userPrompt.length());
        try {
            ResponseEntity<String> resp = rest.exchange(url, HttpMethod.POST, new HttpEntity<>(payload, headers), String.class);
            if (!resp.getStatusCode().is2xxSuccessful()) {
                throw new ExerciseSelectionException("LLM request failed: " + resp.getStatusCode());
            }
            return resp.getBody();
        } catch (RestClientException e) {
            throw new ExerciseSelectionException("LLM request failed: " + e.getMessage(), e);
        }
    }

    /**
     * Drops ids that were not offered and repeats, requires the requested
     * count, and clamps the prescription into sane bounds.
     */
    ExerciseSelectionResponse check(ExerciseSelectionResponse parsed, ExerciseSelectionRequest request) {
        Map<String, Exercise> offered = new LinkedHashMap<>();
        for (Exercise ex : request.getAvailableExercises()) offered.put(ex.getId(), ex);

        int count = request.getExerciseCount();
        int defaultSets = prescription.recommendedSets(request.getGoal(), request.isDeload());
        String defaultReps = prescription.recommendedReps(request.getGoal());
        int defaultRest = prescription.recommendedRestSeconds(request.getGoal());

        List<ExerciseSelectionResponse.SelectedExercise> kept = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        for (ExerciseSelectionResponse.SelectedExercise sel : parsed.getExercises()) {
            String id = sel.getExerciseId();
            if (id == null || !offered.containsKey(id)) {
                log.warn("LLM selected unknown exercise id: {}", id);
                continue;
            }
            if (!seen.add(id)) {
                log.warn("LLM selected exercise {} twice", id);
                continue;
            }
            Exercise ex = offered.get(id);
            sel.setExercise(ex);
            if (sel.getExerciseName() == null || sel.getExerciseName().isBlank()) sel.setExerciseName(ex.getName());
            kept.add(sel);
            if (kept.size() == count) break;
        }
        if (kept.size() < count) {
            throw new ExerciseSelectionException("LLM returned " + kept.size() + " usable exercises, " + count + " requested");
        }

        for (int i = 0; i < kept.size(); i++) {
            ExerciseSelectionResponse.SelectedExercise sel = kept.get(i);
            int sets = sel.getSets() == null ? defaultSets : clamp(sel.getSets(), MIN_SETS, MAX_SETS);
            String reps = sel.getReps() == null || sel.getReps().isBlank() ? defaultReps : sel.getReps().trim();
            int rest = sel.getRestSeconds() == null ? defaultRest : clamp(sel.getRestSeconds(), MIN_REST, MAX_REST);
            sel.prescribe(i + 1, sets, reps, rest);
        }

        ExerciseSelectionResponse out = new ExerciseSelectionResponse();
        out.setExercises(kept);
        out.setWorkoutNotes(parsed.getWorkoutNotes());
        return out.withEstimatedDuration(parsed.getEstimatedDurationMinutes());
    }

    /** Everything that shapes the prompt, except the candidate list itself. */
    static String cacheKey(ExerciseSelectionRequest request) {
        return String.join("|",
                String.valueOf(request.getWorkoutType()),
                String.join(",", new TreeSet<>(request.getMuscleGroups())),
                String.valueOf(request.getExerciseCount()),
                request.getGoal() == null ? "" : request.getGoal().getValue(),
                request.getExperienceLevel() == null ? "" : request.getExperienceLevel().getValue(),
                String.valueOf(Math.round(request.getIntensityPercent() * 100)),
                String.format(Locale.ROOT, "%.2f", request.getVolumeModifier()),
                String.valueOf(request.isDeload()),
                String.join(",", new TreeSet<>(request.getEquipment())),
                String.join(",", normalizedText(request.getUserLimitations())),
                String.join(",", normalizedText(request.getFocusAreas())),
                InputSanitizer.sanitize(request.getPreferences(), InputSanitizer.MAX_PREFERENCES_LENGTH)
                        .toLowerCase(Locale.ROOT));
    }

    private static TreeSet<String> normalizedText(List<String> values) {
        TreeSet<String> out = new TreeSet<>();
        for (String v : InputSanitizer.sanitizeAll(values)) out.add(v.toLowerCase(Locale.ROOT));
        return out;
    }

    // a cached answer is only reusable while every id it names is still on offer
    private static boolean coversCandidates(ExerciseSelectionResponse cached, ExerciseSelectionRequest request) {
        Set<String> offered = new HashSet<>();
        for (Exercise ex : request.getAvailableExercises()) offered.add(ex.getId());
        for (ExerciseSelectionResponse.SelectedExercise sel : cached.getExercises()) {
            if (!offered.contains(sel.getExerciseId())) return false;
        }
        return true;
    }

    private static int clamp(int value, int min, int max) {
        return Math.max(min, Math.min(max, value));
    }

    long cacheSize() {
        cache.cleanUp();
        return cache.estimatedSize();
    }
}
