package com.tuorg.programservice.service.llm;

import com.tuorg.programservice.model.Exercise;
import com.tuorg.programservice.service.InputSanitizer;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

/** System and user prompts for LLM exercise selection. */
public final class ExercisePromptBuilder {

    public static final String SYSTEM_PROMPT = String.join("\n",
            "You are an expert strength and conditioning coach designing workout programs.",
            "",
            "Your role is to select appropriate exercises from a provided list based on:",
            "- Target muscle groups",
            "- Available equipment",
            "- Training goal and intensity",
            "- User experience level",
            "- Any limitations or injuries",
            "",
            "Guidelines for exercise selection:",
            "",
            "1. COMPOUND FIRST: Start with compound movements that target multiple muscle groups",
            "2. MUSCLE BALANCE: Ensure balanced development (e.g., if doing chest press, include rows)",
            "3. PROGRESSIVE ORDER: Order exercises from most demanding to least demanding",
            "4. REST PERIODS:",
            "   - Compound/Heavy: 120-180 seconds",
            "   - Moderate: 60-90 seconds",
            "   - Isolation/Light: 30-60 seconds",
            "",
            "5. REP RANGES by goal:",
            "   - Strength: 1-5 reps",
            "   - Hypertrophy: 6-12 reps",
            "   - Endurance: 12-20 reps",
            "   - Power: 3-5 reps (explosive)",
            "",
            "6. VOLUME by experience:",
            "   - Beginner: 3 sets per exercise, fewer exercises",
            "   - Intermediate: 3-4 sets, moderate exercises",
            "   - Advanced: 3-5 sets, more exercises",
            "",
            "7. DELOAD WEEKS: Reduce volume by 40-50%, reduce intensity by 10-20%",
            "",
            "IMPORTANT:",
            "- Only select exercises from the provided available_exercises list",
            "- Use the exact exercise_id from the list",
            "- Respect user limitations (avoid exercises that stress injured areas)",
            "- Match equipment to what's available",
            "- Respond with a single JSON object and nothing else");

    private static final String RESPONSE_SHAPE = String.join("\n",
            "{",
            "  \"exercises\": [",
            "    {",
            "      \"exercise_id\": \"the-exercise-slug\",",
            "      \"exercise_name\": \"Exercise Name\",",
            "      \"sets\": 4,",
            "      \"reps\": \"8-10\",",
            "      \"rest_seconds\": 90,",
            "      \"notes\": \"Keep core tight\",",
            "      \"order\": 1,",
            "      \"superset_group\": null",
            "    }",
            "  ],",
            "  \"workout_notes\": \"Brief overview of the workout focus\",",
            "  \"estimated_duration_minutes\": 45",
            "}");

    private ExercisePromptBuilder() {
    }

    public static String buildUserPrompt(ExerciseSelectionRequest req) {
        int count = req.getExerciseCount();
        StringBuilder p = new StringBuilder();
        p.append("Select ").append(count).append(" exercises for a ").append(req.getWorkoutType()).append(" workout.\n\n");
        p.append("**Target Muscle Groups:** ").append(String.join(", ", req.getMuscleGroups())).append("\n\n");
        p.append("**Available Equipment:** ")
                .append(req.getEquipment().isEmpty() ? "Bodyweight only" : String.join(", ", req.getEquipment()))
                .append("\n\n");

        p.append("**Training Parameters:**\n");
        p.append("- Goal: ").append(titleCase(req.getGoal() == null ? "" : req.getGoal().getValue())).append("\n");
        p.append("- Experience Level: ")
                .append(titleCase(req.getExperienceLevel() == null ? "" : req.getExperienceLevel().getValue())).append("\n");
        p.append("- Intensity: ").append(Math.round(req.getIntensityPercent() * 100)).append("%\n");
        p.append("- Volume Modifier: ").append(req.getVolumeModifier()).append("x\n");
        p.append("- Deload Week: ").append(req.isDeload() ? "Yes (reduce volume and intensity)" : "No").append("\n\n");

        List<String> limitations = InputSanitizer.sanitizeAll(req.getUserLimitations());
        if (!limitations.isEmpty()) {
            p.append("**User Limitations (AVOID exercises that stress these areas):**\n- ")
                    .append(String.join("\n- ", limitations))
                    .append("\n\n");
        }

        List<String> focus = InputSanitizer.sanitizeAll(req.getFocusAreas());
        if (!focus.isEmpty()) {
            p.append("**Focus Areas (prefer exercises for these):** ").append(String.join(", ", focus)).append("\n\n");
        }
        String preferences = InputSanitizer.sanitize(req.getPreferences(), InputSanitizer.MAX_PREFERENCES_LENGTH);
        if (!preferences.isEmpty()) {
            p.append("**User Preferences:** ").append(preferences).append("\n\n");
        }

        p.append("**Available Exercises (select from these only):**\n");
        for (Exercise ex : req.getAvailableExercises()) {
            p.append("- ").append(ex.getId()).append(": ").append(ex.getName())
                    .append(" (muscles: ").append(String.join(", ", ex.getPrimaryMuscles()))
                    .append(", equipment: ").append(String.join(", ", ex.getEquipment())).append(")\n");
        }
        p.append("\n");

        p.append("Select the best ").append(count).append(" exercises and provide:\n");
        p.append("1. Exercise order (most demanding first)\n");
        p.append("2. Sets and reps appropriate for the goal and intensity\n");
        p.append("3. Rest periods in seconds\n");
        p.append("4. Brief form cues or notes if helpful\n\n");
        p.append("Return your response as a JSON object with this exact structure:\n");
        p.append(RESPONSE_SHAPE).append("\n");
        return p.toString();
    }

    // "weight_loss" -> "Weight Loss"
    static String titleCase(String raw) {
        if (raw == null || raw.isBlank()) return "";
        return Arrays.stream(raw.trim().split("[_\\s]+"))
                .filter(w -> !w.isEmpty())
                .map(w -> w.substring(0, 1).toUpperCase(Locale.ROOT) + w.substring(1).toLowerCase(Locale.ROOT))
                .collect(Collectors.joining(" "));
    }
}
