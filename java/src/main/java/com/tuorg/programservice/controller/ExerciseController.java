package com.tuorg.programservice.controller;

import com.tuorg.programservice.model.Exercise;
import com.tuorg.programservice.repository.ExerciseRepository;
import com.tuorg.programservice.service.ExerciseSelector;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/exercises")
public class ExerciseController {

    private final ExerciseSelector exerciseSelector;
    private final ExerciseRepository exerciseRepository;

    public ExerciseController(ExerciseSelector exerciseSelector, ExerciseRepository exerciseRepository) {
        this.exerciseSelector = exerciseSelector;
        this.exerciseRepository = exerciseRepository;
    }

    /** Substitutes for an exercise that the given equipment allows. */
    @GetMapping("/{exerciseId}/alternatives")
    public ResponseEntity<?> alternatives(@PathVariable String exerciseId,
                                          @RequestParam(value = "equipment", required = false) List<String> equipment,
                                          @RequestParam(value = "limit", defaultValue = "5") int limit) {
        if (limit < 1 || limit > 20) {
            return ResponseEntity.badRequest().body(Map.of("error", "Invalid limit", "detail", "limit must be between 1 and 20"));
        }
        if (exerciseRepository.getById(exerciseId).isEmpty()) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND)
                    .body(Map.of("error", "Exercise not found", "detail", exerciseId));
        }
        List<Exercise> alternatives = exerciseSelector.getAlternatives(exerciseId,
                equipment == null ? List.of() : equipment, limit);
        return ResponseEntity.ok(Map.of("exerciseId", exerciseId, "alternatives", alternatives));
    }
}
