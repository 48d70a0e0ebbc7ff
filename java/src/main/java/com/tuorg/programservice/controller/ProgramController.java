package com.tuorg.programservice.controller;

import com.tuorg.programservice.dto.GenerateProgramRequest;
import com.tuorg.programservice.dto.GenerateProgramResponse;
import com.tuorg.programservice.service.ProgramGenerator;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

@RestController
@RequestMapping("/api/programs")
public class ProgramController {

    private final Logger log = LoggerFactory.getLogger(ProgramController.class);
    private final ProgramGenerator generator;

    public ProgramController(ProgramGenerator generator) {
        this.generator = generator;
    }

    @PostMapping("/generate")
    public ResponseEntity<?> generate(@RequestHeader(value = "X-USER-ID", required = false) String userId,
                                      @Valid @RequestBody GenerateProgramRequest req) {
        if (userId == null || userId.isBlank()) {
            return ResponseEntity.badRequest().body(Map.of("error", "Missing user", "detail", "X-USER-ID header is required"));
        }
        GenerateProgramResponse resp = generator.generate(req, userId.trim());
        log.debug("Generated program {} for user {}", resp.program.getId(), userId);
        return ResponseEntity.status(HttpStatus.CREATED).body(resp);
    }

    @GetMapping("/{programId}")
    public ResponseEntity<?> get(@PathVariable String programId) {
        return generator.getProgram(programId)
                .<ResponseEntity<?>>map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.status(HttpStatus.NOT_FOUND)
                        .body(Map.of("error", "Program not found", "detail", programId)));
    }
}
