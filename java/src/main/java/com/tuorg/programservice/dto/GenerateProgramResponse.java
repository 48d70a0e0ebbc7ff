package com.tuorg.programservice.dto;

import com.tuorg.programservice.model.TrainingProgram;

import java.util.ArrayList;
import java.util.List;

public class GenerateProgramResponse {
    public TrainingProgram program;
    public GenerationMetadata generationMetadata;
    public List<String> suggestions = new ArrayList<>();

    public GenerateProgramResponse() {}

    public GenerateProgramResponse(TrainingProgram program, GenerationMetadata metadata, List<String> suggestions) {
        this.program = program;
        this.generationMetadata = metadata;
        this.suggestions = suggestions;
    }

    public static class GenerationMetadata {
        public String templateId;
        public String templateName;
        public String periodizationModel;
        public double generationTimeSeconds;
        public boolean llmUsed;
        public int llmFallbacks;
        public boolean validationPassed;
        public int warningCount;
        public int placeholderCount;
    }
}
