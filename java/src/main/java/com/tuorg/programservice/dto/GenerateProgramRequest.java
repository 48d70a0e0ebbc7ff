package com.tuorg.programservice.dto;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

import java.util.List;

public class GenerateProgramRequest {
    @NotBlank
    public String goal;

    @NotNull
    @Min(1)
    @Max(52)
    public Integer durationWeeks;

    @NotNull
    @Min(1)
    @Max(7)
    public Integer sessionsPerWeek;

    // beginner | intermediate | advanced | elite; anything else plans as intermediate
    public String experienceLevel;

    public List<String> equipmentAvailable;

    @Size(max = 10)
    public List<String> limitations;

    public List<String> focusAreas;

    @Size(max = 500)
    public String preferences;

    public GenerateProgramRequest() {}
}
