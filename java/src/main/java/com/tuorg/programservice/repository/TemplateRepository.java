package com.tuorg.programservice.repository;

import com.tuorg.programservice.model.ExperienceLevel;
import com.tuorg.programservice.model.ProgramGoal;
import com.tuorg.programservice.model.ProgramTemplate;

import java.util.List;
import java.util.Optional;

public interface TemplateRepository {

    /** Candidates for a goal and level; {@code durationWeeks} may be null. */
    List<ProgramTemplate> getByCriteria(ProgramGoal goal, ExperienceLevel experience, Integer durationWeeks);

    Optional<ProgramTemplate> getById(String templateId);

    void incrementUsageCount(String templateId);
}
