package com.tuorg.programservice.repository.memory;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tuorg.programservice.model.ExperienceLevel;
import com.tuorg.programservice.model.ProgramGoal;
import com.tuorg.programservice.model.ProgramTemplate;
import com.tuorg.programservice.repository.TemplateRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.core.io.ClassPathResource;
import org.springframework.stereotype.Repository;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Templates seeded from {@code catalog/templates.json}. Usage counters live
 * in memory only.
 */
@Repository
public class InMemoryTemplateRepository implements TemplateRepository {

    private static final String LOCATION = "catalog/templates.json";
    private static final int DURATION_WINDOW = 2;

    private final Logger log = LoggerFactory.getLogger(InMemoryTemplateRepository.class);
    private final Map<String, ProgramTemplate> templates = new LinkedHashMap<>();

    public InMemoryTemplateRepository() {
    }

    @Autowired
    public InMemoryTemplateRepository(ObjectMapper mapper) {
        try (InputStream in = new ClassPathResource(LOCATION).getInputStream()) {
            List<ProgramTemplate> seed = mapper.readValue(in, new TypeReference<List<ProgramTemplate>>() {});
            seed.forEach(this::save);
            log.info("Loaded {} program templates", templates.size());
        } catch (IOException e) {
            throw new UncheckedIOException("Could not read " + LOCATION, e);
        }
    }

    public synchronized ProgramTemplate save(ProgramTemplate template) {
        if (template.getId() == null) template.setId(UUID.randomUUID().toString());
        templates.put(template.getId(), new ProgramTemplate(template));
        return template;
    }

    /** Same goal and level, duration within two weeks when given, most used first. */
    @Override
    public synchronized List<ProgramTemplate> getByCriteria(ProgramGoal goal, ExperienceLevel experience,
                                                            Integer durationWeeks) {
        List<ProgramTemplate> matches = new ArrayList<>();
        for (ProgramTemplate t : templates.values()) {
            if (t.getGoal() != goal || t.getExperienceLevel() != experience) continue;
            if (durationWeeks != null && Math.abs(t.getDurationWeeks() - durationWeeks) > DURATION_WINDOW) continue;
            matches.add(new ProgramTemplate(t));
        }
        matches.sort(Comparator.comparingInt(ProgramTemplate::getUsageCount).reversed());
        return matches;
    }

    @Override
    public synchronized Optional<ProgramTemplate> getById(String templateId) {
        ProgramTemplate t = templates.get(templateId);
        return t == null ? Optional.empty() : Optional.of(new ProgramTemplate(t));
    }

    @Override
    public synchronized void incrementUsageCount(String templateId) {
        ProgramTemplate t = templates.get(templateId);
        if (t == null) throw new IllegalArgumentException("Unknown template " + templateId);
        t.setUsageCount(t.getUsageCount() + 1);
    }
}
