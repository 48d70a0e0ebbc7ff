package com.tuorg.programservice.repository.memory;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tuorg.programservice.model.Exercise;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.core.io.ClassPathResource;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.List;
import java.util.function.Supplier;

/**
 * Lazily loaded exercise catalog. Loaded once on first use and kept until
 * {@link #invalidate()}.
 */
@Component
public class ExerciseCatalogCache {

    static final String DEFAULT_LOCATION = "catalog/exercises.json";

    private final Logger log = LoggerFactory.getLogger(ExerciseCatalogCache.class);
    private final Supplier<List<Exercise>> loader;
    private final Object lock = new Object();
    private volatile List<Exercise> exercises;

    @Autowired
    public ExerciseCatalogCache(ObjectMapper mapper) {
        this(() -> readClasspath(mapper, DEFAULT_LOCATION));
    }

    public ExerciseCatalogCache(Supplier<List<Exercise>> loader) {
        this.loader = loader;
    }

    public static ExerciseCatalogCache of(List<Exercise> exercises) {
        List<Exercise> copy = List.copyOf(exercises);
        return new ExerciseCatalogCache(() -> copy);
    }

    public List<Exercise> get() {
        List<Exercise> current = exercises;
        if (current != null) return current;
        synchronized (lock) {
            if (exercises == null) {
                exercises = List.copyOf(loader.get());
                log.info("Exercise catalog loaded: {} exercises", exercises.size());
            }
            return exercises;
        }
    }

    public void invalidate() {
        synchronized (lock) {
            exercises = null;
        }
    }

    static List<Exercise> readClasspath(ObjectMapper mapper, String location) {
        try (InputStream in = new ClassPathResource(location).getInputStream()) {
            return mapper.readValue(in, new TypeReference<List<Exercise>>() {});
        } catch (IOException e) {
            throw new UncheckedIOException("Could not read exercise catalog " + location, e);
        }
    }
}
