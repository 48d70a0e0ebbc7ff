package com.tuorg.programservice.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Tunables for program generation. The scoring weights and "close match"
 * tolerances are calibration values, not invariants.
 */
@ConfigurationProperties(prefix = "program.generation")
public class GenerationProperties {

    /** Width of the pool that runs repository and LLM calls. */
    private int workerPoolSize = 4;

    /** Max candidates requested from the exercise lookup per slot or workout. */
    private int exerciseSearchLimit = 50;

    private TemplateScoring templateScoring = new TemplateScoring();
    private ExerciseScoring exerciseScoring = new ExerciseScoring();

    public int getWorkerPoolSize() { return workerPoolSize; }
    public void setWorkerPoolSize(int workerPoolSize) { this.workerPoolSize = workerPoolSize; }

    public int getExerciseSearchLimit() { return exerciseSearchLimit; }
    public void setExerciseSearchLimit(int exerciseSearchLimit) { this.exerciseSearchLimit = exerciseSearchLimit; }

    public TemplateScoring getTemplateScoring() { return templateScoring; }
    public void setTemplateScoring(TemplateScoring templateScoring) { this.templateScoring = templateScoring; }

    public ExerciseScoring getExerciseScoring() { return exerciseScoring; }
    public void setExerciseScoring(ExerciseScoring exerciseScoring) { this.exerciseScoring = exerciseScoring; }

    public static class TemplateScoring {
        private double base = 20.0;
        private double sessionsExact = 30.0;
        private double sessionsClose = 15.0;
        private int sessionsTolerance = 1;
        private double durationExact = 25.0;
        private double durationClose = 10.0;
        private int durationTolerance = 2;
        private double popularityMax = 15.0;
        private int popularityCap = 100;

        public double getBase() { return base; }
        public void setBase(double base) { this.base = base; }

        public double getSessionsExact() { return sessionsExact; }
        public void setSessionsExact(double sessionsExact) { this.sessionsExact = sessionsExact; }

        public double getSessionsClose() { return sessionsClose; }
        public void setSessionsClose(double sessionsClose) { this.sessionsClose = sessionsClose; }

        public int getSessionsTolerance() { return sessionsTolerance; }
        public void setSessionsTolerance(int sessionsTolerance) { this.sessionsTolerance = sessionsTolerance; }

        public double getDurationExact() { return durationExact; }
        public void setDurationExact(double durationExact) { this.durationExact = durationExact; }

        public double getDurationClose() { return durationClose; }
        public void setDurationClose(double durationClose) { this.durationClose = durationClose; }

        public int getDurationTolerance() { return durationTolerance; }
        public void setDurationTolerance(int durationTolerance) { this.durationTolerance = durationTolerance; }

        public double getPopularityMax() { return popularityMax; }
        public void setPopularityMax(double popularityMax) { this.popularityMax = popularityMax; }

        public int getPopularityCap() { return popularityCap; }
        public void setPopularityCap(int popularityCap) { this.popularityCap = popularityCap; }
    }

    public static class ExerciseScoring {
        private double muscleOverlap = 0.40;
        private double categoryMatch = 0.30;
        private double movementPatternMatch = 0.20;
        private double preferredEquipment = 0.10;
        private double oneRepMaxMatch = 0.05;
        private double compoundBonus = 0.05;

        public double getMuscleOverlap() { return muscleOverlap; }
        public void setMuscleOverlap(double muscleOverlap) { this.muscleOverlap = muscleOverlap; }

        public double getCategoryMatch() { return categoryMatch; }
        public void setCategoryMatch(double categoryMatch) { this.categoryMatch = categoryMatch; }

        public double getMovementPatternMatch() { return movementPatternMatch; }
        public void setMovementPatternMatch(double movementPatternMatch) { this.movementPatternMatch = movementPatternMatch; }

        public double getPreferredEquipment() { return preferredEquipment; }
        public void setPreferredEquipment(double preferredEquipment) { this.preferredEquipment = preferredEquipment; }

        public double getOneRepMaxMatch() { return oneRepMaxMatch; }
        public void setOneRepMaxMatch(double oneRepMaxMatch) { this.oneRepMaxMatch = oneRepMaxMatch; }

        public double getCompoundBonus() { return compoundBonus; }
        public void setCompoundBonus(double compoundBonus) { this.compoundBonus = compoundBonus; }
    }
}
