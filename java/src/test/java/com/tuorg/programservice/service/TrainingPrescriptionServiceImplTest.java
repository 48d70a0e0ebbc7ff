package com.tuorg.programservice.service;

import com.tuorg.programservice.model.ProgramGoal;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class TrainingPrescriptionServiceImplTest {

    private final TrainingPrescriptionService service = new TrainingPrescriptionServiceImpl();

    @Test
    void strengthIsLowRepsLongRest() {
        assertThat(service.recommendedSets(ProgramGoal.STRENGTH, false)).isEqualTo(4);
        assertThat(service.recommendedReps(ProgramGoal.STRENGTH)).isEqualTo("3-5");
        assertThat(service.recommendedRestSeconds(ProgramGoal.STRENGTH)).isEqualTo(150);
    }

    @Test
    void enduranceAndFatLossUseHigherReps() {
        assertThat(service.recommendedReps(ProgramGoal.ENDURANCE)).isEqualTo("15-20");
        assertThat(service.recommendedSets(ProgramGoal.ENDURANCE, false)).isEqualTo(3);
        assertThat(service.recommendedReps(ProgramGoal.WEIGHT_LOSS)).isEqualTo("12-15");
        assertThat(service.recommendedRestSeconds(ProgramGoal.WEIGHT_LOSS)).isEqualTo(45);
    }

    @Test
    void deloadDropsOneSetButNeverBelowTwo() {
        assertThat(service.recommendedSets(ProgramGoal.HYPERTROPHY, true)).isEqualTo(3);
        assertThat(service.recommendedSets(ProgramGoal.GENERAL_FITNESS, true)).isEqualTo(2);
    }

    @Test
    void loadTextFollowsIntensity() {
        assertThat(service.recommendedLoad(82)).isEqualTo("~82% of 1RM");
        assertThat(service.recommendedLoad(0)).isEqualTo("Bodyweight or light load");
    }
}
