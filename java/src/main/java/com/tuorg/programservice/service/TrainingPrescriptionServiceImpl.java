package com.tuorg.programservice.service;

import com.tuorg.programservice.model.ProgramGoal;
import org.springframework.stereotype.Service;

@Service
public class TrainingPrescriptionServiceImpl implements TrainingPrescriptionService {

    @Override
    public int recommendedSets(ProgramGoal goal, boolean deload) {
        int sets;
        switch (goal == null ? ProgramGoal.GENERAL_FITNESS : goal) {
            case STRENGTH:
            case HYPERTROPHY:
            case SPORT_SPECIFIC:
                sets = 4;
                break;
            default:
                sets = 3;
        }
        return deload ? Math.max(2, sets - 1) : sets;
    }

    @Override
    public String recommendedReps(ProgramGoal goal) {
        if (goal == null) return "8-12";
        switch (goal) {
            case STRENGTH: return "3-5";
            case HYPERTROPHY: return "8-12";
            case ENDURANCE: return "15-20";
            case WEIGHT_LOSS: return "12-15";
            case GENERAL_FITNESS: return "10-15";
            case SPORT_SPECIFIC: return "6-10";
            default: return "8-12";
        }
    }

    @Override
    public int recommendedRestSeconds(ProgramGoal goal) {
        if (goal == null) return 90;
        switch (goal) {
            case STRENGTH: return 150;
            case ENDURANCE:
            case GENERAL_FITNESS: return 60;
            case WEIGHT_LOSS: return 45;
            default: return 90; // hypertrophy, sport
        }
    }

    @Override
    public String recommendedLoad(int intensityPercentage) {
        if (intensityPercentage <= 0) return "Bodyweight or light load";
        return "~" + intensityPercentage + "% of 1RM";
    }
}
