package org.edsim.triage;

import org.apache.log4j.Logger;
import org.edsim.model.Patient;
import org.edsim.model.PresentingCondition;
import org.edsim.model.TriageLevel;
import org.edsim.utils.StochasticSampler;

/**
 * TriageClassifier - assigns one of the five triage levels to a patient
 *
 * CLASSIFICATION
 * ==============
 * 1. Start from the population base weights (RED 0.1%, ORANGE 8.3%,
 *    YELLOW 17.9%, GREEN 62.7%, BLUE 11.0%)
 * 2. Multiply by the presenting condition's fixed multiplier vector
 * 3. Age extremes (under 5 or over 75) raise ORANGE x1.3 and YELLOW x1.2
 * 4. Renormalise and make one weighted draw
 *
 * Steps 2-3 are a pure table lookup, so the conditioned weights of a
 * (condition, age) pair are always the same; only step 4 draws randomness.
 * Incident victims carrying a forced level mix skip steps 1-3.
 */
public class TriageClassifier {

    private static final Logger logger = Logger.getLogger(TriageClassifier.class);

    private static final TriageLevel[] LEVELS = TriageLevel.values();

    private final StochasticSampler sampler;
    private final boolean conditionBias;

    public TriageClassifier(StochasticSampler sampler, boolean conditionBias) {
        this.sampler = sampler;
        this.conditionBias = conditionBias;
    }

    public TriageLevel classify(Patient patient) {
        double[] weights = patient.getForcedTriageMix() != null
                ? patient.getForcedTriageMix()
                : conditionedWeights(patient.getCondition(), patient.getAge());
        TriageLevel level = LEVELS[sampler.weightedIndex(weights)];
        if (logger.isDebugEnabled()) {
            logger.debug(String.format("TRIAGE: patientId=%s, condition=%s, age=%d, level=%s",
                    patient.getId(), patient.getCondition(), patient.getAge(), level));
        }
        return level;
    }

    /**
     * Normalised level weights for a condition and age, indexed RED..BLUE.
     */
    public double[] conditionedWeights(PresentingCondition condition, int age) {
        double[] weights = new double[LEVELS.length];
        double total = 0.0;
        for (TriageLevel level : LEVELS) {
            double w = level.getBaseWeight();
            if (conditionBias) {
                if (condition != null) {
                    w *= condition.getTriageMultiplier(level);
                }
                w *= ageMultiplier(level, age);
            }
            weights[level.ordinal()] = w;
            total += w;
        }
        for (int i = 0; i < weights.length; i++) {
            weights[i] /= total;
        }
        return weights;
    }

    static double ageMultiplier(TriageLevel level, int age) {
        if (age >= 5 && age <= 75) {
            return 1.0;
        }
        switch (level) {
            case ORANGE:
                return 1.3;
            case YELLOW:
                return 1.2;
            default:
                return 1.0;
        }
    }

    public boolean isConditionBias() {
        return conditionBias;
    }
}
