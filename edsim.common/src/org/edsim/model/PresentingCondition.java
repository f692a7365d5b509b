package org.edsim.model;

/**
 * Presenting complaints with their population frequency and the multipliers
 * they apply to the baseline triage weights (indexed RED..BLUE).
 */
public enum PresentingCondition {

    CHEST_PAIN("Chest pain", 0.07, new double[] {8.0, 3.0, 1.5, 0.7, 0.3}),
    TRAUMA("Trauma", 0.09, new double[] {3.0, 1.5, 1.3, 1.0, 0.6}),
    ABDOMINAL_PAIN("Abdominal pain", 0.10, new double[] {0.5, 1.2, 1.6, 1.0, 0.6}),
    FEVER("Fever", 0.09, new double[] {0.5, 0.8, 1.1, 1.0, 1.2}),
    HEADACHE("Headache", 0.06, new double[] {0.5, 1.2, 1.2, 1.0, 1.0}),
    DYSPNEA("Shortness of breath", 0.06, new double[] {6.0, 3.0, 1.5, 0.6, 0.3}),
    DIZZINESS("Dizziness", 0.05, new double[] {0.5, 1.0, 1.0, 1.0, 1.0}),
    WOUND("Laceration", 0.08, new double[] {0.5, 0.6, 1.0, 1.1, 1.2}),
    POISONING("Poisoning", 0.02, new double[] {4.0, 2.0, 1.5, 0.8, 0.5}),
    FRACTURE("Suspected fracture", 0.05, new double[] {0.5, 1.5, 2.0, 0.9, 0.3}),
    BURN("Burn", 0.02, new double[] {3.0, 1.8, 1.3, 0.9, 0.5}),
    ALLERGY("Allergic reaction", 0.03, new double[] {3.0, 1.5, 1.0, 1.0, 0.8}),
    GASTROENTERITIS("Gastroenteritis", 0.08, new double[] {0.2, 0.5, 0.8, 1.2, 1.2}),
    LOW_BACK_PAIN("Low back pain", 0.07, new double[] {0.1, 0.3, 0.7, 1.2, 1.3}),
    ANXIETY("Anxiety", 0.04, new double[] {0.1, 0.3, 0.6, 1.1, 1.6}),
    MINOR_COMPLAINT("Minor complaint", 0.09, new double[] {0.05, 0.1, 0.3, 1.0, 2.2});

    private final String description;
    private final double frequency;
    private final double[] triageMultipliers;

    PresentingCondition(String description, double frequency, double[] triageMultipliers) {
        this.description = description;
        this.frequency = frequency;
        this.triageMultipliers = triageMultipliers;
    }

    public String getDescription() {
        return description;
    }

    public double getFrequency() {
        return frequency;
    }

    public double getTriageMultiplier(TriageLevel level) {
        return triageMultipliers[level.ordinal()];
    }
}
