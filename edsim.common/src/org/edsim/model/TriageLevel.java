package org.edsim.model;

/**
 * Five-level Manchester-style triage scale. Rank 1 is the most urgent.
 * Each level carries its maximum recommended wait, the nominal consultation
 * time and the baseline population weight used when no condition bias applies.
 */
public enum TriageLevel {

    RED(1, "Resuscitation", 0, 30.0, 0.001),
    ORANGE(2, "Emergency", 10, 25.0, 0.083),
    YELLOW(3, "Urgent", 60, 15.0, 0.179),
    GREEN(4, "Less urgent", 120, 10.0, 0.627),
    BLUE(5, "Non urgent", 240, 5.0, 0.110);

    private final int rank;
    private final String description;
    private final int maxWaitMinutes;
    private final double nominalConsultationMinutes;
    private final double baseWeight;

    TriageLevel(int rank, String description, int maxWaitMinutes,
                double nominalConsultationMinutes, double baseWeight) {
        this.rank = rank;
        this.description = description;
        this.maxWaitMinutes = maxWaitMinutes;
        this.nominalConsultationMinutes = nominalConsultationMinutes;
        this.baseWeight = baseWeight;
    }

    public int getRank() {
        return rank;
    }

    public String getDescription() {
        return description;
    }

    public int getMaxWaitMinutes() {
        return maxWaitMinutes;
    }

    public double getNominalConsultationMinutes() {
        return nominalConsultationMinutes;
    }

    public double getBaseWeight() {
        return baseWeight;
    }

    /** RED and ORANGE are only treated at the reference hospital. */
    public boolean isMostSevereTier() {
        return rank <= 2;
    }

    public boolean isMoreUrgentThan(TriageLevel other) {
        return rank < other.rank;
    }

    /** Low-acuity levels that load shedding may divert. */
    public boolean isLowAcuity() {
        return rank >= 4;
    }

    public static TriageLevel fromRank(int rank) {
        for (TriageLevel level : values()) {
            if (level.rank == rank) {
                return level;
            }
        }
        throw new IllegalArgumentException("Unknown triage rank: " + rank);
    }
}
