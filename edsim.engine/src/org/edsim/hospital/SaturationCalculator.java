package org.edsim.hospital;

/**
 * Saturation index of a hospital:
 * <pre>
 *   w_c * consultationOccupancy + w_o * observationOccupancy + w_q * (consultationQueue / consultationCapacity)
 * </pre>
 * Non-negative weights keep it monotonically non-decreasing in each input.
 * It is not clamped: a long queue pushes it above 1.0.
 */
public class SaturationCalculator {

    private final double consultationWeight;
    private final double observationWeight;
    private final double queueWeight;

    public SaturationCalculator(double consultationWeight, double observationWeight, double queueWeight) {
        if (consultationWeight < 0.0 || observationWeight < 0.0 || queueWeight < 0.0) {
            throw new IllegalArgumentException("Saturation weights must not be negative");
        }
        this.consultationWeight = consultationWeight;
        this.observationWeight = observationWeight;
        this.queueWeight = queueWeight;
    }

    public double compute(double consultationOccupancy, double observationOccupancy, double queueRatio) {
        return consultationWeight * consultationOccupancy
                + observationWeight * observationOccupancy
                + queueWeight * queueRatio;
    }

    public double compute(Hospital hospital) {
        int rooms = hospital.getConsultation().getCapacity();
        return compute(
                hospital.getConsultation().getOccupancy(),
                hospital.getObservation().getOccupancy(),
                (double) hospital.getConsultation().getQueueLength() / rooms);
    }

    public double getConsultationWeight() { return consultationWeight; }
    public double getObservationWeight() { return observationWeight; }
    public double getQueueWeight() { return queueWeight; }
}
