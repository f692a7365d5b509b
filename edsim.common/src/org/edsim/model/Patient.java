package org.edsim.model;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * A synthetic patient moving through the emergency department.
 *
 * Only the patient flow process mutates a patient; every other component
 * reads it. Besides the clinical attributes the patient keeps the simulated
 * time at which each stage was entered and an acquire/release ledger per
 * resource class, used to verify that no slot is ever leaked.
 */
public class Patient {

    private final String id;
    private final String originHospitalId;
    private final double arrivalTime;
    private final int age;
    private final Sex sex;
    private final PresentingCondition condition;
    private final PatientSource source;
    private final String incidentId;

    private TriageLevel triageLevel;
    private double[] forcedTriageMix;
    private PatientStage stage;
    private Outcome outcome = Outcome.IN_SYSTEM;
    private String currentHospitalId;
    private String destinationHospitalId;
    private int consultationRoom = -1;
    private boolean divertedIn;

    private final Map<PatientStage, Double> stageEntries = new EnumMap<>(PatientStage.class);
    private final Map<ResourceClass, Integer> acquisitions = new EnumMap<>(ResourceClass.class);
    private final Map<ResourceClass, Integer> releases = new EnumMap<>(ResourceClass.class);

    public Patient(String id, String originHospitalId, double arrivalTime, int age, Sex sex,
                   PresentingCondition condition, PatientSource source, String incidentId) {
        this.id = id;
        this.originHospitalId = originHospitalId;
        this.currentHospitalId = originHospitalId;
        this.arrivalTime = arrivalTime;
        this.age = age;
        this.sex = sex;
        this.condition = condition;
        this.source = source;
        this.incidentId = incidentId;
        enterStage(PatientStage.ARRIVED, arrivalTime);
    }

    // ========== Stage tracking ==========

    public void enterStage(PatientStage next, double time) {
        this.stage = next;
        stageEntries.put(next, time);
    }

    public PatientStage getStage() {
        return stage;
    }

    /** Simulated minute at which the stage was entered, or null if never entered. */
    public Double getStageEntry(PatientStage s) {
        return stageEntries.get(s);
    }

    public Map<PatientStage, Double> getStageEntries() {
        return Collections.unmodifiableMap(stageEntries);
    }

    public boolean isTerminal() {
        return stage != null && stage.isTerminal();
    }

    // ========== Resource ledger ==========

    public void recordAcquire(ResourceClass resource) {
        acquisitions.merge(resource, 1, Integer::sum);
    }

    public void recordRelease(ResourceClass resource) {
        releases.merge(resource, 1, Integer::sum);
    }

    public int getAcquireCount(ResourceClass resource) {
        return acquisitions.getOrDefault(resource, 0);
    }

    public int getReleaseCount(ResourceClass resource) {
        return releases.getOrDefault(resource, 0);
    }

    public boolean isLedgerBalanced() {
        for (ResourceClass rc : ResourceClass.values()) {
            if (getAcquireCount(rc) != getReleaseCount(rc)) {
                return false;
            }
        }
        return true;
    }

    // ========== Accessors ==========

    public String getId() {
        return id;
    }

    public String getOriginHospitalId() {
        return originHospitalId;
    }

    public double getArrivalTime() {
        return arrivalTime;
    }

    public int getAge() {
        return age;
    }

    public Sex getSex() {
        return sex;
    }

    public PresentingCondition getCondition() {
        return condition;
    }

    public PatientSource getSource() {
        return source;
    }

    public String getIncidentId() {
        return incidentId;
    }

    public TriageLevel getTriageLevel() {
        return triageLevel;
    }

    public void setTriageLevel(TriageLevel triageLevel) {
        this.triageLevel = triageLevel;
    }

    public double[] getForcedTriageMix() {
        return forcedTriageMix;
    }

    public void setForcedTriageMix(double[] forcedTriageMix) {
        this.forcedTriageMix = forcedTriageMix;
    }

    public Outcome getOutcome() {
        return outcome;
    }

    public void setOutcome(Outcome outcome) {
        this.outcome = outcome;
    }

    public String getCurrentHospitalId() {
        return currentHospitalId;
    }

    public String getDestinationHospitalId() {
        return destinationHospitalId;
    }

    /** Redirects the patient; the destination becomes the current hospital on transfer-in. */
    public void divertTo(String destinationHospitalId) {
        this.destinationHospitalId = destinationHospitalId;
    }

    public void transferredIn(String hospitalId) {
        this.currentHospitalId = hospitalId;
        this.divertedIn = true;
    }

    public boolean isDivertedIn() {
        return divertedIn;
    }

    public int getConsultationRoom() {
        return consultationRoom;
    }

    public void setConsultationRoom(int consultationRoom) {
        this.consultationRoom = consultationRoom;
    }

    @Override
    public String toString() {
        return String.format("Patient[%s, age=%d, %s, level=%s, stage=%s, outcome=%s]",
                id, age, condition, triageLevel, stage, outcome);
    }
}
