package org.edsim.events;

import org.edsim.json.JsonEventBuilder;
import org.json.simple.JSONObject;

/**
 * Point-in-time view of one hospital, sampled by the metrics aggregator.
 * Immutable; built with {@link Builder}.
 */
public final class HospitalSnapshot {

    private final String hospitalId;
    private final double timestamp;

    private final int registrationOccupied;
    private final int registrationCapacity;
    private final int triageOccupied;
    private final int triageCapacity;
    private final int consultationOccupied;
    private final int consultationCapacity;
    private final int observationOccupied;
    private final int observationCapacity;

    private final int registrationQueue;
    private final int triageQueue;
    private final int consultationQueue;
    private final int observationQueue;

    private final double meanRegistrationWait;
    private final double meanTriageWait;
    private final double meanConsultationWait;
    private final double meanConsultationService;

    private final int arrivalsLastHour;
    private final int treatedLastHour;
    private final double saturation;
    private final boolean emergencyActive;
    private final int diversionsSent;
    private final int diversionsReceived;
    private final int slaBreaches;

    private HospitalSnapshot(Builder b) {
        this.hospitalId = b.hospitalId;
        this.timestamp = b.timestamp;
        this.registrationOccupied = b.registrationOccupied;
        this.registrationCapacity = b.registrationCapacity;
        this.triageOccupied = b.triageOccupied;
        this.triageCapacity = b.triageCapacity;
        this.consultationOccupied = b.consultationOccupied;
        this.consultationCapacity = b.consultationCapacity;
        this.observationOccupied = b.observationOccupied;
        this.observationCapacity = b.observationCapacity;
        this.registrationQueue = b.registrationQueue;
        this.triageQueue = b.triageQueue;
        this.consultationQueue = b.consultationQueue;
        this.observationQueue = b.observationQueue;
        this.meanRegistrationWait = b.meanRegistrationWait;
        this.meanTriageWait = b.meanTriageWait;
        this.meanConsultationWait = b.meanConsultationWait;
        this.meanConsultationService = b.meanConsultationService;
        this.arrivalsLastHour = b.arrivalsLastHour;
        this.treatedLastHour = b.treatedLastHour;
        this.saturation = b.saturation;
        this.emergencyActive = b.emergencyActive;
        this.diversionsSent = b.diversionsSent;
        this.diversionsReceived = b.diversionsReceived;
        this.slaBreaches = b.slaBreaches;
    }

    public static Builder builder(String hospitalId, double timestamp) {
        return new Builder(hospitalId, timestamp);
    }

    private static double ratio(int occupied, int capacity) {
        return capacity == 0 ? 0.0 : (double) occupied / capacity;
    }

    public String getHospitalId() { return hospitalId; }
    public double getTimestamp() { return timestamp; }
    public int getRegistrationOccupied() { return registrationOccupied; }
    public int getRegistrationCapacity() { return registrationCapacity; }
    public int getTriageOccupied() { return triageOccupied; }
    public int getTriageCapacity() { return triageCapacity; }
    public int getConsultationOccupied() { return consultationOccupied; }
    public int getConsultationCapacity() { return consultationCapacity; }
    public int getObservationOccupied() { return observationOccupied; }
    public int getObservationCapacity() { return observationCapacity; }
    public double getRegistrationOccupancy() { return ratio(registrationOccupied, registrationCapacity); }
    public double getTriageOccupancy() { return ratio(triageOccupied, triageCapacity); }
    public double getConsultationOccupancy() { return ratio(consultationOccupied, consultationCapacity); }
    public double getObservationOccupancy() { return ratio(observationOccupied, observationCapacity); }
    public int getRegistrationQueue() { return registrationQueue; }
    public int getTriageQueue() { return triageQueue; }
    public int getConsultationQueue() { return consultationQueue; }
    public int getObservationQueue() { return observationQueue; }
    public double getMeanRegistrationWait() { return meanRegistrationWait; }
    public double getMeanTriageWait() { return meanTriageWait; }
    public double getMeanConsultationWait() { return meanConsultationWait; }
    public double getMeanConsultationService() { return meanConsultationService; }
    public int getArrivalsLastHour() { return arrivalsLastHour; }
    public int getTreatedLastHour() { return treatedLastHour; }
    public double getSaturation() { return saturation; }
    public boolean isEmergencyActive() { return emergencyActive; }
    public int getDiversionsSent() { return diversionsSent; }
    public int getDiversionsReceived() { return diversionsReceived; }
    public int getSlaBreaches() { return slaBreaches; }

    public JSONObject toJSONObject() {
        return new JsonEventBuilder()
                .put("hospital_id", hospitalId)
                .put("timestamp", timestamp)
                .put("registration_occupied", registrationOccupied)
                .put("registration_capacity", registrationCapacity)
                .put("registration_occupancy", getRegistrationOccupancy())
                .put("triage_occupied", triageOccupied)
                .put("triage_capacity", triageCapacity)
                .put("triage_occupancy", getTriageOccupancy())
                .put("consultation_occupied", consultationOccupied)
                .put("consultation_capacity", consultationCapacity)
                .put("consultation_occupancy", getConsultationOccupancy())
                .put("observation_occupied", observationOccupied)
                .put("observation_capacity", observationCapacity)
                .put("observation_occupancy", getObservationOccupancy())
                .put("registration_queue", registrationQueue)
                .put("triage_queue", triageQueue)
                .put("consultation_queue", consultationQueue)
                .put("observation_queue", observationQueue)
                .put("mean_registration_wait", meanRegistrationWait)
                .put("mean_triage_wait", meanTriageWait)
                .put("mean_consultation_wait", meanConsultationWait)
                .put("mean_consultation_service", meanConsultationService)
                .put("arrivals_last_hour", arrivalsLastHour)
                .put("treated_last_hour", treatedLastHour)
                .put("saturation", saturation)
                .put("emergency_active", emergencyActive)
                .put("diversions_sent", diversionsSent)
                .put("diversions_received", diversionsReceived)
                .put("sla_breaches", slaBreaches)
                .toJSONObject();
    }

    public String toJson() {
        return toJSONObject().toJSONString();
    }

    @Override
    public String toString() {
        return String.format("Snapshot[%s t=%.1f, consult=%d/%d, queue=%d, saturation=%.3f, emergency=%b]",
                hospitalId, timestamp, consultationOccupied, consultationCapacity,
                consultationQueue, saturation, emergencyActive);
    }

    // ========== Builder ==========

    public static final class Builder {
        private final String hospitalId;
        private final double timestamp;
        private int registrationOccupied;
        private int registrationCapacity;
        private int triageOccupied;
        private int triageCapacity;
        private int consultationOccupied;
        private int consultationCapacity;
        private int observationOccupied;
        private int observationCapacity;
        private int registrationQueue;
        private int triageQueue;
        private int consultationQueue;
        private int observationQueue;
        private double meanRegistrationWait;
        private double meanTriageWait;
        private double meanConsultationWait;
        private double meanConsultationService;
        private int arrivalsLastHour;
        private int treatedLastHour;
        private double saturation;
        private boolean emergencyActive;
        private int diversionsSent;
        private int diversionsReceived;
        private int slaBreaches;

        private Builder(String hospitalId, double timestamp) {
            this.hospitalId = hospitalId;
            this.timestamp = timestamp;
        }

        public Builder registration(int occupied, int capacity, int queue) {
            this.registrationOccupied = occupied;
            this.registrationCapacity = capacity;
            this.registrationQueue = queue;
            return this;
        }

        public Builder triage(int occupied, int capacity, int queue) {
            this.triageOccupied = occupied;
            this.triageCapacity = capacity;
            this.triageQueue = queue;
            return this;
        }

        public Builder consultation(int occupied, int capacity, int queue) {
            this.consultationOccupied = occupied;
            this.consultationCapacity = capacity;
            this.consultationQueue = queue;
            return this;
        }

        public Builder observation(int occupied, int capacity, int queue) {
            this.observationOccupied = occupied;
            this.observationCapacity = capacity;
            this.observationQueue = queue;
            return this;
        }

        public Builder waits(double registration, double triage, double consultation) {
            this.meanRegistrationWait = registration;
            this.meanTriageWait = triage;
            this.meanConsultationWait = consultation;
            return this;
        }

        public Builder meanConsultationService(double minutes) {
            this.meanConsultationService = minutes;
            return this;
        }

        public Builder throughput(int arrivalsLastHour, int treatedLastHour) {
            this.arrivalsLastHour = arrivalsLastHour;
            this.treatedLastHour = treatedLastHour;
            return this;
        }

        public Builder saturation(double saturation, boolean emergencyActive) {
            this.saturation = saturation;
            this.emergencyActive = emergencyActive;
            return this;
        }

        public Builder diversions(int sent, int received) {
            this.diversionsSent = sent;
            this.diversionsReceived = received;
            return this;
        }

        public Builder slaBreaches(int slaBreaches) {
            this.slaBreaches = slaBreaches;
            return this;
        }

        public HospitalSnapshot build() {
            return new HospitalSnapshot(this);
        }
    }
}
