package org.edsim.hospital;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.apache.log4j.Logger;
import org.edsim.engine.EventScheduler;
import org.edsim.logger.SimulationEventLogger;
import org.edsim.model.DemandContext;
import org.edsim.model.HospitalConfig;
import org.edsim.model.Patient;
import org.edsim.model.ResourceClass;
import org.edsim.places.ConsultationRoomPlace;
import org.edsim.places.FifoResourcePlace;

/**
 * Live state of one emergency department: its resource places, the patients
 * currently in its system, counters and statistics.
 *
 * The emergency flag is the union of the hospital's own critical flag
 * (saturation hysteresis) and the network-wide incident emergency.
 */
public class Hospital {

    private static final Logger logger = Logger.getLogger(Hospital.class);

    /** Finished patients kept for inspection; older ones are only counted. */
    public static final int RECENT_FINISHED_CAPACITY = 500;

    private final HospitalConfig config;
    private final boolean reference;

    private final FifoResourcePlace registration;
    private final FifoResourcePlace triage;
    private final ConsultationRoomPlace consultation;
    private final FifoResourcePlace observation;
    private final HospitalStatistics statistics;

    private final Map<String, Patient> activePatients = new LinkedHashMap<>();
    private final Deque<Patient> recentFinished = new ArrayDeque<>();
    private int finishedCount;

    private long patientSequence;
    private int arrivals;
    private int treated;
    private int admittedObservation;
    private int diversionsSent;
    private int diversionsReceived;
    private int slaBreaches;

    private boolean critical;
    private boolean incidentEmergency;
    private DemandContext demandContext;

    public Hospital(HospitalConfig config, boolean reference, double statisticsWindow,
                    EventScheduler scheduler, SimulationEventLogger eventLogger) {
        this.config = config;
        this.reference = reference;
        String id = config.getId();
        this.registration = new FifoResourcePlace(id, ResourceClass.REGISTRATION,
                config.getRegistrationDesks(), scheduler, eventLogger);
        this.triage = new FifoResourcePlace(id, ResourceClass.TRIAGE,
                config.getTriageStations(), scheduler, eventLogger);
        this.consultation = new ConsultationRoomPlace(id, config.getConsultationRooms(), scheduler, eventLogger);
        this.observation = new FifoResourcePlace(id, ResourceClass.OBSERVATION,
                config.getObservationBeds(), scheduler, eventLogger);
        this.statistics = new HospitalStatistics(statisticsWindow, config.getConsultationRooms());
        logger.info(String.format("HOSPITAL_CREATED: %s, reference=%b", config, reference));
    }

    // ========== Patient bookkeeping ==========

    public String nextPatientId() {
        return config.getId() + "-" + (++patientSequence);
    }

    /** A walk-in or incident patient entered this hospital's system. */
    public void admit(Patient patient, double time) {
        activePatients.put(patient.getId(), patient);
        arrivals++;
        statistics.recordArrival(time);
    }

    /** A patient diverted from another hospital reached this one. */
    public void receiveTransfer(Patient patient) {
        activePatients.put(patient.getId(), patient);
        diversionsReceived++;
    }

    /** A patient's outcome at this hospital is final. */
    public void finish(Patient patient) {
        activePatients.remove(patient.getId());
        if (recentFinished.size() == RECENT_FINISHED_CAPACITY) {
            recentFinished.removeFirst();
        }
        recentFinished.addLast(patient);
        finishedCount++;
    }

    public void recordTreated() {
        treated++;
    }

    public void recordAdmittedObservation() {
        admittedObservation++;
    }

    public void recordDiversionSent() {
        diversionsSent++;
    }

    public void recordSlaBreach() {
        slaBreaches++;
    }

    public Collection<Patient> getActivePatients() {
        return Collections.unmodifiableCollection(activePatients.values());
    }

    /** The most recently finished patients, oldest first. */
    public List<Patient> getFinishedPatients() {
        return Collections.unmodifiableList(new ArrayList<>(recentFinished));
    }

    public int getFinishedCount() {
        return finishedCount;
    }

    // ========== Emergency flags ==========

    public boolean isEmergencyActive() {
        return critical || incidentEmergency;
    }

    public boolean isCritical() {
        return critical;
    }

    public void setCritical(boolean critical) {
        this.critical = critical;
    }

    public boolean isIncidentEmergency() {
        return incidentEmergency;
    }

    public void setIncidentEmergency(boolean incidentEmergency) {
        this.incidentEmergency = incidentEmergency;
    }

    // ========== Accessors ==========

    public String getId() { return config.getId(); }
    public HospitalConfig getConfig() { return config; }
    public boolean isReference() { return reference; }
    public FifoResourcePlace getRegistration() { return registration; }
    public FifoResourcePlace getTriage() { return triage; }
    public ConsultationRoomPlace getConsultation() { return consultation; }
    public FifoResourcePlace getObservation() { return observation; }
    public HospitalStatistics getStatistics() { return statistics; }
    public int getArrivals() { return arrivals; }
    public int getTreated() { return treated; }
    public int getAdmittedObservation() { return admittedObservation; }
    public int getDiversionsSent() { return diversionsSent; }
    public int getDiversionsReceived() { return diversionsReceived; }
    public int getSlaBreaches() { return slaBreaches; }
    public DemandContext getDemandContext() { return demandContext; }
    public void setDemandContext(DemandContext demandContext) { this.demandContext = demandContext; }

    @Override
    public String toString() {
        return String.format("Hospital[%s] active=%d, %s, %s, %s, %s", getId(), activePatients.size(),
                registration, triage, consultation, observation);
    }
}
