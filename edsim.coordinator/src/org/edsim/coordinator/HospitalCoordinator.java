package org.edsim.coordinator;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.apache.log4j.Logger;
import org.edsim.config.SimulationConfig;
import org.edsim.coordinator.control.ControlInbox;
import org.edsim.coordinator.incident.HospitalLoad;
import org.edsim.coordinator.incident.IncidentAllocator;
import org.edsim.engine.EventScheduler;
import org.edsim.engine.SimulationContext;
import org.edsim.events.DiversionEvent;
import org.edsim.events.EmergencyEvent;
import org.edsim.events.IncidentEvent;
import org.edsim.events.SimulationEvent;
import org.edsim.exceptions.InvalidInputException;
import org.edsim.flow.DiversionHandler;
import org.edsim.flow.PatientFlowProcess;
import org.edsim.generator.PatientGenerator;
import org.edsim.hospital.Hospital;
import org.edsim.model.DiversionReason;
import org.edsim.model.DiversionRecord;
import org.edsim.model.Incident;
import org.edsim.model.Patient;
import org.edsim.model.TriageLevel;
import org.edsim.places.SlotRequest;
import org.edsim.utils.GeoUtils;

/**
 * HospitalCoordinator - network-level policy over all hospitals
 *
 * RESPONSIBILITIES
 * ================
 * - Severity diversion: RED/ORANGE patients triaged at a non-reference
 *   hospital are sent to the reference hospital, entering its consultation
 *   queue after the estimated transfer time.
 * - Critical flag per hospital with hysteresis: declared when saturation
 *   rises above the high threshold, retracted only when it falls below the
 *   low threshold.
 * - Incidents: victims split across hospitals by distance, saturation and
 *   wait; a network-wide emergency stays declared while any incident is active.
 * - Optional auto-scaling: elastic hospitals borrow doctors from a shared
 *   pool while saturated and return them once demand falls.
 * - Optional load shedding: waiting GREEN/BLUE patients of a critical
 *   hospital move to the least saturated hospital below the low threshold.
 * - Runtime inputs: the control inbox is drained at every tick.
 *
 * All of this runs on the simulation thread.
 */
public class HospitalCoordinator implements DiversionHandler {

    private static final Logger logger = Logger.getLogger(HospitalCoordinator.class);

    private final SimulationContext context;
    private final SimulationConfig config;
    private final EventScheduler scheduler;
    private final IncidentAllocator allocator;
    private final StaffingController staffingController;
    private final ControlInbox inbox = new ControlInbox();
    private final DiversionStatistics diversionStatistics = new DiversionStatistics();

    private final Map<String, PatientGenerator> generators = new LinkedHashMap<>();
    private final Map<String, Incident> activeIncidents = new LinkedHashMap<>();
    private final Map<String, Double> lastSaturation = new LinkedHashMap<>();

    private boolean started;
    private int incidentsIngested;
    private int incidentsResolved;
    private int patientsInTransit;

    public HospitalCoordinator(SimulationContext context) {
        this.context = context;
        this.config = context.getConfig();
        this.scheduler = context.getScheduler();
        this.allocator = new IncidentAllocator(config.getDistanceWeight(), config.getSaturationWeight(),
                config.getWaitWeight());
        this.staffingController = new StaffingController(context);
    }

    /** Makes a hospital's generator available for incident victims. */
    public void registerGenerator(PatientGenerator generator) {
        generators.put(generator.getHospital().getId(), generator);
    }

    // ========== Periodic tick ==========

    public void start() {
        if (started) {
            return;
        }
        started = true;
        scheduleTick(0.0);
    }

    private void scheduleTick(double delay) {
        scheduler.schedule(delay, "coordinator-tick", new Runnable() {
            @Override
            public void run() {
                tick();
                scheduleTick(config.getCoordinatorIntervalMinutes());
            }
        });
    }

    /** One coordination round: inputs, saturation flags, optional auto-scaling and load shedding. */
    public void tick() {
        inbox.drain(this);
        for (Hospital hospital : context.getHospitals()) {
            double saturation = context.getSaturationCalculator().compute(hospital);
            lastSaturation.put(hospital.getId(), saturation);
            updateCriticalFlag(hospital, saturation);
            if (config.isAutoScaling()) {
                staffingController.autoScale(hospital, saturation);
            }
        }
        if (config.isLoadShedding()) {
            for (Hospital hospital : context.getHospitals()) {
                if (hospital.isCritical()) {
                    shedLoad(hospital);
                }
            }
        }
    }

    /**
     * Applies the hysteresis band to one hospital.
     *
     * @return true if the flag changed
     */
    public boolean updateCriticalFlag(Hospital hospital, double saturation) {
        double now = scheduler.now();
        if (!hospital.isCritical() && saturation > config.getHighThreshold()) {
            hospital.setCritical(true);
            logger.warn(String.format("EMERGENCY_DECLARED: hospital=%s, saturation=%.3f, t=%.2f",
                    hospital.getId(), saturation, now));
            context.getPublisher().publish(EmergencyEvent.declared(hospital.getId(), now, saturation, "SATURATION"));
            return true;
        }
        if (hospital.isCritical() && saturation < config.getLowThreshold()) {
            hospital.setCritical(false);
            logger.info(String.format("EMERGENCY_RETRACTED: hospital=%s, saturation=%.3f, t=%.2f",
                    hospital.getId(), saturation, now));
            context.getPublisher().publish(EmergencyEvent.retracted(hospital.getId(), now, saturation, "SATURATION"));
            return true;
        }
        return false;
    }

    // ========== Diversion ==========

    @Override
    public void divert(Patient patient, Hospital origin, DiversionReason reason) {
        Hospital destination = reason == DiversionReason.SEVERITY
                ? context.getReferenceHospital()
                : leastSaturatedBelowLow(origin);
        if (destination == null) {
            // shedding only picks patients once a destination exists
            throw new IllegalStateException("No destination for " + patient.getId() + " from " + origin.getId());
        }
        transfer(patient, origin, destination, reason);
    }

    private void transfer(final Patient patient, Hospital origin, final Hospital destination, DiversionReason reason) {
        double now = scheduler.now();
        double transferMinutes = GeoUtils.travelMinutes(origin.getConfig().getLocation(),
                destination.getConfig().getLocation(), config.getAmbulanceSpeedKmh(), config.getMinTransferMinutes());
        patient.divertTo(destination.getId());
        DiversionRecord record = new DiversionRecord(patient.getId(), origin.getId(), destination.getId(),
                patient.getTriageLevel(), reason, now, transferMinutes);
        diversionStatistics.record(record);
        logger.info(String.format("DIVERSION: %s", record));
        context.getPublisher().publish(new DiversionEvent(record));

        final HospitalCoordinator handler = this;
        patientsInTransit++;
        scheduler.schedule(transferMinutes, "transfer " + patient.getId(), new Runnable() {
            @Override
            public void run() {
                patientsInTransit--;
                PatientFlowProcess.transferIn(context, destination, patient, handler);
            }
        });
    }

    /**
     * Least saturated hospital other than the origin whose saturation is below
     * the low threshold; earlier configuration order wins ties. Null if none.
     */
    Hospital leastSaturatedBelowLow(Hospital origin) {
        Hospital best = null;
        double bestSaturation = Double.MAX_VALUE;
        for (Hospital candidate : context.getHospitals()) {
            if (candidate == origin) {
                continue;
            }
            double saturation = context.getSaturationCalculator().compute(candidate);
            if (saturation < config.getLowThreshold() && saturation < bestSaturation) {
                best = candidate;
                bestSaturation = saturation;
            }
        }
        return best;
    }

    /**
     * Moves up to the configured batch of waiting low-acuity patients out of
     * a critical hospital's consultation queue. BLUE goes before GREEN and,
     * within a level, the most recent arrival in the queue goes first.
     *
     * @return number of patients diverted
     */
    int shedLoad(Hospital hospital) {
        List<SlotRequest> candidates = new ArrayList<>();
        for (SlotRequest request : hospital.getConsultation().getWaitingRequests()) {
            TriageLevel level = request.getPatient().getTriageLevel();
            if (level != null && level.isLowAcuity()) {
                candidates.add(request);
            }
        }
        // service order reversed: lowest acuity, latest first
        Collections.reverse(candidates);
        DiversionReason reason = activeIncidents.isEmpty()
                ? DiversionReason.SATURATION
                : DiversionReason.INCIDENT_OVERLOAD;
        int shed = 0;
        for (SlotRequest request : candidates) {
            if (shed >= config.getLoadSheddingBatch()) {
                break;
            }
            Hospital destination = leastSaturatedBelowLow(hospital);
            if (destination == null) {
                break;
            }
            if (hospital.getConsultation().cancel(request)) {
                Patient patient = request.getPatient();
                PatientFlowProcess.markDiverted(context, hospital, patient);
                transfer(patient, hospital, destination, reason);
                shed++;
            }
        }
        return shed;
    }

    // ========== Incidents ==========

    /**
     * Validates an incident, distributes its victims and declares the
     * network-wide emergency if it is the first active one.
     *
     * @return victims per hospital, in configuration order
     */
    public Map<String, Integer> ingestIncident(Incident incident) throws InvalidInputException {
        incident.validate();
        if (activeIncidents.containsKey(incident.getId())) {
            throw new InvalidInputException("Incident " + incident.getId() + " is already active", "incident");
        }
        double now = scheduler.now();
        final Incident active = incident.startingAt(now);

        List<HospitalLoad> loads = new ArrayList<>();
        for (Hospital hospital : context.getHospitals()) {
            loads.add(new HospitalLoad(hospital.getId(), hospital.getConfig().getLocation(),
                    context.getSaturationCalculator().compute(hospital),
                    hospital.getStatistics().meanConsultationWait(now)));
        }
        Map<String, Integer> allocation = allocator.allocate(active.getLocation(), active.getPatientCount(), loads);
        // nothing below may fail once the first victim is dispatched
        for (Map.Entry<String, Integer> entry : allocation.entrySet()) {
            if (entry.getValue() > 0 && !generators.containsKey(entry.getKey())) {
                throw new InvalidInputException("No patient generator registered for " + entry.getKey(),
                        entry.getKey(), "incident");
            }
        }

        for (Map.Entry<String, Integer> entry : allocation.entrySet()) {
            dispatchVictims(active, context.getHospital(entry.getKey()), entry.getValue());
        }

        boolean first = activeIncidents.isEmpty();
        activeIncidents.put(active.getId(), active);
        incidentsIngested++;
        for (Hospital hospital : context.getHospitals()) {
            hospital.setIncidentEmergency(true);
        }
        logger.warn(String.format("INCIDENT_INGESTED: id=%s, type=%s, patients=%d, allocation=%s, t=%.2f",
                active.getId(), active.getType(), active.getPatientCount(), allocation, now));
        context.getPublisher().publish(IncidentEvent.ingested(active, allocation, now));
        if (first) {
            context.getPublisher().publish(EmergencyEvent.declared(SimulationEvent.SYSTEM, now,
                    meanSaturation(), "INCIDENT:" + active.getType()));
        }

        if (active.getDurationMinutes() != null) {
            scheduler.schedule(active.getDurationMinutes(), "incident-end " + active.getId(), new Runnable() {
                @Override
                public void run() {
                    resolveIncident(active.getId());
                }
            });
        }
        return allocation;
    }

    private void dispatchVictims(Incident incident, Hospital hospital, int count) {
        if (count == 0) {
            return;
        }
        PatientGenerator generator = generators.get(hospital.getId());
        if (generator == null) {
            throw new IllegalStateException("No generator registered for " + hospital.getId());
        }
        double[] mix = incident.getSeverityMix();
        if (incident.getType().isPointSource()) {
            double travel = GeoUtils.travelMinutes(incident.getLocation(), hospital.getConfig().getLocation(),
                    config.getAmbulanceSpeedKmh(), config.getMinTransferMinutes());
            for (int i = 0; i < count; i++) {
                // ambulances leave the scene over the first quarter hour
                generator.injectPatient(incident.getId(), mix, travel + context.getSampler().uniform(0.0, 15.0));
            }
        } else {
            double spread = incident.getDurationMinutes() != null
                    ? incident.getDurationMinutes()
                    : incident.getType().getMinDurationHours() * 60.0;
            for (int i = 0; i < count; i++) {
                generator.injectPatient(incident.getId(), mix, spread * (i + 0.5) / count);
            }
        }
    }

    /**
     * @return false if no such incident was active
     */
    public boolean resolveIncident(String incidentId) {
        Incident incident = activeIncidents.remove(incidentId);
        if (incident == null) {
            return false;
        }
        double now = scheduler.now();
        incidentsResolved++;
        logger.info(String.format("INCIDENT_RESOLVED: id=%s, t=%.2f", incidentId, now));
        context.getPublisher().publish(IncidentEvent.resolved(incident, now));
        if (activeIncidents.isEmpty()) {
            for (Hospital hospital : context.getHospitals()) {
                hospital.setIncidentEmergency(false);
            }
            context.getPublisher().publish(EmergencyEvent.retracted(SimulationEvent.SYSTEM, now,
                    meanSaturation(), "INCIDENTS_RESOLVED"));
        }
        return true;
    }

    public void clearIncidents() {
        for (String id : new ArrayList<>(activeIncidents.keySet())) {
            resolveIncident(id);
        }
    }

    private double meanSaturation() {
        double sum = 0.0;
        List<Hospital> hospitals = context.getHospitals();
        for (Hospital hospital : hospitals) {
            sum += context.getSaturationCalculator().compute(hospital);
        }
        return sum / hospitals.size();
    }

    // ========== Query Methods ==========

    public SimulationContext getContext() { return context; }
    public ControlInbox getInbox() { return inbox; }
    public StaffingController getStaffingController() { return staffingController; }
    public DiversionStatistics getDiversionStatistics() { return diversionStatistics; }
    public int getIncidentsIngested() { return incidentsIngested; }
    public int getIncidentsResolved() { return incidentsResolved; }

    /** Diverted patients that left their origin but have not reached the destination yet. */
    public int getPatientsInTransit() { return patientsInTransit; }

    public boolean isSystemEmergency() {
        return !activeIncidents.isEmpty();
    }

    public Map<String, Incident> getActiveIncidents() {
        return Collections.unmodifiableMap(activeIncidents);
    }

    /** Saturation computed at the last tick; null before the first one. */
    public Double getLastSaturation(String hospitalId) {
        return lastSaturation.get(hospitalId);
    }
}
