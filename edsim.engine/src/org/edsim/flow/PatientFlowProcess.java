package org.edsim.flow;

import org.apache.log4j.Logger;
import org.edsim.config.SimulationConfig;
import org.edsim.engine.EventScheduler;
import org.edsim.engine.SimulationContext;
import org.edsim.events.ArrivalEvent;
import org.edsim.events.ConsultationStartEvent;
import org.edsim.events.DischargeEvent;
import org.edsim.events.ObservationAdmitEvent;
import org.edsim.events.SlaBreachEvent;
import org.edsim.events.TriageCompleteEvent;
import org.edsim.exceptions.InvariantViolationException;
import org.edsim.hospital.Hospital;
import org.edsim.model.DiversionReason;
import org.edsim.model.Outcome;
import org.edsim.model.Patient;
import org.edsim.model.PatientStage;
import org.edsim.model.TriageLevel;
import org.edsim.places.SlotGrantListener;
import org.edsim.places.SlotRequest;
import org.edsim.utils.StochasticSampler;

/**
 * PatientFlowProcess - the journey of one patient through one hospital
 *
 * STATE MACHINE
 * =============
 * ARRIVED -> QUEUED_REGISTRATION -> IN_REGISTRATION -> QUEUED_TRIAGE -> IN_TRIAGE
 *   -> DIVERTED                      (RED/ORANGE at a non-reference hospital)
 *   -> QUEUED_CONSULTATION -> IN_CONSULTATION -> DISCHARGED | ADMITTED_OBSERVATION
 *
 * A patient diverted to this hospital starts at QUEUED_CONSULTATION.
 *
 * Each stage change is a callback: a slot grant resumes the patient in the
 * IN_ stage, a timed callback ends the service and releases the slot before
 * the next request is made. The patient therefore never holds two slots at
 * once, and holds none when diverted.
 *
 * Admitted patients then occupy an observation bed for their stay. That is
 * ward bookkeeping after the outcome is final; it feeds the observation term
 * of the saturation index.
 */
public class PatientFlowProcess {

    private static final Logger logger = Logger.getLogger(PatientFlowProcess.class);

    private final SimulationContext context;
    private final Hospital hospital;
    private final Patient patient;
    private final DiversionHandler diversionHandler;
    private final EventScheduler scheduler;
    private final StochasticSampler sampler;
    private final SimulationConfig config;

    private PatientFlowProcess(SimulationContext context, Hospital hospital, Patient patient,
                               DiversionHandler diversionHandler) {
        this.context = context;
        this.hospital = hospital;
        this.patient = patient;
        this.diversionHandler = diversionHandler;
        this.scheduler = context.getScheduler();
        this.sampler = context.getSampler();
        this.config = context.getConfig();
    }

    // ========== Entry points ==========

    /** Starts the flow of a newly arrived patient at the given hospital. */
    public static PatientFlowProcess arrive(SimulationContext context, Hospital hospital, Patient patient,
                                            DiversionHandler diversionHandler) {
        PatientFlowProcess process = new PatientFlowProcess(context, hospital, patient, diversionHandler);
        process.begin();
        return process;
    }

    /** Continues the flow of a diverted patient at the destination, straight into the consultation queue. */
    public static PatientFlowProcess transferIn(SimulationContext context, Hospital destination, Patient patient,
                                                DiversionHandler diversionHandler) {
        if (patient.getStage() != PatientStage.DIVERTED) {
            throw new InvariantViolationException(destination.getId(),
                    "transfer of " + patient.getId() + " in stage " + patient.getStage());
        }
        PatientFlowProcess process = new PatientFlowProcess(context, destination, patient, diversionHandler);
        patient.transferredIn(destination.getId());
        patient.setOutcome(Outcome.IN_SYSTEM);
        destination.receiveTransfer(patient);
        process.enterConsultationQueue();
        return process;
    }

    /**
     * Marks a patient whose queued consultation request has just been
     * cancelled as diverted. The caller hands the patient on.
     */
    public static void markDiverted(SimulationContext context, Hospital hospital, Patient patient) {
        if (patient.getStage() != PatientStage.QUEUED_CONSULTATION) {
            throw new InvariantViolationException(hospital.getId(),
                    "cannot divert " + patient.getId() + " from stage " + patient.getStage());
        }
        transition(context, hospital, patient, PatientStage.DIVERTED);
        patient.setOutcome(Outcome.DIVERTED);
        hospital.recordDiversionSent();
        hospital.finish(patient);
    }

    // ========== Stages ==========

    private void begin() {
        hospital.admit(patient, scheduler.now());
        context.getPublisher().publish(new ArrivalEvent(hospital.getId(), patient, scheduler.now()));
        transition(PatientStage.QUEUED_REGISTRATION);
        hospital.getRegistration().request(patient, 0, new SlotGrantListener() {
            @Override
            public void slotGranted(SlotRequest grant) {
                startRegistration(grant);
            }
        });
    }

    private void startRegistration(final SlotRequest grant) {
        transition(PatientStage.IN_REGISTRATION);
        hospital.getStatistics().recordRegistrationWait(scheduler.now(), grant.getWaitMinutes());
        double service = sampler.jitter(config.getRegistrationMinutes(), config.getJitterFraction());
        scheduler.schedule(service, "registration-done", new Runnable() {
            @Override
            public void run() {
                finishRegistration(grant);
            }
        });
    }

    private void finishRegistration(SlotRequest grant) {
        hospital.getRegistration().release(grant);
        transition(PatientStage.QUEUED_TRIAGE);
        hospital.getTriage().request(patient, 0, new SlotGrantListener() {
            @Override
            public void slotGranted(SlotRequest triageGrant) {
                startTriage(triageGrant);
            }
        });
    }

    private void startTriage(final SlotRequest grant) {
        transition(PatientStage.IN_TRIAGE);
        hospital.getStatistics().recordTriageWait(scheduler.now(), grant.getWaitMinutes());
        double service = sampler.jitter(config.getTriageMinutes(), config.getJitterFraction());
        scheduler.schedule(service, "triage-done", new Runnable() {
            @Override
            public void run() {
                finishTriage(grant);
            }
        });
    }

    private void finishTriage(SlotRequest grant) {
        TriageLevel level = context.getTriageClassifier().classify(patient);
        patient.setTriageLevel(level);
        hospital.getTriage().release(grant);
        context.getPublisher().publish(new TriageCompleteEvent(hospital.getId(), patient.getId(),
                scheduler.now(), level, patient.getCondition(), grant.getWaitMinutes()));

        if (level.isMostSevereTier() && !hospital.isReference()) {
            logger.info(String.format("SEVERITY_DIVERSION: patientId=%s, hospital=%s, level=%s, t=%.2f",
                    patient.getId(), hospital.getId(), level, scheduler.now()));
            transition(PatientStage.DIVERTED);
            patient.setOutcome(Outcome.DIVERTED);
            hospital.recordDiversionSent();
            hospital.finish(patient);
            diversionHandler.divert(patient, hospital, DiversionReason.SEVERITY);
            return;
        }
        enterConsultationQueue();
    }

    private void enterConsultationQueue() {
        transition(PatientStage.QUEUED_CONSULTATION);
        hospital.getConsultation().request(patient, patient.getTriageLevel().getRank(), new SlotGrantListener() {
            @Override
            public void slotGranted(SlotRequest grant) {
                startConsultation(grant);
            }
        });
    }

    private void startConsultation(final SlotRequest grant) {
        transition(PatientStage.IN_CONSULTATION);
        TriageLevel level = patient.getTriageLevel();
        int room = grant.getSlot();
        patient.setConsultationRoom(room);
        double now = scheduler.now();
        double wait = grant.getWaitMinutes();
        hospital.getStatistics().recordConsultationWait(now, level, wait);
        if (wait > level.getMaxWaitMinutes()) {
            hospital.recordSlaBreach();
            if (logger.isDebugEnabled()) {
                logger.debug(String.format("SLA_BREACH: patientId=%s, hospital=%s, level=%s, wait=%.1f",
                        patient.getId(), hospital.getId(), level, wait));
            }
            context.getPublisher().publish(new SlaBreachEvent(hospital.getId(), patient.getId(), now, level, wait));
        }

        double speed = hospital.getConsultation().getRoomSpeed(room);
        final double service = sampler.jitter(level.getNominalConsultationMinutes(), config.getJitterFraction()) / speed;
        context.getPublisher().publish(new ConsultationStartEvent(hospital.getId(), patient.getId(), now,
                level, room, wait, speed, service));
        scheduler.schedule(service, "consultation-done", new Runnable() {
            @Override
            public void run() {
                finishConsultation(grant, service);
            }
        });
    }

    private void finishConsultation(SlotRequest grant, double service) {
        hospital.getConsultation().release(grant);
        double now = scheduler.now();
        hospital.getStatistics().recordConsultationService(now, grant.getSlot(), service);
        hospital.recordTreated();

        boolean admitted = sampler.bernoulli(config.getObservationProbability());
        Outcome outcome = admitted ? Outcome.ADMITTED_OBSERVATION : Outcome.DISCHARGED;
        transition(admitted ? PatientStage.ADMITTED_OBSERVATION : PatientStage.DISCHARGED);
        patient.setOutcome(outcome);
        double total = now - patient.getArrivalTime();
        hospital.getStatistics().recordTimeInSystem(total);
        context.getPublisher().publish(new DischargeEvent(hospital.getId(), patient.getId(), now,
                patient.getTriageLevel(), outcome, service, total));
        hospital.finish(patient);

        if (admitted) {
            hospital.recordAdmittedObservation();
            hospital.getObservation().request(patient, 0, new SlotGrantListener() {
                @Override
                public void slotGranted(SlotRequest bed) {
                    occupyBed(bed);
                }
            });
        }
    }

    private void occupyBed(final SlotRequest bed) {
        double stay = sampler.jitter(config.getObservationStayMinutes(), config.getJitterFraction());
        context.getPublisher().publish(new ObservationAdmitEvent(hospital.getId(), patient.getId(),
                scheduler.now(), patient.getTriageLevel(), bed.getSlot(), bed.getWaitMinutes(), stay));
        scheduler.schedule(stay, "observation-done", new Runnable() {
            @Override
            public void run() {
                hospital.getObservation().release(bed);
            }
        });
    }

    // ========== Transitions ==========

    private void transition(PatientStage next) {
        transition(context, hospital, patient, next);
    }

    private static void transition(SimulationContext context, Hospital hospital, Patient patient, PatientStage next) {
        PatientStage current = patient.getStage();
        if (!isAllowed(current, next)) {
            throw new InvariantViolationException(hospital.getId(), String.format(
                    "illegal transition %s -> %s for %s", current, next, patient.getId()));
        }
        double now = context.getScheduler().now();
        patient.enterStage(next, now);
        context.getEventLogger().logStageTransition(patient.getId(), hospital.getId(),
                String.valueOf(current), next.name(), now);
    }

    static boolean isAllowed(PatientStage from, PatientStage to) {
        switch (from) {
            case ARRIVED:
                return to == PatientStage.QUEUED_REGISTRATION;
            case QUEUED_REGISTRATION:
                return to == PatientStage.IN_REGISTRATION;
            case IN_REGISTRATION:
                return to == PatientStage.QUEUED_TRIAGE;
            case QUEUED_TRIAGE:
                return to == PatientStage.IN_TRIAGE;
            case IN_TRIAGE:
                return to == PatientStage.QUEUED_CONSULTATION || to == PatientStage.DIVERTED;
            case QUEUED_CONSULTATION:
                return to == PatientStage.IN_CONSULTATION || to == PatientStage.DIVERTED;
            case IN_CONSULTATION:
                return to == PatientStage.DISCHARGED || to == PatientStage.ADMITTED_OBSERVATION;
            case DIVERTED:
                return to == PatientStage.QUEUED_CONSULTATION;
            default:
                return false;
        }
    }

    public Patient getPatient() {
        return patient;
    }

    public Hospital getHospital() {
        return hospital;
    }

    @Override
    public String toString() {
        return String.format("PatientFlow[%s at %s, stage=%s]", patient.getId(), hospital.getId(), patient.getStage());
    }
}
