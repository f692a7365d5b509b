package org.edsim.flow;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import java.util.ArrayList;
import java.util.List;

import org.edsim.config.SimulationConfig;
import org.edsim.engine.EventScheduler;
import org.edsim.engine.SimulationContext;
import org.edsim.engine.SimulationFixtures;
import org.edsim.events.EventKind;
import org.edsim.events.RecordingEventPublisher;
import org.edsim.exceptions.InvariantViolationException;
import org.edsim.generator.PatientGenerator;
import org.edsim.hospital.Hospital;
import org.edsim.model.DiversionReason;
import org.edsim.model.Outcome;
import org.edsim.model.Patient;
import org.edsim.model.PatientSource;
import org.edsim.model.PatientStage;
import org.edsim.model.PresentingCondition;
import org.edsim.model.ResourceClass;
import org.edsim.model.Sex;
import org.edsim.model.TriageLevel;
import org.edsim.places.BaseResourcePlace;
import org.junit.jupiter.api.Test;

class PatientFlowProcessTest {

    /** Sends diverted patients to a fixed destination after a fixed delay. */
    private static class TransferringHandler implements DiversionHandler {

        private final SimulationContext context;
        private final Hospital destination;
        private final List<String> diverted = new ArrayList<>();
        private final List<DiversionReason> reasons = new ArrayList<>();
        private boolean originHeldSlot;

        TransferringHandler(SimulationContext context, Hospital destination) {
            this.context = context;
            this.destination = destination;
        }

        @Override
        public void divert(final Patient patient, Hospital origin, DiversionReason reason) {
            diverted.add(patient.getId());
            reasons.add(reason);
            originHeldSlot |= !patient.isLedgerBalanced() || origin.getTriage().getMarking() > 0;
            patient.divertTo(destination.getId());
            final TransferringHandler self = this;
            context.getScheduler().schedule(10.0, "transfer", new Runnable() {
                @Override
                public void run() {
                    PatientFlowProcess.transferIn(context, destination, patient, self);
                }
            });
        }
    }

    private static final DiversionHandler NO_DIVERSIONS = new DiversionHandler() {
        @Override
        public void divert(Patient patient, Hospital origin, DiversionReason reason) {
            throw new AssertionError("unexpected diversion of " + patient.getId());
        }
    };

    private static Patient patient(Hospital hospital, double time) {
        return new Patient(hospital.nextPatientId(), hospital.getId(), time, 50, Sex.FEMALE,
                PresentingCondition.CHEST_PAIN, PatientSource.WALK_IN, null);
    }

    private static void assertDrained(Hospital hospital) {
        assertThat(hospital.getActivePatients()).isEmpty();
        for (BaseResourcePlace place : new BaseResourcePlace[] {hospital.getRegistration(), hospital.getTriage(),
                hospital.getConsultation(), hospital.getObservation()}) {
            assertThat(place.getMarking()).as(place.getPlaceId()).isZero();
            assertThat(place.getQueueLength()).as(place.getPlaceId()).isZero();
            assertThat(place.getGrantCount()).as(place.getPlaceId()).isEqualTo(place.getReleaseCount());
        }
        for (Patient p : hospital.getFinishedPatients()) {
            assertThat(p.isLedgerBalanced()).as(p.getId()).isTrue();
            assertThat(p.isTerminal()).as(p.getId()).isTrue();
        }
    }

    @Test
    void basicSaturationScenario() throws Exception {
        SimulationConfig config = SimulationFixtures.singleHospital(2, 30.0);
        RecordingEventPublisher publisher = new RecordingEventPublisher();
        SimulationContext context = SimulationFixtures.context(config, publisher);
        Hospital hospital = context.getHospital("h1");
        EventScheduler scheduler = context.getScheduler();
        new PatientGenerator(context, hospital, NO_DIVERSIONS).start();

        boolean roomsBusyEarly = false;
        for (double t = 1.0; t <= 15.0; t += 1.0) {
            scheduler.runUntil(t);
            roomsBusyEarly |= hospital.getConsultation().getOccupancy() > 0.0;
        }
        scheduler.runUntil(60.0);

        assertThat(roomsBusyEarly).isTrue();
        int arrivals = hospital.getArrivals();
        assertThat(arrivals).isGreaterThan(0);
        assertThat(hospital.getRegistration().getQueueLength()).isLessThanOrEqualTo(arrivals);
        assertThat(hospital.getTriage().getQueueLength()).isLessThanOrEqualTo(arrivals);
        assertThat(hospital.getConsultation().getQueueLength()).isLessThanOrEqualTo(arrivals);
        assertThat(hospital.getConsultation().getMarking()).isLessThanOrEqualTo(2);
        assertThat(publisher.count(EventKind.ARRIVAL)).isEqualTo(arrivals);
    }

    @Test
    void everySlotIsReturnedOnceArrivalsStop() throws Exception {
        SimulationConfig config = SimulationFixtures.singleHospital(2, 6.0);
        config.setObservationProbability(0.3);
        RecordingEventPublisher publisher = new RecordingEventPublisher();
        SimulationContext context = SimulationFixtures.context(config, publisher);
        Hospital hospital = context.getHospital("h1");
        PatientGenerator generator = new PatientGenerator(context, hospital, NO_DIVERSIONS);
        generator.start();

        context.getScheduler().runUntil(600.0);
        generator.stop();
        context.getScheduler().runUntil(5000.0);

        assertDrained(hospital);
        assertThat(hospital.getTreated()).isEqualTo(hospital.getArrivals());
        assertThat(publisher.count(EventKind.DISCHARGE)).isEqualTo(hospital.getArrivals());
        assertThat(publisher.count(EventKind.OBSERVATION_ADMIT)).isEqualTo(hospital.getAdmittedObservation());
        assertThat(publisher.count(EventKind.CONSULTATION_START)).isEqualTo(hospital.getTreated());
    }

    @Test
    void mostSevereLevelsAreDivertedToTheReferenceHospital() throws Exception {
        SimulationConfig config = SimulationFixtures.singleHospital(2, 6.0);
        config.addHospital(SimulationFixtures.hospital("h2", 2, 2, 6.0));
        RecordingEventPublisher publisher = new RecordingEventPublisher();
        SimulationContext context = SimulationFixtures.context(config, publisher);
        Hospital reference = context.getHospital("h1");
        Hospital small = context.getHospital("h2");
        TransferringHandler handler = new TransferringHandler(context, reference);

        Patient red = patient(small, 0.0);
        red.setForcedTriageMix(new double[] {1.0, 0.0, 0.0, 0.0, 0.0});
        PatientFlowProcess.arrive(context, small, red, handler);
        context.getScheduler().runUntil(500.0);

        assertThat(handler.diverted).containsExactly(red.getId());
        assertThat(handler.reasons).containsExactly(DiversionReason.SEVERITY);
        assertThat(handler.originHeldSlot).isFalse();
        assertThat(small.getDiversionsSent()).isEqualTo(1);
        assertThat(small.getTreated()).isZero();
        assertThat(reference.getDiversionsReceived()).isEqualTo(1);
        assertThat(reference.getTreated()).isEqualTo(1);
        assertThat(red.getCurrentHospitalId()).isEqualTo("h1");
        assertThat(red.getStageEntry(PatientStage.DIVERTED)).isNotNull();
        // skipped registration and triage at the destination
        assertThat(red.getAcquireCount(ResourceClass.REGISTRATION)).isEqualTo(1);
        assertThat(red.isLedgerBalanced()).isTrue();
        assertDrained(small);
        assertDrained(reference);
    }

    @Test
    void theReferenceHospitalTreatsSevereCasesItself() throws Exception {
        SimulationContext context = SimulationFixtures.context(SimulationFixtures.singleHospital(2, 6.0),
                new RecordingEventPublisher());
        Hospital reference = context.getHospital("h1");
        Patient red = patient(reference, 0.0);
        red.setForcedTriageMix(new double[] {1.0, 0.0, 0.0, 0.0, 0.0});

        PatientFlowProcess.arrive(context, reference, red, NO_DIVERSIONS);
        context.getScheduler().runUntil(500.0);

        assertThat(red.getTriageLevel()).isEqualTo(TriageLevel.RED);
        assertThat(red.getOutcome()).isIn(Outcome.DISCHARGED, Outcome.ADMITTED_OBSERVATION);
        assertThat(reference.getDiversionsSent()).isZero();
    }

    @Test
    void fasterRoomsHalveTheServiceTime() throws Exception {
        SimulationConfig config = SimulationFixtures.singleHospital(2, 6.0);
        config.setConditionBias(false);
        config.setObservationProbability(0.0);
        SimulationContext context = SimulationFixtures.context(config, new RecordingEventPublisher());
        Hospital hospital = context.getHospital("h1");
        hospital.getConsultation().setDoctors(1, 2);
        new PatientGenerator(context, hospital, NO_DIVERSIONS).start();

        context.getScheduler().runUntil(100 * 60.0);

        assertThat(hospital.getStatistics().roomServiceCount(0)).isGreaterThan(100);
        assertThat(hospital.getStatistics().roomServiceCount(1)).isGreaterThan(100);
        double ratio = hospital.getStatistics().meanRoomService(1) / hospital.getStatistics().meanRoomService(0);
        assertThat(ratio).isCloseTo(0.5, within(0.1));
    }

    @Test
    void markDivertedOnlyAppliesToQueuedConsultations() throws Exception {
        SimulationContext context = SimulationFixtures.context(SimulationFixtures.singleHospital(2, 6.0),
                new RecordingEventPublisher());
        final Hospital hospital = context.getHospital("h1");
        final Patient fresh = patient(hospital, 0.0);
        final SimulationContext ctx = context;

        assertThatThrownBy(() -> PatientFlowProcess.markDiverted(ctx, hospital, fresh))
                .isInstanceOf(InvariantViolationException.class);
        assertThatThrownBy(() -> PatientFlowProcess.transferIn(ctx, hospital, fresh, NO_DIVERSIONS))
                .isInstanceOf(InvariantViolationException.class);
    }

    @Test
    void transitionTable() {
        assertThat(PatientFlowProcess.isAllowed(PatientStage.ARRIVED, PatientStage.QUEUED_REGISTRATION)).isTrue();
        assertThat(PatientFlowProcess.isAllowed(PatientStage.IN_TRIAGE, PatientStage.DIVERTED)).isTrue();
        assertThat(PatientFlowProcess.isAllowed(PatientStage.QUEUED_CONSULTATION, PatientStage.DIVERTED)).isTrue();
        assertThat(PatientFlowProcess.isAllowed(PatientStage.DIVERTED, PatientStage.QUEUED_CONSULTATION)).isTrue();
        assertThat(PatientFlowProcess.isAllowed(PatientStage.ARRIVED, PatientStage.IN_TRIAGE)).isFalse();
        assertThat(PatientFlowProcess.isAllowed(PatientStage.IN_CONSULTATION, PatientStage.DIVERTED)).isFalse();
        assertThat(PatientFlowProcess.isAllowed(PatientStage.DISCHARGED, PatientStage.QUEUED_CONSULTATION)).isFalse();
        assertThat(PatientFlowProcess.isAllowed(PatientStage.ADMITTED_OBSERVATION, PatientStage.DISCHARGED)).isFalse();
    }
}
