package org.edsim.coordinator;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import org.edsim.config.SimulationConfig;
import org.edsim.engine.EventScheduler;
import org.edsim.engine.SimulationContext;
import org.edsim.events.EmergencyEvent;
import org.edsim.events.EventKind;
import org.edsim.events.RecordingEventPublisher;
import org.edsim.events.SimulationEvent;
import org.edsim.exceptions.InvalidInputException;
import org.edsim.generator.PatientGenerator;
import org.edsim.hospital.Hospital;
import org.edsim.model.DiversionReason;
import org.edsim.model.DiversionRecord;
import org.edsim.model.Incident;
import org.edsim.model.IncidentType;
import org.edsim.model.Patient;
import org.edsim.model.PatientSource;
import org.edsim.model.PresentingCondition;
import org.edsim.model.Sex;
import org.edsim.model.TriageLevel;
import org.edsim.places.SlotGrantListener;
import org.edsim.places.SlotRequest;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class HospitalCoordinatorTest {

    private RecordingEventPublisher publisher;
    private HospitalCoordinator coordinator;
    private SimulationContext context;
    private EventScheduler scheduler;
    private Hospital east;
    private Hospital west;

    @BeforeEach
    void setUp() throws Exception {
        publisher = new RecordingEventPublisher();
        coordinator = CoordinatorFixtures.coordinator(CoordinatorFixtures.twoHospitals(4, 4), publisher);
        context = coordinator.getContext();
        scheduler = context.getScheduler();
        east = context.getHospital("east");
        west = context.getHospital("west");
    }

    private static final SlotGrantListener IGNORE = new SlotGrantListener() {
        @Override
        public void slotGranted(SlotRequest grant) {
        }
    };

    private PatientGenerator generatorFor(Hospital hospital) {
        return new PatientGenerator(context, hospital, coordinator);
    }

    // ========== Critical flag ==========

    @Test
    void criticalFlagHasAHysteresisBand() {
        assertThat(coordinator.updateCriticalFlag(west, 0.80)).isFalse();
        assertThat(west.isCritical()).isFalse();

        assertThat(coordinator.updateCriticalFlag(west, 0.90)).isTrue();
        assertThat(west.isCritical()).isTrue();
        assertThat(west.isEmergencyActive()).isTrue();

        // inside the band: no change either way
        assertThat(coordinator.updateCriticalFlag(west, 0.75)).isFalse();
        assertThat(coordinator.updateCriticalFlag(west, 0.95)).isFalse();
        assertThat(west.isCritical()).isTrue();

        assertThat(coordinator.updateCriticalFlag(west, 0.65)).isTrue();
        assertThat(west.isCritical()).isFalse();
        assertThat(coordinator.updateCriticalFlag(west, 0.80)).isFalse();

        List<EmergencyEvent> events = publisher.getEvents(EmergencyEvent.class);
        assertThat(events).hasSize(2);
        assertThat(events.get(0).isDeclared()).isTrue();
        assertThat(events.get(0).getCause()).isEqualTo("SATURATION");
        assertThat(events.get(1).isDeclared()).isFalse();
    }

    @Test
    void tickRecordsSaturationOfEveryHospital() {
        assertThat(coordinator.getLastSaturation("east")).isNull();
        coordinator.start();
        scheduler.runUntil(5.0);
        assertThat(coordinator.getLastSaturation("east")).isZero();
        assertThat(coordinator.getLastSaturation("west")).isZero();
    }

    @Test
    void ticksScaleTheElasticHospitalWithItsSaturation() throws Exception {
        SimulationConfig config = CoordinatorFixtures.twoHospitals(4, 4);
        config.setAutoScaling(true);
        config.setDoctorPool(2);
        coordinator = CoordinatorFixtures.coordinator(config, publisher);
        east = coordinator.getContext().getHospital("east");
        west = coordinator.getContext().getHospital("west");

        List<SlotRequest> waiting = new ArrayList<>();
        for (int i = 0; i < 12; i++) {
            Patient patient = new Patient(east.nextPatientId(), "east", 0.0, 40, Sex.MALE,
                    PresentingCondition.FEVER, PatientSource.WALK_IN, null);
            SlotRequest request = east.getConsultation().request(patient, 4, IGNORE);
            if (i >= 4) {
                waiting.add(request);
            }
        }
        for (int i = 0; i < 3; i++) {
            coordinator.tick();
        }
        assertThat(east.getConsultation().getDoctors(0)).isEqualTo(3);
        assertThat(coordinator.getStaffingController().getAvailableDoctors()).isZero();
        assertThat(publisher.count(EventKind.CAPACITY_CHANGE)).isEqualTo(2);

        // busy rooms alone weigh exactly the scale-down threshold
        for (SlotRequest request : waiting) {
            east.getConsultation().cancel(request);
        }
        coordinator.tick();
        coordinator.tick();
        assertThat(east.getConsultation().getDoctors(0)).isEqualTo(1);
        assertThat(coordinator.getStaffingController().getAvailableDoctors()).isEqualTo(2);
        assertThat(west.getConsultation().getDoctors(0)).isEqualTo(1);
        assertThat(publisher.count(EventKind.CAPACITY_CHANGE)).isEqualTo(4);
    }

    @Test
    void autoScalingIsOffByDefault() {
        for (int i = 0; i < 8; i++) {
            Patient patient = new Patient(east.nextPatientId(), "east", 0.0, 40, Sex.MALE,
                    PresentingCondition.FEVER, PatientSource.WALK_IN, null);
            east.getConsultation().request(patient, 4, IGNORE);
        }
        coordinator.tick();
        assertThat(east.getConsultation().getDoctors(0)).isEqualTo(1);
        assertThat(publisher.count(EventKind.CAPACITY_CHANGE)).isZero();
    }

    // ========== Severity diversion ==========

    @Test
    void severeCasesAtOtherHospitalsGoToTheReference() {
        PatientGenerator westGenerator = generatorFor(west);
        coordinator.registerGenerator(westGenerator);
        westGenerator.injectPatient("test", new double[] {0.0, 1.0, 0.0, 0.0, 0.0}, 0.0);

        scheduler.runUntil(300.0);

        List<DiversionRecord> records = coordinator.getDiversionStatistics().getRecords();
        assertThat(records).hasSize(1);
        DiversionRecord record = records.get(0);
        assertThat(record.getSourceHospitalId()).isEqualTo("west");
        assertThat(record.getDestinationHospitalId()).isEqualTo("east");
        assertThat(record.getReason()).isEqualTo(DiversionReason.SEVERITY);
        assertThat(record.getTriageLevel()).isEqualTo(TriageLevel.ORANGE);
        assertThat(record.getTransferMinutes()).isGreaterThanOrEqualTo(5.0);
        assertThat(west.getDiversionsSent()).isEqualTo(1);
        assertThat(east.getDiversionsReceived()).isEqualTo(1);
        assertThat(east.getTreated()).isEqualTo(1);
        assertThat(publisher.count(EventKind.DIVERSION)).isEqualTo(1);

        DiversionStatistics stats = coordinator.getDiversionStatistics();
        assertThat(stats.getTotal()).isEqualTo(1);
        assertThat(stats.count(DiversionReason.SEVERITY)).isEqualTo(1);
        assertThat(stats.sentFrom("west")).isEqualTo(1);
        assertThat(stats.receivedBy("east")).isEqualTo(1);
        assertThat(stats.sentFrom("east")).isZero();
    }

    @Test
    void divertedPatientsAreCountedInTransitUntilTheyArrive() {
        PatientGenerator westGenerator = generatorFor(west);
        coordinator.registerGenerator(westGenerator);
        westGenerator.injectPatient("test", new double[] {1.0, 0.0, 0.0, 0.0, 0.0}, 0.0);

        while (coordinator.getDiversionStatistics().getTotal() == 0 && scheduler.step()) {
            assertThat(coordinator.getPatientsInTransit()).isZero();
        }
        assertThat(coordinator.getPatientsInTransit()).isEqualTo(1);
        assertThat(west.getActivePatients()).isEmpty();
        assertThat(east.getActivePatients()).isEmpty();

        scheduler.runUntil(300.0);
        assertThat(coordinator.getPatientsInTransit()).isZero();
        assertThat(east.getDiversionsReceived()).isEqualTo(1);
    }

    // ========== Incidents ==========

    @Test
    void incidentVictimsAreSplitAndTheNetworkEmergencyFollowsTheIncident() throws Exception {
        Incident incident = new Incident("crash", IncidentType.MASS_CASUALTY, CoordinatorFixtures.MIDPOINT,
                20, 0.0, 120.0, new double[] {0.0, 0.0, 0.5, 0.5, 0.0});

        Map<String, Integer> allocation = coordinator.ingestIncident(incident);

        assertThat(allocation.get("east")).isBetween(9, 11);
        assertThat(allocation.get("east") + allocation.get("west")).isEqualTo(20);
        assertThat(coordinator.isSystemEmergency()).isTrue();
        assertThat(east.isIncidentEmergency()).isTrue();
        assertThat(west.isEmergencyActive()).isTrue();

        List<EmergencyEvent> emergencies = publisher.getEvents(EmergencyEvent.class);
        assertThat(emergencies).hasSize(1);
        assertThat(emergencies.get(0).getHospitalId()).isEqualTo(SimulationEvent.SYSTEM);
        assertThat(emergencies.get(0).getCause()).isEqualTo("INCIDENT:MASS_CASUALTY");

        // ambulances: transfer time plus up to a quarter hour
        scheduler.runUntil(30.0);
        assertThat(east.getArrivals() + west.getArrivals()).isEqualTo(20);
        assertThat(east.getArrivals()).isEqualTo(allocation.get("east"));

        scheduler.runUntil(120.0);
        assertThat(coordinator.isSystemEmergency()).isFalse();
        assertThat(east.isIncidentEmergency()).isFalse();
        assertThat(coordinator.getIncidentsResolved()).isEqualTo(1);
        assertThat(publisher.count(EventKind.EMERGENCY_RETRACTED)).isEqualTo(1);
        assertThat(publisher.count(EventKind.INCIDENT_RESOLVED)).isEqualTo(1);
    }

    @Test
    void emergencyStaysDeclaredWhileAnyIncidentIsActive() throws Exception {
        coordinator.ingestIncident(new Incident("a", IncidentType.LOCALIZED_EMERGENCY,
                CoordinatorFixtures.MIDPOINT, 4, 0.0, null, null));
        coordinator.ingestIncident(new Incident("b", IncidentType.LOCALIZED_EMERGENCY,
                CoordinatorFixtures.MIDPOINT, 4, 0.0, null, null));
        assertThat(publisher.count(EventKind.EMERGENCY_DECLARED)).isEqualTo(1);

        assertThat(coordinator.resolveIncident("a")).isTrue();
        assertThat(coordinator.isSystemEmergency()).isTrue();
        assertThat(publisher.count(EventKind.EMERGENCY_RETRACTED)).isZero();

        assertThat(coordinator.resolveIncident("a")).isFalse();
        coordinator.clearIncidents();
        assertThat(coordinator.isSystemEmergency()).isFalse();
        assertThat(publisher.count(EventKind.EMERGENCY_RETRACTED)).isEqualTo(1);
    }

    @Test
    void epidemicVictimsArriveSpreadOverTheDuration() throws Exception {
        coordinator.ingestIncident(new Incident("flu", IncidentType.EPIDEMIC, CoordinatorFixtures.MIDPOINT,
                10, 0.0, 600.0, new double[] {0.0, 0.0, 0.0, 1.0, 0.0}));

        scheduler.runUntil(59.0);
        assertThat(east.getArrivals() + west.getArrivals()).isZero();
        scheduler.runUntil(300.0);
        assertThat(east.getArrivals() + west.getArrivals()).isBetween(4, 6);
        scheduler.runUntil(600.0);
        assertThat(east.getArrivals() + west.getArrivals()).isEqualTo(10);
    }

    @Test
    void rejectsDuplicateAndMalformedIncidents() throws Exception {
        coordinator.ingestIncident(new Incident("dup", IncidentType.MASS_CASUALTY, CoordinatorFixtures.MIDPOINT,
                2, 0.0, null, null));

        assertThatThrownBy(() -> coordinator.ingestIncident(new Incident("dup", IncidentType.MASS_CASUALTY,
                CoordinatorFixtures.MIDPOINT, 2, 0.0, null, null)))
                .isInstanceOf(InvalidInputException.class);
        assertThatThrownBy(() -> coordinator.ingestIncident(new Incident("bad", IncidentType.MASS_CASUALTY,
                CoordinatorFixtures.MIDPOINT, -3, 0.0, null, null)))
                .isInstanceOf(InvalidInputException.class);
        assertThat(coordinator.getIncidentsIngested()).isEqualTo(1);
        assertThat(coordinator.getActiveIncidents()).containsOnlyKeys("dup");
    }

    @Test
    void incidentIsRejectedBeforeAnyVictimWhenAGeneratorIsMissing() throws Exception {
        SimulationConfig config = CoordinatorFixtures.twoHospitals(2, 2);
        context = SimulationContext.create(config, publisher);
        coordinator = new HospitalCoordinator(context);
        coordinator.registerGenerator(new PatientGenerator(context, context.getHospital("east"), coordinator));

        assertThatThrownBy(() -> coordinator.ingestIncident(new Incident("half", IncidentType.MASS_CASUALTY,
                CoordinatorFixtures.MIDPOINT, 20, 0.0, 60.0, null)))
                .isInstanceOf(InvalidInputException.class)
                .hasMessageContaining("west");

        assertThat(coordinator.getActiveIncidents()).isEmpty();
        assertThat(coordinator.isSystemEmergency()).isFalse();
        assertThat(context.getScheduler().pendingEvents()).isZero();
        assertThat(publisher.count(EventKind.INCIDENT_INGESTED)).isZero();
    }

    // ========== Load shedding ==========

    @Test
    void shedsTheLowestAcuityLatestArrivalsFirst() throws Exception {
        SimulationConfig config = CoordinatorFixtures.twoHospitals(1, 4);
        coordinator = CoordinatorFixtures.coordinator(config, publisher);
        context = coordinator.getContext();
        scheduler = context.getScheduler();
        east = context.getHospital("east");
        west = context.getHospital("west");
        PatientGenerator generator = generatorFor(east);

        // a RED patient takes the only room, the rest queue behind it
        generator.injectPatient("test", new double[] {1.0, 0.0, 0.0, 0.0, 0.0}, 0.0);
        generator.injectPatient("test", new double[] {0.0, 0.0, 1.0, 0.0, 0.0}, 3.0);
        generator.injectPatient("test", new double[] {0.0, 0.0, 0.0, 1.0, 0.0}, 3.0);
        generator.injectPatient("test", new double[] {0.0, 0.0, 0.0, 1.0, 0.0}, 3.0);
        generator.injectPatient("test", new double[] {0.0, 0.0, 0.0, 0.0, 1.0}, 3.0);
        generator.injectPatient("test", new double[] {0.0, 0.0, 0.0, 0.0, 1.0}, 3.0);
        scheduler.runUntil(25.0);
        assertThat(east.getConsultation().getQueueLength()).isEqualTo(5);

        int shed = coordinator.shedLoad(east);

        assertThat(shed).isEqualTo(2);
        assertThat(east.getConsultation().getQueueLength()).isEqualTo(3);
        assertThat(east.getDiversionsSent()).isEqualTo(2);
        for (DiversionRecord record : coordinator.getDiversionStatistics().getRecords()) {
            assertThat(record.getTriageLevel()).isEqualTo(TriageLevel.BLUE);
            assertThat(record.getDestinationHospitalId()).isEqualTo("west");
            assertThat(record.getReason()).isEqualTo(DiversionReason.SATURATION);
        }

        DiversionStatistics stats = coordinator.getDiversionStatistics();
        assertThat(stats.count(DiversionReason.SATURATION)).isEqualTo(2);
        assertThat(stats.getByOrigin()).containsOnlyKeys("east");
        assertThat(stats.receivedBy("west")).isEqualTo(2);

        scheduler.runUntil(400.0);
        assertThat(west.getDiversionsReceived()).isEqualTo(2);
        assertThat(west.getTreated()).isEqualTo(2);
        assertThat(east.getTreated()).isEqualTo(4);
    }

    @Test
    void busyHospitalsAreNotDiversionDestinations() {
        assertThat(coordinator.leastSaturatedBelowLow(east)).isSameAs(west);

        for (int i = 0; i < 8; i++) {
            Patient waiting = new Patient(west.nextPatientId(), "west", 0.0, 40, Sex.MALE,
                    PresentingCondition.FEVER, PatientSource.WALK_IN, null);
            west.getConsultation().request(waiting, 4, IGNORE);
        }
        // 4/4 rooms busy and 4 waiting: 0.5 + 0.3 > low threshold
        assertThat(coordinator.leastSaturatedBelowLow(east)).isNull();
        assertThat(coordinator.leastSaturatedBelowLow(west)).isSameAs(east);
        assertThat(coordinator.shedLoad(east)).isZero();
    }
}
