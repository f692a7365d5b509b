package org.edsim.coordinator.control;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.concurrent.CountDownLatch;

import org.edsim.coordinator.CoordinatorFixtures;
import org.edsim.coordinator.HospitalCoordinator;
import org.edsim.demand.DemandSignal;
import org.edsim.events.RecordingEventPublisher;
import org.edsim.model.Incident;
import org.edsim.model.IncidentType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class ControlInboxTest {

    private HospitalCoordinator coordinator;
    private ControlInbox inbox;

    @BeforeEach
    void setUp() throws Exception {
        coordinator = CoordinatorFixtures.coordinator(CoordinatorFixtures.twoHospitals(2, 2),
                new RecordingEventPublisher());
        inbox = coordinator.getInbox();
    }

    @Test
    void appliesValidCommandsAndCountsRejections() {
        inbox.submit(new StaffAssignmentCommand("east", StaffAssignmentCommand.ALL_ROOMS, 2));
        inbox.submit(new StaffAssignmentCommand("west", 0, 2));
        inbox.submit(new ClearIncidentsCommand("nothing-active"));
        inbox.submit(new DemandSignalCommand("east", new DemandSignal(-80.0, 0.0, 0.0, false)));
        inbox.submit(new DemandSignalCommand("west", new DemandSignal(3.0, 6.0, 0.5, false)));

        assertThat(inbox.getPendingCount()).isEqualTo(5);
        int applied = inbox.drain(coordinator);

        assertThat(applied).isEqualTo(2);
        assertThat(inbox.getAppliedCount()).isEqualTo(2);
        assertThat(inbox.getRejectedCount()).isEqualTo(3);
        assertThat(inbox.getPendingCount()).isZero();
        assertThat(coordinator.getContext().getHospital("east").getConsultation().getDoctors(1)).isEqualTo(2);
        assertThat(coordinator.getContext().getDemandAggregator().getSignal("west").getTemperature()).isEqualTo(3.0);
    }

    @Test
    void incidentCommandsTakeEffectOnTheNextTick() {
        inbox.submit(new InjectIncidentCommand(new Incident("fire", IncidentType.LOCALIZED_EMERGENCY,
                CoordinatorFixtures.MIDPOINT, 6, 0.0, null, null)));
        assertThat(coordinator.isSystemEmergency()).isFalse();

        coordinator.tick();
        assertThat(coordinator.isSystemEmergency()).isTrue();

        inbox.submit(new ClearIncidentsCommand());
        coordinator.tick();
        assertThat(coordinator.isSystemEmergency()).isFalse();
        assertThat(coordinator.getIncidentsResolved()).isEqualTo(1);
    }

    @Test
    void endlessIncidentIsRejectedWithoutTouchingState() {
        inbox.submit(new InjectIncidentCommand(new Incident("forever", IncidentType.EPIDEMIC,
                CoordinatorFixtures.MIDPOINT, 60, 0.0, Double.POSITIVE_INFINITY, null)));
        inbox.submit(new InjectIncidentCommand(new Incident("crowd", IncidentType.LOCALIZED_EMERGENCY,
                CoordinatorFixtures.MIDPOINT, Incident.MAX_PATIENTS + 1, 0.0, 60.0, null)));

        coordinator.tick();

        assertThat(inbox.getRejectedCount()).isEqualTo(2);
        assertThat(coordinator.getActiveIncidents()).isEmpty();
        assertThat(coordinator.getIncidentsIngested()).isZero();
        assertThat(coordinator.isSystemEmergency()).isFalse();
        assertThat(coordinator.getContext().getHospital("east").isIncidentEmergency()).isFalse();
        assertThat(coordinator.getContext().getScheduler().pendingEvents()).isZero();
    }

    @Test
    void acceptsSubmissionsFromOtherThreads() throws Exception {
        final CountDownLatch done = new CountDownLatch(4);
        for (int t = 0; t < 4; t++) {
            new Thread(new Runnable() {
                @Override
                public void run() {
                    for (int i = 0; i < 25; i++) {
                        inbox.submit(new StaffAssignmentCommand("east", 0, 1 + (i % 2)));
                    }
                    done.countDown();
                }
            }).start();
        }
        done.await();

        assertThat(inbox.getSubmittedCount()).isEqualTo(100);
        assertThat(inbox.drain(coordinator)).isEqualTo(100);
    }
}
