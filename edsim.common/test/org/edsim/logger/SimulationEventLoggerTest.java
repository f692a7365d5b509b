package org.edsim.logger;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class SimulationEventLoggerTest {

    @Test
    void tracksMarkingAndPeakPerPlace() {
        SimulationEventLogger eventLogger = new SimulationEventLogger();
        eventLogger.logPlaceCreated("h1/CONSULTATION", "ConsultationRoomPlace", 3);
        eventLogger.logPlaceCreated("h1/TRIAGE", "FifoResourcePlace", 1);

        eventLogger.logSlotAcquired("h1/CONSULTATION", "p1", 1.0, 0, 1, 3);
        eventLogger.logSlotAcquired("h1/CONSULTATION", "p2", 2.0, 1, 2, 3);
        eventLogger.logSlotAcquired("h1/CONSULTATION", "p3", 3.0, 2, 3, 3);
        eventLogger.logSlotReleased("h1/CONSULTATION", "p1", 9.0, 0, 2);
        eventLogger.logSlotReleased("h1/CONSULTATION", "p2", 10.0, 1, 1);

        SimulationEventLogger.PlaceState consultation = eventLogger.getPlaceState("h1/CONSULTATION");
        assertThat(consultation.getMarking()).isEqualTo(1);
        assertThat(consultation.getPeakMarking()).isEqualTo(3);
        assertThat(consultation.getCapacity()).isEqualTo(3);
        assertThat(consultation.isAtCapacity()).isFalse();

        SimulationEventLogger.PlaceState triage = eventLogger.getPlaceState("h1/TRIAGE");
        assertThat(triage.getPeakMarking()).isZero();
    }

    @Test
    void slotsOfUnknownPlacesAreIgnored() {
        SimulationEventLogger eventLogger = new SimulationEventLogger();
        eventLogger.logSlotAcquired("nowhere", "p1", 1.0, 0, 1, 1);
        assertThat(eventLogger.getPlaceState("nowhere")).isNull();
    }
}
