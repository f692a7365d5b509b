package org.edsim.places;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.ArrayList;
import java.util.List;

import org.edsim.engine.EventScheduler;
import org.edsim.logger.SimulationEventLogger;
import org.junit.jupiter.api.Test;

class ConsultationRoomPlaceTest {

    private final EventScheduler scheduler = new EventScheduler();
    private final ConsultationRoomPlace rooms = new ConsultationRoomPlace("h1", 1, scheduler,
            new SimulationEventLogger());
    private final List<String> served = new ArrayList<>();

    private final SlotGrantListener listener = new SlotGrantListener() {
        @Override
        public void slotGranted(SlotRequest grant) {
            served.add(grant.getPatient().getId());
        }
    };

    @Test
    void servesByRankThenArrival() {
        SlotRequest busy = rooms.request(FifoResourcePlaceTest.patient("busy"), 3, listener);
        rooms.request(FifoResourcePlaceTest.patient("green-1"), 4, listener);
        rooms.request(FifoResourcePlaceTest.patient("yellow-1"), 3, listener);
        rooms.request(FifoResourcePlaceTest.patient("green-2"), 4, listener);
        rooms.request(FifoResourcePlaceTest.patient("orange"), 2, listener);
        rooms.request(FifoResourcePlaceTest.patient("yellow-2"), 3, listener);

        List<String> order = new ArrayList<>();
        for (SlotRequest r : rooms.getWaitingRequests()) {
            order.add(r.getPatient().getId());
        }
        assertThat(order).containsExactly("orange", "yellow-1", "yellow-2", "green-1", "green-2");

        scheduler.runUntil(0.0);
        SlotRequest current = busy;
        for (int i = 0; i < 5; i++) {
            rooms.release(current);
            current = rooms.getHolder(0);
        }
        rooms.release(current);
        scheduler.runUntil(0.0);

        assertThat(served).containsExactly("busy", "orange", "yellow-1", "yellow-2", "green-1", "green-2");
        assertThat(rooms.getMarking()).isZero();
    }

    @Test
    void roomsStartWithOneDoctorAndKeepAssignedCounts() {
        ConsultationRoomPlace three = new ConsultationRoomPlace("h1", 3, scheduler, new SimulationEventLogger());
        assertThat(three.getRoomSpeed(2)).isEqualTo(1.0);

        assertThat(three.setDoctors(2, 3)).isEqualTo(1);
        assertThat(three.getDoctors(2)).isEqualTo(3);
        assertThat(three.getRoomSpeed(2)).isEqualTo(3.0);
        assertThat(three.getRoomSpeed(0)).isEqualTo(1.0);
    }

    @Test
    void rejectsInvalidDoctorAssignments() {
        assertThatThrownBy(() -> rooms.setDoctors(0, 0)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> rooms.setDoctors(1, 2)).isInstanceOf(IllegalArgumentException.class);
        assertThat(rooms.getDoctors(0)).isEqualTo(1);
    }
}
