package org.edsim.places;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.ArrayList;
import java.util.List;

import org.edsim.engine.EventScheduler;
import org.edsim.exceptions.InvariantViolationException;
import org.edsim.logger.SimulationEventLogger;
import org.edsim.model.Patient;
import org.edsim.model.PatientSource;
import org.edsim.model.PresentingCondition;
import org.edsim.model.ResourceClass;
import org.edsim.model.Sex;
import org.junit.jupiter.api.Test;

class FifoResourcePlaceTest {

    private final EventScheduler scheduler = new EventScheduler();
    private final FifoResourcePlace place = new FifoResourcePlace("h1", ResourceClass.TRIAGE, 2,
            scheduler, new SimulationEventLogger());
    private final List<SlotRequest> granted = new ArrayList<>();

    private final SlotGrantListener listener = new SlotGrantListener() {
        @Override
        public void slotGranted(SlotRequest grant) {
            granted.add(grant);
        }
    };

    static Patient patient(String id) {
        return new Patient(id, "h1", 0.0, 40, Sex.MALE, PresentingCondition.FEVER, PatientSource.WALK_IN, null);
    }

    @Test
    void grantsUpToCapacityThenQueuesInArrivalOrder() {
        SlotRequest a = place.request(patient("a"), 0, listener);
        SlotRequest b = place.request(patient("b"), 0, listener);
        SlotRequest c = place.request(patient("c"), 0, listener);
        SlotRequest d = place.request(patient("d"), 0, listener);

        assertThat(place.getMarking()).isEqualTo(2);
        assertThat(place.getQueueLength()).isEqualTo(2);
        assertThat(c.getState()).isEqualTo(SlotRequest.State.WAITING);

        scheduler.runUntil(0.0);
        assertThat(granted).containsExactly(a, b);

        scheduler.runUntil(3.0);
        place.release(b);
        place.release(a);
        scheduler.runUntil(3.0);

        assertThat(granted).containsExactly(a, b, c, d);
        assertThat(c.getWaitMinutes()).isEqualTo(3.0);
        assertThat(place.getMarking()).isEqualTo(2);
        assertThat(place.getQueueLength()).isZero();
    }

    @Test
    void grantedSlotIsTheLowestFreeIndex() {
        SlotRequest a = place.request(patient("a"), 0, listener);
        SlotRequest b = place.request(patient("b"), 0, listener);
        assertThat(a.getSlot()).isZero();
        assertThat(b.getSlot()).isEqualTo(1);

        place.release(a);
        SlotRequest c = place.request(patient("c"), 0, listener);
        assertThat(c.getSlot()).isZero();
        assertThat(place.getHolder(0)).isSameAs(c);
    }

    @Test
    void markingStaysWithinCapacityAndLedgerBalances() {
        List<SlotRequest> requests = new ArrayList<>();
        for (int i = 0; i < 6; i++) {
            requests.add(place.request(patient("p" + i), 0, listener));
            assertThat(place.getMarking()).isBetween(0, place.getCapacity());
        }
        while (!granted.isEmpty() || place.getMarking() > 0) {
            scheduler.runUntil(scheduler.now());
            List<SlotRequest> batch = new ArrayList<>(granted);
            granted.clear();
            for (SlotRequest r : batch) {
                place.release(r);
                assertThat(place.getMarking()).isBetween(0, place.getCapacity());
            }
        }
        assertThat(place.getGrantCount()).isEqualTo(6);
        assertThat(place.getReleaseCount()).isEqualTo(6);
        for (SlotRequest r : requests) {
            assertThat(r.getPatient().isLedgerBalanced()).isTrue();
            assertThat(r.getState()).isEqualTo(SlotRequest.State.RELEASED);
        }
    }

    @Test
    void doubleReleaseViolatesTheInvariant() {
        SlotRequest a = place.request(patient("a"), 0, listener);
        place.release(a);
        assertThatThrownBy(() -> place.release(a)).isInstanceOf(InvariantViolationException.class);
        assertThat(place.getMarking()).isZero();
    }

    @Test
    void releasingASlotHeldElsewhereViolatesTheInvariant() {
        FifoResourcePlace other = new FifoResourcePlace("h1", ResourceClass.REGISTRATION, 1,
                scheduler, new SimulationEventLogger());
        SlotRequest foreign = other.request(patient("x"), 0, listener);
        place.request(patient("a"), 0, listener);

        assertThatThrownBy(() -> place.release(foreign)).isInstanceOf(InvariantViolationException.class);
        assertThat(place.getMarking()).isEqualTo(1);
    }

    @Test
    void cancelOnlyWithdrawsWaitingRequests() {
        SlotRequest a = place.request(patient("a"), 0, listener);
        place.request(patient("b"), 0, listener);
        SlotRequest c = place.request(patient("c"), 0, listener);

        assertThat(place.cancel(a)).isFalse();
        assertThat(place.cancel(c)).isTrue();
        assertThat(c.getState()).isEqualTo(SlotRequest.State.CANCELLED);
        assertThat(place.getQueueLength()).isZero();
        assertThat(place.cancel(c)).isFalse();
        assertThat(place.getCancelCount()).isEqualTo(1);
    }

    @Test
    void rejectsZeroCapacity() {
        assertThatThrownBy(() -> new FifoResourcePlace("h1", ResourceClass.OBSERVATION, 0,
                scheduler, new SimulationEventLogger()))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
