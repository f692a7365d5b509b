package org.edsim.coordinator.incident;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;

import org.edsim.coordinator.CoordinatorFixtures;
import org.edsim.model.GeoLocation;
import org.junit.jupiter.api.Test;

class IncidentAllocatorTest {

    private final IncidentAllocator allocator = new IncidentAllocator(0.35, 0.40, 0.25);

    private static int sum(Map<String, Integer> allocation) {
        int total = 0;
        for (int n : allocation.values()) {
            total += n;
        }
        return total;
    }

    @Test
    void equidistantEquallyLoadedHospitalsShareEvenly() {
        List<HospitalLoad> loads = Arrays.asList(
                new HospitalLoad("east", CoordinatorFixtures.EAST, 0.3, 10.0),
                new HospitalLoad("west", CoordinatorFixtures.WEST, 0.3, 10.0));

        Map<String, Integer> allocation = allocator.allocate(CoordinatorFixtures.MIDPOINT, 20, loads);

        assertThat(allocation.get("east")).isBetween(9, 11);
        assertThat(allocation.get("west")).isBetween(9, 11);
        assertThat(sum(allocation)).isEqualTo(20);
    }

    @Test
    void quotasAlwaysAddUpToThePatientCount() {
        List<HospitalLoad> loads = Arrays.asList(
                new HospitalLoad("a", new GeoLocation(43.3487, -8.4066), 0.9, 45.0),
                new HospitalLoad("b", new GeoLocation(43.3623, -8.4115), 0.2, 5.0),
                new HospitalLoad("c", new GeoLocation(43.3571, -8.4189), 0.55, 20.0));
        for (int patients = 1; patients <= 60; patients++) {
            Map<String, Integer> allocation = allocator.allocate(new GeoLocation(43.36, -8.41), patients, loads);
            assertThat(sum(allocation)).as("patients=%d", patients).isEqualTo(patients);
            for (int n : allocation.values()) {
                assertThat(n).isNotNegative();
            }
        }
    }

    @Test
    void closerAndLessSaturatedHospitalsGetMore() {
        GeoLocation site = new GeoLocation(43.35, -8.381);
        Map<String, Integer> byDistance = allocator.allocate(site, 30, Arrays.asList(
                new HospitalLoad("east", CoordinatorFixtures.EAST, 0.3, 10.0),
                new HospitalLoad("west", CoordinatorFixtures.WEST, 0.3, 10.0)));
        assertThat(byDistance.get("east")).isGreaterThan(byDistance.get("west"));

        Map<String, Integer> bySaturation = allocator.allocate(CoordinatorFixtures.MIDPOINT, 30, Arrays.asList(
                new HospitalLoad("east", CoordinatorFixtures.EAST, 0.95, 10.0),
                new HospitalLoad("west", CoordinatorFixtures.WEST, 0.10, 10.0)));
        assertThat(bySaturation.get("west")).isGreaterThan(bySaturation.get("east"));
    }

    @Test
    void equalRemaindersGoToTheHospitalListedFirst() {
        GeoLocation site = new GeoLocation(43.35, -8.40);
        List<HospitalLoad> loads = new ArrayList<>();
        for (String id : new String[] {"a", "b", "c"}) {
            loads.add(new HospitalLoad(id, site, 0.5, 10.0));
        }
        Map<String, Integer> allocation = allocator.allocate(site, 10, loads);
        assertThat(new ArrayList<>(allocation.values())).containsExactly(4, 3, 3);
        assertThat(new ArrayList<>(allocation.keySet())).containsExactly("a", "b", "c");
    }

    @Test
    void rejectsAnEmptyNetwork() {
        assertThatThrownBy(() -> allocator.allocate(CoordinatorFixtures.MIDPOINT, 5,
                Collections.<HospitalLoad>emptyList()))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
