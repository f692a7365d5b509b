package org.edsim.utils;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import org.edsim.model.GeoLocation;
import org.junit.jupiter.api.Test;

class GeoUtilsTest {

    @Test
    void oneDegreeOfLatitudeIsAbout111Km() {
        double km = GeoUtils.haversineKm(new GeoLocation(43.0, -8.0), new GeoLocation(44.0, -8.0));
        assertThat(km).isCloseTo(111.19, within(0.1));
    }

    @Test
    void distanceIsSymmetricAndZeroForSamePoint() {
        GeoLocation chuac = new GeoLocation(43.3487, -8.4066);
        GeoLocation modelo = new GeoLocation(43.3623, -8.4115);
        assertThat(GeoUtils.haversineKm(chuac, modelo)).isEqualTo(GeoUtils.haversineKm(modelo, chuac));
        assertThat(GeoUtils.haversineKm(chuac, chuac)).isZero();
    }

    @Test
    void travelTimeHasAFloor() {
        GeoLocation chuac = new GeoLocation(43.3487, -8.4066);
        GeoLocation modelo = new GeoLocation(43.3623, -8.4115);
        // about 1.6 km at 40 km/h is under three minutes
        assertThat(GeoUtils.travelMinutes(chuac, modelo, 40.0, 5.0)).isEqualTo(5.0);
        GeoLocation far = new GeoLocation(43.0, -8.4066);
        assertThat(GeoUtils.travelMinutes(chuac, far, 40.0, 5.0))
                .isCloseTo(GeoUtils.haversineKm(chuac, far) / 40.0 * 60.0, within(1e-9));
    }
}
