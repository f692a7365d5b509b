package org.edsim.coordinator.incident;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.edsim.model.GeoLocation;
import org.edsim.utils.GeoUtils;

/**
 * Splits the victims of an incident across hospitals.
 *
 * Each hospital scores
 * <pre>
 *   w_d * norm(1 / (distanceKm + 0.1)) + w_s * norm(1 / (saturation + 0.01)) + w_w * norm(1 / (meanWait + 1))
 * </pre>
 * where norm divides by the largest value among the hospitals. Quotas are the
 * score shares of the patient count, rounded by largest remainder so they add
 * up to the count exactly. Equal remainders go to the hospital listed first.
 */
public class IncidentAllocator {

    static final double DISTANCE_EPSILON_KM = 0.1;
    static final double SATURATION_EPSILON = 0.01;
    static final double WAIT_EPSILON_MINUTES = 1.0;

    private final double distanceWeight;
    private final double saturationWeight;
    private final double waitWeight;

    public IncidentAllocator(double distanceWeight, double saturationWeight, double waitWeight) {
        this.distanceWeight = distanceWeight;
        this.saturationWeight = saturationWeight;
        this.waitWeight = waitWeight;
    }

    /**
     * @return patients per hospital id, in the order of {@code loads}; sums to {@code patients}
     */
    public Map<String, Integer> allocate(GeoLocation site, int patients, List<HospitalLoad> loads) {
        int n = loads.size();
        if (n == 0) {
            throw new IllegalArgumentException("No hospitals to allocate to");
        }
        double[] inverseDistance = new double[n];
        double[] inverseSaturation = new double[n];
        double[] inverseWait = new double[n];
        for (int i = 0; i < n; i++) {
            HospitalLoad load = loads.get(i);
            inverseDistance[i] = 1.0 / (GeoUtils.haversineKm(site, load.getLocation()) + DISTANCE_EPSILON_KM);
            inverseSaturation[i] = 1.0 / (Math.max(0.0, load.getSaturation()) + SATURATION_EPSILON);
            inverseWait[i] = 1.0 / (Math.max(0.0, load.getMeanWaitMinutes()) + WAIT_EPSILON_MINUTES);
        }
        normalise(inverseDistance);
        normalise(inverseSaturation);
        normalise(inverseWait);

        double[] scores = new double[n];
        double total = 0.0;
        for (int i = 0; i < n; i++) {
            scores[i] = distanceWeight * inverseDistance[i]
                    + saturationWeight * inverseSaturation[i]
                    + waitWeight * inverseWait[i];
            total += scores[i];
        }

        final int[] quotas = new int[n];
        final double[] remainders = new double[n];
        int assigned = 0;
        for (int i = 0; i < n; i++) {
            double share = total > 0.0 ? patients * scores[i] / total : (double) patients / n;
            quotas[i] = (int) Math.floor(share);
            remainders[i] = share - quotas[i];
            assigned += quotas[i];
        }

        List<Integer> order = new ArrayList<>();
        for (int i = 0; i < n; i++) {
            order.add(i);
        }
        Collections.sort(order, new Comparator<Integer>() {
            @Override
            public int compare(Integer a, Integer b) {
                int byRemainder = Double.compare(remainders[b], remainders[a]);
                return byRemainder != 0 ? byRemainder : Integer.compare(a, b);
            }
        });
        for (int k = 0; assigned < patients; k = (k + 1) % n) {
            quotas[order.get(k)]++;
            assigned++;
        }

        Map<String, Integer> allocation = new LinkedHashMap<>();
        for (int i = 0; i < n; i++) {
            allocation.put(loads.get(i).getHospitalId(), quotas[i]);
        }
        return allocation;
    }

    private static void normalise(double[] values) {
        double max = 0.0;
        for (double v : values) {
            max = Math.max(max, v);
        }
        if (max <= 0.0) {
            return;
        }
        for (int i = 0; i < values.length; i++) {
            values[i] /= max;
        }
    }
}
