package org.edsim.hospital;

import java.util.EnumMap;
import java.util.Map;

import org.edsim.model.TriageLevel;

/**
 * Wait and service statistics of one hospital: trailing windows for the
 * live snapshot and cumulative totals for the end-of-run summary.
 */
public class HospitalStatistics {

    private final TrailingWindow registrationWait;
    private final TrailingWindow triageWait;
    private final TrailingWindow consultationWait;
    private final TrailingWindow consultationService;
    private final TrailingWindow arrivals;
    private final TrailingWindow treated;

    private final double[] roomServiceTotal;
    private final int[] roomServiceCount;
    private final Map<TriageLevel, double[]> waitByLevel = new EnumMap<>(TriageLevel.class);
    private double timeInSystemTotal;
    private int timeInSystemCount;

    public HospitalStatistics(double windowMinutes, int rooms) {
        this.registrationWait = new TrailingWindow(windowMinutes);
        this.triageWait = new TrailingWindow(windowMinutes);
        this.consultationWait = new TrailingWindow(windowMinutes);
        this.consultationService = new TrailingWindow(windowMinutes);
        // throughput is always reported per hour
        this.arrivals = new TrailingWindow(60.0);
        this.treated = new TrailingWindow(60.0);
        this.roomServiceTotal = new double[rooms];
        this.roomServiceCount = new int[rooms];
        for (TriageLevel level : TriageLevel.values()) {
            waitByLevel.put(level, new double[2]);
        }
    }

    // ========== Recording ==========

    public void recordArrival(double time) {
        arrivals.add(time, 1.0);
    }

    public void recordRegistrationWait(double time, double minutes) {
        registrationWait.add(time, minutes);
    }

    public void recordTriageWait(double time, double minutes) {
        triageWait.add(time, minutes);
    }

    public void recordConsultationWait(double time, TriageLevel level, double minutes) {
        consultationWait.add(time, minutes);
        double[] acc = waitByLevel.get(level);
        acc[0] += minutes;
        acc[1] += 1.0;
    }

    public void recordConsultationService(double time, int room, double minutes) {
        consultationService.add(time, minutes);
        treated.add(time, 1.0);
        roomServiceTotal[room] += minutes;
        roomServiceCount[room]++;
    }

    public void recordTimeInSystem(double minutes) {
        timeInSystemTotal += minutes;
        timeInSystemCount++;
    }

    // ========== Trailing window ==========

    public double meanRegistrationWait(double now) { return registrationWait.mean(now); }
    public double meanTriageWait(double now) { return triageWait.mean(now); }
    public double meanConsultationWait(double now) { return consultationWait.mean(now); }
    public double meanConsultationService(double now) { return consultationService.mean(now); }
    public int arrivalsLastHour(double now) { return arrivals.count(now); }
    public int treatedLastHour(double now) { return treated.count(now); }

    // ========== Cumulative ==========

    /** Mean service minutes of consultations held in the room; 0 if none. */
    public double meanRoomService(int room) {
        return roomServiceCount[room] == 0 ? 0.0 : roomServiceTotal[room] / roomServiceCount[room];
    }

    public int roomServiceCount(int room) {
        return roomServiceCount[room];
    }

    public double meanWait(TriageLevel level) {
        double[] acc = waitByLevel.get(level);
        return acc[1] == 0.0 ? 0.0 : acc[0] / acc[1];
    }

    public int consultations(TriageLevel level) {
        return (int) waitByLevel.get(level)[1];
    }

    public double meanTimeInSystem() {
        return timeInSystemCount == 0 ? 0.0 : timeInSystemTotal / timeInSystemCount;
    }
}
