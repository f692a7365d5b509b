package org.edsim.monitor;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.apache.log4j.Logger;
import org.edsim.config.SimulationConfig;
import org.edsim.engine.EventScheduler;
import org.edsim.engine.SimulationContext;
import org.edsim.events.HospitalSnapshot;
import org.edsim.events.QueueAlertEvent;
import org.edsim.hospital.Hospital;
import org.edsim.hospital.HospitalStatistics;
import org.edsim.places.ConsultationRoomPlace;

/**
 * MetricsAggregator - periodic, read-only sampling of every hospital
 *
 * SNAPSHOT
 * ========
 * At every sampling instant one {@link HospitalSnapshot} per hospital is
 * built from the places (occupancy, capacity, queue), the trailing-window
 * statistics (mean waits, mean consultation service, last-hour throughput)
 * and the counters (diversions, SLA breaches), then published.
 *
 * QUEUE ALERT
 * ===========
 * A QUEUE_ALERT is published when the consultation queue exceeds
 * queueAlertFactor x consultation capacity. It fires once per excursion and
 * re-arms when the queue drops back to the threshold.
 *
 * SYSTEM STATUS
 * =============
 *   CRITICAL   some hospital has its emergency flag active
 *   ALERT      some hospital is at or above the low saturation threshold
 *   ATTENTION  mean saturation above 0.5
 *   NORMAL     otherwise
 */
public class MetricsAggregator {

    private static final Logger logger = Logger.getLogger(MetricsAggregator.class);

    static final double ATTENTION_MEAN_SATURATION = 0.5;

    /** System summaries kept for queries; the peak status covers the whole run. */
    public static final int RECENT_SUMMARY_CAPACITY = 720;

    private final SimulationContext context;
    private final SimulationConfig config;
    private final EventScheduler scheduler;

    private final Map<String, HospitalSnapshot> latest = new LinkedHashMap<>();
    private final Set<String> queueAlertActive = new HashSet<>();
    private final Deque<SystemSummary> summaries = new ArrayDeque<>();
    private SystemStatus peakStatus = SystemStatus.NORMAL;

    private boolean running;
    private int samples;

    public MetricsAggregator(SimulationContext context) {
        this.context = context;
        this.config = context.getConfig();
        this.scheduler = context.getScheduler();
    }

    // ========== Sampling ==========

    public void start() {
        if (running) {
            return;
        }
        running = true;
        scheduleSample(config.getMetricsIntervalMinutes());
    }

    public void stop() {
        running = false;
    }

    private void scheduleSample(double delay) {
        scheduler.schedule(delay, "metrics-sample", new Runnable() {
            @Override
            public void run() {
                if (running) {
                    sample();
                    scheduleSample(config.getMetricsIntervalMinutes());
                }
            }
        });
    }

    /** Takes one snapshot of every hospital and publishes it. */
    public SystemSummary sample() {
        double now = scheduler.now();
        for (Hospital hospital : context.getHospitals()) {
            HospitalSnapshot snapshot = snapshot(hospital, now);
            latest.put(hospital.getId(), snapshot);
            context.getPublisher().publish(snapshot);
            checkQueueAlert(hospital, now);
        }
        samples++;
        SystemSummary summary = summarize(now);
        if (summaries.size() == RECENT_SUMMARY_CAPACITY) {
            summaries.removeFirst();
        }
        summaries.addLast(summary);
        if (summary.getStatus().compareTo(peakStatus) > 0) {
            peakStatus = summary.getStatus();
        }
        if (logger.isDebugEnabled()) {
            logger.debug("METRICS_SAMPLE: " + summary);
        }
        return summary;
    }

    HospitalSnapshot snapshot(Hospital hospital, double now) {
        HospitalStatistics stats = hospital.getStatistics();
        ConsultationRoomPlace consultation = hospital.getConsultation();
        return HospitalSnapshot.builder(hospital.getId(), now)
                .registration(hospital.getRegistration().getMarking(), hospital.getRegistration().getCapacity(),
                        hospital.getRegistration().getQueueLength())
                .triage(hospital.getTriage().getMarking(), hospital.getTriage().getCapacity(),
                        hospital.getTriage().getQueueLength())
                .consultation(consultation.getMarking(), consultation.getCapacity(), consultation.getQueueLength())
                .observation(hospital.getObservation().getMarking(), hospital.getObservation().getCapacity(),
                        hospital.getObservation().getQueueLength())
                .waits(stats.meanRegistrationWait(now), stats.meanTriageWait(now), stats.meanConsultationWait(now))
                .meanConsultationService(stats.meanConsultationService(now))
                .throughput(stats.arrivalsLastHour(now), stats.treatedLastHour(now))
                .saturation(context.getSaturationCalculator().compute(hospital), hospital.isEmergencyActive())
                .diversions(hospital.getDiversionsSent(), hospital.getDiversionsReceived())
                .slaBreaches(hospital.getSlaBreaches())
                .build();
    }

    private void checkQueueAlert(Hospital hospital, double now) {
        ConsultationRoomPlace consultation = hospital.getConsultation();
        double threshold = config.getQueueAlertFactor() * consultation.getCapacity();
        int queue = consultation.getQueueLength();
        if (queue > threshold) {
            if (queueAlertActive.add(hospital.getId())) {
                logger.warn(String.format("QUEUE_ALERT: hospital=%s, queue=%d, threshold=%.1f, t=%.2f",
                        hospital.getId(), queue, threshold, now));
                context.getPublisher().publish(new QueueAlertEvent(hospital.getId(), now, queue, threshold));
            }
        } else {
            queueAlertActive.remove(hospital.getId());
        }
    }

    SystemSummary summarize(double now) {
        double total = 0.0;
        int critical = 0;
        int saturated = 0;
        int queued = 0;
        for (HospitalSnapshot snapshot : latest.values()) {
            total += snapshot.getSaturation();
            if (snapshot.isEmergencyActive()) {
                critical++;
            }
            if (snapshot.getSaturation() >= config.getLowThreshold()) {
                saturated++;
            }
            queued += snapshot.getRegistrationQueue() + snapshot.getTriageQueue() + snapshot.getConsultationQueue();
        }
        double mean = latest.isEmpty() ? 0.0 : total / latest.size();
        return new SystemSummary(now, mean, critical, saturated, queued, status(mean, critical, saturated));
    }

    static SystemStatus status(double meanSaturation, int critical, int saturated) {
        if (critical > 0) {
            return SystemStatus.CRITICAL;
        }
        if (saturated > 0) {
            return SystemStatus.ALERT;
        }
        if (meanSaturation > ATTENTION_MEAN_SATURATION) {
            return SystemStatus.ATTENTION;
        }
        return SystemStatus.NORMAL;
    }

    // ========== Query Methods ==========

    public HospitalSnapshot getLatestSnapshot(String hospitalId) {
        return latest.get(hospitalId);
    }

    public Map<String, HospitalSnapshot> getLatestSnapshots() {
        return Collections.unmodifiableMap(latest);
    }

    public SystemSummary getLatestSummary() {
        return summaries.peekLast();
    }

    /** The most recent summaries, oldest first. */
    public List<SystemSummary> getSummaries() {
        return Collections.unmodifiableList(new ArrayList<>(summaries));
    }

    /** Worst status seen over the run so far. */
    public SystemStatus getPeakStatus() {
        return peakStatus;
    }

    public int getSampleCount() {
        return samples;
    }

    public boolean isQueueAlertActive(String hospitalId) {
        return queueAlertActive.contains(hospitalId);
    }
}
