package org.edsim.engine;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.apache.log4j.Logger;
import org.edsim.config.SimulationConfig;
import org.edsim.demand.DemandFactorAggregator;
import org.edsim.events.EventPublisher;
import org.edsim.exceptions.ConfigurationException;
import org.edsim.hospital.Hospital;
import org.edsim.hospital.SaturationCalculator;
import org.edsim.logger.SimulationEventLogger;
import org.edsim.model.HospitalConfig;
import org.edsim.triage.TriageClassifier;
import org.edsim.utils.StochasticSampler;

/**
 * Everything one simulation run shares: configuration, clock, random source,
 * event logger, publisher and the hospitals. Passed explicitly to every
 * component; there is no global state, so several runs can coexist in one JVM.
 */
public class SimulationContext {

    private static final Logger logger = Logger.getLogger(SimulationContext.class);

    private final SimulationConfig config;
    private final EventScheduler scheduler;
    private final SimulationCalendar calendar;
    private final StochasticSampler sampler;
    private final SimulationEventLogger eventLogger;
    private final EventPublisher publisher;
    private final Map<String, Hospital> hospitals = new LinkedHashMap<>();
    private final SaturationCalculator saturationCalculator;
    private final TriageClassifier triageClassifier;
    private final DemandFactorAggregator demandAggregator;
    private boolean closed;

    private SimulationContext(SimulationConfig config, EventPublisher publisher, SimulationEventLogger eventLogger) {
        this.config = config;
        this.publisher = publisher;
        this.eventLogger = eventLogger;
        this.scheduler = new EventScheduler(config.getTimeScale());
        this.calendar = new SimulationCalendar(config.getStartDateTime());
        this.sampler = new StochasticSampler(config.getSeed());
        for (HospitalConfig h : config.getHospitals()) {
            boolean reference = h.getId().equals(config.getReferenceHospitalId());
            hospitals.put(h.getId(), new Hospital(h, reference, config.getStatisticsWindowMinutes(),
                    scheduler, eventLogger));
        }
        this.saturationCalculator = new SaturationCalculator(config.getConsultationWeight(),
                config.getObservationWeight(), config.getQueueWeight());
        this.triageClassifier = new TriageClassifier(sampler, config.isConditionBias());
        this.demandAggregator = new DemandFactorAggregator(config, calendar, sampler, hospitals);
    }

    /**
     * Validates the configuration and builds the context.
     *
     * @throws ConfigurationException if the configuration is invalid; nothing is started
     */
    public static SimulationContext create(SimulationConfig config, EventPublisher publisher)
            throws ConfigurationException {
        return create(config, publisher, new SimulationEventLogger());
    }

    public static SimulationContext create(SimulationConfig config, EventPublisher publisher,
                                           SimulationEventLogger eventLogger) throws ConfigurationException {
        config.validate();
        if (publisher == null) {
            throw new ConfigurationException("An event publisher is required");
        }
        SimulationContext context = new SimulationContext(config, publisher, eventLogger);
        logger.info(String.format("CONTEXT_CREATED: hospitals=%s, reference=%s, seed=%d, timeScale=%.2f",
                context.hospitals.keySet(), config.getReferenceHospitalId(), config.getSeed(), config.getTimeScale()));
        return context;
    }

    // ========== Hospitals ==========

    public Hospital getHospital(String id) {
        return hospitals.get(id);
    }

    public Hospital getReferenceHospital() {
        return hospitals.get(config.getReferenceHospitalId());
    }

    /** Hospitals in configuration order. */
    public List<Hospital> getHospitals() {
        return Collections.unmodifiableList(new ArrayList<>(hospitals.values()));
    }

    // ========== Shared services ==========

    public SimulationConfig getConfig() { return config; }
    public EventScheduler getScheduler() { return scheduler; }
    public SimulationCalendar getCalendar() { return calendar; }
    public StochasticSampler getSampler() { return sampler; }
    public SimulationEventLogger getEventLogger() { return eventLogger; }
    public EventPublisher getPublisher() { return publisher; }
    public SaturationCalculator getSaturationCalculator() { return saturationCalculator; }
    public TriageClassifier getTriageClassifier() { return triageClassifier; }
    public DemandFactorAggregator getDemandAggregator() { return demandAggregator; }

    public double now() {
        return scheduler.now();
    }

    /** Closes the publisher. Safe to call more than once. */
    public synchronized void close() {
        if (closed) {
            return;
        }
        closed = true;
        scheduler.stop();
        publisher.close();
        logger.info(String.format("CONTEXT_CLOSED: t=%.2f, callbacks=%d", scheduler.now(), scheduler.getExecutedCount()));
    }

    public synchronized boolean isClosed() {
        return closed;
    }
}
