package org.edsim.runner;

import java.sql.SQLException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.apache.log4j.Logger;
import org.edsim.config.SimulationConfig;
import org.edsim.coordinator.HospitalCoordinator;
import org.edsim.coordinator.incident.RandomIncidentSource;
import org.edsim.derby.DerbyEventStore;
import org.edsim.engine.SimulationContext;
import org.edsim.events.EventPublisher;
import org.edsim.exceptions.ConfigurationException;
import org.edsim.exceptions.InvalidInputException;
import org.edsim.generator.PatientGenerator;
import org.edsim.hospital.Hospital;
import org.edsim.model.Incident;
import org.edsim.monitor.MetricsAggregator;
import org.edsim.publish.AsyncEventPublisher;
import org.edsim.publish.EventSink;
import org.edsim.publish.JsonLogEventSink;

/**
 * HospitalNetworkSimulation - one fully wired run
 *
 * ASSEMBLY
 * ========
 * context (clock, hospitals, shared services) -> demand refresh ->
 * coordinator -> one generator per hospital -> metrics sampling ->
 * scenario incidents at their configured start times -> optional random
 * incidents.
 *
 * Everything runs on the thread that calls {@link #run()}; other threads
 * talk to the run through the coordinator's control inbox.
 */
public class HospitalNetworkSimulation {

	private static final Logger logger = Logger.getLogger(HospitalNetworkSimulation.class);

	private final SimulationConfig config;
	private final SimulationContext context;
	private final HospitalCoordinator coordinator;
	private final MetricsAggregator metrics;
	private final List<PatientGenerator> generators = new ArrayList<>();
	private final RandomIncidentSource randomIncidents;
	private final DerbyEventStore derbyStore;

	private boolean started;
	private long wallClockMillis;

	public HospitalNetworkSimulation(SimulationConfig config, EventPublisher publisher) throws ConfigurationException {
		this(config, publisher, null);
	}

	private HospitalNetworkSimulation(SimulationConfig config, EventPublisher publisher, DerbyEventStore derbyStore)
			throws ConfigurationException {
		this.config = config;
		this.derbyStore = derbyStore;
		this.context = SimulationContext.create(config, publisher);
		this.coordinator = new HospitalCoordinator(context);
		this.metrics = new MetricsAggregator(context);
		for (Hospital hospital : context.getHospitals()) {
			PatientGenerator generator = new PatientGenerator(context, hospital, coordinator);
			generators.add(generator);
			coordinator.registerGenerator(generator);
		}
		this.randomIncidents = config.isRandomIncidents() ? new RandomIncidentSource(coordinator) : null;
	}

	/**
	 * Builds a run publishing through the sinks the configuration asks for,
	 * behind an asynchronous bounded buffer.
	 */
	public static HospitalNetworkSimulation withConfiguredSinks(SimulationConfig config) throws ConfigurationException {
		List<EventSink> sinks = new ArrayList<>();
		if (config.isJsonLogSink()) {
			sinks.add(new JsonLogEventSink(false));
		}
		DerbyEventStore store = null;
		if (config.isDerbySink()) {
			try {
				store = new DerbyEventStore(config.getDerbyUrl());
			} catch (SQLException e) {
				throw new ConfigurationException("Cannot open Derby store " + config.getDerbyUrl(), e);
			}
			sinks.add(store);
		}
		AsyncEventPublisher publisher = new AsyncEventPublisher(config.getPublishBufferSize(), sinks);
		try {
			return new HospitalNetworkSimulation(config, publisher, store);
		} catch (ConfigurationException e) {
			publisher.close();
			throw e;
		}
	}

	// ========== Lifecycle ==========

	/** Wires the periodic processes. Called by {@link #run()} if not called before. */
	public void start() {
		if (started) {
			return;
		}
		started = true;
		context.getDemandAggregator().start(context.getScheduler());
		coordinator.start();
		for (PatientGenerator generator : generators) {
			generator.start();
		}
		metrics.start();
		for (Incident incident : config.getScenarioIncidents()) {
			scheduleScenarioIncident(incident);
		}
		if (randomIncidents != null) {
			randomIncidents.start();
		}
		logger.info(String.format("SIMULATION_STARTED: hospitals=%d, duration=%.0f min, seed=%d, scenarioIncidents=%d",
				generators.size(), config.getDurationMinutes(), config.getSeed(), config.getScenarioIncidents().size()));
	}

	private void scheduleScenarioIncident(final Incident incident) {
		context.getScheduler().scheduleAt(incident.getStartTime(), "scenario " + incident.getId(), new Runnable() {
			@Override
			public void run() {
				try {
					coordinator.ingestIncident(incident);
				} catch (InvalidInputException e) {
					logger.warn(String.format("SCENARIO_INCIDENT_REJECTED: id=%s, reason=%s", incident.getId(), e));
				}
			}
		});
	}

	/** Runs the configured duration and takes a final metrics sample. */
	public void run() {
		start();
		long wallStart = System.currentTimeMillis();
		context.getScheduler().runUntil(config.getDurationMinutes());
		metrics.sample();
		wallClockMillis = System.currentTimeMillis() - wallStart;
		logger.info(String.format("SIMULATION_FINISHED: t=%.2f, callbacks=%d, wall=%d ms",
				context.now(), context.getScheduler().getExecutedCount(), wallClockMillis));
	}

	/**
	 * Stops new arrivals and sampling, then lets the patients in the system
	 * finish. Used after {@link #run()} when the end state must be empty.
	 */
	public void drain(double extraMinutes) {
		for (PatientGenerator generator : generators) {
			generator.stop();
		}
		if (randomIncidents != null) {
			randomIncidents.stop();
		}
		metrics.stop();
		context.getScheduler().runUntil(context.now() + extraMinutes);
	}

	/** Asks a run in progress to return after the current callback. */
	public void stop() {
		context.getScheduler().stop();
	}

	public void close() {
		context.close();
	}

	// ========== Query Methods ==========

	public SimulationContext getContext() {
		return context;
	}

	public HospitalCoordinator getCoordinator() {
		return coordinator;
	}

	public MetricsAggregator getMetrics() {
		return metrics;
	}

	public List<PatientGenerator> getGenerators() {
		return Collections.unmodifiableList(generators);
	}

	/** The Derby store when the configuration enabled it, else null. */
	public DerbyEventStore getDerbyStore() {
		return derbyStore;
	}

	public long getWallClockMillis() {
		return wallClockMillis;
	}

	public RunSummary summarize() {
		return RunSummary.of(this);
	}
}
