package org.edsim.generator;

import org.apache.log4j.Logger;
import org.edsim.demand.DemandFactorAggregator;
import org.edsim.engine.EventScheduler;
import org.edsim.engine.SimulationContext;
import org.edsim.flow.DiversionHandler;
import org.edsim.flow.PatientFlowProcess;
import org.edsim.hospital.Hospital;
import org.edsim.model.Patient;
import org.edsim.model.PatientSource;
import org.edsim.model.PresentingCondition;
import org.edsim.model.Sex;
import org.edsim.utils.StochasticSampler;

/**
 * Patient Generator
 * Synthesizes arrivals for one hospital as a non-homogeneous Poisson process.
 *
 * ================================================================================
 * ARRIVAL RATE
 * ================================================================================
 *
 *   rate(t) = baseHourlyRate x hourFactor(hour of t) x demandFactor(t)   [patients/hour]
 *
 * Gaps are exponential with the current rate. The rate only changes at hour
 * boundaries, so a gap that would cross the next boundary is discarded and
 * the process restarts at the boundary with the new rate. The exponential
 * distribution is memoryless, which makes this an exact piecewise-constant
 * Poisson process.
 *
 * ================================================================================
 * PATIENT ATTRIBUTES
 * ================================================================================
 *
 *   age        weighted age band, uniform within the band
 *   sex        F 52% / M 48%
 *   condition  one of the presenting-condition categories, by frequency
 *
 * Incident victims are injected with {@link #injectPatient} and carry the
 * incident's triage level mix.
 */
public class PatientGenerator {

	private static final Logger logger = Logger.getLogger(PatientGenerator.class);

	// age bands {min, max} and their weights
	private static final int[][] AGE_BANDS = {
		{0, 5}, {6, 17}, {18, 35}, {36, 55}, {56, 70}, {71, 85}, {86, 100}
	};
	private static final double[] AGE_WEIGHTS = {0.08, 0.12, 0.22, 0.25, 0.18, 0.12, 0.03};

	private static final double FEMALE_SHARE = 0.52;

	private static final PresentingCondition[] CONDITIONS = PresentingCondition.values();
	private static final double[] CONDITION_WEIGHTS = new double[CONDITIONS.length];
	static {
		for (int i = 0; i < CONDITIONS.length; i++) {
			CONDITION_WEIGHTS[i] = CONDITIONS[i].getFrequency();
		}
	}

	private final SimulationContext context;
	private final Hospital hospital;
	private final DiversionHandler diversionHandler;
	private final EventScheduler scheduler;
	private final StochasticSampler sampler;
	private final DemandFactorAggregator demand;

	private boolean running;
	private int generated;
	private int injected;

	public PatientGenerator(SimulationContext context, Hospital hospital, DiversionHandler diversionHandler) {
		this.context = context;
		this.hospital = hospital;
		this.diversionHandler = diversionHandler;
		this.scheduler = context.getScheduler();
		this.sampler = context.getSampler();
		this.demand = context.getDemandAggregator();
	}

	// ========== Lifecycle ==========

	public void start() {
		if (running) {
			return;
		}
		running = true;
		logger.info(String.format("GENERATOR_STARTED: hospital=%s, baseRate=%.1f/h",
				hospital.getId(), hospital.getConfig().getBaseHourlyRate()));
		scheduleNext();
	}

	/** No further walk-in arrivals are created; pending callbacks become no-ops. */
	public void stop() {
		running = false;
	}

	private void scheduleNext() {
		if (!running) {
			return;
		}
		double now = scheduler.now();
		double boundary = context.getCalendar().nextHourBoundary(now);
		double ratePerMinute = demand.hourlyRate(hospital, now) / 60.0;

		if (ratePerMinute > 0.0) {
			double gap = sampler.exponential(ratePerMinute);
			if (now + gap < boundary) {
				scheduler.schedule(gap, hospital.getId() + " arrival", new Runnable() {
					@Override
					public void run() {
						if (running) {
							arrive(PatientSource.WALK_IN, null, null);
							scheduleNext();
						}
					}
				});
				return;
			}
		}
		// gap crosses the hour: resample with the next hour's rate
		scheduler.scheduleAt(boundary, hospital.getId() + " rate-resample", new Runnable() {
			@Override
			public void run() {
				scheduleNext();
			}
		});
	}

	// ========== Patient creation ==========

	/**
	 * Schedules the arrival of an external patient (incident victim) after
	 * the given delay. Works whether or not walk-in generation is running.
	 */
	public void injectPatient(final String incidentId, final double[] severityMix, double delayMinutes) {
		injected++;
		scheduler.schedule(delayMinutes, hospital.getId() + " incident-arrival", new Runnable() {
			@Override
			public void run() {
				arrive(PatientSource.INCIDENT, incidentId, severityMix);
			}
		});
	}

	private Patient arrive(PatientSource source, String incidentId, double[] severityMix) {
		Patient patient = createPatient(source, incidentId);
		if (severityMix != null) {
			patient.setForcedTriageMix(severityMix.clone());
		}
		generated++;
		PatientFlowProcess.arrive(context, hospital, patient, diversionHandler);
		return patient;
	}

	Patient createPatient(PatientSource source, String incidentId) {
		int band = sampler.weightedIndex(AGE_WEIGHTS);
		int age = sampler.uniformInt(AGE_BANDS[band][0], AGE_BANDS[band][1]);
		Sex sex = sampler.bernoulli(FEMALE_SHARE) ? Sex.FEMALE : Sex.MALE;
		PresentingCondition condition = CONDITIONS[sampler.weightedIndex(CONDITION_WEIGHTS)];
		return new Patient(hospital.nextPatientId(), hospital.getId(), scheduler.now(),
				age, sex, condition, source, incidentId);
	}

	// ========== Query Methods ==========

	public Hospital getHospital() {
		return hospital;
	}

	public boolean isRunning() {
		return running;
	}

	/** Patients created so far (walk-ins and incident victims that have arrived). */
	public int getGeneratedCount() {
		return generated;
	}

	/** Incident victims scheduled so far, arrived or not. */
	public int getInjectedCount() {
		return injected;
	}
}
