package org.edsim.coordinator.incident;

import java.util.List;

import org.apache.log4j.Logger;
import org.edsim.coordinator.HospitalCoordinator;
import org.edsim.engine.EventScheduler;
import org.edsim.engine.SimulationContext;
import org.edsim.exceptions.InvalidInputException;
import org.edsim.hospital.Hospital;
import org.edsim.model.GeoLocation;
import org.edsim.model.Incident;
import org.edsim.model.IncidentType;
import org.edsim.utils.StochasticSampler;

/**
 * Raises incidents at random while the run is in progress.
 *
 * Once per simulated hour an incident starts with the hourly share of the
 * configured daily probability. Its type is uniform, its site is near a
 * randomly chosen non-reference hospital, and its victim count and duration
 * are drawn from the ranges of the type.
 */
public class RandomIncidentSource {

    private static final Logger logger = Logger.getLogger(RandomIncidentSource.class);

    /** Largest site offset from the chosen hospital, in degrees. */
    static final double SITE_SPREAD_DEGREES = 0.02;

    private final HospitalCoordinator coordinator;
    private final EventScheduler scheduler;
    private final StochasticSampler sampler;
    private final double hourlyProbability;

    private boolean running;
    private int raised;

    public RandomIncidentSource(HospitalCoordinator coordinator) {
        SimulationContext context = coordinator.getContext();
        this.coordinator = coordinator;
        this.scheduler = context.getScheduler();
        this.sampler = context.getSampler();
        this.hourlyProbability = hourlyProbability(context.getConfig().getRandomIncidentDailyProbability());
    }

    /** Probability per hour that gives the daily probability over 24 independent hours. */
    static double hourlyProbability(double daily) {
        if (daily <= 0.0) {
            return 0.0;
        }
        if (daily >= 1.0) {
            return 1.0;
        }
        return 1.0 - Math.pow(1.0 - daily, 1.0 / 24.0);
    }

    public void start() {
        if (running) {
            return;
        }
        running = true;
        logger.info(String.format("RANDOM_INCIDENTS_STARTED: hourlyProbability=%.5f", hourlyProbability));
        scheduleCheck();
    }

    public void stop() {
        running = false;
    }

    private void scheduleCheck() {
        scheduler.schedule(60.0, "random-incident-check", new Runnable() {
            @Override
            public void run() {
                if (!running) {
                    return;
                }
                if (sampler.bernoulli(hourlyProbability)) {
                    raise();
                }
                scheduleCheck();
            }
        });
    }

    /**
     * Creates and ingests one random incident.
     *
     * @return the incident, or null if the coordinator rejected it
     */
    Incident raise() {
        IncidentType[] types = IncidentType.values();
        IncidentType type = types[sampler.uniformInt(0, types.length - 1)];
        Hospital near = pickSiteHospital();
        GeoLocation base = near.getConfig().getLocation();
        GeoLocation site = new GeoLocation(
                base.getLatitude() + sampler.uniform(-SITE_SPREAD_DEGREES, SITE_SPREAD_DEGREES),
                base.getLongitude() + sampler.uniform(-SITE_SPREAD_DEGREES, SITE_SPREAD_DEGREES));
        int patients = sampler.uniformInt(type.getMinPatients(), type.getMaxPatients());
        double duration = 60.0 * sampler.uniform(type.getMinDurationHours(), type.getMaxDurationHours());

        raised++;
        Incident incident = new Incident("RND-" + raised, type, site, patients, scheduler.now(), duration, null);
        try {
            coordinator.ingestIncident(incident);
            return incident;
        } catch (InvalidInputException e) {
            logger.warn(String.format("RANDOM_INCIDENT_REJECTED: id=%s, reason=%s", incident.getId(), e));
            return null;
        }
    }

    private Hospital pickSiteHospital() {
        List<Hospital> hospitals = coordinator.getContext().getHospitals();
        int nonReference = 0;
        for (Hospital hospital : hospitals) {
            if (!hospital.isReference()) {
                nonReference++;
            }
        }
        if (nonReference == 0) {
            return hospitals.get(sampler.uniformInt(0, hospitals.size() - 1));
        }
        int pick = sampler.uniformInt(0, nonReference - 1);
        for (Hospital hospital : hospitals) {
            if (!hospital.isReference() && pick-- == 0) {
                return hospital;
            }
        }
        throw new IllegalStateException("unreachable");
    }

    public int getRaisedCount() {
        return raised;
    }
}
