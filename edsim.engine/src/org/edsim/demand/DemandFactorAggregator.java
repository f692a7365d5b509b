package org.edsim.demand;

import java.time.DayOfWeek;
import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.Map;

import org.apache.log4j.Logger;
import org.edsim.config.SimulationConfig;
import org.edsim.engine.EventScheduler;
import org.edsim.engine.SimulationCalendar;
import org.edsim.exceptions.InvalidInputException;
import org.edsim.hospital.Hospital;
import org.edsim.model.DemandContext;
import org.edsim.utils.StochasticSampler;

/**
 * Combines the demand inputs of each hospital into one multiplicative factor,
 * refreshed at every simulated hour.
 *
 * factor = weekday x temperature x precipitation x event x holiday, clamped
 * to [0.5, 3.0]. The hour-of-day profile is kept apart (see
 * {@link #hourFactor(int)}) because the generator applies it per hour.
 * A configured fixed factor replaces the product.
 */
public class DemandFactorAggregator {

    private static final Logger logger = Logger.getLogger(DemandFactorAggregator.class);

    public static final double MIN_FACTOR = 0.5;
    public static final double MAX_FACTOR = 3.0;

    private static final double[] HOURLY_FACTORS = {
        0.7, 0.5, 0.4, 0.3, 0.3, 0.4, 0.6, 0.8,
        1.0, 1.2, 1.3, 1.4, 1.3, 1.2, 1.1, 1.0,
        1.1, 1.2, 1.3, 1.4, 1.3, 1.2, 1.0, 0.8
    };

    private final SimulationConfig config;
    private final SimulationCalendar calendar;
    private final StochasticSampler sampler;
    private final Map<String, Hospital> hospitals;
    private final Map<String, DemandSignal> signals = new LinkedHashMap<>();

    public DemandFactorAggregator(SimulationConfig config, SimulationCalendar calendar,
                                  StochasticSampler sampler, Map<String, Hospital> hospitals) {
        this.config = config;
        this.calendar = calendar;
        this.sampler = sampler;
        this.hospitals = hospitals;
        DemandSignal baseline = new DemandSignal(config.getBaselineTemperature(),
                config.getBaselinePrecipitation(), config.getBaselineEventLoad(), config.isHoliday());
        for (String id : hospitals.keySet()) {
            signals.put(id, baseline);
        }
    }

    // ========== Lifecycle ==========

    /** Computes the current contexts and schedules a refresh at every hour boundary. */
    public void start(final EventScheduler scheduler) {
        refresh(scheduler.now());
        scheduleNextRefresh(scheduler);
    }

    private void scheduleNextRefresh(final EventScheduler scheduler) {
        scheduler.scheduleAt(calendar.nextHourBoundary(scheduler.now()), "demand-refresh", new Runnable() {
            @Override
            public void run() {
                refresh(scheduler.now());
                scheduleNextRefresh(scheduler);
            }
        });
    }

    /** Recomputes every hospital's demand context for the given simulated minute. */
    public void refresh(double simTime) {
        LocalDateTime now = calendar.toDateTime(simTime);
        for (Hospital hospital : hospitals.values()) {
            DemandSignal signal = signals.get(hospital.getId());
            if (config.isSyntheticWeather()) {
                signal = perturb(signal, now.getHour());
            }
            DemandContext context = buildContext(hospital.getId(), simTime, now, signal);
            hospital.setDemandContext(context);
            if (logger.isDebugEnabled()) {
                logger.debug("DEMAND_REFRESH: " + context);
            }
        }
    }

    /**
     * Replaces the external inputs of a hospital. Rejected inputs leave the
     * last-known-good values in force.
     */
    public void applySignal(String hospitalId, DemandSignal signal, double simTime) throws InvalidInputException {
        Hospital hospital = hospitals.get(hospitalId);
        if (hospital == null) {
            throw new InvalidInputException("Unknown hospital " + hospitalId, hospitalId, "demand");
        }
        signal.validate(hospitalId);
        signals.put(hospitalId, signal);
        DemandContext context = buildContext(hospitalId, simTime, calendar.toDateTime(simTime), signal);
        hospital.setDemandContext(context);
        logger.info(String.format("DEMAND_SIGNAL: hospital=%s, %s, factor=%.3f", hospitalId, signal, context.getFactor()));
    }

    // ========== Factors ==========

    private DemandContext buildContext(String hospitalId, double simTime, LocalDateTime now, DemandSignal s) {
        DayOfWeek day = now.getDayOfWeek();
        double factor;
        if (config.getFixedDemandFactor() != null) {
            factor = config.getFixedDemandFactor();
        } else {
            factor = combine(day, s.getTemperature(), s.getPrecipitation(), s.getEventLoad(), s.isHoliday());
        }
        return new DemandContext(hospitalId, simTime, now.getHour(), day, s.isHoliday(),
                s.getTemperature(), s.getPrecipitation(), s.getEventLoad(), factor);
    }

    public static double combine(DayOfWeek day, double temperature, double precipitation,
                                 double eventLoad, boolean holiday) {
        double factor = weekdayFactor(day)
                * temperatureFactor(temperature)
                * precipitationFactor(precipitation)
                * (1.0 + eventLoad)
                * (holiday ? 0.85 : 1.0);
        return Math.max(MIN_FACTOR, Math.min(MAX_FACTOR, factor));
    }

    public static double weekdayFactor(DayOfWeek day) {
        switch (day) {
            case MONDAY:
                return 1.2;
            case FRIDAY:
                return 1.1;
            case SATURDAY:
                return 1.3;
            case SUNDAY:
                return 1.2;
            default:
                return 1.0;
        }
    }

    public static double temperatureFactor(double celsius) {
        if (celsius < 5.0) {
            return 1.3;
        } else if (celsius < 10.0) {
            return 1.15;
        } else if (celsius > 32.0) {
            return 1.25;
        } else if (celsius > 28.0) {
            return 1.1;
        }
        return 1.0;
    }

    public static double precipitationFactor(double mmPerHour) {
        if (mmPerHour > 5.0) {
            return 1.2;
        } else if (mmPerHour > 1.0) {
            return 1.1;
        }
        return 1.0;
    }

    /** Hour-of-day arrival profile; flat when the profile is disabled. */
    public double hourFactor(int hour) {
        return config.isHourlyProfile() ? HOURLY_FACTORS[hour] : 1.0;
    }

    /** Arrivals per hour for the hospital at the given simulated minute. */
    public double hourlyRate(Hospital hospital, double simTime) {
        DemandContext context = hospital.getDemandContext();
        double factor = context == null ? 1.0 : context.getFactor();
        return hospital.getConfig().getBaseHourlyRate() * hourFactor(calendar.hourOfDay(simTime)) * factor;
    }

    /** Diurnal temperature swing and occasional showers around the baseline. */
    private DemandSignal perturb(DemandSignal base, int hour) {
        double diurnal = 4.0 * Math.sin((hour - 9) / 24.0 * 2.0 * Math.PI);
        double temperature = base.getTemperature() + diurnal + sampler.gaussian(0.0, 1.5);
        double rain = base.getPrecipitation();
        if (sampler.bernoulli(0.1)) {
            rain += sampler.uniform(0.0, 8.0);
        }
        return new DemandSignal(temperature, rain, base.getEventLoad(), base.isHoliday());
    }

    public DemandSignal getSignal(String hospitalId) {
        return signals.get(hospitalId);
    }
}
