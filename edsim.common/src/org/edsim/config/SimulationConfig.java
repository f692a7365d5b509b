package org.edsim.config;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import org.edsim.exceptions.ConfigurationException;
import org.edsim.exceptions.InvalidInputException;
import org.edsim.model.HospitalConfig;
import org.edsim.model.Incident;

/**
 * Complete configuration of a simulation run.
 *
 * Populated by {@link SimulationConfigLoader} (or directly by tests) and
 * checked once by {@link #validate()} before the clock starts. Durations are
 * simulated minutes.
 */
public class SimulationConfig {

    // ========== Run ==========
    private long seed = 42L;
    private double durationMinutes = 1440.0;
    private double timeScale = 0.0;
    private LocalDateTime startDateTime = LocalDateTime.of(2025, 1, 6, 8, 0);

    // ========== Hospitals ==========
    private final List<HospitalConfig> hospitals = new ArrayList<>();
    private String referenceHospitalId;

    // ========== Patient flow ==========
    private double registrationMinutes = 2.0;
    private double triageMinutes = 5.0;
    private double jitterFraction = 0.2;
    private double observationProbability = 0.15;
    private double observationStayMinutes = 240.0;
    private boolean conditionBias = true;

    // ========== Sampling ==========
    private double metricsIntervalMinutes = 2.0;
    private double coordinatorIntervalMinutes = 1.0;
    private double statisticsWindowMinutes = 60.0;

    // ========== Saturation & policy ==========
    private double consultationWeight = 0.5;
    private double observationWeight = 0.2;
    private double queueWeight = 0.3;
    private double highThreshold = 0.85;
    private double lowThreshold = 0.70;
    private double queueAlertFactor = 2.0;
    private boolean loadShedding = false;
    private int loadSheddingBatch = 2;

    // ========== Auto-scaling ==========
    private boolean autoScaling = false;
    private double scaleUpThreshold = 0.80;
    private double scaleDownThreshold = 0.50;
    private int doctorPool = 6;

    // ========== Incidents ==========
    private double distanceWeight = 0.35;
    private double saturationWeight = 0.40;
    private double waitWeight = 0.25;
    private double ambulanceSpeedKmh = 40.0;
    private double minTransferMinutes = 5.0;
    private final List<Incident> scenarioIncidents = new ArrayList<>();
    private boolean randomIncidents = false;
    private double randomIncidentDailyProbability = 0.1;

    // ========== Demand ==========
    private Double fixedDemandFactor;
    private boolean hourlyProfile = true;
    private double baselineTemperature = 14.0;
    private double baselinePrecipitation = 0.0;
    private double baselineEventLoad = 0.0;
    private boolean holiday = false;
    private boolean syntheticWeather = false;

    // ========== Sinks ==========
    private boolean jsonLogSink = true;
    private boolean derbySink = false;
    private String derbyUrl = "jdbc:derby:memory:edsim;create=true";
    private int publishBufferSize = 10000;

    /**
     * Rejects anything that would make the run meaningless or violate an
     * engine invariant. Called before the clock starts; never during a run.
     */
    public void validate() throws ConfigurationException {
        if (hospitals.isEmpty()) {
            throw new ConfigurationException("At least one hospital must be configured");
        }
        Set<String> ids = new HashSet<>();
        for (HospitalConfig h : hospitals) {
            h.validate();
            if (!ids.add(h.getId())) {
                throw new ConfigurationException("Duplicate hospital id " + h.getId(), h.getId(), "id");
            }
        }
        if (referenceHospitalId == null || !ids.contains(referenceHospitalId)) {
            throw new ConfigurationException("Reference hospital '" + referenceHospitalId + "' is not configured",
                    referenceHospitalId, "reference");
        }
        positive(durationMinutes, "durationMinutes");
        nonNegative(timeScale, "timeScale");
        if (startDateTime == null) {
            throw new ConfigurationException("Start date-time is required", null, "start");
        }
        positive(registrationMinutes, "registrationMinutes");
        positive(triageMinutes, "triageMinutes");
        if (jitterFraction < 0.0 || jitterFraction >= 1.0) {
            throw new ConfigurationException("Jitter fraction must be in [0, 1), got " + jitterFraction,
                    null, "jitter");
        }
        probability(observationProbability, "observationProbability");
        positive(observationStayMinutes, "observationStayMinutes");
        positive(metricsIntervalMinutes, "metricsInterval");
        positive(coordinatorIntervalMinutes, "coordinatorInterval");
        positive(statisticsWindowMinutes, "statisticsWindow");
        weights(new double[] {consultationWeight, observationWeight, queueWeight}, "saturationWeights");
        if (!(lowThreshold > 0.0 && lowThreshold < highThreshold)) {
            throw new ConfigurationException(String.format(
                    "Thresholds must satisfy 0 < low < high, got low=%.3f high=%.3f", lowThreshold, highThreshold),
                    null, "thresholds");
        }
        positive(queueAlertFactor, "queueAlertFactor");
        if (loadSheddingBatch < 1) {
            throw new ConfigurationException("Load shedding batch must be at least 1", null, "loadSheddingBatch");
        }
        if (!(scaleDownThreshold >= 0.0 && scaleDownThreshold < scaleUpThreshold)
                || Double.isInfinite(scaleUpThreshold)) {
            throw new ConfigurationException(String.format(
                    "Scaling thresholds must satisfy 0 <= down < up, got down=%.3f up=%.3f",
                    scaleDownThreshold, scaleUpThreshold), null, "scaling");
        }
        if (doctorPool < 0) {
            throw new ConfigurationException("Doctor pool must not be negative, got " + doctorPool, null, "pool");
        }
        weights(new double[] {distanceWeight, saturationWeight, waitWeight}, "incidentWeights");
        positive(ambulanceSpeedKmh, "ambulanceSpeedKmh");
        nonNegative(minTransferMinutes, "minTransferMinutes");
        probability(randomIncidentDailyProbability, "randomIncidentDailyProbability");
        if (fixedDemandFactor != null) {
            positive(fixedDemandFactor, "fixedDemandFactor");
        }
        nonNegative(baselinePrecipitation, "precipitation");
        nonNegative(baselineEventLoad, "eventLoad");
        if (publishBufferSize < 1) {
            throw new ConfigurationException("Publish buffer size must be at least 1", null, "bufferSize");
        }
        for (Incident incident : scenarioIncidents) {
            try {
                incident.validate();
            } catch (InvalidInputException e) {
                throw new ConfigurationException("Invalid scenario incident: " + e.getMessage(), e);
            }
            nonNegative(incident.getStartTime(), "incident.at");
        }
    }

    private static void positive(double value, String setting) throws ConfigurationException {
        if (!(value > 0.0) || Double.isInfinite(value)) {
            throw new ConfigurationException(setting + " must be positive, got " + value, null, setting);
        }
    }

    private static void nonNegative(double value, String setting) throws ConfigurationException {
        if (!(value >= 0.0) || Double.isInfinite(value)) {
            throw new ConfigurationException(setting + " must not be negative, got " + value, null, setting);
        }
    }

    private static void probability(double value, String setting) throws ConfigurationException {
        if (!(value >= 0.0 && value <= 1.0)) {
            throw new ConfigurationException(setting + " must be in [0, 1], got " + value, null, setting);
        }
    }

    private static void weights(double[] values, String setting) throws ConfigurationException {
        double total = 0.0;
        for (double w : values) {
            nonNegative(w, setting);
            total += w;
        }
        if (total <= 0.0) {
            throw new ConfigurationException(setting + " must not all be zero", null, setting);
        }
    }

    // ========== Hospitals ==========

    public List<HospitalConfig> getHospitals() {
        return Collections.unmodifiableList(hospitals);
    }

    public void addHospital(HospitalConfig hospital) {
        hospitals.add(hospital);
    }

    public HospitalConfig getHospital(String id) {
        for (HospitalConfig h : hospitals) {
            if (h.getId().equals(id)) {
                return h;
            }
        }
        return null;
    }

    public String getReferenceHospitalId() { return referenceHospitalId; }
    public void setReferenceHospitalId(String referenceHospitalId) { this.referenceHospitalId = referenceHospitalId; }

    public List<Incident> getScenarioIncidents() {
        return Collections.unmodifiableList(scenarioIncidents);
    }

    public void addScenarioIncident(Incident incident) {
        scenarioIncidents.add(incident);
    }

    // ========== Plain accessors ==========

    public long getSeed() { return seed; }
    public void setSeed(long seed) { this.seed = seed; }
    public double getDurationMinutes() { return durationMinutes; }
    public void setDurationMinutes(double durationMinutes) { this.durationMinutes = durationMinutes; }
    public double getTimeScale() { return timeScale; }
    public void setTimeScale(double timeScale) { this.timeScale = timeScale; }
    public LocalDateTime getStartDateTime() { return startDateTime; }
    public void setStartDateTime(LocalDateTime startDateTime) { this.startDateTime = startDateTime; }

    public double getRegistrationMinutes() { return registrationMinutes; }
    public void setRegistrationMinutes(double registrationMinutes) { this.registrationMinutes = registrationMinutes; }
    public double getTriageMinutes() { return triageMinutes; }
    public void setTriageMinutes(double triageMinutes) { this.triageMinutes = triageMinutes; }
    public double getJitterFraction() { return jitterFraction; }
    public void setJitterFraction(double jitterFraction) { this.jitterFraction = jitterFraction; }
    public double getObservationProbability() { return observationProbability; }
    public void setObservationProbability(double observationProbability) { this.observationProbability = observationProbability; }
    public double getObservationStayMinutes() { return observationStayMinutes; }
    public void setObservationStayMinutes(double observationStayMinutes) { this.observationStayMinutes = observationStayMinutes; }
    public boolean isConditionBias() { return conditionBias; }
    public void setConditionBias(boolean conditionBias) { this.conditionBias = conditionBias; }

    public double getMetricsIntervalMinutes() { return metricsIntervalMinutes; }
    public void setMetricsIntervalMinutes(double metricsIntervalMinutes) { this.metricsIntervalMinutes = metricsIntervalMinutes; }
    public double getCoordinatorIntervalMinutes() { return coordinatorIntervalMinutes; }
    public void setCoordinatorIntervalMinutes(double coordinatorIntervalMinutes) { this.coordinatorIntervalMinutes = coordinatorIntervalMinutes; }
    public double getStatisticsWindowMinutes() { return statisticsWindowMinutes; }
    public void setStatisticsWindowMinutes(double statisticsWindowMinutes) { this.statisticsWindowMinutes = statisticsWindowMinutes; }

    public double getConsultationWeight() { return consultationWeight; }
    public double getObservationWeight() { return observationWeight; }
    public double getQueueWeight() { return queueWeight; }

    public void setSaturationWeights(double consultation, double observation, double queue) {
        this.consultationWeight = consultation;
        this.observationWeight = observation;
        this.queueWeight = queue;
    }

    public double getHighThreshold() { return highThreshold; }
    public void setHighThreshold(double highThreshold) { this.highThreshold = highThreshold; }
    public double getLowThreshold() { return lowThreshold; }
    public void setLowThreshold(double lowThreshold) { this.lowThreshold = lowThreshold; }
    public double getQueueAlertFactor() { return queueAlertFactor; }
    public void setQueueAlertFactor(double queueAlertFactor) { this.queueAlertFactor = queueAlertFactor; }
    public boolean isLoadShedding() { return loadShedding; }
    public void setLoadShedding(boolean loadShedding) { this.loadShedding = loadShedding; }
    public int getLoadSheddingBatch() { return loadSheddingBatch; }
    public void setLoadSheddingBatch(int loadSheddingBatch) { this.loadSheddingBatch = loadSheddingBatch; }

    public boolean isAutoScaling() { return autoScaling; }
    public void setAutoScaling(boolean autoScaling) { this.autoScaling = autoScaling; }
    public double getScaleUpThreshold() { return scaleUpThreshold; }
    public void setScaleUpThreshold(double scaleUpThreshold) { this.scaleUpThreshold = scaleUpThreshold; }
    public double getScaleDownThreshold() { return scaleDownThreshold; }
    public void setScaleDownThreshold(double scaleDownThreshold) { this.scaleDownThreshold = scaleDownThreshold; }

    /** Doctors available network-wide on top of the one every room starts with. */
    public int getDoctorPool() { return doctorPool; }
    public void setDoctorPool(int doctorPool) { this.doctorPool = doctorPool; }

    public double getDistanceWeight() { return distanceWeight; }
    public double getSaturationWeight() { return saturationWeight; }
    public double getWaitWeight() { return waitWeight; }

    public void setIncidentWeights(double distance, double saturation, double wait) {
        this.distanceWeight = distance;
        this.saturationWeight = saturation;
        this.waitWeight = wait;
    }

    public double getAmbulanceSpeedKmh() { return ambulanceSpeedKmh; }
    public void setAmbulanceSpeedKmh(double ambulanceSpeedKmh) { this.ambulanceSpeedKmh = ambulanceSpeedKmh; }
    public double getMinTransferMinutes() { return minTransferMinutes; }
    public void setMinTransferMinutes(double minTransferMinutes) { this.minTransferMinutes = minTransferMinutes; }
    public boolean isRandomIncidents() { return randomIncidents; }
    public void setRandomIncidents(boolean randomIncidents) { this.randomIncidents = randomIncidents; }
    public double getRandomIncidentDailyProbability() { return randomIncidentDailyProbability; }
    public void setRandomIncidentDailyProbability(double p) { this.randomIncidentDailyProbability = p; }

    public Double getFixedDemandFactor() { return fixedDemandFactor; }
    public void setFixedDemandFactor(Double fixedDemandFactor) { this.fixedDemandFactor = fixedDemandFactor; }
    public boolean isHourlyProfile() { return hourlyProfile; }
    public void setHourlyProfile(boolean hourlyProfile) { this.hourlyProfile = hourlyProfile; }
    public double getBaselineTemperature() { return baselineTemperature; }
    public void setBaselineTemperature(double baselineTemperature) { this.baselineTemperature = baselineTemperature; }
    public double getBaselinePrecipitation() { return baselinePrecipitation; }
    public void setBaselinePrecipitation(double baselinePrecipitation) { this.baselinePrecipitation = baselinePrecipitation; }
    public double getBaselineEventLoad() { return baselineEventLoad; }
    public void setBaselineEventLoad(double baselineEventLoad) { this.baselineEventLoad = baselineEventLoad; }
    public boolean isHoliday() { return holiday; }
    public void setHoliday(boolean holiday) { this.holiday = holiday; }
    public boolean isSyntheticWeather() { return syntheticWeather; }
    public void setSyntheticWeather(boolean syntheticWeather) { this.syntheticWeather = syntheticWeather; }

    public boolean isJsonLogSink() { return jsonLogSink; }
    public void setJsonLogSink(boolean jsonLogSink) { this.jsonLogSink = jsonLogSink; }
    public boolean isDerbySink() { return derbySink; }
    public void setDerbySink(boolean derbySink) { this.derbySink = derbySink; }
    public String getDerbyUrl() { return derbyUrl; }
    public void setDerbyUrl(String derbyUrl) { this.derbyUrl = derbyUrl; }
    public int getPublishBufferSize() { return publishBufferSize; }
    public void setPublishBufferSize(int publishBufferSize) { this.publishBufferSize = publishBufferSize; }
}
