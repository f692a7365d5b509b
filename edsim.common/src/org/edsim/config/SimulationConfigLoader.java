package org.edsim.config;

import java.io.File;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.time.LocalDateTime;
import java.time.format.DateTimeParseException;

import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import javax.xml.xpath.XPath;
import javax.xml.xpath.XPathConstants;
import javax.xml.xpath.XPathExpressionException;
import javax.xml.xpath.XPathFactory;

import org.apache.log4j.Logger;
import org.edsim.exceptions.ConfigurationException;
import org.edsim.model.GeoLocation;
import org.edsim.model.HospitalConfig;
import org.edsim.model.Incident;
import org.edsim.model.IncidentType;
import org.edsim.model.TriageLevel;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.NodeList;
import org.xml.sax.SAXException;

/**
 * Reads a {@code simulation.xml} document into a {@link SimulationConfig}.
 *
 * Layout (every element and attribute is optional unless noted):
 * <pre>
 * &lt;simulation seed="42" durationMinutes="1440" timeScale="0" start="2025-01-06T08:00"&gt;
 *   &lt;reference hospital="chuac"/&gt;                                   (required)
 *   &lt;flow registration="2" triage="5" jitter="0.2" observationProbability="0.15"
 *         observationStay="240" conditionBias="true"/&gt;
 *   &lt;sampling metricsInterval="2" coordinatorInterval="1" window="60"/&gt;
 *   &lt;saturation consultation="0.5" observation="0.2" queue="0.3" high="0.85" low="0.70"
 *               queueAlertFactor="2" loadShedding="false" loadSheddingBatch="2"/&gt;
 *   &lt;incidents distance="0.35" saturation="0.40" wait="0.25" ambulanceSpeedKmh="40"
 *              minTransferMinutes="5" random="false" dailyProbability="0.1"/&gt;
 *   &lt;demand fixedFactor="" hourlyProfile="true" temperature="14" precipitation="0"
 *           eventLoad="0" holiday="false" syntheticWeather="false"/&gt;
 *   &lt;hospitals&gt;                                                      (required)
 *     &lt;hospital id="chuac" name="..." desks="2" triage="5" rooms="10" beds="20"
 *               elastic="true" rate="15" lat="43.344" lon="-8.389" maxDoctors="4"/&gt;
 *   &lt;/hospitals&gt;
 *   &lt;scenario&gt;
 *     &lt;incident id="i1" at="600" type="MASS_CASUALTY" lat=".." lon=".." patients="20"
 *               duration="120" mix="0.2,0.4,0.3,0.1,0"/&gt;
 *   &lt;/scenario&gt;
 *   &lt;sinks jsonLog="true" derby="false" derbyUrl="jdbc:derby:..." bufferSize="10000"/&gt;
 * &lt;/simulation&gt;
 * </pre>
 * The loaded configuration is validated before it is returned.
 */
public class SimulationConfigLoader {

    private static final Logger logger = Logger.getLogger(SimulationConfigLoader.class);

    public static final String DEFAULT_RESOURCE = "simulation.xml";

    private final XPath xpath = XPathFactory.newInstance().newXPath();

    public SimulationConfig loadResource(String resourceName) throws ConfigurationException {
        InputStream in = SimulationConfigLoader.class.getClassLoader().getResourceAsStream(resourceName);
        if (in == null) {
            throw new ConfigurationException("Configuration resource not found on classpath: " + resourceName);
        }
        try {
            return load(in, resourceName);
        } finally {
            closeQuietly(in, resourceName);
        }
    }

    public SimulationConfig loadFile(File file) throws ConfigurationException {
        if (!file.isFile()) {
            throw new ConfigurationException("Configuration file not found: " + file.getAbsolutePath());
        }
        try (InputStream in = new FileInputStream(file)) {
            return load(in, file.getPath());
        } catch (IOException e) {
            throw new ConfigurationException("Cannot read configuration file " + file.getPath(), e);
        }
    }

    public SimulationConfig load(InputStream in, String sourceName) throws ConfigurationException {
        Document doc = parse(in, sourceName);
        SimulationConfig config = new SimulationConfig();
        try {
            readRun(doc, config);
            readFlow(doc, config);
            readSampling(doc, config);
            readSaturation(doc, config);
            readScaling(doc, config);
            readIncidents(doc, config);
            readDemand(doc, config);
            readHospitals(doc, config);
            readScenario(doc, config);
            readSinks(doc, config);
        } catch (XPathExpressionException e) {
            throw new ConfigurationException("Malformed configuration " + sourceName, e);
        }
        config.validate();
        logger.info(String.format("CONFIG_LOADED: source=%s, hospitals=%d, reference=%s, seed=%d, duration=%.0f",
                sourceName, config.getHospitals().size(), config.getReferenceHospitalId(),
                config.getSeed(), config.getDurationMinutes()));
        return config;
    }

    // ========== Sections ==========

    private void readRun(Document doc, SimulationConfig config) throws XPathExpressionException, ConfigurationException {
        String seed = value(doc, "/simulation/@seed");
        if (!seed.isEmpty()) {
            config.setSeed(parseLong(seed, "seed"));
        }
        config.setDurationMinutes(number(doc, "/simulation/@durationMinutes", config.getDurationMinutes()));
        config.setTimeScale(number(doc, "/simulation/@timeScale", config.getTimeScale()));
        String start = value(doc, "/simulation/@start");
        if (!start.isEmpty()) {
            try {
                config.setStartDateTime(LocalDateTime.parse(start));
            } catch (DateTimeParseException e) {
                throw new ConfigurationException("Invalid start date-time '" + start + "'", e);
            }
        }
        String reference = value(doc, "/simulation/reference/@hospital");
        config.setReferenceHospitalId(reference.isEmpty() ? null : reference);
    }

    private void readFlow(Document doc, SimulationConfig config) throws XPathExpressionException, ConfigurationException {
        String base = "/simulation/flow/@";
        config.setRegistrationMinutes(number(doc, base + "registration", config.getRegistrationMinutes()));
        config.setTriageMinutes(number(doc, base + "triage", config.getTriageMinutes()));
        config.setJitterFraction(number(doc, base + "jitter", config.getJitterFraction()));
        config.setObservationProbability(number(doc, base + "observationProbability", config.getObservationProbability()));
        config.setObservationStayMinutes(number(doc, base + "observationStay", config.getObservationStayMinutes()));
        config.setConditionBias(flag(doc, base + "conditionBias", config.isConditionBias()));
    }

    private void readSampling(Document doc, SimulationConfig config) throws XPathExpressionException, ConfigurationException {
        String base = "/simulation/sampling/@";
        config.setMetricsIntervalMinutes(number(doc, base + "metricsInterval", config.getMetricsIntervalMinutes()));
        config.setCoordinatorIntervalMinutes(number(doc, base + "coordinatorInterval", config.getCoordinatorIntervalMinutes()));
        config.setStatisticsWindowMinutes(number(doc, base + "window", config.getStatisticsWindowMinutes()));
    }

    private void readSaturation(Document doc, SimulationConfig config) throws XPathExpressionException, ConfigurationException {
        String base = "/simulation/saturation/@";
        config.setSaturationWeights(
                number(doc, base + "consultation", config.getConsultationWeight()),
                number(doc, base + "observation", config.getObservationWeight()),
                number(doc, base + "queue", config.getQueueWeight()));
        config.setHighThreshold(number(doc, base + "high", config.getHighThreshold()));
        config.setLowThreshold(number(doc, base + "low", config.getLowThreshold()));
        config.setQueueAlertFactor(number(doc, base + "queueAlertFactor", config.getQueueAlertFactor()));
        config.setLoadShedding(flag(doc, base + "loadShedding", config.isLoadShedding()));
        config.setLoadSheddingBatch(whole(doc, base + "loadSheddingBatch", config.getLoadSheddingBatch()));
    }

    private void readScaling(Document doc, SimulationConfig config) throws XPathExpressionException, ConfigurationException {
        String base = "/simulation/scaling/@";
        config.setAutoScaling(flag(doc, base + "enabled", config.isAutoScaling()));
        config.setScaleUpThreshold(number(doc, base + "up", config.getScaleUpThreshold()));
        config.setScaleDownThreshold(number(doc, base + "down", config.getScaleDownThreshold()));
        config.setDoctorPool(whole(doc, base + "pool", config.getDoctorPool()));
    }

    private void readIncidents(Document doc, SimulationConfig config) throws XPathExpressionException, ConfigurationException {
        String base = "/simulation/incidents/@";
        config.setIncidentWeights(
                number(doc, base + "distance", config.getDistanceWeight()),
                number(doc, base + "saturation", config.getSaturationWeight()),
                number(doc, base + "wait", config.getWaitWeight()));
        config.setAmbulanceSpeedKmh(number(doc, base + "ambulanceSpeedKmh", config.getAmbulanceSpeedKmh()));
        config.setMinTransferMinutes(number(doc, base + "minTransferMinutes", config.getMinTransferMinutes()));
        config.setRandomIncidents(flag(doc, base + "random", config.isRandomIncidents()));
        config.setRandomIncidentDailyProbability(
                number(doc, base + "dailyProbability", config.getRandomIncidentDailyProbability()));
    }

    private void readDemand(Document doc, SimulationConfig config) throws XPathExpressionException, ConfigurationException {
        String base = "/simulation/demand/@";
        String fixed = value(doc, base + "fixedFactor");
        if (!fixed.isEmpty()) {
            config.setFixedDemandFactor(parseDouble(fixed, "fixedFactor"));
        }
        config.setHourlyProfile(flag(doc, base + "hourlyProfile", config.isHourlyProfile()));
        config.setBaselineTemperature(number(doc, base + "temperature", config.getBaselineTemperature()));
        config.setBaselinePrecipitation(number(doc, base + "precipitation", config.getBaselinePrecipitation()));
        config.setBaselineEventLoad(number(doc, base + "eventLoad", config.getBaselineEventLoad()));
        config.setHoliday(flag(doc, base + "holiday", config.isHoliday()));
        config.setSyntheticWeather(flag(doc, base + "syntheticWeather", config.isSyntheticWeather()));
    }

    private void readHospitals(Document doc, SimulationConfig config) throws XPathExpressionException, ConfigurationException {
        NodeList nodes = (NodeList) xpath.evaluate("/simulation/hospitals/hospital", doc, XPathConstants.NODESET);
        for (int idx = 0; idx < nodes.getLength(); idx++) {
            Element e = (Element) nodes.item(idx);
            String id = e.getAttribute("id").trim();
            HospitalConfig hospital = new HospitalConfig(
                    id,
                    e.hasAttribute("name") ? e.getAttribute("name") : id,
                    intAttr(e, "desks", 1),
                    intAttr(e, "triage", 1),
                    intAttr(e, "rooms", 1),
                    intAttr(e, "beds", 1),
                    Boolean.parseBoolean(e.getAttribute("elastic").trim()),
                    doubleAttr(e, "rate", 0.0),
                    new GeoLocation(doubleAttr(e, "lat", Double.NaN), doubleAttr(e, "lon", Double.NaN)),
                    intAttr(e, "maxDoctors", HospitalConfig.DEFAULT_MAX_DOCTORS_PER_ROOM));
            config.addHospital(hospital);
            logger.debug("CONFIG_HOSPITAL: " + hospital);
        }
    }

    private void readScenario(Document doc, SimulationConfig config) throws XPathExpressionException, ConfigurationException {
        NodeList nodes = (NodeList) xpath.evaluate("/simulation/scenario/incident", doc, XPathConstants.NODESET);
        for (int idx = 0; idx < nodes.getLength(); idx++) {
            Element e = (Element) nodes.item(idx);
            String typeName = e.getAttribute("type").trim();
            IncidentType type;
            try {
                type = IncidentType.valueOf(typeName);
            } catch (IllegalArgumentException ex) {
                throw new ConfigurationException("Unknown incident type '" + typeName + "'", ex);
            }
            String id = e.hasAttribute("id") ? e.getAttribute("id").trim() : "scenario-" + (idx + 1);
            Double duration = e.hasAttribute("duration") ? doubleAttr(e, "duration", 0.0) : null;
            double[] mix = e.hasAttribute("mix") ? parseMix(e.getAttribute("mix")) : null;
            config.addScenarioIncident(new Incident(
                    id, type,
                    new GeoLocation(doubleAttr(e, "lat", Double.NaN), doubleAttr(e, "lon", Double.NaN)),
                    intAttr(e, "patients", type.getMinPatients()),
                    doubleAttr(e, "at", 0.0),
                    duration,
                    mix));
        }
    }

    private void readSinks(Document doc, SimulationConfig config) throws XPathExpressionException, ConfigurationException {
        String base = "/simulation/sinks/@";
        config.setJsonLogSink(flag(doc, base + "jsonLog", config.isJsonLogSink()));
        config.setDerbySink(flag(doc, base + "derby", config.isDerbySink()));
        String url = value(doc, base + "derbyUrl");
        if (!url.isEmpty()) {
            config.setDerbyUrl(url);
        }
        config.setPublishBufferSize(whole(doc, base + "bufferSize", config.getPublishBufferSize()));
    }

    // ========== Helper Methods ==========

    private Document parse(InputStream in, String sourceName) throws ConfigurationException {
        try {
            DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
            factory.setNamespaceAware(false);
            factory.setExpandEntityReferences(false);
            return factory.newDocumentBuilder().parse(in);
        } catch (ParserConfigurationException | SAXException | IOException e) {
            throw new ConfigurationException("Configuration " + sourceName + " is not well formed", e);
        }
    }

    private String value(Document doc, String path) throws XPathExpressionException {
        return xpath.evaluate(path, doc).trim();
    }

    private double number(Document doc, String path, double fallback) throws XPathExpressionException, ConfigurationException {
        String v = value(doc, path);
        return v.isEmpty() ? fallback : parseDouble(v, path);
    }

    private int whole(Document doc, String path, int fallback) throws XPathExpressionException, ConfigurationException {
        String v = value(doc, path);
        if (v.isEmpty()) {
            return fallback;
        }
        try {
            return Integer.parseInt(v);
        } catch (NumberFormatException e) {
            throw new ConfigurationException("Invalid integer '" + v + "' for " + path, null, path);
        }
    }

    private boolean flag(Document doc, String path, boolean fallback) throws XPathExpressionException {
        String v = value(doc, path);
        return v.isEmpty() ? fallback : Boolean.parseBoolean(v);
    }

    private static int intAttr(Element e, String name, int fallback) throws ConfigurationException {
        String v = e.getAttribute(name).trim();
        if (v.isEmpty()) {
            return fallback;
        }
        try {
            return Integer.parseInt(v);
        } catch (NumberFormatException ex) {
            throw new ConfigurationException("Invalid integer '" + v + "' for " + name, e.getAttribute("id"), name);
        }
    }

    private static double doubleAttr(Element e, String name, double fallback) throws ConfigurationException {
        String v = e.getAttribute(name).trim();
        return v.isEmpty() ? fallback : parseDouble(v, name);
    }

    private static double parseDouble(String v, String setting) throws ConfigurationException {
        try {
            return Double.parseDouble(v);
        } catch (NumberFormatException e) {
            throw new ConfigurationException("Invalid number '" + v + "' for " + setting, null, setting);
        }
    }

    private static long parseLong(String v, String setting) throws ConfigurationException {
        try {
            return Long.parseLong(v);
        } catch (NumberFormatException e) {
            throw new ConfigurationException("Invalid integer '" + v + "' for " + setting, null, setting);
        }
    }

    private static double[] parseMix(String raw) throws ConfigurationException {
        String[] parts = raw.split(",");
        if (parts.length != TriageLevel.values().length) {
            throw new ConfigurationException("Severity mix needs " + TriageLevel.values().length
                    + " comma-separated weights, got '" + raw + "'", null, "mix");
        }
        double[] mix = new double[parts.length];
        for (int i = 0; i < parts.length; i++) {
            mix[i] = parseDouble(parts[i].trim(), "mix");
        }
        return mix;
    }

    private static void closeQuietly(InputStream in, String name) {
        try {
            in.close();
        } catch (IOException e) {
            logger.warn("Failed to close configuration stream " + name, e);
        }
    }
}
