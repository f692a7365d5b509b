package org.edsim.runner;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.edsim.coordinator.DiversionStatistics;
import org.edsim.coordinator.HospitalCoordinator;
import org.edsim.engine.SimulationContext;
import org.edsim.hospital.Hospital;
import org.edsim.hospital.HospitalStatistics;
import org.edsim.logger.SimulationEventLogger;
import org.edsim.model.DiversionReason;
import org.edsim.model.TriageLevel;

/**
 * End-of-run figures per hospital and for the network, rendered as a plain
 * text report.
 */
public final class RunSummary {

    /** Figures of one hospital. */
    public static final class HospitalLine {
        private final String hospitalId;
        private final int arrivals;
        private final int treated;
        private final int admittedObservation;
        private final int diversionsSent;
        private final int diversionsReceived;
        private final int slaBreaches;
        private final int stillInSystem;
        private final double meanTimeInSystem;
        private final double meanConsultationService;
        private final double[] meanWaitByLevel;
        private final double saturation;
        private final int peakConsultation;
        private final int peakObservation;

        HospitalLine(Hospital hospital, double saturation, SimulationEventLogger eventLogger) {
            HospitalStatistics stats = hospital.getStatistics();
            this.hospitalId = hospital.getId();
            this.arrivals = hospital.getArrivals();
            this.treated = hospital.getTreated();
            this.admittedObservation = hospital.getAdmittedObservation();
            this.diversionsSent = hospital.getDiversionsSent();
            this.diversionsReceived = hospital.getDiversionsReceived();
            this.slaBreaches = hospital.getSlaBreaches();
            this.stillInSystem = hospital.getActivePatients().size();
            this.meanTimeInSystem = stats.meanTimeInSystem();
            double serviceSum = 0.0;
            int services = 0;
            for (int room = 0; room < hospital.getConsultation().getRoomCount(); room++) {
                int count = stats.roomServiceCount(room);
                serviceSum += stats.meanRoomService(room) * count;
                services += count;
            }
            this.meanConsultationService = services == 0 ? 0.0 : serviceSum / services;
            TriageLevel[] levels = TriageLevel.values();
            this.meanWaitByLevel = new double[levels.length];
            for (int i = 0; i < levels.length; i++) {
                meanWaitByLevel[i] = stats.meanWait(levels[i]);
            }
            this.saturation = saturation;
            this.peakConsultation = peak(eventLogger, hospital.getConsultation().getPlaceId());
            this.peakObservation = peak(eventLogger, hospital.getObservation().getPlaceId());
        }

        private static int peak(SimulationEventLogger eventLogger, String placeId) {
            SimulationEventLogger.PlaceState state = eventLogger.getPlaceState(placeId);
            return state == null ? 0 : state.getPeakMarking();
        }

        public String getHospitalId() { return hospitalId; }
        public int getArrivals() { return arrivals; }
        public int getTreated() { return treated; }
        public int getAdmittedObservation() { return admittedObservation; }
        public int getDiversionsSent() { return diversionsSent; }
        public int getDiversionsReceived() { return diversionsReceived; }
        public int getSlaBreaches() { return slaBreaches; }
        public int getStillInSystem() { return stillInSystem; }
        public double getMeanTimeInSystem() { return meanTimeInSystem; }
        public double getMeanConsultationService() { return meanConsultationService; }
        public double getMeanWait(TriageLevel level) { return meanWaitByLevel[level.ordinal()]; }
        public double getSaturation() { return saturation; }
        public int getPeakConsultation() { return peakConsultation; }
        public int getPeakObservation() { return peakObservation; }
    }

    private final double simulatedMinutes;
    private final long wallClockMillis;
    private final List<HospitalLine> hospitals;
    private final int diversions;
    private final int severityDiversions;
    private final int saturationDiversions;
    private final int overloadDiversions;
    private final int incidentsIngested;
    private final int patientsInTransit;
    private final long controlApplied;
    private final long controlRejected;
    private final String peakStatus;

    private RunSummary(HospitalNetworkSimulation simulation) {
        SimulationContext context = simulation.getContext();
        HospitalCoordinator coordinator = simulation.getCoordinator();
        DiversionStatistics diversionStats = coordinator.getDiversionStatistics();
        List<HospitalLine> lines = new ArrayList<>();
        for (Hospital hospital : context.getHospitals()) {
            lines.add(new HospitalLine(hospital, context.getSaturationCalculator().compute(hospital),
                    context.getEventLogger()));
        }
        this.simulatedMinutes = context.now();
        this.wallClockMillis = simulation.getWallClockMillis();
        this.hospitals = Collections.unmodifiableList(lines);
        this.diversions = diversionStats.getTotal();
        this.severityDiversions = diversionStats.count(DiversionReason.SEVERITY);
        this.saturationDiversions = diversionStats.count(DiversionReason.SATURATION);
        this.overloadDiversions = diversionStats.count(DiversionReason.INCIDENT_OVERLOAD);
        this.incidentsIngested = coordinator.getIncidentsIngested();
        this.patientsInTransit = coordinator.getPatientsInTransit();
        this.controlApplied = coordinator.getInbox().getAppliedCount();
        this.controlRejected = coordinator.getInbox().getRejectedCount();
        this.peakStatus = simulation.getMetrics().getPeakStatus().name();
    }

    static RunSummary of(HospitalNetworkSimulation simulation) {
        return new RunSummary(simulation);
    }

    public List<HospitalLine> getHospitals() { return hospitals; }
    public int getDiversions() { return diversions; }
    public int getSeverityDiversions() { return severityDiversions; }
    public int getSaturationDiversions() { return saturationDiversions; }
    public int getOverloadDiversions() { return overloadDiversions; }
    public int getIncidentsIngested() { return incidentsIngested; }
    /** Diverted patients still on the road when the run ended; no hospital counts them as inside. */
    public int getPatientsInTransit() { return patientsInTransit; }
    public double getSimulatedMinutes() { return simulatedMinutes; }

    public HospitalLine getHospital(String hospitalId) {
        for (HospitalLine line : hospitals) {
            if (line.getHospitalId().equals(hospitalId)) {
                return line;
            }
        }
        return null;
    }

    public String format() {
        StringBuilder sb = new StringBuilder();
        sb.append("================================================================================\n");
        sb.append(String.format("SIMULATION SUMMARY  simulated=%.0f min  wall=%d ms  peakStatus=%s%n",
                simulatedMinutes, wallClockMillis, peakStatus));
        sb.append("================================================================================\n");
        sb.append(String.format("%-12s %8s %8s %6s %6s %6s %6s %7s %9s %9s %6s %8s %8s%n",
                "hospital", "arrivals", "treated", "obs", "sent", "recv", "sla", "inside", "tis(min)", "svc(min)", "sat",
                "peakCons", "peakObs"));
        for (HospitalLine line : hospitals) {
            sb.append(String.format("%-12s %8d %8d %6d %6d %6d %6d %7d %9.1f %9.1f %6.2f %8d %8d%n",
                    line.hospitalId, line.arrivals, line.treated, line.admittedObservation,
                    line.diversionsSent, line.diversionsReceived, line.slaBreaches, line.stillInSystem,
                    line.meanTimeInSystem, line.meanConsultationService, line.saturation,
                    line.peakConsultation, line.peakObservation));
        }
        sb.append("\nMean consultation wait by triage level (min)\n");
        for (HospitalLine line : hospitals) {
            sb.append(String.format("  %-12s", line.hospitalId));
            for (TriageLevel level : TriageLevel.values()) {
                sb.append(String.format("  %s=%.1f", level, line.getMeanWait(level)));
            }
            sb.append('\n');
        }
        sb.append(String.format("%nDiversions: total=%d, severity=%d, saturation=%d, incidentOverload=%d, inTransit=%d%n",
                diversions, severityDiversions, saturationDiversions, overloadDiversions, patientsInTransit));
        sb.append(String.format("Incidents: %d, control commands: applied=%d, rejected=%d%n",
                incidentsIngested, controlApplied, controlRejected));
        return sb.toString();
    }

    @Override
    public String toString() {
        return format();
    }
}
