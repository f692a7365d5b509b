package org.edsim.demand;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import java.time.DayOfWeek;

import org.edsim.config.SimulationConfig;
import org.edsim.engine.SimulationContext;
import org.edsim.engine.SimulationFixtures;
import org.edsim.events.RecordingEventPublisher;
import org.edsim.exceptions.InvalidInputException;
import org.edsim.hospital.Hospital;
import org.junit.jupiter.api.Test;

class DemandFactorAggregatorTest {

    @Test
    void individualFactors() {
        assertThat(DemandFactorAggregator.weekdayFactor(DayOfWeek.MONDAY)).isEqualTo(1.2);
        assertThat(DemandFactorAggregator.weekdayFactor(DayOfWeek.WEDNESDAY)).isEqualTo(1.0);
        assertThat(DemandFactorAggregator.weekdayFactor(DayOfWeek.SATURDAY)).isEqualTo(1.3);
        assertThat(DemandFactorAggregator.temperatureFactor(2.0)).isEqualTo(1.3);
        assertThat(DemandFactorAggregator.temperatureFactor(7.0)).isEqualTo(1.15);
        assertThat(DemandFactorAggregator.temperatureFactor(20.0)).isEqualTo(1.0);
        assertThat(DemandFactorAggregator.temperatureFactor(30.0)).isEqualTo(1.1);
        assertThat(DemandFactorAggregator.temperatureFactor(35.0)).isEqualTo(1.25);
        assertThat(DemandFactorAggregator.precipitationFactor(0.5)).isEqualTo(1.0);
        assertThat(DemandFactorAggregator.precipitationFactor(3.0)).isEqualTo(1.1);
        assertThat(DemandFactorAggregator.precipitationFactor(12.0)).isEqualTo(1.2);
    }

    @Test
    void combinedFactorIsClamped() {
        assertThat(DemandFactorAggregator.combine(DayOfWeek.WEDNESDAY, 20.0, 0.0, 0.0, false))
                .isCloseTo(1.0, within(1e-9));
        assertThat(DemandFactorAggregator.combine(DayOfWeek.WEDNESDAY, 20.0, 0.0, 0.0, true))
                .isCloseTo(0.85, within(1e-9));
        assertThat(DemandFactorAggregator.combine(DayOfWeek.SATURDAY, 0.0, 10.0, 5.0, false))
                .isEqualTo(DemandFactorAggregator.MAX_FACTOR);
    }

    @Test
    void refreshSetsEachHospitalsContext() throws Exception {
        SimulationConfig config = SimulationFixtures.singleHospital(2, 12.0);
        config.setFixedDemandFactor(null);
        config.setHourlyProfile(true);
        SimulationContext context = SimulationFixtures.context(config, new RecordingEventPublisher());
        Hospital hospital = context.getHospital("h1");

        context.getDemandAggregator().refresh(0.0);

        // Monday 08:00, 14 C, dry
        assertThat(hospital.getDemandContext().getDayOfWeek()).isEqualTo(DayOfWeek.MONDAY);
        assertThat(hospital.getDemandContext().getHourOfDay()).isEqualTo(8);
        assertThat(hospital.getDemandContext().getFactor()).isCloseTo(1.2, within(1e-9));
        assertThat(context.getDemandAggregator().hourlyRate(hospital, 0.0)).isCloseTo(12.0 * 1.2, within(1e-9));
    }

    @Test
    void fixedFactorOverridesTheInputs() throws Exception {
        SimulationConfig config = SimulationFixtures.singleHospital(2, 10.0);
        config.setFixedDemandFactor(2.0);
        SimulationContext context = SimulationFixtures.context(config, new RecordingEventPublisher());
        DemandFactorAggregator demand = context.getDemandAggregator();

        demand.applySignal("h1", new DemandSignal(0.0, 20.0, 1.0, false), 0.0);

        assertThat(context.getHospital("h1").getDemandContext().getFactor()).isEqualTo(2.0);
        assertThat(demand.hourlyRate(context.getHospital("h1"), 0.0)).isCloseTo(20.0, within(1e-9));
    }

    @Test
    void rejectedSignalsKeepTheLastKnownGoodValues() throws Exception {
        SimulationContext context = SimulationFixtures.context(SimulationFixtures.singleHospital(2, 10.0),
                new RecordingEventPublisher());
        final DemandFactorAggregator demand = context.getDemandAggregator();
        DemandSignal before = demand.getSignal("h1");

        assertThatThrownBy(() -> demand.applySignal("h1", new DemandSignal(95.0, 0.0, 0.0, false), 0.0))
                .isInstanceOf(InvalidInputException.class);
        assertThatThrownBy(() -> demand.applySignal("h1", new DemandSignal(10.0, -1.0, 0.0, false), 0.0))
                .isInstanceOf(InvalidInputException.class);
        assertThatThrownBy(() -> demand.applySignal("nowhere", new DemandSignal(10.0, 0.0, 0.0, false), 0.0))
                .isInstanceOf(InvalidInputException.class);

        assertThat(demand.getSignal("h1")).isSameAs(before);
    }

    @Test
    void flatProfileWhenHourlyProfileIsDisabled() throws Exception {
        SimulationContext context = SimulationFixtures.context(SimulationFixtures.singleHospital(2, 10.0),
                new RecordingEventPublisher());
        for (int hour = 0; hour < 24; hour++) {
            assertThat(context.getDemandAggregator().hourFactor(hour)).isEqualTo(1.0);
        }
    }
}
