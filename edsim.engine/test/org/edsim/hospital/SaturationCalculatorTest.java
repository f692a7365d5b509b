package org.edsim.hospital;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import org.edsim.engine.EventScheduler;
import org.edsim.engine.SimulationFixtures;
import org.edsim.logger.SimulationEventLogger;
import org.edsim.model.Patient;
import org.edsim.model.PatientSource;
import org.edsim.model.PresentingCondition;
import org.edsim.model.Sex;
import org.edsim.places.SlotGrantListener;
import org.edsim.places.SlotRequest;
import org.junit.jupiter.api.Test;

class SaturationCalculatorTest {

    private final SaturationCalculator calculator = new SaturationCalculator(0.5, 0.2, 0.3);

    private static final SlotGrantListener IGNORE = new SlotGrantListener() {
        @Override
        public void slotGranted(SlotRequest grant) {
        }
    };

    @Test
    void weightsTheThreeTerms() {
        assertThat(calculator.compute(0.0, 0.0, 0.0)).isZero();
        assertThat(calculator.compute(1.0, 1.0, 0.0)).isCloseTo(0.7, within(1e-9));
        // a long queue pushes the index above one
        assertThat(calculator.compute(1.0, 0.5, 2.0)).isCloseTo(1.2, within(1e-9));
    }

    @Test
    void isMonotoneInEachInput() {
        double base = calculator.compute(0.4, 0.4, 0.4);
        assertThat(calculator.compute(0.5, 0.4, 0.4)).isGreaterThan(base);
        assertThat(calculator.compute(0.4, 0.5, 0.4)).isGreaterThan(base);
        assertThat(calculator.compute(0.4, 0.4, 0.5)).isGreaterThan(base);
    }

    @Test
    void readsTheHospitalsPlaces() {
        EventScheduler scheduler = new EventScheduler();
        Hospital hospital = new Hospital(SimulationFixtures.hospital("h1", 2, 4, 10.0), true, 60.0,
                scheduler, new SimulationEventLogger());
        for (int i = 0; i < 4; i++) {
            Patient p = new Patient(hospital.nextPatientId(), "h1", 0.0, 30, Sex.MALE, PresentingCondition.FEVER,
                    PatientSource.WALK_IN, null);
            hospital.getConsultation().request(p, 4, IGNORE);
        }
        // 2/2 rooms busy, 0/4 beds, 2 waiting over 2 rooms
        assertThat(calculator.compute(hospital)).isCloseTo(0.5 + 0.3, within(1e-9));
    }

    @Test
    void rejectsNegativeWeights() {
        assertThatThrownBy(() -> new SaturationCalculator(-0.1, 0.5, 0.5))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
