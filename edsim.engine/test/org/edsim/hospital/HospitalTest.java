package org.edsim.hospital;

import static org.assertj.core.api.Assertions.assertThat;

import org.edsim.engine.EventScheduler;
import org.edsim.logger.SimulationEventLogger;
import org.edsim.model.GeoLocation;
import org.edsim.model.HospitalConfig;
import org.edsim.model.Patient;
import org.edsim.model.PatientSource;
import org.edsim.model.PresentingCondition;
import org.edsim.model.Sex;
import org.junit.jupiter.api.Test;

class HospitalTest {

    @Test
    void keepsOnlyRecentFinishedPatientsButCountsThemAll() {
        Hospital hospital = new Hospital(
                new HospitalConfig("h1", "H1", 1, 1, 2, 2, false, 6.0, new GeoLocation(43.35, -8.40)),
                false, 60.0, new EventScheduler(), new SimulationEventLogger());
        int total = Hospital.RECENT_FINISHED_CAPACITY + 10;
        for (int i = 0; i < total; i++) {
            Patient patient = new Patient(hospital.nextPatientId(), "h1", i, 40, Sex.MALE,
                    PresentingCondition.FEVER, PatientSource.WALK_IN, null);
            hospital.admit(patient, i);
            hospital.finish(patient);
        }

        assertThat(hospital.getFinishedCount()).isEqualTo(total);
        assertThat(hospital.getFinishedPatients()).hasSize(Hospital.RECENT_FINISHED_CAPACITY);
        assertThat(hospital.getFinishedPatients().get(0).getId()).isEqualTo("h1-11");
        assertThat(hospital.getActivePatients()).isEmpty();
        assertThat(hospital.getArrivals()).isEqualTo(total);
    }
}
