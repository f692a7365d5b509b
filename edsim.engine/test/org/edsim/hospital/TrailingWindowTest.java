package org.edsim.hospital;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import org.junit.jupiter.api.Test;

class TrailingWindowTest {

    @Test
    void averagesOnlyTheTrailingWindow() {
        TrailingWindow window = new TrailingWindow(60.0);
        window.add(0.0, 10.0);
        window.add(30.0, 20.0);
        window.add(90.0, 40.0);

        assertThat(window.mean(90.0)).isCloseTo(30.0, within(1e-9));
        assertThat(window.count(90.0)).isEqualTo(2);
        assertThat(window.mean(200.0)).isZero();
        assertThat(window.count(200.0)).isZero();
    }

    @Test
    void readsDoNotChangeLaterReads() {
        TrailingWindow window = new TrailingWindow(10.0);
        window.add(5.0, 1.0);
        window.add(8.0, 3.0);
        assertThat(window.mean(8.0)).isEqualTo(2.0);
        assertThat(window.mean(100.0)).isZero();
        assertThat(window.mean(8.0)).isEqualTo(2.0);
    }

    @Test
    void emptyWindowHasZeroMean() {
        assertThat(new TrailingWindow(60.0).mean(0.0)).isZero();
    }
}
