package org.edsim.hospital;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Timestamped samples over a trailing window of simulated minutes.
 * Samples older than the window are pruned on insertion; reads only filter,
 * so reading never changes what a later read sees.
 */
public class TrailingWindow {

    private final double windowMinutes;
    private final Deque<double[]> samples = new ArrayDeque<>();

    public TrailingWindow(double windowMinutes) {
        this.windowMinutes = windowMinutes;
    }

    public void add(double time, double value) {
        samples.addLast(new double[] {time, value});
        double cutoff = time - windowMinutes;
        while (!samples.isEmpty() && samples.peekFirst()[0] < cutoff) {
            samples.pollFirst();
        }
    }

    /** Mean of the samples taken in (now - window, now]; 0 when there are none. */
    public double mean(double now) {
        double cutoff = now - windowMinutes;
        double sum = 0.0;
        int n = 0;
        for (double[] s : samples) {
            if (s[0] >= cutoff && s[0] <= now) {
                sum += s[1];
                n++;
            }
        }
        return n == 0 ? 0.0 : sum / n;
    }

    public int count(double now) {
        double cutoff = now - windowMinutes;
        int n = 0;
        for (double[] s : samples) {
            if (s[0] >= cutoff && s[0] <= now) {
                n++;
            }
        }
        return n;
    }

    public double getWindowMinutes() {
        return windowMinutes;
    }
}
