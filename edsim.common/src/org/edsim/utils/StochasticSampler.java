package org.edsim.utils;

import java.util.Random;

/**
 * Single source of randomness for a simulation run. Every stochastic draw
 * goes through one seeded {@link Random}, so a run is reproducible from its
 * seed as long as the draws happen in the same order.
 */
public class StochasticSampler {

    private final long seed;
    private final Random random;

    public StochasticSampler(long seed) {
        this.seed = seed;
        this.random = new Random(seed);
    }

    public long getSeed() {
        return seed;
    }

    public double uniform() {
        return random.nextDouble();
    }

    public double uniform(double low, double high) {
        return low + (high - low) * random.nextDouble();
    }

    /** Uniform integer in [low, high], both inclusive. */
    public int uniformInt(int low, int high) {
        if (high < low) {
            throw new IllegalArgumentException("Empty range [" + low + ", " + high + "]");
        }
        return low + random.nextInt(high - low + 1);
    }

    public boolean bernoulli(double probability) {
        return random.nextDouble() < probability;
    }

    public double gaussian(double mean, double standardDeviation) {
        return mean + random.nextGaussian() * standardDeviation;
    }

    /**
     * Exponential gap for a Poisson process with the given rate (events per
     * time unit). Uses 1 - u so the logarithm never sees zero.
     */
    public double exponential(double rate) {
        if (!(rate > 0.0)) {
            throw new IllegalArgumentException("Exponential rate must be positive, got " + rate);
        }
        return -Math.log(1.0 - random.nextDouble()) / rate;
    }

    /** Nominal value scaled by a uniform factor in [1 - fraction, 1 + fraction]. */
    public double jitter(double nominal, double fraction) {
        return nominal * uniform(1.0 - fraction, 1.0 + fraction);
    }

    /**
     * Index drawn proportionally to the given non-negative weights.
     * The weights need not sum to one.
     */
    public int weightedIndex(double[] weights) {
        double total = 0.0;
        for (double w : weights) {
            if (w < 0.0) {
                throw new IllegalArgumentException("Negative weight " + w);
            }
            total += w;
        }
        if (!(total > 0.0)) {
            throw new IllegalArgumentException("Weights sum to zero");
        }
        double u = random.nextDouble() * total;
        double cumulative = 0.0;
        int lastPositive = -1;
        for (int i = 0; i < weights.length; i++) {
            if (weights[i] > 0.0) {
                lastPositive = i;
            }
            cumulative += weights[i];
            if (u < cumulative) {
                return i;
            }
        }
        // rounding at the top end
        return lastPositive;
    }

    public <T extends Enum<T>> T weightedChoice(T[] values, double[] weights) {
        if (values.length != weights.length) {
            throw new IllegalArgumentException("values and weights differ in length");
        }
        return values[weightedIndex(weights)];
    }
}
