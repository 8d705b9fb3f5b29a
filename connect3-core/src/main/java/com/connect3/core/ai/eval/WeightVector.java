package com.connect3.core.ai.eval;

import java.util.Arrays;
import java.util.Objects;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

/**
 * Immutable ordered list of weights, one per {@link Feature} in declaration order.
 */
public final class WeightVector {

    private static final WeightVector DEFAULTS = of(1.0, 4.0, 0.25, 0.1, 2.0, 0.0);

    private final double[] weights;

    private WeightVector(double[] weights) {
        this.weights = weights;
    }

    /**
     * Creates a vector from weights listed in {@link Feature} order.
     *
     * @throws IllegalArgumentException if the count does not match or a weight is not finite
     */
    public static WeightVector of(double... weights) {
        Objects.requireNonNull(weights, "weights");
        if (weights.length != Feature.values().length) {
            throw new IllegalArgumentException("Expected " + Feature.values().length + " weights but got "
                    + weights.length);
        }
        for (double weight : weights) {
            if (!Double.isFinite(weight)) {
                throw new IllegalArgumentException("Weights must be finite: " + Arrays.toString(weights));
            }
        }
        return new WeightVector(weights.clone());
    }

    public static WeightVector defaults() {
        return DEFAULTS;
    }

    public double get(Feature feature) {
        return weights[feature.ordinal()];
    }

    public WeightVector with(Feature feature, double weight) {
        double[] copy = weights.clone();
        copy[feature.ordinal()] = weight;
        return of(copy);
    }

    public int size() {
        return weights.length;
    }

    public double[] toArray() {
        return weights.clone();
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof WeightVector)) {
            return false;
        }
        return Arrays.equals(weights, ((WeightVector) other).weights);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(weights);
    }

    @Override
    public String toString() {
        Feature[] features = Feature.values();
        return IntStream.range(0, weights.length)
                .mapToObj(i -> String.format("%s=%.3f", features[i], weights[i]))
                .collect(Collectors.joining(", ", "[", "]"));
    }
}
