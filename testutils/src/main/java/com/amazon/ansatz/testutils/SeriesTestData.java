/*
 * Copyright 2020 Amazon.com, Inc. or its affiliates. All Rights Reserved.
 *
 * Licensed under the Apache License, Version 2.0 (the "License").
 * You may not use this file except in compliance with the License.
 * A copy of the License is located at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * or in the "license" file accompanying this file. This file is distributed
 * on an "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either
 * express or implied. See the License for the specific language governing
 * permissions and limitations under the License.
 */

package com.amazon.ansatz.testutils;

import java.util.Arrays;
import java.util.Random;

import org.apache.commons.math3.distribution.NormalDistribution;

/**
 * Deterministic synthetic series for tests and benchmarks. Times are the dense
 * index 1..N unless stated otherwise.
 */
public class SeriesTestData {

    private SeriesTestData() {
    }

    /**
     * @return 1, 2, ..., length
     */
    public static double[] time(int length) {
        double[] result = new double[length];
        for (int i = 0; i < length; i++) {
            result[i] = i + 1;
        }
        return result;
    }

    public static double[] linear(int length, double intercept, double slope) {
        double[] t = time(length);
        double[] result = new double[length];
        for (int i = 0; i < length; i++) {
            result[i] = intercept + slope * t[i];
        }
        return result;
    }

    /**
     * a linear trend with additive normal noise
     */
    public static double[] noisyLinear(int length, double intercept, double slope, double sigma, long seed) {
        double[] result = linear(length, intercept, slope);
        Random rng = new Random(seed);
        for (int i = 0; i < length; i++) {
            result[i] += sigma * rng.nextGaussian();
        }
        return result;
    }

    /**
     * {@code (after - before)/2 sign(t - at) + (after + before)/2}, so the sample
     * exactly at {@code at} lies halfway between the two levels
     */
    public static double[] step(int length, double before, double after, double at) {
        double[] t = time(length);
        double[] result = new double[length];
        for (int i = 0; i < length; i++) {
            result[i] = (after - before) / 2 * Math.signum(t[i] - at) + (after + before) / 2;
        }
        return result;
    }

    public static double[] expDecay(int length, double a, double alpha) {
        double[] t = time(length);
        double[] result = new double[length];
        for (int i = 0; i < length; i++) {
            result[i] = a * Math.exp(-alpha * t[i]);
        }
        return result;
    }

    public static double[] flat(int length, double value) {
        double[] result = new double[length];
        Arrays.fill(result, value);
        return result;
    }

    /**
     * The evenly spaced quantiles {@code (i - 0.5)/length} of a normal
     * distribution in a seeded random order. The sample has the exact shape of
     * the distribution, which makes normality checks reproducible.
     */
    public static double[] normalQuantiles(int length, double mu, double sigma, long seed) {
        NormalDistribution distribution = new NormalDistribution(mu, sigma);
        double[] result = new double[length];
        for (int i = 0; i < length; i++) {
            result[i] = distribution.inverseCumulativeProbability((i + 0.5) / length);
        }
        shuffle(result, new Random(seed));
        return result;
    }

    /**
     * independent normal draws
     */
    public static double[] normal(int length, double mu, double sigma, long seed) {
        Random rng = new Random(seed);
        double[] result = new double[length];
        for (int i = 0; i < length; i++) {
            result[i] = mu + sigma * rng.nextGaussian();
        }
        return result;
    }

    /**
     * adds {@code magnitude} to the values at the given indices
     *
     * @return a copy of the values with the spikes and the indices they were
     *         placed at
     */
    public static SeriesWithAnomalies withSpikes(double[] values, double magnitude, int... indices) {
        double[] result = Arrays.copyOf(values, values.length);
        for (int index : indices) {
            result[index] += magnitude;
        }
        return new SeriesWithAnomalies(time(values.length), result, Arrays.copyOf(indices, indices.length));
    }

    private static void shuffle(double[] values, Random rng) {
        for (int i = values.length - 1; i > 0; i--) {
            int j = rng.nextInt(i + 1);
            double swap = values[i];
            values[i] = values[j];
            values[j] = swap;
        }
    }
}
