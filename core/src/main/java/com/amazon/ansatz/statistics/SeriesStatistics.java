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

package com.amazon.ansatz.statistics;

import static com.amazon.ansatz.CommonUtils.checkArgument;
import static com.amazon.ansatz.statistics.ModelFunctions.checkSameLength;

import java.util.ArrayList;
import java.util.List;

import org.apache.commons.math3.stat.StatUtils;
import org.apache.commons.math3.stat.descriptive.rank.Median;
import org.apache.commons.math3.stat.regression.SimpleRegression;

/**
 * Descriptive statistics and detectors over a single series. Standard
 * deviations are population deviations (normalized by n), skewness and kurtosis
 * are the biased moment ratios.
 */
public class SeriesStatistics {

    // the 0.75 quantile of the standard normal, the limit of MAD / sigma
    public static final double MAD_NORMAL_CONSISTENCY = 0.6745;

    private SeriesStatistics() {
    }

    public static double mean(double[] x) {
        return StatUtils.mean(x);
    }

    public static double std(double[] x) {
        return Math.sqrt(StatUtils.populationVariance(x));
    }

    public static double[] diff(double[] x) {
        double[] answer = new double[Math.max(0, x.length - 1)];
        for (int i = 0; i < answer.length; i++) {
            answer[i] = x[i + 1] - x[i];
        }
        return answer;
    }

    /**
     * @return the first index of the maximum value
     */
    public static int argmax(double[] x) {
        checkArgument(x.length > 0, "empty array");
        int index = 0;
        for (int i = 1; i < x.length; i++) {
            if (x[i] > x[index]) {
                index = i;
            }
        }
        return index;
    }

    static double centralMoment(double[] x, double mean, int order) {
        double sum = 0;
        for (double v : x) {
            sum += Math.pow(v - mean, order);
        }
        return sum / x.length;
    }

    /**
     * the third standardized moment {@code m3 / m2^1.5}; NaN for zero variance
     */
    public static double skewness(double[] x) {
        checkArgument(x.length > 0, "empty array");
        double mean = mean(x);
        double m2 = centralMoment(x, mean, 2);
        if (m2 == 0) {
            return Double.NaN;
        }
        return centralMoment(x, mean, 3) / Math.pow(m2, 1.5);
    }

    /**
     * Pearson kurtosis {@code m4 / m2^2} (3 for a normal distribution); NaN for
     * zero variance
     */
    public static double kurtosis(double[] x) {
        checkArgument(x.length > 0, "empty array");
        double mean = mean(x);
        double m2 = centralMoment(x, mean, 2);
        if (m2 == 0) {
            return Double.NaN;
        }
        return centralMoment(x, mean, 4) / (m2 * m2);
    }

    public static double median(double[] x) {
        return new Median().evaluate(x);
    }

    /**
     * {@code median(|x - median(x)|)}, a robust measure of spread
     */
    public static double medianAbsoluteDeviation(double[] x) {
        double median = median(x);
        double[] deviations = new double[x.length];
        for (int i = 0; i < x.length; i++) {
            deviations[i] = Math.abs(x[i] - median);
        }
        return median(deviations);
    }

    /**
     * {@code (x - mean) / std}; the centered series is returned as is when the
     * deviation is zero
     */
    public static double[] zScore(double[] x) {
        double mean = mean(x);
        double std = std(x);
        double[] answer = new double[x.length];
        for (int i = 0; i < x.length; i++) {
            answer[i] = (std == 0) ? x[i] - mean : (x[i] - mean) / std;
        }
        return answer;
    }

    /**
     * {@code 0.6745 (x - median) / MAD}, the robust counterpart of the z-score;
     * the centered series is returned when the MAD is zero
     */
    public static double[] modifiedZScore(double[] x) {
        double median = median(x);
        double mad = medianAbsoluteDeviation(x);
        double[] answer = new double[x.length];
        for (int i = 0; i < x.length; i++) {
            answer[i] = (mad == 0) ? x[i] - median : MAD_NORMAL_CONSISTENCY * (x[i] - median) / mad;
        }
        return answer;
    }

    /**
     * Counts runs of consecutive points on the same side of the mean. The series
     * oscillates when the number of runs per point exceeds the threshold.
     *
     * @param x                  the series
     * @param frequencyThreshold runs per point above which the series oscillates
     * @return true if oscillating
     */
    public static boolean isOscillating(double[] x, double frequencyThreshold) {
        if (x.length == 0) {
            return false;
        }
        double mean = mean(x);
        int runs = 1;
        boolean above = x[0] - mean > 0;
        for (int i = 1; i < x.length; i++) {
            boolean current = x[i] - mean > 0;
            if (current != above) {
                ++runs;
                above = current;
            }
        }
        return (double) runs / x.length > frequencyThreshold;
    }

    /**
     * Indices {@code i} of the first difference {@code x[i+1] - x[i]} that deviate
     * from the mean difference by more than {@code width} standard deviations of
     * the series.
     *
     * @param x     the series
     * @param width number of standard deviations
     * @return ascending indices into the first difference
     */
    public static int[] discontinuousIndices(double[] x, double width) {
        double[] dx = diff(x);
        if (dx.length == 0) {
            return new int[0];
        }
        double meanDifference = mean(dx);
        double limit = width * std(x);
        List<Integer> indices = new ArrayList<>();
        for (int i = 0; i < dx.length; i++) {
            if (Math.abs(dx[i] - meanDifference) > limit) {
                indices.add(i);
            }
        }
        return indices.stream().mapToInt(Integer::intValue).toArray();
    }

    /**
     * standard deviation of the first difference, optionally relative to the
     * magnitude of the mean difference
     */
    public static double smoothness(double[] x, boolean normalize) {
        double[] dx = diff(x);
        checkArgument(dx.length > 0, "at least two points required");
        double answer = std(dx);
        if (normalize) {
            answer /= Math.abs(mean(dx));
        }
        return answer;
    }

    /**
     * Whether {@code (t, y)} is a straight line within tolerance: the slope
     * standard error is below the threshold, or the slope is indistinguishable
     * from zero with a p-value of exactly one.
     */
    public static boolean isLinear(double[] t, double[] y, double stdErrThreshold) {
        checkSameLength(t, y);
        SimpleRegression regression = new SimpleRegression();
        for (int i = 0; i < t.length; i++) {
            regression.addData(t[i], y[i]);
        }
        return regression.getSignificance() == 1 || regression.getSlopeStdErr() < stdErrThreshold;
    }
}
