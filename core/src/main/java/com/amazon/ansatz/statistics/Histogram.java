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

import java.util.Arrays;
import java.util.Map;
import java.util.TreeMap;

import org.apache.commons.math3.stat.descriptive.rank.Percentile;

import lombok.Getter;

/**
 * A histogram as (center, count) pairs sorted by center. Binning is
 * deterministic: equal width bins over [min, max] with the width chosen as the
 * smaller of the Freedman-Diaconis and Sturges estimates. Without binning every
 * distinct value is its own bin.
 */
@Getter
public class Histogram {

    private final double[] centers;

    private final double[] counts;

    protected Histogram(double[] centers, double[] counts) {
        this.centers = centers;
        this.counts = counts;
    }

    public static Histogram of(double[] x, boolean binning) {
        return binning ? binned(x) : exact(x);
    }

    public int size() {
        return centers.length;
    }

    public double maxCount() {
        return Arrays.stream(counts).max().orElse(0);
    }

    /**
     * counts exact values, treating the series as already discrete
     */
    public static Histogram exact(double[] x) {
        checkArgument(x.length > 0, "cannot build a histogram of an empty series");
        TreeMap<Double, Integer> counter = new TreeMap<>();
        for (double v : x) {
            // -0.0 and 0.0 are the same value
            counter.merge(v + 0.0, 1, Integer::sum);
        }
        double[] centers = new double[counter.size()];
        double[] counts = new double[counter.size()];
        int i = 0;
        for (Map.Entry<Double, Integer> entry : counter.entrySet()) {
            centers[i] = entry.getKey();
            counts[i++] = entry.getValue();
        }
        return new Histogram(centers, counts);
    }

    public static Histogram binned(double[] x) {
        double[] edges = binEdges(x);
        int bins = edges.length - 1;
        double first = edges[0];
        double last = edges[bins];
        double[] counts = new double[bins];
        for (double v : x) {
            int index = (int) Math.floor((v - first) / (last - first) * bins);
            index = Math.max(0, Math.min(bins - 1, index));
            // correct for rounding at the edges
            if (v < edges[index] && index > 0) {
                --index;
            } else if (index < bins - 1 && v >= edges[index + 1]) {
                ++index;
            }
            counts[index]++;
        }
        double[] centers = new double[bins];
        for (int i = 0; i < bins; i++) {
            centers[i] = 0.5 * (edges[i] + edges[i + 1]);
        }
        return new Histogram(centers, counts);
    }

    static double[] binEdges(double[] x) {
        checkArgument(x.length > 0, "cannot build a histogram of an empty series");
        double min = Arrays.stream(x).min().getAsDouble();
        double max = Arrays.stream(x).max().getAsDouble();
        if (min == max) {
            return new double[] { min - 0.5, max + 0.5 };
        }
        double width = autoBinWidth(x, max - min);
        int bins = (width > 0) ? (int) Math.ceil((max - min) / width) : 1;
        bins = Math.max(1, bins);
        double[] edges = new double[bins + 1];
        double step = (max - min) / bins;
        for (int i = 0; i < bins; i++) {
            edges[i] = min + i * step;
        }
        edges[bins] = max;
        return edges;
    }

    static double autoBinWidth(double[] x, double range) {
        double sturges = range / (Math.log(x.length) / Math.log(2) + 1.0);
        Percentile percentile = new Percentile().withEstimationType(Percentile.EstimationType.R_7);
        percentile.setData(x);
        double iqr = percentile.evaluate(75) - percentile.evaluate(25);
        double freedmanDiaconis = 2.0 * iqr * Math.pow(x.length, -1.0 / 3.0);
        return (freedmanDiaconis > 0) ? Math.min(freedmanDiaconis, sturges) : sturges;
    }
}
