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

import org.apache.commons.math3.distribution.ChiSquaredDistribution;

/**
 * D'Agostino and Pearson's omnibus test of normality, combining a test of
 * skewness and a test of kurtosis into a statistic that is chi-squared with two
 * degrees of freedom under the null hypothesis.
 */
public class NormalityTest {

    // the skew test is not valid below this many samples
    public static final int MIN_SAMPLES = 8;

    private NormalityTest() {
    }

    /**
     * @param x the sample
     * @return the p-value of the null hypothesis that x comes from a normal
     *         distribution; NaN when the test is undefined (too few samples or
     *         zero variance)
     */
    public static double pValue(double[] x) {
        if (x.length < MIN_SAMPLES) {
            return Double.NaN;
        }
        double s = skewStatistic(x);
        double k = kurtosisStatistic(x);
        if (!Double.isFinite(s) || !Double.isFinite(k)) {
            return Double.NaN;
        }
        double k2 = s * s + k * k;
        return 1.0 - new ChiSquaredDistribution(2).cumulativeProbability(k2);
    }

    static double skewStatistic(double[] x) {
        double n = x.length;
        double b2 = SeriesStatistics.skewness(x);
        double y = b2 * Math.sqrt(((n + 1) * (n + 3)) / (6.0 * (n - 2)));
        double beta2 = (3.0 * (n * n + 27 * n - 70) * (n + 1) * (n + 3)) / ((n - 2.0) * (n + 5) * (n + 7) * (n + 9));
        double w2 = -1 + Math.sqrt(2 * (beta2 - 1));
        double delta = 1 / Math.sqrt(0.5 * Math.log(w2));
        double alpha = Math.sqrt(2.0 / (w2 - 1));
        double ratio = y / alpha;
        return delta * Math.log(ratio + Math.sqrt(ratio * ratio + 1));
    }

    static double kurtosisStatistic(double[] x) {
        double n = x.length;
        double b2 = SeriesStatistics.kurtosis(x);
        double expected = 3.0 * (n - 1) / (n + 1);
        double variance = 24.0 * n * (n - 2) * (n - 3) / ((n + 1) * (n + 1) * (n + 3) * (n + 5));
        double z = (b2 - expected) / Math.sqrt(variance);
        double sqrtBeta1 = 6.0 * (n * n - 5 * n + 2) / ((n + 7) * (n + 9))
                * Math.sqrt((6.0 * (n + 3) * (n + 5)) / (n * (n - 2) * (n - 3)));
        double a = 6.0 + 8.0 / sqrtBeta1 * (2.0 / sqrtBeta1 + Math.sqrt(1 + 4.0 / (sqrtBeta1 * sqrtBeta1)));
        double term1 = 1 - 2 / (9.0 * a);
        double denominator = 1 + z * Math.sqrt(2 / (a - 4.0));
        if (denominator == 0) {
            return Double.NaN;
        }
        double term2 = Math.signum(denominator) * Math.cbrt((1 - 2.0 / a) / Math.abs(denominator));
        return (term1 - term2) / Math.sqrt(2 / (9.0 * a));
    }
}
