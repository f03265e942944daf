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

import static com.amazon.ansatz.statistics.ModelFunctions.checkSameLength;

import com.amazon.ansatz.config.InfoCriterion;

/**
 * Information criteria computed from the residual sum of squares. A perfect fit
 * (RSS of zero, or negative after floating point error) scores negative
 * infinity instead of taking the logarithm; an undefined RSS scores positive
 * infinity, so that such a model never wins.
 */
public class ICScore {

    private ICScore() {
    }

    public static double rss(double[] y, double[] predicted) {
        checkSameLength(y, predicted);
        double sum = 0;
        for (int i = 0; i < y.length; i++) {
            double r = y[i] - predicted[i];
            sum += r * r;
        }
        return sum;
    }

    /**
     * {@code n log(RSS/n) + 2p}
     *
     * @param y         data samples
     * @param predicted prediction of the fitted model
     * @param p         number of fitted parameters
     * @return the score
     */
    public static double aic(double[] y, double[] predicted, int p) {
        return logLikelihoodTerm(y, predicted) + 2.0 * p;
    }

    /**
     * {@code n log(RSS/n) + p log(n)}
     */
    public static double bic(double[] y, double[] predicted, int p) {
        return logLikelihoodTerm(y, predicted) + p * Math.log(y.length);
    }

    public static double score(InfoCriterion criterion, double[] y, double[] predicted, int p) {
        return (criterion == InfoCriterion.BIC) ? bic(y, predicted, p) : aic(y, predicted, p);
    }

    static double logLikelihoodTerm(double[] y, double[] predicted) {
        double rss = rss(y, predicted);
        if (Double.isNaN(rss) || Double.isInfinite(rss)) {
            return Double.POSITIVE_INFINITY;
        }
        if (rss <= 0) {
            return Double.NEGATIVE_INFINITY;
        }
        int n = y.length;
        return n * Math.log(rss / n);
    }
}
