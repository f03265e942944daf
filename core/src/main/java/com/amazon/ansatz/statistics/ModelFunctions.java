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

import com.amazon.ansatz.DomainException;

/**
 * The four functional families that can explain a series.
 */
public class ModelFunctions {

    public static final ModelFunction NORMAL = (x, p) -> normal(x, p[0], p[1], p[2]);

    public static final ModelFunction LINEAR = (t, p) -> linear(t, p[0], p[1]);

    public static final ModelFunction SIGN = (t, p) -> sign(t, p[0], p[1], p[2]);

    public static final ModelFunction EXP_DECAY = (t, p) -> expDecay(t, p[0], p[1]);

    private ModelFunctions() {
    }

    /**
     * unnormalized normal density {@code a exp(-(x - x0)^2 / (2 sigma^2))}
     *
     * @param x     input values
     * @param a     overall normalization constant
     * @param x0    mean
     * @param sigma standard deviation
     * @return the density at each x
     */
    public static double[] normal(double[] x, double a, double x0, double sigma) {
        double[] answer = new double[x.length];
        double twoVariance = 2 * sigma * sigma;
        for (int i = 0; i < x.length; i++) {
            double d = x[i] - x0;
            answer[i] = a * Math.exp(-d * d / twoVariance);
        }
        return answer;
    }

    /**
     * {@code intercept + slope * t}
     */
    public static double[] linear(double[] t, double intercept, double slope) {
        double[] answer = new double[t.length];
        for (int i = 0; i < t.length; i++) {
            answer[i] = intercept + slope * t[i];
        }
        return answer;
    }

    /**
     * generalized step: {@code a} before {@code t0}, {@code b} after and the
     * midpoint {@code (a + b)/2} exactly at {@code t0}
     */
    public static double[] sign(double[] t, double a, double b, double t0) {
        double[] answer = new double[t.length];
        double half = (b - a) / 2;
        double middle = (a + b) / 2;
        for (int i = 0; i < t.length; i++) {
            answer[i] = half * Math.signum(t[i] - t0) + middle;
        }
        return answer;
    }

    /**
     * {@code a exp(-alpha t)}, defined for non-negative time only
     *
     * @throws DomainException if any abscissa is negative
     */
    public static double[] expDecay(double[] t, double a, double alpha) {
        for (double x : t) {
            if (x < 0) {
                throw new DomainException("Domain of exp(-x) is restricted to x >= 0.");
            }
        }
        double[] answer = new double[t.length];
        for (int i = 0; i < t.length; i++) {
            answer[i] = a * Math.exp(-alpha * t[i]);
        }
        return answer;
    }

    static void checkSameLength(double[] a, double[] b) {
        checkArgument(a.length == b.length, "incorrect lengths");
    }
}
