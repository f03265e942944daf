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

/**
 * Residuals of a fitted model. Masking of small residuals always happens before
 * standardization, and the standard deviation used for standardization is that
 * of the unmasked residual. Standardization is skipped when that deviation is
 * zero.
 */
public class Residuals {

    private Residuals() {
    }

    /**
     * @param t            abscissa
     * @param y            observations
     * @param function     model function
     * @param params       fitted parameters of the function
     * @param maskMin      residuals with magnitude below this are set to zero;
     *                     zero disables masking
     * @param standardized divide by the residual standard deviation
     * @return {@code y - f(t; params)}, masked and possibly standardized
     */
    public static double[] fittingResidual(double[] t, double[] y, ModelFunction function, double[] params,
            double maskMin, boolean standardized) {
        return fittingResidual(y, function.apply(t, params), maskMin, standardized);
    }

    public static double[] fittingResidual(double[] y, double[] predicted, double maskMin, boolean standardized) {
        checkSameLength(y, predicted);
        double[] residual = new double[y.length];
        for (int i = 0; i < y.length; i++) {
            residual[i] = y[i] - predicted[i];
        }
        double norm = SeriesStatistics.std(residual);
        mask(residual, maskMin);
        if (standardized && norm != 0 && Double.isFinite(norm)) {
            for (int i = 0; i < residual.length; i++) {
                residual[i] /= norm;
            }
        }
        return residual;
    }

    /**
     * The distribution residual: the mean centered series, masked, divided by the
     * standard deviation of the series (a z-score).
     *
     * @param x       the series
     * @param maskMin masking floor
     * @return the masked z-score of each point
     */
    public static double[] meanCenteredResidual(double[] x, double maskMin) {
        double mean = SeriesStatistics.mean(x);
        double norm = SeriesStatistics.std(x);
        double[] residual = new double[x.length];
        for (int i = 0; i < x.length; i++) {
            residual[i] = x[i] - mean;
        }
        mask(residual, maskMin);
        if (norm != 0) {
            for (int i = 0; i < residual.length; i++) {
                residual[i] /= norm;
            }
        }
        return residual;
    }

    static void mask(double[] residual, double maskMin) {
        if (maskMin > 0) {
            for (int i = 0; i < residual.length; i++) {
                if (Math.abs(residual[i]) < maskMin) {
                    residual[i] = 0;
                }
            }
        }
    }
}
