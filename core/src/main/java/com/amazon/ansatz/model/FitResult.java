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

package com.amazon.ansatz.model;

import static com.amazon.ansatz.CommonUtils.filled;

import java.util.Arrays;

import lombok.Getter;

/**
 * The outcome of fitting one model: either converged parameters with their
 * standard errors and the predicted values, or a convergence failure. A failure
 * carries infinite parameters, errors and predictions, so that it scores
 * positive infinity under any information criterion and never wins a
 * comparison unless every candidate failed.
 */
@Getter
public class FitResult {

    private final boolean converged;

    private final double[] popt;

    private final double[] perr;

    private final double[] predicted;

    // null for converged fits
    private final String failureReason;

    protected FitResult(boolean converged, double[] popt, double[] perr, double[] predicted, String failureReason) {
        this.converged = converged;
        this.popt = popt;
        this.perr = perr;
        this.predicted = predicted;
        this.failureReason = failureReason;
    }

    public static FitResult converged(double[] popt, double[] perr, double[] predicted) {
        return new FitResult(true, Arrays.copyOf(popt, popt.length), Arrays.copyOf(perr, perr.length),
                Arrays.copyOf(predicted, predicted.length), null);
    }

    /**
     * @param arity  number of parameters of the model
     * @param length number of predicted points
     * @param reason why the fit failed
     * @return a failure with all values at positive infinity
     */
    public static FitResult failed(int arity, int length, String reason) {
        return new FitResult(false, filled(arity, Double.POSITIVE_INFINITY), filled(arity, Double.POSITIVE_INFINITY),
                filled(length, Double.POSITIVE_INFINITY), reason);
    }

    /**
     * @param from first parameter index to include
     * @return the sum of squared parameter errors from the given index on
     */
    public double errorEnergy(int from) {
        double sum = 0;
        for (int i = from; i < perr.length; i++) {
            sum += perr[i] * perr[i];
        }
        return sum;
    }

    public double errorEnergy() {
        return errorEnergy(0);
    }
}
