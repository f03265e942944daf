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

import org.apache.commons.math3.stat.regression.SimpleRegression;

import com.amazon.ansatz.config.Ansatz;
import com.amazon.ansatz.config.ModelType;
import com.amazon.ansatz.config.Params;
import com.amazon.ansatz.diagnostics.DiagnosticCode;
import com.amazon.ansatz.statistics.ModelFunctions;

/**
 * Ordinary least squares of {@code value = intercept + slope * time}.
 */
public class LinearTrendModel extends AbstractModel {

    static final int ARITY = 2;

    public LinearTrendModel(double[] time, double[] values, Params params) {
        super(time, values, params);
    }

    @Override
    public Ansatz getAnsatz() {
        return Ansatz.LINEAR_REGRESSION;
    }

    @Override
    protected int getArity() {
        return ARITY;
    }

    @Override
    public boolean isApplicable() {
        return true;
    }

    @Override
    protected FitResult doFit() {
        if (values.length <= ARITY) {
            return failure("not enough points for a linear regression");
        }
        SimpleRegression regression = new SimpleRegression();
        for (int i = 0; i < values.length; i++) {
            regression.addData(time[i], values[i]);
        }
        double[] popt = new double[] { regression.getIntercept(), regression.getSlope() };
        double[] perr = new double[] { regression.getInterceptStdErr(), regression.getSlopeStdErr() };
        return FitResult.converged(popt, perr, ModelFunctions.linear(time, popt[0], popt[1]));
    }

    @Override
    public double residualThreshold(Params params) {
        return params.getLinearRes();
    }

    /**
     * the standard error of the slope
     */
    @Override
    public double convergenceError() {
        return getFitResult().getPerr()[1];
    }

    @Override
    public double convergenceTolerance(Params params) {
        return params.getLinearErr();
    }

    @Override
    public DiagnosticCode convergenceWarning() {
        return DiagnosticCode.LINEAR_CONVERGENCE;
    }

    @Override
    public ModelType getModelType() {
        return ModelType.LINEAR_REGRESSION;
    }
}
