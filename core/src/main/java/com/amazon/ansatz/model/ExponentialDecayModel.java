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

import java.util.Arrays;

import org.apache.commons.math3.stat.regression.SimpleRegression;

import com.amazon.ansatz.config.Ansatz;
import com.amazon.ansatz.config.ModelType;
import com.amazon.ansatz.config.Params;
import com.amazon.ansatz.diagnostics.DiagnosticCode;
import com.amazon.ansatz.statistics.ModelFunctions;

/**
 * {@code a exp(-alpha t)} for non-negative time. Strictly positive series are
 * fit by linear regression of {@code log(value)} on time; any other series by
 * unbounded Levenberg-Marquardt seeded with {@code (1, 1)}.
 */
public class ExponentialDecayModel extends AbstractModel {

    static final int ARITY = 2;

    public ExponentialDecayModel(double[] time, double[] values, Params params) {
        super(time, values, params);
    }

    @Override
    public Ansatz getAnsatz() {
        return Ansatz.EXP_DECAY;
    }

    @Override
    protected int getArity() {
        return ARITY;
    }

    /**
     * @return true if every time is non-negative
     */
    @Override
    public boolean isApplicable() {
        return Arrays.stream(time).allMatch(t -> t >= 0);
    }

    @Override
    protected FitResult doFit() {
        if (values.length <= ARITY) {
            return failure("not enough points for an exponential decay");
        }
        // evaluating the function rejects negative time before any fitting
        ModelFunctions.expDecay(time, 1, 0);
        if (Arrays.stream(values).allMatch(v -> v > 0)) {
            return logLinearFit();
        }
        LeastSquaresFitter fitter = new LeastSquaresFitter(ModelFunctions.EXP_DECAY,
                ExponentialDecayModel::jacobian, params.getMaxEvaluations());
        return fitter.fit(time, values, new double[] { 1, 1 });
    }

    FitResult logLinearFit() {
        SimpleRegression regression = new SimpleRegression();
        for (int i = 0; i < values.length; i++) {
            regression.addData(time[i], Math.log(values[i]));
        }
        double a = Math.exp(regression.getIntercept());
        double alpha = -regression.getSlope();
        double[] perr = new double[] { a * regression.getInterceptStdErr(), regression.getSlopeStdErr() };
        return FitResult.converged(new double[] { a, alpha }, perr, ModelFunctions.expDecay(time, a, alpha));
    }

    static double[][] jacobian(double[] t, double[] p) {
        double[][] answer = new double[t.length][ARITY];
        for (int i = 0; i < t.length; i++) {
            double e = Math.exp(-p[1] * t[i]);
            answer[i][0] = e;
            answer[i][1] = -p[0] * t[i] * e;
        }
        return answer;
    }

    @Override
    public double residualThreshold(Params params) {
        return params.getExpDecayRes();
    }

    @Override
    public double convergenceTolerance(Params params) {
        return params.getExpDecayErr();
    }

    @Override
    public DiagnosticCode convergenceWarning() {
        return DiagnosticCode.EXP_DECAY_CONVERGENCE;
    }

    @Override
    public ModelType getModelType() {
        return ModelType.EXP_DECAY;
    }
}
