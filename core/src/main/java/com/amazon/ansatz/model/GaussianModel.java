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

import lombok.Getter;

import com.amazon.ansatz.config.Ansatz;
import com.amazon.ansatz.config.InfoCriterion;
import com.amazon.ansatz.config.ModelType;
import com.amazon.ansatz.config.Params;
import com.amazon.ansatz.diagnostics.DiagnosticCode;
import com.amazon.ansatz.statistics.Histogram;
import com.amazon.ansatz.statistics.ICScore;
import com.amazon.ansatz.statistics.ModelFunctions;
import com.amazon.ansatz.statistics.NormalityTest;
import com.amazon.ansatz.statistics.Residuals;
import com.amazon.ansatz.statistics.SeriesStatistics;

/**
 * Treats the series as noise drawn from a normal distribution. The model is
 * fit to the histogram of the values, not to the values over time. When the
 * series has fewer distinct values than the model has parameters the fit is
 * replaced by the flat-histogram estimate {@code (count(mode), mode, +inf)}.
 */
public class GaussianModel extends AbstractModel {

    static final int ARITY = 3;

    static final double AMPLITUDE_SEED_FACTOR = 0.9;

    private Histogram histogram;

    @Getter
    private double pValue = Double.NaN;

    @Getter
    private boolean flat;

    public GaussianModel(double[] time, double[] values, Params params) {
        super(time, values, params);
    }

    @Override
    public Ansatz getAnsatz() {
        return Ansatz.GAUSSIAN;
    }

    @Override
    protected int getArity() {
        return ARITY;
    }

    /**
     * the normality gate: the p-value of the D'Agostino-Pearson test on the raw
     * values must be finite and at least {@code pNormality}
     */
    @Override
    public boolean isApplicable() {
        pValue = NormalityTest.pValue(values);
        return Double.isFinite(pValue) && pValue >= params.getPNormality();
    }

    @Override
    protected FitResult doFit() {
        if (Histogram.exact(values).size() < ARITY) {
            flat = true;
            return flatHistogram(values);
        }
        histogram = Histogram.binned(values);

        double[] start = new double[] { AMPLITUDE_SEED_FACTOR * histogram.maxCount(),
                SeriesStatistics.mean(values), SeriesStatistics.std(values) };
        double[] lower = new double[ARITY];
        double[] upper = new double[ARITY];
        Arrays.fill(lower, params.getLowerBound());
        Arrays.fill(upper, params.getUpperBound());
        for (int i = 0; i < ARITY; i++) {
            if (start[i] < lower[i] || start[i] > upper[i]) {
                return failure("initial guess " + Arrays.toString(start) + " is outside of the bounds");
            }
        }

        LeastSquaresFitter fitter = new LeastSquaresFitter(ModelFunctions.NORMAL, GaussianModel::jacobian,
                params.getMaxEvaluations(), lower, upper);
        return fitter.fit(histogram.getCenters(), histogram.getCounts(), start);
    }

    /**
     * Assigns Gaussian parameters to a histogram that is too flat to fit: the
     * series is regarded as a local segment of a much wider distribution.
     *
     * @param x the values
     * @return popt {@code (count(mode), mode, +inf)} with zero errors
     */
    public static FitResult flatHistogram(double[] x) {
        Histogram exact = Histogram.exact(x);
        double[] counts = exact.getCounts();
        int mode = SeriesStatistics.argmax(counts);
        double[] popt = new double[] { counts[mode], exact.getCenters()[mode], Double.POSITIVE_INFINITY };
        double[] predicted = new double[x.length];
        Arrays.fill(predicted, popt[1]);
        return FitResult.converged(popt, new double[ARITY], predicted);
    }

    /**
     * the flat-histogram estimate has an infinite std
     */
    @Override
    protected boolean isAdmissible(FitResult result) {
        if (!flat) {
            return super.isAdmissible(result);
        }
        double[] popt = result.getPopt();
        return Double.isFinite(popt[0]) && Double.isFinite(popt[1]) && popt[2] == Double.POSITIVE_INFINITY;
    }

    static double[][] jacobian(double[] x, double[] p) {
        double a = p[0];
        double x0 = p[1];
        double sigma = p[2];
        double[][] answer = new double[x.length][ARITY];
        for (int i = 0; i < x.length; i++) {
            double d = x[i] - x0;
            double e = Math.exp(-d * d / (2 * sigma * sigma));
            answer[i][0] = e;
            answer[i][1] = a * e * d / (sigma * sigma);
            answer[i][2] = a * e * d * d / (sigma * sigma * sigma);
        }
        return answer;
    }

    /**
     * scored against the histogram it was fit to
     */
    @Override
    public double score(InfoCriterion criterion) {
        if (!getFitResult().isConverged() || flat) {
            return super.score(criterion);
        }
        return ICScore.score(criterion, histogram.getCounts(), getFitResult().getPredicted(), ARITY);
    }

    @Override
    public double[] residual(Params params) {
        return Residuals.meanCenteredResidual(values, params.getMinRes());
    }

    @Override
    public double residualThreshold(Params params) {
        return params.getStdWidth();
    }

    @Override
    public double convergenceError() {
        return getFitResult().getPerr()[2];
    }

    @Override
    public double convergenceTolerance(Params params) {
        return params.getGaussianStdErr();
    }

    @Override
    public DiagnosticCode convergenceWarning() {
        return DiagnosticCode.GAUSSIAN_CONVERGENCE;
    }

    @Override
    public ModelType getModelType() {
        return flat ? ModelType.FLAT_HISTOGRAM : ModelType.GAUSSIAN;
    }
}
