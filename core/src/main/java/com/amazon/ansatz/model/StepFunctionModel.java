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
import java.util.Comparator;
import java.util.stream.IntStream;

import com.amazon.ansatz.config.Ansatz;
import com.amazon.ansatz.config.ModelType;
import com.amazon.ansatz.config.Params;
import com.amazon.ansatz.diagnostics.DiagnosticCode;
import com.amazon.ansatz.statistics.ModelFunctions;
import com.amazon.ansatz.statistics.SeriesStatistics;

/**
 * A single level shift {@code (b - a)/2 sign(t - t0) + (a + b)/2}.
 * <p>
 * The residual sum of squares is piecewise constant in {@code t0}, so a
 * gradient based solver cannot move the step. The fit profiles {@code t0}
 * instead: every midpoint between consecutive distinct times is a candidate,
 * the levels {@code a} and {@code b} are the bounded means on either side, and
 * the candidate with the least residual wins. Ties go to the candidate nearest
 * the seed, which is the time of the largest increase between consecutive
 * values. Each candidate costs one evaluation; when there are more candidates
 * than the evaluation budget, only those nearest the seed are scanned.
 */
public class StepFunctionModel extends AbstractModel {

    static final int ARITY = 3;

    public StepFunctionModel(double[] time, double[] values, Params params) {
        super(time, values, params);
    }

    @Override
    public Ansatz getAnsatz() {
        return Ansatz.STEP_FUNC;
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
        int n = values.length;
        if (n <= ARITY) {
            return failure("not enough points for a step function");
        }

        int[] order = IntStream.range(0, n).boxed().sorted(Comparator.comparingDouble(i -> time[i]))
                .mapToInt(Integer::intValue).toArray();
        double[] sortedTime = new double[n];
        double[] sum = new double[n + 1];
        double[] sumOfSquares = new double[n + 1];
        for (int k = 0; k < n; k++) {
            double y = values[order[k]];
            sortedTime[k] = time[order[k]];
            sum[k + 1] = sum[k] + y;
            sumOfSquares[k + 1] = sumOfSquares[k] + y * y;
        }

        // candidate k splits the sorted samples into [0, k] and [k + 1, n)
        double seed = time[SeriesStatistics.argmax(SeriesStatistics.diff(values))];
        Integer[] candidates = IntStream.range(0, n - 1)
                .filter(k -> sortedTime[k] < sortedTime[k + 1] && isInBounds(midpoint(sortedTime, k))).boxed()
                .sorted(Comparator.comparingDouble(k -> Math.abs(midpoint(sortedTime, k) - seed)))
                .toArray(Integer[]::new);
        if (candidates.length == 0) {
            return failure("no admissible step location");
        }

        int evaluations = Math.min(candidates.length, params.getMaxEvaluations());
        int best = -1;
        double bestRss = Double.POSITIVE_INFINITY;
        double bestA = 0;
        double bestB = 0;
        for (int c = 0; c < evaluations; c++) {
            int k = candidates[c];
            int left = k + 1;
            int right = n - left;
            double a = clip(sum[left] / left);
            double b = clip((sum[n] - sum[left]) / right);
            double rss = (sumOfSquares[left] - 2 * a * sum[left] + left * a * a)
                    + (sumOfSquares[n] - sumOfSquares[left] - 2 * b * (sum[n] - sum[left]) + right * b * b);
            // strict comparison keeps the candidate nearest the seed on ties
            if (rss < bestRss) {
                bestRss = rss;
                best = k;
                bestA = a;
                bestB = b;
            }
        }
        if (best < 0) {
            return failure("residual is not finite for any step location");
        }

        double t0 = midpoint(sortedTime, best);
        double[] popt = new double[] { bestA, bestB, t0 };
        int left = best + 1;
        int right = n - left;
        double variance = Math.max(bestRss, 0) / (n - ARITY);
        double[] perr = new double[] { Math.sqrt(variance / left), Math.sqrt(variance / right), 0 };
        return FitResult.converged(popt, perr, ModelFunctions.sign(time, bestA, bestB, t0));
    }

    private static double midpoint(double[] sorted, int k) {
        return 0.5 * (sorted[k] + sorted[k + 1]);
    }

    private boolean isInBounds(double value) {
        return value >= params.getLowerBound() && value <= params.getUpperBound();
    }

    private double clip(double value) {
        return Math.max(params.getLowerBound(), Math.min(params.getUpperBound(), value));
    }

    /**
     * @return true if the fitted level after the step is above the level before
     */
    public boolean isIncreasing() {
        double[] popt = getFitResult().getPopt();
        return popt[1] > popt[0];
    }

    @Override
    public double residualThreshold(Params params) {
        return params.getStepRes();
    }

    @Override
    public double convergenceTolerance(Params params) {
        return params.getStepErr();
    }

    @Override
    public DiagnosticCode convergenceWarning() {
        return DiagnosticCode.STEP_CONVERGENCE;
    }

    @Override
    public ModelType getModelType() {
        return isIncreasing() ? ModelType.INCREASE_STEP_FUNC : ModelType.DECREASE_STEP_FUNC;
    }
}
