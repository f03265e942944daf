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

import static com.amazon.ansatz.CommonUtils.checkArgument;

import java.util.Arrays;
import java.util.function.BiFunction;

import org.apache.commons.math3.fitting.leastsquares.LeastSquaresBuilder;
import org.apache.commons.math3.fitting.leastsquares.LeastSquaresOptimizer;
import org.apache.commons.math3.fitting.leastsquares.LeastSquaresProblem;
import org.apache.commons.math3.fitting.leastsquares.LevenbergMarquardtOptimizer;
import org.apache.commons.math3.fitting.leastsquares.MultivariateJacobianFunction;
import org.apache.commons.math3.fitting.leastsquares.ParameterValidator;
import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.ArrayRealVector;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.SingularMatrixException;
import org.apache.commons.math3.util.Pair;

import com.amazon.ansatz.statistics.ModelFunction;

/**
 * Nonlinear least squares with Levenberg-Marquardt. Parameter standard errors
 * are the square roots of the diagonal of the covariance scaled by the residual
 * variance; when the covariance cannot be estimated they are infinite.
 */
public class LeastSquaresFitter {

    static final double COVARIANCE_THRESHOLD = 1e-14;

    private final ModelFunction function;

    private final BiFunction<double[], double[], double[][]> jacobian;

    private final int maxEvaluations;

    // null when unbounded
    private final double[] lowerBound;

    private final double[] upperBound;

    /**
     * @param function       the model function
     * @param jacobian       partial derivatives of the function for every point
     *                       (rows) and parameter (columns)
     * @param maxEvaluations budget of function evaluations
     */
    public LeastSquaresFitter(ModelFunction function, BiFunction<double[], double[], double[][]> jacobian,
            int maxEvaluations) {
        this(function, jacobian, maxEvaluations, null, null);
    }

    public LeastSquaresFitter(ModelFunction function, BiFunction<double[], double[], double[][]> jacobian,
            int maxEvaluations, double[] lowerBound, double[] upperBound) {
        checkArgument(maxEvaluations > 0, "maxEvaluations must be positive");
        checkArgument((lowerBound == null) == (upperBound == null), "bounds must be given together");
        this.function = function;
        this.jacobian = jacobian;
        this.maxEvaluations = maxEvaluations;
        this.lowerBound = lowerBound;
        this.upperBound = upperBound;
    }

    /**
     * @param x     the independent variable
     * @param y     observed values
     * @param start initial parameters, inside the bounds if any
     * @return the converged fit
     * @throws org.apache.commons.math3.exception.TooManyEvaluationsException
     *         if the budget runs out
     */
    public FitResult fit(double[] x, double[] y, double[] start) {
        checkArgument(x.length == y.length, "x and y must have the same length");
        if (lowerBound != null) {
            checkArgument(lowerBound.length == start.length && upperBound.length == start.length,
                    "bounds must match the number of parameters");
            for (int i = 0; i < start.length; i++) {
                checkArgument(start[i] >= lowerBound[i] && start[i] <= upperBound[i],
                        "initial guess is outside of the bounds");
            }
        }

        MultivariateJacobianFunction model = point -> {
            double[] p = point.toArray();
            return new Pair<>(new ArrayRealVector(function.apply(x, p), false),
                    new Array2DRowRealMatrix(jacobian.apply(x, p), false));
        };

        LeastSquaresBuilder builder = new LeastSquaresBuilder().start(start).model(model).target(y)
                .maxEvaluations(maxEvaluations).maxIterations(maxEvaluations);
        if (lowerBound != null) {
            builder.parameterValidator(clamp());
        }
        LeastSquaresProblem problem = builder.build();

        LeastSquaresOptimizer.Optimum optimum = new LevenbergMarquardtOptimizer().optimize(problem);
        double[] popt = optimum.getPoint().toArray();
        return FitResult.converged(popt, standardErrors(optimum, x.length, popt.length), function.apply(x, popt));
    }

    private ParameterValidator clamp() {
        return params -> {
            double[] p = params.toArray();
            for (int i = 0; i < p.length; i++) {
                p[i] = Math.max(lowerBound[i], Math.min(upperBound[i], p[i]));
            }
            return new ArrayRealVector(p, false);
        };
    }

    static double[] standardErrors(LeastSquaresOptimizer.Optimum optimum, int observations, int parameters) {
        double[] perr = new double[parameters];
        int dof = observations - parameters;
        if (dof <= 0) {
            Arrays.fill(perr, Double.POSITIVE_INFINITY);
            return perr;
        }
        double cost = optimum.getCost();
        double variance = cost * cost / dof;
        try {
            RealMatrix covariance = optimum.getCovariances(COVARIANCE_THRESHOLD);
            for (int i = 0; i < parameters; i++) {
                perr[i] = Math.sqrt(Math.abs(covariance.getEntry(i, i)) * variance);
            }
        } catch (SingularMatrixException e) {
            Arrays.fill(perr, Double.POSITIVE_INFINITY);
        }
        return perr;
    }
}
