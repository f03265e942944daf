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
import static com.amazon.ansatz.CommonUtils.checkNotNull;
import static com.amazon.ansatz.CommonUtils.checkState;

import java.util.Arrays;

import lombok.Getter;

import org.apache.commons.math3.exception.MathArithmeticException;
import org.apache.commons.math3.exception.MathIllegalArgumentException;
import org.apache.commons.math3.exception.MathIllegalStateException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.amazon.ansatz.DomainException;
import com.amazon.ansatz.config.InfoCriterion;
import com.amazon.ansatz.config.Params;
import com.amazon.ansatz.statistics.ICScore;
import com.amazon.ansatz.statistics.Residuals;

/**
 * Holds the fit-once lifecycle shared by all models. Subclasses implement
 * {@link #doFit()}; numerical failures thrown from it are converted into a
 * failed {@link FitResult} here.
 */
public abstract class AbstractModel implements IModel {

    private static final Logger logger = LogManager.getLogger(AbstractModel.class);

    /**
     * the time axis used for fitting, either the caller's time or 1..N
     */
    @Getter
    protected final double[] time;

    @Getter
    protected final double[] values;

    protected final Params params;

    private FitResult fitResult;

    protected AbstractModel(double[] time, double[] values, Params params) {
        checkNotNull(time, "time must not be null");
        checkNotNull(values, "values must not be null");
        checkArgument(time.length == values.length, "time and values must have the same length");
        this.time = Arrays.copyOf(time, time.length);
        this.values = Arrays.copyOf(values, values.length);
        this.params = checkNotNull(params, "params must not be null");
    }

    /**
     * fits the model on the stored series
     *
     * @return the fit, never null
     * @throws MathIllegalStateException    on non-convergence
     * @throws MathIllegalArgumentException on a degenerate problem
     * @throws DomainException              if the series is outside the domain
     *                                      of the model function
     */
    protected abstract FitResult doFit();

    /**
     * @return the number of parameters of the model function
     */
    protected abstract int getArity();

    @Override
    public final FitResult fit() {
        checkState(fitResult == null, getAnsatz() + " model was already fit");
        FitResult result;
        try {
            result = doFit();
            if (result.isConverged() && !isAdmissible(result)) {
                result = failure("non-finite parameters " + Arrays.toString(result.getPopt()));
            }
        } catch (DomainException | MathIllegalStateException | MathIllegalArgumentException
                | MathArithmeticException e) {
            result = failure(e.getMessage());
        }
        if (!result.isConverged()) {
            logger.warn("{} fit did not converge: {}", getAnsatz(), result.getFailureReason());
        } else {
            logger.debug("{} fit popt={} perr={}", getAnsatz(), Arrays.toString(result.getPopt()),
                    Arrays.toString(result.getPerr()));
        }
        fitResult = result;
        return result;
    }

    /**
     * whether a converged fit carries usable parameters; by default all of them
     * must be finite
     */
    protected boolean isAdmissible(FitResult result) {
        return Arrays.stream(result.getPopt()).allMatch(Double::isFinite);
    }

    protected FitResult failure(String reason) {
        return FitResult.failed(getArity(), values.length, reason);
    }

    @Override
    public boolean isFitted() {
        return fitResult != null;
    }

    @Override
    public FitResult getFitResult() {
        checkState(fitResult != null, getAnsatz() + " model has not been fit");
        return fitResult;
    }

    @Override
    public int getDegreesOfFreedom() {
        return getArity();
    }

    @Override
    public double score(InfoCriterion criterion) {
        FitResult result = getFitResult();
        if (!result.isConverged()) {
            return Double.POSITIVE_INFINITY;
        }
        return ICScore.score(criterion, values, result.getPredicted(), getDegreesOfFreedom());
    }

    /**
     * the fitting residual of the stored series against the prediction, masked
     * below the minimum residual and z-normalized when the policy says so
     */
    @Override
    public double[] residual(Params params) {
        return Residuals.fittingResidual(values, getFitResult().getPredicted(), params.getMinRes(),
                params.isZNormalization());
    }

    @Override
    public double convergenceError() {
        return getFitResult().errorEnergy();
    }

    @Override
    public String toString() {
        return getAnsatz() + (fitResult == null ? " (unfit)" : " " + Arrays.toString(fitResult.getPopt()));
    }
}
