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

import com.amazon.ansatz.config.Ansatz;
import com.amazon.ansatz.config.InfoCriterion;
import com.amazon.ansatz.config.ModelType;
import com.amazon.ansatz.config.Params;
import com.amazon.ansatz.diagnostics.DiagnosticCode;

/**
 * The capabilities shared by every ansatz. A model is constructed for one
 * detection run and fit exactly once; refitting requires a new instance.
 */
public interface IModel {

    Ansatz getAnsatz();

    /**
     * @return the number of fitted parameters used in the information criterion
     */
    int getDegreesOfFreedom();

    /**
     * @return true if the series is in the domain where this ansatz can be
     *         considered at all
     */
    boolean isApplicable();

    /**
     * Fits the model. Numerical failures never escape; they are returned as a
     * failed {@link FitResult}.
     *
     * @return the outcome of the fit
     * @throws IllegalStateException if the model was already fit
     */
    FitResult fit();

    boolean isFitted();

    FitResult getFitResult();

    /**
     * @param criterion AIC or BIC
     * @return the information criterion score of the fit, positive infinity for a
     *         failed fit
     */
    double score(InfoCriterion criterion);

    /**
     * @param params thresholds and policies of the run
     * @return the signed deviation of every point from the fitted model, in the
     *         units the residual threshold of this model is expressed in
     */
    double[] residual(Params params);

    /**
     * @param params thresholds of the run
     * @return points whose residual magnitude exceeds this are anomalous
     */
    double residualThreshold(Params params);

    /**
     * @return the measure of fit uncertainty compared against
     *         {@link #convergenceTolerance(Params)}
     */
    double convergenceError();

    double convergenceTolerance(Params params);

    /**
     * @return the warning attached to the result when the convergence error
     *         exceeds its tolerance
     */
    DiagnosticCode convergenceWarning();

    /**
     * @return the reporting identity of the fitted model
     */
    ModelType getModelType();
}
