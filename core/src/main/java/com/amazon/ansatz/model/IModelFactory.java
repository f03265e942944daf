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
import com.amazon.ansatz.config.Params;

/**
 * Creates a fresh, unfit model for one detection run.
 */
@FunctionalInterface
public interface IModelFactory {

    /**
     * @param ansatz the functional form
     * @param time   the time axis used for fitting
     * @param values the values of the series
     * @param params the configuration of the run
     * @return a new model that has not been fit
     */
    IModel newModel(Ansatz ansatz, double[] time, double[] values, Params params);

    static IModelFactory standard() {
        return (ansatz, time, values, params) -> {
            switch (ansatz) {
            case GAUSSIAN:
                return new GaussianModel(time, values, params);
            case LINEAR_REGRESSION:
                return new LinearTrendModel(time, values, params);
            case STEP_FUNC:
                return new StepFunctionModel(time, values, params);
            case EXP_DECAY:
                return new ExponentialDecayModel(time, values, params);
            default:
                throw new IllegalArgumentException("unknown ansatz " + ansatz);
            }
        };
    }
}
