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

package com.amazon.ansatz.config;

import com.amazon.ansatz.ValidationException;

/**
 * The reporting identity of a selected ansatz. The step function is a single
 * fitted shape with two identities depending on the direction of the jump.
 */
public enum ModelType {

    GAUSSIAN("gaussian"),
    /**
     * the series passed the normality gate but its histogram was too flat to fit
     */
    FLAT_HISTOGRAM("flat_histogram"),
    LINEAR_REGRESSION("linear_regression"),
    INCREASE_STEP_FUNC("increase_step_func"),
    DECREASE_STEP_FUNC("decrease_step_func"),
    EXP_DECAY("exp_decay");

    private final String label;

    ModelType(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }

    public boolean isDistribution() {
        return this == GAUSSIAN || this == FLAT_HISTOGRAM;
    }

    public boolean isStepFunction() {
        return this == INCREASE_STEP_FUNC || this == DECREASE_STEP_FUNC;
    }

    public static ModelType fromLabel(String label) {
        for (ModelType type : values()) {
            if (type.label.equals(label)) {
                return type;
            }
        }
        throw new ValidationException("unknown model " + label);
    }
}
