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

import java.util.Arrays;

import com.amazon.ansatz.ValidationException;

/**
 * The ansatzes that can be switched on or off for a detection run.
 */
public enum Ansatz {

    GAUSSIAN("gaussian"), LINEAR_REGRESSION("linear_regression"), STEP_FUNC("step_func"), EXP_DECAY("exp_decay");

    private final String label;

    Ansatz(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }

    public static Ansatz fromLabel(String label) {
        return Arrays.stream(values()).filter(a -> a.label.equalsIgnoreCase(label)).findFirst()
                .orElseThrow(() -> new ValidationException("unknown ansatz " + label));
    }
}
