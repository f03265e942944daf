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

package com.amazon.ansatz.diagnostics;

import java.util.Arrays;

import lombok.Getter;

import com.amazon.ansatz.ValidationException;

/**
 * Advisory and informational codes attached to a result. The numeric codes
 * are stable and used as keys in serialized results.
 */
@Getter
public enum DiagnosticCode {

    CHECK_PASSED(0, "Check passed."),

    GAUSSIAN_CONVERGENCE(-1, "ConvergenceError: Gaussian fitting may not converge, std_err > std_err_th."),

    /**
     * only evaluated when the Gaussian or flat histogram model was selected
     */
    SKEWNESS(-2, "Warning: Normal distribution may have skewed, skewness > skewness_th."),

    STEP_CONVERGENCE(-3, "ConvergenceError: General erf fitting may not converge, perr > perr_th."),

    EXP_DECAY_CONVERGENCE(-4, "ConvergenceError: Exponential fitting may not converge, perr > perr_th."),

    LINEAR_CONVERGENCE(-5, "ConvergenceError: Linear ansatz fitting may not converge, perr > perr_th."),

    OSCILLATION(-6, "Warning: Rawdata might be oscillating, data flips sign repeatedly over mean."),

    Z_NORMALIZATION(-8, "Info: AnomalyDetector is using z normalization."),

    /**
     * the message is a template taking the number of discontinuous points
     */
    DISCONTINUITY(-9, "Info: There are more than %d discontinuous points detected.");

    private final int code;

    private final String message;

    DiagnosticCode(int code, String message) {
        this.code = code;
        this.message = message;
    }

    public String format(Object... args) {
        return String.format(message, args);
    }

    public static DiagnosticCode fromCode(int code) {
        return Arrays.stream(values()).filter(c -> c.code == code).findFirst()
                .orElseThrow(() -> new ValidationException("unknown diagnostic code " + code));
    }
}
