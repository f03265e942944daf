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

import java.util.Locale;

import com.amazon.ansatz.ValidationException;

/**
 * The penalized likelihood used to compare fitted models of different
 * complexity. Both are computed from the residual sum of squares.
 */
public enum InfoCriterion {

    /**
     * Akaike, {@code n log(RSS/n) + 2p}
     */
    AIC,
    /**
     * Bayesian, {@code n log(RSS/n) + p log(n)}; penalizes parameters more for
     * longer series
     */
    BIC;

    /**
     * parses a criterion name, ignoring case
     *
     * @param name "AIC" or "BIC"
     * @return the criterion
     * @throws ValidationException for any other name
     */
    public static InfoCriterion parse(String name) {
        if (name != null) {
            String upper = name.trim().toUpperCase(Locale.ROOT);
            for (InfoCriterion criterion : values()) {
                if (criterion.name().equals(upper)) {
                    return criterion;
                }
            }
        }
        throw new ValidationException("Information criterion can only be 'AIC' or 'BIC', found " + name);
    }
}
