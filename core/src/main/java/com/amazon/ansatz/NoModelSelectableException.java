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

package com.amazon.ansatz;

import java.util.Collections;
import java.util.Map;

import lombok.Getter;

import com.amazon.ansatz.config.Ansatz;

/**
 * Thrown when every candidate model failed to produce a finite information
 * criterion score, so no model can be reported.
 */
@Getter
public class NoModelSelectableException extends IllegalStateException {

    private static final long serialVersionUID = 1L;

    /**
     * the scores of the candidates that were attempted, all non-finite
     */
    private final transient Map<Ansatz, Double> scores;

    public NoModelSelectableException(String message, Map<Ansatz, Double> scores) {
        super(message);
        this.scores = Collections.unmodifiableMap(scores);
    }
}
