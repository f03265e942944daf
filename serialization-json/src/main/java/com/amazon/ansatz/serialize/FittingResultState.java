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

package com.amazon.ansatz.serialize;

import java.io.Serializable;
import java.util.Map;

import lombok.Data;

/**
 * The plain data form of a fitting result. Anomalies are {@code [time, value]}
 * pairs, diagnostics are keyed by their numeric code and scores by the label of
 * the ansatz.
 */
@Data
public class FittingResultState implements Serializable {

    private static final long serialVersionUID = 1L;

    private String model;

    private double[] popt;

    private double[] perr;

    private double[][] anomalies;

    private double[] residuals;

    private Map<String, String> diagnostics;

    private Map<String, Double> scores;

    private boolean checkFailed;
}
