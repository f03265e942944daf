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

package com.amazon.ansatz.outlier;

import java.util.Collections;
import java.util.List;

import lombok.AllArgsConstructor;
import lombok.Getter;

import com.amazon.ansatz.diagnostics.DiagnosticCode;
import com.amazon.ansatz.returntypes.AnomalousPoint;

/**
 * anomalous points in ascending time, their residuals and the convergence
 * warnings raised while extracting them
 */
@Getter
@AllArgsConstructor
public class Outliers {

    private final List<AnomalousPoint> points;

    private final double[] residuals;

    private final List<DiagnosticCode> warnings;

    public static Outliers none() {
        return new Outliers(Collections.emptyList(), new double[0], Collections.emptyList());
    }

    public boolean isEmpty() {
        return points.isEmpty();
    }
}
