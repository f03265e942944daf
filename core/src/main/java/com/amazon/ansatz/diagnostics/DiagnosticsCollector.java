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

import java.util.LinkedHashMap;
import java.util.Map;

import com.amazon.ansatz.config.ModelType;
import com.amazon.ansatz.config.Params;
import com.amazon.ansatz.inputtypes.Series;
import com.amazon.ansatz.outlier.Outliers;
import com.amazon.ansatz.statistics.Histogram;
import com.amazon.ansatz.statistics.SeriesStatistics;

/**
 * Assembles the advisory messages of a run. Convergence warnings raised during
 * outlier extraction come first, then the skewness, oscillation, normalization
 * and discontinuity checks, and finally {@link DiagnosticCode#CHECK_PASSED}
 * when nothing was flagged.
 */
public class DiagnosticsCollector {

    private final Params params;

    public DiagnosticsCollector(Params params) {
        this.params = params;
    }

    public Map<DiagnosticCode, String> collect(ModelType model, Series series, Outliers outliers) {
        Map<DiagnosticCode, String> diagnostics = new LinkedHashMap<>();
        for (DiagnosticCode warning : outliers.getWarnings()) {
            diagnostics.putIfAbsent(warning, warning.getMessage());
        }

        double[] values = series.getValues();
        if (model.isDistribution() && isSkewed(values)) {
            diagnostics.put(DiagnosticCode.SKEWNESS, DiagnosticCode.SKEWNESS.getMessage());
        }
        if (SeriesStatistics.isOscillating(values, params.getOscillationFrequency())) {
            diagnostics.put(DiagnosticCode.OSCILLATION, DiagnosticCode.OSCILLATION.getMessage());
        }
        if (params.isZNormalization()) {
            diagnostics.put(DiagnosticCode.Z_NORMALIZATION, DiagnosticCode.Z_NORMALIZATION.getMessage());
        }
        int discontinuities = SeriesStatistics.discontinuousIndices(values, params.getDiscontinuityWidth()).length;
        if (discontinuities > params.getDiscontinuityLimit()) {
            diagnostics.put(DiagnosticCode.DISCONTINUITY, DiagnosticCode.DISCONTINUITY.format(discontinuities));
        }
        if (outliers.isEmpty()) {
            diagnostics.put(DiagnosticCode.CHECK_PASSED, DiagnosticCode.CHECK_PASSED.getMessage());
        }
        return diagnostics;
    }

    /**
     * the skewness of the counts of the exact-value histogram, which is NaN and
     * therefore never skewed when all counts are equal
     */
    boolean isSkewed(double[] values) {
        return Math.abs(SeriesStatistics.skewness(Histogram.exact(values).getCounts())) > params.getSkewness();
    }
}
