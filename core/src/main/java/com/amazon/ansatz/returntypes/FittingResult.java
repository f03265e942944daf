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

package com.amazon.ansatz.returntypes;

import static com.amazon.ansatz.CommonUtils.checkNotNull;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import com.amazon.ansatz.config.Ansatz;
import com.amazon.ansatz.config.ModelType;
import com.amazon.ansatz.diagnostics.DiagnosticCode;

/**
 * The outcome of one check of a series: the selected model with its fitted
 * parameters, the anomalous points in ascending time with their residuals, and
 * the diagnostics in the order they were raised.
 */
@Getter
@ToString
@EqualsAndHashCode
public class FittingResult {

    private final ModelType model;

    private final double[] popt;

    private final double[] perr;

    private final List<AnomalousPoint> anomalies;

    /**
     * the residual of each anomalous point, aligned with {@link #getAnomalies()}
     */
    private final double[] residuals;

    private final Map<DiagnosticCode, String> diagnostics;

    /**
     * the information criterion score of every competing model, empty when the
     * Gaussian was accepted without competition
     */
    private final Map<Ansatz, Double> scores;

    /**
     * false when no anomaly was found
     */
    private final boolean checkFailed;

    @Builder
    public FittingResult(ModelType model, double[] popt, double[] perr, List<AnomalousPoint> anomalies,
            double[] residuals, Map<DiagnosticCode, String> diagnostics, Map<Ansatz, Double> scores,
            boolean checkFailed) {
        this.model = checkNotNull(model, "model must not be null");
        this.popt = Arrays.copyOf(checkNotNull(popt, "popt must not be null"), popt.length);
        this.perr = Arrays.copyOf(checkNotNull(perr, "perr must not be null"), perr.length);
        this.anomalies = (anomalies == null) ? Collections.emptyList()
                : Collections.unmodifiableList(new ArrayList<>(anomalies));
        this.residuals = (residuals == null) ? new double[0] : Arrays.copyOf(residuals, residuals.length);
        this.diagnostics = (diagnostics == null) ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(diagnostics));
        Map<Ansatz, Double> scoreCopy = new EnumMap<>(Ansatz.class);
        if (scores != null) {
            scoreCopy.putAll(scores);
        }
        this.scores = Collections.unmodifiableMap(scoreCopy);
        this.checkFailed = checkFailed;
    }

    public double[] getPopt() {
        return Arrays.copyOf(popt, popt.length);
    }

    public double[] getPerr() {
        return Arrays.copyOf(perr, perr.length);
    }

    public double[] getResiduals() {
        return Arrays.copyOf(residuals, residuals.length);
    }

    public boolean hasDiagnostic(DiagnosticCode code) {
        return diagnostics.containsKey(code);
    }
}
