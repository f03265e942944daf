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

import static com.amazon.ansatz.CommonUtils.checkNotNull;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.amazon.ansatz.ValidationException;
import com.amazon.ansatz.config.Ansatz;
import com.amazon.ansatz.config.ModelType;
import com.amazon.ansatz.diagnostics.DiagnosticCode;
import com.amazon.ansatz.returntypes.AnomalousPoint;
import com.amazon.ansatz.returntypes.FittingResult;

/**
 * Converts between {@link FittingResult} and {@link FittingResultState}.
 */
public class FittingResultMapper {

    public FittingResultState toState(FittingResult result) {
        checkNotNull(result, "result must not be null");
        FittingResultState state = new FittingResultState();
        state.setModel(result.getModel().getLabel());
        state.setPopt(result.getPopt());
        state.setPerr(result.getPerr());

        List<AnomalousPoint> anomalies = result.getAnomalies();
        double[][] pairs = new double[anomalies.size()][];
        for (int i = 0; i < pairs.length; i++) {
            pairs[i] = new double[] { anomalies.get(i).getTime(), anomalies.get(i).getValue() };
        }
        state.setAnomalies(pairs);
        state.setResiduals(result.getResiduals());

        Map<String, String> diagnostics = new LinkedHashMap<>();
        result.getDiagnostics().forEach((code, message) -> diagnostics.put(Integer.toString(code.getCode()), message));
        state.setDiagnostics(diagnostics);

        Map<String, Double> scores = new LinkedHashMap<>();
        result.getScores().forEach((ansatz, score) -> scores.put(ansatz.getLabel(), score));
        state.setScores(scores);
        state.setCheckFailed(result.isCheckFailed());
        return state;
    }

    public FittingResult toModel(FittingResultState state) {
        checkNotNull(state, "state must not be null");
        List<AnomalousPoint> anomalies = new ArrayList<>();
        if (state.getAnomalies() != null) {
            for (double[] pair : state.getAnomalies()) {
                if (pair == null || pair.length != 2) {
                    throw new ValidationException("anomalies must be [time, value] pairs");
                }
                anomalies.add(new AnomalousPoint(pair[0], pair[1]));
            }
        }

        Map<DiagnosticCode, String> diagnostics = new LinkedHashMap<>();
        if (state.getDiagnostics() != null) {
            state.getDiagnostics().forEach(
                    (code, message) -> diagnostics.put(DiagnosticCode.fromCode(parseCode(code)), message));
        }

        Map<Ansatz, Double> scores = new LinkedHashMap<>();
        if (state.getScores() != null) {
            state.getScores().forEach((label, score) -> scores.put(Ansatz.fromLabel(label), score));
        }

        return FittingResult.builder().model(ModelType.fromLabel(state.getModel())).popt(state.getPopt())
                .perr(state.getPerr()).anomalies(anomalies).residuals(state.getResiduals()).diagnostics(diagnostics)
                .scores(scores).checkFailed(state.isCheckFailed()).build();
    }

    private static int parseCode(String code) {
        try {
            return Integer.parseInt(code);
        } catch (NumberFormatException e) {
            throw new ValidationException("diagnostic code is not an integer: " + code);
        }
    }
}
