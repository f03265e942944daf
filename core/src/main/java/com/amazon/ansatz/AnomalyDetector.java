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

import static com.amazon.ansatz.CommonUtils.checkNotNull;
import static com.amazon.ansatz.CommonUtils.checkState;
import static com.amazon.ansatz.CommonUtils.checkValid;

import java.util.Map;

import lombok.Getter;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.amazon.ansatz.config.Params;
import com.amazon.ansatz.diagnostics.DiagnosticCode;
import com.amazon.ansatz.diagnostics.DiagnosticsCollector;
import com.amazon.ansatz.inputtypes.Series;
import com.amazon.ansatz.model.FitResult;
import com.amazon.ansatz.model.IModel;
import com.amazon.ansatz.model.IModelFactory;
import com.amazon.ansatz.outlier.OutlierExtractor;
import com.amazon.ansatz.outlier.Outliers;
import com.amazon.ansatz.returntypes.FittingResult;
import com.amazon.ansatz.selection.Selection;
import com.amazon.ansatz.selection.SelectionEngine;
import com.amazon.ansatz.selection.SelectionState;

/**
 * Checks a complete series for anomalies in one synchronous call. The detector
 * holds only its configuration: every call fits fresh models and shares no
 * state with other calls, so a detector may be used from several threads.
 *
 * <pre>
 * AnomalyDetector detector = new AnomalyDetector(Params.builder().infoCriterion(InfoCriterion.BIC).build());
 * FittingResult result = detector.check(time, values);
 * </pre>
 */
public class AnomalyDetector {

    private static final Logger logger = LogManager.getLogger(AnomalyDetector.class);

    @Getter
    private final Params params;

    private final IModelFactory modelFactory;

    public AnomalyDetector() {
        this(Params.builder().build());
    }

    public AnomalyDetector(Params params) {
        this(params, IModelFactory.standard());
    }

    public AnomalyDetector(Params params, IModelFactory modelFactory) {
        this.params = checkNotNull(params, "params must not be null");
        this.modelFactory = checkNotNull(modelFactory, "modelFactory must not be null");
    }

    /**
     * checks a series whose time is the dense index 1..N
     */
    public FittingResult check(double[] values) {
        return check(Series.of(values));
    }

    public FittingResult check(double[] time, double[] values) {
        return check(Series.of(time, values));
    }

    /**
     * @param series the series to check
     * @return the selected model, the anomalous points and the diagnostics
     * @throws ValidationException        if the series is shorter than the
     *                                    minimum sample size
     * @throws NoModelSelectableException if no model could be fit
     */
    public FittingResult check(Series series) {
        checkNotNull(series, "series must not be null");
        checkValid(series.size() >= params.getMinSampleSize(), String.format(
                "number of samples %d are less than min sample size %d", series.size(), params.getMinSampleSize()));

        SelectionState state = advance(SelectionState.START, SelectionState.NORMALITY_CHECK);
        Selection selection = new SelectionEngine(params, modelFactory).select(series);
        state = advance(state, selection.getPath());
        IModel model = selection.getModel();
        state = advance(state, SelectionState.SCORED);

        Outliers outliers = new OutlierExtractor(params).extract(model, series);
        state = advance(state, SelectionState.OUTLIERS_EXTRACTED);

        Map<DiagnosticCode, String> diagnostics = new DiagnosticsCollector(params).collect(model.getModelType(),
                series, outliers);
        state = advance(state, SelectionState.DIAGNOSED);

        FitResult fit = model.getFitResult();
        FittingResult result = FittingResult.builder().model(model.getModelType()).popt(fit.getPopt())
                .perr(fit.getPerr()).anomalies(outliers.getPoints()).residuals(outliers.getResiduals())
                .diagnostics(diagnostics).scores(selection.getScores()).checkFailed(!outliers.isEmpty()).build();
        advance(state, SelectionState.DONE);
        logger.info("selected {} with {} anomalous points out of {}", result.getModel(), result.getAnomalies().size(),
                series.size());
        return result;
    }

    private static SelectionState advance(SelectionState from, SelectionState to) {
        checkState(from.canAdvanceTo(to), "illegal transition " + from + " -> " + to);
        logger.debug("{} -> {}", from, to);
        return to;
    }
}
