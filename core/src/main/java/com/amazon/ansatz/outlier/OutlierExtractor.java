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

import static com.amazon.ansatz.CommonUtils.checkArgument;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.stream.IntStream;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.amazon.ansatz.config.ModelType;
import com.amazon.ansatz.config.Params;
import com.amazon.ansatz.diagnostics.DiagnosticCode;
import com.amazon.ansatz.inputtypes.Series;
import com.amazon.ansatz.model.IModel;
import com.amazon.ansatz.returntypes.AnomalousPoint;

/**
 * Flags the points that deviate from the selected model. A point is anomalous
 * when the magnitude of its residual strictly exceeds the threshold of the
 * model. A decreasing step that fit well is the exception: when the drop is
 * larger than {@code minRes}, every point after the step location is
 * anomalous regardless of how close it is to the fitted level.
 */
public class OutlierExtractor {

    private static final Logger logger = LogManager.getLogger(OutlierExtractor.class);

    private final Params params;

    public OutlierExtractor(Params params) {
        this.params = params;
    }

    /**
     * @param model  the selected model, already fit
     * @param series the series the model was fit to
     * @return the anomalous points in ascending caller time
     */
    public Outliers extract(IModel model, Series series) {
        checkArgument(model.isFitted(), "model must be fit before extracting outliers");
        List<DiagnosticCode> warnings = new ArrayList<>();
        boolean poorFit = model.convergenceError() > model.convergenceTolerance(params);
        if (poorFit) {
            warnings.add(model.convergenceWarning());
        }

        int n = series.size();
        double[] residual;
        boolean[] flagged = new boolean[n];
        if (model.getModelType() == ModelType.DECREASE_STEP_FUNC && !poorFit) {
            residual = new double[n];
            double[] popt = model.getFitResult().getPopt();
            double drop = popt[0] - popt[1];
            if (drop > params.getMinRes()) {
                double[] fittingTime = series.getFittingTime(params.isScalelessTime());
                for (int i = 0; i < n; i++) {
                    if (fittingTime[i] > popt[2]) {
                        flagged[i] = true;
                        residual[i] = drop;
                    }
                }
            }
        } else {
            residual = model.residual(params);
            double threshold = model.residualThreshold(params);
            for (int i = 0; i < n; i++) {
                flagged[i] = Math.abs(residual[i]) > threshold;
            }
        }

        int[] order = IntStream.range(0, n).filter(i -> flagged[i]).boxed()
                .sorted(Comparator.comparingDouble(i -> series.getTime(i))).mapToInt(Integer::intValue).toArray();
        List<AnomalousPoint> points = new ArrayList<>(order.length);
        double[] residuals = new double[order.length];
        for (int k = 0; k < order.length; k++) {
            points.add(new AnomalousPoint(series.getTime(order[k]), series.getValue(order[k])));
            residuals[k] = residual[order[k]];
        }
        logger.debug("{} flagged {} of {} points", model.getModelType(), points.size(), n);
        return new Outliers(points, residuals, warnings);
    }
}
