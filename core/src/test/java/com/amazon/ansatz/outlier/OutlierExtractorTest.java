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

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import java.util.Arrays;
import java.util.Collections;

import org.junit.jupiter.api.Test;

import com.amazon.ansatz.config.ModelType;
import com.amazon.ansatz.config.Params;
import com.amazon.ansatz.diagnostics.DiagnosticCode;
import com.amazon.ansatz.inputtypes.Series;
import com.amazon.ansatz.model.FitResult;
import com.amazon.ansatz.model.IModel;
import com.amazon.ansatz.model.StepFunctionModel;
import com.amazon.ansatz.returntypes.AnomalousPoint;
import com.amazon.ansatz.testutils.SeriesTestData;

public class OutlierExtractorTest {

    private final Params params = Params.builder().build();

    private final OutlierExtractor extractor = new OutlierExtractor(params);

    private static IModel modelWithResidual(double[] residual, double threshold) {
        IModel model = mock(IModel.class);
        when(model.isFitted()).thenReturn(true);
        when(model.getModelType()).thenReturn(ModelType.LINEAR_REGRESSION);
        when(model.residual(any())).thenReturn(residual);
        when(model.residualThreshold(any())).thenReturn(threshold);
        when(model.convergenceError()).thenReturn(0.0);
        when(model.convergenceTolerance(any())).thenReturn(10.0);
        return model;
    }

    @Test
    public void testUpwardStepMidpoint() {
        Series series = Series.of(SeriesTestData.step(100, 20, 60, 20));
        StepFunctionModel model = new StepFunctionModel(series.getTime(), series.getValues(), params);
        model.fit();
        Outliers outliers = extractor.extract(model, series);
        assertEquals(Collections.singletonList(new AnomalousPoint(20, 40)), outliers.getPoints());
        assertEquals(19 / Math.sqrt(3.8), outliers.getResiduals()[0], 1e-9);
        assertTrue(outliers.getWarnings().isEmpty());
    }

    @Test
    public void testDownwardStepFlagsLowerLevel() {
        Series series = Series.of(SeriesTestData.step(100, 60, 20, 50));
        StepFunctionModel model = new StepFunctionModel(series.getTime(), series.getValues(), params);
        model.fit();
        Outliers outliers = extractor.extract(model, series);
        assertEquals(50, outliers.getPoints().size());
        assertEquals(new AnomalousPoint(51, 20), outliers.getPoints().get(0));
        assertEquals(new AnomalousPoint(100, 20), outliers.getPoints().get(49));
        for (double residual : outliers.getResiduals()) {
            assertEquals(39.6, residual, 1e-9);
        }
    }

    @Test
    public void testSmallDropIsNotAnomalous() {
        Series series = Series.of(SeriesTestData.step(100, 30, 25, 50));
        StepFunctionModel model = new StepFunctionModel(series.getTime(), series.getValues(), params);
        model.fit();
        assertEquals(ModelType.DECREASE_STEP_FUNC, model.getModelType());
        assertTrue(extractor.extract(model, series).isEmpty());
    }

    @Test
    public void testPoorFitWarnsAndUsesResidual() {
        IModel model = modelWithResidual(new double[] { 0, 0, 5 }, 2.5);
        when(model.getModelType()).thenReturn(ModelType.DECREASE_STEP_FUNC);
        when(model.convergenceError()).thenReturn(100.0);
        when(model.convergenceWarning()).thenReturn(DiagnosticCode.STEP_CONVERGENCE);
        when(model.getFitResult()).thenReturn(
                FitResult.converged(new double[] { 60, 20, 1.5 }, new double[3], new double[3]));

        Outliers outliers = extractor.extract(model, Series.of(new double[] { 60, 60, 25 }));
        assertEquals(Collections.singletonList(DiagnosticCode.STEP_CONVERGENCE), outliers.getWarnings());
        assertEquals(Collections.singletonList(new AnomalousPoint(3, 25)), outliers.getPoints());
    }

    @Test
    public void testSortedByCallerTime() {
        Series series = Series.of(new double[] { 50, 40, 30, 20, 10 }, new double[] { 1, 2, 3, 4, 5 });
        IModel model = modelWithResidual(new double[] { -3, 1, 2.6, 0, 5 }, 2.5);
        Outliers outliers = extractor.extract(model, series);
        assertEquals(Arrays.asList(new AnomalousPoint(10, 5), new AnomalousPoint(30, 3), new AnomalousPoint(50, 1)),
                outliers.getPoints());
        assertArrayEquals(new double[] { 5, 2.6, -3 }, outliers.getResiduals());
    }

    @Test
    public void testRaisingThresholdNeverAddsPoints() {
        double[] residual = new double[] { -3, 1, 2.6, 0, 5, -0.7, 4 };
        Series series = Series.of(new double[residual.length]);
        int previous = Integer.MAX_VALUE;
        for (double threshold : new double[] { 0, 0.5, 1, 2.5, 3, 4.5, 10 }) {
            int count = extractor.extract(modelWithResidual(residual, threshold), series).getPoints().size();
            assertTrue(count <= previous);
            previous = count;
        }
        assertEquals(0, previous);
    }

    @Test
    public void testUnfitModel() {
        IModel model = mock(IModel.class);
        assertThrows(IllegalArgumentException.class, () -> extractor.extract(model, Series.of(new double[3])));
    }
}
