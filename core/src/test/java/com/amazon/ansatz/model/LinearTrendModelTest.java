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

package com.amazon.ansatz.model;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

import com.amazon.ansatz.config.Ansatz;
import com.amazon.ansatz.config.InfoCriterion;
import com.amazon.ansatz.config.ModelType;
import com.amazon.ansatz.config.Params;
import com.amazon.ansatz.testutils.SeriesTestData;

public class LinearTrendModelTest {

    private final Params params = Params.builder().build();

    @Test
    public void testExactLine() {
        LinearTrendModel model = new LinearTrendModel(SeriesTestData.time(100), SeriesTestData.linear(100, 10, 6),
                params);
        FitResult result = model.fit();
        assertTrue(result.isConverged());
        assertEquals(10, result.getPopt()[0], 1e-9);
        assertEquals(6, result.getPopt()[1], 1e-9);
        assertEquals(0, result.getPerr()[1], 1e-9);
        assertTrue(model.score(InfoCriterion.AIC) < -1000);
        assertEquals(ModelType.LINEAR_REGRESSION, model.getModelType());
        assertEquals(Ansatz.LINEAR_REGRESSION, model.getAnsatz());
        assertEquals(2, model.getDegreesOfFreedom());
    }

    @Test
    public void testNoisyLine() {
        LinearTrendModel model = new LinearTrendModel(SeriesTestData.time(200),
                SeriesTestData.noisyLinear(200, 5, 0.5, 1, 11), params);
        FitResult result = model.fit();
        assertEquals(0.5, result.getPopt()[1], 0.05);
        assertTrue(model.convergenceError() < model.convergenceTolerance(params));
        assertEquals(result.getPerr()[1], model.convergenceError());
    }

    @Test
    public void testTooFewPoints() {
        LinearTrendModel model = new LinearTrendModel(new double[] { 1, 2 }, new double[] { 3, 4 }, params);
        FitResult result = model.fit();
        assertFalse(result.isConverged());
        assertEquals(Double.POSITIVE_INFINITY, model.score(InfoCriterion.AIC));
    }

    @Test
    public void testResidualMasking() {
        double[] values = SeriesTestData.linear(50, 0, 1);
        values[25] += 40;
        LinearTrendModel model = new LinearTrendModel(SeriesTestData.time(50), values, params);
        model.fit();
        double[] residual = model.residual(params);
        for (int i = 0; i < values.length; i++) {
            if (i == 25) {
                assertTrue(residual[i] > params.getLinearRes());
            } else {
                assertEquals(0, residual[i]);
            }
        }
    }
}
