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

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

import com.amazon.ansatz.config.ModelType;
import com.amazon.ansatz.config.Params;
import com.amazon.ansatz.testutils.SeriesTestData;

public class StepFunctionModelTest {

    private final Params params = Params.builder().build();

    @Test
    public void testUpwardStep() {
        StepFunctionModel model = new StepFunctionModel(SeriesTestData.time(100), SeriesTestData.step(100, 20, 60, 20),
                params);
        FitResult result = model.fit();
        assertTrue(result.isConverged());
        // the midpoint sample at t = 20 joins the lower level
        assertArrayEquals(new double[] { 21, 60, 20.5 }, result.getPopt(), 1e-9);
        assertTrue(model.isIncreasing());
        assertEquals(ModelType.INCREASE_STEP_FUNC, model.getModelType());
        assertEquals(0, result.getPerr()[2]);
        assertTrue(model.convergenceError() < model.convergenceTolerance(params));
    }

    @Test
    public void testDownwardStep() {
        StepFunctionModel model = new StepFunctionModel(SeriesTestData.time(100), SeriesTestData.step(100, 60, 20, 50),
                params);
        FitResult result = model.fit();
        assertArrayEquals(new double[] { 59.6, 20, 50.5 }, result.getPopt(), 1e-9);
        assertFalse(model.isIncreasing());
        assertEquals(ModelType.DECREASE_STEP_FUNC, model.getModelType());
    }

    @Test
    public void testEvaluationBudget() {
        StepFunctionModel model = new StepFunctionModel(SeriesTestData.time(100), SeriesTestData.step(100, 20, 60, 20),
                Params.builder().maxEvaluations(1).build());
        // only the candidate nearest the largest increase is scanned
        assertEquals(18.5, model.fit().getPopt()[2]);
    }

    @Test
    public void testLevelsAreClipped() {
        StepFunctionModel model = new StepFunctionModel(SeriesTestData.time(100), SeriesTestData.step(100, 20, 60, 20),
                Params.builder().bounds(0, 40).build());
        FitResult result = model.fit();
        assertTrue(result.isConverged());
        assertTrue(result.getPopt()[1] <= 40);
        assertTrue(result.getPopt()[2] <= 40);
    }

    @Test
    public void testUnsortedTime() {
        double[] time = new double[] { 5, 1, 4, 2, 3, 8, 6, 7 };
        double[] values = new double[8];
        for (int i = 0; i < time.length; i++) {
            values[i] = time[i] > 4 ? 30 : 10;
        }
        StepFunctionModel model = new StepFunctionModel(time, values, params);
        assertArrayEquals(new double[] { 10, 30, 4.5 }, model.fit().getPopt(), 1e-9);
        assertArrayEquals(values, model.getFitResult().getPredicted(), 1e-9);
    }

    @Test
    public void testConstantTime() {
        StepFunctionModel model = new StepFunctionModel(SeriesTestData.flat(10, 1), SeriesTestData.time(10), params);
        assertFalse(model.fit().isConverged());
    }

    @Test
    public void testTooFewPoints() {
        StepFunctionModel model = new StepFunctionModel(new double[] { 1, 2, 3 }, new double[] { 1, 1, 5 }, params);
        assertFalse(model.fit().isConverged());
    }
}
