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
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

public class FitResultTest {

    @Test
    public void testConverged() {
        double[] popt = new double[] { 1, 2 };
        FitResult result = FitResult.converged(popt, new double[] { 3, 4 }, new double[] { 5, 6, 7 });
        popt[0] = 100;
        assertTrue(result.isConverged());
        assertNull(result.getFailureReason());
        assertArrayEquals(new double[] { 1, 2 }, result.getPopt());
        assertEquals(25, result.errorEnergy());
        assertEquals(16, result.errorEnergy(1));
    }

    @Test
    public void testFailed() {
        FitResult result = FitResult.failed(3, 5, "diverged");
        assertFalse(result.isConverged());
        assertEquals("diverged", result.getFailureReason());
        assertEquals(3, result.getPopt().length);
        assertEquals(5, result.getPredicted().length);
        for (double v : result.getPerr()) {
            assertEquals(Double.POSITIVE_INFINITY, v);
        }
        assertEquals(Double.POSITIVE_INFINITY, result.errorEnergy());
    }
}
