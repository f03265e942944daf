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

package com.amazon.ansatz.selection;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

public class SelectionStateTest {

    @Test
    public void testGaussianPath() {
        assertTrue(SelectionState.START.canAdvanceTo(SelectionState.NORMALITY_CHECK));
        assertTrue(SelectionState.NORMALITY_CHECK.canAdvanceTo(SelectionState.GAUSSIAN_ACCEPTED));
        assertTrue(SelectionState.GAUSSIAN_ACCEPTED.canAdvanceTo(SelectionState.SCORED));
        assertTrue(SelectionState.SCORED.canAdvanceTo(SelectionState.OUTLIERS_EXTRACTED));
        assertTrue(SelectionState.OUTLIERS_EXTRACTED.canAdvanceTo(SelectionState.DIAGNOSED));
        assertTrue(SelectionState.DIAGNOSED.canAdvanceTo(SelectionState.DONE));
    }

    @Test
    public void testCompetitionPath() {
        assertTrue(SelectionState.NORMALITY_CHECK.canAdvanceTo(SelectionState.COMPETE));
        assertTrue(SelectionState.COMPETE.canAdvanceTo(SelectionState.SCORED));
    }

    @Test
    public void testIllegalTransitions() {
        assertFalse(SelectionState.START.canAdvanceTo(SelectionState.COMPETE));
        assertFalse(SelectionState.GAUSSIAN_ACCEPTED.canAdvanceTo(SelectionState.COMPETE));
        assertFalse(SelectionState.SCORED.canAdvanceTo(SelectionState.DONE));
        for (SelectionState next : SelectionState.values()) {
            assertFalse(SelectionState.DONE.canAdvanceTo(next));
        }
    }
}
