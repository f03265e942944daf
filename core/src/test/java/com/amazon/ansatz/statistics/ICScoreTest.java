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

package com.amazon.ansatz.statistics;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

import com.amazon.ansatz.config.InfoCriterion;

public class ICScoreTest {

    private static final double[] Y = new double[] { 0, 1, 2, 3, 4 };

    private static final double[] PREDICTED = new double[] { 0.1, 0.8, 2.3, 2.6, 4.5 };

    @Test
    public void testAic() {
        assertEquals(-7.03637456595, ICScore.aic(Y, PREDICTED, 2), 1e-9);
        assertEquals(ICScore.aic(Y, PREDICTED, 2), ICScore.score(InfoCriterion.AIC, Y, PREDICTED, 2));
    }

    @Test
    public void testBic() {
        assertEquals(-7.81749874108, ICScore.bic(Y, PREDICTED, 2), 1e-9);
        assertEquals(ICScore.bic(Y, PREDICTED, 2), ICScore.score(InfoCriterion.BIC, Y, PREDICTED, 2));
    }

    @Test
    public void testRss() {
        assertEquals(0.55, ICScore.rss(Y, PREDICTED), 1e-12);
    }

    @Test
    public void testDegenerateResiduals() {
        assertEquals(Double.NEGATIVE_INFINITY, ICScore.aic(Y, Y, 2));
        double[] failed = new double[] { Double.POSITIVE_INFINITY, Double.POSITIVE_INFINITY,
                Double.POSITIVE_INFINITY, Double.POSITIVE_INFINITY, Double.POSITIVE_INFINITY };
        assertEquals(Double.POSITIVE_INFINITY, ICScore.aic(Y, failed, 2));
        assertEquals(Double.POSITIVE_INFINITY, ICScore.bic(Y, failed, 3));
    }

    @Test
    public void testMoreParametersCostMore() {
        assertTrue(ICScore.aic(Y, PREDICTED, 3) > ICScore.aic(Y, PREDICTED, 2));
        // log(5) < 2, so for five samples BIC penalizes less than AIC
        assertTrue(ICScore.bic(Y, PREDICTED, 2) < ICScore.aic(Y, PREDICTED, 2));
    }
}
