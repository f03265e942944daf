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

package com.amazon.ansatz.runner;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.EnumSet;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.amazon.ansatz.ValidationException;
import com.amazon.ansatz.config.Ansatz;
import com.amazon.ansatz.config.InfoCriterion;
import com.amazon.ansatz.config.Params;

public class ArgumentParserTest {

    private ArgumentParser parser;

    @BeforeEach
    public void setUp() {
        parser = new ArgumentParser("runner-class", "runner-description");
    }

    @Test
    public void testNew() {
        assertEquals(InfoCriterion.AIC, parser.getInfoCriterion());
        assertEquals(10, parser.getMinSampleSize());
        assertTrue(parser.getScalelessTime());
        assertTrue(parser.getZNormalization());
        assertEquals(5e-3, parser.getPNormality());
        assertEquals(10.0, parser.getMinRes());
        assertTrue(parser.getDisabledModels().isEmpty());
        assertFalse(parser.getParallel());
        assertEquals(",", parser.getDelimiter());
        assertFalse(parser.getHeaderRow());
        assertEquals(Params.builder().build(), parser.toParams());
    }

    @Test
    public void testParse() {
        parser.parse("--info-criterion", "bic", "--min-sample-size", "20", "--scaleless-time", "false",
                "--z-normalization", "false", "--p-normality", "0.05", "--min-res", "1.5", "--disable",
                "exp_decay, step_func", "--parallel", "true", "--delimiter", "\t", "--header-row", "true");

        assertEquals(InfoCriterion.BIC, parser.getInfoCriterion());
        assertEquals(20, parser.getMinSampleSize());
        assertFalse(parser.getScalelessTime());
        assertFalse(parser.getZNormalization());
        assertEquals(0.05, parser.getPNormality());
        assertEquals(1.5, parser.getMinRes());
        assertEquals(EnumSet.of(Ansatz.EXP_DECAY, Ansatz.STEP_FUNC), parser.getDisabledModels());
        assertTrue(parser.getParallel());
        assertEquals("\t", parser.getDelimiter());
        assertTrue(parser.getHeaderRow());

        Params params = parser.toParams();
        assertEquals(InfoCriterion.BIC, params.getInfoCriterion());
        assertFalse(params.isEnabled(Ansatz.EXP_DECAY));
        assertTrue(params.isEnabled(Ansatz.LINEAR_REGRESSION));
        assertTrue(params.isParallelExecutionEnabled());
    }

    @Test
    public void testParseShortFlags() {
        parser.parse("-c", "BIC", "-m", "30", "-z", "false", "-p", "0.01", "-r", "0", "-d", ";");

        assertEquals(InfoCriterion.BIC, parser.getInfoCriterion());
        assertEquals(30, parser.getMinSampleSize());
        assertFalse(parser.getZNormalization());
        assertEquals(0.01, parser.getPNormality());
        assertEquals(0.0, parser.getMinRes());
        assertEquals(";", parser.getDelimiter());
    }

    @Test
    public void testParseModels() {
        assertEquals(EnumSet.of(Ansatz.GAUSSIAN, Ansatz.LINEAR_REGRESSION),
                ArgumentParser.parseModels("GAUSSIAN,,linear_regression"));
        assertTrue(ArgumentParser.parseModels("").isEmpty());
        assertThrows(ValidationException.class, () -> ArgumentParser.parseModels("erf"));
    }
}
