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
import static org.mockito.ArgumentMatchers.startsWith;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.io.BufferedReader;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.amazon.ansatz.inputtypes.Series;

public class AnomalyCheckRunnerTest {

    private AnomalyCheckRunner runner;

    private BufferedReader in;
    private PrintWriter out;

    @BeforeEach
    public void setUp() {
        runner = new AnomalyCheckRunner();
        runner.parse("--delimiter", ",", "--header-row", "true");

        in = mock(BufferedReader.class);
        out = mock(PrintWriter.class);
    }

    private static String[] lines(String header, double[] time, double[] values) {
        String[] lines = new String[values.length + 2];
        lines[0] = header;
        for (int i = 0; i < values.length; i++) {
            lines[i + 1] = (time == null) ? Double.toString(values[i]) : time[i] + "," + values[i];
        }
        lines[values.length + 1] = null;
        return lines;
    }

    private void feed(String[] lines) throws IOException {
        when(in.readLine()).thenReturn(lines[0], Arrays.copyOfRange(lines, 1, lines.length));
    }

    @Test
    public void testRunLinear() throws IOException {
        double[] values = new double[100];
        for (int i = 0; i < values.length; i++) {
            values[i] = 6 * (i + 1) + 10;
        }
        feed(lines("value", null, values));
        runner.run(in, out);
        verify(out).println("time,value,residual");
        verify(out).println("# model: linear_regression");
        verify(out).println("# -8: Info: AnomalyDetector is using z normalization.");
        verify(out).println("# 0: Check passed.");
        verify(out, never()).println(startsWith("20.0,"));
    }

    @Test
    public void testRunStepWithTime() throws IOException {
        double[] time = new double[100];
        double[] values = new double[100];
        for (int i = 0; i < values.length; i++) {
            time[i] = i + 1;
            values[i] = 20 * (Math.signum(time[i] - 20) + 2);
        }
        feed(lines("time,value", time, values));
        runner.run(in, out);
        verify(out).println("# model: increase_step_func");
        verify(out).println(startsWith("20.0,40.0,"));
        verify(out, never()).println("# 0: Check passed.");
    }

    @Test
    public void testProcessLine() {
        runner.lineNumber = 1;
        runner.processLine(new String[] { "1.0", "2.5" });
        runner.processLine(new String[] { "2.0", " 3.5 " });
        Series series = runner.toSeries();
        assertEquals(2, series.size());
        assertEquals(2.0, series.getTime(1));
        assertEquals(3.5, series.getValue(1));
    }

    @Test
    public void testInconsistentFields() {
        runner.processLine(new String[] { "1.0", "2.5" });
        assertThrows(IllegalArgumentException.class, () -> runner.processLine(new String[] { "1.0" }));
        AnomalyCheckRunner other = new AnomalyCheckRunner();
        assertThrows(IllegalArgumentException.class, () -> other.processLine(new String[] { "1", "2", "3" }));
    }

    @Test
    public void testMainKeepsStdoutForResults() throws IOException {
        StringBuilder input = new StringBuilder();
        for (int i = 1; i <= 50; i++) {
            input.append(3 * i + 1).append('\n');
        }
        ByteArrayOutputStream stdout = new ByteArrayOutputStream();
        ByteArrayOutputStream stderr = new ByteArrayOutputStream();

        InputStream originalIn = System.in;
        PrintStream originalOut = System.out;
        PrintStream originalErr = System.err;
        try {
            System.setIn(new ByteArrayInputStream(input.toString().getBytes(StandardCharsets.UTF_8)));
            System.setOut(new PrintStream(stdout, true, StandardCharsets.UTF_8));
            System.setErr(new PrintStream(stderr, true, StandardCharsets.UTF_8));
            AnomalyCheckRunner.main();
        } finally {
            System.setIn(originalIn);
            System.setOut(originalOut);
            System.setErr(originalErr);
        }

        String results = stdout.toString(StandardCharsets.UTF_8);
        String messages = stderr.toString(StandardCharsets.UTF_8);
        assertTrue(results.contains("# model: linear_regression"));
        assertFalse(results.contains("Reading from stdin"));
        assertFalse(results.contains("Done."));
        assertTrue(messages.contains("Reading from stdin"));
        assertTrue(messages.contains("Done."));
    }
}
