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

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.StringJoiner;

import com.amazon.ansatz.AnomalyDetector;
import com.amazon.ansatz.diagnostics.DiagnosticCode;
import com.amazon.ansatz.inputtypes.Series;
import com.amazon.ansatz.returntypes.AnomalousPoint;
import com.amazon.ansatz.returntypes.FittingResult;

/**
 * Reads a whole series from standard input, checks it once, and writes the
 * anomalous points followed by the fitted model and the diagnostics. Each input
 * line holds either a value or a time and a value.
 */
public class AnomalyCheckRunner {

    protected final ArgumentParser argumentParser;
    protected final List<Double> time = new ArrayList<>();
    protected final List<Double> values = new ArrayList<>();
    protected int lineNumber;
    protected int fields;

    public AnomalyCheckRunner() {
        this(new ArgumentParser(AnomalyCheckRunner.class.getName(),
                "Fit the series to its best explaining model and list the points that deviate from it."));
    }

    public AnomalyCheckRunner(ArgumentParser argumentParser) {
        this.argumentParser = argumentParser;
    }

    public static void main(String... args) throws IOException {
        AnomalyCheckRunner runner = new AnomalyCheckRunner();
        runner.parse(args);
        System.err.println("Reading from stdin... (Ctrl-c to exit)");
        runner.run(new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8)),
                new PrintWriter(System.out, true));
        System.err.println("Done.");
    }

    public void parse(String... arguments) {
        argumentParser.parse(arguments);
    }

    public void run(BufferedReader in, PrintWriter out) throws IOException {
        String line;
        while ((line = in.readLine()) != null) {
            lineNumber++;
            if (lineNumber == 1 && argumentParser.getHeaderRow()) {
                continue;
            }
            if (line.trim().isEmpty()) {
                continue;
            }
            processLine(line.split(argumentParser.getDelimiter()));
        }

        finish(out);
        out.flush();
    }

    protected void processLine(String[] row) {
        if (fields == 0) {
            if (row.length < 1 || row.length > 2) {
                throw new IllegalArgumentException(
                        String.format("Expected a value or a time and a value on line %d but found %d fields.",
                                lineNumber, row.length));
            }
            fields = row.length;
        }
        if (row.length != fields) {
            throw new IllegalArgumentException(String.format(
                    "Wrong number of values on line %d. Expected %d but found %d.", lineNumber, fields, row.length));
        }
        if (fields == 2) {
            time.add(Double.parseDouble(row[0].trim()));
        }
        values.add(Double.parseDouble(row[fields - 1].trim()));
    }

    protected Series toSeries() {
        double[] v = values.stream().mapToDouble(Double::doubleValue).toArray();
        if (fields == 2) {
            return Series.of(time.stream().mapToDouble(Double::doubleValue).toArray(), v);
        }
        return Series.of(v);
    }

    protected void finish(PrintWriter out) {
        AnomalyDetector detector = new AnomalyDetector(argumentParser.toParams());
        FittingResult result = detector.check(toSeries());

        String delimiter = argumentParser.getDelimiter();
        StringJoiner header = new StringJoiner(delimiter);
        header.add("time").add("value").add("residual");
        out.println(header.toString());

        List<AnomalousPoint> anomalies = result.getAnomalies();
        double[] residuals = result.getResiduals();
        for (int i = 0; i < anomalies.size(); i++) {
            StringJoiner joiner = new StringJoiner(delimiter);
            joiner.add(Double.toString(anomalies.get(i).getTime()));
            joiner.add(Double.toString(anomalies.get(i).getValue()));
            joiner.add(Double.toString(residuals[i]));
            out.println(joiner.toString());
        }

        out.println("# model: " + result.getModel().getLabel());
        out.println("# popt: " + Arrays.toString(result.getPopt()));
        out.println("# perr: " + Arrays.toString(result.getPerr()));
        for (Map.Entry<DiagnosticCode, String> entry : result.getDiagnostics().entrySet()) {
            out.println("# " + entry.getKey().getCode() + ": " + entry.getValue());
        }
    }
}
