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

package com.amazon.ansatz;

import org.openjdk.jmh.annotations.Benchmark;
import org.openjdk.jmh.annotations.Fork;
import org.openjdk.jmh.annotations.Level;
import org.openjdk.jmh.annotations.Measurement;
import org.openjdk.jmh.annotations.Param;
import org.openjdk.jmh.annotations.Scope;
import org.openjdk.jmh.annotations.Setup;
import org.openjdk.jmh.annotations.State;
import org.openjdk.jmh.annotations.Warmup;
import org.openjdk.jmh.infra.Blackhole;

import com.amazon.ansatz.config.Params;
import com.amazon.ansatz.returntypes.FittingResult;
import com.amazon.ansatz.serialize.FittingResultSerDe;
import com.amazon.ansatz.testutils.SeriesTestData;

@Warmup(iterations = 5)
@Measurement(iterations = 10)
@Fork(value = 1)
@State(Scope.Benchmark)
public class DetectorBenchmark {

    @State(Scope.Thread)
    public static class BenchmarkState {
        @Param({ "100", "10000" })
        int length;

        @Param({ "linear", "step", "exp_decay", "gaussian" })
        String shape;

        @Param({ "false", "true" })
        boolean parallel;

        double[] values;
        AnomalyDetector detector;

        @Setup(Level.Trial)
        public void setUpData() {
            switch (shape) {
            case "linear":
                values = SeriesTestData.noisyLinear(length, 10, 6, 1, 0);
                break;
            case "step":
                values = SeriesTestData.step(length, 20, 60, length / 5.0);
                break;
            case "exp_decay":
                values = SeriesTestData.expDecay(length, 10, 3.0 / length);
                break;
            default:
                values = SeriesTestData.normalQuantiles(length, 100, 10, 0);
            }
            detector = new AnomalyDetector(Params.builder().parallelExecutionEnabled(parallel).build());
        }
    }

    @Benchmark
    public FittingResult check(BenchmarkState state) {
        return state.detector.check(state.values);
    }

    @Benchmark
    public String checkAndSerialize(BenchmarkState state, Blackhole blackhole) {
        FittingResult result = state.detector.check(state.values);
        blackhole.consume(result);
        return new FittingResultSerDe().toJson(result);
    }
}
