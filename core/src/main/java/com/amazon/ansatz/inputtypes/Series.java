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

package com.amazon.ansatz.inputtypes;

import static com.amazon.ansatz.CommonUtils.checkValid;
import static com.amazon.ansatz.CommonUtils.denseTimeIndex;

import java.util.Arrays;

import lombok.EqualsAndHashCode;

/**
 * An ordered sequence of (time, value) pairs. When no time array is supplied,
 * time is the dense index 1..N. The arrays are copied on the way in and on the
 * way out, so a series is immutable.
 */
@EqualsAndHashCode
public class Series {

    private final double[] time;

    private final double[] values;

    private final boolean explicitTime;

    protected Series(double[] time, double[] values, boolean explicitTime) {
        this.time = time;
        this.values = values;
        this.explicitTime = explicitTime;
    }

    /**
     * @param values the observations, time defaults to 1..N
     * @return a series
     */
    public static Series of(double[] values) {
        checkValid(values != null, "values cannot be null");
        checkFinite(values);
        return new Series(denseTimeIndex(values.length), Arrays.copyOf(values, values.length), false);
    }

    /**
     * @param time   the time of each observation, must match the values in length
     * @param values the observations
     * @return a series
     */
    public static Series of(double[] time, double[] values) {
        if (time == null) {
            return of(values);
        }
        checkValid(values != null, "values cannot be null");
        checkValid(time.length == values.length,
                String.format("shape %d does not match with shape %d.", time.length, values.length));
        checkFinite(values);
        for (double t : time) {
            checkValid(Double.isFinite(t), "time has to be finite");
        }
        return new Series(Arrays.copyOf(time, time.length), Arrays.copyOf(values, values.length), true);
    }

    private static void checkFinite(double[] values) {
        for (double v : values) {
            checkValid(Double.isFinite(v), "values have to be finite");
        }
    }

    public int size() {
        return values.length;
    }

    public double[] getTime() {
        return Arrays.copyOf(time, time.length);
    }

    public double[] getValues() {
        return Arrays.copyOf(values, values.length);
    }

    public double getTime(int index) {
        return time[index];
    }

    public double getValue(int index) {
        return values[index];
    }

    public boolean hasExplicitTime() {
        return explicitTime;
    }

    /**
     * The abscissa used for fitting: the dense index 1..N under the scaleless
     * policy, the caller's time otherwise. Reported anomalies always carry the
     * caller's time.
     *
     * @param scaleless whether the scaleless policy is in effect
     * @return a fresh copy of the fitting abscissa
     */
    public double[] getFittingTime(boolean scaleless) {
        return scaleless ? denseTimeIndex(values.length) : getTime();
    }
}
