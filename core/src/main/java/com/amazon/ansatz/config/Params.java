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

package com.amazon.ansatz.config;

import static com.amazon.ansatz.CommonUtils.checkValid;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Optional;
import java.util.Set;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * Configuration of a detection run. Instances are immutable and are passed by
 * value into the detector; the engine never mutates them. Every field has a
 * default, so {@code Params.builder().build()} is a complete configuration.
 */
@Getter
@ToString
@EqualsAndHashCode
public class Params {

    public static final boolean DEFAULT_SCALELESS_TIME = true;
    public static final boolean DEFAULT_Z_NORMALIZATION = true;
    public static final InfoCriterion DEFAULT_INFO_CRITERION = InfoCriterion.AIC;
    public static final int DEFAULT_MIN_SAMPLE_SIZE = 10;

    public static final double DEFAULT_P_NORMALITY = 5e-3;
    public static final double DEFAULT_GAUSSIAN_ERR = 75;
    public static final double DEFAULT_GAUSSIAN_STD_ERR = 10;
    public static final double DEFAULT_STD_WIDTH = 1.5;
    public static final double DEFAULT_LINEAR_ERR = 10;
    public static final double DEFAULT_LINEAR_RES = 2;
    public static final double DEFAULT_STEP_ERR = 10;
    public static final double DEFAULT_STEP_RES = 2.5;
    public static final double DEFAULT_EXP_DECAY_ERR = 10;
    public static final double DEFAULT_EXP_DECAY_RES = 2;
    public static final double DEFAULT_SKEWNESS = 20;
    public static final double DEFAULT_MIN_RES = 10;

    public static final double DEFAULT_OSCILLATION_FREQUENCY = 0.3;
    public static final double DEFAULT_DISCONTINUITY_WIDTH = 1;
    public static final int DEFAULT_DISCONTINUITY_LIMIT = 0;

    // heuristic, when the best score is this close to the linear score we prefer
    // the straight line
    public static final double DEFAULT_LINEAR_TIE_ABSOLUTE_TOLERANCE = 10;
    public static final double DEFAULT_LINEAR_TIE_RELATIVE_TOLERANCE = 1e-2;

    public static final int DEFAULT_MAX_EVALUATIONS = 2000;
    public static final double DEFAULT_LOWER_BOUND = 0;
    public static final double DEFAULT_UPPER_BOUND = 1e6;
    public static final boolean DEFAULT_PARALLEL_EXECUTION_ENABLED = false;

    // policies
    private final boolean scalelessTime;
    private final boolean zNormalization;
    private final InfoCriterion infoCriterion;
    private final int minSampleSize;

    // gates and thresholds
    private final double pNormality;
    private final double gaussianErr;
    private final double gaussianStdErr;
    private final double stdWidth;
    private final double linearErr;
    private final double linearRes;
    private final double stepErr;
    private final double stepRes;
    private final double expDecayErr;
    private final double expDecayRes;
    private final double skewness;
    private final double minRes;

    // diagnostics
    private final double oscillationFrequency;
    private final double discontinuityWidth;
    private final int discontinuityLimit;

    // selection and fitting
    private final double linearTieAbsoluteTolerance;
    private final double linearTieRelativeTolerance;
    private final int maxEvaluations;
    private final double lowerBound;
    private final double upperBound;
    private final Set<Ansatz> enabledModels;
    private final boolean parallelExecutionEnabled;
    private final Optional<Integer> threadPoolSize;

    protected Params(Builder builder) {
        scalelessTime = builder.scalelessTime;
        zNormalization = builder.zNormalization;
        infoCriterion = builder.infoCriterion;
        minSampleSize = builder.minSampleSize;
        pNormality = builder.pNormality;
        gaussianErr = builder.gaussianErr;
        gaussianStdErr = builder.gaussianStdErr;
        stdWidth = builder.stdWidth;
        linearErr = builder.linearErr;
        linearRes = builder.linearRes;
        stepErr = builder.stepErr;
        stepRes = builder.stepRes;
        expDecayErr = builder.expDecayErr;
        expDecayRes = builder.expDecayRes;
        skewness = builder.skewness;
        minRes = builder.minRes;
        oscillationFrequency = builder.oscillationFrequency;
        discontinuityWidth = builder.discontinuityWidth;
        discontinuityLimit = builder.discontinuityLimit;
        linearTieAbsoluteTolerance = builder.linearTieAbsoluteTolerance;
        linearTieRelativeTolerance = builder.linearTieRelativeTolerance;
        maxEvaluations = builder.maxEvaluations;
        lowerBound = builder.lowerBound;
        upperBound = builder.upperBound;
        enabledModels = Collections.unmodifiableSet(EnumSet.copyOf(builder.enabledModels));
        parallelExecutionEnabled = builder.parallelExecutionEnabled;
        threadPoolSize = builder.threadPoolSize;
    }

    public boolean isEnabled(Ansatz ansatz) {
        return enabledModels.contains(ansatz);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * @return a builder initialized with the values of this configuration
     */
    public Builder toBuilder() {
        Builder builder = new Builder().scalelessTime(scalelessTime).zNormalization(zNormalization)
                .infoCriterion(infoCriterion).minSampleSize(minSampleSize).pNormality(pNormality)
                .gaussianErr(gaussianErr).gaussianStdErr(gaussianStdErr).stdWidth(stdWidth).linearErr(linearErr)
                .linearRes(linearRes).stepErr(stepErr).stepRes(stepRes).expDecayErr(expDecayErr)
                .expDecayRes(expDecayRes).skewness(skewness).minRes(minRes)
                .oscillationFrequency(oscillationFrequency).discontinuityWidth(discontinuityWidth)
                .discontinuityLimit(discontinuityLimit).linearTieAbsoluteTolerance(linearTieAbsoluteTolerance)
                .linearTieRelativeTolerance(linearTieRelativeTolerance).maxEvaluations(maxEvaluations)
                .bounds(lowerBound, upperBound).enabledModels(enabledModels)
                .parallelExecutionEnabled(parallelExecutionEnabled);
        threadPoolSize.ifPresent(builder::threadPoolSize);
        return builder;
    }

    public static class Builder {

        protected boolean scalelessTime = DEFAULT_SCALELESS_TIME;
        protected boolean zNormalization = DEFAULT_Z_NORMALIZATION;
        protected InfoCriterion infoCriterion = DEFAULT_INFO_CRITERION;
        protected int minSampleSize = DEFAULT_MIN_SAMPLE_SIZE;
        protected double pNormality = DEFAULT_P_NORMALITY;
        protected double gaussianErr = DEFAULT_GAUSSIAN_ERR;
        protected double gaussianStdErr = DEFAULT_GAUSSIAN_STD_ERR;
        protected double stdWidth = DEFAULT_STD_WIDTH;
        protected double linearErr = DEFAULT_LINEAR_ERR;
        protected double linearRes = DEFAULT_LINEAR_RES;
        protected double stepErr = DEFAULT_STEP_ERR;
        protected double stepRes = DEFAULT_STEP_RES;
        protected double expDecayErr = DEFAULT_EXP_DECAY_ERR;
        protected double expDecayRes = DEFAULT_EXP_DECAY_RES;
        protected double skewness = DEFAULT_SKEWNESS;
        protected double minRes = DEFAULT_MIN_RES;
        protected double oscillationFrequency = DEFAULT_OSCILLATION_FREQUENCY;
        protected double discontinuityWidth = DEFAULT_DISCONTINUITY_WIDTH;
        protected int discontinuityLimit = DEFAULT_DISCONTINUITY_LIMIT;
        protected double linearTieAbsoluteTolerance = DEFAULT_LINEAR_TIE_ABSOLUTE_TOLERANCE;
        protected double linearTieRelativeTolerance = DEFAULT_LINEAR_TIE_RELATIVE_TOLERANCE;
        protected int maxEvaluations = DEFAULT_MAX_EVALUATIONS;
        protected double lowerBound = DEFAULT_LOWER_BOUND;
        protected double upperBound = DEFAULT_UPPER_BOUND;
        protected Set<Ansatz> enabledModels = EnumSet.allOf(Ansatz.class);
        protected boolean parallelExecutionEnabled = DEFAULT_PARALLEL_EXECUTION_ENABLED;
        protected Optional<Integer> threadPoolSize = Optional.empty();

        void validate() {
            checkValid(infoCriterion != null, "Information criterion can only be 'AIC' or 'BIC'.");
            checkValid(minSampleSize > 0, "min sample size has to be positive");
            checkValid(pNormality >= 0 && pNormality <= 1, "p normality has to be in [0,1]");
            checkValid(minRes >= 0, "min residual cannot be negative");
            checkValid(maxEvaluations > 0, "max evaluations has to be positive");
            checkValid(lowerBound < upperBound, "lower bound has to be below upper bound");
            checkValid(oscillationFrequency > 0, "oscillation frequency has to be positive");
            checkValid(discontinuityLimit >= 0, "discontinuity limit cannot be negative");
            checkValid(linearTieAbsoluteTolerance >= 0 && linearTieRelativeTolerance >= 0,
                    "tie break tolerances cannot be negative");
            checkValid(enabledModels != null && !enabledModels.isEmpty(), "at least one model has to be enabled");
            if (enabledModels.size() == 1) {
                checkValid(!enabledModels.contains(Ansatz.GAUSSIAN),
                        "the gaussian cannot be the only model, a competing ansatz is needed when it is rejected");
            }
            threadPoolSize.ifPresent(n -> {
                checkValid(n > 0, "thread pool size has to be positive");
                checkValid(parallelExecutionEnabled, "thread pool size requires parallel execution");
            });
        }

        public Params build() {
            validate();
            return new Params(this);
        }

        public Builder scalelessTime(boolean scalelessTime) {
            this.scalelessTime = scalelessTime;
            return this;
        }

        public Builder zNormalization(boolean zNormalization) {
            this.zNormalization = zNormalization;
            return this;
        }

        public Builder infoCriterion(InfoCriterion infoCriterion) {
            this.infoCriterion = infoCriterion;
            return this;
        }

        public Builder minSampleSize(int minSampleSize) {
            this.minSampleSize = minSampleSize;
            return this;
        }

        public Builder pNormality(double pNormality) {
            this.pNormality = pNormality;
            return this;
        }

        public Builder gaussianErr(double gaussianErr) {
            this.gaussianErr = gaussianErr;
            return this;
        }

        public Builder gaussianStdErr(double gaussianStdErr) {
            this.gaussianStdErr = gaussianStdErr;
            return this;
        }

        public Builder stdWidth(double stdWidth) {
            this.stdWidth = stdWidth;
            return this;
        }

        public Builder linearErr(double linearErr) {
            this.linearErr = linearErr;
            return this;
        }

        public Builder linearRes(double linearRes) {
            this.linearRes = linearRes;
            return this;
        }

        public Builder stepErr(double stepErr) {
            this.stepErr = stepErr;
            return this;
        }

        public Builder stepRes(double stepRes) {
            this.stepRes = stepRes;
            return this;
        }

        public Builder expDecayErr(double expDecayErr) {
            this.expDecayErr = expDecayErr;
            return this;
        }

        public Builder expDecayRes(double expDecayRes) {
            this.expDecayRes = expDecayRes;
            return this;
        }

        public Builder skewness(double skewness) {
            this.skewness = skewness;
            return this;
        }

        public Builder minRes(double minRes) {
            this.minRes = minRes;
            return this;
        }

        public Builder oscillationFrequency(double oscillationFrequency) {
            this.oscillationFrequency = oscillationFrequency;
            return this;
        }

        public Builder discontinuityWidth(double discontinuityWidth) {
            this.discontinuityWidth = discontinuityWidth;
            return this;
        }

        public Builder discontinuityLimit(int discontinuityLimit) {
            this.discontinuityLimit = discontinuityLimit;
            return this;
        }

        public Builder linearTieAbsoluteTolerance(double linearTieAbsoluteTolerance) {
            this.linearTieAbsoluteTolerance = linearTieAbsoluteTolerance;
            return this;
        }

        public Builder linearTieRelativeTolerance(double linearTieRelativeTolerance) {
            this.linearTieRelativeTolerance = linearTieRelativeTolerance;
            return this;
        }

        public Builder maxEvaluations(int maxEvaluations) {
            this.maxEvaluations = maxEvaluations;
            return this;
        }

        public Builder bounds(double lowerBound, double upperBound) {
            this.lowerBound = lowerBound;
            this.upperBound = upperBound;
            return this;
        }

        public Builder enabledModels(Set<Ansatz> enabledModels) {
            this.enabledModels = (enabledModels == null || enabledModels.isEmpty()) ? EnumSet.noneOf(Ansatz.class)
                    : EnumSet.copyOf(enabledModels);
            return this;
        }

        public Builder disable(Ansatz ansatz) {
            this.enabledModels.remove(ansatz);
            return this;
        }

        public Builder parallelExecutionEnabled(boolean parallelExecutionEnabled) {
            this.parallelExecutionEnabled = parallelExecutionEnabled;
            return this;
        }

        public Builder threadPoolSize(int threadPoolSize) {
            this.threadPoolSize = Optional.of(threadPoolSize);
            return this;
        }
    }
}
