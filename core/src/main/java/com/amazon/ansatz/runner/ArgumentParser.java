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

import static com.amazon.ansatz.CommonUtils.checkArgument;
import static com.amazon.ansatz.CommonUtils.checkNotNull;

import java.util.Arrays;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.Map;
import java.util.Set;
import java.util.function.Consumer;
import java.util.function.Function;

import com.amazon.ansatz.config.Ansatz;
import com.amazon.ansatz.config.InfoCriterion;
import com.amazon.ansatz.config.Params;

/**
 * A utility class for parsing command-line arguments.
 */
public class ArgumentParser {

    public static final String ARCHIVE_NAME = "target/ansatz-core-1.0.0.jar";
    private final String runnerClass;
    private final String runnerDescription;
    private final Map<String, Argument<?>> shortFlags;
    private final Map<String, Argument<?>> longFlags;
    private final StringArgument infoCriterion;
    private final IntegerArgument minSampleSize;
    private final BooleanArgument scalelessTime;
    private final BooleanArgument zNormalization;
    private final DoubleArgument pNormality;
    private final DoubleArgument minRes;
    private final StringArgument disabledModels;
    private final BooleanArgument parallel;
    private final StringArgument delimiter;
    private final BooleanArgument headerRow;

    /**
     * Create a new ArgumentParser. The runner class and runner description will
     * be used in help text.
     *
     * @param runnerClass       The name of the runner class where this argument
     *                          parser is being invoked.
     * @param runnerDescription A description of the runner class where this
     *                          argument parser is being invoked.
     */
    public ArgumentParser(String runnerClass, String runnerDescription) {
        this.runnerClass = runnerClass;
        this.runnerDescription = runnerDescription;
        shortFlags = new HashMap<>();
        longFlags = new HashMap<>();

        infoCriterion = new StringArgument("-c", "--info-criterion",
                "Information criterion used to compare models, AIC or BIC.", Params.DEFAULT_INFO_CRITERION.name(),
                InfoCriterion::parse);

        addArgument(infoCriterion);

        minSampleSize = new IntegerArgument("-m", "--min-sample-size", "Minimum number of samples in the series.",
                Params.DEFAULT_MIN_SAMPLE_SIZE, n -> checkArgument(n > 0, "min sample size should be greater than 0"));

        addArgument(minSampleSize);

        scalelessTime = new BooleanArgument(null, "--scaleless-time",
                "Set to 'false' to fit against the time column instead of the index 1..N.",
                Params.DEFAULT_SCALELESS_TIME);

        addArgument(scalelessTime);

        zNormalization = new BooleanArgument("-z", "--z-normalization",
                "Set to 'false' to threshold raw residuals instead of standardized ones.",
                Params.DEFAULT_Z_NORMALIZATION);

        addArgument(zNormalization);

        pNormality = new DoubleArgument("-p", "--p-normality",
                "Minimum normality test p-value for the series to be treated as Gaussian noise.",
                Params.DEFAULT_P_NORMALITY,
                p -> checkArgument(p >= 0 && p <= 1, "p-normality should be between 0 and 1"));

        addArgument(pNormality);

        minRes = new DoubleArgument("-r", "--min-res", "Residuals below this magnitude are treated as zero.",
                Params.DEFAULT_MIN_RES, r -> checkArgument(r >= 0, "min-res should be non-negative"));

        addArgument(minRes);

        disabledModels = new StringArgument(null, "--disable",
                "Comma separated models to leave out: gaussian, linear_regression, step_func, exp_decay.", "",
                s -> parseModels(s));

        addArgument(disabledModels);

        parallel = new BooleanArgument(null, "--parallel", "Set to 'true' to fit the competing models in parallel.",
                Params.DEFAULT_PARALLEL_EXECUTION_ENABLED);

        addArgument(parallel);

        delimiter = new StringArgument("-d", "--delimiter", "The character or string used as a field delimiter.",
                ",");

        addArgument(delimiter);

        headerRow = new BooleanArgument(null, "--header-row", "Set to 'true' if the data contains a header row.",
                false);

        addArgument(headerRow);
    }

    /**
     * Add a new argument to this argument parser.
     *
     * @param argument An Argument instance for a command-line argument that should
     *                 be parsed.
     */
    protected void addArgument(Argument<?> argument) {
        checkNotNull(argument, "argument should not be null");

        checkArgument(argument.getShortFlag() == null || !shortFlags.containsKey(argument.getShortFlag()),
                String.format("An argument mapping already exists for %s", argument.getShortFlag()));

        checkArgument(!longFlags.containsKey(argument.getLongFlag()),
                String.format("An argument mapping already exists for %s", argument.getLongFlag()));

        if (argument.getShortFlag() != null) {
            shortFlags.put(argument.getShortFlag(), argument);
        }

        longFlags.put(argument.getLongFlag(), argument);
    }

    /**
     * Parse the given array of command-line arguments.
     *
     * @param arguments An array of command-line arguments.
     */
    public void parse(String... arguments) {
        int i = 0;
        while (i < arguments.length) {
            String flag = arguments[i];

            try {
                if (shortFlags.containsKey(flag)) {
                    shortFlags.get(flag).parse(arguments[++i]);
                } else if (longFlags.containsKey(flag)) {
                    longFlags.get(flag).parse(arguments[++i]);
                } else if ("-h".equals(flag) || "--help".equals(flag)) {
                    printUsage();
                    Runtime.getRuntime().exit(0);
                } else {
                    throw new IllegalArgumentException("Unknown argument: " + flag);
                }
            } catch (Exception e) {
                printUsageAndExit("%s: %s", e.getClass().getName(), e.getMessage());
            }

            i++;
        }
    }

    /**
     * Print a usage message to STDOUT.
     */
    public void printUsage() {
        System.out.println(String.format("Usage: java -cp %s %s [options] < input_file > output_file", ARCHIVE_NAME,
                runnerClass));
        System.out.println();
        System.out.println(runnerDescription);
        System.out.println();
        System.out.println("Options:");

        longFlags.values().stream().map(Argument::getHelpMessage).sorted()
                .forEach(msg -> System.out.println("\t" + msg));

        System.out.println();
        System.out.println("\t--help, -h: Print this help message and exit.");
    }

    /**
     * Print an error message, the usage message, and exit the application.
     *
     * @param errorMessage  An error message to show the user.
     * @param formatObjects An array of format objects that will be interpolated
     *                      into the error message using {@link String#format}.
     */
    public void printUsageAndExit(String errorMessage, Object... formatObjects) {
        System.err.println("Error: " + String.format(errorMessage, formatObjects));
        printUsage();
        System.exit(1);
    }

    static Set<Ansatz> parseModels(String labels) {
        Set<Ansatz> models = EnumSet.noneOf(Ansatz.class);
        Arrays.stream(labels.split(",")).map(String::trim).filter(s -> !s.isEmpty())
                .forEach(s -> models.add(Ansatz.fromLabel(s)));
        return models;
    }

    /**
     * @return the configuration described by the parsed arguments
     */
    public Params toParams() {
        Params.Builder builder = Params.builder().infoCriterion(getInfoCriterion())
                .minSampleSize(getMinSampleSize()).scalelessTime(getScalelessTime())
                .zNormalization(getZNormalization()).pNormality(getPNormality()).minRes(getMinRes())
                .parallelExecutionEnabled(getParallel());
        getDisabledModels().forEach(builder::disable);
        return builder.build();
    }

    /**
     * @return the user-specified value of the info-criterion parameter
     */
    public InfoCriterion getInfoCriterion() {
        return InfoCriterion.parse(infoCriterion.getValue());
    }

    /**
     * @return the user-specified value of the min-sample-size parameter
     */
    public int getMinSampleSize() {
        return minSampleSize.getValue();
    }

    public boolean getScalelessTime() {
        return scalelessTime.getValue();
    }

    public boolean getZNormalization() {
        return zNormalization.getValue();
    }

    public double getPNormality() {
        return pNormality.getValue();
    }

    public double getMinRes() {
        return minRes.getValue();
    }

    /**
     * @return the models named by the disable parameter
     */
    public Set<Ansatz> getDisabledModels() {
        return parseModels(disabledModels.getValue());
    }

    public boolean getParallel() {
        return parallel.getValue();
    }

    /**
     * @return the user-specified value of the delimiter parameter
     */
    public String getDelimiter() {
        return delimiter.getValue();
    }

    /**
     * @return the user-specified value of the header-row parameter
     */
    public boolean getHeaderRow() {
        return headerRow.getValue();
    }

    public static class Argument<T> {

        private final String shortFlag;
        private final String longFlag;
        private final String description;
        private final T defaultValue;
        private final Function<String, T> parseFunction;
        private final Consumer<T> validateFunction;
        private T value;

        public Argument(String shortFlag, String longFlag, String description, T defaultValue,
                Function<String, T> parseFunction, Consumer<T> validateFunction) {
            this.shortFlag = shortFlag;
            this.longFlag = longFlag;
            this.description = description;
            this.defaultValue = defaultValue;
            this.parseFunction = parseFunction;
            this.validateFunction = validateFunction;
            value = defaultValue;
        }

        public Argument(String shortFlag, String longFlag, String description, T defaultValue,
                Function<String, T> parseFunction) {
            this(shortFlag, longFlag, description, defaultValue, parseFunction, t -> {
            });
        }

        public String getShortFlag() {
            return shortFlag;
        }

        public String getLongFlag() {
            return longFlag;
        }

        public String getDescription() {
            return description;
        }

        public T getDefaultValue() {
            return defaultValue;
        }

        public String getHelpMessage() {
            if (shortFlag != null) {
                return String.format("%s, %s: %s (default: %s)", longFlag, shortFlag, description, defaultValue);
            } else {
                return String.format("%s: %s (default: %s)", longFlag, description, defaultValue);
            }
        }

        public void parse(String string) {
            value = parseFunction.apply(string);
            validateFunction.accept(value);
        }

        public T getValue() {
            return value;
        }
    }

    public static class StringArgument extends Argument<String> {
        public StringArgument(String shortFlag, String longFlag, String description, String defaultValue,
                Consumer<String> validateFunction) {
            super(shortFlag, longFlag, description, defaultValue, x -> x, validateFunction);
        }

        public StringArgument(String shortFlag, String longFlag, String description, String defaultValue) {
            super(shortFlag, longFlag, description, defaultValue, x -> x);
        }
    }

    public static class BooleanArgument extends Argument<Boolean> {
        public BooleanArgument(String shortFlag, String longFlag, String description, boolean defaultValue) {
            super(shortFlag, longFlag, description, defaultValue, Boolean::parseBoolean);
        }
    }

    public static class IntegerArgument extends Argument<Integer> {
        public IntegerArgument(String shortFlag, String longFlag, String description, int defaultValue,
                Consumer<Integer> validateFunction) {
            super(shortFlag, longFlag, description, defaultValue, Integer::parseInt, validateFunction);
        }

        public IntegerArgument(String shortFlag, String longFlag, String description, int defaultValue) {
            super(shortFlag, longFlag, description, defaultValue, Integer::parseInt);
        }
    }

    public static class DoubleArgument extends Argument<Double> {
        public DoubleArgument(String shortFlag, String longFlag, String description, double defaultValue,
                Consumer<Double> validateFunction) {
            super(shortFlag, longFlag, description, defaultValue, Double::parseDouble, validateFunction);
        }

        public DoubleArgument(String shortFlag, String longFlag, String description, double defaultValue) {
            super(shortFlag, longFlag, description, defaultValue, Double::parseDouble);
        }
    }
}
