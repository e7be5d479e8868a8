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

package com.amazon.latencysentinel.runner;

import static com.amazon.latencysentinel.CommonUtils.checkArgument;
import static com.amazon.latencysentinel.CommonUtils.checkNotNull;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.function.Consumer;
import java.util.function.Function;

import com.amazon.latencysentinel.config.DetectorConfig;
import com.amazon.latencysentinel.config.InvalidConfigurationException;
import com.amazon.latencysentinel.config.ThresholdMode;

/**
 * A utility class for parsing command-line arguments.
 */
public class ArgumentParser {

    public static final String ARCHIVE_NAME = "target/latency-sentinel-core-1.0.0.jar";
    private final String runnerClass;
    private final String runnerDescription;
    private final Map<String, Argument<?>> shortFlags;
    private final Map<String, Argument<?>> longFlags;
    private final IntegerArgument windowCapacity;
    private final IntegerArgument minPoints;
    private final IntegerArgument numberOfTrees;
    private final IntegerArgument sampleSize;
    private final DoubleArgument contamination;
    private final LongArgument randomSeed;
    private final Argument<ThresholdMode> thresholdMode;
    private final StringArgument delimiter;
    private final BooleanArgument headerRow;
    private final IntegerArgument valueColumn;

    /**
     * Create a new ArgumentParser.The runner class and runner description will be
     * used in help text.
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

        windowCapacity = new IntegerArgument("-w", "--window-capacity",
                "Number of most recent samples kept as the reference history.",
                DetectorConfig.DEFAULT_WINDOW_CAPACITY,
                n -> checkArgument(n > 0, "window capacity should be greater than 0"));

        addArgument(windowCapacity);

        minPoints = new IntegerArgument("-m", "--min-points",
                "Number of samples required before samples are classified.", DetectorConfig.DEFAULT_MIN_POINTS,
                n -> checkArgument(n >= 2, "min points should be at least 2"));

        addArgument(minPoints);

        numberOfTrees = new IntegerArgument("-n", "--number-of-trees", "Number of trees to use in the forest.",
                DetectorConfig.DEFAULT_NUMBER_OF_TREES,
                n -> checkArgument(n > 0, "number of trees should be greater than 0"));

        addArgument(numberOfTrees);

        sampleSize = new IntegerArgument("-s", "--sample-size",
                "Maximum number of history points each tree is grown on.", DetectorConfig.DEFAULT_SAMPLE_SIZE,
                n -> checkArgument(n > 0, "sample size should be greater than 0"));

        addArgument(sampleSize);

        contamination = new DoubleArgument("-c", "--contamination", "Expected fraction of anomalies in the history.",
                DetectorConfig.DEFAULT_CONTAMINATION,
                x -> checkArgument(x > 0.0 && x < 1.0, "contamination should be between 0 and 1"));

        addArgument(contamination);

        randomSeed = new LongArgument(null, "--random-seed", "Random seed used to grow the forest on every sample",
                DetectorConfig.DEFAULT_RANDOM_SEED);

        addArgument(randomSeed);

        thresholdMode = new Argument<>(null, "--threshold-mode",
                "How the cutoff is derived from the contamination: TOP_FRACTION or TRAINING_PERCENTILE.",
                DetectorConfig.DEFAULT_THRESHOLD_MODE, s -> ThresholdMode.valueOf(s.toUpperCase(Locale.ROOT)));

        addArgument(thresholdMode);

        delimiter = new StringArgument("-d", "--delimiter", "The character or string used as a field delimiter.",
                ",");

        addArgument(delimiter);

        headerRow = new BooleanArgument(null, "--header-row", "Set to 'true' if the data contains a header row.",
                false);

        addArgument(headerRow);

        valueColumn = new IntegerArgument(null, "--value-column", "0-based index of the column holding the latency.",
                0, n -> checkArgument(n >= 0, "value column should be non-negative"));

        addArgument(valueColumn);
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
     * Remove the argument with the given long flag from help messages. This allows
     * subclasses to suppress arguments as needed. The argument will still exist in
     * this object with its default value.
     *
     * @param longFlag The long flag corresponding to the argument being removed
     */
    protected void removeArgument(String longFlag) {
        Argument<?> argument = longFlags.get(longFlag);
        if (argument != null) {
            longFlags.remove(longFlag);
            shortFlags.remove(argument.getShortFlag());
        }
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
        System.out.println("Usage: " + getUsage());
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

    /**
     * @return the command line shown in the usage message.
     */
    protected String getUsage() {
        return String.format("java -cp %s %s [options] < input_file > output_file", ARCHIVE_NAME, runnerClass);
    }

    /**
     * Combine the detector options into a validated configuration.
     *
     * @return a DetectorConfig holding the user-specified detector options.
     * @throws InvalidConfigurationException if the options are inconsistent
     */
    public DetectorConfig getDetectorConfig() {
        return DetectorConfig.builder().windowCapacity(getWindowCapacity()).minPoints(getMinPoints())
                .numberOfTrees(getNumberOfTrees()).sampleSize(getSampleSize()).contamination(getContamination())
                .randomSeed(getRandomSeed()).thresholdMode(getThresholdMode()).build();
    }

    /**
     * @return the user-specified value of the window-capacity parameter.
     */
    public int getWindowCapacity() {
        return windowCapacity.getValue();
    }

    /**
     * @return the user-specified value of the min-points parameter.
     */
    public int getMinPoints() {
        return minPoints.getValue();
    }

    /**
     * @return the user-specified value of the number-of-trees parameter.
     */
    public int getNumberOfTrees() {
        return numberOfTrees.getValue();
    }

    /**
     * @return the user-specified value of the sample-size parameter.
     */
    public int getSampleSize() {
        return sampleSize.getValue();
    }

    /**
     * @return the user-specified value of the contamination parameter.
     */
    public double getContamination() {
        return contamination.getValue();
    }

    /**
     * @return the user-specified value of the random-seed parameter
     */
    public long getRandomSeed() {
        return randomSeed.getValue();
    }

    /**
     * @return the user-specified value of the threshold-mode parameter
     */
    public ThresholdMode getThresholdMode() {
        return thresholdMode.getValue();
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

    /**
     * @return the user-specified value of the value-column parameter
     */
    public int getValueColumn() {
        return valueColumn.getValue();
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

    public static class LongArgument extends Argument<Long> {
        public LongArgument(String shortFlag, String longFlag, String description, long defaultValue,
                Consumer<Long> validateFunction) {
            super(shortFlag, longFlag, description, defaultValue, Long::parseLong, validateFunction);
        }

        public LongArgument(String shortFlag, String longFlag, String description, long defaultValue) {
            super(shortFlag, longFlag, description, defaultValue, Long::parseLong);
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
