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

import java.io.BufferedReader;
import java.io.IOException;
import java.io.PrintWriter;
import java.util.Arrays;
import java.util.List;
import java.util.StringJoiner;
import java.util.function.Function;

import com.amazon.latencysentinel.config.DetectorConfig;
import com.amazon.latencysentinel.config.InvalidConfigurationException;

/**
 * Reads delimited lines, parses one sample per line from the configured value
 * column, and writes each input line followed by the result columns of a
 * {@link LineTransformer}.
 */
public class SimpleRunner {

    protected final ArgumentParser argumentParser;
    protected final Function<DetectorConfig, LineTransformer> algorithmInitializer;
    protected LineTransformer algorithm;
    protected int lineNumber;

    public SimpleRunner(String runnerClass, String runnerDescription,
            Function<DetectorConfig, LineTransformer> algorithmInitializer) {
        this(new ArgumentParser(runnerClass, runnerDescription), algorithmInitializer);
    }

    public SimpleRunner(ArgumentParser argumentParser,
            Function<DetectorConfig, LineTransformer> algorithmInitializer) {
        this.argumentParser = argumentParser;
        this.algorithmInitializer = algorithmInitializer;
    }

    public void parse(String... arguments) {
        argumentParser.parse(arguments);
    }

    /**
     * Parse the arguments and build the line transformer right away, so that an
     * inconsistent combination of options is reported before any input is read.
     *
     * @param arguments the command line arguments
     * @throws InvalidConfigurationException if the parsed options do not form a
     *                                       valid detector configuration
     */
    public void configure(String... arguments) {
        parse(arguments);
        prepareAlgorithm();
    }

    public void run(BufferedReader in, PrintWriter out) throws IOException {
        String line;
        while ((line = in.readLine()) != null) {
            lineNumber++;
            String[] values = line.split(argumentParser.getDelimiter());

            if (algorithm == null) {
                prepareAlgorithm();
            }

            if (lineNumber == 1 && argumentParser.getHeaderRow()) {
                writeHeader(values, out);
                continue;
            }

            processLine(values, out);
        }

        out.flush();
    }

    protected void prepareAlgorithm() {
        algorithm = algorithmInitializer.apply(argumentParser.getDetectorConfig());
    }

    protected void writeHeader(String[] values, PrintWriter out) {
        StringJoiner joiner = new StringJoiner(argumentParser.getDelimiter());
        Arrays.stream(values).forEach(joiner::add);
        algorithm.getResultColumnNames().forEach(joiner::add);
        out.println(joiner.toString());
    }

    protected void processLine(String[] values, PrintWriter out) {
        List<String> result = algorithm.getResultValues(parseValue(values));

        StringJoiner joiner = new StringJoiner(argumentParser.getDelimiter());
        Arrays.stream(values).forEach(joiner::add);
        result.forEach(joiner::add);

        out.println(joiner.toString());
    }

    protected double parseValue(String... stringValues) {
        int column = argumentParser.getValueColumn();
        if (column >= stringValues.length) {
            throw new IllegalArgumentException(
                    String.format("Wrong number of values on line %d. Expected at least %d but found %d.", lineNumber,
                            column + 1, stringValues.length));
        }
        try {
            return Double.parseDouble(stringValues[column].trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(
                    String.format("Invalid value '%s' on line %d.", stringValues[column], lineNumber), e);
        }
    }
}
