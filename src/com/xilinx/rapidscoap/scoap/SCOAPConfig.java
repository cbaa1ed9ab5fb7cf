/*
 * Copyright (c) 2025, Advanced Micro Devices, Inc.
 * All rights reserved.
 *
 * This file is part of RapidSCOAP.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 */

package com.xilinx.rapidscoap.scoap;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import com.xilinx.rapidscoap.netlist.Net;
import com.xilinx.rapidscoap.util.MessageGenerator;
import com.xilinx.rapidscoap.util.Params;

import joptsimple.OptionParser;
import joptsimple.OptionSet;

/**
 * A collection of customizable parameters for a SCOAP analysis run. Defaults come from
 * {@link Params} (environment variables or JVM properties) and can be overridden by
 * command-line options or by calling the applicable setter method.
 */
public class SCOAPConfig {

    public static final int DEFAULT_MAX_ITERATIONS = 100;

    public static final int DEFAULT_MAX_VALUE = 1000000;

    /** Allowed max number of forward/backward sweeps for sequential circuits */
    private int maxIterations;
    /** Saturation limit for every finite cost */
    private int maxValue;
    /** true to print the progress of the convergence loop */
    private boolean verbose;
    /** Netlist to analyze (*.json or *.bench) */
    private String inputFileName;
    /** Where to write the text report, null for standard out */
    private String outputFileName;
    /** Where to write the JSON report, null for none */
    private String jsonFileName;

    private static final List<String> INPUT_OPTS = Arrays.asList("i", "input");
    private static final List<String> OUTPUT_OPTS = Arrays.asList("o", "output");
    private static final List<String> JSON_OPTS = Arrays.asList("j", "json");
    private static final List<String> MAX_ITERATIONS_OPTS = Collections.singletonList("max-iterations");
    private static final List<String> MAX_VALUE_OPTS = Collections.singletonList("max-value");
    private static final List<String> VERBOSE_OPTS = Arrays.asList("v", "verbose");
    private static final List<String> HELP_OPTS = Arrays.asList("?", "h", "help");

    /** Constructs a configuration with default values */
    public SCOAPConfig() {
        setMaxIterations(Params.getParamOrDefaultIntSetting(Params.SCOAP_MAX_ITERATIONS_NAME,
                DEFAULT_MAX_ITERATIONS));
        setMaxValue(Params.getParamOrDefaultIntSetting(Params.SCOAP_MAX_VALUE_NAME, DEFAULT_MAX_VALUE));
        verbose = Params.isParamSet(Params.SCOAP_VERBOSE_NAME);
    }

    /**
     * Constructs a configuration from command-line arguments.
     * @param arguments Options as described by {@link #printHelp()}.
     */
    public SCOAPConfig(String[] arguments) {
        this();
        if (arguments != null) {
            parseArguments(arguments);
        }
    }

    public static OptionParser createOptionParser() {
        return new OptionParser() {
            {
                acceptsAll(INPUT_OPTS, "Input netlist (*.json or *.bench)").withRequiredArg();
                acceptsAll(OUTPUT_OPTS, "Write the text report to this file instead of standard out").withRequiredArg();
                acceptsAll(JSON_OPTS, "Also write the report as JSON to this file").withRequiredArg();
                acceptsAll(MAX_ITERATIONS_OPTS, "Max sequential convergence iterations (default "
                        + DEFAULT_MAX_ITERATIONS + ")").withRequiredArg();
                acceptsAll(MAX_VALUE_OPTS, "Saturation limit for SCOAP costs (default "
                        + DEFAULT_MAX_VALUE + ")").withRequiredArg();
                acceptsAll(VERBOSE_OPTS, "Print progress of the convergence iterations");
                acceptsAll(HELP_OPTS, "Print this help message").forHelp();
            }
        };
    }

    public static boolean hasHelpArg(String[] args) {
        OptionSet options = createOptionParser().parse(args);
        return options.has(HELP_OPTS.get(0));
    }

    public static void printHelp() {
        OptionParser p = createOptionParser();
        MessageGenerator.printHeader("SCOAPAnalysis");
        System.out.println("Computes SCOAP controllability/observability metrics of a gate-level netlist.");
        try {
            p.printHelpOn(System.out);
        } catch (IOException e) {
            throw new UncheckedIOException("ERROR: Could not print help message", e);
        }
    }

    private void parseArguments(String[] arguments) {
        OptionParser p = createOptionParser();
        OptionSet options = p.parse(arguments);

        if (options.has(INPUT_OPTS.get(0))) {
            setInputFileName((String) options.valueOf(INPUT_OPTS.get(0)));
        } else if (!options.nonOptionArguments().isEmpty()) {
            setInputFileName(options.nonOptionArguments().get(0).toString());
        }
        if (options.has(OUTPUT_OPTS.get(0))) {
            setOutputFileName((String) options.valueOf(OUTPUT_OPTS.get(0)));
        }
        if (options.has(JSON_OPTS.get(0))) {
            setJsonFileName((String) options.valueOf(JSON_OPTS.get(0)));
        }
        if (options.has(MAX_ITERATIONS_OPTS.get(0))) {
            setMaxIterations(parseInt(options, MAX_ITERATIONS_OPTS));
        }
        if (options.has(MAX_VALUE_OPTS.get(0))) {
            setMaxValue(parseInt(options, MAX_VALUE_OPTS));
        }
        if (options.has(VERBOSE_OPTS.get(0))) {
            setVerbose(true);
        }
    }

    private static int parseInt(OptionSet options, List<String> opts) {
        String value = (String) options.valueOf(opts.get(0));
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("ERROR: Option --" + opts.get(opts.size() - 1)
                    + " expects an integer, got '" + value + "'", e);
        }
    }

    public int getMaxIterations() {
        return maxIterations;
    }

    /**
     * @param maxIterations Max number of forward/backward sweeps, at least 1.
     */
    public void setMaxIterations(int maxIterations) {
        if (maxIterations < 1) {
            throw new IllegalArgumentException("ERROR: Max iterations must be at least 1, got " + maxIterations);
        }
        this.maxIterations = maxIterations;
    }

    public int getMaxValue() {
        return maxValue;
    }

    /**
     * @param maxValue Saturation limit, between 1 and {@link Net#UNDEFINED} - 1.
     */
    public void setMaxValue(int maxValue) {
        if (maxValue < 1 || maxValue >= Net.UNDEFINED) {
            throw new IllegalArgumentException("ERROR: Max value must be in [1, " + (Net.UNDEFINED - 1)
                    + "], got " + maxValue);
        }
        this.maxValue = maxValue;
    }

    public boolean isVerbose() {
        return verbose;
    }

    public void setVerbose(boolean verbose) {
        this.verbose = verbose;
    }

    public String getInputFileName() {
        return inputFileName;
    }

    public void setInputFileName(String inputFileName) {
        this.inputFileName = inputFileName;
    }

    public String getOutputFileName() {
        return outputFileName;
    }

    public void setOutputFileName(String outputFileName) {
        this.outputFileName = outputFileName;
    }

    public String getJsonFileName() {
        return jsonFileName;
    }

    public void setJsonFileName(String jsonFileName) {
        this.jsonFileName = jsonFileName;
    }

    @Override
    public String toString() {
        return "SCOAP Configuration:\n"
                + String.format("%-22s %10d\n", "Max iterations:", maxIterations)
                + String.format("%-22s %10d\n", "Max value:", maxValue)
                + String.format("%-22s %10b\n", "Verbose:", verbose);
    }
}
