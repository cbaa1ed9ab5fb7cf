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

package com.xilinx.rapidscoap.applications;

import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.nio.file.Paths;

import com.xilinx.rapidscoap.io.BenchNetlistReader;
import com.xilinx.rapidscoap.io.NetlistJsonReader;
import com.xilinx.rapidscoap.io.SCOAPReportWriter;
import com.xilinx.rapidscoap.netlist.MalformedNetlistException;
import com.xilinx.rapidscoap.netlist.NetlistDescription;
import com.xilinx.rapidscoap.scoap.CombinationalLoopException;
import com.xilinx.rapidscoap.scoap.SCOAPAnalyzer;
import com.xilinx.rapidscoap.scoap.SCOAPConfig;
import com.xilinx.rapidscoap.scoap.SCOAPResult;
import com.xilinx.rapidscoap.util.CodePerfTracker;
import com.xilinx.rapidscoap.util.MessageGenerator;

import joptsimple.OptionException;

/**
 * Command-line front end: reads a netlist (*.json or *.bench), computes its SCOAP metrics and
 * prints the table (or writes it to a file).
 */
public class SCOAPAnalysis {

    /**
     * Loads a netlist, choosing the reader from the file extension.
     * @param fileName Path to a *.json or *.bench file.
     * @return The normalized instance list.
     */
    public static NetlistDescription readNetlist(String fileName) {
        Path path = Paths.get(fileName);
        String lower = fileName.toLowerCase();
        if (lower.endsWith(".json")) {
            return NetlistJsonReader.read(path);
        } else if (lower.endsWith(".bench")) {
            return BenchNetlistReader.read(path);
        }
        throw new IllegalArgumentException("ERROR: Unrecognized netlist file extension: " + fileName
                + " (expected .json or .bench)");
    }

    /**
     * Creates the stage timer for a run. Verbose runs report timing on standard error, since the
     * table may go to standard out.
     * @param config Parsed options.
     * @return A printing tracker when verbose, otherwise {@link CodePerfTracker#SILENT}.
     */
    public static CodePerfTracker createTracker(SCOAPConfig config) {
        return config.isVerbose() ? new CodePerfTracker(SCOAPAnalysis.class.getSimpleName(), true, System.err)
                : CodePerfTracker.SILENT;
    }

    /**
     * Runs an analysis as configured and writes the requested reports.
     * @param config Parsed options; the input file name must be set.
     * @param t Timer for the stages.
     * @return The result of the analysis.
     */
    public static SCOAPResult run(SCOAPConfig config, CodePerfTracker t) {
        if (config.getInputFileName() == null) {
            throw new IllegalArgumentException("ERROR: No input netlist given (use -i <file>)");
        }
        t.start("Read netlist");
        NetlistDescription desc = readNetlist(config.getInputFileName());
        t.stop();

        SCOAPResult result = new SCOAPAnalyzer(config, t).analyze(desc);

        t.start("Write report");
        String text = SCOAPReportWriter.toText(result);
        if (config.getOutputFileName() != null) {
            SCOAPReportWriter.writeText(result, Paths.get(config.getOutputFileName()));
        }
        if (config.getJsonFileName() != null) {
            SCOAPReportWriter.writeJSON(result, Paths.get(config.getJsonFileName()));
        }
        t.stop();
        if (config.getOutputFileName() == null) {
            System.out.print(text);
            System.out.flush();
        }
        return result;
    }

    public static void main(String[] args) {
        SCOAPConfig config;
        try {
            if (args.length == 0 || SCOAPConfig.hasHelpArg(args)) {
                SCOAPConfig.printHelp();
                return;
            }
            config = new SCOAPConfig(args);
        } catch (OptionException | IllegalArgumentException e) {
            MessageGenerator.briefErrorAndExit(e.getMessage());
            return;
        }

        CodePerfTracker t = createTracker(config);
        try {
            run(config, t);
        } catch (MalformedNetlistException | CombinationalLoopException | UncheckedIOException
                | IllegalArgumentException e) {
            MessageGenerator.briefErrorAndExit(e.getMessage());
            return;
        }
        if (config.isVerbose()) {
            t.printSummary();
        }
    }
}
