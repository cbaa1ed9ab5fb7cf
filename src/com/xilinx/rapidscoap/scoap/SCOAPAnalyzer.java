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

import java.util.ArrayList;
import java.util.List;

import com.xilinx.rapidscoap.netlist.CircuitGraph;
import com.xilinx.rapidscoap.netlist.Net;
import com.xilinx.rapidscoap.netlist.NetlistDescription;
import com.xilinx.rapidscoap.util.CodePerfTracker;
import com.xilinx.rapidscoap.util.MessageGenerator;

/**
 * Entry point of the SCOAP engine: builds the {@link CircuitGraph}, levelizes it and drives the
 * propagation passes to convergence. All fatal errors are raised before any metric is returned.
 */
public class SCOAPAnalyzer {

    private final SCOAPConfig config;

    private final CodePerfTracker t;

    public SCOAPAnalyzer() {
        this(new SCOAPConfig());
    }

    public SCOAPAnalyzer(SCOAPConfig config) {
        this(config, CodePerfTracker.SILENT);
    }

    public SCOAPAnalyzer(SCOAPConfig config, CodePerfTracker t) {
        this.config = config;
        this.t = t == null ? CodePerfTracker.SILENT : t;
    }

    public SCOAPConfig getConfig() {
        return config;
    }

    /**
     * Builds the circuit graph of a netlist description and analyzes it.
     * @param desc The normalized instance list.
     * @return The metrics of every net.
     * @throws com.xilinx.rapidscoap.netlist.MalformedNetlistException If the description is invalid.
     * @throws CombinationalLoopException If the circuit has a loop without a flip-flop.
     */
    public SCOAPResult analyze(NetlistDescription desc) {
        t.start("Build circuit graph");
        CircuitGraph graph = CircuitGraph.build(desc);
        t.stop();
        return analyze(graph);
    }

    /**
     * Analyzes a circuit graph. Values left on the nets by a previous run are cleared first, so
     * analyzing the same graph twice gives identical results.
     * @param graph The circuit.
     * @return The metrics of every net.
     * @throws CombinationalLoopException If the circuit has a loop without a flip-flop.
     */
    public SCOAPResult analyze(CircuitGraph graph) {
        graph.resetComputedValues();

        t.start("Levelize");
        Levelizer levelizer = new Levelizer(graph);
        levelizer.levelize();
        t.stop();

        t.start("Propagate");
        SequentialConvergenceDriver driver = new SequentialConvergenceDriver(levelizer, config);
        driver.run();
        t.stop();

        List<NetMetrics> metrics = new ArrayList<>();
        for (Net net : graph.getNets()) {
            metrics.add(NetMetrics.of(net, graph.isSequential()));
        }
        List<String> saturated = new ArrayList<>();
        for (Net net : driver.getSaturatedNets()) {
            saturated.add(net.getName());
        }
        if (!saturated.isEmpty() && config.isVerbose()) {
            MessageGenerator.briefStatus("INFO: " + saturated.size() + " net(s) reached the saturation limit of "
                    + config.getMaxValue());
        }
        return new SCOAPResult(graph.getName(), metrics, graph.isSequential(), driver.getIteration(),
                driver.isConverged(), driver.getWarning(), saturated);
    }
}
