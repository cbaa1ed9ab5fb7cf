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
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.xilinx.rapidscoap.netlist.CircuitGraph;
import com.xilinx.rapidscoap.netlist.FlipFlop;
import com.xilinx.rapidscoap.netlist.Net;
import com.xilinx.rapidscoap.util.MessageGenerator;

/**
 * Runs the controllability and observability passes until the values carried across flip-flops
 * stop changing.
 * <p>
 * Flip-flop feedback makes the dependency graph cyclic. Each iteration treats the flip-flops as
 * open: their outputs are seeded from the {@link FlipFlopState} of the previous iteration, a full
 * forward and backward pass is run, and the next state is derived from the new values. A
 * combinational circuit needs exactly one iteration. A sequential one stops when the state is
 * unchanged (exact equality) or the iteration bound is reached, in which case a
 * {@link SequentialConvergenceWarning} is recorded.
 */
public class SequentialConvergenceDriver {

    private final CircuitGraph graph;
    private final Levelizer levelizer;
    private final SCOAPConfig config;
    private final GateFormulas formulas;
    private final ControllabilityPropagator controllability;
    private final ObservabilityPropagator observability;

    private Map<FlipFlop, FlipFlopState> states;
    private List<String> unstableFlipFlops;
    private int iteration;
    private boolean converged;
    private SequentialConvergenceWarning warning;

    /**
     * @param levelizer A levelizer on which {@link Levelizer#levelize()} has been run.
     * @param config Iteration bound, saturation limit and verbosity.
     */
    public SequentialConvergenceDriver(Levelizer levelizer, SCOAPConfig config) {
        this.graph = levelizer.getGraph();
        this.levelizer = levelizer;
        this.config = config;
        this.formulas = new GateFormulas(config.getMaxValue());
        this.controllability = new ControllabilityPropagator(formulas);
        this.observability = new ObservabilityPropagator(formulas);
        this.states = new LinkedHashMap<>();
        for (FlipFlop ff : graph.getFlipFlops()) {
            states.put(ff, FlipFlopState.INITIAL);
        }
        this.unstableFlipFlops = Collections.emptyList();
    }

    /**
     * Runs one forward pass and one backward pass and updates the flip-flop states.
     * @return True if the analysis has converged.
     */
    public boolean step() {
        if (converged) return true;
        controllability.propagate(levelizer.getForwardOrder(), states);
        observability.propagate(levelizer.getBackwardOrder(), states);
        iteration++;

        Map<FlipFlop, FlipFlopState> next = new LinkedHashMap<>();
        List<String> changed = new ArrayList<>();
        for (FlipFlop ff : graph.getFlipFlops()) {
            FlipFlopState s = FlipFlopState.fromComputedValues(ff, formulas);
            next.put(ff, s);
            if (!s.equals(states.get(ff))) {
                changed.add(ff.getName());
            }
        }
        states = next;
        unstableFlipFlops = changed;
        converged = changed.isEmpty();

        if (config.isVerbose() && graph.isSequential()) {
            MessageGenerator.briefStatus("INFO: SCOAP iteration " + iteration + ": " + changed.size()
                    + " of " + graph.getFlipFlops().size() + " flip-flop(s) changed");
        }
        return converged;
    }

    /**
     * Iterates until convergence or until the configured bound is reached.
     * @return True if the analysis converged; otherwise {@link #getWarning()} is set.
     */
    public boolean run() {
        while (!converged && iteration < config.getMaxIterations()) {
            step();
        }
        if (!converged && warning == null) {
            warning = new SequentialConvergenceWarning(iteration, config.getMaxIterations(), unstableFlipFlops);
            MessageGenerator.briefError(warning.getMessage());
        }
        return converged;
    }

    public int getIteration() {
        return iteration;
    }

    public boolean isConverged() {
        return converged;
    }

    /**
     * @return The warning produced when the iteration bound was hit, or null.
     */
    public SequentialConvergenceWarning getWarning() {
        return warning;
    }

    /**
     * @return The state each flip-flop will be seeded with on the next iteration.
     */
    public Map<FlipFlop, FlipFlopState> getStates() {
        return Collections.unmodifiableMap(states);
    }

    /**
     * @return Nets that hit the saturation limit in the last iteration.
     */
    public Set<Net> getSaturatedNets() {
        Set<Net> saturated = new LinkedHashSet<>(controllability.getSaturatedNets());
        saturated.addAll(observability.getSaturatedNets());
        return saturated;
    }

    public GateFormulas getFormulas() {
        return formulas;
    }
}
