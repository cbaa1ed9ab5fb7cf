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

package com.xilinx.rapidscoap.netlist;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * The normalized instance list a netlist reader produces: ordered cell and flip-flop entries plus
 * the primary input and output names. Nothing is validated here; {@link CircuitGraph#build}
 * does that.
 */
public class NetlistDescription {

    /** One combinational instance: {name, type, output, inputs[]} */
    public static class CellEntry {
        private final String name;
        private final String type;
        private final String output;
        private final List<String> inputs;

        public CellEntry(String name, String type, String output, List<String> inputs) {
            this.name = name;
            this.type = type;
            this.output = output;
            this.inputs = Collections.unmodifiableList(new ArrayList<>(inputs));
        }

        public String getName() {
            return name;
        }

        public String getType() {
            return type;
        }

        public String getOutput() {
            return output;
        }

        public List<String> getInputs() {
            return inputs;
        }
    }

    /** One D flip-flop: {name, d, clk, q} with optional asynchronous reset/set */
    public static class FlipFlopEntry {
        private final String name;
        private final String data;
        private final String clock;
        private final String output;
        private final String reset;
        private final String set;

        public FlipFlopEntry(String name, String data, String clock, String output, String reset, String set) {
            this.name = name;
            this.data = data;
            this.clock = clock;
            this.output = output;
            this.reset = reset;
            this.set = set;
        }

        public String getName() {
            return name;
        }

        public String getData() {
            return data;
        }

        public String getClock() {
            return clock;
        }

        public String getOutput() {
            return output;
        }

        public String getReset() {
            return reset;
        }

        public String getSet() {
            return set;
        }
    }

    private String name;
    private final Set<String> primaryInputs = new LinkedHashSet<>();
    private final Set<String> primaryOutputs = new LinkedHashSet<>();
    private final Set<String> wires = new LinkedHashSet<>();
    private final List<CellEntry> cells = new ArrayList<>();
    private final List<FlipFlopEntry> flipFlops = new ArrayList<>();

    public NetlistDescription() {
        this("top");
    }

    public NetlistDescription(String name) {
        this.name = name;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public NetlistDescription addPrimaryInput(String... netNames) {
        primaryInputs.addAll(Arrays.asList(netNames));
        return this;
    }

    public NetlistDescription addPrimaryOutput(String... netNames) {
        primaryOutputs.addAll(Arrays.asList(netNames));
        return this;
    }

    /**
     * Declares nets that are neither primary inputs nor outputs. Optional: nets are also
     * declared implicitly by being referenced from an instance.
     */
    public NetlistDescription addWire(String... netNames) {
        wires.addAll(Arrays.asList(netNames));
        return this;
    }

    public NetlistDescription addCell(String name, String type, String output, String... inputs) {
        return addCell(name, type, output, Arrays.asList(inputs));
    }

    public NetlistDescription addCell(String name, String type, String output, List<String> inputs) {
        cells.add(new CellEntry(name, type, output, inputs));
        return this;
    }

    public NetlistDescription addFlipFlop(String name, String data, String clock, String output) {
        return addFlipFlop(name, data, clock, output, null, null);
    }

    public NetlistDescription addFlipFlop(String name, String data, String clock, String output,
                                          String reset, String set) {
        flipFlops.add(new FlipFlopEntry(name, data, clock, output, reset, set));
        return this;
    }

    public Set<String> getPrimaryInputs() {
        return Collections.unmodifiableSet(primaryInputs);
    }

    public Set<String> getPrimaryOutputs() {
        return Collections.unmodifiableSet(primaryOutputs);
    }

    public Set<String> getWires() {
        return Collections.unmodifiableSet(wires);
    }

    public List<CellEntry> getCells() {
        return Collections.unmodifiableList(cells);
    }

    public List<FlipFlopEntry> getFlipFlops() {
        return Collections.unmodifiableList(flipFlops);
    }

    @Override
    public String toString() {
        return "NetlistDescription{" + name + ", inputs=" + primaryInputs.size() + ", outputs="
                + primaryOutputs.size() + ", cells=" + cells.size() + ", flipflops=" + flipFlops.size() + "}";
    }
}
