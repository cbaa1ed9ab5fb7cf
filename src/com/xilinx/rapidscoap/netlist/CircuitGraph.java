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
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.jgrapht.graph.DirectedPseudograph;

import com.xilinx.rapidscoap.netlist.NetlistDescription.CellEntry;
import com.xilinx.rapidscoap.netlist.NetlistDescription.FlipFlopEntry;

/**
 * A CircuitGraph is a directed graph whose vertices are the {@link Net}s of a gate-level circuit
 * and whose edges ({@link NetEdge}) are the data pins of its cells and flip-flops. Flip-flop
 * edges make the graph cyclic in sequential circuits; the combinational part must be acyclic.
 * <p>
 * The topology is fixed once {@link #build(NetlistDescription)} returns. Only the computed values
 * stored on the nets change afterwards.
 */
public class CircuitGraph extends DirectedPseudograph<Net, NetEdge> {

    private static final long serialVersionUID = -6019573316471092842L;

    private final String name;
    private final Map<String, Net> netMap;
    private final List<Net> nets;
    private final List<Cell> cells;
    private final List<FlipFlop> flipFlops;
    private final List<Net> primaryInputs;
    private final List<Net> primaryOutputs;

    private CircuitGraph(String name) {
        super(NetEdge.class);
        this.name = name;
        this.netMap = new HashMap<>();
        this.nets = new ArrayList<>();
        this.cells = new ArrayList<>();
        this.flipFlops = new ArrayList<>();
        this.primaryInputs = new ArrayList<>();
        this.primaryOutputs = new ArrayList<>();
    }

    /**
     * Validates a netlist description and builds its graph. Either a complete graph is returned
     * or nothing is built at all.
     * @param desc The normalized instance list.
     * @return The new circuit graph.
     * @throws MalformedNetlistException If a net has two drivers, a referenced net is not driven,
     * a primary output is not driven, a primary input is driven by an instance, two instances
     * share a name or an instance is badly formed.
     */
    public static CircuitGraph build(NetlistDescription desc) {
        Map<String, String> drivers = validate(desc);

        CircuitGraph g = new CircuitGraph(desc.getName());
        for (String netName : drivers.keySet()) {
            g.createNet(netName);
        }
        for (String pi : desc.getPrimaryInputs()) {
            Net net = g.getNet(pi);
            net.setPrimaryInputDriver();
            g.primaryInputs.add(net);
        }
        for (String po : desc.getPrimaryOutputs()) {
            Net net = g.getNet(po);
            net.setPrimaryOutput();
            g.primaryOutputs.add(net);
        }
        for (CellEntry e : desc.getCells()) {
            List<Net> inputs = new ArrayList<>();
            for (String in : e.getInputs()) {
                inputs.add(g.getNet(in));
            }
            Net output = g.getNet(e.getOutput());
            Cell cell = new Cell(e.getName(), GateType.getGateType(e.getType()), inputs, output);
            output.setDriver(cell);
            for (int i = 0; i < inputs.size(); i++) {
                inputs.get(i).addReader(PinRef.cellInput(cell, i));
                g.addEdge(inputs.get(i), output, new NetEdge(cell, i));
            }
            g.cells.add(cell);
        }
        for (FlipFlopEntry e : desc.getFlipFlops()) {
            FlipFlop ff = new FlipFlop(e.getName(), g.getNet(e.getData()), g.getNetOrNull(e.getClock()),
                    g.getNet(e.getOutput()), g.getNetOrNull(e.getReset()), g.getNetOrNull(e.getSet()));
            ff.getOutput().setDriver(ff);
            ff.getData().addReader(PinRef.flopPin(PinRef.Kind.FLOP_DATA, ff));
            if (ff.getClock() != null) ff.getClock().addReader(PinRef.flopPin(PinRef.Kind.FLOP_CLOCK, ff));
            if (ff.getReset() != null) ff.getReset().addReader(PinRef.flopPin(PinRef.Kind.FLOP_RESET, ff));
            if (ff.getSet() != null) ff.getSet().addReader(PinRef.flopPin(PinRef.Kind.FLOP_SET, ff));
            g.addEdge(ff.getData(), ff.getOutput(), new NetEdge(ff));
            g.flipFlops.add(ff);
        }
        return g;
    }

    /**
     * Checks the description and returns every net name, in declaration order, mapped to a
     * description of its driver.
     */
    private static Map<String, String> validate(NetlistDescription desc) {
        // Insertion order of this map is the declaration order of the nets
        Map<String, String> drivers = new LinkedHashMap<>();
        Map<String, String> firstReader = new HashMap<>();
        Map<String, Boolean> instanceNames = new HashMap<>();

        for (String pi : desc.getPrimaryInputs()) {
            checkNetName(pi, "primary input list");
            drivers.put(pi, "<primary input>");
        }
        for (String po : desc.getPrimaryOutputs()) {
            checkNetName(po, "primary output list");
            drivers.putIfAbsent(po, null);
        }
        for (String w : desc.getWires()) {
            checkNetName(w, "wire list");
            drivers.putIfAbsent(w, null);
        }

        for (CellEntry e : desc.getCells()) {
            checkInstanceName(e.getName(), instanceNames);
            GateType type = GateType.getGateType(e.getType());
            if (type == null) {
                throw new MalformedNetlistException(e.getName(), "ERROR: Cell '" + e.getName()
                        + "' has unknown gate type '" + e.getType() + "'");
            }
            if (e.getInputs().isEmpty()) {
                throw new MalformedNetlistException(e.getName(), "ERROR: Cell '" + e.getName()
                        + "' has no inputs");
            }
            if (type.isSingleInput() && e.getInputs().size() != 1) {
                throw new MalformedNetlistException(e.getName(), "ERROR: " + type + " cell '"
                        + e.getName() + "' must have exactly one input, found " + e.getInputs().size());
            }
            for (String in : e.getInputs()) {
                checkNetName(in, "an input of cell '" + e.getName() + "'");
                drivers.putIfAbsent(in, null);
                firstReader.putIfAbsent(in, e.getName());
            }
            checkNetName(e.getOutput(), "the output of cell '" + e.getName() + "'");
            claimDriver(drivers, e.getOutput(), e.getName(), desc);
        }

        for (FlipFlopEntry e : desc.getFlipFlops()) {
            checkInstanceName(e.getName(), instanceNames);
            checkNetName(e.getData(), "the data input of flip-flop '" + e.getName() + "'");
            drivers.putIfAbsent(e.getData(), null);
            firstReader.putIfAbsent(e.getData(), e.getName());
            for (String ctrl : new String[] {e.getClock(), e.getReset(), e.getSet()}) {
                if (ctrl == null) continue;
                checkNetName(ctrl, "a control pin of flip-flop '" + e.getName() + "'");
                drivers.putIfAbsent(ctrl, null);
                firstReader.putIfAbsent(ctrl, e.getName());
            }
            checkNetName(e.getOutput(), "the output of flip-flop '" + e.getName() + "'");
            claimDriver(drivers, e.getOutput(), e.getName(), desc);
        }

        for (Map.Entry<String, String> e : drivers.entrySet()) {
            if (e.getValue() != null) continue;
            String net = e.getKey();
            if (desc.getPrimaryOutputs().contains(net)) {
                throw new MalformedNetlistException(net, "ERROR: Primary output net '" + net
                        + "' is not driven");
            }
            String reader = firstReader.get(net);
            if (reader != null) {
                throw new MalformedNetlistException(net, "ERROR: Net '" + net + "' is read by '"
                        + reader + "' but has no driver");
            }
            throw new MalformedNetlistException(net, "ERROR: Net '" + net
                    + "' is declared but has no driver");
        }
        return drivers;
    }

    private static void claimDriver(Map<String, String> drivers, String net, String instance,
                                    NetlistDescription desc) {
        String existing = drivers.get(net);
        if (existing == null) {
            drivers.put(net, instance);
            return;
        }
        if (desc.getPrimaryInputs().contains(net)) {
            throw new MalformedNetlistException(net, "ERROR: Primary input net '" + net
                    + "' is also driven by '" + instance + "'");
        }
        throw new MalformedNetlistException(net, "ERROR: Net '" + net + "' has multiple drivers: '"
                + existing + "' and '" + instance + "'");
    }

    private static void checkNetName(String net, String where) {
        if (net == null || net.isEmpty()) {
            throw new MalformedNetlistException(String.valueOf(net), "ERROR: Missing net name in "
                    + where);
        }
    }

    private static void checkInstanceName(String name, Map<String, Boolean> instanceNames) {
        if (name == null || name.isEmpty()) {
            throw new MalformedNetlistException(String.valueOf(name), "ERROR: Instance with no name");
        }
        if (instanceNames.put(name, Boolean.TRUE) != null) {
            throw new MalformedNetlistException(name, "ERROR: Duplicate instance name '" + name + "'");
        }
    }

    private Net createNet(String netName) {
        Net net = new Net(netName, nets.size());
        nets.add(net);
        netMap.put(netName, net);
        addVertex(net);
        return net;
    }

    public String getName() {
        return name;
    }

    /**
     * @param netName Name of the net.
     * @return The net of that name, or null if there is none.
     */
    public Net getNet(String netName) {
        return netMap.get(netName);
    }

    private Net getNetOrNull(String netName) {
        return netName == null ? null : netMap.get(netName);
    }

    /**
     * @return All nets in declaration order.
     */
    public List<Net> getNets() {
        return Collections.unmodifiableList(nets);
    }

    public List<Cell> getCells() {
        return Collections.unmodifiableList(cells);
    }

    public List<FlipFlop> getFlipFlops() {
        return Collections.unmodifiableList(flipFlops);
    }

    public List<Net> getPrimaryInputs() {
        return Collections.unmodifiableList(primaryInputs);
    }

    public List<Net> getPrimaryOutputs() {
        return Collections.unmodifiableList(primaryOutputs);
    }

    /**
     * @return True if the circuit contains at least one flip-flop.
     */
    public boolean isSequential() {
        return !flipFlops.isEmpty();
    }

    /**
     * Gets the cells that read the provided net, once per input pin.
     * @param net The net.
     * @return Cell input edges leaving the net.
     */
    public List<NetEdge> getCellFanout(Net net) {
        List<NetEdge> fanout = new ArrayList<>();
        for (NetEdge e : outgoingEdgesOf(net)) {
            if (!e.isSequential()) fanout.add(e);
        }
        return fanout;
    }

    /**
     * Resets levels, controllability and observability on every net.
     */
    public void resetComputedValues() {
        for (Net net : nets) {
            net.resetComputedValues();
        }
    }

    @Override
    public String toString() {
        return "CircuitGraph{" + name + ", nets=" + nets.size() + ", cells=" + cells.size()
                + ", flipflops=" + flipFlops.size() + "}";
    }
}
