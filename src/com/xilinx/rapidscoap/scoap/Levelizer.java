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
import java.util.Comparator;
import java.util.List;
import java.util.Set;
import java.util.function.ObjIntConsumer;
import java.util.function.ToIntFunction;

import org.jgrapht.Graph;
import org.jgrapht.alg.cycle.CycleDetector;
import org.jgrapht.graph.EdgeReversedGraph;
import org.jgrapht.graph.MaskSubgraph;
import org.jgrapht.traverse.TopologicalOrderIterator;

import com.xilinx.rapidscoap.netlist.CircuitGraph;
import com.xilinx.rapidscoap.netlist.Net;
import com.xilinx.rapidscoap.netlist.NetEdge;

/**
 * Computes forward and backward levels of every net and the visitation orders used by the
 * propagators.
 * <p>
 * Flip-flop edges are masked out first so that flip-flop outputs become sources and flip-flop
 * data inputs become sinks. What remains must be a DAG. The forward level of a net is its longest
 * distance from a source, the backward level its longest distance to a sink of the combinational
 * subgraph (computed on the transposed graph).
 */
public class Levelizer {

    private final CircuitGraph graph;
    private final Graph<Net, NetEdge> combinational;
    private List<Net> forwardOrder;
    private List<Net> backwardOrder;
    private int maxForwardLevel;
    private int maxBackwardLevel;

    public Levelizer(CircuitGraph graph) {
        this.graph = graph;
        this.combinational = new MaskSubgraph<>(graph, v -> false, NetEdge::isSequential);
    }

    /**
     * Computes the levels of all nets and stores them on the nets.
     * @throws CombinationalLoopException If the combinational subgraph has a cycle.
     */
    public void levelize() {
        checkForCombinationalLoops();

        maxForwardLevel = computeLevels(combinational, Net::getForwardLevel, Net::setForwardLevel);
        maxBackwardLevel = computeLevels(new EdgeReversedGraph<>(combinational),
                Net::getBackwardLevel, Net::setBackwardLevel);

        forwardOrder = sortByLevel(Net::getForwardLevel);
        backwardOrder = sortByLevel(Net::getBackwardLevel);
    }

    private void checkForCombinationalLoops() {
        Net loopNet = null;
        for (NetEdge e : combinational.edgeSet()) {
            Net src = combinational.getEdgeSource(e);
            if (src == combinational.getEdgeTarget(e)) {
                if (loopNet == null || src.getIndex() < loopNet.getIndex()) loopNet = src;
            }
        }
        if (loopNet == null) {
            CycleDetector<Net, NetEdge> detector = new CycleDetector<>(combinational);
            if (detector.detectCycles()) {
                Set<Net> inCycles = detector.findCycles();
                loopNet = Collections.min(inCycles, Comparator.comparingInt(Net::getIndex));
            }
        }
        if (loopNet != null) {
            throw new CombinationalLoopException(loopNet.getName());
        }
    }

    /**
     * Walks the DAG in topological order and sets each vertex to 1 + the maximum level of its
     * predecessors, or 0 if it has none.
     * @return The largest level assigned.
     */
    private static int computeLevels(Graph<Net, NetEdge> dag, ToIntFunction<Net> getter,
                                     ObjIntConsumer<Net> setter) {
        int max = 0;
        TopologicalOrderIterator<Net, NetEdge> it = new TopologicalOrderIterator<>(dag);
        while (it.hasNext()) {
            Net net = it.next();
            int level = 0;
            for (NetEdge e : dag.incomingEdgesOf(net)) {
                level = Math.max(level, getter.applyAsInt(dag.getEdgeSource(e)) + 1);
            }
            setter.accept(net, level);
            max = Math.max(max, level);
        }
        return max;
    }

    private List<Net> sortByLevel(ToIntFunction<Net> level) {
        List<Net> order = new ArrayList<>(graph.getNets());
        order.sort(Comparator.comparingInt(level).thenComparingInt(Net::getIndex));
        return Collections.unmodifiableList(order);
    }

    /**
     * Gets the order in which controllability is computed: ascending forward level, then
     * declaration order. Every cell output comes after all of the cell's inputs.
     * @return Nets in forward order.
     */
    public List<Net> getForwardOrder() {
        if (forwardOrder == null) throw new IllegalStateException("ERROR: levelize() has not been run");
        return forwardOrder;
    }

    /**
     * Gets the order in which observability is computed: ascending backward level, then
     * declaration order. Every cell output comes before the nets the cell reads.
     * @return Nets in backward order.
     */
    public List<Net> getBackwardOrder() {
        if (backwardOrder == null) throw new IllegalStateException("ERROR: levelize() has not been run");
        return backwardOrder;
    }

    public int getMaxForwardLevel() {
        return maxForwardLevel;
    }

    public int getMaxBackwardLevel() {
        return maxBackwardLevel;
    }

    public CircuitGraph getGraph() {
        return graph;
    }
}
