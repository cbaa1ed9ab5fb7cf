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

import org.jgrapht.graph.DefaultEdge;

/**
 * Edges within a {@link CircuitGraph}. A combinational edge connects one input pin of a
 * {@link Cell} to the cell's output net; a sequential edge connects the data net of a
 * {@link FlipFlop} to its output net. Each pin gets its own edge, so a cell reading the same net
 * twice contributes two parallel edges.
 */
public class NetEdge extends DefaultEdge {

    private static final long serialVersionUID = -3174408592357641310L;

    private final Cell cell;
    private final FlipFlop flipFlop;
    private final int inputIndex;

    /**
     * Creates the edge for input pin {@code inputIndex} of a cell.
     * @param cell The cell.
     * @param inputIndex Position of the pin in the cell's input list.
     */
    public NetEdge(Cell cell, int inputIndex) {
        this.cell = cell;
        this.flipFlop = null;
        this.inputIndex = inputIndex;
    }

    /**
     * Creates the data-to-output edge of a flip-flop.
     * @param flipFlop The flip-flop.
     */
    public NetEdge(FlipFlop flipFlop) {
        this.cell = null;
        this.flipFlop = flipFlop;
        this.inputIndex = -1;
    }

    /**
     * @return True if this edge crosses a flip-flop (data input to output).
     */
    public boolean isSequential() {
        return flipFlop != null;
    }

    public Cell getCell() {
        return cell;
    }

    public FlipFlop getFlipFlop() {
        return flipFlop;
    }

    public int getInputIndex() {
        return inputIndex;
    }

    @Override
    public String toString() {
        String src = String.valueOf(getSource());
        String dst = String.valueOf(getTarget());
        if (isSequential()) {
            return src + " -> " + flipFlop.getName() + " -> " + dst;
        }
        return src + " -> " + cell.getName() + "/I" + inputIndex + " -> " + dst;
    }
}
