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

import com.xilinx.rapidscoap.netlist.FlipFlop;
import com.xilinx.rapidscoap.netlist.Net;

/**
 * The values carried across a flip-flop from one convergence iteration to the next: the
 * sequential controllability seeded onto its output and the sequential observability seeded onto
 * its data input. Combinational metrics never cross a flip-flop: the output is always seeded with
 * CC0 = CC1 = 1 and the data input receives no CO. Instances are immutable value copies, so the
 * cyclic dependency through the flip-flop never becomes a cyclic reference.
 */
public final class FlipFlopState {

    /** State used before the first iteration */
    public static final FlipFlopState INITIAL = new FlipFlopState(1, 1, Net.UNDEFINED);

    private final int outputSC0;
    private final int outputSC1;
    private final int dataSO;

    public FlipFlopState(int outputSC0, int outputSC1, int dataSO) {
        this.outputSC0 = outputSC0;
        this.outputSC1 = outputSC1;
        this.dataSO = dataSO;
    }

    /**
     * Derives the state for the next iteration from the values just computed on the flip-flop's
     * nets. Each sequential cost pays one clock cycle.
     * @param ff The flip-flop.
     * @param formulas Used to saturate the incremented costs.
     * @return The next state.
     */
    public static FlipFlopState fromComputedValues(FlipFlop ff, GateFormulas formulas) {
        Net d = ff.getData();
        Net q = ff.getOutput();
        int so = q.getSO() == Net.UNDEFINED ? Net.UNDEFINED : formulas.clamp(q.getSO() + 1L);
        return new FlipFlopState(formulas.clamp(d.getSC0() + 1L), formulas.clamp(d.getSC1() + 1L), so);
    }

    public int getOutputSC0() {
        return outputSC0;
    }

    public int getOutputSC1() {
        return outputSC1;
    }

    public int getDataSO() {
        return dataSO;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof FlipFlopState)) return false;
        FlipFlopState s = (FlipFlopState) o;
        return outputSC0 == s.outputSC0 && outputSC1 == s.outputSC1 && dataSO == s.dataSO;
    }

    @Override
    public int hashCode() {
        int h = outputSC0;
        h = 31 * h + outputSC1;
        h = 31 * h + dataSO;
        return h;
    }

    @Override
    public String toString() {
        return "FlipFlopState{Q sc=" + outputSC0 + "/" + outputSC1 + ", D so=" + dataSO + "}";
    }
}
