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

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.xilinx.rapidscoap.netlist.Cell;
import com.xilinx.rapidscoap.netlist.Net;
import com.xilinx.rapidscoap.netlist.FlipFlop;
import com.xilinx.rapidscoap.netlist.PinRef;

/**
 * Backward pass computing CO and SO for every net. Must run after the
 * {@link ControllabilityPropagator} of the same iteration since side-input costs come from the
 * controllability values.
 */
public class ObservabilityPropagator {

    private final GateFormulas formulas;
    private final Set<Net> saturated;

    public ObservabilityPropagator(GateFormulas formulas) {
        this.formulas = formulas;
        this.saturated = new LinkedHashSet<>();
    }

    /**
     * Computes observability for every net. A net's value is the cheapest of: 0 if it is a
     * primary output, observing it through one of the cell pins it drives or, for SO only, the
     * value seeded on a flip-flop data pin it drives. CO never crosses a flip-flop.
     * @param backwardOrder Nets in backward order (see {@link Levelizer#getBackwardOrder()}).
     * @param states Values seeded on each flip-flop data input for this iteration.
     */
    public void propagate(List<Net> backwardOrder, Map<FlipFlop, FlipFlopState> states) {
        saturated.clear();
        for (Net net : backwardOrder) {
            int co = Net.UNDEFINED;
            int so = Net.UNDEFINED;
            for (PinRef pin : net.getReaders()) {
                switch (pin.getKind()) {
                    case PRIMARY_OUTPUT:
                        co = 0;
                        so = 0;
                        break;
                    case FLOP_DATA: {
                        FlipFlopState s = states.get(pin.getFlipFlop());
                        if (s == null) s = FlipFlopState.INITIAL;
                        so = Math.min(so, s.getDataSO());
                        break;
                    }
                    case CELL_INPUT:
                        co = Math.min(co, observeThroughCell(pin.getCell(), pin.getIndex(), false));
                        so = Math.min(so, observeThroughCell(pin.getCell(), pin.getIndex(), true));
                        break;
                    default:
                        // clock, reset and set pins do not propagate values
                        break;
                }
            }
            net.setCO(co);
            net.setSO(so);
            if (formulas.isSaturated(co) || formulas.isSaturated(so)) {
                saturated.add(net);
            }
        }
    }

    private int observeThroughCell(Cell cell, int pin, boolean sequential) {
        Net out = cell.getOutput();
        int outObservability = sequential ? out.getSO() : out.getCO();
        if (outObservability == Net.UNDEFINED) {
            return Net.UNDEFINED;
        }
        int n = cell.getInputCount();
        int[] c0 = new int[n];
        int[] c1 = new int[n];
        for (int i = 0; i < n; i++) {
            Net in = cell.getInput(i);
            c0[i] = sequential ? in.getSC0() : in.getCC0();
            c1[i] = sequential ? in.getSC1() : in.getCC1();
        }
        return formulas.observeThrough(outObservability, formulas.sideCost(cell.getType(), c0, c1, pin));
    }

    /**
     * @return Nets whose observability hit the saturation limit in the last pass.
     */
    public Set<Net> getSaturatedNets() {
        return saturated;
    }
}
