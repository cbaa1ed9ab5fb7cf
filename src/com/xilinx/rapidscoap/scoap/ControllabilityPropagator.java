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
import com.xilinx.rapidscoap.netlist.FlipFlop;
import com.xilinx.rapidscoap.netlist.Net;

/**
 * Forward pass computing CC0/CC1 and SC0/SC1 for every net.
 */
public class ControllabilityPropagator {

    private final GateFormulas formulas;
    private final Set<Net> saturated;

    public ControllabilityPropagator(GateFormulas formulas) {
        this.formulas = formulas;
        this.saturated = new LinkedHashSet<>();
    }

    /**
     * Computes controllability for every net.
     * @param forwardOrder Nets in forward order (see {@link Levelizer#getForwardOrder()}).
     * @param states Values seeded on each flip-flop output for this iteration.
     */
    public void propagate(List<Net> forwardOrder, Map<FlipFlop, FlipFlopState> states) {
        saturated.clear();
        for (Net net : forwardOrder) {
            switch (net.getDriverType()) {
                case PRIMARY_INPUT:
                    net.setCC(1, 1);
                    net.setSC(1, 1);
                    break;
                case FLIP_FLOP: {
                    FlipFlopState s = states.get(net.getDriverFlipFlop());
                    if (s == null) s = FlipFlopState.INITIAL;
                    // combinational controllability restarts at a state boundary
                    net.setCC(1, 1);
                    net.setSC(s.getOutputSC0(), s.getOutputSC1());
                    break;
                }
                case CELL:
                    computeCell(net.getDriverCell());
                    break;
                default:
                    throw new RuntimeException("ERROR: Net '" + net + "' has no driver");
            }
            if (formulas.isSaturated(net.getCC0()) || formulas.isSaturated(net.getCC1())
                    || formulas.isSaturated(net.getSC0()) || formulas.isSaturated(net.getSC1())) {
                saturated.add(net);
            }
        }
    }

    private void computeCell(Cell cell) {
        int n = cell.getInputCount();
        int[] cc0 = new int[n];
        int[] cc1 = new int[n];
        int[] sc0 = new int[n];
        int[] sc1 = new int[n];
        for (int i = 0; i < n; i++) {
            Net in = cell.getInput(i);
            cc0[i] = in.getCC0();
            cc1[i] = in.getCC1();
            sc0[i] = in.getSC0();
            sc1[i] = in.getSC1();
        }
        int[] cc = formulas.controllability(cell.getType(), cc0, cc1);
        int[] sc = formulas.controllability(cell.getType(), sc0, sc1);
        cell.getOutput().setCC(cc[0], cc[1]);
        cell.getOutput().setSC(sc[0], sc[1]);
    }

    /**
     * @return Nets whose controllability hit the saturation limit in the last pass.
     */
    public Set<Net> getSaturatedNets() {
        return saturated;
    }
}
