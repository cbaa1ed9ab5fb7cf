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

import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import com.xilinx.rapidscoap.netlist.CircuitGraph;
import com.xilinx.rapidscoap.netlist.FlipFlop;
import com.xilinx.rapidscoap.netlist.Net;
import com.xilinx.rapidscoap.netlist.NetlistDescription;

public class TestSequentialConvergenceDriver {

    private static SequentialConvergenceDriver createDriver(CircuitGraph g, int maxIterations) {
        SCOAPConfig config = new SCOAPConfig();
        config.setMaxIterations(maxIterations);
        config.setMaxValue(SCOAPConfig.DEFAULT_MAX_VALUE);
        config.setVerbose(false);
        g.resetComputedValues();
        Levelizer l = new Levelizer(g);
        l.levelize();
        return new SequentialConvergenceDriver(l, config);
    }

    @Test
    public void testShiftRegisterSteps() {
        CircuitGraph g = CircuitGraph.build(TestSCOAPAnalyzer.createShiftRegister());
        SequentialConvergenceDriver driver = createDriver(g, 10);
        Net a = g.getNet("a");
        Net q2 = g.getNet("q2");

        Assertions.assertFalse(driver.step());
        Assertions.assertEquals(1, q2.getSC1());
        Assertions.assertEquals(Net.UNDEFINED, a.getSO());

        Assertions.assertFalse(driver.step());
        Assertions.assertEquals(2, q2.getSC1());
        Assertions.assertEquals(Net.UNDEFINED, a.getSO());

        Assertions.assertTrue(driver.step());
        Assertions.assertEquals(3, q2.getSC1());
        Assertions.assertEquals(2, a.getSO());
        Assertions.assertEquals(3, driver.getIteration());

        // nothing left to do once converged
        Assertions.assertTrue(driver.step());
        Assertions.assertEquals(3, driver.getIteration());
        Assertions.assertNull(driver.getWarning());
    }

    /** ISCAS-89 s27: three flip-flops with feedback through NOR/NAND logic */
    private static NetlistDescription createS27() {
        return new NetlistDescription("s27")
                .addPrimaryInput("G0", "G1", "G2", "G3")
                .addPrimaryOutput("G17")
                .addFlipFlop("G5", "G10", null, "G5")
                .addFlipFlop("G6", "G11", null, "G6")
                .addFlipFlop("G7", "G13", null, "G7")
                .addCell("G14", "NOT", "G14", "G0")
                .addCell("G17", "NOT", "G17", "G11")
                .addCell("G8", "AND", "G8", "G14", "G6")
                .addCell("G15", "OR", "G15", "G12", "G8")
                .addCell("G16", "OR", "G16", "G3", "G8")
                .addCell("G9", "NAND", "G9", "G16", "G15")
                .addCell("G10", "NOR", "G10", "G14", "G11")
                .addCell("G11", "NOR", "G11", "G5", "G9")
                .addCell("G12", "NOR", "G12", "G1", "G7")
                .addCell("G13", "NOR", "G13", "G2", "G12");
    }

    @Test
    public void testSequentialMetricsAreMonotonic() {
        CircuitGraph g = CircuitGraph.build(createS27());
        SequentialConvergenceDriver driver = createDriver(g, 20);
        Map<Net, int[]> previous = new HashMap<>();
        boolean soBecameFinite = false;
        while (true) {
            boolean converged = driver.step();
            for (Net net : g.getNets()) {
                int[] now = {net.getSC0(), net.getSC1(), net.getSO()};
                int[] before = previous.get(net);
                if (before != null) {
                    Assertions.assertTrue(now[0] >= before[0], net + " SC0 decreased at iteration "
                            + driver.getIteration());
                    Assertions.assertTrue(now[1] >= before[1], net + " SC1 decreased at iteration "
                            + driver.getIteration());
                    if (before[2] == Net.UNDEFINED) {
                        soBecameFinite |= now[2] != Net.UNDEFINED;
                    } else {
                        Assertions.assertNotEquals(Net.UNDEFINED, now[2], net + " lost its SO");
                        Assertions.assertTrue(now[2] >= before[2], net + " SO decreased at iteration "
                                + driver.getIteration());
                    }
                }
                previous.put(net, now);
            }
            if (converged) break;
            Assertions.assertTrue(driver.getIteration() < 20);
        }
        Assertions.assertEquals(3, driver.getIteration());
        Assertions.assertTrue(soBecameFinite);
        // G2 reaches G17 only through flip-flop G7
        Assertions.assertEquals(Net.UNDEFINED, g.getNet("G2").getCO());
        Assertions.assertEquals(19, g.getNet("G2").getSO());
        Assertions.assertEquals(21, g.getNet("G0").getSO());
    }

    @Test
    public void testCombinationalControllabilityIsStable() {
        CircuitGraph g = CircuitGraph.build(TestSCOAPAnalyzer.createToggle());
        SequentialConvergenceDriver driver = createDriver(g, 20);
        for (int i = 0; i < 20; i++) {
            driver.step();
            Assertions.assertEquals(1, g.getNet("q").getCC0());
            Assertions.assertEquals(1, g.getNet("q").getCC1());
            Assertions.assertEquals(2, g.getNet("n").getCC0());
            Assertions.assertEquals(1, g.getNet("q").getCO());
        }
        Assertions.assertEquals(2 * 20 - 1, g.getNet("q").getSC1());
    }

    @Test
    public void testRunHitsBound() {
        CircuitGraph g = CircuitGraph.build(TestSCOAPAnalyzer.createToggle());
        SequentialConvergenceDriver driver = createDriver(g, 3);
        Assertions.assertFalse(driver.run());
        Assertions.assertEquals(3, driver.getIteration());
        Assertions.assertFalse(driver.isConverged());
        Assertions.assertNotNull(driver.getWarning());
        Assertions.assertEquals(Arrays.asList("r"), driver.getWarning().getUnstableFlipFlops());
    }

    @Test
    public void testFlipFlopStates() {
        CircuitGraph g = CircuitGraph.build(TestSCOAPAnalyzer.createShiftRegister());
        SequentialConvergenceDriver driver = createDriver(g, 10);
        FlipFlop ff2 = g.getFlipFlops().get(1);
        Assertions.assertEquals(FlipFlopState.INITIAL, driver.getStates().get(ff2));
        driver.run();
        FlipFlopState s = driver.getStates().get(ff2);
        // Q of ff2 pays one cycle on the SC of q1; D pays one cycle on the SO of q2
        Assertions.assertEquals(new FlipFlopState(3, 3, 1), s);
        Assertions.assertEquals(s.hashCode(), new FlipFlopState(3, 3, 1).hashCode());
    }

    @Test
    public void testCombinationalRunsOnce() {
        CircuitGraph g = CircuitGraph.build(new NetlistDescription()
                .addPrimaryInput("a")
                .addPrimaryOutput("y")
                .addCell("g", "NOT", "y", "a"));
        SequentialConvergenceDriver driver = createDriver(g, 10);
        Assertions.assertTrue(driver.run());
        Assertions.assertEquals(1, driver.getIteration());
        Assertions.assertTrue(driver.getStates().isEmpty());
        List<Net> nets = g.getNets();
        Assertions.assertEquals(1, nets.get(0).getCO());
        Assertions.assertEquals(2, nets.get(1).getCC0());
    }
}
