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

package com.xilinx.rapidscoap.io;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import com.xilinx.rapidscoap.netlist.MalformedNetlistException;
import com.xilinx.rapidscoap.netlist.NetlistDescription;
import com.xilinx.rapidscoap.netlist.NetlistDescription.FlipFlopEntry;
import com.xilinx.rapidscoap.scoap.NetMetrics;
import com.xilinx.rapidscoap.scoap.SCOAPAnalyzer;
import com.xilinx.rapidscoap.scoap.SCOAPConfig;
import com.xilinx.rapidscoap.scoap.SCOAPResult;

public class TestNetlistJsonReader {

    @Test
    public void testParse() {
        String json = "{\"name\": \"reg\", \"inputs\": [\"a\", \"b\", \"clk\", \"rst\"], \"outputs\": [\"q\"],"
                + " \"wires\": [\"n1\"],"
                + " \"cells\": [{\"name\": \"g1\", \"type\": \"xor\", \"output\": \"n1\", \"inputs\": [\"a\", \"b\"]}],"
                + " \"flipflops\": [{\"name\": \"r1\", \"d\": \"n1\", \"clk\": \"clk\", \"q\": \"q\","
                + " \"reset\": \"rst\", \"set\": null}]}";
        NetlistDescription desc = NetlistJsonReader.parse(json);
        Assertions.assertEquals("reg", desc.getName());
        Assertions.assertEquals(4, desc.getPrimaryInputs().size());
        Assertions.assertTrue(desc.getWires().contains("n1"));
        Assertions.assertEquals("xor", desc.getCells().get(0).getType());
        FlipFlopEntry ff = desc.getFlipFlops().get(0);
        Assertions.assertEquals("clk", ff.getClock());
        Assertions.assertEquals("rst", ff.getReset());
        Assertions.assertNull(ff.getSet());

        SCOAPConfig config = new SCOAPConfig();
        config.setMaxIterations(SCOAPConfig.DEFAULT_MAX_ITERATIONS);
        SCOAPResult r = new SCOAPAnalyzer(config).analyze(desc);
        Assertions.assertEquals(3, r.getNetMetrics("n1").getCC0());
        // n1 is only observed through r1
        Assertions.assertEquals(NetMetrics.UNDEFINED, r.getNetMetrics("n1").getCO());
        Assertions.assertEquals(1, r.getNetMetrics("n1").getSO());
        Assertions.assertFalse(r.getNetMetrics("rst").isObservable());
    }

    @Test
    public void testDefaultNames() {
        NetlistDescription desc = NetlistJsonReader.parse("{\"inputs\": [\"a\"], \"outputs\": [\"y\"],"
                + " \"cells\": [{\"type\": \"NOT\", \"output\": \"y\", \"inputs\": [\"a\"]}]}");
        Assertions.assertEquals("top", desc.getName());
        Assertions.assertEquals("y", desc.getCells().get(0).getName());
        Assertions.assertTrue(desc.getFlipFlops().isEmpty());
    }

    @Test
    public void testInvalidJson() {
        Assertions.assertThrows(MalformedNetlistException.class, () -> NetlistJsonReader.parse("{\"inputs\": ["));
        // missing required "outputs"
        Assertions.assertThrows(MalformedNetlistException.class, () -> NetlistJsonReader.parse("{\"inputs\": []}"));
        // cell without an output
        Assertions.assertThrows(MalformedNetlistException.class, () -> NetlistJsonReader.parse(
                "{\"inputs\": [\"a\"], \"outputs\": [], \"cells\": [{\"type\": \"NOT\", \"inputs\": [\"a\"]}]}"));
    }

    @Test
    public void testReadResource() {
        NetlistDescription desc = NetlistJsonReader.read(TestBenchNetlistReader.getResource("half_adder.json"));
        Assertions.assertEquals("half_adder", desc.getName());
        SCOAPResult r = new SCOAPAnalyzer().analyze(desc);
        Assertions.assertEquals(3, r.getNetMetrics("sum").getCC1());
        Assertions.assertEquals(3, r.getNetMetrics("carry").getCC1());
        Assertions.assertEquals(2, r.getNetMetrics("carry").getCC0());
        Assertions.assertEquals(2, r.getNetMetrics("a").getCO());
    }
}
