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

import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.URISyntaxException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Arrays;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.xilinx.rapidscoap.netlist.MalformedNetlistException;
import com.xilinx.rapidscoap.netlist.NetlistDescription;
import com.xilinx.rapidscoap.netlist.NetlistDescription.FlipFlopEntry;
import com.xilinx.rapidscoap.scoap.NetMetrics;
import com.xilinx.rapidscoap.scoap.SCOAPAnalyzer;
import com.xilinx.rapidscoap.scoap.SCOAPConfig;
import com.xilinx.rapidscoap.scoap.SCOAPResult;

public class TestBenchNetlistReader {

    static Path getResource(String name) {
        try {
            return Paths.get(TestBenchNetlistReader.class.getResource("/netlists/" + name).toURI());
        } catch (URISyntaxException e) {
            throw new RuntimeException(e);
        }
    }

    @Test
    public void testParse() {
        NetlistDescription desc = BenchNetlistReader.parse(String.join("\n",
                "# a comment",
                "INPUT(a)",
                "input( b )",
                "",
                "OUTPUT(y)   # trailing comment",
                "q = DFF(n)",
                "n = BUFF(a)",
                "y = nand(n, b, q)"), "small");
        Assertions.assertEquals("small", desc.getName());
        Assertions.assertEquals(Arrays.asList("a", "b"), Arrays.asList(desc.getPrimaryInputs().toArray()));
        Assertions.assertTrue(desc.getPrimaryOutputs().contains("y"));
        Assertions.assertEquals(2, desc.getCells().size());
        Assertions.assertEquals("y", desc.getCells().get(1).getName());
        Assertions.assertEquals(Arrays.asList("n", "b", "q"), desc.getCells().get(1).getInputs());
        FlipFlopEntry ff = desc.getFlipFlops().get(0);
        Assertions.assertEquals("q", ff.getName());
        Assertions.assertEquals("n", ff.getData());
        Assertions.assertNull(ff.getClock());
    }

    @Test
    public void testSyntaxError() {
        MalformedNetlistException e = Assertions.assertThrows(MalformedNetlistException.class,
                () -> BenchNetlistReader.parse("INPUT(a)\nOUTPUT(y)\ny = AND(a\n", "bad"));
        Assertions.assertEquals("bad:3", e.getOffendingName());
        Assertions.assertTrue(e.getMessage().contains("line 3"));
    }

    @Test
    public void testBadFlipFlop() {
        Assertions.assertThrows(MalformedNetlistException.class,
                () -> BenchNetlistReader.parse("INPUT(a)\nq = DFF(a, a)\n", "bad"));
    }

    @Test
    public void testMissingFile(@TempDir Path tmpDir) {
        Assertions.assertThrows(UncheckedIOException.class,
                () -> BenchNetlistReader.read(tmpDir.resolve("missing.bench")));
    }

    @Test
    public void testReadFile(@TempDir Path tmpDir) throws IOException {
        Path file = tmpDir.resolve("inv.bench");
        Files.write(file, Arrays.asList("INPUT(a)", "OUTPUT(y)", "y = INV(a)"));
        NetlistDescription desc = BenchNetlistReader.read(file);
        Assertions.assertEquals("inv", desc.getName());
        Assertions.assertEquals("INV", desc.getCells().get(0).getType());
    }

    @Test
    public void testS27() {
        NetlistDescription desc = BenchNetlistReader.read(getResource("s27.bench"));
        Assertions.assertEquals("s27", desc.getName());
        Assertions.assertEquals(4, desc.getPrimaryInputs().size());
        Assertions.assertEquals(1, desc.getPrimaryOutputs().size());
        Assertions.assertEquals(3, desc.getFlipFlops().size());
        Assertions.assertEquals(10, desc.getCells().size());

        SCOAPConfig config = new SCOAPConfig();
        config.setMaxIterations(SCOAPConfig.DEFAULT_MAX_ITERATIONS);
        config.setMaxValue(SCOAPConfig.DEFAULT_MAX_VALUE);
        SCOAPResult r = new SCOAPAnalyzer(config).analyze(desc);
        Assertions.assertTrue(r.isSequential());
        Assertions.assertTrue(r.isConverged());
        Assertions.assertEquals(3, r.getIterations());
        Assertions.assertEquals(2, r.getNetMetrics("G14").getCC1());
        Assertions.assertEquals(10, r.getNetMetrics("G17").getCC0());
        Assertions.assertEquals(3, r.getNetMetrics("G17").getCC1());
        Assertions.assertEquals(0, r.getNetMetrics("G17").getCO());
        Assertions.assertEquals(1, r.getNetMetrics("G11").getCO());
        Assertions.assertEquals(12, r.getNetMetrics("G0").getCO());
        // G2 only reaches G17 through flip-flop G7
        Assertions.assertEquals(NetMetrics.UNDEFINED, r.getNetMetrics("G2").getCO());
        Assertions.assertEquals(19, r.getNetMetrics("G2").getSO());
        Assertions.assertEquals(21, r.getNetMetrics("G0").getSO());
        Assertions.assertEquals(15, r.getNetMetrics("G6").getSC1());
    }
}
