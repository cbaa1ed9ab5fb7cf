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
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import org.json.JSONArray;
import org.json.JSONObject;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.xilinx.rapidscoap.netlist.NetlistDescription;
import com.xilinx.rapidscoap.scoap.SCOAPAnalyzer;
import com.xilinx.rapidscoap.scoap.SCOAPConfig;
import com.xilinx.rapidscoap.scoap.SCOAPResult;

public class TestSCOAPReportWriter {

    private static SCOAPResult analyze(NetlistDescription desc, int maxIterations) {
        SCOAPConfig config = new SCOAPConfig();
        config.setMaxIterations(maxIterations);
        config.setMaxValue(SCOAPConfig.DEFAULT_MAX_VALUE);
        config.setVerbose(false);
        return new SCOAPAnalyzer(config).analyze(desc);
    }

    private static SCOAPResult analyzeCombinational() {
        return analyze(new NetlistDescription("and2")
                .addPrimaryInput("A", "B")
                .addPrimaryOutput("Y")
                .addCell("g1", "AND", "Y", "A", "B")
                .addCell("g2", "NOT", "dead", "A"), SCOAPConfig.DEFAULT_MAX_ITERATIONS);
    }

    private static SCOAPResult analyzeSequential(int maxIterations) {
        return analyze(new NetlistDescription("toggle")
                .addPrimaryInput("clk")
                .addPrimaryOutput("n")
                .addFlipFlop("r", "n", "clk", "q")
                .addCell("inv", "NOT", "n", "q"), maxIterations);
    }

    private static String findRow(String text, String netName) {
        for (String line : text.split(System.lineSeparator())) {
            String[] fields = line.trim().split("\\s+");
            if (fields.length > 0 && fields[0].equals(netName)) {
                return line;
            }
        }
        return null;
    }

    @Test
    public void testCombinationalText() {
        String text = SCOAPReportWriter.toText(analyzeCombinational());
        Assertions.assertTrue(text.contains("SCOAP Results for and2"));
        Assertions.assertTrue(text.contains("FwdLev"));
        Assertions.assertFalse(text.contains("SC0"));
        Assertions.assertFalse(text.contains("Iterations"));

        String[] y = findRow(text, "Y").trim().split("\\s+");
        // Net FwdLev BkwdLev CC0 CC1 CO
        Assertions.assertArrayEquals(new String[] {"Y", "1", "0", "2", "3", "0"}, y);
        String[] dead = findRow(text, "dead").trim().split("\\s+");
        Assertions.assertEquals(SCOAPReportWriter.UNDEFINED_TEXT, dead[5]);
    }

    @Test
    public void testSequentialText() {
        String text = SCOAPReportWriter.toText(analyzeSequential(3));
        Assertions.assertTrue(text.contains("SC0"));
        Assertions.assertTrue(text.contains("SO"));
        Assertions.assertTrue(text.contains("Iterations: 3 (not converged)"));
        Assertions.assertTrue(text.contains("WARNING: SCOAP values did not converge"));
        Assertions.assertEquals(9, findRow(text, "q").trim().split("\\s+").length);
    }

    @Test
    public void testJSON() {
        JSONObject json = SCOAPReportWriter.toJSON(analyzeCombinational());
        Assertions.assertEquals("and2", json.getString("name"));
        Assertions.assertFalse(json.getBoolean("sequential"));
        Assertions.assertTrue(json.getBoolean("converged"));
        Assertions.assertFalse(json.has("warning"));
        JSONArray nets = json.getJSONArray("nets");
        Assertions.assertEquals(4, nets.length());
        JSONObject y = nets.getJSONObject(2);
        Assertions.assertEquals("Y", y.getString("name"));
        Assertions.assertEquals(3, y.getInt("cc1"));
        Assertions.assertEquals(0, y.getInt("co"));
        Assertions.assertFalse(y.has("sc0"));
        JSONObject dead = nets.getJSONObject(3);
        Assertions.assertTrue(dead.isNull("co"));

        JSONObject seq = SCOAPReportWriter.toJSON(analyzeSequential(3));
        Assertions.assertTrue(seq.has("warning"));
        Assertions.assertTrue(seq.getJSONArray("nets").getJSONObject(0).has("so"));
    }

    @Test
    public void testWriteFiles(@TempDir Path tmpDir) throws IOException {
        SCOAPResult r = analyzeCombinational();
        Path text = tmpDir.resolve("reports").resolve("and2.txt");
        Path json = tmpDir.resolve("and2.json");
        SCOAPReportWriter.writeText(r, text);
        SCOAPReportWriter.writeJSON(r, json);
        Assertions.assertEquals(SCOAPReportWriter.toText(r),
                new String(Files.readAllBytes(text), StandardCharsets.UTF_8));
        JSONObject parsed = new JSONObject(new String(Files.readAllBytes(json), StandardCharsets.UTF_8));
        Assertions.assertEquals(4, parsed.getJSONArray("nets").length());
    }
}
