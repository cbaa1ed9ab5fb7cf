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
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import org.json.JSONArray;
import org.json.JSONObject;

import com.xilinx.rapidscoap.scoap.NetMetrics;
import com.xilinx.rapidscoap.scoap.SCOAPResult;
import com.xilinx.rapidscoap.util.MessageGenerator;

/**
 * Renders a {@link SCOAPResult} as a fixed-width text table or as a JSON document. Sequential
 * columns (SC0, SC1, SO) are only emitted for circuits with flip-flops.
 */
public class SCOAPReportWriter {

    public static final String UNDEFINED_TEXT = "inf";

    private static final int NAME_WIDTH = 20;

    private static final int VALUE_WIDTH = 9;

    public static String toText(SCOAPResult result) {
        String nl = System.lineSeparator();
        boolean seq = result.isSequential();
        int nameWidth = NAME_WIDTH;
        for (NetMetrics m : result.getNetMetrics()) {
            nameWidth = Math.max(nameWidth, m.getName().length() + 1);
        }

        StringBuilder sb = new StringBuilder();
        sb.append(MessageGenerator.createHeader("SCOAP Results for " + result.getCircuitName())).append(nl);
        StringBuilder header = new StringBuilder(pad("Net", nameWidth));
        for (String col : seq ? new String[] {"FwdLev", "BkwdLev", "CC0", "CC1", "CO", "SC0", "SC1", "SO"}
                              : new String[] {"FwdLev", "BkwdLev", "CC0", "CC1", "CO"}) {
            header.append(String.format("%" + VALUE_WIDTH + "s", col));
        }
        sb.append(header).append(nl);
        sb.append(dashes(header.length())).append(nl);

        for (NetMetrics m : result.getNetMetrics()) {
            sb.append(pad(m.getName(), nameWidth));
            sb.append(cell(m.getForwardLevel())).append(cell(m.getBackwardLevel()));
            sb.append(cell(m.getCC0())).append(cell(m.getCC1())).append(cell(m.getCO()));
            if (seq) {
                sb.append(cell(m.getSC0())).append(cell(m.getSC1())).append(cell(m.getSO()));
            }
            sb.append(nl);
        }
        if (seq) {
            sb.append(nl).append("Iterations: ").append(result.getIterations())
              .append(result.isConverged() ? " (converged)" : " (not converged)").append(nl);
        }
        if (result.hasWarning()) {
            sb.append(result.getWarning().getMessage()).append(nl);
        }
        if (!result.getSaturatedNets().isEmpty()) {
            sb.append("INFO: Saturated nets: ").append(String.join(", ", result.getSaturatedNets())).append(nl);
        }
        return sb.toString();
    }

    public static void writeText(SCOAPResult result, Path path) {
        write(toText(result), path);
    }

    public static JSONObject toJSON(SCOAPResult result) {
        JSONObject root = new JSONObject();
        root.put("name", result.getCircuitName());
        root.put("sequential", result.isSequential());
        root.put("iterations", result.getIterations());
        root.put("converged", result.isConverged());
        if (result.hasWarning()) {
            root.put("warning", result.getWarning().getMessage());
        }
        root.put("saturated", new JSONArray(result.getSaturatedNets()));

        JSONArray nets = new JSONArray();
        for (NetMetrics m : result.getNetMetrics()) {
            JSONObject n = new JSONObject();
            n.put("name", m.getName());
            n.put("forwardLevel", m.getForwardLevel());
            n.put("backwardLevel", m.getBackwardLevel());
            n.put("cc0", m.getCC0());
            n.put("cc1", m.getCC1());
            n.put("co", value(m.getCO()));
            if (result.isSequential()) {
                n.put("sc0", m.getSC0());
                n.put("sc1", m.getSC1());
                n.put("so", value(m.getSO()));
            }
            nets.put(n);
        }
        root.put("nets", nets);
        return root;
    }

    public static void writeJSON(SCOAPResult result, Path path) {
        write(toJSON(result).toString(2) + System.lineSeparator(), path);
    }

    private static Object value(int v) {
        return v == NetMetrics.UNDEFINED ? JSONObject.NULL : Integer.valueOf(v);
    }

    private static String cell(int v) {
        return String.format("%" + VALUE_WIDTH + "s", v == NetMetrics.UNDEFINED ? UNDEFINED_TEXT
                : Integer.toString(v));
    }

    private static String pad(String s, int width) {
        return s + MessageGenerator.makeWhiteSpace(width - s.length());
    }

    private static String dashes(int length) {
        StringBuilder sb = new StringBuilder(length);
        for (int i = 0; i < length; i++) {
            sb.append('-');
        }
        return sb.toString();
    }

    private static void write(String text, Path path) {
        try {
            Path parent = path.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.write(path, text.getBytes(StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new UncheckedIOException("ERROR: Could not write report: " + path, e);
        }
    }
}
