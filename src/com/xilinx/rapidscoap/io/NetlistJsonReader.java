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
import java.util.ArrayList;
import java.util.List;

import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;

import com.xilinx.rapidscoap.netlist.MalformedNetlistException;
import com.xilinx.rapidscoap.netlist.NetlistDescription;

/**
 * Reads a normalized netlist from JSON:
 * <pre>
 * {
 *   "name": "top",
 *   "inputs": ["a", "b", "clk"],
 *   "outputs": ["y"],
 *   "wires": ["n1"],
 *   "cells": [ {"name": "g1", "type": "AND", "output": "n1", "inputs": ["a", "b"]} ],
 *   "flipflops": [ {"name": "r1", "d": "n1", "clk": "clk", "q": "y", "reset": null, "set": null} ]
 * }
 * </pre>
 * Only "inputs", "outputs" and the instance fields output/inputs and d/q are required. A missing
 * instance name defaults to the name of the net it drives.
 */
public class NetlistJsonReader {

    public static NetlistDescription read(Path path) {
        String text;
        try {
            text = new String(Files.readAllBytes(path), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("ERROR: Problem reading file: " + path, e);
        }
        String defaultName = path.getFileName().toString().replaceFirst("\\.json$", "");
        return parse(text, defaultName);
    }

    public static NetlistDescription parse(String json) {
        return parse(json, "top");
    }

    public static NetlistDescription parse(String json, String defaultName) {
        try {
            JSONObject root = new JSONObject(json);
            NetlistDescription desc = new NetlistDescription(root.optString("name", defaultName));
            desc.addPrimaryInput(getStrings(root, "inputs", true).toArray(new String[0]));
            desc.addPrimaryOutput(getStrings(root, "outputs", true).toArray(new String[0]));
            desc.addWire(getStrings(root, "wires", false).toArray(new String[0]));

            JSONArray cells = root.optJSONArray("cells");
            if (cells != null) {
                for (int i = 0; i < cells.length(); i++) {
                    JSONObject c = cells.getJSONObject(i);
                    String output = c.getString("output");
                    desc.addCell(c.optString("name", output), c.getString("type"), output,
                            getStrings(c, "inputs", true));
                }
            }
            JSONArray flops = root.optJSONArray("flipflops");
            if (flops != null) {
                for (int i = 0; i < flops.length(); i++) {
                    JSONObject f = flops.getJSONObject(i);
                    String q = f.getString("q");
                    desc.addFlipFlop(f.optString("name", q), f.getString("d"), f.optString("clk", null), q,
                            f.optString("reset", null), f.optString("set", null));
                }
            }
            return desc;
        } catch (JSONException e) {
            throw new MalformedNetlistException(defaultName, "ERROR: Invalid JSON netlist: " + e.getMessage());
        }
    }

    private static List<String> getStrings(JSONObject obj, String key, boolean required) {
        List<String> values = new ArrayList<>();
        JSONArray array = required ? obj.getJSONArray(key) : obj.optJSONArray(key);
        if (array == null) return values;
        for (int i = 0; i < array.length(); i++) {
            values.add(array.getString(i));
        }
        return values;
    }
}
