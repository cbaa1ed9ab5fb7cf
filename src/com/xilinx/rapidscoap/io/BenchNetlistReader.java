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
import java.util.Arrays;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import com.xilinx.rapidscoap.netlist.MalformedNetlistException;
import com.xilinx.rapidscoap.netlist.NetlistDescription;

/**
 * Reads netlists in the ISCAS-85/89 ".bench" format:
 * <pre>
 * # comment
 * INPUT(G0)
 * OUTPUT(G17)
 * G5 = DFF(G10)
 * G14 = NOT(G0)
 * G8 = AND(G14, G6)
 * </pre>
 * Instances are named after the net they drive. The format has no clock, so flip-flops are
 * created without one.
 */
public class BenchNetlistReader {

    private static final Pattern PORT = Pattern.compile("(INPUT|OUTPUT)\\s*\\(\\s*([^\\s()]+)\\s*\\)",
            Pattern.CASE_INSENSITIVE);

    private static final Pattern ASSIGN = Pattern.compile("([^\\s=]+)\\s*=\\s*(\\w+)\\s*\\(([^()]*)\\)");

    public static NetlistDescription read(Path path) {
        List<String> lines;
        try {
            lines = Files.readAllLines(path, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("ERROR: Problem reading file: " + path, e);
        }
        String name = path.getFileName().toString().replaceFirst("\\.bench$", "");
        return parse(lines, name);
    }

    public static NetlistDescription parse(String text, String name) {
        return parse(Arrays.asList(text.split("\\r?\\n")), name);
    }

    public static NetlistDescription parse(List<String> lines, String name) {
        NetlistDescription desc = new NetlistDescription(name);
        int lineNumber = 0;
        for (String raw : lines) {
            lineNumber++;
            String line = raw;
            int comment = line.indexOf('#');
            if (comment >= 0) line = line.substring(0, comment);
            line = line.trim();
            if (line.isEmpty()) continue;

            Matcher m = PORT.matcher(line);
            if (m.matches()) {
                if (m.group(1).equalsIgnoreCase("INPUT")) {
                    desc.addPrimaryInput(m.group(2));
                } else {
                    desc.addPrimaryOutput(m.group(2));
                }
                continue;
            }
            m = ASSIGN.matcher(line);
            if (!m.matches()) {
                throw new MalformedNetlistException(name + ":" + lineNumber,
                        "ERROR: Unrecognized statement on line " + lineNumber + ": " + raw.trim());
            }
            String output = m.group(1);
            String type = m.group(2);
            List<String> inputs = splitArguments(m.group(3));
            if (type.equalsIgnoreCase("DFF")) {
                if (inputs.size() != 1) {
                    throw new MalformedNetlistException(output, "ERROR: DFF '" + output + "' on line "
                            + lineNumber + " must have exactly one input");
                }
                desc.addFlipFlop(output, inputs.get(0), null, output);
            } else {
                desc.addCell(output, type, output, inputs);
            }
        }
        return desc;
    }

    private static List<String> splitArguments(String args) {
        List<String> list = new ArrayList<>();
        for (String s : args.split(",")) {
            String trimmed = s.trim();
            if (!trimmed.isEmpty()) list.add(trimmed);
        }
        return list;
    }
}
