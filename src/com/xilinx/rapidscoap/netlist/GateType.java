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

package com.xilinx.rapidscoap.netlist;

import java.util.Collections;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

/**
 * The combinational primitives understood by the SCOAP engine.
 */
public enum GateType {
    AND(false),
    OR(false),
    NAND(false),
    NOR(false),
    XOR(false),
    XNOR(false),
    NOT(true),
    BUF(true);

    private final boolean singleInput;

    private static final Map<String, GateType> nameMap;

    static {
        Map<String, GateType> m = new HashMap<>();
        for (GateType t : values()) {
            m.put(t.name(), t);
        }
        // Common spellings from ISCAS benchmarks and cell libraries
        m.put("BUFF", BUF);
        m.put("INV", NOT);
        nameMap = Collections.unmodifiableMap(m);
    }

    GateType(boolean singleInput) {
        this.singleInput = singleInput;
    }

    /**
     * @return True if this primitive takes exactly one input (NOT, BUF).
     */
    public boolean isSingleInput() {
        return singleInput;
    }

    /**
     * Looks up a gate type by name, case-insensitive. Accepts the aliases BUFF and INV.
     * @param name Gate type name as found in a netlist.
     * @return The matching gate type, or null if the name is not recognised.
     */
    public static GateType getGateType(String name) {
        if (name == null) return null;
        return nameMap.get(name.trim().toUpperCase(Locale.ROOT));
    }

    /**
     * @param name Gate type name as found in a netlist.
     * @return True if {@link #getGateType(String)} would find a match.
     */
    public static boolean isGateTypeName(String name) {
        return getGateType(name) != null;
    }
}
