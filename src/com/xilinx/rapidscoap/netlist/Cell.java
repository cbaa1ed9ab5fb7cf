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
import java.util.List;

/**
 * A combinational primitive instance. The order of the inputs is the order in which they were
 * declared.
 */
public class Cell {

    private final String name;
    private final GateType type;
    private final List<Net> inputs;
    private final Net output;

    Cell(String name, GateType type, List<Net> inputs, Net output) {
        this.name = name;
        this.type = type;
        this.inputs = Collections.unmodifiableList(inputs);
        this.output = output;
    }

    public String getName() {
        return name;
    }

    public GateType getType() {
        return type;
    }

    public List<Net> getInputs() {
        return inputs;
    }

    public Net getInput(int index) {
        return inputs.get(index);
    }

    public int getInputCount() {
        return inputs.size();
    }

    public Net getOutput() {
        return output;
    }

    @Override
    public String toString() {
        return name + "(" + type + ")";
    }
}
