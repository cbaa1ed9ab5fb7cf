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

/**
 * A D flip-flop. Only the data input and output take part in value propagation; the clock and the
 * optional asynchronous reset/set nets are kept for structure only.
 */
public class FlipFlop {

    private final String name;
    private final Net data;
    private final Net clock;
    private final Net output;
    private final Net reset;
    private final Net set;

    FlipFlop(String name, Net data, Net clock, Net output, Net reset, Net set) {
        this.name = name;
        this.data = data;
        this.clock = clock;
        this.output = output;
        this.reset = reset;
        this.set = set;
    }

    public String getName() {
        return name;
    }

    public Net getData() {
        return data;
    }

    /**
     * @return The clock net, or null when the source format leaves the clock implicit.
     */
    public Net getClock() {
        return clock;
    }

    public Net getOutput() {
        return output;
    }

    public Net getReset() {
        return reset;
    }

    public Net getSet() {
        return set;
    }

    @Override
    public String toString() {
        return name;
    }
}
