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
 * Thrown when a netlist description cannot be turned into a valid {@link CircuitGraph}: a net
 * with two drivers, a reference to a net that nothing drives, an undriven primary output, a
 * driven primary input or a badly formed instance.
 */
public class MalformedNetlistException extends RuntimeException {

    private static final long serialVersionUID = 2206131953528830157L;

    private final String offendingName;

    /**
     * @param offendingName Name of the net, cell or flip-flop at fault.
     * @param message Description of the problem.
     */
    public MalformedNetlistException(String offendingName, String message) {
        super(message);
        this.offendingName = offendingName;
    }

    /**
     * @return Name of the net, cell or flip-flop that made the netlist invalid.
     */
    public String getOffendingName() {
        return offendingName;
    }
}
