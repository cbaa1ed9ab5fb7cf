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

package com.xilinx.rapidscoap.scoap;

/**
 * Thrown by the {@link Levelizer} when the circuit contains a loop that does not pass through any
 * flip-flop.
 */
public class CombinationalLoopException extends RuntimeException {

    private static final long serialVersionUID = -8520436019113826937L;

    private final String netName;

    public CombinationalLoopException(String netName) {
        super("ERROR: Combinational loop detected through net '" + netName + "'");
        this.netName = netName;
    }

    /**
     * @return Name of one net that lies on the loop.
     */
    public String getNetName() {
        return netName;
    }
}
