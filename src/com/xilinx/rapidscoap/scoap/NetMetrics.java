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

import com.xilinx.rapidscoap.netlist.Net;

/**
 * Immutable snapshot of the SCOAP metrics of one net. Observability values equal to
 * {@link #UNDEFINED} mean the net cannot be observed.
 */
public final class NetMetrics {

    /** Sentinel for an observability that cannot be achieved */
    public static final int UNDEFINED = Net.UNDEFINED;

    private final String name;
    private final int forwardLevel;
    private final int backwardLevel;
    private final int cc0;
    private final int cc1;
    private final int co;
    private final int sc0;
    private final int sc1;
    private final int so;
    private final boolean sequentialMetrics;

    public NetMetrics(String name, int forwardLevel, int backwardLevel, int cc0, int cc1, int co,
                      int sc0, int sc1, int so, boolean sequentialMetrics) {
        this.name = name;
        this.forwardLevel = forwardLevel;
        this.backwardLevel = backwardLevel;
        this.cc0 = cc0;
        this.cc1 = cc1;
        this.co = co;
        this.sc0 = sc0;
        this.sc1 = sc1;
        this.so = so;
        this.sequentialMetrics = sequentialMetrics;
    }

    /**
     * Takes a snapshot of the values currently stored on a net.
     * @param net The net.
     * @param sequentialMetrics Whether SC0/SC1/SO are meaningful (the circuit has flip-flops).
     */
    public static NetMetrics of(Net net, boolean sequentialMetrics) {
        return new NetMetrics(net.getName(), net.getForwardLevel(), net.getBackwardLevel(),
                net.getCC0(), net.getCC1(), net.getCO(), net.getSC0(), net.getSC1(), net.getSO(),
                sequentialMetrics);
    }

    public String getName() {
        return name;
    }

    public int getForwardLevel() {
        return forwardLevel;
    }

    public int getBackwardLevel() {
        return backwardLevel;
    }

    public int getCC0() {
        return cc0;
    }

    public int getCC1() {
        return cc1;
    }

    /**
     * @return Combinational observability, or {@link #UNDEFINED}.
     */
    public int getCO() {
        return co;
    }

    public boolean isObservable() {
        return co != UNDEFINED;
    }

    /**
     * True when the circuit has at least one flip-flop; only then are SC0/SC1/SO reported.
     */
    public boolean hasSequentialMetrics() {
        return sequentialMetrics;
    }

    public int getSC0() {
        return sc0;
    }

    public int getSC1() {
        return sc1;
    }

    /**
     * @return Sequential observability, or {@link #UNDEFINED}.
     */
    public int getSO() {
        return so;
    }

    public boolean isSequentiallyObservable() {
        return so != UNDEFINED;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof NetMetrics)) return false;
        NetMetrics m = (NetMetrics) o;
        return name.equals(m.name) && forwardLevel == m.forwardLevel && backwardLevel == m.backwardLevel
                && cc0 == m.cc0 && cc1 == m.cc1 && co == m.co
                && sc0 == m.sc0 && sc1 == m.sc1 && so == m.so
                && sequentialMetrics == m.sequentialMetrics;
    }

    @Override
    public int hashCode() {
        int h = name.hashCode();
        h = 31 * h + forwardLevel;
        h = 31 * h + backwardLevel;
        h = 31 * h + cc0;
        h = 31 * h + cc1;
        h = 31 * h + co;
        h = 31 * h + sc0;
        h = 31 * h + sc1;
        h = 31 * h + so;
        return h;
    }

    private static String format(int value) {
        return value == UNDEFINED ? "inf" : Integer.toString(value);
    }

    @Override
    public String toString() {
        String s = name + " [lvl " + forwardLevel + "/" + backwardLevel + "] CC0=" + cc0 + " CC1=" + cc1
                + " CO=" + format(co);
        if (sequentialMetrics) {
            s += " SC0=" + sc0 + " SC1=" + sc1 + " SO=" + format(so);
        }
        return s;
    }
}
