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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A Net represents a single named signal of the circuit and is a vertex of the
 * {@link CircuitGraph}. It has exactly one driver and any number of readers. It also stores the
 * values computed by the SCOAP passes (levels, controllability and observability); these are
 * overwritten on every convergence iteration.
 */
public class Net {

    /** Sentinel used for costs that cannot be achieved (e.g. observability of a dead net) */
    public static final int UNDEFINED = Integer.MAX_VALUE;

    private final String name;
    /** Order in which this net was first declared, used to keep visitation deterministic */
    private final int index;

    private NetDriverType driverType;
    private Cell driverCell;
    private FlipFlop driverFlipFlop;
    private boolean primaryOutput;
    private final List<PinRef> readers;

    private int forwardLevel;
    private int backwardLevel;
    private int cc0;
    private int cc1;
    private int sc0;
    private int sc1;
    private int co;
    private int so;

    Net(String name, int index) {
        this.name = name;
        this.index = index;
        this.readers = new ArrayList<>();
        resetComputedValues();
    }

    public String getName() {
        return name;
    }

    /**
     * @return The declaration order of this net within its {@link CircuitGraph}.
     */
    public int getIndex() {
        return index;
    }

    public NetDriverType getDriverType() {
        return driverType;
    }

    /**
     * @return The cell driving this net, or null if the net is not driven by a cell.
     */
    public Cell getDriverCell() {
        return driverCell;
    }

    /**
     * @return The flip-flop driving this net, or null if the net is not a flip-flop output.
     */
    public FlipFlop getDriverFlipFlop() {
        return driverFlipFlop;
    }

    public boolean isPrimaryInput() {
        return driverType == NetDriverType.PRIMARY_INPUT;
    }

    public boolean isFlipFlopOutput() {
        return driverType == NetDriverType.FLIP_FLOP;
    }

    public boolean isPrimaryOutput() {
        return primaryOutput;
    }

    /**
     * Gets the readers of this net in the order they were connected.
     * @return An unmodifiable list of reader pins.
     */
    public List<PinRef> getReaders() {
        return Collections.unmodifiableList(readers);
    }

    void setPrimaryInputDriver() {
        driverType = NetDriverType.PRIMARY_INPUT;
    }

    void setDriver(Cell cell) {
        driverType = NetDriverType.CELL;
        driverCell = cell;
    }

    void setDriver(FlipFlop ff) {
        driverType = NetDriverType.FLIP_FLOP;
        driverFlipFlop = ff;
    }

    void setPrimaryOutput() {
        if (!primaryOutput) {
            primaryOutput = true;
            readers.add(PinRef.primaryOutput());
        }
    }

    void addReader(PinRef pin) {
        readers.add(pin);
    }

    /**
     * Clears all computed values: levels to 0, controllability to 1 and observability to
     * {@link #UNDEFINED}.
     */
    public void resetComputedValues() {
        forwardLevel = 0;
        backwardLevel = 0;
        cc0 = 1;
        cc1 = 1;
        sc0 = 1;
        sc1 = 1;
        co = UNDEFINED;
        so = UNDEFINED;
    }

    public int getForwardLevel() {
        return forwardLevel;
    }

    public void setForwardLevel(int forwardLevel) {
        this.forwardLevel = forwardLevel;
    }

    public int getBackwardLevel() {
        return backwardLevel;
    }

    public void setBackwardLevel(int backwardLevel) {
        this.backwardLevel = backwardLevel;
    }

    public int getCC0() {
        return cc0;
    }

    public int getCC1() {
        return cc1;
    }

    public void setCC(int cc0, int cc1) {
        this.cc0 = cc0;
        this.cc1 = cc1;
    }

    public int getSC0() {
        return sc0;
    }

    public int getSC1() {
        return sc1;
    }

    public void setSC(int sc0, int sc1) {
        this.sc0 = sc0;
        this.sc1 = sc1;
    }

    public int getCO() {
        return co;
    }

    public void setCO(int co) {
        this.co = co;
    }

    public int getSO() {
        return so;
    }

    public void setSO(int so) {
        this.so = so;
    }

    @Override
    public String toString() {
        return name;
    }

    @Override
    public boolean equals(Object o) {
        if (o instanceof Net)
            return ((Net) o).name.equals(name);
        return false;
    }

    @Override
    public int hashCode() {
        return name.hashCode();
    }
}
