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
 * A reader of a {@link Net}: one input pin of a cell or flip-flop, or the primary output port of
 * the same name.
 */
public class PinRef {

    public enum Kind {
        CELL_INPUT,
        FLOP_DATA,
        FLOP_CLOCK,
        FLOP_RESET,
        FLOP_SET,
        PRIMARY_OUTPUT;
    }

    private final Kind kind;
    private final Cell cell;
    private final FlipFlop flipFlop;
    /** Position within the cell's input list, -1 for anything other than a cell input */
    private final int index;

    private PinRef(Kind kind, Cell cell, FlipFlop flipFlop, int index) {
        this.kind = kind;
        this.cell = cell;
        this.flipFlop = flipFlop;
        this.index = index;
    }

    static PinRef cellInput(Cell cell, int index) {
        return new PinRef(Kind.CELL_INPUT, cell, null, index);
    }

    static PinRef flopPin(Kind kind, FlipFlop ff) {
        return new PinRef(kind, null, ff, -1);
    }

    static PinRef primaryOutput() {
        return new PinRef(Kind.PRIMARY_OUTPUT, null, null, -1);
    }

    public Kind getKind() {
        return kind;
    }

    public Cell getCell() {
        return cell;
    }

    public FlipFlop getFlipFlop() {
        return flipFlop;
    }

    public int getIndex() {
        return index;
    }

    @Override
    public String toString() {
        switch (kind) {
            case CELL_INPUT:
                return cell.getName() + "/I" + index;
            case FLOP_DATA:
                return flipFlop.getName() + "/D";
            case FLOP_CLOCK:
                return flipFlop.getName() + "/C";
            case FLOP_RESET:
                return flipFlop.getName() + "/R";
            case FLOP_SET:
                return flipFlop.getName() + "/S";
            default:
                return "<primary output>";
        }
    }
}
