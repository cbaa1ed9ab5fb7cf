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

import com.xilinx.rapidscoap.netlist.GateType;
import com.xilinx.rapidscoap.netlist.Net;

/**
 * SCOAP formulas for each {@link GateType}. The same formulas serve the combinational (CC/CO)
 * and sequential (SC/SO) metrics; callers pass in whichever pair of controllability arrays
 * applies. Sums are done in long arithmetic and then clamped to the saturation limit.
 */
public class GateFormulas {

    private static final long UNREACHABLE = Long.MAX_VALUE / 4;

    private final int maxValue;

    /**
     * @param maxValue Saturation limit for every finite cost. Must be below {@link Net#UNDEFINED}.
     */
    public GateFormulas(int maxValue) {
        if (maxValue < 1 || maxValue >= Net.UNDEFINED) {
            throw new IllegalArgumentException("ERROR: Saturation limit must be in [1, "
                    + (Net.UNDEFINED - 1) + "], got " + maxValue);
        }
        this.maxValue = maxValue;
    }

    public int getMaxValue() {
        return maxValue;
    }

    /**
     * Clamps a cost to the saturation limit.
     * @param value A non-negative cost.
     * @return The cost, or the saturation limit if it was larger.
     */
    public int clamp(long value) {
        return value > maxValue ? maxValue : (int) value;
    }

    /**
     * @param value A cost returned by this class.
     * @return True if the value sits at the saturation limit.
     */
    public boolean isSaturated(int value) {
        return value == maxValue;
    }

    /**
     * Adds a side cost (plus one for the traversed cell) to an observability value. An undefined
     * observability stays undefined.
     */
    public int observeThrough(int outputObservability, long sideCost) {
        if (outputObservability == Net.UNDEFINED) {
            return Net.UNDEFINED;
        }
        return clamp(outputObservability + sideCost + 1);
    }

    /**
     * Computes the output controllability of a gate.
     * @param type Gate type.
     * @param c0 Cost to set each input to 0, in input order.
     * @param c1 Cost to set each input to 1, in input order.
     * @return Two element array {cost to 0, cost to 1} of the output.
     */
    public int[] controllability(GateType type, int[] c0, int[] c1) {
        long out0;
        long out1;
        switch (type) {
            case AND:
                out0 = min(c0) + 1;
                out1 = sum(c1, -1) + 1;
                break;
            case OR:
                out0 = sum(c0, -1) + 1;
                out1 = min(c1) + 1;
                break;
            case NAND:
                out0 = sum(c1, -1) + 1;
                out1 = min(c0) + 1;
                break;
            case NOR:
                out0 = min(c1) + 1;
                out1 = sum(c0, -1) + 1;
                break;
            case NOT:
                out0 = c1[0] + 1L;
                out1 = c0[0] + 1L;
                break;
            case BUF:
                out0 = c0[0] + 1L;
                out1 = c1[0] + 1L;
                break;
            case XOR: {
                long[] parity = parityCosts(c0, c1);
                out0 = parity[0] + 1;
                out1 = parity[1] + 1;
                break;
            }
            case XNOR: {
                long[] parity = parityCosts(c0, c1);
                out0 = parity[1] + 1;
                out1 = parity[0] + 1;
                break;
            }
            default:
                throw new RuntimeException("ERROR: No controllability formula for " + type);
        }
        return new int[] {clamp(out0), clamp(out1)};
    }

    /**
     * Computes the cost of holding every input except {@code pin} at a value that lets a change
     * on {@code pin} reach the output.
     * @param type Gate type.
     * @param c0 Cost to set each input to 0, in input order.
     * @param c1 Cost to set each input to 1, in input order.
     * @param pin Index of the input being observed.
     * @return The sensitization cost (not clamped).
     */
    public long sideCost(GateType type, int[] c0, int[] c1, int pin) {
        switch (type) {
            case AND:
            case NAND:
                return sum(c1, pin);
            case OR:
            case NOR:
                return sum(c0, pin);
            case NOT:
            case BUF:
                return 0;
            case XOR:
            case XNOR: {
                long cost = 0;
                for (int j = 0; j < c0.length; j++) {
                    if (j == pin) continue;
                    cost += Math.min(c0[j], c1[j]);
                }
                return cost;
            }
            default:
                throw new RuntimeException("ERROR: No observability formula for " + type);
        }
    }

    /**
     * Cheapest assignment of the inputs with an even (index 0) or odd (index 1) number of ones.
     * For two inputs this is min(c0a+c0b, c1a+c1b) and min(c0a+c1b, c1a+c0b).
     */
    private static long[] parityCosts(int[] c0, int[] c1) {
        long even = 0;
        long odd = UNREACHABLE;
        for (int i = 0; i < c0.length; i++) {
            long nextEven = Math.min(even + c0[i], odd + c1[i]);
            long nextOdd = Math.min(even + c1[i], odd + c0[i]);
            even = nextEven;
            odd = nextOdd;
        }
        return new long[] {even, odd};
    }

    private static long min(int[] costs) {
        long min = UNREACHABLE;
        for (int c : costs) {
            if (c < min) min = c;
        }
        return min;
    }

    /** Sum of all costs, skipping index {@code skip} (-1 to skip nothing) */
    private static long sum(int[] costs, int skip) {
        long sum = 0;
        for (int i = 0; i < costs.length; i++) {
            if (i == skip) continue;
            sum += costs[i];
        }
        return sum;
    }
}
