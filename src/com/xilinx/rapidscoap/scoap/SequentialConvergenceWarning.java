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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Non-fatal outcome of a sequential analysis that hit its iteration bound before the flip-flop
 * values stopped changing. The reported metrics are those of the last iteration.
 */
public class SequentialConvergenceWarning {

    private final int iterations;
    private final int maxIterations;
    private final List<String> unstableFlipFlops;

    public SequentialConvergenceWarning(int iterations, int maxIterations, List<String> unstableFlipFlops) {
        this.iterations = iterations;
        this.maxIterations = maxIterations;
        this.unstableFlipFlops = Collections.unmodifiableList(new ArrayList<>(unstableFlipFlops));
    }

    public int getIterations() {
        return iterations;
    }

    public int getMaxIterations() {
        return maxIterations;
    }

    /**
     * @return Names of the flip-flops whose values still changed in the last iteration.
     */
    public List<String> getUnstableFlipFlops() {
        return unstableFlipFlops;
    }

    public String getMessage() {
        StringBuilder sb = new StringBuilder();
        sb.append("WARNING: SCOAP values did not converge after ").append(iterations)
          .append(" iteration(s) (max ").append(maxIterations).append("); ")
          .append(unstableFlipFlops.size()).append(" flip-flop(s) still changing");
        int shown = Math.min(5, unstableFlipFlops.size());
        if (shown > 0) {
            sb.append(": ").append(String.join(", ", unstableFlipFlops.subList(0, shown)));
            if (shown < unstableFlipFlops.size()) sb.append(", ...");
        }
        return sb.toString();
    }

    @Override
    public String toString() {
        return getMessage();
    }
}
