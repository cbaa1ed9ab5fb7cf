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
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The outcome of a SCOAP analysis: metrics of every net in declaration order plus convergence
 * information. Immutable; it does not reference the {@link com.xilinx.rapidscoap.netlist.CircuitGraph}.
 */
public class SCOAPResult {

    private final String circuitName;
    private final Map<String, NetMetrics> metrics;
    private final boolean sequential;
    private final int iterations;
    private final boolean converged;
    private final SequentialConvergenceWarning warning;
    private final List<String> saturatedNets;

    public SCOAPResult(String circuitName, List<NetMetrics> metrics, boolean sequential, int iterations,
                       boolean converged, SequentialConvergenceWarning warning, List<String> saturatedNets) {
        this.circuitName = circuitName;
        Map<String, NetMetrics> m = new LinkedHashMap<>();
        for (NetMetrics nm : metrics) {
            m.put(nm.getName(), nm);
        }
        this.metrics = Collections.unmodifiableMap(m);
        this.sequential = sequential;
        this.iterations = iterations;
        this.converged = converged;
        this.warning = warning;
        this.saturatedNets = Collections.unmodifiableList(new ArrayList<>(saturatedNets));
    }

    public String getCircuitName() {
        return circuitName;
    }

    /**
     * @return Metrics of every net, in declaration order.
     */
    public List<NetMetrics> getNetMetrics() {
        return new ArrayList<>(metrics.values());
    }

    /**
     * @param netName Name of a net.
     * @return Its metrics, or null if the circuit has no such net.
     */
    public NetMetrics getNetMetrics(String netName) {
        return metrics.get(netName);
    }

    /**
     * @return True if the circuit has flip-flops and SC0/SC1/SO are reported.
     */
    public boolean isSequential() {
        return sequential;
    }

    public int getIterations() {
        return iterations;
    }

    public boolean isConverged() {
        return converged;
    }

    public boolean hasWarning() {
        return warning != null;
    }

    /**
     * @return The convergence warning, or null if the analysis converged.
     */
    public SequentialConvergenceWarning getWarning() {
        return warning;
    }

    /**
     * @return Names of nets with at least one value clamped to the saturation limit.
     */
    public List<String> getSaturatedNets() {
        return saturatedNets;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SCOAPResult)) return false;
        SCOAPResult r = (SCOAPResult) o;
        return circuitName.equals(r.circuitName) && metrics.equals(r.metrics) && sequential == r.sequential
                && iterations == r.iterations && converged == r.converged
                && saturatedNets.equals(r.saturatedNets);
    }

    @Override
    public int hashCode() {
        return 31 * circuitName.hashCode() + metrics.hashCode();
    }

    @Override
    public String toString() {
        return "SCOAPResult{" + circuitName + ", nets=" + metrics.size() + ", sequential=" + sequential
                + ", iterations=" + iterations + ", converged=" + converged + "}";
    }
}
