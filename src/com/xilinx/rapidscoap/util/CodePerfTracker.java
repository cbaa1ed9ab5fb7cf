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

package com.xilinx.rapidscoap.util;

import java.io.PrintStream;
import java.util.ArrayList;
import java.util.List;

/**
 * Simple tool for measuring the runtime of the analysis stages and reporting it.
 */
public class CodePerfTracker {

    /** A tracker that records and prints nothing */
    public static final CodePerfTracker SILENT = new CodePerfTracker("", false);

    private final String name;
    private final boolean printProgress;
    private final PrintStream out;
    private final List<String> segmentNames;
    private final List<Long> runtimes;
    private static final int MAX_SEGMENT_NAME_SIZE = 24;

    public CodePerfTracker(String name) {
        this(name, true);
    }

    public CodePerfTracker(String name, boolean printProgress) {
        this(name, printProgress, System.out);
    }

    /**
     * @param name Title of the header printed before the first segment.
     * @param printProgress Print each segment's runtime as soon as it stops.
     * @param out Stream that receives the header and all runtimes.
     */
    public CodePerfTracker(String name, boolean printProgress, PrintStream out) {
        this.name = name;
        this.printProgress = printProgress;
        this.out = out;
        this.segmentNames = new ArrayList<>();
        this.runtimes = new ArrayList<>();
        if (printProgress && name != null && !name.isEmpty()) {
            out.println(MessageGenerator.createHeader(name));
        }
    }

    /**
     * Starts timing a new segment.
     * @param segmentName Label printed for the segment.
     * @return This tracker, for chaining.
     */
    public CodePerfTracker start(String segmentName) {
        if (this == SILENT) return this;
        segmentNames.add(segmentName);
        runtimes.add(System.nanoTime());
        return this;
    }

    /**
     * Stops the most recently started segment.
     * @return This tracker, for chaining.
     */
    public CodePerfTracker stop() {
        if (this == SILENT) return this;
        int idx = runtimes.size() - 1;
        if (idx < 0) return this;
        runtimes.set(idx, System.nanoTime() - runtimes.get(idx));
        if (printProgress) {
            print(segmentNames.get(idx), runtimes.get(idx));
        }
        return this;
    }

    /**
     * @param segmentName Label of a finished segment.
     * @return Its runtime in nanoseconds, or null if no segment has that label.
     */
    public Long getRuntime(String segmentName) {
        int i = segmentNames.indexOf(segmentName);
        return i == -1 ? null : runtimes.get(i);
    }

    public String getName() {
        return name;
    }

    private void print(String segmentName, long runtime) {
        out.printf("%" + MAX_SEGMENT_NAME_SIZE + "s: %9.3fs%n", segmentName, runtime / 1000000000.0);
    }

    /**
     * Prints the total runtime of all segments (and every segment when progress was not printed).
     */
    public void printSummary() {
        if (this == SILENT) return;
        if (!printProgress) out.println(MessageGenerator.createHeader(name));
        long total = 0L;
        for (int i = 0; i < runtimes.size(); i++) {
            if (!printProgress) print(segmentNames.get(i), runtimes.get(i));
            total += runtimes.get(i);
        }
        out.println("------------------------------------------------------------------------------");
        print("*Total*", total);
    }
}
