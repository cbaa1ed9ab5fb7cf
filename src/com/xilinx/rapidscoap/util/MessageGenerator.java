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

/**
 * Common class for console messages of the analysis tools.
 */
public class MessageGenerator {

    private static final String BAR = "==============================================================================";

    /**
     * Prints a message to standard error and exits with status 1.
     * @param msg The message to print to standard error
     */
    public static void briefErrorAndExit(String msg) {
        briefError(msg);
        System.exit(1);
    }

    /**
     * Prints a message to standard error.
     * @param msg The message to print to standard error
     */
    public static void briefError(String msg) {
        System.err.println(msg);
    }

    /**
     * Prints a progress message to standard error, keeping standard out free for reports.
     * @param msg The message to print to standard error
     */
    public static void briefStatus(String msg) {
        System.err.println(msg);
    }

    /**
     * Prints a generic header to standard out to separate operations.
     * @param s Title to center in the header.
     */
    public static void printHeader(String s) {
        System.out.println(createHeader(s));
    }

    /**
     * Creates the three-line header printed by {@link #printHeader(String)}.
     * @param s Title to center in the header.
     * @return The header text, without a trailing newline.
     */
    public static String createHeader(String s) {
        double whiteSpace = (72 - s.length()) / 2.0;
        String left = makeWhiteSpace((int) whiteSpace);
        String right = makeWhiteSpace((int) (whiteSpace + 0.5));
        return BAR + System.lineSeparator() + "== " + left + s + right + " ==" + System.lineSeparator() + BAR;
    }

    /**
     * Creates a whitespace string with length number of spaces.
     * @param length Number of spaces in the string.
     * @return The newly created whitespace string.
     */
    public static String makeWhiteSpace(int length) {
        if (length < 1)
            return "";
        StringBuilder sb = new StringBuilder(length);
        for (int i = 0; i < length; i++) {
            sb.append(" ");
        }
        return sb.toString();
    }
}
