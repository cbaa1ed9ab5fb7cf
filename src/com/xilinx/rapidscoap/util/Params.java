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
 * Centralized helper class to read global RapidSCOAP settings from environment variables or JVM
 * properties. Values are looked up each time they are requested.
 */
public class Params {

    /** Bound on sequential convergence iterations */
    public static final String SCOAP_MAX_ITERATIONS_NAME = "SCOAP_MAX_ITERATIONS";

    /** Saturation limit applied to every finite SCOAP cost */
    public static final String SCOAP_MAX_VALUE_NAME = "SCOAP_MAX_VALUE";

    /** Print per-iteration progress of the convergence loop */
    public static final String SCOAP_VERBOSE_NAME = "SCOAP_VERBOSE";

    /**
     * Checks if the named parameter is set via an environment variable or by a JVM parameter of
     * the same name.
     *
     * @param key Name of the global parameter
     * @return True if the parameter is set (as defined by {@link #isSet(String)}),
     *         false otherwise
     */
    public static boolean isParamSet(String key) {
        return isSet(System.getenv(key)) || isSet(System.getProperty(key));
    }

    /**
     * Checks if a parameter is set by examining the provided value.
     *
     * @param value An environment variable or JVM parameter value
     * @return True if (1) value is not null, (2) is not an empty string, (3) is not
     *         0 and (4) is not false (case-insensitive).
     */
    public static boolean isSet(String value) {
        return !( value == null
               || value.length() == 0
               || value.equals("0")
               || value.equalsIgnoreCase("false")
               );
    }

    /**
     * Gets the string value of the provided parameter name. The environment takes precedence over
     * JVM properties.
     *
     * @param key Name of the parameter to get.
     * @return The set string value of the parameter, or null if none was set.
     */
    public static String getParamValue(String key) {
        String value = System.getenv(key);
        if (value == null) {
            value = System.getProperty(key);
        }
        return value;
    }

    /**
     * Gets the integer value of the provided parameter name.
     *
     * @param key Name of the parameter to get.
     * @return The set integer value of the parameter, or null if none was set. If the value is
     *         not a parsable integer, a warning is printed and null is returned.
     */
    public static Integer getParamIntValue(String key) {
        String value = getParamValue(key);
        if (value != null) {
            try {
                return Integer.parseInt(value.trim());
            } catch (NumberFormatException e) {
                MessageGenerator.briefError("WARNING: Couldn't interpret the value '" + value
                        + "' from the parameter '" + key + "' as an integer.");
            }
        }
        return null;
    }

    /**
     * Returns the parameter's integer value if set, otherwise the default.
     *
     * @param key          Name of the parameter to check.
     * @param defaultValue The value to return if the parameter is not set.
     * @return The parameter value if set, otherwise defaultValue.
     */
    public static int getParamOrDefaultIntSetting(String key, int defaultValue) {
        Integer setValue = getParamIntValue(key);
        return setValue == null ? defaultValue : setValue;
    }
}
