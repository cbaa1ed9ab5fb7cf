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

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import com.xilinx.rapidscoap.util.Params;

import joptsimple.OptionException;

public class TestSCOAPConfig {

    @Test
    public void testParseArguments() {
        SCOAPConfig config = new SCOAPConfig(new String[] {"-i", "s27.bench", "--max-iterations", "7",
                "--max-value", "500", "-v", "-j", "out.json", "--output", "out.txt"});
        Assertions.assertEquals("s27.bench", config.getInputFileName());
        Assertions.assertEquals(7, config.getMaxIterations());
        Assertions.assertEquals(500, config.getMaxValue());
        Assertions.assertTrue(config.isVerbose());
        Assertions.assertEquals("out.json", config.getJsonFileName());
        Assertions.assertEquals("out.txt", config.getOutputFileName());
    }

    @Test
    public void testPositionalInput() {
        SCOAPConfig config = new SCOAPConfig(new String[] {"circuit.json"});
        Assertions.assertEquals("circuit.json", config.getInputFileName());
        Assertions.assertNull(config.getOutputFileName());
        Assertions.assertNull(config.getJsonFileName());
    }

    @Test
    public void testHelp() {
        Assertions.assertTrue(SCOAPConfig.hasHelpArg(new String[] {"-h"}));
        Assertions.assertTrue(SCOAPConfig.hasHelpArg(new String[] {"--help"}));
        Assertions.assertFalse(SCOAPConfig.hasHelpArg(new String[] {"-i", "x.json"}));
    }

    @ParameterizedTest
    @ValueSource(strings = {"0", "2.5", "many"})
    public void testBadMaxIterations(String value) {
        Assertions.assertThrows(IllegalArgumentException.class,
                () -> new SCOAPConfig(new String[] {"--max-iterations", value}));
    }

    @Test
    public void testBadMaxValue() {
        SCOAPConfig config = new SCOAPConfig();
        Assertions.assertThrows(IllegalArgumentException.class, () -> config.setMaxValue(0));
        Assertions.assertThrows(IllegalArgumentException.class, () -> config.setMaxValue(Integer.MAX_VALUE));
    }

    @Test
    public void testUnknownOption() {
        Assertions.assertThrows(OptionException.class, () -> new SCOAPConfig(new String[] {"--frobnicate"}));
    }

    @Test
    public void testDefaultsFromProperties() {
        String key = Params.SCOAP_MAX_ITERATIONS_NAME;
        String old = System.getProperty(key);
        try {
            System.setProperty(key, "42");
            if (System.getenv(key) == null) {
                Assertions.assertEquals(42, new SCOAPConfig().getMaxIterations());
            }
            // command line overrides the property
            Assertions.assertEquals(3, new SCOAPConfig(new String[] {"--max-iterations", "3"}).getMaxIterations());
        } finally {
            if (old == null) {
                System.clearProperty(key);
            } else {
                System.setProperty(key, old);
            }
        }
    }
}
