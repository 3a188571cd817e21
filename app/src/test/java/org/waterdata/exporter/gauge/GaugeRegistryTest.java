/**
 * Licensed to the Apache Software Foundation (ASF) under one
 * or more contributor license agreements.  See the NOTICE file
 * distributed with this work for additional information
 * regarding copyright ownership.  The ASF licenses this file
 * to you under the Apache License, Version 2.0 (the
 * "License"); you may not use this file except in compliance
 * with the License.  You may obtain a copy of the License at
 *     http://www.apache.org/licenses/LICENSE-2.0
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package org.waterdata.exporter.gauge;

import org.junit.jupiter.api.Test;
import org.waterdata.exporter.model.GaugeDescriptor;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class GaugeRegistryTest {

    private static GaugeDescriptor gauge(String id) {
        return GaugeDescriptor.of(id, null, null, "USGS", "00060", "00011");
    }

    @Test
    void testKeepsConfigurationOrder() {
        GaugeRegistry registry = GaugeRegistry.of(gauge("C"), gauge("A"), gauge("B"));

        assertEquals(List.of("C", "A", "B"), registry.gauges().stream().map(GaugeDescriptor::id).toList());
        assertEquals(3, registry.size());
        assertFalse(registry.isEmpty());
    }

    @Test
    void testFind() {
        GaugeRegistry registry = GaugeRegistry.of(gauge("A"));

        assertTrue(registry.find("A").isPresent());
        assertTrue(registry.find("missing").isEmpty());
    }

    @Test
    void testDuplicateIdRejected() {
        assertThrows(GaugeConfigurationException.class, () -> GaugeRegistry.of(gauge("A"), gauge("A")));
    }

    @Test
    void testEmptyRegistry() {
        GaugeRegistry registry = new GaugeRegistry(List.of());

        assertTrue(registry.isEmpty());
        assertEquals(0, registry.size());
    }
}
