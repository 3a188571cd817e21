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
package org.waterdata.exporter.model;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class GaugeDescriptorTest {

    @Test
    void testOf_BuildsOrderedQueryParameters() {
        GaugeDescriptor gauge = GaugeDescriptor.of("01646500", "Potomac River", "Little Falls",
                "USGS", "00060", "00011");

        assertEquals(List.of("monitoring_location_id", "parameter_code", "statistic_id", "properties"),
                List.copyOf(gauge.queryParameters().keySet()));
        assertEquals("USGS-01646500", gauge.queryParameters().get("monitoring_location_id"));
        assertEquals("00060", gauge.queryParameters().get("parameter_code"));
        assertEquals("00011", gauge.queryParameters().get("statistic_id"));
        assertEquals("value,time", gauge.queryParameters().get("properties"));
    }

    @Test
    void testNamesDefaultToId() {
        GaugeDescriptor gauge = GaugeDescriptor.of("01646500", null, null, "USGS", "00060", "00011");

        assertEquals("01646500", gauge.name());
        assertEquals("01646500", gauge.friendlyName());
    }

    @Test
    void testFriendlyNameDefaultsToName() {
        GaugeDescriptor gauge = GaugeDescriptor.of("01646500", "Potomac River", null, "USGS", "00060", "00011");

        assertEquals("Potomac River", gauge.friendlyName());
    }

    @Test
    void testQueryParametersAreImmutable() {
        GaugeDescriptor gauge = new GaugeDescriptor("1", "n", "f", Map.of("a", "b"));

        assertThrows(UnsupportedOperationException.class, () -> gauge.queryParameters().put("x", "y"));
    }
}
