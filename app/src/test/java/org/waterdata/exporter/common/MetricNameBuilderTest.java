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
package org.waterdata.exporter.common;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;

class MetricNameBuilderTest {

    @Test
    void testBuildWithSubsystem() {
        assertEquals("usgs_exporter_scrape_success", MetricNameBuilder.build(Constants.SUBSYSTEM_EXPORTER, "scrape_success"));
        assertEquals("usgs_api_ratelimit_limit", MetricNameBuilder.build(Constants.SUBSYSTEM_API, "ratelimit_limit"));
    }

    @Test
    void testBuildWithoutSubsystem() {
        assertEquals("usgs_streamflow_cfs", MetricNameBuilder.build("streamflow_cfs"));
    }
}
