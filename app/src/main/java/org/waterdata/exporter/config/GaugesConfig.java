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
package org.waterdata.exporter.config;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Location of the gauge list and the query defaults applied to every gauge.
 */
@ConfigMapping(prefix = "usgs.gauges")
public interface GaugesConfig {

    @WithDefault("/config/usgs_gauges.yaml")
    String file();

    /**
     * Agency prefix of the monitoring location id, e.g. USGS-01646500.
     */
    @WithDefault("USGS")
    String agency();

    /**
     * Parameter code requested when a gauge does not override it (00060 = discharge, cfs).
     */
    @WithDefault("00060")
    String parameterCode();

    /**
     * Statistic requested when a gauge does not override it (00011 = instantaneous).
     */
    @WithDefault("00011")
    String statisticId();
}
