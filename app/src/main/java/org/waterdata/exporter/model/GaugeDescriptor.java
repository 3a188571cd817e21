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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A monitored station and the query parameters needed to request its latest reading.
 *
 * @param id              USGS site code, e.g. 01646500
 * @param name            Location name of the station
 * @param friendlyName    Short display label
 * @param queryParameters Ordered query parameters sent to the upstream API
 */
public record GaugeDescriptor(String id, String name, String friendlyName, Map<String, String> queryParameters) {

    public static final String PARAM_MONITORING_LOCATION_ID = "monitoring_location_id";
    public static final String PARAM_PARAMETER_CODE = "parameter_code";
    public static final String PARAM_STATISTIC_ID = "statistic_id";
    public static final String PARAM_PROPERTIES = "properties";
    public static final String REQUESTED_PROPERTIES = "value,time";

    public GaugeDescriptor {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(queryParameters, "queryParameters");
        name = name != null ? name : id;
        friendlyName = friendlyName != null ? friendlyName : name;
        queryParameters = Collections.unmodifiableMap(new LinkedHashMap<>(queryParameters));
    }

    /**
     * Create a descriptor querying the latest value of one parameter/statistic pair.
     *
     * @param id            Site code
     * @param name          Location name (defaults to the id)
     * @param friendlyName  Display label (defaults to the name)
     * @param agency        Agency prefix of the monitoring location
     * @param parameterCode USGS parameter code
     * @param statisticId   USGS statistic id
     * @return Gauge descriptor
     */
    public static GaugeDescriptor of(String id, String name, String friendlyName,
                                     String agency, String parameterCode, String statisticId) {
        Map<String, String> params = new LinkedHashMap<>();
        params.put(PARAM_MONITORING_LOCATION_ID, agency + "-" + id);
        params.put(PARAM_PARAMETER_CODE, parameterCode);
        params.put(PARAM_STATISTIC_ID, statisticId);
        params.put(PARAM_PROPERTIES, REQUESTED_PROPERTIES);
        return new GaugeDescriptor(id, name, friendlyName, params);
    }
}
