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

import lombok.experimental.UtilityClass;

/**
 * Global constants for USGS exporter metrics
 */
@UtilityClass
public final class Constants {
    public static final String NAMESPACE = "usgs";
    public static final String SUBSYSTEM_EXPORTER = "exporter";
    public static final String SUBSYSTEM_API = "api";
    public static final String TAG_GAUGE_ID = "gauge_id";
    public static final String TAG_FRIENDLY_NAME = "friendly_name";
    public static final String TAG_LOCATION_NAME = "location_name";
    public static final String TAG_API_KEY_LABEL = "api_key_label";
    public static final String TAG_FAILURE_KIND = "kind";
    public static final String HEADER_API_KEY = "X-Api-Key";
    public static final String HEADER_RATE_LIMIT_LIMIT = "X-RateLimit-Limit";
    public static final String HEADER_RATE_LIMIT_REMAINING = "X-RateLimit-Remaining";
}
