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

import java.util.StringJoiner;

/**
 * Builds meter names under the {@code usgs} namespace, e.g. {@code usgs_api_ratelimit_limit}.
 */
@UtilityClass
public class MetricNameBuilder {

    /**
     * Join name parts with underscores after the namespace.
     *
     * @param parts Optional subsystem followed by the metric name
     * @return Meter name
     */
    public static String build(String... parts) {
        StringJoiner name = new StringJoiner("_").add(Constants.NAMESPACE);
        for (String part : parts) {
            name.add(part);
        }
        return name.toString();
    }
}
