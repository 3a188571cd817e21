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
package org.waterdata.exporter.fetch;

import org.waterdata.exporter.model.FetchOutcome;
import org.waterdata.exporter.model.GaugeDescriptor;

/**
 * Fetches the latest reading of one gauge.
 *
 * <p><b>Thread Safety:</b> Implementations are called concurrently from the poll
 * worker pool and must be thread-safe.
 */
public interface GaugeFetcher {

    /**
     * Query the upstream API for the gauge's latest reading.
     *
     * <p>Implementations classify every failure into the returned outcome instead of
     * throwing, and bound each request by a timeout.
     *
     * @param gauge Gauge to query (never null)
     * @return Value in CFS or a classified failure (never null)
     */
    FetchOutcome fetch(GaugeDescriptor gauge);
}
