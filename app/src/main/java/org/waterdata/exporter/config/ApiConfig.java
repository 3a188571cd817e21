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

import java.time.Duration;
import java.util.Optional;
import java.util.Set;

/**
 * Configuration of the upstream USGS Water Data API.
 */
@ConfigMapping(prefix = "usgs.api")
public interface ApiConfig {

    /**
     * Items endpoint of the latest-continuous collection.
     */
    @WithDefault("https://api.waterdata.usgs.gov/ogcapi/v0/collections/latest-continuous/items")
    String url();

    /**
     * Primary API key. Requests are sent anonymously when neither key is set.
     */
    Optional<String> key();

    /**
     * Backup API key, tried after the primary key has been rejected.
     */
    Optional<String> backupKey();

    /**
     * Timeout of a single upstream request, from sending until the response arrives.
     *
     * @return Request timeout (default: 10 seconds)
     */
    @WithDefault("10s")
    Duration requestTimeout();

    /**
     * Timeout for establishing the connection to the upstream API.
     *
     * @return Connect timeout (default: 5 seconds)
     */
    @WithDefault("5s")
    Duration connectTimeout();

    /**
     * HTTP statuses meaning the credential was rejected or its quota is used up.
     * Such a response fails over to the next credential instead of failing the gauge.
     */
    @WithDefault("401,403,429")
    Set<Integer> authFailureStatuses();
}
