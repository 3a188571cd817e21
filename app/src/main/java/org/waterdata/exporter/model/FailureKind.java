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

import java.util.Locale;

/**
 * Classification of a failed gauge fetch. Every kind is recoverable per gauge.
 */
public enum FailureKind {
    /**
     * Network error, timeout or an unusable HTTP status.
     */
    TRANSPORT,
    /**
     * Every credential was rejected by the upstream API.
     */
    AUTH_EXHAUSTED,
    /**
     * Well-formed response without a current reading (gauge offline, no recent data).
     */
    NO_DATA,
    /**
     * Malformed payload or a value that is not a finite number.
     */
    PARSE_ERROR;

    public String tagValue() {
        return name().toLowerCase(Locale.ROOT);
    }
}
