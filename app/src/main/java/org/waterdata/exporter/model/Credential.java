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

import java.util.Objects;

/**
 * API credential with its failover rank.
 *
 * @param label Label used in logs and metric tags (primary, backup, anonymous)
 * @param key   API key, or null for anonymous access
 * @param rank  Failover rank, 0 is tried first
 */
public record Credential(String label, String key, int rank) {

    public static final String LABEL_PRIMARY = "primary";
    public static final String LABEL_BACKUP = "backup";
    public static final String LABEL_ANONYMOUS = "anonymous";

    public Credential {
        Objects.requireNonNull(label, "label");
        if (rank < 0) {
            throw new IllegalArgumentException("rank must not be negative: " + rank);
        }
    }

    public static Credential anonymous() {
        return new Credential(LABEL_ANONYMOUS, null, 0);
    }

    public boolean isAnonymous() {
        return key == null;
    }

    /**
     * Masked form of the key for logging, keeping the last four characters.
     */
    public String maskedKey() {
        if (key == null) {
            return "none";
        }
        if (key.length() <= 4) {
            return "***";
        }
        return "***" + key.substring(key.length() - 4);
    }

    @Override
    public String toString() {
        return "Credential[label=" + label + ", key=" + maskedKey() + ", rank=" + rank + "]";
    }
}
