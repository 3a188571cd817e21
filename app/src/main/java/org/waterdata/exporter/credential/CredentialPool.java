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
package org.waterdata.exporter.credential;

import org.waterdata.exporter.config.ApiConfig;
import org.waterdata.exporter.model.Credential;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Ordered API credentials, constant for the process lifetime.
 *
 * <p>Failover is a walk over {@link #ordered()} that every fetch starts again at rank 0.
 * No lockout state is kept: a key rejected now is tried first again on the next fetch,
 * since upstream quota lockouts expire.
 */
public final class CredentialPool {

    private final List<Credential> credentials;

    public CredentialPool(List<Credential> credentials) {
        if (credentials.isEmpty()) {
            throw new IllegalArgumentException("Credential pool must hold at least one credential");
        }
        for (int i = 0; i < credentials.size(); i++) {
            if (credentials.get(i).rank() != i) {
                throw new IllegalArgumentException("Credentials must be ordered by rank: " + credentials);
            }
        }
        this.credentials = List.copyOf(credentials);
    }

    /**
     * Build the pool from a primary and an optional backup key.
     * Blank keys count as absent; without any key the pool holds one anonymous credential.
     *
     * @param primaryKey Primary API key
     * @param backupKey  Backup API key
     * @return Credential pool
     */
    public static CredentialPool of(Optional<String> primaryKey, Optional<String> backupKey) {
        List<Credential> credentials = new ArrayList<>(2);
        primaryKey.filter(k -> !k.isBlank())
                .ifPresent(k -> credentials.add(new Credential(Credential.LABEL_PRIMARY, k.trim(), credentials.size())));
        backupKey.filter(k -> !k.isBlank())
                .ifPresent(k -> credentials.add(new Credential(Credential.LABEL_BACKUP, k.trim(), credentials.size())));

        if (credentials.isEmpty()) {
            return new CredentialPool(List.of(Credential.anonymous()));
        }
        return new CredentialPool(credentials);
    }

    public static CredentialPool from(ApiConfig config) {
        return of(config.key(), config.backupKey());
    }

    /**
     * Credentials in failover order, primary first.
     */
    public List<Credential> ordered() {
        return credentials;
    }

    public int size() {
        return credentials.size();
    }

    public boolean isAnonymous() {
        return credentials.size() == 1 && credentials.get(0).isAnonymous();
    }
}
