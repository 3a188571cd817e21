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

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.waterdata.exporter.config.ApiConfig;
import org.waterdata.exporter.model.Credential;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class CredentialPoolTest {

    @Mock
    private ApiConfig apiConfig;

    @Test
    void testPrimaryAndBackup_OrderedByRank() {
        CredentialPool pool = CredentialPool.of(Optional.of("primary-key"), Optional.of("backup-key"));

        List<Credential> ordered = pool.ordered();
        assertEquals(2, ordered.size());
        assertEquals(new Credential(Credential.LABEL_PRIMARY, "primary-key", 0), ordered.get(0));
        assertEquals(new Credential(Credential.LABEL_BACKUP, "backup-key", 1), ordered.get(1));
        assertFalse(pool.isAnonymous());
    }

    @Test
    void testBackupOptional() {
        CredentialPool pool = CredentialPool.of(Optional.of("primary-key"), Optional.empty());

        assertEquals(1, pool.size());
        assertEquals(Credential.LABEL_PRIMARY, pool.ordered().get(0).label());
    }

    @Test
    void testBackupWithoutPrimary_PromotedToRankZero() {
        CredentialPool pool = CredentialPool.of(Optional.empty(), Optional.of("backup-key"));

        assertEquals(1, pool.size());
        Credential only = pool.ordered().get(0);
        assertEquals(Credential.LABEL_BACKUP, only.label());
        assertEquals(0, only.rank());
    }

    @Test
    void testNoKeys_AnonymousCredential() {
        CredentialPool pool = CredentialPool.of(Optional.empty(), Optional.empty());

        assertTrue(pool.isAnonymous());
        assertEquals(List.of(Credential.anonymous()), pool.ordered());
    }

    @Test
    void testBlankKeysCountAsAbsent() {
        CredentialPool pool = CredentialPool.of(Optional.of("  "), Optional.of(""));

        assertTrue(pool.isAnonymous());
    }

    @Test
    void testKeysAreTrimmed() {
        CredentialPool pool = CredentialPool.of(Optional.of(" primary-key \n"), Optional.empty());

        assertEquals("primary-key", pool.ordered().get(0).key());
    }

    @Test
    void testFromConfig() {
        when(apiConfig.key()).thenReturn(Optional.of("primary-key"));
        when(apiConfig.backupKey()).thenReturn(Optional.of("backup-key"));

        CredentialPool pool = CredentialPool.from(apiConfig);

        assertEquals(2, pool.size());
        assertEquals("backup-key", pool.ordered().get(1).key());
    }

    @Test
    void testOrderedIsImmutable() {
        CredentialPool pool = CredentialPool.of(Optional.of("primary-key"), Optional.empty());

        assertThrows(UnsupportedOperationException.class, () -> pool.ordered().add(Credential.anonymous()));
    }

    @Test
    void testRejectsUnorderedCredentials() {
        List<Credential> unordered = List.of(
                new Credential(Credential.LABEL_BACKUP, "b", 1),
                new Credential(Credential.LABEL_PRIMARY, "a", 0));

        assertThrows(IllegalArgumentException.class, () -> new CredentialPool(unordered));
        assertThrows(IllegalArgumentException.class, () -> new CredentialPool(List.of()));
    }
}
