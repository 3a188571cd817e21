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

import java.util.List;
import java.util.Objects;

/**
 * Result of querying one gauge: either a streamflow value in cubic feet per second
 * or a classified failure.
 *
 * <p>Also carries what was learned about credential quotas along the way, so the
 * fetcher itself never touches shared metric state.
 *
 * @param value        Streamflow in CFS, null on failure
 * @param failureKind  Failure classification, null on success
 * @param detail       Human readable failure detail, null on success
 * @param rateLimits   Rate limit statuses observed on each attempt
 * @param requestCount Number of HTTP requests made for this outcome
 */
public record FetchOutcome(Double value,
                           FailureKind failureKind,
                           String detail,
                           List<RateLimitStatus> rateLimits,
                           int requestCount) {

    public static final String UNIT = "cfs";

    public FetchOutcome {
        if ((value == null) == (failureKind == null)) {
            throw new IllegalArgumentException("Outcome must carry either a value or a failure kind");
        }
        rateLimits = rateLimits != null ? List.copyOf(rateLimits) : List.of();
    }

    /**
     * Create a successful outcome.
     *
     * @param value Streamflow in CFS
     * @return Successful outcome
     */
    public static FetchOutcome success(double value) {
        return new FetchOutcome(value, null, null, List.of(), 0);
    }

    /**
     * Create a failed outcome.
     *
     * @param kind   Failure classification
     * @param detail What went wrong
     * @return Failed outcome
     */
    public static FetchOutcome failure(FailureKind kind, String detail) {
        return new FetchOutcome(null, Objects.requireNonNull(kind, "kind"), detail, List.of(), 0);
    }

    /**
     * Copy of this outcome annotated with the attempts that produced it.
     */
    public FetchOutcome withAttempts(List<RateLimitStatus> observedRateLimits, int requests) {
        return new FetchOutcome(value, failureKind, detail, observedRateLimits, requests);
    }

    public boolean isSuccess() {
        return value != null;
    }
}
