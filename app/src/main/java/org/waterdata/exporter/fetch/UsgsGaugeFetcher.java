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

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import lombok.extern.slf4j.Slf4j;
import org.waterdata.exporter.common.Constants;
import org.waterdata.exporter.config.ApiConfig;
import org.waterdata.exporter.credential.CredentialPool;
import org.waterdata.exporter.model.Credential;
import org.waterdata.exporter.model.FailureKind;
import org.waterdata.exporter.model.FetchOutcome;
import org.waterdata.exporter.model.GaugeDescriptor;
import org.waterdata.exporter.model.RateLimitStatus;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpHeaders;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.Set;
import java.util.StringJoiner;

/**
 * Fetches the latest discharge of a gauge from the USGS Water Data API.
 *
 * <p><b>Failover:</b> credentials are tried in pool order. Only an authorization-class
 * status moves on to the next credential; a transport error or timeout ends the fetch
 * immediately so a struggling upstream is not hit with repeated requests.
 */
@Slf4j
@ApplicationScoped
public class UsgsGaugeFetcher implements GaugeFetcher {

    private final String apiUrl;
    private final Duration requestTimeout;
    private final Set<Integer> authFailureStatuses;
    private final CredentialPool credentialPool;
    private final LatestValueParser parser;
    private final HttpClient httpClient;

    @Inject
    public UsgsGaugeFetcher(ApiConfig config, CredentialPool credentialPool, LatestValueParser parser) {
        this(config, credentialPool, parser, HttpClient.newBuilder()
                .connectTimeout(config.connectTimeout())
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build());
    }

    UsgsGaugeFetcher(ApiConfig config, CredentialPool credentialPool,
                     LatestValueParser parser, HttpClient httpClient) {
        this.apiUrl = config.url();
        this.requestTimeout = config.requestTimeout();
        this.authFailureStatuses = Set.copyOf(config.authFailureStatuses());
        this.credentialPool = credentialPool;
        this.parser = parser;
        this.httpClient = httpClient;
    }

    @Override
    public FetchOutcome fetch(GaugeDescriptor gauge) {
        URI uri = buildUri(gauge);
        List<RateLimitStatus> rateLimits = new ArrayList<>(credentialPool.size());
        int requests = 0;

        for (Credential credential : credentialPool.ordered()) {
            HttpResponse<String> response;
            requests++;
            try {
                response = httpClient.send(buildRequest(uri, credential), HttpResponse.BodyHandlers.ofString());
            } catch (HttpTimeoutException e) {
                log.warn("Timeout fetching gauge {} with {} key after {}", gauge.id(), credential.label(), requestTimeout);
                return FetchOutcome.failure(FailureKind.TRANSPORT, "timeout after " + requestTimeout)
                        .withAttempts(rateLimits, requests);
            } catch (IOException e) {
                log.warn("Transport error fetching gauge {} with {} key: {}", gauge.id(), credential.label(), e.getMessage());
                return FetchOutcome.failure(FailureKind.TRANSPORT, e.getClass().getSimpleName() + ": " + e.getMessage())
                        .withAttempts(rateLimits, requests);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return FetchOutcome.failure(FailureKind.TRANSPORT, "interrupted")
                        .withAttempts(rateLimits, requests);
            }

            readRateLimit(credential, response.headers()).ifPresent(rateLimits::add);
            int status = response.statusCode();

            if (authFailureStatuses.contains(status)) {
                log.warn("Gauge {}: {} key rejected with HTTP {}", gauge.id(), credential.label(), status);
                continue;
            }
            if (status < 200 || status >= 300) {
                log.warn("Gauge {}: upstream answered HTTP {}", gauge.id(), status);
                return FetchOutcome.failure(FailureKind.TRANSPORT, "HTTP " + status)
                        .withAttempts(rateLimits, requests);
            }

            FetchOutcome outcome = parser.parse(response.body());
            if (!outcome.isSuccess()) {
                log.debug("Gauge {}: {} ({})", gauge.id(), outcome.failureKind(), outcome.detail());
            }
            return outcome.withAttempts(rateLimits, requests);
        }

        log.warn("Gauge {}: all {} credentials rejected", gauge.id(), credentialPool.size());
        return FetchOutcome.failure(FailureKind.AUTH_EXHAUSTED,
                        "all " + credentialPool.size() + " credentials rejected")
                .withAttempts(rateLimits, requests);
    }

    URI buildUri(GaugeDescriptor gauge) {
        StringJoiner query = new StringJoiner("&");
        for (Map.Entry<String, String> param : gauge.queryParameters().entrySet()) {
            query.add(encode(param.getKey()) + "=" + encode(param.getValue()));
        }
        String separator = apiUrl.contains("?") ? "&" : "?";
        return URI.create(apiUrl + separator + query);
    }

    private HttpRequest buildRequest(URI uri, Credential credential) {
        HttpRequest.Builder request = HttpRequest.newBuilder(uri)
                .timeout(requestTimeout)
                .header("Accept", "application/geo+json, application/json")
                .GET();
        if (!credential.isAnonymous()) {
            request.header(Constants.HEADER_API_KEY, credential.key());
        }
        return request.build();
    }

    private Optional<RateLimitStatus> readRateLimit(Credential credential, HttpHeaders headers) {
        OptionalLong limit = longHeader(headers, Constants.HEADER_RATE_LIMIT_LIMIT);
        OptionalLong remaining = longHeader(headers, Constants.HEADER_RATE_LIMIT_REMAINING);
        if (limit.isEmpty() || remaining.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(new RateLimitStatus(credential.label(), limit.getAsLong(), remaining.getAsLong()));
    }

    private static OptionalLong longHeader(HttpHeaders headers, String name) {
        Optional<String> raw = headers.firstValue(name);
        if (raw.isEmpty()) {
            return OptionalLong.empty();
        }
        try {
            return OptionalLong.of(Long.parseLong(raw.get().trim()));
        } catch (NumberFormatException e) {
            log.debug("Ignoring non-numeric {} header: {}", name, raw.get());
            return OptionalLong.empty();
        }
    }

    private static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }
}
