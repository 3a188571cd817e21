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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.waterdata.exporter.model.FailureKind;
import org.waterdata.exporter.model.FetchOutcome;

/**
 * Extracts the latest observation from a latest-continuous GeoJSON response.
 *
 * <p>The value is read from {@code features[0].properties.value}. The API returns it
 * as a string; plain numbers and objects nesting a {@code value} field are accepted too.
 */
@ApplicationScoped
public class LatestValueParser {

    private final ObjectMapper objectMapper;

    @Inject
    public LatestValueParser(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * Parse a response body.
     *
     * @param body Response body
     * @return Success with the value, {@code NO_DATA} when the response holds no
     * current reading, {@code PARSE_ERROR} when it is malformed
     */
    public FetchOutcome parse(String body) {
        if (body == null || body.isBlank()) {
            return FetchOutcome.failure(FailureKind.PARSE_ERROR, "empty response body");
        }

        JsonNode root;
        try {
            root = objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            return FetchOutcome.failure(FailureKind.PARSE_ERROR, "invalid JSON: " + e.getOriginalMessage());
        }

        if (root == null || !root.isObject()) {
            return FetchOutcome.failure(FailureKind.PARSE_ERROR, "response is not a JSON object");
        }

        JsonNode features = root.get("features");
        if (features == null || features.isNull()) {
            return FetchOutcome.failure(FailureKind.NO_DATA, "response has no features");
        }
        if (!features.isArray()) {
            return FetchOutcome.failure(FailureKind.PARSE_ERROR, "features is not an array");
        }
        if (features.isEmpty()) {
            return FetchOutcome.failure(FailureKind.NO_DATA, "no recent observation");
        }

        JsonNode feature = features.get(0);
        if (!feature.isObject()) {
            return FetchOutcome.failure(FailureKind.PARSE_ERROR, "feature is not an object");
        }
        JsonNode properties = feature.path("properties");
        if (properties.isMissingNode() || properties.isNull()) {
            return FetchOutcome.failure(FailureKind.NO_DATA, "feature has no properties");
        }
        if (!properties.isObject()) {
            return FetchOutcome.failure(FailureKind.PARSE_ERROR, "feature properties is not an object");
        }

        JsonNode value = properties.path("value");
        if (value.isObject()) {
            value = value.path("value");
        }
        return toOutcome(value);
    }

    private FetchOutcome toOutcome(JsonNode value) {
        if (value.isMissingNode() || value.isNull()
                || (value.isTextual() && value.asText().isBlank())) {
            return FetchOutcome.failure(FailureKind.NO_DATA, "observation has no value");
        }

        double parsed;
        if (value.isNumber()) {
            parsed = value.doubleValue();
        } else if (value.isTextual()) {
            try {
                parsed = Double.parseDouble(value.asText().trim());
            } catch (NumberFormatException e) {
                return FetchOutcome.failure(FailureKind.PARSE_ERROR, "value is not numeric: " + value.asText());
            }
        } else {
            return FetchOutcome.failure(FailureKind.PARSE_ERROR, "unexpected value type: " + value.getNodeType());
        }

        if (!Double.isFinite(parsed)) {
            return FetchOutcome.failure(FailureKind.PARSE_ERROR, "value is not finite: " + parsed);
        }
        return FetchOutcome.success(parsed);
    }
}
