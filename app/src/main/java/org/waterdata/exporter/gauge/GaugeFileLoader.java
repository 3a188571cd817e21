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
package org.waterdata.exporter.gauge;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import lombok.extern.slf4j.Slf4j;
import org.waterdata.exporter.config.GaugesConfig;
import org.waterdata.exporter.model.GaugeDescriptor;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads the YAML gauge list.
 *
 * <p>Expected format:
 * <pre>{@code
 * - id: "01646500"
 *   name: Potomac River near Washington DC
 *   friendly_name: Little Falls
 * - id: "01638500"
 *   parameter_code: "00065"
 * }</pre>
 *
 * <p>Site codes should be quoted, otherwise YAML reads them as numbers and
 * leading zeros are lost.
 */
@Slf4j
@ApplicationScoped
public class GaugeFileLoader {

    private static final String FIELD_ID = "id";
    private static final String FIELD_NAME = "name";
    private static final String FIELD_FRIENDLY_NAME = "friendly_name";
    private static final String FIELD_PARAMETER_CODE = "parameter_code";
    private static final String FIELD_STATISTIC_ID = "statistic_id";

    private final ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory());
    private final GaugesConfig config;

    @Inject
    public GaugeFileLoader(GaugesConfig config) {
        this.config = config;
    }

    /**
     * Load the gauge file configured in {@code usgs.gauges.file}.
     *
     * @return Registry of configured gauges
     * @throws GaugeConfigurationException If the file is missing or invalid
     */
    public GaugeRegistry load() {
        return load(Path.of(config.file()));
    }

    /**
     * Load a gauge file.
     *
     * @param file YAML file holding a list of gauges
     * @return Registry of configured gauges
     * @throws GaugeConfigurationException If the file is missing or invalid
     */
    public GaugeRegistry load(Path file) {
        if (!Files.isRegularFile(file)) {
            throw new GaugeConfigurationException("Gauge file not found: " + file);
        }

        JsonNode root;
        try {
            root = yamlMapper.readTree(file.toFile());
        } catch (JsonProcessingException e) {
            throw new GaugeConfigurationException("Gauge file is not valid YAML: " + file, e);
        } catch (IOException e) {
            throw new GaugeConfigurationException("Cannot read gauge file: " + file, e);
        }

        if (root == null || !root.isArray()) {
            throw new GaugeConfigurationException("Gauge file must contain a list of gauges: " + file);
        }

        List<GaugeDescriptor> gauges = new ArrayList<>(root.size());
        for (JsonNode entry : root) {
            gauges.add(toDescriptor(entry));
        }

        GaugeRegistry registry = new GaugeRegistry(gauges);
        log.info("Loaded {} gauges from {}", registry.size(), file);
        return registry;
    }

    private GaugeDescriptor toDescriptor(JsonNode entry) {
        if (!entry.isObject() || !entry.hasNonNull(FIELD_ID)) {
            throw new GaugeConfigurationException("Malformed gauge entry: " + entry);
        }
        JsonNode idNode = entry.get(FIELD_ID);
        if (!idNode.isTextual()) {
            log.warn("Gauge id {} is not quoted in the gauge file, leading zeros may have been lost", idNode);
        }
        String id = idNode.asText().trim();
        if (id.isEmpty()) {
            throw new GaugeConfigurationException("Gauge id must not be blank: " + entry);
        }

        return GaugeDescriptor.of(
                id,
                text(entry, FIELD_NAME, null),
                text(entry, FIELD_FRIENDLY_NAME, null),
                config.agency(),
                text(entry, FIELD_PARAMETER_CODE, config.parameterCode()),
                text(entry, FIELD_STATISTIC_ID, config.statisticId())
        );
    }

    private static String text(JsonNode entry, String field, String defaultValue) {
        JsonNode node = entry.get(field);
        if (node == null || node.isNull() || node.asText().isBlank()) {
            return defaultValue;
        }
        return node.asText();
    }
}
