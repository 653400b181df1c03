/**
 * Copyright (C) 2026 Hal Hildebrand. All rights reserved.
 *
 * This file is part of VoxelFit.
 *
 * This program is free software: you can redistribute it and/or modify it under the terms of the GNU Affero General
 * Public License as published by the Free Software Foundation, either version 3 of the License, or (at your option) any
 * later version.
 *
 * This program is distributed in the hope that it will be useful, but WITHOUT ANY WARRANTY; without even the implied
 * warranty of MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE. See the GNU Affero General Public License for more
 * details.
 *
 * You should have received a copy of the GNU Affero General Public License along with this program. If not, see
 * <http://www.gnu.org/licenses/>.
 */

package com.hellblazer.voxelfit.config;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.hellblazer.voxelfit.ConfigurationException;
import com.hellblazer.voxelfit.balancing.DeviceDescriptor;
import com.hellblazer.voxelfit.data.ProtocolSelection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;

/**
 * Loads {@link FittingConfiguration} from YAML.
 *
 * <p>Configuration is layered, later layers overriding earlier ones:
 * <ol>
 * <li>the built-in defaults, {@code /voxelfit-defaults.yaml} on the classpath</li>
 * <li>the user file {@code ~/.voxelfit/voxelfit.yaml}, if present</li>
 * <li>any explicitly given file or string</li>
 * </ol>
 * Within a layer, general values replace those of the layer below, and model specific entries are placed in front
 * of the entries below so that they win ties.
 *
 * @author hal.hildebrand
 */
public class ConfigurationLoader {
    private static final Logger log = LoggerFactory.getLogger(ConfigurationLoader.class);

    public static final String DEFAULTS_RESOURCE = "/voxelfit-defaults.yaml";

    private static final Set<String>                  SECTIONS = Set.of("optimization", "processing_strategies",
                                                                        "model_protocol_options", "devices");
    private static final TypeReference<Map<String, Object>> OPTIONS  = new TypeReference<>() {
    };

    private final ObjectMapper objectMapper;
    private final Path         userFile;

    public ConfigurationLoader() {
        this(Path.of(System.getProperty("user.home"), ".voxelfit", "voxelfit.yaml"));
    }

    /**
     * @param userFile the user configuration file, consulted if it exists
     */
    public ConfigurationLoader(Path userFile) {
        this.objectMapper = new ObjectMapper(new YAMLFactory());
        this.userFile = userFile;
    }

    /**
     * The built-in defaults overridden by the user file.
     */
    public FittingConfiguration load() {
        var config = FittingConfiguration.defaultConfig();
        try (InputStream is = ConfigurationLoader.class.getResourceAsStream(DEFAULTS_RESOURCE)) {
            if (is == null) {
                log.warn("Built-in configuration {} not found, using compiled defaults", DEFAULTS_RESOURCE);
            } else {
                config = apply(config, objectMapper.readTree(is));
                log.debug("Loaded built-in configuration");
            }
        } catch (IOException e) {
            throw new ConfigurationException("Cannot read built-in configuration " + DEFAULTS_RESOURCE, e);
        }
        if (userFile != null && Files.isRegularFile(userFile)) {
            config = apply(config, userFile);
            log.info("Loaded user configuration from {}", userFile);
        }
        return config;
    }

    /**
     * The built-in and user configuration, overridden by {@code file}.
     */
    public FittingConfiguration load(Path file) {
        return apply(load(), file);
    }

    public FittingConfiguration apply(FittingConfiguration base, Path file) {
        try {
            return apply(base, objectMapper.readTree(file.toFile()));
        } catch (IOException e) {
            throw new ConfigurationException("Cannot read configuration file " + file, e);
        }
    }

    public FittingConfiguration apply(FittingConfiguration base, String yaml) {
        try {
            return apply(base, objectMapper.readTree(yaml));
        } catch (JsonProcessingException e) {
            throw new ConfigurationException("Invalid configuration: " + e.getOriginalMessage(), e);
        }
    }

    FittingConfiguration apply(FittingConfiguration base, JsonNode root) {
        if (root == null || root.isMissingNode() || root.isNull()) {
            return base;
        }
        if (!root.isObject()) {
            throw new ConfigurationException("Configuration must be a mapping of sections");
        }
        var config = base;
        var sections = root.fieldNames();
        while (sections.hasNext()) {
            var section = sections.next();
            if (!SECTIONS.contains(section)) {
                throw new ConfigurationException("Unknown configuration section: " + section);
            }
        }
        if (root.has("optimization")) {
            config = applyOptimization(config, root.get("optimization"));
        }
        if (root.has("processing_strategies")) {
            config = applyProcessingStrategies(config, root.get("processing_strategies"));
        }
        if (root.has("model_protocol_options")) {
            config = config.withProtocolOptions(
            modelSpecific(root.get("model_protocol_options"), this::protocolSelection));
        }
        if (root.has("devices")) {
            config = config.withDevices(devices(root.get("devices")));
        }
        return config;
    }

    private FittingConfiguration applyOptimization(FittingConfiguration config, JsonNode node) {
        var general = node.path("general");
        if (general.has("optimizers")) {
            config = config.withOptimizers(optimizers(general.get("optimizers")));
        }
        if (general.has("extra_optim_runs")) {
            try {
                config = config.withExtraOptimRuns(general.get("extra_optim_runs").asInt());
            } catch (IllegalArgumentException e) {
                throw new ConfigurationException("Invalid extra_optim_runs: " + e.getMessage(), e);
            }
        }
        if (node.has("model_specific")) {
            config = config.withOptimizerOverrides(
            modelSpecific(node.get("model_specific"), entry -> optimizers(entry.path("optimizers"))));
        }
        return config;
    }

    private FittingConfiguration applyProcessingStrategies(FittingConfiguration config, JsonNode node) {
        var names = node.fieldNames();
        while (names.hasNext()) {
            var name = names.next();
            if (!"optimization".equals(name)) {
                throw new ConfigurationException("Unknown processing strategy type: " + name);
            }
        }
        var optimization = node.path("optimization");
        if (optimization.has("general")) {
            config = config.withStrategy(strategy(optimization.get("general")));
        }
        if (optimization.has("model_specific")) {
            config = config.withStrategyOverrides(modelSpecific(optimization.get("model_specific"), this::strategy));
        }
        return config;
    }

    private <T> ConfigOverrideTable<T> modelSpecific(JsonNode node, Function<JsonNode, T> payload) {
        var builder = ConfigOverrideTable.<T>builder();
        if (node == null || node.isNull()) {
            return builder.build();
        }
        if (!node.isArray()) {
            throw new ConfigurationException("Model specific settings must be a list of entries with a 'match' key");
        }
        for (var entry : node) {
            var match = entry.get("match");
            if (match == null || match.isNull()) {
                throw new ConfigurationException("Model specific entry without 'match': " + entry);
            }
            if (match.isArray()) {
                var patterns = new ArrayList<String>();
                match.forEach(p -> patterns.add(p.isNull() ? null : p.asText()));
                builder.add(patterns, payload.apply(entry));
            } else {
                builder.add(match.asText(), payload.apply(entry));
            }
        }
        return builder.build();
    }

    private List<OptimizerSettings> optimizers(JsonNode node) {
        if (!node.isArray() || node.isEmpty()) {
            throw new ConfigurationException("'optimizers' must be a non-empty list");
        }
        var optimizers = new ArrayList<OptimizerSettings>();
        for (var optimizer : node) {
            var name = required(optimizer, "name", "optimizer");
            int patience = optimizer.path("patience").asInt(OptimizerSettings.DEFAULT_PATIENCE);
            try {
                optimizers.add(new OptimizerSettings(name, patience, options(optimizer.get("options"))));
            } catch (IllegalArgumentException e) {
                throw new ConfigurationException("Invalid optimizer " + name + ": " + e.getMessage(), e);
            }
        }
        return optimizers;
    }

    private StrategySettings strategy(JsonNode node) {
        return new StrategySettings(required(node, "name", "processing strategy"), options(node.get("options")));
    }

    private ProtocolSelection protocolSelection(JsonNode node) {
        var ranges = new ArrayList<ProtocolSelection.BValueRange>();
        for (var range : node.path("b_value_ranges")) {
            if (!range.isArray() || range.size() != 2) {
                throw new ConfigurationException("A b value range must be a [start, end] pair: " + range);
            }
            try {
                ranges.add(new ProtocolSelection.BValueRange(range.get(0).asDouble(), range.get(1).asDouble()));
            } catch (IllegalArgumentException e) {
                throw new ConfigurationException(e.getMessage(), e);
            }
        }
        return new ProtocolSelection(node.path("use_weighted").asBoolean(true),
                                     node.path("use_unweighted").asBoolean(true), ranges);
    }

    private List<DeviceDescriptor> devices(JsonNode node) {
        if (!node.isArray()) {
            throw new ConfigurationException("'devices' must be a list");
        }
        var devices = new ArrayList<DeviceDescriptor>();
        for (var device : node) {
            var name = required(device, "name", "device");
            try {
                devices.add(new DeviceDescriptor(devices.size(), name, device.path("weight").asDouble(1.0),
                                                 device.path("memory_bytes")
                                                       .asLong(DeviceDescriptor.DEFAULT_MEMORY_BYTES)));
            } catch (IllegalArgumentException e) {
                throw new ConfigurationException("Invalid device " + name + ": " + e.getMessage(), e);
            }
        }
        return devices;
    }

    private Map<String, Object> options(JsonNode node) {
        if (node == null || node.isNull()) {
            return Map.of();
        }
        if (!node.isObject()) {
            throw new ConfigurationException("Options must be a mapping: " + node);
        }
        var fields = node.fields();
        while (fields.hasNext()) {
            var field = fields.next();
            if (field.getValue().isNull()) {
                throw new ConfigurationException("Option " + field.getKey() + " has no value");
            }
        }
        return objectMapper.convertValue(node, OPTIONS);
    }

    private static String required(JsonNode node, String field, String what) {
        var value = node.get(field);
        if (value == null || value.isNull() || value.asText().isBlank()) {
            throw new ConfigurationException(String.format("Every %s needs a '%s': %s", what, field, node));
        }
        return value.asText();
    }
}
