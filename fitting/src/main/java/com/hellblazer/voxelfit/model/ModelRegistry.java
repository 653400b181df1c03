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

package com.hellblazer.voxelfit.model;

import com.hellblazer.voxelfit.ConfigurationException;
import com.hellblazer.voxelfit.model.standard.AdcCascade;
import com.hellblazer.voxelfit.model.standard.AdcModel;
import com.hellblazer.voxelfit.model.standard.S0Model;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * Models and cascades by name. Every lookup builds a fresh instance.
 *
 * @author hal.hildebrand
 */
public class ModelRegistry {
    private static final Logger log = LoggerFactory.getLogger(ModelRegistry.class);

    private final Map<String, Supplier<? extends Fittable>> factories = new ConcurrentHashMap<>();

    /**
     * A registry holding the standard models.
     */
    public static ModelRegistry standard() {
        var registry = new ModelRegistry();
        registry.register(S0Model.NAME, S0Model::new);
        registry.register(AdcModel.NAME, AdcModel::new);
        registry.register(AdcCascade.NAME, AdcCascade::create);
        return registry;
    }

    public ModelRegistry register(String name, Supplier<? extends Fittable> factory) {
        Objects.requireNonNull(name, "name cannot be null");
        Objects.requireNonNull(factory, "factory cannot be null");
        if (factories.put(name, factory) != null) {
            log.info("Replaced model registration {}", name);
        }
        return this;
    }

    /**
     * @throws ConfigurationException if no model of that name is registered
     */
    public Fittable get(String name) {
        var factory = factories.get(name);
        if (factory == null) {
            throw new ConfigurationException("Unknown model: " + name);
        }
        return factory.get();
    }

    public boolean contains(String name) {
        return factories.containsKey(name);
    }

    public List<String> names() {
        return factories.keySet().stream().sorted().toList();
    }
}
