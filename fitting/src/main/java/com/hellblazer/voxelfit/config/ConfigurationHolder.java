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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.UnaryOperator;

/**
 * Holds the configuration of one fitting session.
 *
 * <p>The held value is only replaced inside an {@link #override} scope, which restores the previous value when
 * closed, however the scope is left. Scopes nest and must be closed in reverse order of opening, which
 * try-with-resources guarantees.
 *
 * <pre>{@code
 * try (var scope = holder.override("processing_strategies: ...")) {
 *     fit.run();
 * }
 * }</pre>
 *
 * @author hal.hildebrand
 */
public class ConfigurationHolder {
    private static final Logger log = LoggerFactory.getLogger(ConfigurationHolder.class);

    private final AtomicReference<FittingConfiguration> current;
    private final ConfigurationLoader                   loader;

    public ConfigurationHolder(FittingConfiguration initial) {
        this(initial, new ConfigurationLoader());
    }

    public ConfigurationHolder(FittingConfiguration initial, ConfigurationLoader loader) {
        this.current = new AtomicReference<>(Objects.requireNonNull(initial, "initial cannot be null"));
        this.loader = Objects.requireNonNull(loader, "loader cannot be null");
    }

    public FittingConfiguration get() {
        return current.get();
    }

    /**
     * Install the current configuration with the YAML applied on top, until the scope closes.
     *
     * @throws com.hellblazer.voxelfit.ConfigurationException if the YAML is invalid; nothing is installed then
     */
    public Scope override(String yaml) {
        return override(config -> loader.apply(config, yaml));
    }

    /**
     * Install a configuration derived from the current one, until the scope closes.
     */
    public Scope override(UnaryOperator<FittingConfiguration> change) {
        var snapshot = current.get();
        var derived = Objects.requireNonNull(change.apply(snapshot), "derived configuration cannot be null");
        current.set(derived);
        log.debug("Configuration overridden: {}", derived);
        return new Scope(snapshot);
    }

    /**
     * An active override. Closing restores the configuration in place when the override was opened; only the first
     * close has an effect.
     */
    public final class Scope implements AutoCloseable {
        private final FittingConfiguration snapshot;
        private final AtomicBoolean        closed = new AtomicBoolean();

        private Scope(FittingConfiguration snapshot) {
            this.snapshot = snapshot;
        }

        @Override
        public void close() {
            if (closed.compareAndSet(false, true)) {
                current.set(snapshot);
                log.debug("Configuration restored");
            }
        }
    }
}
