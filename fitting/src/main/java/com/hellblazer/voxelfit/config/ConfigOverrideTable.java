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

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Ordered, immutable mapping from model chain keys to configuration payloads.
 *
 * <p>Order matters: among keys of equal length the earlier entry wins, see {@link ModelChainMatcher}.
 *
 * @param <T> the payload type
 * @author hal.hildebrand
 */
public final class ConfigOverrideTable<T> {

    private static final ConfigOverrideTable<?> EMPTY = new ConfigOverrideTable<>(List.of());

    private final List<Entry<T>> entries;

    private ConfigOverrideTable(List<Entry<T>> entries) {
        this.entries = List.copyOf(entries);
    }

    @SuppressWarnings("unchecked")
    public static <T> ConfigOverrideTable<T> empty() {
        return (ConfigOverrideTable<T>) EMPTY;
    }

    public static <T> Builder<T> builder() {
        return new Builder<>();
    }

    public List<Entry<T>> entries() {
        return entries;
    }

    public int size() {
        return entries.size();
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    /**
     * A table with the entries of {@code overrides} placed before the entries of this table, so that they win ties.
     */
    public ConfigOverrideTable<T> overriddenBy(ConfigOverrideTable<T> overrides) {
        if (overrides.isEmpty()) {
            return this;
        }
        var merged = new ArrayList<Entry<T>>(overrides.entries);
        merged.addAll(entries);
        return new ConfigOverrideTable<>(merged);
    }

    @Override
    public String toString() {
        return "ConfigOverrideTable" + entries;
    }

    public record Entry<T>(ChainPattern key, T payload) {
        public Entry {
            Objects.requireNonNull(key, "key cannot be null");
            Objects.requireNonNull(payload, "payload cannot be null");
        }

        @Override
        public String toString() {
            return key + "=" + payload;
        }
    }

    public static final class Builder<T> {
        private final List<Entry<T>> entries = new ArrayList<>();

        private Builder() {
        }

        public Builder<T> add(String pattern, T payload) {
            entries.add(new Entry<>(ChainPattern.of(pattern), payload));
            return this;
        }

        public Builder<T> add(List<String> patterns, T payload) {
            entries.add(new Entry<>(ChainPattern.of(patterns), payload));
            return this;
        }

        public Builder<T> add(ChainPattern key, T payload) {
            entries.add(new Entry<>(key, payload));
            return this;
        }

        public ConfigOverrideTable<T> build() {
            return new ConfigOverrideTable<>(entries);
        }
    }
}
