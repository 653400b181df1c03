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

import com.hellblazer.voxelfit.ConfigurationException;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;
import java.util.stream.Collectors;

/**
 * Key of a {@link ConfigOverrideTable}: either a single model name pattern or a tuple of patterns, one per element
 * of a model chain.
 *
 * <p>Patterns match at the start of a name, like {@link java.util.regex.Matcher#lookingAt()}; anchor with
 * {@code ^...$} to match whole names.
 *
 * @author hal.hildebrand
 */
public final class ChainPattern {

    private final List<Pattern> patterns;
    private final boolean       tuple;

    private ChainPattern(List<Pattern> patterns, boolean tuple) {
        this.patterns = patterns;
        this.tuple = tuple;
    }

    /**
     * A single pattern key.
     *
     * @throws ConfigurationException if the pattern is null or not a valid regular expression
     */
    public static ChainPattern of(String pattern) {
        return new ChainPattern(List.of(compile(pattern)), false);
    }

    /**
     * A tuple key, matching chains element by element.
     *
     * @throws ConfigurationException if the tuple is empty or holds an invalid pattern
     */
    public static ChainPattern of(List<String> patterns) {
        if (patterns == null || patterns.isEmpty()) {
            throw new ConfigurationException("A model chain key needs at least one pattern");
        }
        var compiled = new ArrayList<Pattern>(patterns.size());
        for (var p : patterns) {
            compiled.add(compile(p));
        }
        return new ChainPattern(List.copyOf(compiled), true);
    }

    private static Pattern compile(String pattern) {
        if (pattern == null) {
            throw new ConfigurationException("A model name pattern cannot be null");
        }
        try {
            return Pattern.compile(pattern);
        } catch (PatternSyntaxException e) {
            throw new ConfigurationException("Invalid model name pattern: " + pattern, e);
        }
    }

    public int length() {
        return patterns.size();
    }

    public boolean isTuple() {
        return tuple;
    }

    /**
     * True if the chain has exactly this key's length and every element matches its pattern.
     */
    public boolean matches(List<String> chain) {
        return matches(chain, 0);
    }

    /**
     * True if {@code chain} matches the patterns of this key from index {@code from} on.
     */
    boolean matches(List<String> chain, int from) {
        if (chain.size() != patterns.size() - from) {
            return false;
        }
        for (int i = from; i < patterns.size(); i++) {
            if (!patterns.get(i).matcher(chain.get(i - from)).lookingAt()) {
                return false;
            }
        }
        return true;
    }

    @Override
    public String toString() {
        var text = patterns.stream().map(Pattern::pattern).collect(Collectors.toList());
        return tuple ? text.toString() : text.get(0);
    }
}
