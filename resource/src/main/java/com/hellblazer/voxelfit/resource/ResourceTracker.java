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

package com.hellblazer.voxelfit.resource;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Tracks live resource handles and counts the ones reclaimed without an explicit release.
 */
public class ResourceTracker {
    private final Map<String, String> active    = new ConcurrentHashMap<>();
    private final AtomicLong          leaks     = new AtomicLong();
    private final AtomicLong          allocated = new AtomicLong();

    void register(String id, String description) {
        active.put(id, description == null ? "" : description);
        allocated.incrementAndGet();
    }

    void unregister(String id) {
        active.remove(id);
    }

    void recordLeak(String id) {
        leaks.incrementAndGet();
    }

    public int getActiveCount() {
        return active.size();
    }

    public long getLeakCount() {
        return leaks.get();
    }

    public long getTotalAllocated() {
        return allocated.get();
    }

    public boolean isActive(String id) {
        return active.containsKey(id);
    }

    /**
     * Snapshot of the live handles, id to description.
     */
    public Map<String, String> getActive() {
        return Map.copyOf(active);
    }
}
