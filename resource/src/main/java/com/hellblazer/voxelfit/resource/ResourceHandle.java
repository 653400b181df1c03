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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.ref.Cleaner;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

/**
 * Scoped owner of a single native or device-side resource.
 *
 * <p>The resource is released exactly once: either by an explicit {@link #close()} (the normal path, usually via
 * try-with-resources) or, if the owner is discarded while still open, by a {@link Cleaner} that also reports the
 * leak to the {@link ResourceTracker}. The release action must not reference the handle itself.
 *
 * @param <T> the type of the wrapped resource
 * @author hal.hildebrand
 */
public abstract class ResourceHandle<T> implements AutoCloseable {
    private static final Logger  log     = LoggerFactory.getLogger(ResourceHandle.class);
    private static final Cleaner CLEANER = Cleaner.create();

    private final String            id;
    private final long              createdNanos;
    private final T                 resource;
    private final Release<T>        release;
    private final Cleaner.Cleanable cleanable;

    protected ResourceHandle(T resource, String description, ResourceTracker tracker, Consumer<T> releaser) {
        this.resource = Objects.requireNonNull(resource, "resource cannot be null");
        Objects.requireNonNull(tracker, "tracker cannot be null");
        Objects.requireNonNull(releaser, "releaser cannot be null");
        this.id = UUID.randomUUID().toString();
        this.createdNanos = System.nanoTime();
        this.release = new Release<>(id, description, resource, tracker, releaser);
        tracker.register(id, description);
        this.cleanable = CLEANER.register(this, release);
    }

    /**
     * Get the wrapped resource.
     *
     * @throws IllegalStateException if the handle has been closed
     */
    public T get() {
        if (!isValid()) {
            throw new IllegalStateException("Resource " + id + " has been released");
        }
        return resource;
    }

    public String getId() {
        return id;
    }

    public String getDescription() {
        return release.description;
    }

    public long getAgeMillis() {
        return (System.nanoTime() - createdNanos) / 1_000_000L;
    }

    public boolean isValid() {
        return !release.released.get();
    }

    /**
     * Release the resource. Subsequent calls are no-ops.
     */
    @Override
    public void close() {
        release.explicit = true;
        cleanable.clean();
    }

    private static final class Release<T> implements Runnable {
        private final String          id;
        private final String          description;
        private final T               resource;
        private final ResourceTracker tracker;
        private final Consumer<T>     releaser;
        private final AtomicBoolean   released = new AtomicBoolean();
        private volatile boolean      explicit;

        private Release(String id, String description, T resource, ResourceTracker tracker, Consumer<T> releaser) {
            this.id = id;
            this.description = description;
            this.resource = resource;
            this.tracker = tracker;
            this.releaser = releaser;
        }

        @Override
        public void run() {
            if (!released.compareAndSet(false, true)) {
                return;
            }
            if (!explicit) {
                log.warn("Resource {} ({}) was not released by its owner, reclaiming", id, description);
                tracker.recordLeak(id);
            }
            try {
                releaser.accept(resource);
            } finally {
                tracker.unregister(id);
            }
        }
    }
}
