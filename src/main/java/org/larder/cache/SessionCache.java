/*
 * Copyright 2006 Amazon Technologies, Inc. or its affiliates.
 * Amazon, Amazon.com and Carbonado are trademarks or registered trademarks
 * of Amazon Technologies, Inc. or its affiliates.  All rights reserved.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.larder.cache;

import java.util.ArrayList;
import java.util.List;

import org.joda.time.DateTimeUtils;

import org.larder.InventoryItem;
import org.larder.StoreUnavailableException;

/**
 * Read-through cache holding a single snapshot of the entire inventory, for
 * one session. There is no per-item entry; any invalidation discards the
 * whole snapshot. An inventory invalidates its cache after every successful
 * mutation, and it never consults the cache when verifying a version.
 *
 * <p>A snapshot also expires once it is older than the time-to-live, which
 * bounds how stale a display may become when other sessions write to the
 * same store. Time is measured by {@link DateTimeUtils#currentTimeMillis}.
 *
 * <p>SessionCache instances are thread-safe.
 */
public class SessionCache {
    /** Default time-to-live of a snapshot: ten minutes */
    public static final long DEFAULT_TTL_MILLIS = 600000L;

    /**
     * Loads a fresh snapshot when the cache has none.
     */
    public static interface Loader {
        List<InventoryItem> load() throws StoreUnavailableException;
    }

    private final long mTtlMillis;

    private List<InventoryItem> mSnapshot;
    private long mLoadedAt;

    private int mLoadCount;
    private int mInvalidateCount;

    public SessionCache() {
        this(DEFAULT_TTL_MILLIS);
    }

    /**
     * @param ttlMillis snapshot time-to-live, or zero for no expiry
     * @throws IllegalArgumentException if ttl is negative
     */
    public SessionCache(long ttlMillis) {
        if (ttlMillis < 0) {
            throw new IllegalArgumentException("Negative time-to-live: " + ttlMillis);
        }
        mTtlMillis = ttlMillis;
    }

    /**
     * Returns a copy of the cached snapshot, loading one first if none is
     * held or if it has expired. If loading fails, the cache is left empty.
     *
     * @param loader loads a fresh snapshot from the store
     */
    public synchronized List<InventoryItem> get(Loader loader) throws StoreUnavailableException {
        if (mSnapshot == null || isExpired()) {
            mSnapshot = null;
            List<InventoryItem> snapshot = loader.load();
            mSnapshot = copy(snapshot);
            mLoadedAt = DateTimeUtils.currentTimeMillis();
            mLoadCount++;
        }
        return copy(mSnapshot);
    }

    /**
     * Discards the snapshot, forcing the next read to go to the store.
     */
    public synchronized void invalidate() {
        mSnapshot = null;
        mInvalidateCount++;
    }

    /**
     * Returns true if a snapshot is held and it hasn't expired.
     */
    public synchronized boolean isLoaded() {
        return mSnapshot != null && !isExpired();
    }

    public long getTimeToLiveMillis() {
        return mTtlMillis;
    }

    /**
     * Returns the number of times a snapshot was loaded from the store.
     */
    public synchronized int getLoadCount() {
        return mLoadCount;
    }

    /**
     * Returns the number of times the cache was invalidated.
     */
    public synchronized int getInvalidateCount() {
        return mInvalidateCount;
    }

    // Caller must be synchronized.
    private boolean isExpired() {
        return mTtlMillis > 0 && DateTimeUtils.currentTimeMillis() - mLoadedAt >= mTtlMillis;
    }

    private static List<InventoryItem> copy(List<InventoryItem> items) {
        List<InventoryItem> copy = new ArrayList<InventoryItem>(items.size());
        for (InventoryItem item : items) {
            copy.add(item.copy());
        }
        return copy;
    }
}
