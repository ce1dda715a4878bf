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

package org.larder.engine;

import java.util.ArrayList;
import java.util.Collection;

import org.joda.time.DateTimeZone;

import org.larder.ConfigurationException;
import org.larder.Inventory;
import org.larder.StoreUnavailableException;
import org.larder.TableStore;
import org.larder.TableStoreBuilder;

import org.larder.cache.SessionCache;

import org.larder.layout.RowLayout;

import org.larder.spi.AbstractTableStoreBuilder;

/**
 * Builds an {@link OptimisticInventory}, which represents one session against
 * a table store. Either an open store or a store builder must be provided.
 * Sessions which must observe each other's writes need to share a store
 * instance, or open stores which address the same backing table.
 *
 * Example:
 *
 * <pre>
 * InventoryBuilder builder = new InventoryBuilder();
 * builder.setTableStoreBuilder(new JsonFileTableStoreBuilder(...));
 * builder.setCacheTimeToLiveMillis(60000);
 * Inventory inventory = builder.build();
 * </pre>
 */
public class InventoryBuilder {
    private TableStore mStore;
    private TableStoreBuilder mStoreBuilder;
    private boolean mCacheEnabled = true;
    private long mCacheTtlMillis = SessionCache.DEFAULT_TTL_MILLIS;
    private String mTimeZone;

    public InventoryBuilder() {
    }

    public Inventory build() throws ConfigurationException, StoreUnavailableException {
        assertReady();

        TableStore store = mStore;
        if (store == null) {
            store = mStoreBuilder.build();
        }

        SessionCache cache = mCacheEnabled ? new SessionCache(mCacheTtlMillis) : null;

        DateTimeZone zone = mTimeZone == null ? DateTimeZone.getDefault()
            : DateTimeZone.forID(mTimeZone);

        return new OptimisticInventory(store, cache, new RowLayout(), zone);
    }

    /**
     * Set an already open store, which may be shared with other sessions.
     */
    public void setTableStore(TableStore store) {
        mStore = store;
    }

    public TableStore getTableStore() {
        return mStore;
    }

    /**
     * Set a builder which opens a store dedicated to the new session.
     */
    public void setTableStoreBuilder(TableStoreBuilder builder) {
        mStoreBuilder = builder;
    }

    public TableStoreBuilder getTableStoreBuilder() {
        return mStoreBuilder;
    }

    /**
     * By default, the session caches a snapshot for display reads. Pass false
     * to read the store every time.
     */
    public void setCacheEnabled(boolean enabled) {
        mCacheEnabled = enabled;
    }

    public boolean isCacheEnabled() {
        return mCacheEnabled;
    }

    /**
     * Set the time-to-live of cached snapshots, in milliseconds. Zero means
     * snapshots never expire, and are only discarded by mutations. Default is
     * ten minutes.
     */
    public void setCacheTimeToLiveMillis(long millis) {
        mCacheTtlMillis = millis;
    }

    public long getCacheTimeToLiveMillis() {
        return mCacheTtlMillis;
    }

    /**
     * Set the time zone used to stamp modification dates, as a Joda-Time zone
     * id such as "UTC" or "America/Chicago". Default is the system zone.
     */
    public void setTimeZone(String zoneId) {
        mTimeZone = zoneId;
    }

    public String getTimeZone() {
        return mTimeZone;
    }

    /**
     * Throw a configuration exception if the configuration is not filled out
     * sufficiently and correctly such that an inventory could be built.
     */
    public final void assertReady() throws ConfigurationException {
        ArrayList<String> messages = new ArrayList<String>();
        errorCheck(messages);
        AbstractTableStoreBuilder.throwIfAny(messages);
    }

    public void errorCheck(Collection<String> messages) throws ConfigurationException {
        if (mStore == null && mStoreBuilder == null) {
            messages.add("Table store or table store builder must be set");
        } else if (mStore != null && mStoreBuilder != null) {
            messages.add("Only one of table store or table store builder may be set");
        }
        if (mCacheTtlMillis < 0) {
            messages.add("cache time-to-live cannot be negative: " + mCacheTtlMillis);
        }
        if (mTimeZone != null) {
            try {
                DateTimeZone.forID(mTimeZone);
            } catch (IllegalArgumentException e) {
                messages.add("unknown time zone: " + mTimeZone);
            }
        }
    }
}
