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

package org.larder.repo.map;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

import java.util.concurrent.TimeUnit;

import org.larder.ConfigurationException;
import org.larder.Row;
import org.larder.TableStore;

import org.larder.capability.ConditionalWriteCapability;

import org.larder.spi.AbstractTableStoreBuilder;

/**
 * Volatile table store implementation, holding the table in memory. Locks
 * used by the store are coarse, much like <i>table locks</i>.
 *
 * <p>
 * The following extra capabilities are supported, unless disabled:
 * <ul>
 * <li>{@link ConditionalWriteCapability}
 * </ul>
 *
 * Example:
 *
 * <pre>
 * MapTableStoreBuilder builder = new MapTableStoreBuilder();
 * builder.setName("pantry");
 * TableStore store = builder.build();
 * </pre>
 */
public class MapTableStoreBuilder extends AbstractTableStoreBuilder {
    /**
     * Convenience method to build a new MapTableStore.
     */
    public static TableStore newTableStore() {
        try {
            return new MapTableStoreBuilder().build();
        } catch (ConfigurationException e) {
            // Not expected.
            throw new RuntimeException(e);
        }
    }

    private String mName = "map";
    private boolean mConditionalWrites = true;
    private int mLockTimeout;
    private TimeUnit mLockTimeoutUnit;
    private final List<Row> mInitialRows;

    public MapTableStoreBuilder() {
        setLockTimeoutMillis(500);
        mInitialRows = new ArrayList<Row>();
    }

    public TableStore build() throws ConfigurationException {
        assertReady();
        return new MapTableStore(this);
    }

    public String getName() {
        return mName;
    }

    public void setName(String name) {
        mName = name;
    }

    /**
     * By default, the store supports conditional row writes. Pass false to
     * restrict it to full-table reads and writes only.
     */
    public void setConditionalWritesEnabled(boolean enabled) {
        mConditionalWrites = enabled;
    }

    public boolean isConditionalWritesEnabled() {
        return mConditionalWrites;
    }

    /**
     * Set the lock timeout, in milliseconds. Default value is 500 milliseconds.
     */
    public void setLockTimeoutMillis(int timeout) {
        setLockTimeout(timeout, TimeUnit.MILLISECONDS);
    }

    /**
     * Set the lock timeout. Default value is 500 milliseconds.
     */
    public void setLockTimeout(int timeout, TimeUnit unit) {
        if (timeout < 0 || unit == null) {
            throw new IllegalArgumentException();
        }
        mLockTimeout = timeout;
        mLockTimeoutUnit = unit;
    }

    /**
     * Returns the lock timeout. Call getLockTimeoutUnit to get the unit.
     */
    public int getLockTimeout() {
        return mLockTimeout;
    }

    /**
     * Returns the lock timeout unit. Call getLockTimeout to get the timeout.
     */
    public TimeUnit getLockTimeoutUnit() {
        return mLockTimeoutUnit;
    }

    /**
     * Adds a row which the store initially contains.
     */
    public void addInitialRow(Row row) {
        if (row == null) {
            throw new IllegalArgumentException("Row cannot be null");
        }
        mInitialRows.add(row);
    }

    /**
     * Returns the rows which the store initially contains.
     */
    public List<Row> getInitialRows() {
        return new ArrayList<Row>(mInitialRows);
    }

    @Override
    public void errorCheck(Collection<String> messages) throws ConfigurationException {
        super.errorCheck(messages);
        if (mLockTimeoutUnit == null) {
            messages.add("lock timeout unit missing");
        }
    }
}
