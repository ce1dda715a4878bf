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
import java.util.Iterator;
import java.util.List;

import java.util.concurrent.TimeUnit;

import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

import org.larder.Column;
import org.larder.Row;
import org.larder.StoreRejectedException;
import org.larder.StoreUnavailableException;
import org.larder.TableStore;

import org.larder.capability.Capability;
import org.larder.capability.ConditionalWriteCapability;

import org.larder.layout.VersionRegistry;

import org.larder.spi.RowSchema;

/**
 * Volatile table store backed by a list of rows. Locks used by the store are
 * coarse, much like <i>table locks</i>. Reads acquire the read lock, and
 * writes acquire the write lock. A lock which cannot be acquired within the
 * configured timeout causes the call to fail with a {@link
 * StoreUnavailableException}, standing in for a transport timeout.
 *
 * <p>A single instance can be shared by any number of inventories, each
 * acting as an independent session against the same table.
 *
 * @see MapTableStoreBuilder
 */
class MapTableStore implements TableStore, ConditionalWriteCapability {
    private final String mName;
    private final boolean mConditionalWrites;
    private final long mLockTimeout;
    private final TimeUnit mLockTimeoutUnit;

    private final ReadWriteLock mLock;
    private final List<Row> mRows;

    private volatile boolean mClosed;

    MapTableStore(MapTableStoreBuilder builder) {
        mName = builder.getName();
        mConditionalWrites = builder.isConditionalWritesEnabled();
        mLockTimeout = builder.getLockTimeout();
        mLockTimeoutUnit = builder.getLockTimeoutUnit();
        mLock = new ReentrantReadWriteLock(true);
        mRows = new ArrayList<Row>();
        for (Row row : builder.getInitialRows()) {
            mRows.add(new Row(row));
        }
    }

    public String getName() {
        return mName;
    }

    public List<Row> readAll() throws StoreUnavailableException {
        Lock lock = lock(mLock.readLock());
        try {
            return copy(mRows);
        } finally {
            lock.unlock();
        }
    }

    public void writeAll(List<Row> rows) throws StoreUnavailableException, StoreRejectedException {
        RowSchema.check(rows);
        List<Row> copy = copy(rows);
        Lock lock = lock(mLock.writeLock());
        try {
            mRows.clear();
            mRows.addAll(copy);
        } finally {
            lock.unlock();
        }
    }

    public Result replaceRow(String name, int expectedVersion, Row replacement)
        throws StoreUnavailableException, StoreRejectedException
    {
        RowSchema.check(replacement, 0);
        replacement = new Row(replacement);
        Lock lock = lock(mLock.writeLock());
        try {
            int index = indexOf(name);
            if (index < 0) {
                return Result.ABSENT;
            }
            if (VersionRegistry.versionOf(mRows.get(index)) != expectedVersion) {
                return Result.STALE;
            }
            mRows.set(index, replacement);
            return Result.APPLIED;
        } finally {
            lock.unlock();
        }
    }

    public Result deleteRow(String name, int expectedVersion) throws StoreUnavailableException {
        Lock lock = lock(mLock.writeLock());
        try {
            int index = indexOf(name);
            if (index < 0) {
                return Result.ABSENT;
            }
            if (VersionRegistry.versionOf(mRows.get(index)) != expectedVersion) {
                return Result.STALE;
            }
            mRows.remove(index);
            return Result.APPLIED;
        } finally {
            lock.unlock();
        }
    }

    public void appendRow(Row row) throws StoreUnavailableException, StoreRejectedException {
        RowSchema.check(row, 0);
        row = new Row(row);
        Lock lock = lock(mLock.writeLock());
        try {
            mRows.add(row);
        } finally {
            lock.unlock();
        }
    }

    public <C extends Capability> C getCapability(Class<C> capabilityType) {
        if (capabilityType == ConditionalWriteCapability.class && !mConditionalWrites) {
            return null;
        }
        if (capabilityType.isInstance(this)) {
            return (C) this;
        }
        return null;
    }

    public void close() {
        mClosed = true;
    }

    @Override
    public String toString() {
        return "MapTableStore {name=" + mName + '}';
    }

    /**
     * Caller must hold a lock.
     *
     * @return index of first row with name, or -1 if none
     */
    private int indexOf(String name) {
        Iterator<Row> it = mRows.iterator();
        for (int i=0; it.hasNext(); i++) {
            String rowName = it.next().get(Column.NAME);
            if (rowName != null && rowName.equals(name)) {
                return i;
            }
        }
        return -1;
    }

    private Lock lock(Lock lock) throws StoreUnavailableException {
        if (mClosed) {
            throw new StoreUnavailableException("Store is closed: " + mName);
        }
        try {
            if (lock.tryLock(mLockTimeout, mLockTimeoutUnit)) {
                return lock;
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new StoreUnavailableException("Interrupted while waiting for " + mName, e);
        }
        throw new StoreUnavailableException
            ("Timed out after " + mLockTimeout + ' ' +
             mLockTimeoutUnit.toString().toLowerCase() + " waiting for " + mName);
    }

    private static List<Row> copy(List<Row> rows) {
        List<Row> copy = new ArrayList<Row>(rows.size());
        for (Row row : rows) {
            copy.add(new Row(row));
        }
        return copy;
    }
}
