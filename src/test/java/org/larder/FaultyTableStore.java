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

package org.larder;

import java.util.List;

import org.larder.capability.Capability;
import org.larder.capability.ConditionalWriteCapability;

/**
 * Table store wrapper which can be told to fail its next read or write, and
 * which counts calls. Conditional writes of the wrapped store are hidden
 * unless enabled, so that the full-table path is exercised.
 */
public class FaultyTableStore implements TableStore {
    private final TableStore mStore;
    private final boolean mPassCapabilities;

    private RepositoryException mReadFailure;
    private RepositoryException mWriteFailure;

    private int mReadCount;
    private int mWriteCount;

    public FaultyTableStore(TableStore store) {
        this(store, false);
    }

    public FaultyTableStore(TableStore store, boolean passCapabilities) {
        mStore = store;
        mPassCapabilities = passCapabilities;
    }

    /**
     * Fail the next read with the given exception.
     */
    public synchronized void failNextRead(StoreUnavailableException e) {
        mReadFailure = e;
    }

    /**
     * Fail the next write with the given exception, which must be either
     * unavailable or rejected.
     */
    public synchronized void failNextWrite(RepositoryException e) {
        mWriteFailure = e;
    }

    public synchronized int getReadCount() {
        return mReadCount;
    }

    public synchronized int getWriteCount() {
        return mWriteCount;
    }

    public String getName() {
        return mStore.getName();
    }

    public List<Row> readAll() throws StoreUnavailableException {
        synchronized (this) {
            mReadCount++;
            RepositoryException e = mReadFailure;
            if (e != null) {
                mReadFailure = null;
                throw (StoreUnavailableException) e;
            }
        }
        return mStore.readAll();
    }

    public void writeAll(List<Row> rows) throws StoreUnavailableException, StoreRejectedException {
        synchronized (this) {
            mWriteCount++;
            RepositoryException e = mWriteFailure;
            if (e != null) {
                mWriteFailure = null;
                if (e instanceof StoreRejectedException) {
                    throw (StoreRejectedException) e;
                }
                throw (StoreUnavailableException) e;
            }
        }
        mStore.writeAll(rows);
    }

    public <C extends Capability> C getCapability(Class<C> capabilityType) {
        if (!mPassCapabilities && capabilityType == ConditionalWriteCapability.class) {
            return null;
        }
        return mStore.getCapability(capabilityType);
    }

    public void close() {
        mStore.close();
    }
}
