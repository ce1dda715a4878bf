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

package org.larder.repo.logging;

import java.util.List;

import org.larder.Row;
import org.larder.StoreRejectedException;
import org.larder.StoreUnavailableException;
import org.larder.TableStore;

import org.larder.capability.Capability;
import org.larder.capability.ConditionalWriteCapability;

/**
 * Table store which logs every call made against the actual store, and the
 * result or failure of each.
 */
class LoggingTableStore implements TableStore, LogAccessCapability {
    private final TableStore mStore;
    private final Log mLog;

    LoggingTableStore(TableStore actual, Log log) {
        mStore = actual;
        mLog = log;
    }

    public String getName() {
        return mStore.getName();
    }

    public List<Row> readAll() throws StoreUnavailableException {
        try {
            List<Row> rows = mStore.readAll();
            if (mLog.isEnabled()) {
                mLog.write("TableStore.readAll() on " + getName() + " returned " +
                           rows.size() + " rows");
            }
            return rows;
        } catch (StoreUnavailableException e) {
            failed("readAll()", e);
            throw e;
        }
    }

    public void writeAll(List<Row> rows) throws StoreUnavailableException, StoreRejectedException {
        if (mLog.isEnabled()) {
            mLog.write("TableStore.writeAll(" + (rows == null ? "null" : rows.size() + " rows") +
                       ") on " + getName());
        }
        try {
            mStore.writeAll(rows);
        } catch (StoreUnavailableException e) {
            failed("writeAll()", e);
            throw e;
        } catch (StoreRejectedException e) {
            failed("writeAll()", e);
            throw e;
        }
    }

    public <C extends Capability> C getCapability(Class<C> capabilityType) {
        if (capabilityType.isInstance(this)) {
            return (C) this;
        }
        C capability = mStore.getCapability(capabilityType);
        if (capability instanceof ConditionalWriteCapability) {
            return (C) new LoggingConditionalWrite((ConditionalWriteCapability) capability);
        }
        return capability;
    }

    public void close() {
        if (mLog.isEnabled()) {
            mLog.write("TableStore.close() on " + getName());
        }
        mStore.close();
    }

    public Log getLog() {
        return mLog;
    }

    private void failed(String call, Exception e) {
        if (mLog.isEnabled()) {
            mLog.write("TableStore." + call + " on " + getName() + " failed: " + e);
        }
    }

    private class LoggingConditionalWrite implements ConditionalWriteCapability {
        private final ConditionalWriteCapability mActual;

        LoggingConditionalWrite(ConditionalWriteCapability actual) {
            mActual = actual;
        }

        public Result replaceRow(String name, int expectedVersion, Row replacement)
            throws StoreUnavailableException, StoreRejectedException
        {
            Result result = mActual.replaceRow(name, expectedVersion, replacement);
            if (mLog.isEnabled()) {
                mLog.write("ConditionalWrite.replaceRow(" + name + ", " + expectedVersion +
                           ") on " + getName() + " returned " + result);
            }
            return result;
        }

        public Result deleteRow(String name, int expectedVersion)
            throws StoreUnavailableException, StoreRejectedException
        {
            Result result = mActual.deleteRow(name, expectedVersion);
            if (mLog.isEnabled()) {
                mLog.write("ConditionalWrite.deleteRow(" + name + ", " + expectedVersion +
                           ") on " + getName() + " returned " + result);
            }
            return result;
        }

        public void appendRow(Row row) throws StoreUnavailableException, StoreRejectedException {
            if (mLog.isEnabled()) {
                mLog.write("ConditionalWrite.appendRow(" + row + ") on " + getName());
            }
            mActual.appendRow(row);
        }
    }
}
