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

import java.util.Collection;

import org.larder.ConfigurationException;
import org.larder.StoreUnavailableException;
import org.larder.TableStore;
import org.larder.TableStoreBuilder;

import org.larder.spi.AbstractTableStoreBuilder;

/**
 * Table store implementation which logs activity against it. By default, all
 * logged messages are at the debug level.
 *
 * <p>
 * The following extra capabilities are supported:
 * <ul>
 * <li>{@link LogAccessCapability}
 * </ul>
 * Any capabilities of the actual store are passed through.
 *
 * Example:
 *
 * <pre>
 * LoggingTableStoreBuilder loggingBuilder = new LoggingTableStoreBuilder();
 * loggingBuilder.setActualTableStoreBuilder(...);
 * TableStore store = loggingBuilder.build();
 * </pre>
 */
public class LoggingTableStoreBuilder extends AbstractTableStoreBuilder {
    private String mName;
    private Log mLog;
    private TableStoreBuilder mStoreBuilder;

    public LoggingTableStoreBuilder() {
    }

    public TableStore build() throws ConfigurationException, StoreUnavailableException {
        if (mName == null) {
            if (mStoreBuilder != null) {
                mName = mStoreBuilder.getName();
            }
        }

        assertReady();

        if (mLog == null) {
            mLog = new CommonsLog(mName);
        }

        TableStore actual = mStoreBuilder.build();

        if (!mLog.isEnabled()) {
            return actual;
        }

        return new LoggingTableStore(actual, mLog);
    }

    public void setName(String name) {
        mName = name;
    }

    public String getName() {
        return mName;
    }

    /**
     * Set the Log to use. If null, use a {@link CommonsLog} for the store name. Log must be enabled when build
     * is called, or else no logging is ever performed.
     */
    public void setLog(Log log) {
        mLog = log;
    }

    /**
     * Return the Log to use. If null, use default.
     */
    public Log getLog() {
        return mLog;
    }

    /**
     * Set the TableStore to wrap all calls to.
     */
    public void setActualTableStoreBuilder(TableStoreBuilder builder) {
        mStoreBuilder = builder;
    }

    /**
     * Returns the TableStore that all calls are wrapped to.
     */
    public TableStoreBuilder getActualTableStoreBuilder() {
        return mStoreBuilder;
    }

    @Override
    public void errorCheck(Collection<String> messages) throws ConfigurationException {
        super.errorCheck(messages);
        if (mStoreBuilder == null) {
            messages.add("Actual table store builder must be set");
        }
    }
}
