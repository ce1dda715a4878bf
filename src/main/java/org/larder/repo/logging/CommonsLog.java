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

import org.apache.commons.logging.LogFactory;

/**
 * Log implementation that writes store traffic to Jakarta Commons Logging at
 * debug level. Each table store gets its own category, named after {@link
 * LoggingTableStore} and suffixed by the store name, and so logging can be
 * enabled for one table only.
 */
public class CommonsLog implements Log {
    /**
     * Returns the commons-logging category used for the given table store.
     */
    public static String categoryFor(String storeName) {
        String base = LoggingTableStore.class.getName();
        return storeName == null ? base : base + '.' + storeName;
    }

    private final String mCategory;
    private final org.apache.commons.logging.Log mLog;

    /**
     * @param storeName name of logged table store, or null for the base category
     */
    public CommonsLog(String storeName) {
        mCategory = categoryFor(storeName);
        mLog = LogFactory.getLog(mCategory);
    }

    public String getCategory() {
        return mCategory;
    }

    public boolean isEnabled() {
        return mLog.isDebugEnabled();
    }

    public void write(String message) {
        mLog.debug(message);
    }
}
