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

/**
 * Standard interface for building up configuration and opening a {@link
 * TableStore} instance. All table store implementations should be
 * constructable via a builder.
 */
public interface TableStoreBuilder {
    /**
     * Builds a table store instance.
     *
     * @throws ConfigurationException if there is a problem in the builder's
     * configuration
     * @throws StoreUnavailableException if there is a general problem opening
     * the store
     */
    TableStore build() throws ConfigurationException, StoreUnavailableException;

    /**
     * Returns the name of the store.
     */
    String getName();

    /**
     * Set name for the store, which is required.
     */
    void setName(String name);
}
