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

/**
 * Access to the external table which holds the authoritative inventory. The
 * only primitives assumed are reading and replacing the entire table. A
 * TableStore has no locking which callers may rely upon; concurrency safety
 * is the responsibility of the {@link Inventory} layered above.
 *
 * <p>TableStore instances are thread-safe.
 */
public interface TableStore {
    /**
     * Returns the name of this store.
     */
    String getName();

    /**
     * Reads the full current table. The returned list and its rows are
     * copies, owned by the caller.
     *
     * @throws StoreUnavailableException if the table cannot be read
     */
    List<Row> readAll() throws StoreUnavailableException;

    /**
     * Replaces the entire contents of the table with the given rows.
     *
     * @throws StoreUnavailableException if the table cannot be reached
     * @throws StoreRejectedException if the store refuses the rows
     * @throws IllegalArgumentException if rows is null
     */
    void writeAll(List<Row> rows) throws StoreUnavailableException, StoreRejectedException;

    /**
     * Returns the requested capability, or null if not supported.
     */
    <C extends Capability> C getCapability(Class<C> capabilityType);

    /**
     * Closes this store, releasing any resources it holds. Closing a store
     * which is shared by several inventories affects all of them.
     */
    void close();
}
