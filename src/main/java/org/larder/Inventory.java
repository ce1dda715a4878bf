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

/**
 * A shared collection of {@link InventoryItem inventory items}, supporting
 * versioned mutation. Each mutation of an existing item requires the version
 * the caller last observed. Before writing, the item is re-read from the
 * authoritative store and its version compared; if it differs, the mutation
 * is rejected with an {@link OptimisticLockException} and nothing is written.
 * Of any number of callers presenting the same version, at most one succeeds.
 *
 * <p>No operation retries or waits for a conflicting writer. A rejected
 * mutation is terminal, and the caller must re-read before trying again.
 */
public interface Inventory {
    /**
     * Returns a snapshot of all items, suitable for display. The snapshot may
     * be served from a session cache, and so it may be stale.
     *
     * @throws StoreUnavailableException if the store cannot be read
     */
    List<InventoryItem> readAll() throws StoreUnavailableException;

    /**
     * Returns the item with the given name from the display snapshot, or null
     * if not found.
     *
     * @throws StoreUnavailableException if the store cannot be read
     */
    InventoryItem load(String name) throws StoreUnavailableException;

    /**
     * Sets the quantity of an item and stamps it with the current date.
     * Negative quantities are clamped to zero.
     *
     * @param name name of item to update
     * @param newQuantity new quantity
     * @param expectedVersion version the caller last observed
     * @return the updated item, with its new version
     * @throws RecordNotFoundException if no item has the given name
     * @throws OptimisticLockException if the expected version is stale
     * @throws StoreRejectedException if the store refuses the write
     * @throws StoreUnavailableException if the store cannot be reached
     */
    InventoryItem updateQuantityAndDate(String name, int newQuantity, int expectedVersion)
        throws PersistException, StoreUnavailableException;

    /**
     * Adds a delta to the current quantity of an item and stamps it with the
     * current date. The resulting quantity is clamped to zero.
     *
     * @param name name of item to update
     * @param delta amount to add, which may be negative
     * @param expectedVersion version the caller last observed
     * @return the updated item, with its new version
     * @throws RecordNotFoundException if no item has the given name
     * @throws OptimisticLockException if the expected version is stale
     * @throws StoreRejectedException if the store refuses the write
     * @throws StoreUnavailableException if the store cannot be reached
     */
    InventoryItem adjustQuantity(String name, int delta, int expectedVersion)
        throws PersistException, StoreUnavailableException;

    /**
     * Replaces the notes of an item. The modification date is not changed.
     *
     * @param newNotes new notes, which may be null to clear them
     * @return the updated item, with its new version
     * @throws RecordNotFoundException if no item has the given name
     * @throws OptimisticLockException if the expected version is stale
     * @throws StoreRejectedException if the store refuses the write
     * @throws StoreUnavailableException if the store cannot be reached
     */
    InventoryItem updateNotes(String name, String newNotes, int expectedVersion)
        throws PersistException, StoreUnavailableException;

    /**
     * Removes an item entirely.
     *
     * @return the item as it was just before deletion
     * @throws RecordNotFoundException if no item has the given name
     * @throws OptimisticLockException if the expected version is stale
     * @throws StoreRejectedException if the store refuses the write
     * @throws StoreUnavailableException if the store cannot be reached
     */
    InventoryItem deleteRecord(String name, int expectedVersion)
        throws PersistException, StoreUnavailableException;

    /**
     * Unconditionally appends a new item at version 1, stamped with the
     * current date. Name uniqueness is not checked.
     *
     * @param image optional image URI
     * @param name required item name
     * @param quantity initial quantity, clamped to zero
     * @param notes optional notes
     * @return the new item
     * @throws IllegalArgumentException if name is null or blank
     * @throws StoreRejectedException if the store refuses the write
     * @throws StoreUnavailableException if the store cannot be reached
     */
    InventoryItem addRecord(String image, String name, int quantity, String notes)
        throws PersistException, StoreUnavailableException;
}
