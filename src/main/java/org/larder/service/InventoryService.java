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

package org.larder.service;

import java.util.Collections;
import java.util.List;

import org.apache.commons.logging.Log;
import org.apache.commons.logging.LogFactory;

import org.larder.Inventory;
import org.larder.InventoryItem;
import org.larder.OptimisticLockException;
import org.larder.RecordNotFoundException;
import org.larder.RepositoryException;
import org.larder.StoreRejectedException;
import org.larder.StoreUnavailableException;

/**
 * Front end of an {@link Inventory} for interactive callers. Each request is
 * answered with an {@link Outcome} instead of an exception. Nothing is ever
 * retried or merged here; a caller told to refresh must re-read the view and
 * present the new version.
 */
public class InventoryService {
    /** Items with this quantity or less are reported as low on stock */
    public static final int DEFAULT_LOW_STOCK_THRESHOLD = 1;

    private final Log mLog = LogFactory.getLog(InventoryService.class);

    private final Inventory mInventory;
    private final int mLowStockThreshold;

    public InventoryService(Inventory inventory) {
        this(inventory, DEFAULT_LOW_STOCK_THRESHOLD);
    }

    public InventoryService(Inventory inventory, int lowStockThreshold) {
        if (inventory == null) {
            throw new IllegalArgumentException("Inventory cannot be null");
        }
        mInventory = inventory;
        mLowStockThreshold = lowStockThreshold;
    }

    /**
     * Returns the current snapshot split by stock level.
     */
    public InventoryView view() {
        List<InventoryItem> items;
        Outcome outcome;
        try {
            items = mInventory.readAll();
            if (items.isEmpty()) {
                outcome = Outcome.success
                    ("No inventory data found. Add a new item to get started.", null);
            } else {
                outcome = Outcome.success("Loaded " + items.size() + " items.", null);
            }
        } catch (StoreUnavailableException e) {
            items = Collections.emptyList();
            outcome = failed(null, e);
        }
        return new InventoryView(items, mLowStockThreshold, outcome);
    }

    public Outcome updateQuantity(String name, int newQuantity, int version) {
        if (isBlank(name)) {
            return missingName();
        }
        try {
            InventoryItem item = mInventory.updateQuantityAndDate(name, newQuantity, version);
            return Outcome.success("Quantity and Date updated successfully!", item);
        } catch (RepositoryException e) {
            return failed(name, e);
        }
    }

    /**
     * Increments the quantity by one.
     */
    public Outcome increase(String name, int version) {
        return adjust(name, 1, version);
    }

    /**
     * Decrements the quantity by one, but never below zero.
     */
    public Outcome decrease(String name, int version) {
        return adjust(name, -1, version);
    }

    public Outcome updateNotes(String name, String notes, int version) {
        if (isBlank(name)) {
            return missingName();
        }
        try {
            InventoryItem item = mInventory.updateNotes(name, notes, version);
            return Outcome.success("Notes updated successfully!", item);
        } catch (RepositoryException e) {
            return failed(name, e);
        }
    }

    public Outcome delete(String name, int version) {
        if (isBlank(name)) {
            return missingName();
        }
        try {
            InventoryItem item = mInventory.deleteRecord(name, version);
            return Outcome.success
                ("Successfully deleted '" + name + "' from the inventory!", item);
        } catch (RepositoryException e) {
            return failed(name, e);
        }
    }

    public Outcome add(String image, String name, int quantity, String notes) {
        if (isBlank(name)) {
            return missingName();
        }
        if (quantity < 0) {
            return Outcome.failure
                (Outcome.Kind.INVALID_INPUT, "Initial quantity cannot be negative.", null);
        }
        try {
            InventoryItem item = mInventory.addRecord(image, name, quantity, notes);
            return Outcome.success("Successfully added '" + name + "' to the inventory!", item);
        } catch (RepositoryException e) {
            return failed(name, e);
        }
    }

    public int getLowStockThreshold() {
        return mLowStockThreshold;
    }

    private Outcome adjust(String name, int delta, int version) {
        if (isBlank(name)) {
            return missingName();
        }
        try {
            InventoryItem item = mInventory.adjustQuantity(name, delta, version);
            return Outcome.success("Quantity and Date updated successfully!", item);
        } catch (RepositoryException e) {
            return failed(name, e);
        }
    }

    private static boolean isBlank(String name) {
        return name == null || name.trim().length() == 0;
    }

    private static Outcome missingName() {
        return Outcome.failure
            (Outcome.Kind.INVALID_INPUT, "Please enter a name for the item.", null);
    }

    private Outcome failed(String name, RepositoryException e) {
        if (e instanceof OptimisticLockException) {
            if (mLog.isInfoEnabled()) {
                mLog.info("Rejected stale write: " + e.getMessage());
            }
            return Outcome.failure
                (Outcome.Kind.VERSION_CONFLICT,
                 "Data for '" + name + "' has been changed by another user. " +
                 "Please refresh the page to get the latest version.", e);
        }
        if (e instanceof RecordNotFoundException) {
            if (mLog.isInfoEnabled()) {
                mLog.info(e.getMessage());
            }
            return Outcome.failure
                (Outcome.Kind.RECORD_NOT_FOUND, "Item not found. Please refresh the page.", e);
        }
        if (e instanceof StoreRejectedException) {
            mLog.error("Store rejected write for \"" + name + '"', e);
            return Outcome.failure
                (Outcome.Kind.STORE_REJECTED,
                 "The inventory store refused the change: " + e.getMessage(), e);
        }
        mLog.error(name == null ? "Unable to read inventory" : "Unable to write \"" + name + '"', e);
        return Outcome.failure
            (Outcome.Kind.STORE_UNAVAILABLE,
             "Error communicating with the inventory store: " + e.getMessage(), e);
    }
}
