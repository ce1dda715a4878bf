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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.larder.InventoryItem;

/**
 * Snapshot of the inventory for display, split into normal stock and low
 * stock. An item is low on stock when its quantity is at or below the
 * threshold.
 */
public class InventoryView {
    private final List<InventoryItem> mNormalStock;
    private final List<InventoryItem> mLowStock;
    private final int mThreshold;
    private final Outcome mOutcome;

    InventoryView(List<InventoryItem> items, int threshold, Outcome outcome) {
        List<InventoryItem> normal = new ArrayList<InventoryItem>();
        List<InventoryItem> low = new ArrayList<InventoryItem>();
        for (InventoryItem item : items) {
            if (item.getQuantity() <= threshold) {
                low.add(item);
            } else {
                normal.add(item);
            }
        }
        mNormalStock = Collections.unmodifiableList(normal);
        mLowStock = Collections.unmodifiableList(low);
        mThreshold = threshold;
        mOutcome = outcome;
    }

    public List<InventoryItem> getNormalStock() {
        return mNormalStock;
    }

    public List<InventoryItem> getLowStock() {
        return mLowStock;
    }

    public int getLowStockThreshold() {
        return mThreshold;
    }

    public boolean isEmpty() {
        return mNormalStock.isEmpty() && mLowStock.isEmpty();
    }

    /**
     * Returns the outcome of reading the snapshot. If it failed, the view is
     * empty.
     */
    public Outcome getOutcome() {
        return mOutcome;
    }
}
