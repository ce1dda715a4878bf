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

import org.joda.time.LocalDate;

/**
 * One inventory item, keyed by its name. Instances are mutable and not
 * thread-safe. Items returned by an {@link Inventory} are copies, and so
 * altering them has no effect on the store; all changes must go through the
 * inventory's versioned mutation methods.
 *
 * <p>The version property is the authoritative version number for the
 * entire item. The inventory establishes it as 1 on insert and increments it
 * by exactly one on every successful mutation. Under no circumstances should
 * it be incremented manually.
 */
public class InventoryItem implements Cloneable {
    private String mName;
    private String mImage;
    private int mQuantity;
    private String mNotes;
    private LocalDate mLastModified;
    private int mVersion;

    public InventoryItem() {
    }

    public InventoryItem(String name) {
        mName = name;
    }

    public String getName() {
        return mName;
    }

    public void setName(String name) {
        mName = name;
    }

    /**
     * Returns the image URI, or null if none.
     */
    public String getImage() {
        return mImage;
    }

    public void setImage(String image) {
        mImage = image;
    }

    public int getQuantity() {
        return mQuantity;
    }

    /**
     * Set the quantity, which is clamped to be at least zero.
     */
    public void setQuantity(int quantity) {
        mQuantity = quantity < 0 ? 0 : quantity;
    }

    /**
     * Returns the free-text notes, or null if none.
     */
    public String getNotes() {
        return mNotes;
    }

    public void setNotes(String notes) {
        mNotes = notes;
    }

    /**
     * Returns the date of the last quantity change, or null if not known.
     */
    public LocalDate getLastModified() {
        return mLastModified;
    }

    public void setLastModified(LocalDate date) {
        mLastModified = date;
    }

    public int getVersion() {
        return mVersion;
    }

    public void setVersion(int version) {
        mVersion = version;
    }

    /**
     * Returns true if the given item has the same name as this one.
     */
    public boolean equalPrimaryKeys(InventoryItem other) {
        if (other == null) {
            return false;
        }
        return mName == null ? other.mName == null : mName.equals(other.mName);
    }

    /**
     * Returns an exact shallow copy of this item.
     */
    public InventoryItem copy() {
        try {
            return (InventoryItem) super.clone();
        } catch (CloneNotSupportedException e) {
            throw new InternalError(e.toString());
        }
    }

    public String toStringKeyOnly() {
        return "InventoryItem {name=" + mName + '}';
    }

    @Override
    public String toString() {
        StringBuilder b = new StringBuilder();
        b.append("InventoryItem {name=").append(mName);
        b.append(", quantity=").append(mQuantity);
        b.append(", version=").append(mVersion);
        if (mLastModified != null) {
            b.append(", lastModified=").append(mLastModified);
        }
        if (mImage != null) {
            b.append(", image=").append(mImage);
        }
        if (mNotes != null) {
            b.append(", notes=").append(mNotes);
        }
        return b.append('}').toString();
    }

    @Override
    public int hashCode() {
        int hash = mName == null ? 0 : mName.hashCode();
        hash = hash * 31 + mQuantity;
        hash = hash * 31 + mVersion;
        return hash;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof InventoryItem)) {
            return false;
        }
        InventoryItem other = (InventoryItem) obj;
        return equalPrimaryKeys(other)
            && mQuantity == other.mQuantity
            && mVersion == other.mVersion
            && equal(mImage, other.mImage)
            && equal(mNotes, other.mNotes)
            && equal(mLastModified, other.mLastModified);
    }

    private static boolean equal(Object a, Object b) {
        return a == null ? b == null : a.equals(b);
    }
}
