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

package org.larder.engine;

import java.util.ArrayList;
import java.util.List;

import org.apache.commons.logging.Log;
import org.apache.commons.logging.LogFactory;

import org.joda.time.DateTimeUtils;
import org.joda.time.DateTimeZone;
import org.joda.time.LocalDate;

import org.larder.Column;
import org.larder.Inventory;
import org.larder.InventoryItem;
import org.larder.OptimisticLockException;
import org.larder.PersistException;
import org.larder.RecordNotFoundException;
import org.larder.Row;
import org.larder.StoreUnavailableException;
import org.larder.TableStore;

import org.larder.cache.SessionCache;

import org.larder.capability.ConditionalWriteCapability;

import org.larder.layout.RowLayout;
import org.larder.layout.VersionRegistry;

/**
 * Inventory which detects conflicting writers by version. Every mutation of
 * an existing item re-reads the authoritative table, bypassing the session
 * cache, and verifies the caller's expected version before writing anything.
 * The session cache, if any, is invalidated only after the store has accepted
 * the write, and so a failed write never alters what the session displays.
 *
 * <p>If the store offers the {@link ConditionalWriteCapability}, the changed
 * row is written with a conditional row write keyed by name and expected
 * version, which the store applies atomically. Otherwise the entire table is
 * written back. In that case the verification read and the write are not
 * atomic, and two writers which verify at the same instant may both succeed
 * unless the store serializes full-table writes.
 *
 * <p>Each instance represents one session. Any number of instances, in any
 * number of processes, may share one store.
 *
 * @see InventoryBuilder
 */
public class OptimisticInventory implements Inventory {
    private final Log mLog = LogFactory.getLog(OptimisticInventory.class);

    private final TableStore mStore;
    private final SessionCache mCache;
    private final RowLayout mLayout;
    private final DateTimeZone mZone;

    /**
     * @param store authoritative store
     * @param cache optional session cache; pass null to always read the store
     */
    public OptimisticInventory(TableStore store, SessionCache cache) {
        this(store, cache, new RowLayout(), DateTimeZone.getDefault());
    }

    /**
     * @param store authoritative store
     * @param cache optional session cache; pass null to always read the store
     * @param layout converts between rows and items
     * @param zone time zone used for modification dates
     */
    public OptimisticInventory(TableStore store, SessionCache cache,
                               RowLayout layout, DateTimeZone zone)
    {
        if (store == null) {
            throw new IllegalArgumentException("TableStore cannot be null");
        }
        if (layout == null) {
            throw new IllegalArgumentException("RowLayout cannot be null");
        }
        if (zone == null) {
            throw new IllegalArgumentException("DateTimeZone cannot be null");
        }
        mStore = store;
        mCache = cache;
        mLayout = layout;
        mZone = zone;
    }

    public List<InventoryItem> readAll() throws StoreUnavailableException {
        if (mCache == null) {
            return readAuthoritative();
        }
        return mCache.get(new SessionCache.Loader() {
            public List<InventoryItem> load() throws StoreUnavailableException {
                return readAuthoritative();
            }
        });
    }

    public InventoryItem load(String name) throws StoreUnavailableException {
        checkName(name);
        List<InventoryItem> items = readAll();
        int index = indexOf(items, name);
        return index < 0 ? null : items.get(index);
    }

    public InventoryItem updateQuantityAndDate(String name, final int newQuantity,
                                               int expectedVersion)
        throws PersistException, StoreUnavailableException
    {
        return mutate(name, expectedVersion, new Mutation() {
            InventoryItem apply(InventoryItem item) {
                item.setQuantity(newQuantity);
                item.setLastModified(today());
                return item;
            }
        });
    }

    public InventoryItem adjustQuantity(String name, final int delta, int expectedVersion)
        throws PersistException, StoreUnavailableException
    {
        return mutate(name, expectedVersion, new Mutation() {
            InventoryItem apply(InventoryItem item) {
                long quantity = (long) item.getQuantity() + delta;
                item.setQuantity((int) Math.min(Integer.MAX_VALUE, Math.max(0, quantity)));
                item.setLastModified(today());
                return item;
            }
        });
    }

    public InventoryItem updateNotes(String name, final String newNotes, int expectedVersion)
        throws PersistException, StoreUnavailableException
    {
        return mutate(name, expectedVersion, new Mutation() {
            InventoryItem apply(InventoryItem item) {
                item.setNotes(newNotes);
                return item;
            }
        });
    }

    public InventoryItem deleteRecord(String name, int expectedVersion)
        throws PersistException, StoreUnavailableException
    {
        return mutate(name, expectedVersion, new Mutation() {
            InventoryItem apply(InventoryItem item) {
                return null;
            }
        });
    }

    public InventoryItem addRecord(String image, String name, int quantity, String notes)
        throws PersistException, StoreUnavailableException
    {
        checkName(name);
        if (name.trim().length() == 0) {
            throw new IllegalArgumentException("Name cannot be blank");
        }

        InventoryItem item = new InventoryItem(name);
        item.setImage(blankToNull(image));
        item.setQuantity(quantity);
        item.setNotes(blankToNull(notes));
        item.setLastModified(today());
        item.setVersion(VersionRegistry.INITIAL_VERSION);

        ConditionalWriteCapability cap = mStore.getCapability(ConditionalWriteCapability.class);
        if (cap != null) {
            cap.appendRow(mLayout.encode(item));
        } else {
            List<Row> rows = mStore.readAll();
            rows.add(mLayout.encode(item));
            mStore.writeAll(rows);
        }

        invalidateCache();

        if (mLog.isDebugEnabled()) {
            mLog.debug("Added " + item);
        }

        return item.copy();
    }

    /**
     * Returns the session cache, or null if none.
     */
    public SessionCache getSessionCache() {
        return mCache;
    }

    /**
     * Returns the store which this inventory reads and writes.
     */
    public TableStore getTableStore() {
        return mStore;
    }

    /**
     * Always reads from the store, never from the cache.
     */
    List<InventoryItem> readAuthoritative() throws StoreUnavailableException {
        return mLayout.decode(mStore.readAll());
    }

    LocalDate today() {
        return new LocalDate(DateTimeUtils.currentTimeMillis(), mZone);
    }

    /**
     * Read, verify and write an existing item. Only the row of the item is
     * changed; rows of all other items are written back as read, without any
     * of the repairs applied when decoding them.
     *
     * @return updated item, or the original item if deleted
     */
    private InventoryItem mutate(String name, int expectedVersion, Mutation mutation)
        throws PersistException, StoreUnavailableException
    {
        checkName(name);

        List<Row> rows = mStore.readAll();
        int index = indexOfRow(rows, name);
        if (index < 0) {
            throw new RecordNotFoundException(name);
        }

        InventoryItem current = mLayout.decode(rows.get(index));
        if (current.getVersion() != expectedVersion) {
            throw new OptimisticLockException(expectedVersion, current.getVersion(), current);
        }

        InventoryItem updated = mutation.apply(current.copy());
        if (updated != null) {
            updated.setVersion(VersionRegistry.nextVersion(expectedVersion));
        }

        ConditionalWriteCapability cap = mStore.getCapability(ConditionalWriteCapability.class);
        if (cap != null) {
            ConditionalWriteCapability.Result result;
            if (updated == null) {
                result = cap.deleteRow(name, expectedVersion);
            } else {
                result = cap.replaceRow(name, expectedVersion, mLayout.encode(updated));
            }
            switch (result) {
            case ABSENT:
                throw new RecordNotFoundException(name);
            case STALE:
                // Another writer got in after the verification read.
                throw new OptimisticLockException(expectedVersion, null, current);
            default:
                break;
            }
        } else {
            // All other rows are written back exactly as read.
            List<Row> newRows = new ArrayList<Row>(rows);
            if (updated == null) {
                newRows.remove(index);
            } else {
                newRows.set(index, mLayout.encode(updated));
            }
            mStore.writeAll(newRows);
        }

        invalidateCache();

        if (mLog.isDebugEnabled()) {
            if (updated == null) {
                mLog.debug("Deleted " + current);
            } else {
                mLog.debug("Updated " + updated);
            }
        }

        return updated == null ? current : updated.copy();
    }

    private void invalidateCache() {
        if (mCache != null) {
            mCache.invalidate();
        }
    }

    /**
     * @return index of first row with the non-blank name, or -1
     */
    private static int indexOfRow(List<Row> rows, String name) {
        for (int i=0; i<rows.size(); i++) {
            Row row = rows.get(i);
            if (name.equals(row.get(Column.NAME)) && !row.isBlank(Column.NAME)) {
                return i;
            }
        }
        return -1;
    }

    private static int indexOf(List<InventoryItem> items, String name) {
        for (int i=0; i<items.size(); i++) {
            if (name.equals(items.get(i).getName())) {
                return i;
            }
        }
        return -1;
    }

    private static void checkName(String name) {
        if (name == null) {
            throw new IllegalArgumentException("Name cannot be null");
        }
    }

    private static String blankToNull(String str) {
        return (str == null || str.trim().length() == 0) ? null : str;
    }

    /**
     * Changes a copy of the verified item.
     */
    private abstract static class Mutation {
        /**
         * @param item copy of the current item, which may be modified
         * @return the replacement item, or null to delete
         */
        abstract InventoryItem apply(InventoryItem item);
    }
}
