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

import java.util.List;

import junit.framework.TestCase;
import junit.framework.TestSuite;

import org.joda.time.DateTimeUtils;
import org.joda.time.LocalDate;

import org.larder.Column;
import org.larder.FaultyTableStore;
import org.larder.InventoryItem;
import org.larder.OptimisticLockException;
import org.larder.RecordNotFoundException;
import org.larder.Row;
import org.larder.StoreRejectedException;
import org.larder.StoreUnavailableException;

import org.larder.engine.InventoryBuilder;

import org.larder.repo.map.MapTableStoreBuilder;

/**
 * Tests for InventoryService.
 */
public class TestInventoryService extends TestCase {
    public static void main(String[] args) {
        junit.textui.TestRunner.run(suite());
    }

    public static TestSuite suite() {
        return new TestSuite(TestInventoryService.class);
    }

    // 2025-07-04T12:00:00Z
    private static final long NOW = 1751630400000L;

    public TestInventoryService(String name) {
        super(name);
    }

    private FaultyTableStore mStore;
    private InventoryService mService;

    @Override
    protected void setUp() throws Exception {
        DateTimeUtils.setCurrentMillisFixed(NOW);
        MapTableStoreBuilder builder = new MapTableStoreBuilder();
        builder.addInitialRow(row("Rice", "5", "2"));
        builder.addInitialRow(row("Salt", "0", "1"));
        builder.addInitialRow(row("Soap", "1", "4"));
        mStore = new FaultyTableStore(builder.build());
        mService = newService(2);
    }

    @Override
    protected void tearDown() {
        DateTimeUtils.setCurrentMillisSystem();
    }

    private InventoryService newService(int threshold) throws Exception {
        InventoryBuilder builder = new InventoryBuilder();
        builder.setTableStore(mStore);
        builder.setCacheEnabled(false);
        builder.setTimeZone("UTC");
        return new InventoryService(builder.build(), threshold);
    }

    private static Row row(String name, String quantity, String version) {
        return new Row()
            .set(Column.NAME, name)
            .set(Column.QUANTITY, quantity)
            .set(Column.VERSION, version);
    }

    public void testView() throws Exception {
        InventoryView view = mService.view();
        assertTrue(view.getOutcome().isSuccess());
        assertEquals("Loaded 3 items.", view.getOutcome().getMessage());
        assertEquals(2, view.getLowStockThreshold());
        assertFalse(view.isEmpty());

        List<InventoryItem> normal = view.getNormalStock();
        assertEquals(1, normal.size());
        assertEquals("Rice", normal.get(0).getName());

        List<InventoryItem> low = view.getLowStock();
        assertEquals(2, low.size());
        assertEquals("Salt", low.get(0).getName());
        assertEquals("Soap", low.get(1).getName());
    }

    public void testDefaultThreshold() throws Exception {
        InventoryBuilder builder = new InventoryBuilder();
        builder.setTableStore(mStore);
        InventoryService service = new InventoryService(builder.build());
        assertEquals(InventoryService.DEFAULT_LOW_STOCK_THRESHOLD, service.getLowStockThreshold());
        assertEquals(2, service.view().getLowStock().size());
    }

    public void testEmptyView() throws Exception {
        mService.delete("Rice", 2);
        mService.delete("Salt", 1);
        mService.delete("Soap", 4);

        InventoryView view = mService.view();
        assertTrue(view.isEmpty());
        assertTrue(view.getOutcome().isSuccess());
        assertEquals("No inventory data found. Add a new item to get started.",
                     view.getOutcome().getMessage());
    }

    public void testViewUnavailable() throws Exception {
        mStore.failNextRead(new StoreUnavailableException("quota exceeded"));
        InventoryView view = mService.view();
        assertTrue(view.isEmpty());
        Outcome outcome = view.getOutcome();
        assertEquals(Outcome.Kind.STORE_UNAVAILABLE, outcome.getKind());
        assertEquals("Error communicating with the inventory store: quota exceeded",
                     outcome.getMessage());
        assertFalse(outcome.isRefreshRequired());
    }

    public void testUpdateQuantity() throws Exception {
        Outcome outcome = mService.updateQuantity("Rice", 4, 2);
        assertTrue(outcome.isSuccess());
        assertEquals("Quantity and Date updated successfully!", outcome.getMessage());
        assertEquals(4, outcome.getItem().getQuantity());
        assertEquals(3, outcome.getItem().getVersion());
        assertEquals(new LocalDate(2025, 7, 4), outcome.getItem().getLastModified());
        assertNull(outcome.getCause());

        outcome = mService.updateQuantity("Rice", 4, 2);
        assertEquals(Outcome.Kind.VERSION_CONFLICT, outcome.getKind());
        assertEquals("Data for 'Rice' has been changed by another user. " +
                     "Please refresh the page to get the latest version.", outcome.getMessage());
        assertTrue(outcome.isRefreshRequired());
        assertTrue(outcome.getCause() instanceof OptimisticLockException);
        assertNull(outcome.getItem());
    }

    public void testIncreaseAndDecrease() throws Exception {
        Outcome outcome = mService.increase("Salt", 1);
        assertTrue(outcome.isSuccess());
        assertEquals(1, outcome.getItem().getQuantity());
        assertEquals(2, outcome.getItem().getVersion());

        outcome = mService.decrease("Salt", 2);
        assertEquals(0, outcome.getItem().getQuantity());
        assertEquals(3, outcome.getItem().getVersion());

        outcome = mService.decrease("Salt", 3);
        assertTrue(outcome.isSuccess());
        assertEquals(0, outcome.getItem().getQuantity());
        assertEquals(4, outcome.getItem().getVersion());

        assertEquals(Outcome.Kind.VERSION_CONFLICT, mService.increase("Salt", 3).getKind());
    }

    public void testUpdateNotes() throws Exception {
        Outcome outcome = mService.updateNotes("Soap", "unscented", 4);
        assertTrue(outcome.isSuccess());
        assertEquals("Notes updated successfully!", outcome.getMessage());
        assertEquals("unscented", outcome.getItem().getNotes());
        assertEquals(5, outcome.getItem().getVersion());
    }

    public void testDelete() throws Exception {
        Outcome outcome = mService.delete("Salt", 1);
        assertTrue(outcome.isSuccess());
        assertEquals("Successfully deleted 'Salt' from the inventory!", outcome.getMessage());
        assertEquals("Salt", outcome.getItem().getName());

        outcome = mService.delete("Salt", 1);
        assertEquals(Outcome.Kind.RECORD_NOT_FOUND, outcome.getKind());
        assertEquals("Item not found. Please refresh the page.", outcome.getMessage());
        assertTrue(outcome.getCause() instanceof RecordNotFoundException);
        assertTrue(outcome.isRefreshRequired());
    }

    public void testAdd() throws Exception {
        Outcome outcome = mService.add("http://example.com/tea.png", "Tea", 3, "  ");
        assertTrue(outcome.isSuccess());
        assertEquals("Successfully added 'Tea' to the inventory!", outcome.getMessage());
        assertEquals(1, outcome.getItem().getVersion());
        assertNull(outcome.getItem().getNotes());
        assertEquals(4, mService.view().getNormalStock().size()
                     + mService.view().getLowStock().size());
    }

    public void testAddInvalid() throws Exception {
        Outcome outcome = mService.add(null, " ", 1, null);
        assertEquals(Outcome.Kind.INVALID_INPUT, outcome.getKind());
        assertEquals("Please enter a name for the item.", outcome.getMessage());

        outcome = mService.add(null, "Tea", -1, null);
        assertEquals(Outcome.Kind.INVALID_INPUT, outcome.getKind());
        assertEquals("Initial quantity cannot be negative.", outcome.getMessage());

        assertEquals(0, mStore.getWriteCount());
    }

    public void testMissingNameIsInvalidInput() throws Exception {
        Outcome[] outcomes = {
            mService.updateQuantity(null, 1, 1),
            mService.increase(null, 1),
            mService.decrease(" ", 1),
            mService.updateNotes(null, "x", 1),
            mService.delete(null, 1),
        };
        for (Outcome outcome : outcomes) {
            assertEquals(Outcome.Kind.INVALID_INPUT, outcome.getKind());
            assertEquals("Please enter a name for the item.", outcome.getMessage());
            assertFalse(outcome.isRefreshRequired());
        }
        assertEquals(0, mStore.getReadCount());
        assertEquals(0, mStore.getWriteCount());
    }

    public void testWriteUnavailable() throws Exception {
        mStore.failNextWrite(new StoreUnavailableException("timed out"));
        Outcome outcome = mService.updateQuantity("Rice", 1, 2);
        assertEquals(Outcome.Kind.STORE_UNAVAILABLE, outcome.getKind());
        assertEquals("Error communicating with the inventory store: timed out",
                     outcome.getMessage());

        // Nothing changed, so the same version still applies.
        assertTrue(mService.updateQuantity("Rice", 1, 2).isSuccess());
    }

    public void testWriteRejected() throws Exception {
        mStore.failNextWrite(new StoreRejectedException("read-only sheet"));
        Outcome outcome = mService.updateNotes("Rice", "jasmine", 2);
        assertEquals(Outcome.Kind.STORE_REJECTED, outcome.getKind());
        assertEquals("The inventory store refused the change: read-only sheet",
                     outcome.getMessage());
        assertFalse(outcome.isRefreshRequired());
    }
}
