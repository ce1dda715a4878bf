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

package org.larder.layout;

import java.util.ArrayList;
import java.util.List;

import junit.framework.TestCase;
import junit.framework.TestSuite;

import org.joda.time.LocalDate;

import org.larder.Column;
import org.larder.InventoryItem;
import org.larder.Row;

/**
 * Tests for RowLayout and VersionRegistry.
 */
public class TestRowLayout extends TestCase {
    public static void main(String[] args) {
        junit.textui.TestRunner.run(suite());
    }

    public static TestSuite suite() {
        return new TestSuite(TestRowLayout.class);
    }

    public TestRowLayout(String name) {
        super(name);
    }

    private RowLayout mLayout;

    @Override
    protected void setUp() {
        mLayout = new RowLayout();
    }

    public void testDecode() {
        Row row = new Row()
            .set(Column.IMAGE, "https://example.com/rice.png")
            .set(Column.NAME, "Rice")
            .set(Column.QUANTITY, "5")
            .set(Column.NOTES, "in the pantry")
            .set(Column.DATE, "7/4/2025")
            .set(Column.VERSION, "2");

        InventoryItem item = mLayout.decode(row);
        assertEquals("Rice", item.getName());
        assertEquals("https://example.com/rice.png", item.getImage());
        assertEquals(5, item.getQuantity());
        assertEquals("in the pantry", item.getNotes());
        assertEquals(new LocalDate(2025, 7, 4), item.getLastModified());
        assertEquals(2, item.getVersion());

        assertEquals(row, mLayout.encode(item));
    }

    public void testMissingVersionIsInitial() {
        Row row = new Row().set(Column.NAME, "Rice").set(Column.QUANTITY, "5");
        assertEquals(VersionRegistry.INITIAL_VERSION, mLayout.decode(row).getVersion());
        // The caller's row isn't repaired in place.
        assertNull(row.get(Column.VERSION));
    }

    public void testMalformedVersionIsInitial() {
        String[] cells = {"", "  ", "abc", "0", "-3", "2.5"};
        for (String cell : cells) {
            Row row = new Row().set(Column.NAME, "Rice").set(Column.VERSION, cell);
            assertEquals(cell, 1, mLayout.decode(row).getVersion());
            assertEquals(cell, 1, VersionRegistry.versionOf(row));
        }
    }

    public void testIntegralDecimalVersion() {
        Row row = new Row().set(Column.NAME, "Rice").set(Column.VERSION, "4.0");
        assertEquals(4, mLayout.decode(row).getVersion());

        VersionRegistry registry = new VersionRegistry();
        assertEquals(4, registry.normalize(row));
        assertEquals("4", row.get(Column.VERSION));
    }

    public void testNextVersion() {
        assertEquals(2, VersionRegistry.nextVersion(1));
        try {
            VersionRegistry.nextVersion(Integer.MAX_VALUE);
            fail();
        } catch (IllegalStateException e) {
        }
    }

    public void testQuantityCoercion() {
        assertEquals(0, RowLayout.coerceQuantity(null));
        assertEquals(0, RowLayout.coerceQuantity(""));
        assertEquals(0, RowLayout.coerceQuantity("lots"));
        assertEquals(0, RowLayout.coerceQuantity("-1"));
        assertEquals(3, RowLayout.coerceQuantity(" 3 "));
        assertEquals(3, RowLayout.coerceQuantity("3.0"));
        assertEquals(3, RowLayout.coerceQuantity("3.9"));

        Row row = new Row().set(Column.NAME, "Rice").set(Column.QUANTITY, "a few");
        assertEquals(0, mLayout.decode(row).getQuantity());
        row.set(Column.QUANTITY, "-2");
        assertEquals(0, mLayout.decode(row).getQuantity());
    }

    public void testMalformedDateIsDropped() {
        Row row = new Row().set(Column.NAME, "Rice").set(Column.DATE, "yesterday");
        assertNull(mLayout.decode(row).getLastModified());
    }

    public void testEmptyAndNamelessRowsSkipped() {
        List<Row> rows = new ArrayList<Row>();
        rows.add(new Row().set(Column.NOTES, "stray note"));
        rows.add(new Row().set(Column.NAME, "Rice").set(Column.QUANTITY, "1"));
        rows.add(new Row().set(Column.QUANTITY, "4"));
        rows.add(new Row().set(Column.NAME, "Salt"));

        List<InventoryItem> items = mLayout.decode(rows);
        assertEquals(2, items.size());
        assertEquals("Rice", items.get(0).getName());
        assertEquals("Salt", items.get(1).getName());
    }

    public void testDuplicateNamesRetainedInOrder() {
        List<Row> rows = new ArrayList<Row>();
        rows.add(new Row().set(Column.NAME, "Rice").set(Column.QUANTITY, "1"));
        rows.add(new Row().set(Column.NAME, "Rice").set(Column.QUANTITY, "2"));

        List<InventoryItem> items = mLayout.decode(rows);
        assertEquals(2, items.size());
        assertEquals(1, items.get(0).getQuantity());
        assertEquals(2, items.get(1).getQuantity());
    }

    public void testEncodeOmitsBlankCells() {
        InventoryItem item = new InventoryItem("Salt");
        item.setVersion(1);
        Row row = mLayout.encode(item);
        assertNull(row.get(Column.IMAGE));
        assertNull(row.get(Column.NOTES));
        assertNull(row.get(Column.DATE));
        assertEquals("0", row.get(Column.QUANTITY));
        assertEquals("1", row.get(Column.VERSION));
    }
}
