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

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import org.apache.commons.logging.Log;
import org.apache.commons.logging.LogFactory;

import org.joda.time.LocalDate;

import org.joda.time.format.DateTimeFormat;
import org.joda.time.format.DateTimeFormatter;

import org.larder.Column;
import org.larder.InventoryItem;
import org.larder.Row;

/**
 * Converts between raw table {@link Row rows} and {@link InventoryItem
 * items}. Decoding is lenient: rows whose image, name and quantity cells are
 * all blank are skipped, as are rows without a name. Malformed quantities are
 * read as zero, and versions are repaired by the {@link VersionRegistry}.
 * Each such repair is logged as a warning.
 *
 * <p>RowLayout instances are thread-safe.
 */
public class RowLayout {
    /** Pattern of the date column, as in "7/4/2025" */
    public static final String DATE_PATTERN = "M/d/yyyy";

    private static final DateTimeFormatter cDateFormat = DateTimeFormat.forPattern(DATE_PATTERN);

    private static final Log cLog = LogFactory.getLog(RowLayout.class);

    /**
     * Coerces a quantity cell into a non-negative integer. Decimal forms are
     * truncated.
     *
     * @return quantity, or zero if blank, malformed or negative
     */
    public static int coerceQuantity(String cell) {
        Integer quantity = parseQuantity(cell);
        return quantity == null ? 0 : quantity;
    }

    /**
     * Formats a date as stored in the date column.
     */
    public static String formatDate(LocalDate date) {
        return date == null ? null : cDateFormat.print(date);
    }

    /**
     * @return null if malformed
     */
    private static Integer parseQuantity(String cell) {
        if (cell == null) {
            return 0;
        }
        cell = cell.trim();
        if (cell.length() == 0) {
            return 0;
        }
        try {
            BigDecimal value = new BigDecimal(cell);
            if (value.signum() < 0) {
                return 0;
            }
            if (value.compareTo(BigDecimal.valueOf(Integer.MAX_VALUE)) > 0) {
                return Integer.MAX_VALUE;
            }
            return value.intValue();
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private final VersionRegistry mVersions;

    public RowLayout() {
        this(new VersionRegistry());
    }

    public RowLayout(VersionRegistry versions) {
        if (versions == null) {
            throw new IllegalArgumentException("VersionRegistry cannot be null");
        }
        mVersions = versions;
    }

    /**
     * Decodes all non-empty rows, in order. Duplicate names are retained, but
     * a warning is logged since lookups by name only ever see the first one.
     */
    public List<InventoryItem> decode(List<Row> rows) {
        List<InventoryItem> items = new ArrayList<InventoryItem>(rows.size());
        Set<String> names = new HashSet<String>();
        for (Row row : rows) {
            InventoryItem item = decode(row);
            if (item == null) {
                continue;
            }
            if (!names.add(item.getName()) && cLog.isWarnEnabled()) {
                cLog.warn("Duplicate inventory item name \"" + item.getName() +
                          "\"; only the first is addressable");
            }
            items.add(item);
        }
        return items;
    }

    /**
     * Decodes a single row.
     *
     * @return item, or null if the row is empty
     */
    public InventoryItem decode(Row row) {
        if (isEmpty(row)) {
            return null;
        }
        if (row.isBlank(Column.NAME)) {
            if (cLog.isWarnEnabled()) {
                cLog.warn("Skipping row without a name: " + row);
            }
            return null;
        }

        // Work on a copy, so that repairs don't leak into the caller's row.
        row = new Row(row);

        InventoryItem item = new InventoryItem(row.get(Column.NAME));
        item.setImage(trimToNull(row.get(Column.IMAGE)));
        item.setNotes(row.get(Column.NOTES));

        String quantityCell = row.get(Column.QUANTITY);
        Integer quantity = parseQuantity(quantityCell);
        if (quantity == null) {
            if (cLog.isWarnEnabled()) {
                cLog.warn("Malformed quantity \"" + quantityCell + "\" for " +
                          item.toStringKeyOnly() + "; treating as 0");
            }
            quantity = 0;
        }
        item.setQuantity(quantity);

        String dateCell = trimToNull(row.get(Column.DATE));
        if (dateCell != null) {
            try {
                item.setLastModified(cDateFormat.parseLocalDate(dateCell));
            } catch (IllegalArgumentException e) {
                if (cLog.isWarnEnabled()) {
                    cLog.warn("Malformed date \"" + dateCell + "\" for " +
                              item.toStringKeyOnly() + "; ignoring");
                }
            }
        }

        item.setVersion(mVersions.normalize(row));

        return item;
    }

    public List<Row> encode(List<InventoryItem> items) {
        List<Row> rows = new ArrayList<Row>(items.size());
        for (InventoryItem item : items) {
            rows.add(encode(item));
        }
        return rows;
    }

    public Row encode(InventoryItem item) {
        return new Row()
            .set(Column.IMAGE, item.getImage())
            .set(Column.NAME, item.getName())
            .set(Column.QUANTITY, String.valueOf(item.getQuantity()))
            .set(Column.NOTES, item.getNotes())
            .set(Column.DATE, formatDate(item.getLastModified()))
            .set(Column.VERSION, String.valueOf(item.getVersion()));
    }

    /**
     * Returns true if image, name and quantity are all blank.
     */
    public boolean isEmpty(Row row) {
        return row.isBlank(Column.IMAGE)
            && row.isBlank(Column.NAME)
            && row.isBlank(Column.QUANTITY);
    }

    private static String trimToNull(String str) {
        if (str == null) {
            return null;
        }
        str = str.trim();
        return str.length() == 0 ? null : str;
    }
}
