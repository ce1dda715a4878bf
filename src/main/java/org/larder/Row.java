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

import java.util.EnumMap;
import java.util.Map;

/**
 * One raw row of the backing table, mapping each {@link Column} to a cell
 * value. A null or absent cell is blank. Rows carry no interpretation of
 * their cells; see {@link org.larder.layout.RowLayout}.
 */
public class Row {
    private final EnumMap<Column, String> mCells;

    public Row() {
        mCells = new EnumMap<Column, String>(Column.class);
    }

    public Row(Row row) {
        mCells = new EnumMap<Column, String>(row.mCells);
    }

    /**
     * Returns the cell value, or null if blank.
     */
    public String get(Column column) {
        return mCells.get(column);
    }

    /**
     * Set a cell value. A null or empty value clears the cell.
     *
     * @return this row, for chaining
     */
    public Row set(Column column, String value) {
        if (column == null) {
            throw new IllegalArgumentException("Column cannot be null");
        }
        if (value == null || value.length() == 0) {
            mCells.remove(column);
        } else {
            mCells.put(column, value);
        }
        return this;
    }

    /**
     * Returns true if the given cell is null or only whitespace.
     */
    public boolean isBlank(Column column) {
        String value = mCells.get(column);
        return value == null || value.trim().length() == 0;
    }

    /**
     * Returns a copy of all non-blank cells, keyed by column header.
     */
    public Map<String, String> toHeaderMap() {
        Map<String, String> map = new java.util.LinkedHashMap<String, String>();
        for (Map.Entry<Column, String> entry : mCells.entrySet()) {
            map.put(entry.getKey().getHeader(), entry.getValue());
        }
        return map;
    }

    @Override
    public int hashCode() {
        return mCells.hashCode();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (obj instanceof Row) {
            return mCells.equals(((Row) obj).mCells);
        }
        return false;
    }

    @Override
    public String toString() {
        return "Row " + toHeaderMap();
    }
}
