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

import org.apache.commons.logging.Log;
import org.apache.commons.logging.LogFactory;

import org.larder.Column;
import org.larder.Row;

/**
 * Guarantees that every row carries a well-formed version. Versions are
 * positive integers, starting at {@link #INITIAL_VERSION} and incremented by
 * exactly one on every successful mutation.
 *
 * <p>A row whose version cell is missing, blank, non-numeric or less than one
 * is treated as being at the initial version. This is a repair, not a
 * conflict, and it is persisted by the next successful write of the table.
 */
public class VersionRegistry {
    public static final int INITIAL_VERSION = 1;

    private static final Log cLog = LogFactory.getLog(VersionRegistry.class);

    /**
     * Returns the version held by the given row, applying the same repair
     * rules as {@link #normalize}, but without logging.
     */
    public static int versionOf(Row row) {
        Integer version = parse(row.get(Column.VERSION));
        return version == null ? INITIAL_VERSION : version;
    }

    /**
     * Returns the version which follows the given one.
     *
     * @throws IllegalStateException if version would overflow
     */
    public static int nextVersion(int version) {
        if (version == Integer.MAX_VALUE) {
            throw new IllegalStateException("Version overflow");
        }
        return version + 1;
    }

    /**
     * Parses a version cell, accepting integral decimal forms such as "3.0"
     * as written by some spreadsheet exports.
     *
     * @return version, or null if cell is blank or malformed
     */
    static Integer parse(String cell) {
        if (cell == null) {
            return null;
        }
        cell = cell.trim();
        if (cell.length() == 0) {
            return null;
        }
        try {
            BigDecimal value = new BigDecimal(cell);
            int version = value.intValueExact();
            return version < INITIAL_VERSION ? null : version;
        } catch (NumberFormatException e) {
            return null;
        } catch (ArithmeticException e) {
            // Fractional or out of range.
            return null;
        }
    }

    public VersionRegistry() {
    }

    /**
     * Returns the version of the given row, repairing it to the initial
     * version if the cell is not well-formed. The row itself is updated to
     * hold the canonical form of the version.
     */
    public int normalize(Row row) {
        String cell = row.get(Column.VERSION);
        Integer version = parse(cell);
        if (version == null) {
            if (cLog.isWarnEnabled()) {
                if (cell == null) {
                    cLog.warn("Row for \"" + row.get(Column.NAME) +
                              "\" has no version; assuming " + INITIAL_VERSION);
                } else {
                    cLog.warn("Row for \"" + row.get(Column.NAME) +
                              "\" has malformed version \"" + cell +
                              "\"; assuming " + INITIAL_VERSION);
                }
            }
            version = INITIAL_VERSION;
        }
        row.set(Column.VERSION, String.valueOf(version));
        return version;
    }
}
