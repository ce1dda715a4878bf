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

/**
 * Columns of the flat inventory table. Column order is not significant.
 */
public enum Column {
    IMAGE("Image"),
    NAME("Name"),
    QUANTITY("Quantity"),
    NOTES("Notes"),
    DATE("Date"),
    VERSION("Version");

    private final String mHeader;

    private Column(String header) {
        mHeader = header;
    }

    /**
     * Returns the column header as it appears in the backing table.
     */
    public String getHeader() {
        return mHeader;
    }

    /**
     * Returns the column for the given header, or null if not a known column.
     * Matching is exact, and so is case sensitive.
     */
    public static Column forHeader(String header) {
        for (Column column : values()) {
            if (column.mHeader.equals(header)) {
                return column;
            }
        }
        return null;
    }
}
