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

package org.larder.spi;

import java.util.List;

import org.larder.Column;
import org.larder.Row;
import org.larder.StoreRejectedException;

/**
 * Schema checks applied by stores before accepting a write. Every row must
 * be present and must have a name.
 */
public class RowSchema {
    private RowSchema() {
    }

    /**
     * @throws StoreRejectedException if any row violates the schema
     * @throws IllegalArgumentException if rows is null
     */
    public static void check(List<Row> rows) throws StoreRejectedException {
        if (rows == null) {
            throw new IllegalArgumentException("Rows cannot be null");
        }
        for (int i=0; i<rows.size(); i++) {
            check(rows.get(i), i);
        }
    }

    /**
     * @param index position of row, for the exception message
     * @throws StoreRejectedException if row violates the schema
     */
    public static void check(Row row, int index) throws StoreRejectedException {
        if (row == null) {
            throw new StoreRejectedException("Row " + index + " is null");
        }
        if (row.isBlank(Column.NAME)) {
            throw new StoreRejectedException
                ("Row " + index + " has no " + Column.NAME.getHeader() + ": " + row);
        }
    }
}
