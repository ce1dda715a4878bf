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

package org.larder.repo.file;

import java.io.IOException;

import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import org.apache.commons.logging.Log;
import org.apache.commons.logging.LogFactory;

import org.larder.Column;
import org.larder.Row;
import org.larder.StoreRejectedException;
import org.larder.StoreUnavailableException;
import org.larder.TableStore;

import org.larder.capability.Capability;

import org.larder.spi.ExceptionTransformer;
import org.larder.spi.RowSchema;

/**
 * Table store which keeps the table in a JSON file, as an array of objects
 * keyed by column header. Any number of processes may open the same file.
 * Each write goes to a temporary file in the same directory, which then
 * atomically replaces the table, and so readers never observe a partially
 * written table. Full-table writes are not serialized against each other,
 * and so no conditional write capability is offered.
 *
 * @see JsonFileTableStoreBuilder
 */
class JsonFileTableStore implements TableStore {
    private static final TypeReference<List<Map<String, Object>>> cTableType =
        new TypeReference<List<Map<String, Object>>>() {};

    private final Log mLog = LogFactory.getLog(JsonFileTableStore.class);

    private final String mName;
    private final Path mFile;
    private final ObjectMapper mMapper;
    private final ExceptionTransformer mTransformer;

    private volatile boolean mClosed;

    JsonFileTableStore(JsonFileTableStoreBuilder builder) {
        mName = builder.getName();
        mFile = builder.getFile().toPath().toAbsolutePath();
        mMapper = new ObjectMapper();
        if (builder.isPrettyPrint()) {
            mMapper.enable(SerializationFeature.INDENT_OUTPUT);
        }
        mTransformer = new JsonExceptionTransformer();
    }

    public String getName() {
        return mName;
    }

    public List<Row> readAll() throws StoreUnavailableException {
        checkClosed();
        if (!Files.exists(mFile)) {
            return new ArrayList<Row>();
        }

        List<Map<String, Object>> table;
        try {
            table = mMapper.readValue(mFile.toFile(), cTableType);
        } catch (IOException e) {
            throw mTransformer.toStoreUnavailableException(e);
        }

        List<Row> rows = new ArrayList<Row>(table == null ? 0 : table.size());
        if (table != null) {
            for (Map<String, Object> object : table) {
                if (object != null) {
                    rows.add(toRow(object));
                }
            }
        }
        return rows;
    }

    public void writeAll(List<Row> rows) throws StoreUnavailableException, StoreRejectedException {
        checkClosed();
        RowSchema.check(rows);

        List<Map<String, String>> table = new ArrayList<Map<String, String>>(rows.size());
        for (Row row : rows) {
            table.add(row.toHeaderMap());
        }

        Path dir = mFile.getParent();
        Path temp = null;
        try {
            Files.createDirectories(dir);
            temp = Files.createTempFile(dir, mFile.getFileName().toString(), ".tmp");
            mMapper.writeValue(temp.toFile(), table);
            try {
                Files.move(temp, mFile, StandardCopyOption.REPLACE_EXISTING,
                           StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(temp, mFile, StandardCopyOption.REPLACE_EXISTING);
            }
            temp = null;
        } catch (IOException e) {
            mTransformer.throwWriteException(e);
        } finally {
            if (temp != null) {
                deleteQuietly(temp);
            }
        }
    }

    public <C extends Capability> C getCapability(Class<C> capabilityType) {
        return null;
    }

    public void close() {
        mClosed = true;
    }

    @Override
    public String toString() {
        return "JsonFileTableStore {name=" + mName + ", file=" + mFile + '}';
    }

    private void checkClosed() throws StoreUnavailableException {
        if (mClosed) {
            throw new StoreUnavailableException("Store is closed: " + mName);
        }
    }

    private void deleteQuietly(Path temp) {
        try {
            Files.deleteIfExists(temp);
        } catch (IOException e) {
            mLog.warn("Unable to delete temporary file " + temp, e);
        }
    }

    private static Row toRow(Map<String, Object> object) {
        Row row = new Row();
        for (Map.Entry<String, Object> entry : object.entrySet()) {
            Column column = Column.forHeader(entry.getKey());
            Object value = entry.getValue();
            if (column != null && value != null) {
                row.set(column, value.toString());
            }
        }
        return row;
    }
}
