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

import java.io.File;
import java.util.Collection;

import org.larder.ConfigurationException;
import org.larder.TableStore;

import org.larder.spi.AbstractTableStoreBuilder;

/**
 * Builds a table store backed by a JSON file, which several processes may
 * share. The file need not exist until the first write.
 *
 * Example:
 *
 * <pre>
 * JsonFileTableStoreBuilder builder = new JsonFileTableStoreBuilder();
 * builder.setName("pantry");
 * builder.setFile(new File("/var/lib/larder/pantry.json"));
 * TableStore store = builder.build();
 * </pre>
 */
public class JsonFileTableStoreBuilder extends AbstractTableStoreBuilder {
    private String mName;
    private File mFile;
    private boolean mPrettyPrint = true;

    public JsonFileTableStoreBuilder() {
    }

    public TableStore build() throws ConfigurationException {
        if (mName == null && mFile != null) {
            mName = mFile.getName();
        }
        assertReady();
        return new JsonFileTableStore(this);
    }

    public String getName() {
        return mName;
    }

    public void setName(String name) {
        mName = name;
    }

    /**
     * Set the file which holds the table, which is required.
     */
    public void setFile(File file) {
        mFile = file;
    }

    public File getFile() {
        return mFile;
    }

    /**
     * By default, the file is written with indentation. Pass false to write
     * it compactly.
     */
    public void setPrettyPrint(boolean pretty) {
        mPrettyPrint = pretty;
    }

    public boolean isPrettyPrint() {
        return mPrettyPrint;
    }

    @Override
    public void errorCheck(Collection<String> messages) throws ConfigurationException {
        super.errorCheck(messages);
        if (mFile == null) {
            messages.add("file missing");
        } else if (mFile.isDirectory()) {
            messages.add("file is a directory: " + mFile);
        }
    }
}
