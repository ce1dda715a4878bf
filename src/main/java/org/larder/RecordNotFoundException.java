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
 * A RecordNotFoundException is thrown when a mutation names a record which
 * is absent from the store at verification time. Usually the record was
 * deleted or renamed by another session, and the caller should refresh.
 */
public class RecordNotFoundException extends PersistException {

    private static final long serialVersionUID = 3960210986421544571L;

    private final String mName;

    public RecordNotFoundException(String name) {
        super("No inventory item named \"" + name + '"');
        mName = name;
    }

    public RecordNotFoundException(String name, String message) {
        super(message);
        mName = name;
    }

    /**
     * Returns the name of the record which was not found.
     */
    public String getName() {
        return mName;
    }
}
