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

package org.larder.capability;

import org.larder.Row;
import org.larder.StoreRejectedException;
import org.larder.StoreUnavailableException;

/**
 * Capability for stores which can address a single row by name, and which
 * apply a row change only if the row's version cell still holds an expected
 * value. The check and the write are atomic with respect to all other
 * writers of the store, which closes the window between an inventory's
 * verification read and its write.
 *
 * <p>Versions are interpreted by {@link org.larder.layout.VersionRegistry},
 * and so a blank or malformed version cell is considered to be version 1.
 * When several rows share a name, the first one is addressed.
 */
public interface ConditionalWriteCapability extends Capability {
    /**
     * Result of a conditional row write.
     */
    enum Result {
        /** Row was found at the expected version and the change was applied */
        APPLIED,
        /** No row has the given name; nothing was changed */
        ABSENT,
        /** Row exists but its version differs; nothing was changed */
        STALE
    }

    /**
     * Replaces the named row only if its version equals the expected version.
     *
     * @param name name of row to replace
     * @param expectedVersion version the row must currently have
     * @param replacement complete replacement row
     */
    Result replaceRow(String name, int expectedVersion, Row replacement)
        throws StoreUnavailableException, StoreRejectedException;

    /**
     * Deletes the named row only if its version equals the expected version.
     */
    Result deleteRow(String name, int expectedVersion)
        throws StoreUnavailableException, StoreRejectedException;

    /**
     * Appends a row without any condition.
     */
    void appendRow(Row row) throws StoreUnavailableException, StoreRejectedException;
}
