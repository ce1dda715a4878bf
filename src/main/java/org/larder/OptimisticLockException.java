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
 * An OptimisticLockException is thrown when a mutation presents an expected
 * version which doesn't match the version currently held by the store. Some
 * other session has changed the record since the caller last observed it.
 * Nothing is written, and the caller must refresh before retrying.
 */
public class OptimisticLockException extends PersistException {

    private static final long serialVersionUID = -1937506633880155604L;

    private final transient InventoryItem mItem;
    private final Integer mExpectedVersion;
    private final Integer mSavedVersion;

    public OptimisticLockException(String message) {
        super(message);
        mItem = null;
        mExpectedVersion = null;
        mSavedVersion = null;
    }

    /**
     * @param expectedVersion version number that was expected for persistent
     * record when update was executed
     */
    public OptimisticLockException(int expectedVersion) {
        this(expectedVersion, null, null);
    }

    /**
     * @param expectedVersion version number that was expected for persistent
     * record when update was executed
     * @param savedVersion actual persistent version number of item, or null
     * if not known
     * @param item item which was acted upon, or null if not available
     */
    public OptimisticLockException(int expectedVersion, Integer savedVersion,
                                   InventoryItem item)
    {
        super(makeMessage(expectedVersion, savedVersion, item));
        mItem = item;
        mExpectedVersion = expectedVersion;
        mSavedVersion = savedVersion;
    }

    /**
     * Returns the item as currently held by the store, or null if not
     * available.
     */
    public InventoryItem getItem() {
        return mItem;
    }

    /**
     * Returns the version the caller presented, or null if not available.
     */
    public Integer getExpectedVersion() {
        return mExpectedVersion;
    }

    /**
     * Returns the version currently held by the store, or null if not
     * available.
     */
    public Integer getSavedVersion() {
        return mSavedVersion;
    }

    private static String makeMessage(int expectedVersion, Integer savedVersion,
                                      InventoryItem item)
    {
        String message;
        if (savedVersion == null) {
            message = "Update acted on version " + expectedVersion +
                ", which is no longer current";
        } else {
            message = "Update acted on version " + expectedVersion +
                ", but canonical version is " + savedVersion;
        }

        if (item != null) {
            message = message + ": " + item.toStringKeyOnly();
        }

        return message;
    }
}
