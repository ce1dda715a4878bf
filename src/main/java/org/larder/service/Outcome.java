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

package org.larder.service;

import org.larder.InventoryItem;

/**
 * Result of an inventory operation requested through {@link InventoryService},
 * carrying a message fit for display to a person.
 */
public class Outcome {
    public static enum Kind {
        /** Operation was applied */
        SUCCESS,
        /** Store could not be reached; nothing was changed */
        STORE_UNAVAILABLE,
        /** Store refused the write; nothing was changed */
        STORE_REJECTED,
        /** Named item no longer exists; refresh and retry */
        RECORD_NOT_FOUND,
        /** Item was changed by another session; refresh and retry */
        VERSION_CONFLICT,
        /** Request itself was invalid */
        INVALID_INPUT
    }

    static Outcome success(String message, InventoryItem item) {
        return new Outcome(Kind.SUCCESS, message, item, null);
    }

    static Outcome failure(Kind kind, String message, Exception cause) {
        return new Outcome(kind, message, null, cause);
    }

    private final Kind mKind;
    private final String mMessage;
    private final InventoryItem mItem;
    private final Exception mCause;

    private Outcome(Kind kind, String message, InventoryItem item, Exception cause) {
        mKind = kind;
        mMessage = message;
        mItem = item;
        mCause = cause;
    }

    public Kind getKind() {
        return mKind;
    }

    public boolean isSuccess() {
        return mKind == Kind.SUCCESS;
    }

    /**
     * Returns true if the caller should refresh its view and may then try
     * again.
     */
    public boolean isRefreshRequired() {
        return mKind == Kind.RECORD_NOT_FOUND || mKind == Kind.VERSION_CONFLICT;
    }

    public String getMessage() {
        return mMessage;
    }

    /**
     * Returns the item as updated, added or just deleted, or null if the
     * operation failed.
     */
    public InventoryItem getItem() {
        return mItem;
    }

    /**
     * Returns the exception which caused a failure, or null if none.
     */
    public Exception getCause() {
        return mCause;
    }

    @Override
    public String toString() {
        return "Outcome {kind=" + mKind + ", message=" + mMessage + '}';
    }
}
