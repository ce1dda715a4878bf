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

import java.util.Random;

/**
 * General checked exception thrown when accessing an {@link Inventory} or
 * its {@link TableStore}.
 *
 * <p>Some failures are expected and recoverable, most notably an {@link
 * OptimisticLockException} raised when a caller presents a stale version. No
 * operation retries on its own behalf; a caller which chooses to retry must
 * first re-read the record to obtain a fresh version. As a convenience, this
 * class provides a bounded random wait to support such a caller-driven loop:
 *
 * <pre>
 * // Retry at most three more times
 * for (int retryCount = 3;;) {
 *     InventoryItem item = inventory.load("Rice");
 *     try {
 *         inventory.adjustQuantity("Rice", -1, item.getVersion());
 *         break;
 *     } catch (OptimisticLockException e) {
 *         // Wait up to one second before retrying
 *         retryCount = RepositoryException.backoff(e, retryCount, 1000);
 *     }
 * }
 * </pre>
 *
 * If the retry count is zero (or less) when backoff is called, then the
 * original exception is rethrown, indicating retry failure.
 */
public class RepositoryException extends Exception {

    private static final long serialVersionUID = 2104592276370419731L;

    /**
     * Waits a bounded random amount of time, to support a caller-initiated
     * retry. A retry count is required as well, which is decremented and
     * returned by this method. If the retry count is zero (or less) when this
     * method is called, then the given exception is thrown again.
     *
     * @param retryCount current retry count, if zero, throw the exception again
     * @param milliseconds upper bound on the random amount of time to wait
     * @return retryCount minus one
     * @throws E if retry count is zero
     */
    public static <E extends Throwable> int backoff(E e, int retryCount, int milliseconds)
        throws E
    {
        if (retryCount <= 0) {
            org.larder.util.ThrowUnchecked.fire(e);
        }
        if (milliseconds > 0) {
            Random rnd = cRandom;
            if (rnd == null) {
                cRandom = rnd = new Random();
            }
            if ((milliseconds = rnd.nextInt(milliseconds)) > 0) {
                try {
                    Thread.sleep(milliseconds);
                } catch (InterruptedException e2) {
                    Thread.currentThread().interrupt();
                }
                return retryCount - 1;
            }
        }
        Thread.yield();
        return retryCount - 1;
    }

    private static Random cRandom;

    public RepositoryException() {
        super();
    }

    public RepositoryException(String message) {
        super(message);
    }

    public RepositoryException(String message, Throwable cause) {
        super(message, cause);
    }

    public RepositoryException(Throwable cause) {
        super(cause);
    }

    /**
     * Recursively calls getCause, until the root cause is found. Returns this
     * if no root cause.
     */
    public Throwable getRootCause() {
        Throwable cause = this;
        while (cause.getCause() != null) {
            cause = cause.getCause();
        }
        return cause;
    }
}
