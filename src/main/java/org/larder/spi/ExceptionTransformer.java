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

import java.io.IOException;
import java.nio.channels.ClosedByInterruptException;
import java.util.concurrent.TimeoutException;

import org.larder.StoreRejectedException;
import org.larder.StoreUnavailableException;

/**
 * Supports transforming arbitrary exceptions into appropriate store
 * exceptions. Stores will likely extend this class, providing custom
 * transformation rules.
 */
public class ExceptionTransformer {
    public ExceptionTransformer() {
    }

    /**
     * Transforms the given throwable into an appropriate unavailable
     * exception. If it already is one, it is simply casted.
     *
     * @param e required exception to transform
     * @return StoreUnavailableException, never null
     */
    public StoreUnavailableException toStoreUnavailableException(Throwable e) {
        StoreUnavailableException ue = transformIntoStoreUnavailableException(e);
        if (ue != null) {
            return ue;
        }

        Throwable cause = e.getCause();
        if (cause != null) {
            ue = transformIntoStoreUnavailableException(cause);
            if (ue != null) {
                return ue;
            }
        } else {
            cause = e;
        }

        return new StoreUnavailableException(cause);
    }

    /**
     * Transforms the given throwable into a rejection, if it represents one.
     *
     * @param e required exception to transform
     * @return StoreRejectedException, or null if not a rejection
     */
    public StoreRejectedException toStoreRejectedException(Throwable e) {
        StoreRejectedException re = transformIntoStoreRejectedException(e);
        if (re == null && e.getCause() != null) {
            re = transformIntoStoreRejectedException(e.getCause());
        }
        return re;
    }

    /**
     * Throws an exception appropriate for a failed write. Rejections take
     * precedence, and all other failures are reported as unavailability.
     *
     * @param e required exception to transform
     */
    public void throwWriteException(Throwable e)
        throws StoreUnavailableException, StoreRejectedException
    {
        StoreRejectedException re = toStoreRejectedException(e);
        if (re != null) {
            throw re;
        }
        throw toStoreUnavailableException(e);
    }

    /**
     * Override to support custom transformations, returning null if none is
     * applicable. Be sure to call super first. If it returns non-null, return
     * that result.
     *
     * @param e required exception to transform
     * @return StoreUnavailableException, or null if no applicable transform
     */
    protected StoreUnavailableException transformIntoStoreUnavailableException(Throwable e) {
        if (e instanceof StoreUnavailableException) {
            return (StoreUnavailableException) e;
        }
        if (e instanceof InterruptedException || e instanceof ClosedByInterruptException) {
            Thread.currentThread().interrupt();
            return new StoreUnavailableException("Interrupted", e);
        }
        if (e instanceof TimeoutException) {
            return new StoreUnavailableException("Timed out", e);
        }
        if (e instanceof IOException) {
            return new StoreUnavailableException(e.getMessage(), e);
        }
        return null;
    }

    /**
     * Override to support custom transformations, returning null if none is
     * applicable. Be sure to call super first. If it returns non-null, return
     * that result.
     *
     * @param e required exception to transform
     * @return StoreRejectedException, or null if no applicable transform
     */
    protected StoreRejectedException transformIntoStoreRejectedException(Throwable e) {
        if (e instanceof StoreRejectedException) {
            return (StoreRejectedException) e;
        }
        return null;
    }
}
