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

import junit.framework.TestCase;
import junit.framework.TestSuite;

import org.larder.StoreRejectedException;
import org.larder.StoreUnavailableException;

/**
 * Tests for ExceptionTransformer.
 */
public class TestExceptionTransformer extends TestCase {
    public static void main(String[] args) {
        junit.textui.TestRunner.run(suite());
    }

    public static TestSuite suite() {
        return new TestSuite(TestExceptionTransformer.class);
    }

    public TestExceptionTransformer(String name) {
        super(name);
    }

    private ExceptionTransformer mTransformer;

    @Override
    protected void setUp() {
        mTransformer = new ExceptionTransformer();
    }

    public void testUnavailable() {
        StoreUnavailableException e = new StoreUnavailableException("down");
        assertSame(e, mTransformer.toStoreUnavailableException(e));

        IOException io = new IOException("disk gone");
        e = mTransformer.toStoreUnavailableException(io);
        assertEquals("disk gone", e.getMessage());
        assertSame(io, e.getCause());

        e = mTransformer.toStoreUnavailableException(new TimeoutException());
        assertEquals("Timed out", e.getMessage());

        // Causes are inspected too.
        e = mTransformer.toStoreUnavailableException(new RuntimeException(io));
        assertSame(io, e.getCause());

        RuntimeException other = new IllegalStateException("odd");
        e = mTransformer.toStoreUnavailableException(other);
        assertSame(other, e.getCause());
    }

    public void testInterruptRestored() {
        StoreUnavailableException e =
            mTransformer.toStoreUnavailableException(new ClosedByInterruptException());
        assertEquals("Interrupted", e.getMessage());
        assertTrue(Thread.interrupted());
    }

    public void testRejected() {
        assertNull(mTransformer.toStoreRejectedException(new IOException()));
        StoreRejectedException re = new StoreRejectedException("no");
        assertSame(re, mTransformer.toStoreRejectedException(re));
        assertSame(re, mTransformer.toStoreRejectedException(new RuntimeException(re)));
    }

    public void testThrowWriteException() {
        try {
            mTransformer.throwWriteException(new StoreRejectedException("no"));
            fail();
        } catch (StoreRejectedException e) {
        } catch (StoreUnavailableException e) {
            fail();
        }
        try {
            mTransformer.throwWriteException(new IOException("full"));
            fail();
        } catch (StoreRejectedException e) {
            fail();
        } catch (StoreUnavailableException e) {
            assertEquals("full", e.getMessage());
        }
    }
}
