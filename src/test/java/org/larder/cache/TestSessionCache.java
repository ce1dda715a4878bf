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

package org.larder.cache;

import java.util.ArrayList;
import java.util.List;

import junit.framework.TestCase;
import junit.framework.TestSuite;

import org.joda.time.DateTimeUtils;

import org.larder.InventoryItem;
import org.larder.StoreUnavailableException;

/**
 * Tests for SessionCache.
 */
public class TestSessionCache extends TestCase {
    public static void main(String[] args) {
        junit.textui.TestRunner.run(suite());
    }

    public static TestSuite suite() {
        return new TestSuite(TestSessionCache.class);
    }

    public TestSessionCache(String name) {
        super(name);
    }

    private CountingLoader mLoader;

    @Override
    protected void setUp() {
        DateTimeUtils.setCurrentMillisFixed(1000000L);
        mLoader = new CountingLoader();
    }

    @Override
    protected void tearDown() {
        DateTimeUtils.setCurrentMillisSystem();
    }

    public void testReadThrough() throws Exception {
        SessionCache cache = new SessionCache();
        assertFalse(cache.isLoaded());

        assertEquals(1, cache.get(mLoader).size());
        assertEquals(1, cache.get(mLoader).size());
        assertEquals(1, mLoader.mCount);
        assertEquals(1, cache.getLoadCount());
        assertTrue(cache.isLoaded());
    }

    public void testInvalidateForcesReload() throws Exception {
        SessionCache cache = new SessionCache();
        cache.get(mLoader);
        cache.invalidate();
        assertFalse(cache.isLoaded());
        cache.get(mLoader);
        assertEquals(2, mLoader.mCount);
        assertEquals(1, cache.getInvalidateCount());
    }

    public void testSnapshotIsCopied() throws Exception {
        SessionCache cache = new SessionCache();
        List<InventoryItem> items = cache.get(mLoader);
        items.get(0).setQuantity(99);
        items.clear();

        items = cache.get(mLoader);
        assertEquals(1, items.size());
        assertEquals(3, items.get(0).getQuantity());
    }

    public void testExpiry() throws Exception {
        SessionCache cache = new SessionCache(5000);
        cache.get(mLoader);

        DateTimeUtils.setCurrentMillisFixed(1004999L);
        cache.get(mLoader);
        assertEquals(1, mLoader.mCount);

        DateTimeUtils.setCurrentMillisFixed(1005000L);
        assertFalse(cache.isLoaded());
        cache.get(mLoader);
        assertEquals(2, mLoader.mCount);
    }

    public void testZeroTtlNeverExpires() throws Exception {
        SessionCache cache = new SessionCache(0);
        cache.get(mLoader);
        DateTimeUtils.setCurrentMillisFixed(Long.MAX_VALUE / 2);
        cache.get(mLoader);
        assertEquals(1, mLoader.mCount);
    }

    public void testFailedLoadLeavesCacheEmpty() throws Exception {
        SessionCache cache = new SessionCache();
        cache.get(mLoader);
        cache.invalidate();

        mLoader.mFail = true;
        try {
            cache.get(mLoader);
            fail();
        } catch (StoreUnavailableException e) {
        }
        assertFalse(cache.isLoaded());

        mLoader.mFail = false;
        assertEquals(1, cache.get(mLoader).size());
    }

    public void testNegativeTtl() {
        try {
            new SessionCache(-1);
            fail();
        } catch (IllegalArgumentException e) {
        }
    }

    private static class CountingLoader implements SessionCache.Loader {
        int mCount;
        boolean mFail;

        public List<InventoryItem> load() throws StoreUnavailableException {
            if (mFail) {
                throw new StoreUnavailableException("offline");
            }
            mCount++;
            List<InventoryItem> items = new ArrayList<InventoryItem>();
            InventoryItem item = new InventoryItem("Rice");
            item.setQuantity(3);
            item.setVersion(1);
            items.add(item);
            return items;
        }
    }
}
