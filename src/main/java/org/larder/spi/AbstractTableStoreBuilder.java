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

import java.util.ArrayList;
import java.util.Collection;

import org.larder.ConfigurationException;
import org.larder.TableStoreBuilder;

/**
 * Abstract builder class for opening table stores.
 */
public abstract class AbstractTableStoreBuilder implements TableStoreBuilder {
    protected AbstractTableStoreBuilder() {
    }

    /**
     * Throw a configuration exception if the configuration is not filled out
     * sufficiently and correctly such that a store could be instantiated
     * from it.
     */
    public final void assertReady() throws ConfigurationException {
        ArrayList<String> messages = new ArrayList<String>();
        errorCheck(messages);
        throwIfAny(messages);
    }

    /**
     * This method is called by assertReady, and subclasses must override to
     * perform custom checks. Be sure to call {@code super.errorCheck} as well.
     *
     * @param messages add any error messages to this list
     * @throws ConfigurationException if error checking indirectly caused
     * another exception
     */
    public void errorCheck(Collection<String> messages) throws ConfigurationException {
        if (getName() == null) {
            messages.add("name missing");
        }
    }

    /**
     * Combines the given error messages into a single configuration
     * exception, unless there are none.
     */
    public static void throwIfAny(Collection<String> messages) throws ConfigurationException {
        int size = messages.size();
        if (size == 0) {
            return;
        }
        StringBuilder b = new StringBuilder();
        if (size > 1) {
            b.append("Multiple problems: ");
        }
        int i = 0;
        for (String message : messages) {
            if (i++ > 0) {
                b.append("; ");
            }
            b.append(message);
        }
        throw new ConfigurationException(b.toString());
    }
}
