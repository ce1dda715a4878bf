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

import com.fasterxml.jackson.core.JsonGenerationException;
import com.fasterxml.jackson.databind.JsonMappingException;

import org.larder.StoreRejectedException;

import org.larder.spi.ExceptionTransformer;

/**
 * Treats content which Jackson refuses to serialize as a rejected write.
 * Failures to parse the stored table remain unavailability, since the
 * caller cannot correct them.
 */
class JsonExceptionTransformer extends ExceptionTransformer {
    @Override
    protected StoreRejectedException transformIntoStoreRejectedException(Throwable e) {
        StoreRejectedException re = super.transformIntoStoreRejectedException(e);
        if (re != null) {
            return re;
        }
        if (e instanceof JsonGenerationException || e instanceof JsonMappingException) {
            return new StoreRejectedException(e.getMessage(), e);
        }
        return null;
    }
}
