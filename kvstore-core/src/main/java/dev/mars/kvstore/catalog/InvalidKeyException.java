/*
 * Copyright 2026 Mark Andrew Ray-Smith
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
package dev.mars.kvstore.catalog;

import dev.mars.kvstore.KvStoreException;

/**
 * A qualified key was not of the form {@code table:key} (or {@code table:key:value}).
 */
public class InvalidKeyException extends KvStoreException {

    public InvalidKeyException(String message) {
        super(message);
    }
}
