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
 * The namespace does not exist under the storage root.
 */
public class NamespaceNotFoundException extends KvStoreException {

    private final String namespace;

    public NamespaceNotFoundException(String namespace) {
        super("Namespace '" + namespace + "' does not exist");
        this.namespace = namespace;
    }

    public String namespace() {
        return namespace;
    }
}
