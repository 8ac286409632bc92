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
 * The table does not exist in its namespace.
 */
public class TableNotFoundException extends KvStoreException {

    private final String namespace;
    private final String table;

    public TableNotFoundException(String namespace, String table) {
        super("Table '" + table + "' does not exist in namespace '" + namespace + "'");
        this.namespace = namespace;
        this.table = table;
    }

    public String namespace() {
        return namespace;
    }

    public String table() {
        return table;
    }
}
