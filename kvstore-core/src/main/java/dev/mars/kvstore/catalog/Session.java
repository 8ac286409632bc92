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

import java.util.Optional;

/**
 * Per-caller context: the namespace that {@code table:key} addresses resolve against.
 * <p>
 * The catalog itself holds no current namespace. Each caller (a shell, a
 * test, a service request) owns a session and passes it into every
 * key-addressed call. Created by {@link Catalog#newSession()}; the namespace
 * is only changed through {@link Catalog#useNamespace(Session, String)}, which
 * validates it first.
 */
public final class Session {

    private volatile String namespace;

    Session() {
    }

    /** The selected namespace, if any. */
    public Optional<String> namespace() {
        return Optional.ofNullable(namespace);
    }

    /**
     * The selected namespace.
     *
     * @throws NoNamespaceSelectedException if none has been selected
     */
    public String requireNamespace() {
        String current = namespace;
        if (current == null) {
            throw new NoNamespaceSelectedException();
        }
        return current;
    }

    void select(String namespace) {
        this.namespace = namespace;
    }

    @Override
    public String toString() {
        return "Session{namespace=" + namespace + '}';
    }
}
