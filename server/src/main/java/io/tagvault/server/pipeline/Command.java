// file: server/src/main/java/io/tagvault/server/pipeline/Command.java
package io.tagvault.server.pipeline;

import io.tagvault.server.store.EntityStore;

/**
 * Business logic run by the pipeline against a rehydrated store.
 * Throws a {@code TagVaultException} subtype to reject the operation.
 */
@FunctionalInterface
public interface Command<T> {
    T execute(EntityStore store);
}
