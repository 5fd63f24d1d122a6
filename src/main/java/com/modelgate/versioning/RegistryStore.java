package com.modelgate.versioning;

import java.io.IOException;

/**
 * Authoritative registry storage. {@link #transact} runs its transaction against the latest state
 * and commits it atomically with respect to every other transaction on the same store.
 */
public interface RegistryStore {

    RegistryState snapshot() throws IOException;

    <T> T transact(RegistryTransaction<T> transaction) throws IOException;
}
