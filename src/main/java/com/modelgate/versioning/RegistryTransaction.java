package com.modelgate.versioning;

/**
 * Unit of work against a fresh copy of the registry. Throwing discards every change.
 */
@FunctionalInterface
public interface RegistryTransaction<T> {
    T apply(RegistryState state);
}
