package de.admir.unistore.core;

import de.admir.unistore.core.error.StorageError;
import de.admir.unistore.core.util.Xor;

/**
 * Builds the vendor client a provider talks to, from a connection string or a credential bundle. Invoked once per
 * provider instance.
 */
public interface StorageEndpointFactory<T> {

    Xor<StorageError, T> createEndpoint(String configuration);
}
