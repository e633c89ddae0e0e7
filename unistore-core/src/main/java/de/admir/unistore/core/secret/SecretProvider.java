package de.admir.unistore.core.secret;

import de.admir.unistore.core.error.StorageError;
import de.admir.unistore.core.util.Xor;

/**
 * Supplies connection strings and credential bundles. Consulted once when a provider is built, never per operation.
 */
public interface SecretProvider {

    /**
     * @return the secret value, {@code NOT_FOUND} if no such secret exists or {@code BACKEND_UNAVAILABLE} if the
     * secret store could not be reached
     */
    Xor<StorageError, String> getSecret(String name);
}
