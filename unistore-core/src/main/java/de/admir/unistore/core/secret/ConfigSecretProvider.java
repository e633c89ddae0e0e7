package de.admir.unistore.core.secret;

import de.admir.unistore.core.error.StorageError;
import de.admir.unistore.core.error.StorageErrorType;
import de.admir.unistore.core.util.Xor;

import java.util.Objects;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigUtil;

import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads secrets from {@code unistore.secrets.values}. Values are usually substituted from environment variables in
 * {@code application.conf}, e.g. {@code azure-connection-string = ${?AZURE_STORAGE_CONNECTION_STRING}}.
 */
public class ConfigSecretProvider implements SecretProvider {
    private static final Logger logger = LoggerFactory.getLogger(ConfigSecretProvider.class);

    static final String SECRETS_PATH = "unistore.secrets.values";

    private final Config config;

    public ConfigSecretProvider(Config config) {
        this.config = Objects.requireNonNull(config, "config");
    }

    @Override
    public Xor<StorageError, String> getSecret(String name) {
        if (StringUtils.isBlank(name))
            return Xor.left(StorageError.invalidArgument("Secret name cannot be null or empty", null));

        String path = SECRETS_PATH + "." + ConfigUtil.quoteString(name);
        try {
            if (!config.hasPath(path)) {
                logger.warn(String.format("Secret not configured: %s", name));
                return Xor.left(new StorageError("Secret not found: " + name, StorageErrorType.NOT_FOUND, null));
            }
            String value = config.getString(path);
            if (StringUtils.isBlank(value))
                return Xor.left(new StorageError("Secret is empty: " + name, StorageErrorType.NOT_FOUND, null));
            return Xor.right(value);
        } catch (ConfigException e) {
            logger.error(String.format("Could not read secret: %s", name), e);
            return Xor.left(new StorageError("Could not read secret: " + name, e, StorageErrorType.BACKEND_UNAVAILABLE, null));
        }
    }
}
