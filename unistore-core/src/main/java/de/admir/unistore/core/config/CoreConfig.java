package de.admir.unistore.core.config;

import java.time.Duration;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;

public class CoreConfig {
    public static final Config CONFIG = ConfigFactory.load();

    private CoreConfig() {
    }

    public static String getBackend(Config config) {
        return config.getString("unistore.backend");
    }

    public static int getDeleteBatchThreshold(Config config) {
        return config.getInt("unistore.delete-batch-threshold");
    }

    public static Duration getSecretsCacheTtl() {
        return CONFIG.getDuration("unistore.secrets.cache-ttl");
    }
}
