package com.z254.butterfly.conclave.config;

import com.z254.butterfly.conclave.config.ConclaveProperties.StoreProperties;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Checks {@code conclave.store} settings before any connection is attempted.
 */
public final class StoreSettingsValidator {

    private StoreSettingsValidator() {
    }

    /**
     * @return the problems found, empty when the settings are usable
     */
    public static List<String> validate(StoreProperties store) {
        List<String> errors = new ArrayList<>();
        if (isBlank(store.getKeyPrefix())) {
            errors.add("key-prefix must not be blank");
        }
        if (store.getMaxCommitAttempts() < 0) {
            errors.add("max-commit-attempts must be 0 (unbounded) or positive");
        }
        if (!store.isUseRedis()) {
            return errors;
        }
        if (isBlank(store.getRedisHost())) {
            errors.add("redis-host is required when use-redis is set");
        }
        if (store.getRedisPort() < 1 || store.getRedisPort() > 65535) {
            errors.add("redis-port must be between 1 and 65535, got " + store.getRedisPort());
        }
        if (!isBlank(store.getRedisUsername()) && isBlank(store.getRedisPassword())) {
            errors.add("redis-username requires redis-password");
        }
        if (store.getCommandTimeout() == null || store.getCommandTimeout().isNegative()
                || store.getCommandTimeout().isZero()) {
            errors.add("command-timeout must be positive");
        }
        boolean certfile = !isBlank(store.getRedisSslCertfile());
        boolean keyfile = !isBlank(store.getRedisSslKeyfile());
        boolean caCerts = !isBlank(store.getRedisSslCaCerts());
        if ((certfile || keyfile || caCerts) && !store.isRedisSsl()) {
            errors.add("redis-ssl-* files require redis-ssl");
        }
        if (certfile != keyfile) {
            errors.add("redis-ssl-certfile and redis-ssl-keyfile must be set together");
        }
        checkReadable("redis-ssl-certfile", store.getRedisSslCertfile(), errors);
        checkReadable("redis-ssl-keyfile", store.getRedisSslKeyfile(), errors);
        checkReadable("redis-ssl-ca-certs", store.getRedisSslCaCerts(), errors);
        return errors;
    }

    /**
     * @throws InvalidStoreConfigurationException if {@link #validate} reports problems
     */
    public static void requireValid(StoreProperties store) {
        List<String> errors = validate(store);
        if (!errors.isEmpty()) {
            throw new InvalidStoreConfigurationException(errors);
        }
    }

    private static void checkReadable(String property, String file, List<String> errors) {
        if (!isBlank(file) && !Files.isReadable(Path.of(file))) {
            errors.add(property + " is not a readable file: " + file);
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
