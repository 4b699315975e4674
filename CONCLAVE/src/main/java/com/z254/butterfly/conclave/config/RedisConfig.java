package com.z254.butterfly.conclave.config;

import com.z254.butterfly.conclave.config.ConclaveProperties.StoreProperties;
import io.lettuce.core.ClientOptions;
import io.lettuce.core.SslOptions;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.connection.RedisPassword;
import org.springframework.data.redis.connection.RedisStandaloneConfiguration;
import org.springframework.data.redis.connection.lettuce.LettuceClientConfiguration;
import org.springframework.data.redis.connection.lettuce.LettuceConnectionFactory;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.io.File;

/**
 * Redis connection for the shared store, built from {@code conclave.store}.
 */
@Slf4j
@Configuration
@ConditionalOnProperty(prefix = "conclave.store", name = "use-redis", havingValue = "true")
public class RedisConfig {

    @Bean
    public LettuceConnectionFactory conclaveRedisConnectionFactory(ConclaveProperties properties) {
        StoreProperties store = properties.getStore();
        StoreSettingsValidator.requireValid(store);

        RedisStandaloneConfiguration server = new RedisStandaloneConfiguration(store.getRedisHost(), store.getRedisPort());
        if (store.getRedisUsername() != null && !store.getRedisUsername().isBlank()) {
            server.setUsername(store.getRedisUsername());
        }
        if (store.getRedisPassword() != null && !store.getRedisPassword().isBlank()) {
            server.setPassword(RedisPassword.of(store.getRedisPassword()));
        }

        LettuceClientConfiguration.LettuceClientConfigurationBuilder client = LettuceClientConfiguration.builder()
                .commandTimeout(store.getCommandTimeout());
        if (store.isRedisSsl()) {
            client.useSsl().and();
            client.clientOptions(ClientOptions.builder().sslOptions(sslOptions(store)).build());
        }

        log.info("Connecting shared store to Redis at {}:{} (ssl: {})",
                store.getRedisHost(), store.getRedisPort(), store.isRedisSsl());
        return new LettuceConnectionFactory(server, client.build());
    }

    @Bean
    public StringRedisTemplate conclaveRedisTemplate(LettuceConnectionFactory conclaveRedisConnectionFactory) {
        return new StringRedisTemplate(conclaveRedisConnectionFactory);
    }

    static SslOptions sslOptions(StoreProperties store) {
        SslOptions.Builder ssl = SslOptions.builder().jdkSslProvider();
        if (store.getRedisSslCertfile() != null && !store.getRedisSslCertfile().isBlank()) {
            ssl.keyManager(new File(store.getRedisSslCertfile()), new File(store.getRedisSslKeyfile()), null);
        }
        if (store.getRedisSslCaCerts() != null && !store.getRedisSslCaCerts().isBlank()) {
            ssl.trustManager(new File(store.getRedisSslCaCerts()));
        }
        return ssl.build();
    }
}
