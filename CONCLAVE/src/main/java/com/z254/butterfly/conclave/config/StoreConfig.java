package com.z254.butterfly.conclave.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.z254.butterfly.conclave.agent.AgentServices;
import com.z254.butterfly.conclave.collaboration.CollaborationController;
import com.z254.butterfly.conclave.config.ConclaveProperties.StoreProperties;
import com.z254.butterfly.conclave.observability.ConclaveMetrics;
import com.z254.butterfly.conclave.registry.Registry;
import com.z254.butterfly.conclave.store.LocalSharedStore;
import com.z254.butterfly.conclave.store.RedisSharedStore;
import com.z254.butterfly.conclave.store.SharedStore;
import com.z254.butterfly.conclave.support.ConclaveJson;
import com.z254.butterfly.conclave.transport.InProcessMessageBus;
import com.z254.butterfly.conclave.transport.MessageCodec;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.StringRedisTemplate;

/**
 * Shared store, registry and messaging beans. The store backend is picked once, here.
 */
@Configuration
public class StoreConfig {

    @Bean
    public ObjectMapper conclaveObjectMapper() {
        return ConclaveJson.mapper();
    }

    @Bean
    public SharedStore sharedStore(ConclaveProperties properties,
                                   ObjectProvider<StringRedisTemplate> redisTemplate,
                                   ConclaveMetrics metrics) {
        StoreProperties store = properties.getStore();
        StoreSettingsValidator.requireValid(store);
        if (!store.isUseRedis()) {
            return new LocalSharedStore();
        }
        return new RedisSharedStore(redisTemplate.getObject(), store.getMaxCommitAttempts(), metrics);
    }

    @Bean(destroyMethod = "close")
    public Registry registry(SharedStore sharedStore, ObjectMapper conclaveObjectMapper, ConclaveProperties properties) {
        return new Registry(sharedStore, conclaveObjectMapper, properties.getStore().getKeyPrefix());
    }

    @Bean
    public CollaborationController collaborationController() {
        return new CollaborationController();
    }

    @Bean
    public AgentServices agentServices(Registry registry, CollaborationController collaborationController,
                                       ConclaveMetrics metrics) {
        return new AgentServices(registry, collaborationController, metrics);
    }

    @Bean
    public MessageCodec messageCodec(ObjectMapper conclaveObjectMapper) {
        return new MessageCodec(conclaveObjectMapper);
    }

    @Bean
    public InProcessMessageBus inProcessMessageBus() {
        return new InProcessMessageBus();
    }
}
