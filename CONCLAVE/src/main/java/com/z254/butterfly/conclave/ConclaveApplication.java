package com.z254.butterfly.conclave;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.data.redis.RedisAutoConfiguration;
import org.springframework.boot.autoconfigure.data.redis.RedisReactiveAutoConfiguration;
import org.springframework.boot.autoconfigure.data.redis.RedisRepositoriesAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

/**
 * CONCLAVE - Multi-agent coordination for the BUTTERFLY Ecosystem.
 *
 * <p>CONCLAVE provides:
 * <ul>
 *   <li>Shared Contexts - conversation state shared by agents, in process memory or Redis</li>
 *   <li>Registry - directory of agents, contexts and tools</li>
 *   <li>Collaboration - sequential, phased, chat and independent routing of agent output</li>
 *   <li>Declarative Agents - LLM agents and coordinators started from configuration</li>
 * </ul>
 *
 * <p>The Redis connection is configured from {@code conclave.store}, so Spring Boot's own
 * Redis auto-configuration is switched off.
 */
@SpringBootApplication(exclude = {
        RedisAutoConfiguration.class,
        RedisReactiveAutoConfiguration.class,
        RedisRepositoriesAutoConfiguration.class
})
@EnableConfigurationProperties
public class ConclaveApplication {

    public static void main(String[] args) {
        SpringApplication.run(ConclaveApplication.class, args);
    }
}
