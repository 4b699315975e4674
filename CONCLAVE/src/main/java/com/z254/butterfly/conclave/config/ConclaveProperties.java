package com.z254.butterfly.conclave.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Configuration properties for CONCLAVE.
 */
@Data
@Component
@ConfigurationProperties(prefix = "conclave")
public class ConclaveProperties {

    private StoreProperties store = new StoreProperties();
    private LlmAgentProperties llmAgent = new LlmAgentProperties();
    private List<AgentDefinition> agents = new ArrayList<>();

    @Data
    public static class StoreProperties {
        /**
         * Share state through Redis instead of process memory.
         */
        private boolean useRedis = false;
        private String redisHost = "localhost";
        private int redisPort = 6379;
        private String redisUsername;
        private String redisPassword;
        private boolean redisSsl = false;
        /**
         * Client certificate chain (PEM) for mutual TLS.
         */
        private String redisSslCertfile;
        /**
         * Client private key (PKCS#8 PEM) matching the certificate.
         */
        private String redisSslKeyfile;
        /**
         * CA bundle (PEM) used to verify the server.
         */
        private String redisSslCaCerts;
        /**
         * Prefix of every key written to the store.
         */
        private String keyPrefix = "conclave";
        /**
         * Attempts per optimistic commit before giving up. 0 retries until the commit succeeds.
         */
        private int maxCommitAttempts = 0;
        private Duration commandTimeout = Duration.ofSeconds(5);
    }

    @Data
    public static class LlmAgentProperties {
        private int maxToolRounds = 5;
    }

    @Data
    public static class AgentDefinition {
        private String name;
        private String description;
        private AgentKind kind;
        /**
         * System message of an LLM agent.
         */
        private String systemMessage;
        /**
         * Agents called in order by a sequential coordinator.
         */
        private List<String> agents = new ArrayList<>();
        /**
         * Agents of each phase of a phased coordinator.
         */
        private List<List<String>> phases = new ArrayList<>();
        /**
         * Overrides {@code conclave.llm-agent.max-tool-rounds}.
         */
        private Integer maxToolRounds;
    }

    public enum AgentKind {
        LLM,
        SEQUENTIAL_COORDINATOR,
        PHASED_COORDINATOR
    }
}
