package com.z254.butterfly.conclave;

import com.z254.butterfly.conclave.agent.AgentRuntime;
import com.z254.butterfly.conclave.agent.AgentServices;
import com.z254.butterfly.conclave.agent.ScriptedAgent;
import com.z254.butterfly.conclave.bootstrap.AgentLauncher;
import com.z254.butterfly.conclave.config.InvalidStoreConfigurationException;
import com.z254.butterfly.conclave.domain.model.ChatMessage;
import com.z254.butterfly.conclave.domain.model.Message;
import com.z254.butterfly.conclave.domain.model.ToolDefinition;
import com.z254.butterfly.conclave.health.ConclaveHealthIndicator;
import com.z254.butterfly.conclave.llm.LlmClient;
import com.z254.butterfly.conclave.llm.LlmCompletion;
import com.z254.butterfly.conclave.registry.Registry;
import com.z254.butterfly.conclave.transport.InProcessMessageBus;
import com.z254.butterfly.conclave.transport.InProcessTransport;
import com.z254.butterfly.conclave.transport.MessageCodec;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.actuate.health.Status;
import org.springframework.boot.builder.SpringApplicationBuilder;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Application wiring with the in-memory store and agents declared in properties.
 */
@SpringBootTest(properties = {
        "conclave.agents[0].name=writer",
        "conclave.agents[0].kind=LLM",
        "conclave.agents[0].system-message=writer",
        "conclave.agents[1].name=editor",
        "conclave.agents[1].kind=LLM",
        "conclave.agents[1].system-message=editor",
        "conclave.agents[2].name=pipeline",
        "conclave.agents[2].kind=SEQUENTIAL_COORDINATOR",
        "conclave.agents[2].agents[0]=writer",
        "conclave.agents[2].agents[1]=editor"
})
class ConclaveApplicationTest {

    @Autowired
    private AgentLauncher launcher;

    @Autowired
    private Registry registry;

    @Autowired
    private AgentServices services;

    @Autowired
    private InProcessMessageBus bus;

    @Autowired
    private MessageCodec codec;

    @Autowired
    private ConclaveHealthIndicator healthIndicator;

    @Test
    void shouldStartDeclaredAgents() {
        assertThat(launcher.isRunning()).isTrue();
        assertThat(launcher.getAgents()).extracting(AgentRuntime::getName)
                .containsExactly("writer", "editor", "pipeline");
        assertThat(registry.getAgents()).containsKeys("writer", "editor", "pipeline");
    }

    @Test
    void shouldAnswerThroughConfiguredPipeline() throws Exception {
        ScriptedAgent client = new ScriptedAgent("app-client", new InProcessTransport("app-client", bus, codec),
                services, request -> Optional.empty());
        client.start();
        try {
            client.sendRequest(Message.request("app", "chat-1", "draft"), "pipeline");

            Message response = client.awaitResponse(Duration.ofSeconds(10));
            assertThat(response.getSender()).isEqualTo("editor");
            assertThat(response.getContent()).isEqualTo("[editor] [writer] draft");
        } finally {
            client.stop();
        }
    }

    @Test
    void shouldReportHealth() {
        assertThat(healthIndicator.health().getStatus()).isEqualTo(Status.UP);
        assertThat(healthIndicator.health().getDetails()).containsEntry("backend", "local");
    }

    @Test
    void shouldFailStartupOnInvalidStoreSettings() {
        assertThatThrownBy(() -> new SpringApplicationBuilder(ConclaveApplication.class)
                .properties("conclave.store.max-commit-attempts=-1")
                .run().close())
                .hasRootCauseInstanceOf(InvalidStoreConfigurationException.class);
    }

    @TestConfiguration
    static class EchoLlmConfiguration {

        /**
         * Prefixes the last user turn with the system message.
         */
        @Bean
        LlmClient echoLlmClient() {
            return new LlmClient() {
                @Override
                public String processSinglePrompt(String prompt) {
                    return prompt;
                }

                @Override
                public LlmCompletion processChatCompletion(List<ChatMessage> messages, List<ToolDefinition> tools) {
                    String system = messages.get(0).content();
                    String user = messages.get(messages.size() - 1).content();
                    return LlmCompletion.text("[" + system + "] " + user);
                }

                @Override
                public String getProviderId() {
                    return "echo";
                }
            };
        }
    }
}
