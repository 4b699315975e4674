package com.z254.butterfly.conclave.context;

import com.z254.butterfly.conclave.domain.model.ChatMessage;
import com.z254.butterfly.conclave.observability.ConclaveMetrics;
import com.z254.butterfly.conclave.store.RedisSharedStore;
import com.z254.butterfly.conclave.store.SharedStore;
import com.z254.butterfly.conclave.support.ConclaveJson;
import com.z254.butterfly.conclave.support.RedisTestSupport;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.testcontainers.containers.GenericContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Context over Redis, including writers on separate connections.
 */
@Testcontainers(disabledWithoutDocker = true)
class RedisContextTest extends ContextContractTest {

    @Container
    static final GenericContainer<?> REDIS = RedisTestSupport.redisContainer();

    private final String prefix = "test-" + UUID.randomUUID();
    private StringRedisTemplate template;
    private StringRedisTemplate otherTemplate;
    private SharedStore otherStore;

    @Override
    protected SharedStore createStore() {
        ConclaveMetrics metrics = new ConclaveMetrics(new SimpleMeterRegistry());
        template = RedisTestSupport.newTemplate(REDIS);
        otherTemplate = RedisTestSupport.newTemplate(REDIS);
        otherStore = new RedisSharedStore(otherTemplate, 0, metrics);
        return new RedisSharedStore(template, 0, metrics);
    }

    @Override
    protected void closeStore() {
        RedisTestSupport.close(template);
        RedisTestSupport.close(otherTemplate);
    }

    @Override
    protected String keyPrefix() {
        return prefix;
    }

    @Test
    void shouldKeepConcurrentHistoryAppendsFromTwoProcesses() throws Exception {
        Context mine = new Context("ctx", store, ConclaveJson.mapper(), prefix);
        Context theirs = new Context("ctx", otherStore, ConclaveJson.mapper(), prefix);
        int appends = 50;

        CompletableFuture<Void> a = CompletableFuture.runAsync(() -> {
            for (int i = 0; i < appends; i++) {
                mine.appendChatHistory(chatId, ChatMessage.assistant("a" + i));
            }
        });
        CompletableFuture<Void> b = CompletableFuture.runAsync(() -> {
            for (int i = 0; i < appends; i++) {
                theirs.appendChatHistory(chatId, ChatMessage.assistant("b" + i));
            }
        });
        CompletableFuture.allOf(a, b).get(60, TimeUnit.SECONDS);

        assertThat(mine.getChatHistory(chatId)).hasSize(2 * appends);
    }
}
