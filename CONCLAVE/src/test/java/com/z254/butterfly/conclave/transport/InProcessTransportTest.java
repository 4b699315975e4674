package com.z254.butterfly.conclave.transport;

import com.z254.butterfly.conclave.domain.model.AgentEvent;
import com.z254.butterfly.conclave.domain.model.Message;
import com.z254.butterfly.conclave.support.ConclaveJson;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for InProcessTransport.
 */
class InProcessTransportTest {

    private InProcessMessageBus bus;
    private MessageCodec codec;
    private InProcessTransport sender;
    private InProcessTransport receiver;
    private RecordingListener listener;

    @BeforeEach
    void setUp() {
        bus = new InProcessMessageBus();
        codec = new MessageCodec(ConclaveJson.mapper());
        sender = new InProcessTransport("A", bus, codec);
        receiver = new InProcessTransport("B", bus, codec);
        listener = new RecordingListener();
        sender.setListener(new RecordingListener());
        receiver.setListener(listener);
        sender.start();
        receiver.start();
    }

    @AfterEach
    void tearDown() {
        sender.stop();
        receiver.stop();
    }

    @Test
    void shouldDeliverRequestsAndResponsesSeparately() throws Exception {
        Message request = Message.request("room", "chat", "question").withSender("A");
        Message response = Message.response("room", "chat", "answer").withSender("A");

        sender.sendRequest(request, "B");
        sender.sendResponse(response, "B");

        assertThat(listener.request.get(5, TimeUnit.SECONDS)).isEqualTo(request);
        assertThat(listener.response.get(5, TimeUnit.SECONDS)).isEqualTo(response);
    }

    @Test
    void shouldReportHandlerFailuresAndKeepRunning() throws Exception {
        listener.failNextRequest = true;

        sender.sendRequest(Message.request("room", "chat", "boom").withSender("A"), "B");
        sender.sendRequest(Message.request("room", "chat", "fine").withSender("A"), "B");

        assertThat(listener.request.get(5, TimeUnit.SECONDS).getContent()).isEqualTo("fine");
        assertThat(listener.errors).singleElement().isInstanceOf(IllegalStateException.class);
    }

    @Test
    void shouldReportUndecodableFrames() throws Exception {
        bus.send(InProcessMessageBus.requestQueue("B"), "{broken");
        sender.sendRequest(Message.request("room", "chat", "after").withSender("A"), "B");

        assertThat(listener.request.get(5, TimeUnit.SECONDS).getContent()).isEqualTo("after");
        assertThat(listener.errors).singleElement().isInstanceOf(MessageCodecException.class);
    }

    @Test
    void shouldDeliverEventsFromOthers() throws Exception {
        sender.publishEvent(AgentEvent.builder().source("A").name("hello").payload(Map.of()).build());

        assertThat(listener.event.get(5, TimeUnit.SECONDS).getName()).isEqualTo("hello");
    }

    @Test
    void shouldRequireListener() {
        InProcessTransport transport = new InProcessTransport("C", bus, codec);

        assertThatThrownBy(transport::start).isInstanceOf(IllegalStateException.class);
    }

    private static class RecordingListener implements TransportListener {

        final CompletableFuture<Message> request = new CompletableFuture<>();
        final CompletableFuture<Message> response = new CompletableFuture<>();
        final CompletableFuture<AgentEvent> event = new CompletableFuture<>();
        final List<Throwable> errors = new CopyOnWriteArrayList<>();
        volatile boolean failNextRequest;

        @Override
        public void onRequest(Message message) {
            if (failNextRequest) {
                failNextRequest = false;
                throw new IllegalStateException("handler failed");
            }
            request.complete(message);
        }

        @Override
        public void onResponse(Message message) {
            response.complete(message);
        }

        @Override
        public void onEvent(AgentEvent agentEvent) {
            event.complete(agentEvent);
        }

        @Override
        public void onError(Throwable error) {
            errors.add(error);
        }
    }
}
