package com.z254.butterfly.conclave.collaboration;

import com.z254.butterfly.conclave.context.Context;
import com.z254.butterfly.conclave.domain.model.ChatMessage;
import com.z254.butterfly.conclave.domain.model.CollaborationType;
import com.z254.butterfly.conclave.domain.model.Message;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Optional;

/**
 * Decides, per collaboration type, what an agent sees before processing a request and
 * where its output goes afterwards.
 *
 * <ul>
 *     <li>SEQUENTIAL: the output is the next agent's request; the last agent answers the
 *     chat's response target.</li>
 *     <li>PHASED and CHAT: the output joins the shared history and the requester gets an
 *     acknowledgment.</li>
 *     <li>INDEPENDENT: the output is the response to the requester.</li>
 * </ul>
 */
@Slf4j
public class CollaborationController {

    /**
     * History passed to the agent: the chat's shared history for PHASED and CHAT, nothing
     * otherwise.
     */
    public List<ChatMessage> historyFor(Context context, String chatId, CollaborationType type) {
        if (type.usesSharedHistory() && chatId != null) {
            return context.getChatHistory(chatId);
        }
        return List.of();
    }

    public RoutingDecision route(Context context, Message request, String self, String text,
                                 CollaborationType type) {
        String chatId = request.getChatId();
        String contextName = context.getName();

        switch (type) {
            case PHASED, CHAT -> {
                if (request.getSender() == null) {
                    log.warn("Agent {} cannot acknowledge request {} without sender", self, request.getId());
                    return new RoutingDecision(RoutingDecision.Delivery.NONE, null, null,
                            ChatMessage.assistant(text));
                }
                return new RoutingDecision(RoutingDecision.Delivery.RESPONSE, request.getSender(),
                        Message.ack(contextName, chatId, text), ChatMessage.assistant(text));
            }
            case SEQUENTIAL -> {
                Optional<String> next = context.getNextAgentInSequence(chatId, self);
                if (next.isPresent()) {
                    log.debug("Sequence {} continues with {}", chatId, next.get());
                    return RoutingDecision.request(next.get(), Message.request(contextName, chatId, text));
                }
                Optional<String> target = context.getRouteResponseTo(chatId);
                if (target.isEmpty()) {
                    log.warn("No response target for sequential chat {}, answering sender {}",
                            chatId, request.getSender());
                }
                return respond(target.orElse(request.getSender()), contextName, chatId, text, self, request);
            }
            default -> {
                return respond(request.getSender(), contextName, chatId, text, self, request);
            }
        }
    }

    private RoutingDecision respond(String destination, String contextName, String chatId, String text,
                                    String self, Message request) {
        if (destination == null) {
            log.warn("Agent {} has no destination for the response to request {}", self, request.getId());
            return RoutingDecision.none();
        }
        return RoutingDecision.response(destination, Message.response(contextName, chatId, text));
    }
}
