package com.z254.butterfly.conclave.tool;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.z254.butterfly.conclave.domain.model.ToolDefinition;
import com.z254.butterfly.conclave.support.ConclaveJson;
import lombok.Builder;
import lombok.NonNull;
import lombok.Value;
import lombok.With;

import java.util.Map;

/**
 * A capability an LLM agent may call.
 *
 * <p>A function tool runs its {@link ToolCallback} in the calling process. An agent tool
 * ({@code agentTool = true}) is answered by the agent of the same name, which receives the
 * call as a request.
 */
@Value
@Builder(toBuilder = true)
public class Tool {

    private static final ObjectMapper JSON = ConclaveJson.mapper();

    @NonNull
    String name;

    String description;

    /**
     * JSON Schema of the parameters.
     */
    @Builder.Default
    Map<String, Object> parametersSchema = Map.of("type", "object", "properties", Map.of());

    boolean agentTool;

    /**
     * Absent for agent tools and for tools looked up in another process.
     */
    @With
    ToolCallback callback;

    /**
     * Runs the tool. Without a callback the result is the JSON of the arguments.
     */
    public String invoke(Map<String, Object> arguments) {
        Map<String, Object> args = arguments == null ? Map.of() : arguments;
        if (callback != null) {
            return callback.call(args);
        }
        try {
            return JSON.writeValueAsString(args);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Arguments of tool " + name + " are not serializable", e);
        }
    }

    public ToolDefinition toDefinition() {
        return ToolDefinition.function(name, description, parametersSchema);
    }
}
