package com.agentorchestra.orchestrator.capability.claude;

import com.agentorchestra.orchestrator.capability.Capability;
import com.agentorchestra.orchestrator.capability.CapabilityException;
import com.agentorchestra.orchestrator.capability.CapabilityManifest;
import com.agentorchestra.orchestrator.capability.input.AgentInput;
import com.agentorchestra.orchestrator.claude.ClaudeClient;
import com.agentorchestra.orchestrator.claude.ClaudeClient.Message;
import com.agentorchestra.orchestrator.model.AgentOutput;
import com.agentorchestra.orchestrator.model.AgentType;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;

/**
 * Default capability: one Claude turn per invocation.
 *
 * The typed input is serialised as JSON into the user message, the agent's
 * system prompt comes from {@link AgentPrompts}, and the reply's JSON object
 * becomes the {@link AgentOutput}. A reply without a JSON object or without a
 * {@code summary} is a {@link CapabilityException}.
 */
public class ClaudeAgentCapability implements Capability<AgentInput> {

    private static final Logger log = LoggerFactory.getLogger(ClaudeAgentCapability.class);

    private static final TypeReference<Map<String, Object>> OBJECT_TYPE = new TypeReference<>() {};

    private final CapabilityManifest manifest;
    private final ClaudeClient       claude;
    private final AgentPrompts       prompts;
    private final ObjectMapper       objectMapper;
    private final String             model;

    public ClaudeAgentCapability(AgentType agentType,
                                 ClaudeClient claude,
                                 AgentPrompts prompts,
                                 ObjectMapper objectMapper,
                                 String model) {
        this.manifest     = new CapabilityManifest(agentType, "1.0.0",
                "Claude-backed " + agentType + " (" + model + ")");
        this.claude       = claude;
        this.prompts      = prompts;
        this.objectMapper = objectMapper;
        this.model        = model;
    }

    @Override public CapabilityManifest manifest()  { return manifest; }
    @Override public Class<AgentInput>  inputType() { return AgentInput.class; }

    @Override
    public AgentOutput invoke(AgentInput input) throws CapabilityException {
        AgentType type = manifest.agentType();
        if (input.agentType() != type) {
            throw new CapabilityException(
                    "Input for " + input.agentType() + " passed to the " + type + " capability");
        }

        String reply = claude.complete(model,
                List.of(new Message("user", buildUserMessage(input))),
                prompts.get(type));

        String payload = ResponseParser.extractPayload(reply);
        Map<String, Object> fields;
        try {
            fields = objectMapper.readValue(payload, OBJECT_TYPE);
        } catch (JsonProcessingException e) {
            log.debug("Unparseable {} reply: {}", type, reply);
            throw new CapabilityException(type + " did not return a JSON object", e);
        }
        if (fields == null || !fields.containsKey(AgentOutput.SUMMARY)) {
            throw new CapabilityException(type + " result has no '" + AgentOutput.SUMMARY + "' field");
        }
        return AgentOutput.of(fields);
    }

    private String buildUserMessage(AgentInput input) {
        String inputJson;
        try {
            inputJson = objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(input);
        } catch (JsonProcessingException e) {
            throw new CapabilityException("Could not serialise " + manifest.agentType() + " input", e);
        }
        return "=== TASK INPUT ===\n" + inputJson + "\n=== END INPUT ===\n\n"
                + "Produce your result now.";
    }
}
