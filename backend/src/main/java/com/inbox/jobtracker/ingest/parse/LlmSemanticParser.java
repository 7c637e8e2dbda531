package com.inbox.jobtracker.ingest.parse;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.inbox.jobtracker.config.TrackerProperties;
import com.inbox.jobtracker.ingest.http.ServiceHttpClient;
import com.inbox.jobtracker.ingest.model.HttpCallResult;
import com.inbox.jobtracker.ingest.model.ParseOutcome;
import com.inbox.jobtracker.ingest.model.StructuredRecord;
import com.inbox.jobtracker.ingest.service.TrackerSetupException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.net.URI;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Asks an OpenAI-compatible chat-completions endpoint to pull company, position and status
 * out of one email. Anything short of a usable JSON answer is reported as {@link ParseOutcome.Empty}.
 */
@Service
public class LlmSemanticParser implements SemanticParser {
    private static final Logger log = LoggerFactory.getLogger(LlmSemanticParser.class);
    private static final int MAX_BODY_CHARS = 8000;
    private static final String SYSTEM_PROMPT =
        "You extract job application details from emails. "
            + "Reply with a single JSON object and nothing else: "
            + "{\"company\": string, \"position\": string, \"status\": string}. "
            + "status is one of Applied, Interview, Offer, Rejected, Other. "
            + "Use an empty string for anything the email does not state.";

    private final ServiceHttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final TrackerProperties properties;

    public LlmSemanticParser(ServiceHttpClient httpClient, ObjectMapper objectMapper, TrackerProperties properties) {
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
        this.properties = properties;
    }

    @Override
    public void verifySetup() {
        String endpoint = properties.getParser().getEndpoint();
        try {
            if (endpoint.isBlank() || URI.create(endpoint).getHost() == null) {
                throw new TrackerSetupException("Parser endpoint is not configured (tracker.parser.endpoint)");
            }
        } catch (IllegalArgumentException e) {
            throw new TrackerSetupException("Parser endpoint is malformed: " + endpoint, e);
        }
    }

    @Override
    public ParseOutcome parse(String subject, String body, String senderEmail, Instant receivedAt) {
        TrackerProperties.Parser config = properties.getParser();
        String requestBody;
        try {
            requestBody = objectMapper.writeValueAsString(buildRequest(config.getModel(), subject, body, senderEmail, receivedAt));
        } catch (JsonProcessingException e) {
            return ParseOutcome.empty("request_encoding_failed: " + e.getOriginalMessage());
        }

        Map<String, String> headers = new LinkedHashMap<>();
        if (!config.getApiKey().isBlank()) {
            headers.put("Authorization", "Bearer " + config.getApiKey());
        }
        HttpCallResult result = httpClient.postJson(config.getEndpoint(), requestBody, headers);
        if (!result.isSuccessful()) {
            log.warn("Parser call failed for '{}': {}", subject, result.describeFailure());
            return ParseOutcome.empty("parser_call_failed: " + result.describeFailure());
        }
        return interpret(result.body(), senderEmail, receivedAt);
    }

    ParseOutcome interpret(String responseBody, String senderEmail, Instant receivedAt) {
        if (responseBody == null || responseBody.isBlank()) {
            return ParseOutcome.empty("empty_response");
        }
        try {
            JsonNode root = objectMapper.readTree(responseBody);
            String content = root.path("choices").path(0).path("message").path("content").asText("");
            if (content.isBlank()) {
                return ParseOutcome.empty("no_message_content");
            }
            JsonNode fields = objectMapper.readTree(stripCodeFence(content));
            if (fields == null || !fields.isObject()) {
                return ParseOutcome.empty("content_not_an_object");
            }
            String status = text(fields, "status");
            StructuredRecord record = new StructuredRecord(
                text(fields, "company"),
                text(fields, "position"),
                status.isBlank() ? properties.getParser().getDefaultStatus() : status,
                receivedAt,
                senderEmail == null ? "" : senderEmail
            );
            return ParseOutcome.of(record);
        } catch (JsonProcessingException e) {
            log.debug("Unparsable parser response: {}", e.getOriginalMessage());
            return ParseOutcome.empty("unparsable_response");
        }
    }

    private ObjectNode buildRequest(String model, String subject, String body, String senderEmail, Instant receivedAt) {
        ObjectNode request = objectMapper.createObjectNode();
        request.put("model", model);
        request.put("temperature", 0);
        request.putObject("response_format").put("type", "json_object");
        ArrayNode messages = request.putArray("messages");
        messages.addObject()
            .put("role", "system")
            .put("content", SYSTEM_PROMPT);
        messages.addObject()
            .put("role", "user")
            .put("content", userPrompt(subject, body, senderEmail, receivedAt));
        return request;
    }

    private String userPrompt(String subject, String body, String senderEmail, Instant receivedAt) {
        String safeBody = body == null ? "" : body;
        if (safeBody.length() > MAX_BODY_CHARS) {
            safeBody = safeBody.substring(0, MAX_BODY_CHARS);
        }
        return "Subject: " + (subject == null ? "" : subject) + "\n"
            + "From: " + (senderEmail == null ? "" : senderEmail) + "\n"
            + "Date: " + (receivedAt == null ? "" : receivedAt.toString()) + "\n\n"
            + safeBody;
    }

    private static String stripCodeFence(String content) {
        String trimmed = content.strip();
        if (!trimmed.startsWith("```")) {
            return trimmed;
        }
        int firstNewline = trimmed.indexOf('\n');
        int closing = trimmed.lastIndexOf("```");
        if (firstNewline < 0 || closing <= firstNewline) {
            return trimmed;
        }
        return trimmed.substring(firstNewline + 1, closing).strip();
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return "";
        }
        return value.asText("").trim();
    }
}
