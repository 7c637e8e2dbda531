package com.inbox.jobtracker.ingest.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.inbox.jobtracker.config.TrackerProperties;
import com.inbox.jobtracker.ingest.http.ServiceHttpClient;
import com.inbox.jobtracker.ingest.model.HttpCallResult;
import com.inbox.jobtracker.ingest.model.StructuredRecord;
import com.inbox.jobtracker.ingest.model.UpsertResult;
import com.inbox.jobtracker.ingest.service.TrackerSetupException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Keeps one Notion database page per (Company, Position). Expected database properties:
 * Company (title), Position (rich_text), Status (select), Date (date), Email (email).
 */
@Service
public class NotionStoreReconciler implements StoreReconciler {
    private static final Logger log = LoggerFactory.getLogger(NotionStoreReconciler.class);

    static final String COMPANY = "Company";
    static final String POSITION = "Position";
    static final String STATUS = "Status";
    static final String DATE = "Date";
    static final String EMAIL = "Email";

    private final ServiceHttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final TrackerProperties properties;

    public NotionStoreReconciler(ServiceHttpClient httpClient, ObjectMapper objectMapper, TrackerProperties properties) {
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
        this.properties = properties;
    }

    @Override
    public void verifySetup() {
        TrackerProperties.Store store = properties.getStore();
        if (store.getToken().isBlank() || store.getDatabaseId().isBlank()) {
            throw new TrackerSetupException("Notion store is not configured (tracker.store.token/database-id)");
        }
    }

    @Override
    public UpsertResult upsert(StructuredRecord record) {
        TrackerProperties.Store store = properties.getStore();
        try {
            HttpCallResult query = httpClient.postJson(
                store.getBaseUrl() + "/databases/" + store.getDatabaseId() + "/query",
                objectMapper.writeValueAsString(buildQuery(record)),
                headers()
            );
            if (!query.isSuccessful()) {
                return failure("Notion query failed", record, query);
            }

            String pageId = firstPageId(query.body());
            if (pageId != null) {
                HttpCallResult update = httpClient.patchJson(
                    store.getBaseUrl() + "/pages/" + pageId,
                    objectMapper.writeValueAsString(buildUpdate(record)),
                    headers()
                );
                if (!update.isSuccessful()) {
                    return failure("Notion update failed", record, update);
                }
                log.info("Updated {} / {} -> {}", record.company(), record.position(), record.status());
                return UpsertResult.updated();
            }

            HttpCallResult create = httpClient.postJson(
                store.getBaseUrl() + "/pages",
                objectMapper.writeValueAsString(buildCreate(record, store.getDatabaseId())),
                headers()
            );
            if (!create.isSuccessful()) {
                return failure("Notion create failed", record, create);
            }
            log.info("Created {} / {} ({})", record.company(), record.position(), record.status());
            return UpsertResult.created();
        } catch (JsonProcessingException e) {
            return UpsertResult.failure("Notion response unreadable: " + e.getOriginalMessage());
        }
    }

    private UpsertResult failure(String step, StructuredRecord record, HttpCallResult result) {
        String reason = step + ": " + result.describeFailure();
        log.warn("{} for {} / {}", reason, record.company(), record.position());
        return UpsertResult.failure(reason);
    }

    private Map<String, String> headers() {
        Map<String, String> headers = new LinkedHashMap<>();
        headers.put("Authorization", "Bearer " + properties.getStore().getToken());
        headers.put("Notion-Version", properties.getStore().getNotionVersion());
        return headers;
    }

    private String firstPageId(String body) throws JsonProcessingException {
        if (body == null || body.isBlank()) {
            return null;
        }
        JsonNode results = objectMapper.readTree(body).path("results");
        if (!results.isArray() || results.isEmpty()) {
            return null;
        }
        String id = results.get(0).path("id").asText("");
        return id.isBlank() ? null : id;
    }

    ObjectNode buildQuery(StructuredRecord record) {
        ObjectNode query = objectMapper.createObjectNode();
        ArrayNode and = query.putObject("filter").putArray("and");
        addEqualsFilter(and.addObject().put("property", COMPANY), "title", record.company());
        addEqualsFilter(and.addObject().put("property", POSITION), "rich_text", record.position());
        query.put("page_size", 1);
        return query;
    }

    private void addEqualsFilter(ObjectNode condition, String type, String value) {
        ObjectNode filter = condition.putObject(type);
        if (value == null || value.isBlank()) {
            filter.put("is_empty", true);
        } else {
            filter.put("equals", value);
        }
    }

    ObjectNode buildUpdate(StructuredRecord record) {
        ObjectNode body = objectMapper.createObjectNode();
        ObjectNode props = body.putObject("properties");
        putMutableProperties(props, record);
        return body;
    }

    ObjectNode buildCreate(StructuredRecord record, String databaseId) {
        ObjectNode body = objectMapper.createObjectNode();
        body.putObject("parent").put("database_id", databaseId);
        ObjectNode props = body.putObject("properties");
        props.putObject(COMPANY).putArray("title")
            .addObject().putObject("text").put("content", nullToEmpty(record.company()));
        props.putObject(POSITION).putArray("rich_text")
            .addObject().putObject("text").put("content", nullToEmpty(record.position()));
        putMutableProperties(props, record);
        return body;
    }

    private void putMutableProperties(ObjectNode props, StructuredRecord record) {
        if (record.status() != null && !record.status().isBlank()) {
            props.putObject(STATUS).putObject("select").put("name", record.status());
        }
        if (record.sourceDate() != null) {
            props.putObject(DATE).putObject("date").put("start", record.sourceDate().toString());
        }
        if (record.sourceEmail() == null || record.sourceEmail().isBlank()) {
            props.putObject(EMAIL).putNull("email");
        } else {
            props.putObject(EMAIL).put("email", record.sourceEmail());
        }
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }
}
