package com.ivamare.pipeline.sink.impl;

import com.ivamare.pipeline.event.EventData;
import com.ivamare.pipeline.model.ItemStatus;
import com.ivamare.pipeline.sink.ItemStatusSink;
import com.ivamare.pipeline.sink.RecoveredItem;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;

import java.util.List;
import java.util.Map;

/**
 * JDBC implementation of ItemStatusSink for PostgreSQL.
 *
 * <p>Expects a table {@code pipeline.item_status} with columns item_id (primary key),
 * status, payload_json (jsonb), artifact_ref, published_ref, last_error and updated_at.
 */
public class JdbcItemStatusSink implements ItemStatusSink {

    private static final Logger log = LoggerFactory.getLogger(JdbcItemStatusSink.class);

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};

    private static final String UPSERT_SQL = """
        INSERT INTO pipeline.item_status
            (item_id, status, payload_json, artifact_ref, published_ref, last_error, updated_at)
        VALUES (?, ?, ?::jsonb, ?, ?, ?, now())
        ON CONFLICT (item_id) DO UPDATE SET
            status = EXCLUDED.status,
            payload_json = COALESCE(EXCLUDED.payload_json, pipeline.item_status.payload_json),
            artifact_ref = COALESCE(EXCLUDED.artifact_ref, pipeline.item_status.artifact_ref),
            published_ref = COALESCE(EXCLUDED.published_ref, pipeline.item_status.published_ref),
            last_error = EXCLUDED.last_error,
            updated_at = now()
        """;

    private static final String UNFINISHED_SQL = """
        SELECT item_id, status, payload_json, artifact_ref
        FROM pipeline.item_status
        WHERE status IN ('DETECTED', 'DOWNLOADING', 'DOWNLOADED', 'UPLOADING')
        ORDER BY updated_at ASC
        """;

    private final JdbcTemplate jdbcTemplate;
    private final ObjectMapper objectMapper;
    private final RowMapper<RecoveredItem> recoveredMapper;

    public JdbcItemStatusSink(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper) {
        this.jdbcTemplate = jdbcTemplate;
        this.objectMapper = objectMapper;
        this.recoveredMapper = (rs, rowNum) -> {
            String itemId = rs.getString("item_id");
            return new RecoveredItem(
                itemId,
                ItemStatus.fromValue(rs.getString("status")),
                parsePayload(itemId, rs.getString("payload_json")),
                rs.getString("artifact_ref")
            );
        };
    }

    @Override
    public void record(String itemId, ItemStatus status, Map<String, Object> details) {
        Map<String, Object> safeDetails = details != null ? details : Map.of();

        jdbcTemplate.update(UPSERT_SQL,
            itemId,
            status.name(),
            serializePayload(safeDetails.get(EventData.PAYLOAD)),
            asString(safeDetails.get(EventData.ARTIFACT_REF)),
            asString(safeDetails.get(EventData.PUBLISHED_REF)),
            asString(safeDetails.get(EventData.ERROR))
        );
        log.debug("Recorded item {} as {}", itemId, status);
    }

    @Override
    public List<RecoveredItem> loadUnfinishedItems() {
        List<RecoveredItem> items = jdbcTemplate.query(UNFINISHED_SQL, recoveredMapper);
        log.info("Loaded {} unfinished items", items.size());
        return items;
    }

    private String serializePayload(Object payload) {
        if (!(payload instanceof Map<?, ?> map) || map.isEmpty()) {
            return null;
        }
        try {
            return objectMapper.writeValueAsString(map);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to serialize item payload", e);
        }
    }

    private Map<String, Object> parsePayload(String itemId, String json) {
        if (json != null) {
            try {
                return objectMapper.readValue(json, MAP_TYPE);
            } catch (JsonProcessingException e) {
                log.warn("Unreadable payload for item {}, restoring with id only: {}", itemId, e.getMessage());
            }
        }
        return EventData.itemOnly(itemId);
    }

    private static String asString(Object value) {
        return value != null ? value.toString() : null;
    }
}
