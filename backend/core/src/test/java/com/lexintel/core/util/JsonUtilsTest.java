package com.lexintel.core.util;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.lexintel.core.model.ArticleStatus;
import com.lexintel.core.model.Category;
import com.lexintel.core.model.PublishStatus;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

class JsonUtilsTest {
    @Test
    void objectMapperIsSingletonAndLenient() throws Exception {
        ObjectMapper first = JsonUtils.objectMapper();

        assertSame(first, JsonUtils.objectMapper());
        assertFalse(first.isEnabled(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES));

        Payload parsed = first.readValue(
                "{\"name\":\"ok\",\"createdAt\":\"2026-02-01T00:00:00Z\",\"unknown\":1}",
                Payload.class
        );
        assertEquals(Instant.parse("2026-02-01T00:00:00Z"), parsed.createdAt());
    }

    @Test
    void instantsAreIsoStringsAndNullsAreOmitted() throws Exception {
        String json = JsonUtils.objectMapper().writeValueAsString(
                new Payload("ok", null, Instant.parse("2026-02-01T00:00:00Z")));

        assertTrue(json.contains("\"createdAt\":\"2026-02-01T00:00:00Z\""));
        assertFalse(json.contains("optional"));
    }

    @Test
    void enumsUseLowercaseWireNames() throws Exception {
        ObjectMapper mapper = JsonUtils.objectMapper();

        assertEquals("\"m_and_a\"", mapper.writeValueAsString(Category.M_AND_A));
        assertEquals("\"retry_queued\"", mapper.writeValueAsString(PublishStatus.RETRY_QUEUED));
        assertEquals(ArticleStatus.ANALYZED, mapper.readValue("\"analyzed\"", ArticleStatus.class));
        assertEquals(Category.FUNDING, mapper.readValue("\"funding\"", Category.class));
    }

    private record Payload(String name, String optional, Instant createdAt) {
    }
}
