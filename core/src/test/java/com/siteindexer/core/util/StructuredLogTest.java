package com.siteindexer.core.util;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.util.logging.Level;

import static org.assertj.core.api.Assertions.assertThat;

class StructuredLogTest {

    private final ObjectMapper om = new ObjectMapper();

    @Test
    void rendersOneJsonObjectPerEvent() throws Exception {
        StructuredLog slog = StructuredLog.get(StructuredLogTest.class);
        String line = slog.render(Level.INFO, "page-indexed",
                null, "url", "https://ex.com/", "tokens", 12, "ok", true, "prefix", null);

        JsonNode n = om.readTree(line);
        assertThat(n.get("event").asText()).isEqualTo("page-indexed");
        assertThat(n.get("comp").asText()).isEqualTo("StructuredLogTest");
        assertThat(n.get("lvl").asText()).isEqualTo("INFO");
        assertThat(n.get("tokens").isInt()).isTrue();
        assertThat(n.get("ok").asBoolean()).isTrue();
        assertThat(n.get("prefix").isNull()).isTrue();
        assertThat(n.has("_kv_mismatch")).isFalse();
    }

    @Test
    void oddPairsAndErrorsAreMarked() throws Exception {
        StructuredLog slog = StructuredLog.get(StructuredLogTest.class);
        JsonNode n = om.readTree(slog.render(Level.SEVERE, "task-failed",
                new IllegalStateException("boom"), "dangling"));

        assertThat(n.get("_kv_mismatch").asBoolean()).isTrue();
        assertThat(n.get("error").asText()).isEqualTo("IllegalStateException");
        assertThat(n.get("message").asText()).isEqualTo("boom");
    }
}
