// file: client/src/test/java/io/tagvault/client/CliTest.java
package io.tagvault.client;

import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class CliTest {

    @Test
    void fields_become_payload_entries() {
        ObjectNode body = Cli.buildRpcBody("registerPage",
                List.of("url=https://example.com/?a=b", "title=Example page"));

        assertEquals("registerPage", body.get("operation").asText());
        assertEquals("https://example.com/?a=b", body.get("payload").get("url").asText());
        assertEquals("Example page", body.get("payload").get("title").asText());
    }

    @Test
    void no_fields_gives_empty_payload() {
        ObjectNode body = Cli.buildRpcBody("getAllTags", List.of());
        assertTrue(body.get("payload").isEmpty());
    }

    @Test
    void malformed_field_is_rejected() {
        assertThrows(Cli.CliException.class, () -> Cli.buildRpcBody("createTag", List.of("Work")));
        assertThrows(Cli.CliException.class, () -> Cli.buildRpcBody("createTag", List.of("=Work")));
    }

    @Test
    void base_url_flag_is_split_off() {
        Map.Entry<String, String[]> parsed = Cli.parseBaseUrl(new String[]{"--base-url", "http://h:1", "getAllTags"});
        assertEquals("http://h:1", parsed.getKey());
        assertArrayEquals(new String[]{"getAllTags"}, parsed.getValue());

        Map.Entry<String, String[]> plain = Cli.parseBaseUrl(new String[]{"status"});
        assertEquals("http://localhost:8080", plain.getKey());
        assertThrows(Cli.CliException.class, () -> Cli.parseBaseUrl(new String[]{"--base-url"}));
    }
}
