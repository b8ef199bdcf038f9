package com.elssolution.unlockwatch.integration.status;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.assertThat;

class UnlockSignalParsingTest {

    private final ObjectMapper mapper = new ObjectMapper();

    private boolean unlocked(String json) throws Exception {
        JsonNode node = json == null ? null : mapper.readTree(json);
        return StatusProbeClient.extractUnlocked(node);
    }

    @Test
    void top_level_key_wins_over_nested_data() throws Exception {
        assertThat(unlocked("{\"unlocked\": false, \"status\": \"ok\", \"data\": {\"unlocked\": true}}")).isFalse();
    }

    @Test
    void nested_data_needs_ok_or_success_status() throws Exception {
        assertThat(unlocked("{\"status\": \"ok\", \"data\": {\"unlocked\": true}}")).isTrue();
        assertThat(unlocked("{\"status\": \"success\", \"data\": {\"unlocked\": true}}")).isTrue();
        assertThat(unlocked("{\"status\": \"pending\", \"data\": {\"unlocked\": true}}")).isFalse();
        assertThat(unlocked("{\"data\": {\"unlocked\": true}}")).isFalse();
        assertThat(unlocked("{\"status\": \"OK\", \"data\": {\"unlocked\": true}}")).isFalse();
    }

    @Test
    void nested_data_must_be_an_object_with_the_key() throws Exception {
        assertThat(unlocked("{\"status\": \"ok\", \"data\": [true]}")).isFalse();
        assertThat(unlocked("{\"status\": \"ok\", \"data\": null}")).isFalse();
        assertThat(unlocked("{\"status\": \"ok\", \"data\": {\"locked\": false}}")).isFalse();
    }

    @Test
    void non_object_bodies_are_never_unlocked() throws Exception {
        assertThat(unlocked(null)).isFalse();
        assertThat(unlocked("[{\"unlocked\": true}]")).isFalse();
        assertThat(unlocked("\"unlocked\"")).isFalse();
        assertThat(unlocked("true")).isFalse();
    }

    @Test
    void json_followed_by_trailing_garbage_is_treated_as_text() {
        String body = "{\"unlocked\": true} <html>oops</html>";

        assertThat(StatusProbeClient.parseQuietly(body)).isNull();
        assertThat(StatusProbeClient.extractUnlocked(StatusProbeClient.parseQuietly(body))).isFalse();
    }

    @Test
    void well_formed_body_with_surrounding_whitespace_still_parses() {
        assertThat(StatusProbeClient.extractUnlocked(
                StatusProbeClient.parseQuietly("  {\"unlocked\": true}\n"))).isTrue();
    }

    @ParameterizedTest
    @CsvSource(delimiter = '|', value = {
            "true          | true",
            "false         | false",
            "1             | true",
            "0             | false",
            "0.0           | false",
            "'\"yes\"'     | true",
            "'\"\"'        | false",
            "null          | false",
            "'{\"a\":1}'   | true",
            "'[]'          | false"
    })
    void unlocked_value_uses_loose_truthiness(String value, boolean expected) throws Exception {
        assertThat(unlocked("{\"unlocked\": " + value + "}")).isEqualTo(expected);
    }
}
