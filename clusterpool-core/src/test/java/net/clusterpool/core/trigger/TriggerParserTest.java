package net.clusterpool.core.trigger;

import net.clusterpool.core.error.ParseRequestException;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class TriggerParserTest {

    final TriggerParser parser = new TriggerParser();

    @Test
    void no_body_means_every_pending_unit() throws Exception {
        assertEquals(Optional.empty(), parser.parse(null));
        assertEquals(Optional.empty(), parser.parse(""));
        assertEquals(Optional.empty(), parser.parse("{}"));
    }

    @Test
    void scheduled_job_body_means_every_pending_unit() throws Exception {
        assertEquals(Optional.empty(), parser.parse("""
                {"execution_id": "9f1c", "process_name": "cluster-pool", "job_name": "manage"}
                """));
    }

    @Test
    void queue_message_names_the_units() throws Exception {
        assertEquals(Optional.of(List.of(4L, 8L, 15L)), parser.parse("""
                {"topic": "cluster-pool-steps", "id": "m-1", "msg": {"steps": [4, 8, 15]}}
                """));
    }

    @Test
    void queue_message_without_steps_is_rejected() {
        assertThrows(ParseRequestException.class, () -> parser.parse("""
                {"topic": "cluster-pool-steps", "msg": {}}
                """));
        assertThrows(ParseRequestException.class, () -> parser.parse("""
                {"topic": "cluster-pool-steps", "msg": {"steps": ["four"]}}
                """));
    }

    @Test
    void unknown_shapes_are_rejected() {
        var ex = assertThrows(ParseRequestException.class, () -> parser.parse("{\"foo\": 1}"));
        assertTrue(ex.getMessage().contains("execution_id"));
        assertThrows(ParseRequestException.class, () -> parser.parse("[1, 2]"));
        assertThrows(ParseRequestException.class, () -> parser.parse("not json"));
    }
}
