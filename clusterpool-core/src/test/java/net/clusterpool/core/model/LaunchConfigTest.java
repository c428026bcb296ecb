package net.clusterpool.core.model;

import net.clusterpool.core.support.Fixtures;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class LaunchConfigTest {

    @Test
    void identical_serialization_hashes_equal() {
        LaunchConfig a = LaunchConfig.of(Fixtures.jobFlow("etl"));
        LaunchConfig b = LaunchConfig.parse(a.canonicalJson());

        assertEquals(a.hash(), b.hash());
        assertEquals(a, b);
        assertThat(a.hash()).hasSize(64).matches("[0-9a-f]+");
    }

    @Test
    void any_value_change_changes_the_hash() {
        Map<String, Object> doc = Fixtures.jobFlow("etl");
        LaunchConfig base = LaunchConfig.of(doc);
        doc.put("ReleaseLabel", "emr-7.0.0");

        assertNotEquals(base.hash(), LaunchConfig.of(doc).hash());
        assertNotEquals(base.hash(), Fixtures.launchConfig("etl-2").hash());
    }

    @Test
    void key_order_is_part_of_the_identity() {
        Map<String, Object> ab = new LinkedHashMap<>();
        ab.put("Name", "x");
        ab.put("ReleaseLabel", "emr-6.15.0");
        Map<String, Object> ba = new LinkedHashMap<>();
        ba.put("ReleaseLabel", "emr-6.15.0");
        ba.put("Name", "x");

        assertNotEquals(LaunchConfig.of(ab).hash(), LaunchConfig.of(ba).hash());
    }

    @Test
    void document_is_a_detached_read_only_copy() {
        Map<String, Object> doc = Fixtures.jobFlow("etl");
        LaunchConfig config = LaunchConfig.of(doc);
        String before = config.hash();

        doc.put("Name", "changed");
        assertEquals(before, config.hash());
        assertEquals("etl", config.name());
        assertThrows(UnsupportedOperationException.class, () -> config.document().put("Name", "y"));

        Map<String, Object> copy = config.mutableCopy();
        copy.put("Name", "y");
        assertEquals("etl", config.name());
    }
}
