package com.patternsentinel.core.stats;

import com.patternsentinel.core.model.CorrelationPair;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link CorrelationTable}.
 */
class CorrelationTableTest {

    @Test
    @DisplayName("Lookup should ignore argument order")
    void lookupShouldBeUnordered() {
        CorrelationTable table = new CorrelationTable(List.of(new CorrelationPair("sensor.b", "sensor.a", 0.9, 48)));

        assertThat(table.get("sensor.a", "sensor.b")).isPresent();
        assertThat(table.get("sensor.b", "sensor.a")).isPresent();
        assertThat(table.get("sensor.a", "sensor.c")).isEmpty();
    }

    @Test
    @DisplayName("Ids containing the separator character should not collide")
    void idsWithSeparatorShouldNotCollide() {
        CorrelationPair first = new CorrelationPair("x|y", "z", 0.9, 48);
        CorrelationPair second = new CorrelationPair("x", "y|z", -0.8, 48);

        CorrelationTable table = new CorrelationTable(List.of(first, second));

        assertThat(table.size()).isEqualTo(2);
        assertThat(table.get("z", "x|y")).contains(first);
        assertThat(table.get("x", "y|z")).contains(second);
    }

    @Test
    @DisplayName("Dropping an entity should remove every pair it is part of")
    void withoutShouldDropInvolvedPairs() {
        CorrelationTable table = new CorrelationTable(List.of(
                new CorrelationPair("a", "b", 0.9, 48),
                new CorrelationPair("a", "c", 0.8, 48),
                new CorrelationPair("b", "c", 0.7, 48)));

        CorrelationTable reduced = table.without("a");

        assertThat(reduced.pairs()).extracting(CorrelationPair::compositeId).containsExactly("b <-> c");
        assertThat(reduced.without("a")).isSameAs(reduced);
    }
}
