/* (C)2026 */
package com.ammann.petrophysics.service;

import com.ammann.petrophysics.cache.WellAvailabilityCache.WellAvailability;
import com.ammann.petrophysics.enumeration.CurveAlias;
import com.ammann.petrophysics.model.WellLogDataset;
import com.ammann.petrophysics.support.MutableClock;
import com.ammann.petrophysics.support.TestDataFactory;
import jakarta.ws.rs.NotFoundException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class WellDatasetRegistryTest
{

    private MutableClock clock;
    private WellDatasetRegistry registry;

    @BeforeEach
    void setUp()
    {
        clock = new MutableClock(Instant.parse("2026-03-01T08:00:00Z"));
        registry = new WellDatasetRegistry(clock, Duration.ofMinutes(5));
    }

    @Test
    void registersAndFindsWells()
    {
        assertThat(registry.register(TestDataFactory.reservoirWell("B-2"))).isFalse();
        assertThat(registry.register(TestDataFactory.tightWell("A-1"))).isFalse();

        assertThat(registry.find("B-2")).isPresent();
        assertThat(registry.find("C-3")).isEmpty();
        assertThat(registry.require("A-1").getWellName()).isEqualTo("A-1");
    }

    @Test
    void reportsReplacement()
    {
        registry.register(TestDataFactory.tightWell("A-1"));

        assertThat(registry.register(TestDataFactory.reservoirWell("A-1"))).isTrue();
        assertThat(registry.require("A-1").has(CurveAlias.RESISTIVITY)).isTrue();
    }

    @Test
    void requireFailsForUnknownWell()
    {
        assertThatThrownBy(() -> registry.require("NOPE"))
                .isInstanceOf(NotFoundException.class)
                .hasMessageContaining("NOPE");
    }

    @Test
    void requireAllKeepsRequestedOrder()
    {
        registry.register(TestDataFactory.tightWell("A-1"));
        registry.register(TestDataFactory.tightWell("B-2"));

        assertThat(registry.requireAll(List.of("B-2", "A-1")))
                .extracting(WellLogDataset::getWellName)
                .containsExactly("B-2", "A-1");
    }

    @Test
    void availabilityIsSortedAndRefreshedOnChange()
    {
        registry.register(TestDataFactory.tightWell("B-2"));
        registry.register(TestDataFactory.tightWell("A-1"));

        WellAvailability first = registry.availability();
        assertThat(first.wellNames()).containsExactly("A-1", "B-2");

        clock.advance(Duration.ofMinutes(1));
        assertThat(registry.availability()).isSameAs(first);

        assertThat(registry.remove("A-1")).isTrue();
        WellAvailability second = registry.availability();
        assertThat(second.wellNames()).containsExactly("B-2");
        assertThat(second.asOf()).isEqualTo(clock.instant());
    }

    @Test
    void removingUnknownWellReportsFalse()
    {
        assertThat(registry.remove("NOPE")).isFalse();
    }
}
