package fr.lapetina.congress.gateway.service;

import fr.lapetina.congress.gateway.domain.model.BillType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class StaticResourcesTest {

    private StaticResources resources;

    @BeforeEach
    void setUp() {
        resources = new StaticResources();
    }

    @Test
    @DisplayName("should describe the current congress")
    void shouldDescribeCurrentCongress() {
        Map<String, Object> congress = resources.lookup(StaticResources.CURRENT_CONGRESS).orElseThrow();

        assertThat(congress)
                .containsEntry("number", 118)
                .containsEntry("startDate", "2023-01-03")
                .containsEntry("endDate", "2025-01-03");
    }

    @Test
    @DisplayName("should list all eight bill types")
    @SuppressWarnings("unchecked")
    void shouldListBillTypes() {
        Map<String, Object> payload = resources.lookup(StaticResources.BILL_TYPES).orElseThrow();

        List<Map<String, Object>> types = (List<Map<String, Object>>) payload.get("billTypes");
        assertThat(types).hasSize(BillType.values().length);
        assertThat(payload).containsEntry("count", 8);
        assertThat(types.get(0)).containsEntry("code", "hr").containsEntry("chamber", "house");
    }

    @Test
    @DisplayName("should match ignoring case, whitespace and query")
    void shouldMatchLeniently() {
        assertThat(resources.isStatic("  CONGRESS-GOV://info/Overview?x=1 ")).isTrue();
        assertThat(resources.isStatic("congress-gov://info/unknown")).isFalse();
        assertThat(resources.isStatic(null)).isFalse();
    }

    @Test
    @DisplayName("should expose the overview in a stable key order")
    void shouldKeepOverviewOrder() {
        assertThat(resources.lookup(StaticResources.OVERVIEW).orElseThrow().keySet())
                .containsExactly("message", "version", "documentation");
        assertThat(resources.identifiers()).containsExactly(
                StaticResources.OVERVIEW, StaticResources.CURRENT_CONGRESS, StaticResources.BILL_TYPES);
    }
}
