package com.papertrail.core.analytics;

import com.papertrail.core.facts.ProcurementFacts;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.time.LocalDate;
import java.util.List;

import static com.papertrail.core.GraphFixtures.agency;
import static com.papertrail.core.GraphFixtures.contract;
import static com.papertrail.core.GraphFixtures.graph;
import static org.junit.jupiter.api.Assertions.*;

@DisplayName("ConcentrationAnalyzer")
class ConcentrationAnalyzerTest {

    private static final LocalDate DAY = LocalDate.of(2021, 3, 15);

    private final ConcentrationAnalyzer analyzer = new ConcentrationAnalyzer();

    @Test
    @DisplayName("Should compute HHI as the sum of squared value shares")
    void testHhi() {
        ProcurementFacts facts = ProcurementFacts.builder()
                .contract(contract("H-1", "agy-1", "con-a", 5_000_000.0, DAY, 3))
                .contract(contract("H-2", "agy-1", "con-b", 3_000_000.0, DAY, 3))
                .contract(contract("H-3", "agy-1", "con-a", 1_000_000.0, DAY, 3))
                .contract(contract("H-4", "agy-1", "con-c", 1_000_000.0, DAY, 3))
                .build();

        List<ConcentrationMetric> metrics = analyzer.analyze(graph(facts));

        assertEquals(1, metrics.size());
        ConcentrationMetric metric = metrics.get(0);
        assertEquals(0.36 + 0.09 + 0.01, metric.hhi(), 1e-9);
        assertEquals(ConcentrationLevel.HIGH, metric.level());
        assertEquals(10_000_000.0, metric.totalValue(), 0.001);
        assertEquals(4, metric.contractCount());
        assertEquals("con-a", metric.shares().get(0).contractorId());
        assertEquals(0.6, metric.shares().get(0).share(), 1e-9);
        assertFalse(metric.isMonopoly());
    }

    @Test
    @DisplayName("Should report a single supplier as a monopoly with HHI 1")
    void testMonopoly() {
        ProcurementFacts facts = ProcurementFacts.builder()
                .contract(contract("M-1", "agy-1", "con-a", 2_000_000.0, DAY, 1))
                .contract(contract("M-2", "agy-1", "con-a", 2_000_000.0, DAY.plusDays(40), 1))
                .build();

        ConcentrationMetric metric = analyzer.analyze(graph(facts)).get(0);

        assertEquals(1.0, metric.hhi(), 1e-12);
        assertTrue(metric.isMonopoly());
    }

    @Test
    @DisplayName("Should leave HHI undefined for an agency without awarded value")
    void testUndefined() {
        ProcurementFacts facts = ProcurementFacts.builder()
                .contract(contract("Z-1", "agy-2", "con-a", 0.0, DAY, 1))
                .build();

        List<ConcentrationMetric> metrics = analyzer.analyze(graph(facts, agency("agy-1", "Idle Office")));

        assertEquals(List.of("agy-1", "agy-2"), metrics.stream().map(ConcentrationMetric::agencyId).toList());
        assertTrue(metrics.stream().noneMatch(ConcentrationMetric::isDefined));
        assertNull(metrics.get(0).level());
    }

    @Test
    @DisplayName("Should count only awards inside the window")
    void testWindow() {
        ProcurementFacts facts = ProcurementFacts.builder()
                .contract(contract("W-1", "agy-1", "con-a", 1_000_000.0, DAY, 2))
                .contract(contract("W-2", "agy-1", "con-b", 1_000_000.0, DAY.plusYears(1), 2))
                .build();
        AnalysisWindow window = new AnalysisWindow(DAY.minusDays(1), DAY.plusDays(1));

        ConcentrationMetric metric = analyzer.analyze(graph(facts), window).get(0);

        assertEquals(1, metric.contractCount());
        assertEquals(1.0, metric.hhi(), 1e-12);
        assertEquals(window, metric.window());
    }

    @Test
    @DisplayName("Should reject a window that ends before it starts")
    void testInvalidWindow() {
        assertThrows(IllegalArgumentException.class, () -> new AnalysisWindow(DAY, DAY.minusDays(1)));
    }

    @ParameterizedTest(name = "HHI {0} is {1}")
    @CsvSource({"0.0, LOW", "0.1499, LOW", "0.15, MODERATE", "0.2499, MODERATE", "0.25, HIGH", "1.0, HIGH"})
    @DisplayName("Should band HHI values")
    void testBands(double hhi, ConcentrationLevel expected) {
        assertEquals(expected, ConcentrationLevel.of(hhi));
    }
}
