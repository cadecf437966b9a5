package com.papertrail.core.redflag.detectors;

import com.papertrail.core.config.DetectionOptions;
import com.papertrail.core.facts.ProcurementFacts;
import com.papertrail.core.facts.Subcontract;
import com.papertrail.core.model.RedFlag;
import com.papertrail.core.model.Severity;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.LocalDate;
import java.util.List;

import static com.papertrail.core.GraphFixtures.context;
import static com.papertrail.core.GraphFixtures.contract;
import static com.papertrail.core.GraphFixtures.contractor;
import static com.papertrail.core.GraphFixtures.graph;
import static org.junit.jupiter.api.Assertions.*;

@DisplayName("CircularSubcontractingDetector")
class CircularSubcontractingDetectorTest {

    private static final LocalDate DAY = LocalDate.of(2021, 9, 1);

    private final CircularSubcontractingDetector detector = new CircularSubcontractingDetector();

    @Test
    @DisplayName("Should flag money returning to the awardee with the bottleneck as retained value")
    void testCircularScenario() {
        ProcurementFacts facts = ProcurementFacts.builder()
                .contract(contract("CR-1", "agy-1", "con-a", 98_000_000.0, DAY, 2))
                .subcontract(new Subcontract("CR-1", "con-a", "con-b", 68_000_000.0, DAY.plusDays(10)))
                .subcontract(new Subcontract("CR-1", "con-b", "con-a", 42_000_000.0, DAY.plusDays(40)))
                .build();

        List<RedFlag> flags = detector.detect(context(graph(facts,
                contractor("con-a", "A Corp"), contractor("con-b", "B Corp"))));

        assertEquals(1, flags.size());
        RedFlag flag = flags.get(0);
        assertEquals(Severity.CRITICAL, flag.getSeverity());
        assertEquals(List.of("con-a", "con-b"), flag.getSubjectIds());
        assertEquals(List.of("con-a", "con-b", "con-a"), flag.getEvidence().get("path"));
        assertEquals(2, flag.getEvidence().get("hops"));
        assertEquals(42_000_000.0, (double) flag.getEvidence().get("net_retained_value"), 0.01);
        assertEquals(98_000_000.0, (double) flag.getEvidence().get("award_value"), 0.01);
        assertEquals(List.of("CR-1"), flag.getEvidence().get("contract_refs"));
    }

    @Test
    @DisplayName("Should report a longer cycle once")
    void testThreeHopCycle() {
        ProcurementFacts facts = ProcurementFacts.builder()
                .contract(contract("CR-1", "agy-1", "con-a", 50_000_000.0, DAY, 2))
                .contract(contract("CR-2", "agy-1", "con-b", 20_000_000.0, DAY, 2))
                .subcontract(new Subcontract("CR-1", "con-a", "con-b", 30_000_000.0, DAY))
                .subcontract(new Subcontract("CR-2", "con-b", "con-c", 10_000_000.0, DAY))
                .subcontract(new Subcontract("CR-1", "con-c", "con-a", 8_000_000.0, DAY))
                .build();

        List<RedFlag> flags = detector.detect(context(graph(facts)));

        assertEquals(1, flags.size());
        assertEquals(3, flags.get(0).getEvidence().get("hops"));
        assertEquals(List.of("con-a", "con-b", "con-c", "con-a"), flags.get(0).getEvidence().get("path"));
    }

    @Test
    @DisplayName("Should ignore cycles longer than the configured bound")
    void testMaxLength() {
        ProcurementFacts facts = ProcurementFacts.builder()
                .contract(contract("CR-1", "agy-1", "con-a", 50_000_000.0, DAY, 2))
                .subcontract(new Subcontract("CR-1", "con-a", "con-b", 30_000_000.0, DAY))
                .subcontract(new Subcontract("CR-1", "con-b", "con-c", 10_000_000.0, DAY))
                .subcontract(new Subcontract("CR-1", "con-c", "con-a", 8_000_000.0, DAY))
                .build();
        DetectionOptions options = DetectionOptions.builder().maxCycleLength(2).build();

        assertTrue(detector.detect(context(graph(facts), options)).isEmpty());
    }

    @Test
    @DisplayName("Should not flag a one-way chain")
    void testAcyclic() {
        ProcurementFacts facts = ProcurementFacts.builder()
                .contract(contract("CR-1", "agy-1", "con-a", 50_000_000.0, DAY, 2))
                .subcontract(new Subcontract("CR-1", "con-a", "con-b", 30_000_000.0, DAY))
                .subcontract(new Subcontract("CR-1", "con-b", "con-c", 10_000_000.0, DAY))
                .build();

        assertTrue(detector.detect(context(graph(facts))).isEmpty());
    }

    @Test
    @DisplayName("Should stop at the search budget and keep cycles already found")
    void testSearchBudget() {
        ProcurementFacts.Builder builder = ProcurementFacts.builder()
                .contract(contract("CR-1", "agy-1", "con-a", 50_000_000.0, DAY, 2))
                .subcontract(new Subcontract("CR-1", "con-a", "con-b", 30_000_000.0, DAY))
                .subcontract(new Subcontract("CR-1", "con-b", "con-a", 10_000_000.0, DAY))
                .contract(contract("CR-2", "agy-1", "con-k0", 50_000_000.0, DAY, 2));
        for (int i = 0; i < 8; i++) {
            for (int j = 0; j < 8; j++) {
                if (i != j) {
                    builder.subcontract(new Subcontract("CR-2", "con-k" + i, "con-k" + j, 1_000_000.0, DAY));
                }
            }
        }
        DetectionOptions options = DetectionOptions.builder().cycleSearchBudget(20).build();

        List<RedFlag> flags = assertTimeoutPreemptively(Duration.ofSeconds(5),
                () -> detector.detect(context(graph(builder.build()), options)));

        assertTrue(flags.stream().anyMatch(f -> f.getSubjectIds().equals(List.of("con-a", "con-b"))));
        assertTrue(flags.stream().allMatch(f -> Boolean.TRUE.equals(f.getEvidence().get("truncated"))));
    }
}
