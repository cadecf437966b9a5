package com.papertrail.core.redflag.detectors;

import com.papertrail.core.facts.ProcurementFacts;
import com.papertrail.core.model.RedFlag;
import com.papertrail.core.model.Severity;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;

import static com.papertrail.core.GraphFixtures.agency;
import static com.papertrail.core.GraphFixtures.context;
import static com.papertrail.core.GraphFixtures.contract;
import static com.papertrail.core.GraphFixtures.graph;
import static org.junit.jupiter.api.Assertions.*;

@DisplayName("ConcentrationDetector")
class ConcentrationDetectorTest {

    private static final LocalDate DAY = LocalDate.of(2022, 1, 10);

    private final ConcentrationDetector detector = new ConcentrationDetector();

    private static Severity severityFor(ProcurementFacts facts) {
        List<RedFlag> flags = new ConcentrationDetector().detect(context(graph(facts)));
        assertEquals(1, flags.size());
        return flags.get(0).getSeverity();
    }

    @Test
    @DisplayName("Should rate a single-supplier agency CRITICAL")
    void testMonopoly() {
        ProcurementFacts.Builder facts = ProcurementFacts.builder();
        for (int i = 0; i < 4; i++) {
            facts.contract(contract("M-" + i, "agy-1", "con-x", 2_000_000.0, DAY.plusDays(i * 20L), 1));
        }

        List<RedFlag> flags = detector.detect(context(graph(facts.build(), agency("agy-1", "Provincial Office"))));

        assertEquals(1, flags.size());
        RedFlag flag = flags.get(0);
        assertEquals(Severity.CRITICAL, flag.getSeverity());
        assertEquals(List.of("agy-1"), flag.getSubjectIds());
        assertEquals(1.0, (double) flag.getEvidence().get("hhi"), 1e-9);
        assertEquals("con-x", flag.getEvidence().get("top_contractor_id"));
        assertEquals(4, flag.getEvidence().get("contract_count"));
    }

    @Test
    @DisplayName("Should rate a 60/40 split HIGH")
    void testHighBand() {
        ProcurementFacts facts = ProcurementFacts.builder()
                .contract(contract("H-1", "agy-1", "con-x", 6_000_000.0, DAY, 3))
                .contract(contract("H-2", "agy-1", "con-y", 4_000_000.0, DAY, 3))
                .build();

        assertEquals(Severity.HIGH, severityFor(facts));
    }

    @Test
    @DisplayName("Should rate four equal suppliers MEDIUM")
    void testMediumBand() {
        ProcurementFacts.Builder facts = ProcurementFacts.builder();
        for (int i = 0; i < 4; i++) {
            facts.contract(contract("E-" + i, "agy-1", "con-" + i, 1_000_000.0, DAY, 3));
        }

        assertEquals(Severity.MEDIUM, severityFor(facts.build()));
    }

    @Test
    @DisplayName("Should not flag competitive or empty agencies")
    void testNoFlag() {
        ProcurementFacts.Builder facts = ProcurementFacts.builder();
        for (int i = 0; i < 10; i++) {
            facts.contract(contract("K-" + i, "agy-1", "con-" + i, 1_000_000.0, DAY, 5));
        }

        assertTrue(detector.detect(context(graph(facts.build(), agency("agy-2", "Idle Office")))).isEmpty());
    }
}
