package com.papertrail.core.redflag.detectors;

import com.papertrail.core.facts.ContractorProfile;
import com.papertrail.core.facts.ProcurementFacts;
import com.papertrail.core.model.RedFlag;
import com.papertrail.core.model.Severity;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;

import static com.papertrail.core.GraphFixtures.context;
import static com.papertrail.core.GraphFixtures.contract;
import static com.papertrail.core.GraphFixtures.graph;
import static org.junit.jupiter.api.Assertions.*;

@DisplayName("ShellCompanyDetector")
class ShellCompanyDetectorTest {

    private static final LocalDate DAY = LocalDate.of(2022, 4, 4);

    private final ShellCompanyDetector detector = new ShellCompanyDetector();

    private static ProcurementFacts awards(Double capital) {
        return ProcurementFacts.builder()
                .contract(contract("S-1", "agy-1", "con-s", 30_000_000.0, DAY, 2))
                .contract(contract("S-2", "agy-2", "con-s", 25_000_000.0, DAY.plusDays(90), 2))
                .contractorProfile(new ContractorProfile("con-s", "Unit 5, Quezon City", capital, null, null))
                .build();
    }

    @Test
    @DisplayName("Should flag awards above one hundred times the registered capital")
    void testThinCapital() {
        List<RedFlag> flags = detector.detect(context(graph(awards(250_000.0))));

        assertEquals(1, flags.size());
        RedFlag flag = flags.get(0);
        assertEquals(Severity.HIGH, flag.getSeverity());
        assertEquals(List.of("con-s"), flag.getSubjectIds());
        assertEquals(220.0, (double) flag.getEvidence().get("ratio"), 1e-9);
        assertEquals(2, flag.getEvidence().get("contract_count"));
    }

    @Test
    @DisplayName("Should not flag adequately capitalized contractors")
    void testAdequateCapital() {
        assertTrue(detector.detect(context(graph(awards(10_000_000.0)))).isEmpty());
    }

    @Test
    @DisplayName("Should skip contractors without known capital")
    void testUnknownCapital() {
        assertTrue(detector.detect(context(graph(awards(null)))).isEmpty());
        assertTrue(detector.detect(context(graph(awards(0.0)))).isEmpty());
    }
}
