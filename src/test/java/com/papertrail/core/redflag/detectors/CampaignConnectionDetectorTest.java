package com.papertrail.core.redflag.detectors;

import com.papertrail.core.facts.AgencyProfile;
import com.papertrail.core.facts.Donation;
import com.papertrail.core.facts.Office;
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

@DisplayName("CampaignConnectionDetector")
class CampaignConnectionDetectorTest {

    private static final LocalDate ELECTION = LocalDate.of(2022, 5, 9);

    private final CampaignConnectionDetector detector = new CampaignConnectionDetector();

    private static ProcurementFacts.Builder base() {
        return ProcurementFacts.builder()
                .office(new Office("pol-1", null, "Mayor", "mun-1", "Cebu", 2022))
                .agencyProfile(new AgencyProfile("agy-1", "mun-1", "Cebu"))
                .agencyProfile(new AgencyProfile("agy-2", "mun-2", "Cebu"))
                .donation(new Donation("con-d", "pol-1", 500_000.0, ELECTION.minusMonths(2)));
    }

    @Test
    @DisplayName("Should flag a donor later awarded contracts in the recipient's municipality")
    void testDonationThenAward() {
        ProcurementFacts facts = base()
                .contract(contract("P-1", "agy-1", "con-d", 12_000_000.0, ELECTION.plusMonths(3), 2))
                .contract(contract("P-2", "agy-1", "con-d", 8_000_000.0, ELECTION.plusMonths(6), 2))
                .build();

        List<RedFlag> flags = detector.detect(context(graph(facts)));

        assertEquals(1, flags.size());
        RedFlag flag = flags.get(0);
        assertEquals(Severity.HIGH, flag.getSeverity());
        assertEquals(List.of("con-d", "pol-1"), flag.getSubjectIds());
        assertEquals(List.of("P-1", "P-2"), flag.getEvidence().get("contract_refs"));
        assertEquals(20_000_000.0, (double) flag.getEvidence().get("awarded_amount"), 0.001);
        assertEquals(500_000.0, (double) flag.getEvidence().get("donated_amount"), 0.001);
        assertEquals(List.of("mun-1"), flag.getEvidence().get("municipality_ids"));
    }

    @Test
    @DisplayName("Should ignore awards made before the donation")
    void testAwardBeforeDonation() {
        ProcurementFacts facts = base()
                .contract(contract("P-1", "agy-1", "con-d", 12_000_000.0, ELECTION.minusMonths(6), 2))
                .build();

        assertTrue(detector.detect(context(graph(facts))).isEmpty());
    }

    @Test
    @DisplayName("Should ignore awards outside the recipient's jurisdiction")
    void testOtherMunicipality() {
        ProcurementFacts facts = base()
                .contract(contract("P-1", "agy-2", "con-d", 12_000_000.0, ELECTION.plusMonths(3), 2))
                .build();

        assertTrue(detector.detect(context(graph(facts))).isEmpty());
    }
}
