package com.papertrail.core.redflag.detectors;

import com.papertrail.core.facts.Blacklisting;
import com.papertrail.core.facts.ContractorProfile;
import com.papertrail.core.facts.Ownership;
import com.papertrail.core.facts.OwnershipRole;
import com.papertrail.core.facts.ProcurementFacts;
import com.papertrail.core.model.RedFlag;
import com.papertrail.core.model.Severity;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;

import static com.papertrail.core.GraphFixtures.context;
import static com.papertrail.core.GraphFixtures.contractor;
import static com.papertrail.core.GraphFixtures.graph;
import static org.junit.jupiter.api.Assertions.*;

@DisplayName("PhoenixCompanyDetector")
class PhoenixCompanyDetectorTest {

    private static final String ADDRESS = "12 Rizal Street, Barangay San Roque, Tacloban City";

    private final PhoenixCompanyDetector detector = new PhoenixCompanyDetector();

    private static ProcurementFacts.Builder phoenixFacts(LocalDate successorRegistered) {
        return ProcurementFacts.builder()
                .blacklisting(new Blacklisting("con-a", LocalDate.of(2020, 2, 1), "Abandoned project"))
                .contractorProfile(new ContractorProfile("con-a", ADDRESS, 1_000_000.0,
                        LocalDate.of(2012, 4, 1), "Leyte"))
                .contractorProfile(new ContractorProfile("con-b", "12 Rizal St., Brgy. San Roque, Tacloban City",
                        1_000_000.0, successorRegistered, "Leyte"))
                .ownership(new Ownership("con-a", null, "Maria Santos", OwnershipRole.DIRECTOR))
                .ownership(new Ownership("con-b", null, "Maria Santos", OwnershipRole.OWNER));
    }

    @Test
    @DisplayName("Should flag a successor sharing address and director with a blacklisted contractor")
    void testPhoenixScenario() {
        ProcurementFacts facts = phoenixFacts(LocalDate.of(2020, 6, 15)).build();

        List<RedFlag> flags = detector.detect(context(graph(facts,
                contractor("con-a", "Alpha Construction"), contractor("con-b", "Alpha Prime Builders"))));

        assertEquals(1, flags.size());
        RedFlag flag = flags.get(0);
        assertEquals(Severity.CRITICAL, flag.getSeverity());
        assertEquals("con-b", flag.getPrimarySubjectId());
        assertEquals(List.of("con-b", "con-a"), flag.getSubjectIds());
        assertEquals(List.of("RE_REGISTERED_AS", "SAME_ADDRESS_AS", "SHARES_DIRECTOR_WITH"),
                flag.getEvidence().get("indicators"));
        assertEquals("2020-02-01", flag.getEvidence().get("blacklisted_on"));
        assertEquals("2020-06-15", flag.getEvidence().get("successor_registered_on"));
    }

    @Test
    @DisplayName("Should still flag on shared address and director when the registration date is unknown")
    void testWithoutRegistrationDate() {
        ProcurementFacts facts = phoenixFacts(null).build();

        List<RedFlag> flags = detector.detect(context(graph(facts)));

        assertEquals(1, flags.size());
        assertEquals(List.of("SAME_ADDRESS_AS", "SHARES_DIRECTOR_WITH"), flags.get(0).getEvidence().get("indicators"));
        assertFalse(flags.get(0).getEvidence().containsKey("successor_registered_on"));
    }

    @Test
    @DisplayName("Should not flag a shared address alone")
    void testAddressOnly() {
        ProcurementFacts facts = ProcurementFacts.builder()
                .blacklisting(new Blacklisting("con-a", LocalDate.of(2020, 2, 1), "Abandoned project"))
                .contractorProfile(new ContractorProfile("con-a", ADDRESS, null, null, null))
                .contractorProfile(new ContractorProfile("con-b", ADDRESS, null, null, null))
                .build();

        assertTrue(detector.detect(context(graph(facts))).isEmpty());
    }

    @Test
    @DisplayName("Should not flag look-alikes when neither was blacklisted")
    void testNoBlacklisting() {
        ProcurementFacts facts = ProcurementFacts.builder()
                .contractorProfile(new ContractorProfile("con-a", ADDRESS, null, null, null))
                .contractorProfile(new ContractorProfile("con-b", ADDRESS, null, null, null))
                .ownership(new Ownership("con-a", null, "Maria Santos", OwnershipRole.DIRECTOR))
                .ownership(new Ownership("con-b", null, "Maria Santos", OwnershipRole.DIRECTOR))
                .build();

        assertTrue(detector.detect(context(graph(facts))).isEmpty());
    }
}
