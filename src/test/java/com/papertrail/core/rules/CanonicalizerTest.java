package com.papertrail.core.rules;

import com.papertrail.core.config.CacheConfig;
import com.papertrail.core.model.EntityKind;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Canonicalizer")
class CanonicalizerTest {

    private final Canonicalizer canonicalizer = new Canonicalizer();

    @Nested
    @DisplayName("Organisation names")
    class Organisations {

        @ParameterizedTest(name = "\"{0}\" -> \"{1}\"")
        @CsvSource(delimiter = '|', value = {
                "ACME Builders, Inc.|acme builders",
                "Reyes & Co.|reyes",
                "Tan and Sons Corp|tan and sons",
                "Tan & Sons|tan and sons",
                "Peña Construction Company|pena construction",
                "  J.R.   Santos   Trading  |jr santos trading",
                "Inc.|inc"
        })
        @DisplayName("Should fold case, accents, punctuation and legal suffixes")
        void testContractorNames(String raw, String expected) {
            assertEquals(expected, canonicalizer.canonicalize(raw, EntityKind.CONTRACTOR));
        }

        @Test
        @DisplayName("Should return an empty form for blank or null names")
        void testBlank() {
            assertEquals("", canonicalizer.canonicalize(null, EntityKind.CONTRACTOR));
            assertEquals("", canonicalizer.canonicalize("   ", EntityKind.AGENCY));
            assertEquals("", canonicalizer.canonicalize("!!!", EntityKind.AGENCY));
        }
    }

    @Nested
    @DisplayName("Personal names")
    class People {

        @ParameterizedTest(name = "\"{0}\" -> \"{1}\"")
        @CsvSource(delimiter = '|', value = {
                "Hon. Juan de la Cruz Jr.|juan dela cruz",
                "Atty. Maria Clara Santos|maria clara santos",
                "Gov. Pedro Garcia III|pedro garcia",
                "Engr. José Rizal Sr.|jose rizal"
        })
        @DisplayName("Should strip titles and generational suffixes and join surname particles")
        void testPoliticianNames(String raw, String expected) {
            assertEquals(expected, canonicalizer.canonicalize(raw, EntityKind.POLITICIAN));
        }

        @Test
        @DisplayName("Should keep legal-looking tokens in personal names")
        void testPersonKeepsCo() {
            assertEquals("juan co", canonicalizer.canonicalize("Juan Co", EntityKind.PERSON));
        }
    }

    @ParameterizedTest
    @CsvSource(delimiter = '|', value = {
            "CONTRACTOR|Reyes and Co. Builders, Inc.",
            "POLITICIAN|Hon. Ma. Teresa de los Santos Jr.",
            "AGENCY|Dept. of Public Works & Highways"
    })
    @DisplayName("Should be idempotent")
    void testIdempotent(EntityKind kind, String raw) {
        String once = canonicalizer.canonicalize(raw, kind);
        assertEquals(once, canonicalizer.canonicalize(once, kind));
    }

    @Test
    @DisplayName("Should abbreviate common address words")
    void testAddresses() {
        assertEquals("12 rizal st brgy san roque",
                canonicalizer.canonicalizeAddress("12 Rizal Street, Barangay San Roque"));
        assertEquals(canonicalizer.canonicalizeAddress("Bldg. 3, Ortigas Avenue"),
                canonicalizer.canonicalizeAddress("Building 3 Ortigas Ave"));
        assertEquals("", canonicalizer.canonicalizeAddress(null));
    }

    @Test
    @DisplayName("Should cache canonical forms when enabled and not when disabled")
    void testCaching() {
        Canonicalizer cached = new Canonicalizer(CacheConfig.defaults());
        cached.canonicalize("ACME Builders, Inc.", EntityKind.CONTRACTOR);
        cached.canonicalize("ACME Builders, Inc.", EntityKind.CONTRACTOR);
        cached.canonicalize("ACME Builders, Inc.", EntityKind.AGENCY);
        cached.canonicalizeAddress("ACME Builders, Inc.");

        Canonicalizer uncached = new Canonicalizer(CacheConfig.disabled());
        uncached.canonicalize("ACME Builders, Inc.", EntityKind.CONTRACTOR);

        assertEquals(3, cached.cachedEntries());
        assertEquals(0, uncached.cachedEntries());
    }

    @Test
    @DisplayName("Should apply custom rules only to their kinds")
    void testCustomEngine() {
        NormalizationEngine engine = new NormalizationEngine(List.of(NormalizationRule.builder()
                .name("dpwh-expansion")
                .pattern("\\bdpwh\\b")
                .replacement("department of public works and highways")
                .applicableKinds(EntityKind.AGENCY)
                .build()));
        Canonicalizer custom = new Canonicalizer(engine, CacheConfig.disabled());

        assertEquals("department of public works and highways region vii",
                custom.canonicalize("DPWH Region VII", EntityKind.AGENCY));
        assertEquals("dpwh region vii", custom.canonicalize("DPWH Region VII", EntityKind.CONTRACTOR));
    }
}
