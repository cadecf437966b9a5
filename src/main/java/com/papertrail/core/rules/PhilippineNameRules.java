package com.papertrail.core.rules;

import com.papertrail.core.model.EntityKind;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Built-in rewrite rules and token tables for Philippine personal names,
 * company names and addresses.
 */
public final class PhilippineNameRules {

    /**
     * Trailing tokens removed from organisation names while more than one token remains.
     */
    public static final Set<String> LEGAL_SUFFIXES = Set.of(
            "inc", "incorporated", "corp", "corporation", "co", "company",
            "ltd", "limited", "llc", "pte", "pvt", "plc", "opc");

    /**
     * Joiners dropped together with a trailing legal suffix ("Reyes and Co.", "Tan &amp; Co").
     */
    public static final Set<String> JOINERS = Set.of("and", "&");

    public static final Map<String, String> ADDRESS_ABBREVIATIONS = Map.of(
            "street", "st",
            "avenue", "ave",
            "barangay", "brgy",
            "building", "bldg",
            "road", "rd",
            "number", "no");

    private PhilippineNameRules() {
        // Utility class
    }

    public static NormalizationEngine createEngine() {
        return new NormalizationEngine(getPersonNameRules());
    }

    public static List<NormalizationRule> getPersonNameRules() {
        return List.of(
                NormalizationRule.builder()
                        .name("person-honorific")
                        .pattern("^((hon|atty|engr|dr|mr|mrs|ms|gov|mayor|rep|sen)\\s+)+")
                        .applicableKinds(EntityKind.PERSON, EntityKind.POLITICIAN)
                        .priority(10)
                        .build(),

                NormalizationRule.builder()
                        .name("person-generational-suffix")
                        .pattern("(\\s+(jr|sr|ii|iii|iv))+$")
                        .applicableKinds(EntityKind.PERSON, EntityKind.POLITICIAN)
                        .priority(20)
                        .build(),

                // "de la cruz" and "dela cruz" are the same surname
                NormalizationRule.builder()
                        .name("person-particle-de-la")
                        .pattern("\\bde\\s+(la|los|las)\\b")
                        .replacement("de$1")
                        .applicableKinds(EntityKind.PERSON, EntityKind.POLITICIAN)
                        .priority(30)
                        .build()
        );
    }
}
