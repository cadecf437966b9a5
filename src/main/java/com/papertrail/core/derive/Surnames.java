package com.papertrail.core.derive;

import com.papertrail.core.model.EntityKind;
import com.papertrail.core.rules.Canonicalizer;

import java.util.Set;

/**
 * Surname extraction for Filipino personal names.
 */
final class Surnames {

    private static final Set<String> PARTICLES = Set.of(
            "de", "del", "dela", "delos", "delas", "san", "santa", "sta", "di");

    private Surnames() {
    }

    /**
     * "SURNAME, Given" yields everything before the comma; otherwise the last
     * canonical token, together with a preceding particle ("dela cruz").
     */
    static String extract(String rawName, Canonicalizer canonicalizer) {
        if (rawName == null || rawName.isBlank()) {
            return "";
        }
        int comma = rawName.indexOf(',');
        if (comma > 0) {
            return canonicalizer.canonicalize(rawName.substring(0, comma), EntityKind.PERSON);
        }
        String canonical = canonicalizer.canonicalize(rawName, EntityKind.PERSON);
        if (canonical.isEmpty()) {
            return "";
        }
        String[] tokens = canonical.split(" ");
        String last = tokens[tokens.length - 1];
        if (tokens.length >= 3 && PARTICLES.contains(tokens[tokens.length - 2])) {
            return tokens[tokens.length - 2] + " " + last;
        }
        return last;
    }
}
