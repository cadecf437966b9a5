package com.papertrail.core.similarity;

import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Set;

/**
 * Blocking on three cheap keys:
 * <ul>
 *   <li><b>First token</b>: {@code tok:santos}</li>
 *   <li><b>Name prefix</b>: first 4 characters, {@code pfx:sant}</li>
 *   <li><b>Registration prefix</b>: first N alphanumerics of the registration number, {@code reg:cs2019}</li>
 * </ul>
 * The prefix key rescues names whose first token is misspelled late in the word.
 */
public class DefaultBlockingKeyStrategy implements BlockingKeyStrategy {

    private static final int NAME_PREFIX_LENGTH = 4;

    private final int registrationPrefixLength;

    public DefaultBlockingKeyStrategy() {
        this(6);
    }

    public DefaultBlockingKeyStrategy(int registrationPrefixLength) {
        if (registrationPrefixLength < 1) {
            throw new IllegalArgumentException("registrationPrefixLength must be >= 1");
        }
        this.registrationPrefixLength = registrationPrefixLength;
    }

    @Override
    public Set<String> generateKeys(String canonicalName, String registrationNumber) {
        Set<String> keys = new LinkedHashSet<>();
        if (canonicalName != null && !canonicalName.isBlank()) {
            String cleaned = canonicalName.trim();
            int space = cleaned.indexOf(' ');
            keys.add("tok:" + (space < 0 ? cleaned : cleaned.substring(0, space)));
            keys.add("pfx:" + cleaned.substring(0, Math.min(NAME_PREFIX_LENGTH, cleaned.length())));
        }
        String reg = normalizeRegistration(registrationNumber);
        if (!reg.isEmpty()) {
            keys.add("reg:" + reg.substring(0, Math.min(registrationPrefixLength, reg.length())));
        }
        return keys;
    }

    /**
     * Registration number reduced to upper-case alphanumerics.
     */
    public static String normalizeRegistration(String registrationNumber) {
        if (registrationNumber == null) {
            return "";
        }
        return registrationNumber.replaceAll("[^A-Za-z0-9]", "").toUpperCase(Locale.ROOT);
    }
}
