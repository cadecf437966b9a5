package com.papertrail.core.rules;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.papertrail.core.config.CacheConfig;
import com.papertrail.core.model.EntityKind;

import java.text.Normalizer;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Turns raw names and addresses into comparison-ready strings.
 *
 * <p>Steps, in order: Unicode decomposition with combining marks removed,
 * case folding, dot removal inside tokens, punctuation to whitespace,
 * kind-scoped rewrite rules, trailing legal-suffix stripping, whitespace
 * collapse. The transformation is deterministic and idempotent; the cache
 * only memoizes it.</p>
 *
 * <p>Blank input yields the empty string, which callers treat as unmatchable.</p>
 */
public class Canonicalizer {

    private static final Pattern COMBINING_MARKS = Pattern.compile("\\p{M}+");
    private static final Pattern DOTS = Pattern.compile("\\.");
    private static final Pattern PUNCTUATION = Pattern.compile("[^\\p{L}\\p{N}&\\s]+");
    private static final Pattern AMPERSAND = Pattern.compile("&");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private final NormalizationEngine engine;
    private final Cache<CacheKey, String> cache;

    public Canonicalizer() {
        this(PhilippineNameRules.createEngine(), CacheConfig.defaults());
    }

    public Canonicalizer(CacheConfig cacheConfig) {
        this(PhilippineNameRules.createEngine(), cacheConfig);
    }

    public Canonicalizer(NormalizationEngine engine, CacheConfig cacheConfig) {
        this.engine = engine;
        this.cache = cacheConfig.enabled()
                ? Caffeine.newBuilder()
                    .maximumSize(cacheConfig.maxSize())
                    .expireAfterAccess(Duration.ofSeconds(cacheConfig.ttlSeconds()))
                    .build()
                : null;
    }

    /**
     * Canonical form of an entity name of the given kind.
     */
    public String canonicalize(String raw, EntityKind kind) {
        if (raw == null || raw.isBlank()) {
            return "";
        }
        if (cache == null) {
            return computeName(raw, kind);
        }
        return cache.get(new CacheKey(raw, kind, false), k -> computeName(raw, kind));
    }

    /**
     * Canonical form of a postal address.
     */
    public String canonicalizeAddress(String raw) {
        if (raw == null || raw.isBlank()) {
            return "";
        }
        if (cache == null) {
            return computeAddress(raw);
        }
        return cache.get(new CacheKey(raw, null, true), k -> computeAddress(raw));
    }

    public long cachedEntries() {
        return cache == null ? 0 : cache.estimatedSize();
    }

    private String computeName(String raw, EntityKind kind) {
        String text = engine.apply(fold(raw), kind);
        if (!kind.isPersonName()) {
            text = stripLegalSuffixes(text);
        }
        // a lone joiner left in the middle of a name reads the same either way
        return AMPERSAND.matcher(text).replaceAll("and");
    }

    private String computeAddress(String raw) {
        String[] tokens = WHITESPACE.split(fold(raw));
        StringBuilder sb = new StringBuilder();
        for (String token : tokens) {
            if (token.isEmpty()) {
                continue;
            }
            if (sb.length() > 0) {
                sb.append(' ');
            }
            sb.append(PhilippineNameRules.ADDRESS_ABBREVIATIONS.getOrDefault(token, token));
        }
        return AMPERSAND.matcher(sb.toString()).replaceAll("and");
    }

    private static String fold(String raw) {
        String text = Normalizer.normalize(raw, Normalizer.Form.NFKD);
        text = COMBINING_MARKS.matcher(text).replaceAll("");
        text = Normalizer.normalize(text, Normalizer.Form.NFKC);
        text = text.toLowerCase(Locale.ROOT);
        text = DOTS.matcher(text).replaceAll("");
        text = PUNCTUATION.matcher(text).replaceAll(" ");
        text = AMPERSAND.matcher(text).replaceAll(" & ");
        return WHITESPACE.matcher(text).replaceAll(" ").trim();
    }

    private static String stripLegalSuffixes(String text) {
        if (text.isEmpty()) {
            return text;
        }
        List<String> tokens = new ArrayList<>(Arrays.asList(text.split(" ")));
        while (tokens.size() > 1 && PhilippineNameRules.LEGAL_SUFFIXES.contains(tokens.get(tokens.size() - 1))) {
            tokens.remove(tokens.size() - 1);
            if (tokens.size() > 1 && PhilippineNameRules.JOINERS.contains(tokens.get(tokens.size() - 1))) {
                tokens.remove(tokens.size() - 1);
            }
        }
        return String.join(" ", tokens);
    }

    private record CacheKey(String raw, EntityKind kind, boolean address) {
    }
}
