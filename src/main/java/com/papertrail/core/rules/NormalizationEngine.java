package com.papertrail.core.rules;

import com.papertrail.core.model.EntityKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Applies normalization rules in priority order (lower number first),
 * filtered by entity kind.
 */
public class NormalizationEngine {
    private static final Logger log = LoggerFactory.getLogger(NormalizationEngine.class);

    private final List<NormalizationRule> rules;

    public NormalizationEngine(List<NormalizationRule> rules) {
        this.rules = new ArrayList<>(rules);
        this.rules.sort(Comparator.comparingInt(NormalizationRule::getPriority));
    }

    public List<NormalizationRule> getRules() {
        return List.copyOf(rules);
    }

    /**
     * Rewrites {@code text} with every rule applicable to {@code kind}, then
     * trims and collapses whitespace.
     */
    public String apply(String text, EntityKind kind) {
        if (text == null || text.isBlank()) {
            return "";
        }
        String result = text;
        for (NormalizationRule rule : rules) {
            if (rule.appliesTo(kind)) {
                String before = result;
                result = rule.apply(result);
                if (!before.equals(result) && log.isTraceEnabled()) {
                    log.trace("normalize.rule rule={} before='{}' after='{}'", rule.getName(), before, result);
                }
            }
        }
        return result.trim().replaceAll("\\s+", " ");
    }
}
