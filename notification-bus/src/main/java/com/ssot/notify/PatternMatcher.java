package com.ssot.notify;

import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Pattern;
import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Decides whether a {@link SubscriptionPattern} matches a {@link ChangeEvent}.
 *
 * <h2>Evaluation order</h2>
 * <ol>
 *   <li>A {@link SubscriptionPattern.Custom} pattern is decided by its predicate alone. A predicate
 *       that throws is logged and treated as a non-match.</li>
 *   <li>Otherwise {@code type}, {@code entityType}, {@code entityId}, {@code attributeName} and
 *       {@code changeType} must each equal the event's value or be wildcarded. The first failing
 *       test ends the evaluation.</li>
 *   <li>An {@code attributeNamePattern}, when present, must glob-match the attribute name.</li>
 *   <li>For relation events only, {@code relationType} is tested (wildcard {@code *}) and the
 *       source/target entity types must match exactly when the pattern specifies them.</li>
 * </ol>
 */
public class PatternMatcher {

    private static final Logger LOGGER = LoggerFactory.getLogger(PatternMatcher.class);

    // Compiled globs; the pattern set of a bus is small and long-lived.
    private final Map<String, Pattern> globCache = new ConcurrentHashMap<>();

    private long predicateFailures = 0;

    public boolean matches(@Nonnull ChangeEvent event, @Nonnull SubscriptionPattern pattern) {
        Objects.requireNonNull(event, "Event must not be null");
        Objects.requireNonNull(pattern, "Pattern must not be null");

        if (pattern instanceof SubscriptionPattern.Custom) {
            return matchesCustom(event, (SubscriptionPattern.Custom) pattern);
        }
        return matchesStructural(event, (SubscriptionPattern.Structural) pattern);
    }

    private boolean matchesCustom(ChangeEvent event, SubscriptionPattern.Custom pattern) {
        try {
            return pattern.getPredicate().test(event);
        } catch (RuntimeException e) {
            predicateFailures++;
            LOGGER.warn("Custom subscription predicate threw while matching {}", event, e);
            return false;
        }
    }

    private boolean matchesStructural(ChangeEvent event, SubscriptionPattern.Structural pattern) {
        if (pattern.getType() != null && pattern.getType() != event.getType()) {
            return false;
        }
        if (!matchesField(pattern.getEntityType(), event.getEntityType())) {
            return false;
        }
        if (!matchesField(pattern.getEntityId(), event.getEntityId())) {
            return false;
        }
        if (!matchesField(pattern.getAttributeName(), event.getAttributeName())) {
            return false;
        }
        if (pattern.getChangeType() != null && pattern.getChangeType() != event.getChangeType()) {
            return false;
        }
        if (pattern.getAttributeNamePattern() != null
                && !matchesGlob(event.getAttributeName(), pattern.getAttributeNamePattern())) {
            return false;
        }
        if (event.getType() == EventType.RELATION) {
            if (!matchesField(pattern.getRelationType(), event.getRelationType())) {
                return false;
            }
            if (pattern.getSourceEntityType() != null
                    && !pattern.getSourceEntityType().equals(event.getSourceEntityType())) {
                return false;
            }
            if (pattern.getTargetEntityType() != null
                    && !pattern.getTargetEntityType().equals(event.getTargetEntityType())) {
                return false;
            }
        }
        return true;
    }

    private static boolean matchesField(String expected, @Nullable String actual) {
        return SubscriptionPattern.WILDCARD.equals(expected) || expected.equals(actual);
    }

    /**
     * Case-insensitive glob match where {@code *} is any run of characters and {@code ?} a single
     * character. Every other character is literal. A missing or empty text never matches.
     *
     * @param text the attribute name to test
     * @param glob the glob expression
     * @return true if the whole text matches the glob
     */
    public boolean matchesGlob(@Nullable String text, @Nullable String glob) {
        if (text == null || text.isEmpty() || glob == null || glob.isEmpty()) {
            return false;
        }
        return globCache.computeIfAbsent(glob, PatternMatcher::compileGlob).matcher(text).matches();
    }

    static Pattern compileGlob(String glob) {
        StringBuilder regex = new StringBuilder(glob.length() + 8);
        StringBuilder literal = new StringBuilder();
        for (int i = 0; i < glob.length(); i++) {
            char c = glob.charAt(i);
            if (c == '*' || c == '?') {
                if (literal.length() > 0) {
                    regex.append(Pattern.quote(literal.toString()));
                    literal.setLength(0);
                }
                regex.append(c == '*' ? ".*" : ".");
            } else {
                literal.append(c);
            }
        }
        if (literal.length() > 0) {
            regex.append(Pattern.quote(literal.toString()));
        }
        return Pattern.compile(regex.toString(), Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE | Pattern.DOTALL);
    }

    /**
     * @return number of custom predicates that threw since this matcher was created
     */
    public long getPredicateFailures() {
        return predicateFailures;
    }
}
