package org.dxworks.celerrate.dialect;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.dxworks.celerrate.dialect.Dialect.*;

/**
 * Central table of version gates and ambiguity readings.
 * <p>
 * The table is built once during class initialization and never changes afterwards, so a
 * single instance is shared by every mapping pass without synchronization. Adding a dialect
 * or a construct means adding a row here; mapping rules only ask questions.
 */
public final class DialectResolver {

    private static final DialectResolver DEFAULT = new DialectResolver();

    private final Map<Construct, ConstructRule> constructs;
    private final Map<Ambiguity, List<Candidate>> ambiguities;

    private DialectResolver(Map<Construct, ConstructRule> constructs, Map<Ambiguity, List<Candidate>> ambiguities) {
        this.constructs = constructs;
        this.ambiguities = ambiguities;
    }

    private DialectResolver() {
        Map<Construct, ConstructRule> rules = new EnumMap<>(Construct.class);
        // Types
        rule(rules, Construct.NULLABLE_TYPE, PHP_7_1, GatePolicy.KEEP);
        rule(rules, Construct.VOID_TYPE, PHP_7_1, GatePolicy.KEEP);
        rule(rules, Construct.ITERABLE_TYPE, PHP_7_1, GatePolicy.KEEP);
        rule(rules, Construct.OBJECT_TYPE, PHP_7_2, GatePolicy.KEEP);
        rule(rules, Construct.MIXED_TYPE, PHP_8_0, GatePolicy.KEEP);
        rule(rules, Construct.STATIC_RETURN_TYPE, PHP_8_0, GatePolicy.KEEP);
        rule(rules, Construct.UNION_TYPE, PHP_8_0, GatePolicy.KEEP);
        rule(rules, Construct.NEVER_TYPE, PHP_8_1, GatePolicy.KEEP);
        rule(rules, Construct.INTERSECTION_TYPE, PHP_8_1, GatePolicy.KEEP);
        rule(rules, Construct.STANDALONE_LITERAL_TYPE, PHP_8_2, GatePolicy.KEEP);
        rule(rules, Construct.DNF_TYPE, PHP_8_2, GatePolicy.KEEP);

        // Declarations and modifiers
        rule(rules, Construct.CLASS_CONSTANT_VISIBILITY, PHP_7_1, GatePolicy.DOWNGRADE);
        rule(rules, Construct.TYPED_PROPERTY, PHP_7_4, GatePolicy.DOWNGRADE);
        rule(rules, Construct.CONSTRUCTOR_PROMOTION, PHP_8_0, GatePolicy.DOWNGRADE);
        rule(rules, Construct.ATTRIBUTES, PHP_8_0, GatePolicy.DOWNGRADE);
        rule(rules, Construct.READONLY_PROPERTY, PHP_8_1, GatePolicy.DOWNGRADE);
        rule(rules, Construct.ENUM, PHP_8_1, GatePolicy.REJECT);
        rule(rules, Construct.FINAL_CLASS_CONSTANT, PHP_8_1, GatePolicy.DOWNGRADE);
        rule(rules, Construct.READONLY_CLASS, PHP_8_2, GatePolicy.DOWNGRADE);
        rule(rules, Construct.TRAIT_CONSTANT, PHP_8_2, GatePolicy.KEEP);
        rule(rules, Construct.TYPED_CLASS_CONSTANT, PHP_8_3, GatePolicy.DOWNGRADE);

        // Statements and expressions
        rule(rules, Construct.MULTI_CATCH, PHP_7_1, GatePolicy.KEEP);
        rule(rules, Construct.SHORT_LIST_DESTRUCTURING, PHP_7_1, GatePolicy.KEEP);
        rule(rules, Construct.ARROW_FUNCTION, PHP_7_4, GatePolicy.KEEP);
        rule(rules, Construct.NULL_COALESCING_ASSIGNMENT, PHP_7_4, GatePolicy.KEEP);
        rule(rules, Construct.ARRAY_SPREAD, PHP_7_4, GatePolicy.KEEP);
        rule(rules, Construct.NUMERIC_LITERAL_SEPARATOR, PHP_7_4, GatePolicy.KEEP);
        rule(rules, Construct.MATCH_EXPRESSION, PHP_8_0, GatePolicy.REJECT);
        rule(rules, Construct.NULLSAFE_OPERATOR, PHP_8_0, GatePolicy.KEEP);
        rule(rules, Construct.NAMED_ARGUMENTS, PHP_8_0, GatePolicy.KEEP);
        rule(rules, Construct.THROW_EXPRESSION, PHP_8_0, GatePolicy.KEEP);
        rule(rules, Construct.FIRST_CLASS_CALLABLE, PHP_8_1, GatePolicy.KEEP);
        rule(rules, Construct.NEW_IN_INITIALIZER, PHP_8_1, GatePolicy.KEEP);
        rule(rules, Construct.EXPLICIT_OCTAL_LITERAL, PHP_8_1, GatePolicy.KEEP);
        rule(rules, Construct.DYNAMIC_CLASS_CONSTANT_FETCH, PHP_8_3, GatePolicy.KEEP);

        // Forms that were removed
        rules.put(Construct.UNPARENTHESIZED_NESTED_TERNARY,
                new ConstructRule(PHP_7_0, PHP_7_4, PHP_8_0, GatePolicy.KEEP));
        rules.put(Construct.REAL_CAST, new ConstructRule(PHP_7_0, PHP_7_4, PHP_8_0, GatePolicy.KEEP));
        rules.put(Construct.UNSET_CAST, new ConstructRule(PHP_7_0, PHP_7_2, PHP_8_0, GatePolicy.KEEP));

        for (Construct construct : Construct.values()) {
            if (!rules.containsKey(construct)) {
                throw new IllegalStateException("No dialect rule for construct " + construct.getId());
            }
        }
        this.constructs = Collections.unmodifiableMap(rules);

        Map<Ambiguity, List<Candidate>> readings = new EnumMap<>(Ambiguity.class);
        readings.put(Ambiguity.STATEMENT_BODY, List.of(
                new Candidate(InterpretationChoice.BLOCK, null)));
        readings.put(Ambiguity.ALTERNATIVE_SYNTAX, List.of(
                new Candidate(InterpretationChoice.BLOCK, null)));
        readings.put(Ambiguity.ELSE_IF_SPELLING, List.of(
                new Candidate(InterpretationChoice.ELSEIF_CLAUSE, null),
                new Candidate(InterpretationChoice.NESTED_IF, null)));
        readings.put(Ambiguity.ARRAY_SPELLING, List.of(
                new Candidate(InterpretationChoice.ARRAY_LITERAL, null)));
        readings.put(Ambiguity.LIST_SPELLING, List.of(
                new Candidate(InterpretationChoice.DESTRUCTURING, null)));
        readings.put(Ambiguity.NULLABLE_SPELLING, List.of(
                new Candidate(InterpretationChoice.UNION_WITH_NULL, Construct.UNION_TYPE),
                new Candidate(InterpretationChoice.NULLABLE_SHORTHAND, Construct.NULLABLE_TYPE),
                new Candidate(InterpretationChoice.AS_WRITTEN, null)));
        readings.put(Ambiguity.NESTED_TERNARY, List.of(
                new Candidate(InterpretationChoice.LEFT_ASSOCIATIVE, Construct.UNPARENTHESIZED_NESTED_TERNARY),
                new Candidate(InterpretationChoice.REJECT, null)));
        for (Ambiguity ambiguity : Ambiguity.values()) {
            if (!readings.containsKey(ambiguity)) {
                throw new IllegalStateException("No readings for ambiguity " + ambiguity);
            }
        }
        this.ambiguities = Collections.unmodifiableMap(readings);
    }

    private static void rule(Map<Construct, ConstructRule> rules, Construct construct, Dialect since, GatePolicy policy) {
        rules.put(construct, new ConstructRule(since, null, null, policy));
    }

    public static DialectResolver getDefault() {
        return DEFAULT;
    }

    /**
     * Copy of this resolver in which {@code ambiguity} always reads as {@code choice}. The
     * construct table is shared; this resolver is left unchanged.
     */
    public DialectResolver withReading(Ambiguity ambiguity, InterpretationChoice choice) {
        Map<Ambiguity, List<Candidate>> readings = new EnumMap<>(ambiguities);
        readings.put(ambiguity, List.of(new Candidate(choice, null)));
        return new DialectResolver(constructs, Collections.unmodifiableMap(readings));
    }

    public boolean isConstructEnabled(Construct construct, Dialect dialect) {
        ConstructRule rule = constructs.get(construct);
        if (!dialect.isAtLeast(rule.since)) return false;
        return rule.removedIn == null || !dialect.isAtLeast(rule.removedIn);
    }

    /**
     * String-keyed variant for callers holding grammar-level identifiers such as
     * {@code "readonly_property"}.
     */
    public boolean isConstructEnabled(String constructId, Dialect dialect) {
        Construct construct = Construct.fromId(constructId)
                .orElseThrow(() -> new IllegalArgumentException("Unknown construct id: " + constructId));
        return isConstructEnabled(construct, dialect);
    }

    public boolean isDeprecated(Construct construct, Dialect dialect) {
        ConstructRule rule = constructs.get(construct);
        return rule.deprecatedIn != null && dialect.isAtLeast(rule.deprecatedIn)
                && isConstructEnabled(construct, dialect);
    }

    public GateDecision gate(Construct construct, Dialect dialect) {
        if (isConstructEnabled(construct, dialect)) {
            return GateDecision.ALLOW;
        }
        switch (constructs.get(construct).policy) {
            case DOWNGRADE:
                return GateDecision.DOWNGRADE;
            case REJECT:
                return GateDecision.REJECT;
            default:
                return GateDecision.KEEP_WITH_WARNING;
        }
    }

    public Dialect getMinimumDialect(Construct construct) {
        return constructs.get(construct).since;
    }

    public Optional<Dialect> getRemovedIn(Construct construct) {
        return Optional.ofNullable(constructs.get(construct).removedIn);
    }

    public GatePolicy getPolicy(Construct construct) {
        return constructs.get(construct).policy;
    }

    /**
     * Picks the reading for an ambiguous form. Among the candidates the dialect allows, the one
     * whose required construct became legal earliest wins; candidates without a requirement rank
     * last; ties keep declaration order.
     */
    public InterpretationChoice resolveAmbiguity(Ambiguity ambiguity, Dialect dialect) {
        List<Candidate> candidates = ambiguities.get(ambiguity);
        List<IndexedCandidate> allowed = new ArrayList<>();
        for (int i = 0; i < candidates.size(); i++) {
            Candidate candidate = candidates.get(i);
            if (candidate.requires == null || isConstructEnabled(candidate.requires, dialect)) {
                allowed.add(new IndexedCandidate(i, candidate));
            }
        }
        if (allowed.isEmpty()) {
            return InterpretationChoice.AS_WRITTEN;
        }
        allowed.sort(Comparator
                .comparingInt((IndexedCandidate c) -> c.candidate.requires == null
                        ? Integer.MAX_VALUE : getMinimumDialect(c.candidate.requires).ordinal())
                .thenComparingInt(c -> c.index));
        return allowed.get(0).candidate.choice;
    }

    /**
     * Resolves a requested version tag; unknown or future tags fall back to the newest dialect.
     */
    public DialectSelection resolveTag(String tag) {
        Optional<Dialect> known = Dialect.fromTag(tag);
        return known.map(dialect -> new DialectSelection(tag, dialect, false))
                .orElseGet(() -> new DialectSelection(tag, Dialect.latest(), true));
    }

    private static final class ConstructRule {
        final Dialect since;
        final Dialect deprecatedIn;
        final Dialect removedIn;
        final GatePolicy policy;

        ConstructRule(Dialect since, Dialect deprecatedIn, Dialect removedIn, GatePolicy policy) {
            this.since = since;
            this.deprecatedIn = deprecatedIn;
            this.removedIn = removedIn;
            this.policy = policy;
        }
    }

    private static final class Candidate {
        final InterpretationChoice choice;
        final Construct requires;

        Candidate(InterpretationChoice choice, Construct requires) {
            this.choice = choice;
            this.requires = requires;
        }
    }

    private static final class IndexedCandidate {
        final int index;
        final Candidate candidate;

        IndexedCandidate(int index, Candidate candidate) {
            this.index = index;
            this.candidate = candidate;
        }
    }
}
