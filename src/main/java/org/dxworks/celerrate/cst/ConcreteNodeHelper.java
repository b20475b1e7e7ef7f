package org.dxworks.celerrate.cst;

import java.util.ArrayList;
import java.util.List;

/**
 * Lookups over concrete nodes shared by the mapping rules. Comments are extras that the
 * grammar may attach anywhere, so the "significant" variants skip them.
 */
public final class ConcreteNodeHelper {

    private ConcreteNodeHelper() {
    }

    public static List<ConcreteNode> significantChildren(ConcreteNode parent) {
        List<ConcreteNode> result = new ArrayList<>();
        if (parent == null) return result;
        for (ConcreteNode child : parent.children()) {
            if (child.isNamed() && !"comment".equals(child.kind())) {
                result.add(child);
            }
        }
        return result;
    }

    public static ConcreteNode findFirstChild(ConcreteNode parent, String kind) {
        if (parent == null) return null;
        for (ConcreteNode child : parent.children()) {
            if (kind.equals(child.kind())) {
                return child;
            }
        }
        return null;
    }

    public static List<ConcreteNode> findAllChildren(ConcreteNode parent, String kind) {
        List<ConcreteNode> result = new ArrayList<>();
        if (parent == null) return result;
        for (ConcreteNode child : parent.children()) {
            if (kind.equals(child.kind())) {
                result.add(child);
            }
        }
        return result;
    }

    public static ConcreteNode getFirstChildOfKinds(ConcreteNode parent, String... kinds) {
        if (parent == null) return null;
        for (ConcreteNode child : parent.children()) {
            if (isKindOneOf(child.kind(), kinds)) {
                return child;
            }
        }
        return null;
    }

    /**
     * Field child if the grammar labels it, otherwise the first child of one of the given kinds.
     */
    public static ConcreteNode fieldOrKind(ConcreteNode parent, String field, String... kinds) {
        if (parent == null) return null;
        return parent.field(field).orElseGet(() -> getFirstChildOfKinds(parent, kinds));
    }

    public static boolean isKindOneOf(String kind, String... kinds) {
        if (kind == null) return false;
        for (String k : kinds) if (kind.equals(k)) return true;
        return false;
    }

    /**
     * Anonymous token child with the given text, compared case-insensitively since PHP keywords are.
     */
    public static ConcreteNode findToken(ConcreteNode parent, String token) {
        if (parent == null) return null;
        for (ConcreteNode child : parent.children()) {
            if (!child.isNamed() && token.equalsIgnoreCase(child.kind())) {
                return child;
            }
        }
        return null;
    }

    public static boolean hasToken(ConcreteNode parent, String token) {
        return findToken(parent, token) != null;
    }

    /**
     * Collapses whitespace runs to single spaces and trims.
     */
    public static String normalizeInline(String s) {
        if (s == null) return null;
        return s.replaceAll("\\s+", " ").trim();
    }
}
