package org.dxworks.celerrate.model;

import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Declared type of a parameter, property, constant or return value.
 * <p>
 * Built-in type names are lower-cased, class names are kept as written. Two hints are equal when
 * they have the same form and members, so {@code ?int} written as {@code ?INT} compares equal.
 */
public final class TypeHint {

    public enum Form {
        NAMED,
        NULLABLE,
        UNION,
        INTERSECTION
    }

    private static final Set<String> BUILTINS = Set.of(
            "int", "float", "string", "bool", "array", "callable", "iterable", "object", "mixed",
            "void", "null", "never", "false", "true", "static", "self", "parent");

    private final Form form;
    private final String name;
    private final List<TypeHint> members;

    private TypeHint(Form form, String name, List<TypeHint> members) {
        this.form = form;
        this.name = name;
        this.members = List.copyOf(members);
    }

    public static TypeHint named(String name) {
        Objects.requireNonNull(name, "name");
        String lower = name.toLowerCase();
        return new TypeHint(Form.NAMED, BUILTINS.contains(lower) ? lower : name, List.of());
    }

    public static TypeHint nullable(TypeHint inner) {
        return new TypeHint(Form.NULLABLE, null, List.of(inner));
    }

    public static TypeHint union(List<TypeHint> members) {
        return new TypeHint(Form.UNION, null, members);
    }

    public static TypeHint intersection(List<TypeHint> members) {
        return new TypeHint(Form.INTERSECTION, null, members);
    }

    public Form getForm() {
        return form;
    }

    /**
     * Name of a {@link Form#NAMED} hint, {@code null} otherwise.
     */
    public String getName() {
        return name;
    }

    public List<TypeHint> getMembers() {
        return members;
    }

    public boolean isBuiltin() {
        return form == Form.NAMED && BUILTINS.contains(name);
    }

    /**
     * True when the hint names the given built-in anywhere, e.g. {@code mixed} inside a union.
     */
    public boolean mentions(String builtin) {
        if (form == Form.NAMED) return name.equals(builtin);
        for (TypeHint member : members) {
            if (member.mentions(builtin)) return true;
        }
        return false;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TypeHint)) return false;
        TypeHint other = (TypeHint) o;
        return form == other.form && Objects.equals(name, other.name) && members.equals(other.members);
    }

    @Override
    public int hashCode() {
        return Objects.hash(form, name, members);
    }

    @Override
    public String toString() {
        switch (form) {
            case NAMED:
                return name;
            case NULLABLE:
                return "?" + members.get(0);
            case UNION:
                return members.stream()
                        .map(m -> m.form == Form.INTERSECTION ? "(" + m + ")" : m.toString())
                        .collect(Collectors.joining("|"));
            default:
                return members.stream().map(TypeHint::toString).collect(Collectors.joining("&"));
        }
    }
}
