package org.dxworks.celerrate.mapper;

/**
 * Innermost enclosing declaration while mapping, used for context-dependent rules such as
 * constructor promotion and implicitly readonly properties.
 */
public final class DeclarationScope {

    public enum Kind {
        FILE,
        CLASS,
        INTERFACE,
        TRAIT,
        ENUM,
        FUNCTION,
        METHOD,
        CONSTRUCTOR,
        CLOSURE
    }

    private final Kind kind;
    private final boolean readonlyClass;

    public DeclarationScope(Kind kind, boolean readonlyClass) {
        this.kind = kind;
        this.readonlyClass = readonlyClass;
    }

    public static DeclarationScope of(Kind kind) {
        return new DeclarationScope(kind, false);
    }

    public Kind getKind() {
        return kind;
    }

    public boolean isReadonlyClass() {
        return readonlyClass;
    }

    public boolean isClassLike() {
        return kind == Kind.CLASS || kind == Kind.INTERFACE || kind == Kind.TRAIT || kind == Kind.ENUM;
    }
}
