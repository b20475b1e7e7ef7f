package org.dxworks.celerrate.cst;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Read-only view of one node of the grammar engine's concrete tree.
 * <p>
 * Byte offsets index the UTF-8 encoding of the source. Children include anonymous tokens
 * (punctuation, keywords, operators) in source order. Handles are only valid for the pass
 * that produced them.
 */
public interface ConcreteNode {

    String kind();

    int startByte();

    int endByte();

    boolean isNamed();

    /**
     * True for error nodes the engine inserted while recovering from a syntax error.
     */
    boolean isError();

    /**
     * True for zero-width nodes the engine synthesized for a token it expected but did not find.
     */
    boolean isMissing();

    List<ConcreteNode> children();

    /**
     * Field name under which the child at {@code index} hangs, or {@code null}.
     */
    String fieldNameOf(int index);

    default GrammarKind grammarKind() {
        return GrammarKind.fromTag(kind());
    }

    default List<ConcreteNode> namedChildren() {
        List<ConcreteNode> named = new ArrayList<>();
        for (ConcreteNode child : children()) {
            if (child.isNamed()) {
                named.add(child);
            }
        }
        return named;
    }

    default Optional<ConcreteNode> field(String name) {
        List<ConcreteNode> children = children();
        for (int i = 0; i < children.size(); i++) {
            if (name.equals(fieldNameOf(i))) {
                return Optional.of(children.get(i));
            }
        }
        return Optional.empty();
    }

    default List<ConcreteNode> fields(String name) {
        List<ConcreteNode> result = new ArrayList<>();
        List<ConcreteNode> children = children();
        for (int i = 0; i < children.size(); i++) {
            if (name.equals(fieldNameOf(i))) {
                result.add(children.get(i));
            }
        }
        return result;
    }
}
