package org.dxworks.celerrate.model;

import java.util.Collection;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Renders a tree as an indented outline, one node per line with its set attributes.
 * Attributes that are {@code null}, {@code false} or empty are left out.
 */
public final class AstPrinter {

    private AstPrinter() {
    }

    public static String print(AstNode root) {
        StringBuilder out = new StringBuilder();
        for (NodeVisit visit : AstTraversal.preOrder(root)) {
            out.append("  ".repeat(visit.getDepth()));
            out.append(visit.getNode().getKind().getTag());
            for (Map.Entry<String, Object> attribute : visit.getNode().getAttributes().entrySet()) {
                Object value = attribute.getValue();
                if (value == null || Boolean.FALSE.equals(value)) continue;
                if (value instanceof Collection && ((Collection<?>) value).isEmpty()) continue;
                if (value instanceof Map && ((Map<?, ?>) value).isEmpty()) continue;
                out.append(' ').append(attribute.getKey()).append('=').append(render(value));
            }
            out.append('\n');
        }
        return out.toString();
    }

    private static String render(Object value) {
        if (value instanceof String) {
            return '"' + ((String) value).replace("\\", "\\\\").replace("\n", "\\n").replace("\"", "\\\"") + '"';
        }
        if (value instanceof Collection) {
            return ((Collection<?>) value).stream()
                    .map(AstPrinter::render)
                    .collect(Collectors.joining(", ", "[", "]"));
        }
        return String.valueOf(value);
    }
}
