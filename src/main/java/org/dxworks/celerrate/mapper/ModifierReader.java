package org.dxworks.celerrate.mapper;

import org.dxworks.celerrate.cst.ConcreteNode;
import org.dxworks.celerrate.dialect.Construct;
import org.dxworks.celerrate.model.Visibility;

import java.util.ArrayList;
import java.util.List;

import static org.dxworks.celerrate.cst.ConcreteNodeHelper.findAllChildren;
import static org.dxworks.celerrate.cst.ConcreteNodeHelper.normalizeInline;

/**
 * Modifier keywords and attribute groups written in front of a declaration.
 */
final class ModifierReader {
    ConcreteNode visibility;
    ConcreteNode staticModifier;
    ConcreteNode abstractModifier;
    ConcreteNode finalModifier;
    ConcreteNode readonlyModifier;
    ConcreteNode varModifier;

    private ModifierReader() {
    }

    static ModifierReader read(ConcreteNode declaration) {
        ModifierReader modifiers = new ModifierReader();
        for (ConcreteNode child : declaration.children()) {
            switch (child.grammarKind()) {
                case VISIBILITY_MODIFIER:
                    if (modifiers.visibility == null) modifiers.visibility = child;
                    break;
                case STATIC_MODIFIER:
                    modifiers.staticModifier = child;
                    break;
                case ABSTRACT_MODIFIER:
                    modifiers.abstractModifier = child;
                    break;
                case FINAL_MODIFIER:
                    modifiers.finalModifier = child;
                    break;
                case READONLY_MODIFIER:
                    modifiers.readonlyModifier = child;
                    break;
                case VAR_MODIFIER:
                    modifiers.varModifier = child;
                    break;
                default:
                    break;
            }
        }
        return modifiers;
    }

    /**
     * Declared visibility, or {@code fallback} when none is written. {@code var} means public.
     */
    Visibility visibility(MappingContext context, Visibility fallback) {
        if (visibility == null) {
            return varModifier != null ? Visibility.PUBLIC : fallback;
        }
        String text = context.text(visibility).trim();
        // Asymmetric forms such as "public(set)" keep their read visibility
        int paren = text.indexOf('(');
        if (paren > 0) text = text.substring(0, paren);
        return Visibility.fromKeyword(text).orElse(fallback);
    }

    /**
     * Normalized text of each attribute, or nothing when the dialect does not have attributes.
     */
    static List<String> annotations(ConcreteNode declaration, MappingContext context) {
        List<String> result = new ArrayList<>();
        for (ConcreteNode list : findAllChildren(declaration, "attribute_list")) {
            if (!context.gate(Construct.ATTRIBUTES, list).keepsConstruct()) continue;
            for (ConcreteNode group : findAllChildren(list, "attribute_group")) {
                List<ConcreteNode> attributes = findAllChildren(group, "attribute");
                if (attributes.isEmpty()) {
                    String text = normalizeInline(context.text(group));
                    if (text.startsWith("#[")) text = text.substring(2);
                    if (text.endsWith("]")) text = text.substring(0, text.length() - 1);
                    result.add(text.trim());
                    continue;
                }
                for (ConcreteNode attribute : attributes) {
                    result.add(normalizeInline(context.text(attribute)));
                }
            }
        }
        return result;
    }
}
