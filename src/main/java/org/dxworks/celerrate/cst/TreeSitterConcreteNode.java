package org.dxworks.celerrate.cst;

import org.treesitter.TSNode;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * {@link ConcreteNode} backed by a tree-sitter node. Children and their field names are read
 * once, on first access.
 */
public final class TreeSitterConcreteNode implements ConcreteNode {
    private final TSNode node;
    private List<ConcreteNode> children;
    private List<String> fieldNames;

    private TreeSitterConcreteNode(TSNode node) {
        this.node = node;
    }

    public static TreeSitterConcreteNode wrap(TSNode node) {
        if (node == null || node.isNull()) {
            throw new IllegalArgumentException("Cannot wrap a null tree-sitter node");
        }
        return new TreeSitterConcreteNode(node);
    }

    @Override
    public String kind() {
        return node.getType();
    }

    @Override
    public int startByte() {
        return node.getStartByte();
    }

    @Override
    public int endByte() {
        return node.getEndByte();
    }

    @Override
    public boolean isNamed() {
        return node.isNamed();
    }

    @Override
    public boolean isError() {
        return "ERROR".equals(node.getType());
    }

    @Override
    public boolean isMissing() {
        return node.isMissing();
    }

    @Override
    public List<ConcreteNode> children() {
        loadChildren();
        return children;
    }

    @Override
    public String fieldNameOf(int index) {
        loadChildren();
        return fieldNames.get(index);
    }

    private void loadChildren() {
        if (children != null) return;
        int count = node.getChildCount();
        List<ConcreteNode> nodes = new ArrayList<>(count);
        List<String> names = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            TSNode child = node.getChild(i);
            if (child == null || child.isNull()) continue;
            nodes.add(new TreeSitterConcreteNode(child));
            // getFieldNameForChild takes the index among all children, anonymous ones included
            names.add(fieldNameFor(i));
        }
        fieldNames = Collections.unmodifiableList(names);
        children = Collections.unmodifiableList(nodes);
    }

    private String fieldNameFor(int index) {
        try {
            return node.getFieldNameForChild(index);
        } catch (RuntimeException e) {
            // The binding throws for children without a field on some platforms
            return null;
        }
    }

    @Override
    public String toString() {
        return kind() + "[" + startByte() + ".." + endByte() + ")";
    }
}
