package org.dxworks.celerrate.cst;

import java.util.ArrayList;
import java.util.List;

/**
 * Hand-built concrete node for trees the real grammar would not produce on demand.
 */
public final class FakeConcreteNode implements ConcreteNode {
    private final String kind;
    private final int start;
    private final int end;
    private final boolean named;
    private boolean missing;
    private final List<ConcreteNode> children = new ArrayList<>();
    private final List<String> fieldNames = new ArrayList<>();

    private FakeConcreteNode(String kind, int start, int end, boolean named) {
        this.kind = kind;
        this.start = start;
        this.end = end;
        this.named = named;
    }

    public static FakeConcreteNode node(String kind, int start, int end, ConcreteNode... children) {
        FakeConcreteNode node = new FakeConcreteNode(kind, start, end, true);
        for (ConcreteNode child : children) {
            node.add(null, child);
        }
        return node;
    }

    public static FakeConcreteNode token(String text, int start) {
        return new FakeConcreteNode(text, start, start + text.length(), false);
    }

    public static FakeConcreteNode missing(String kind, int at) {
        FakeConcreteNode node = new FakeConcreteNode(kind, at, at, true);
        node.missing = true;
        return node;
    }

    public FakeConcreteNode add(String fieldName, ConcreteNode child) {
        children.add(child);
        fieldNames.add(fieldName);
        return this;
    }

    public FakeConcreteNode withField(String fieldName, ConcreteNode child) {
        return add(fieldName, child);
    }

    @Override
    public String kind() {
        return kind;
    }

    @Override
    public int startByte() {
        return start;
    }

    @Override
    public int endByte() {
        return end;
    }

    @Override
    public boolean isNamed() {
        return named;
    }

    @Override
    public boolean isError() {
        return "ERROR".equals(kind);
    }

    @Override
    public boolean isMissing() {
        return missing;
    }

    @Override
    public List<ConcreteNode> children() {
        return children;
    }

    @Override
    public String fieldNameOf(int index) {
        return fieldNames.get(index);
    }
}
