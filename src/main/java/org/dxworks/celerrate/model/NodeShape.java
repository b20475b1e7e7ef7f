package org.dxworks.celerrate.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Span-free description of a node: its scalar attributes and its named child slots,
 * both in declaration order. Structural equality and printing are defined over shapes.
 */
public final class NodeShape {
    private final Map<String, Object> attributes = new LinkedHashMap<>();
    private final List<Slot> slots = new ArrayList<>();

    public NodeShape attribute(String name, Object value) {
        attributes.put(name, value);
        return this;
    }

    public NodeShape child(String slot, AstNode node) {
        slots.add(new Slot(slot, node == null ? List.of() : List.of(node)));
        return this;
    }

    public NodeShape children(String slot, List<? extends AstNode> nodes) {
        slots.add(new Slot(slot, List.copyOf(nodes)));
        return this;
    }

    /**
     * Nodes of both lists ordered by start offset, for a slot that holds more than one node type.
     */
    public static List<AstNode> inSourceOrder(List<? extends AstNode> first, List<? extends AstNode> second) {
        List<AstNode> all = new ArrayList<>(first);
        all.addAll(second);
        all.sort(Comparator.comparingInt(node -> node.getSpan().getStartOffset()));
        return all;
    }

    public Map<String, Object> getAttributes() {
        return Collections.unmodifiableMap(attributes);
    }

    public List<Slot> getSlots() {
        return Collections.unmodifiableList(slots);
    }

    List<AstNode> flatten() {
        List<AstNode> all = new ArrayList<>();
        for (Slot slot : slots) {
            all.addAll(slot.nodes);
        }
        return Collections.unmodifiableList(all);
    }

    public static final class Slot {
        private final String name;
        private final List<AstNode> nodes;

        Slot(String name, List<AstNode> nodes) {
            this.name = name;
            this.nodes = nodes;
        }

        public String getName() {
            return name;
        }

        public List<AstNode> getNodes() {
            return nodes;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof Slot)) return false;
            Slot other = (Slot) o;
            return name.equals(other.name) && nodes.equals(other.nodes);
        }

        @Override
        public int hashCode() {
            return Objects.hash(name, nodes);
        }
    }
}
