package org.dxworks.celerrate.model;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Read-only walks over a mapped tree. Walks use an explicit stack, so deep trees do not
 * grow the call stack.
 */
public final class AstTraversal {

    private AstTraversal() {
    }

    /**
     * Lazy pre-order walk in source order. Each call to {@code iterator()} starts a fresh walk.
     */
    public static Iterable<NodeVisit> preOrder(AstNode root) {
        return () -> new PreOrderIterator(root);
    }

    public static Stream<NodeVisit> stream(AstNode root) {
        return StreamSupport.stream(preOrder(root).spliterator(), false);
    }

    public static <T extends AstNode> List<T> findAll(AstNode root, Class<T> type) {
        return stream(root)
                .map(NodeVisit::getNode)
                .filter(type::isInstance)
                .map(type::cast)
                .collect(Collectors.toList());
    }

    public static <T extends AstNode> T findFirst(AstNode root, Class<T> type) {
        return stream(root)
                .map(NodeVisit::getNode)
                .filter(type::isInstance)
                .map(type::cast)
                .findFirst()
                .orElse(null);
    }

    private static final class PreOrderIterator implements Iterator<NodeVisit> {
        private final Deque<NodeVisit> stack = new ArrayDeque<>();

        PreOrderIterator(AstNode root) {
            stack.push(new NodeVisit(root, null));
        }

        @Override
        public boolean hasNext() {
            return !stack.isEmpty();
        }

        @Override
        public NodeVisit next() {
            if (stack.isEmpty()) {
                throw new NoSuchElementException();
            }
            NodeVisit visit = stack.pop();
            List<AstNode> children = new ArrayList<>(visit.getNode().getChildren());
            // Push in reverse so the first child is visited first
            for (int i = children.size() - 1; i >= 0; i--) {
                stack.push(new NodeVisit(children.get(i), visit));
            }
            return visit;
        }
    }
}
