package ai.canopy.tree;

import java.util.AbstractList;
import java.util.Collection;
import java.util.List;
import java.util.RandomAccess;

/** An immutable, ordered list of sibling nodes held in a single child field. */
public final class NodeSequence extends AbstractList<PyNode> implements TreeItem, RandomAccess {

    private final List<PyNode> elements;

    private NodeSequence(List<PyNode> elements) {
        this.elements = elements;
    }

    /** A fresh empty sequence. Instances are never shared, so each one has its own identity in a tree. */
    public static NodeSequence empty() {
        return new NodeSequence(List.of());
    }

    public static NodeSequence of(PyNode... nodes) {
        return new NodeSequence(List.of(nodes));
    }

    public static NodeSequence copyOf(Collection<? extends PyNode> nodes) {
        return new NodeSequence(List.copyOf(nodes));
    }

    @Override
    public PyNode get(int index) {
        return elements.get(index);
    }

    @Override
    public int size() {
        return elements.size();
    }

    public PyNode last() {
        if (elements.isEmpty()) {
            throw new IllegalStateException("Empty sequence has no last element");
        }
        return elements.get(elements.size() - 1);
    }

    @Override
    public List<PyNode> items() {
        return elements;
    }

    @Override
    public NodeSequence withItems(List<? extends TreeItem> items) {
        for (TreeItem item : items) {
            if (!(item instanceof PyNode)) {
                throw new IllegalArgumentException("A sequence can only hold nodes, got " + item);
            }
        }
        @SuppressWarnings("unchecked")
        List<PyNode> nodes = (List<PyNode>) (List<?>) items;
        return copyOf(nodes);
    }

    @Override
    public boolean isPresent() {
        return !elements.isEmpty();
    }
}
