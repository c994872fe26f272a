package ai.canopy.tree;

import java.util.List;

/** Marks an absent optional child. There is exactly one instance; it is never given a parent. */
public final class Empty extends PyNode {

    public static final Empty INSTANCE = new Empty();

    private Empty() {
        super(null);
        complete();
    }

    @Override
    public NodeKind kind() {
        return NodeKind.EMPTY;
    }

    @Override
    protected PyNode bareCopy() {
        throw new UnsupportedOperationException("Empty has no children to replace");
    }

    @Override
    public TreeItem withItems(List<? extends TreeItem> items) {
        if (!items.isEmpty()) {
            throw new IllegalArgumentException("Empty cannot hold children");
        }
        return this;
    }

    @Override
    public boolean isPresent() {
        return false;
    }

    @Override
    public boolean equals(Object o) {
        return this == o;
    }

    @Override
    public int hashCode() {
        return System.identityHashCode(this);
    }

    @Override
    public String toString() {
        return "Empty";
    }
}
