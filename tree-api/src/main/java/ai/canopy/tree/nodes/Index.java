package ai.canopy.tree.nodes;

import ai.canopy.tree.NodeKind;
import ai.canopy.tree.Position;
import ai.canopy.tree.PyNode;
import org.jetbrains.annotations.Nullable;

/** A plain, non-slice subscript. */
public final class Index extends PyNode {

    public Index(@Nullable Position position) {
        super(position);
    }

    public Index postinit(PyNode value) {
        complete(value);
        return this;
    }

    public PyNode value() {
        return nodeAt(0);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.INDEX;
    }

    @Override
    protected PyNode bareCopy() {
        return new Index(position());
    }
}
