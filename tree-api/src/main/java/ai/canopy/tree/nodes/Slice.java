package ai.canopy.tree.nodes;

import ai.canopy.tree.NodeKind;
import ai.canopy.tree.Position;
import ai.canopy.tree.PyNode;
import org.jetbrains.annotations.Nullable;

public final class Slice extends PyNode {

    public Slice(@Nullable Position position) {
        super(position);
    }

    public Slice postinit(PyNode lower, PyNode upper, PyNode step) {
        complete(lower, upper, step);
        return this;
    }

    public PyNode lower() {
        return nodeAt(0);
    }

    public PyNode upper() {
        return nodeAt(1);
    }

    public PyNode step() {
        return nodeAt(2);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.SLICE;
    }

    @Override
    protected PyNode bareCopy() {
        return new Slice(position());
    }
}
