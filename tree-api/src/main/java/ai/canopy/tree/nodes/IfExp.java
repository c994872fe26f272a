package ai.canopy.tree.nodes;

import ai.canopy.tree.NodeKind;
import ai.canopy.tree.Position;
import ai.canopy.tree.PyNode;
import org.jetbrains.annotations.Nullable;

/** {@code body if test else orelse}. */
public final class IfExp extends PyNode {

    public IfExp(@Nullable Position position) {
        super(position);
    }

    public IfExp postinit(PyNode test, PyNode body, PyNode orelse) {
        complete(test, body, orelse);
        return this;
    }

    public PyNode test() {
        return nodeAt(0);
    }

    public PyNode body() {
        return nodeAt(1);
    }

    public PyNode orelse() {
        return nodeAt(2);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.IF_EXP;
    }

    @Override
    protected PyNode bareCopy() {
        return new IfExp(position());
    }
}
