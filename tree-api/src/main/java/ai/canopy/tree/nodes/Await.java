package ai.canopy.tree.nodes;

import ai.canopy.tree.NodeKind;
import ai.canopy.tree.Position;
import ai.canopy.tree.PyNode;
import org.jetbrains.annotations.Nullable;

public final class Await extends PyNode {

    public Await(@Nullable Position position) {
        super(position);
    }

    public Await postinit(PyNode value) {
        complete(value);
        return this;
    }

    public PyNode value() {
        return nodeAt(0);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.AWAIT;
    }

    @Override
    protected PyNode bareCopy() {
        return new Await(position());
    }
}
