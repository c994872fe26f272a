package ai.canopy.tree.nodes;

import ai.canopy.tree.NodeKind;
import ai.canopy.tree.Position;
import ai.canopy.tree.PyNode;
import org.jetbrains.annotations.Nullable;

public class Yield extends PyNode {

    public Yield(@Nullable Position position) {
        super(position);
    }

    public Yield postinit(PyNode value) {
        complete(value);
        return this;
    }

    public PyNode value() {
        return nodeAt(0);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.YIELD;
    }

    @Override
    protected PyNode bareCopy() {
        return new Yield(position());
    }
}
