package ai.canopy.tree.nodes;

import ai.canopy.tree.NodeKind;
import ai.canopy.tree.Position;
import ai.canopy.tree.PyNode;
import org.jetbrains.annotations.Nullable;

public final class Return extends PyNode {

    public Return(@Nullable Position position) {
        super(position);
    }

    public Return postinit(PyNode value) {
        complete(value);
        return this;
    }

    public PyNode value() {
        return nodeAt(0);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.RETURN;
    }

    @Override
    protected PyNode bareCopy() {
        return new Return(position());
    }
}
