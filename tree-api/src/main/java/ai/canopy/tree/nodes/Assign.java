package ai.canopy.tree.nodes;

import ai.canopy.tree.NodeKind;
import ai.canopy.tree.NodeSequence;
import ai.canopy.tree.Position;
import ai.canopy.tree.PyNode;
import org.jetbrains.annotations.Nullable;

public final class Assign extends PyNode {

    public Assign(@Nullable Position position) {
        super(position);
    }

    public Assign postinit(NodeSequence targets, PyNode value) {
        complete(targets, value);
        return this;
    }

    public NodeSequence targets() {
        return sequenceAt(0);
    }

    public PyNode value() {
        return nodeAt(1);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.ASSIGN;
    }

    @Override
    protected PyNode bareCopy() {
        return new Assign(position());
    }
}
