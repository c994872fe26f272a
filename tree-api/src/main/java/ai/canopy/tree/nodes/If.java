package ai.canopy.tree.nodes;

import ai.canopy.tree.NodeKind;
import ai.canopy.tree.NodeSequence;
import ai.canopy.tree.Position;
import ai.canopy.tree.PyNode;
import org.jetbrains.annotations.Nullable;

public final class If extends PyNode {

    public If(@Nullable Position position) {
        super(position);
    }

    public If postinit(PyNode test, NodeSequence body, NodeSequence orelse) {
        complete(test, body, orelse);
        return this;
    }

    public PyNode test() {
        return nodeAt(0);
    }

    public NodeSequence body() {
        return sequenceAt(1);
    }

    public NodeSequence orelse() {
        return sequenceAt(2);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.IF;
    }

    @Override
    protected PyNode bareCopy() {
        return new If(position());
    }
}
