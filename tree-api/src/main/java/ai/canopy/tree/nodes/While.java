package ai.canopy.tree.nodes;

import ai.canopy.tree.NodeKind;
import ai.canopy.tree.NodeSequence;
import ai.canopy.tree.Position;
import ai.canopy.tree.PyNode;
import org.jetbrains.annotations.Nullable;

public final class While extends PyNode {

    public While(@Nullable Position position) {
        super(position);
    }

    public While postinit(PyNode test, NodeSequence body, NodeSequence orelse) {
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
        return NodeKind.WHILE;
    }

    @Override
    protected PyNode bareCopy() {
        return new While(position());
    }
}
