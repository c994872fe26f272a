package ai.canopy.tree.nodes;

import ai.canopy.tree.NodeKind;
import ai.canopy.tree.NodeSequence;
import ai.canopy.tree.Position;
import ai.canopy.tree.PyNode;
import org.jetbrains.annotations.Nullable;

public class For extends PyNode {

    public For(@Nullable Position position) {
        super(position);
    }

    public For postinit(PyNode target, PyNode iter, NodeSequence body, NodeSequence orelse) {
        complete(target, iter, body, orelse);
        return this;
    }

    public PyNode target() {
        return nodeAt(0);
    }

    public PyNode iter() {
        return nodeAt(1);
    }

    public NodeSequence body() {
        return sequenceAt(2);
    }

    public NodeSequence orelse() {
        return sequenceAt(3);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.FOR;
    }

    @Override
    protected PyNode bareCopy() {
        return new For(position());
    }
}
