package ai.canopy.tree.nodes;

import ai.canopy.tree.NodeKind;
import ai.canopy.tree.NodeSequence;
import ai.canopy.tree.Position;
import ai.canopy.tree.PyNode;
import org.jetbrains.annotations.Nullable;

public final class Delete extends PyNode {

    public Delete(@Nullable Position position) {
        super(position);
    }

    public Delete postinit(NodeSequence targets) {
        complete(targets);
        return this;
    }

    public NodeSequence targets() {
        return sequenceAt(0);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.DELETE;
    }

    @Override
    protected PyNode bareCopy() {
        return new Delete(position());
    }
}
