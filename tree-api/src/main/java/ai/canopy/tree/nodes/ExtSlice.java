package ai.canopy.tree.nodes;

import ai.canopy.tree.NodeKind;
import ai.canopy.tree.NodeSequence;
import ai.canopy.tree.Position;
import ai.canopy.tree.PyNode;
import org.jetbrains.annotations.Nullable;

/** A subscript with several dimensions, at least one of them a slice. */
public final class ExtSlice extends PyNode {

    public ExtSlice(@Nullable Position position) {
        super(position);
    }

    public ExtSlice postinit(NodeSequence dims) {
        complete(dims);
        return this;
    }

    public NodeSequence dims() {
        return sequenceAt(0);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.EXT_SLICE;
    }

    @Override
    protected PyNode bareCopy() {
        return new ExtSlice(position());
    }
}
