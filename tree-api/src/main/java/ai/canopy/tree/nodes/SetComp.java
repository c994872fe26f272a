package ai.canopy.tree.nodes;

import ai.canopy.tree.NodeKind;
import ai.canopy.tree.NodeSequence;
import ai.canopy.tree.Position;
import ai.canopy.tree.PyNode;
import org.jetbrains.annotations.Nullable;

/** A set comprehension. */
public final class SetComp extends BaseComprehension {

    public SetComp(@Nullable Position position) {
        super(position);
    }

    public SetComp postinit(NodeSequence generators, PyNode elt) {
        complete(generators, elt);
        return this;
    }

    public PyNode elt() {
        return nodeAt(1);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.SET_COMP;
    }

    @Override
    protected PyNode bareCopy() {
        return new SetComp(position());
    }
}
