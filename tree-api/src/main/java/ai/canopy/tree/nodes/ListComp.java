package ai.canopy.tree.nodes;

import ai.canopy.tree.NodeKind;
import ai.canopy.tree.NodeSequence;
import ai.canopy.tree.Position;
import ai.canopy.tree.PyNode;
import org.jetbrains.annotations.Nullable;

/** A list comprehension. */
public final class ListComp extends BaseComprehension {

    public ListComp(@Nullable Position position) {
        super(position);
    }

    public ListComp postinit(NodeSequence generators, PyNode elt) {
        complete(generators, elt);
        return this;
    }

    public PyNode elt() {
        return nodeAt(1);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.LIST_COMP;
    }

    @Override
    protected PyNode bareCopy() {
        return new ListComp(position());
    }
}
