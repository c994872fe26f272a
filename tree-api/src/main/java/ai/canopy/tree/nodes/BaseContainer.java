package ai.canopy.tree.nodes;

import ai.canopy.tree.NodeSequence;
import ai.canopy.tree.Position;
import ai.canopy.tree.PyNode;
import org.jetbrains.annotations.Nullable;

/** Shared shape of the list, tuple and set displays. */
public abstract class BaseContainer extends PyNode {

    protected BaseContainer(@Nullable Position position) {
        super(position);
    }

    public BaseContainer postinit(NodeSequence elts) {
        complete(elts);
        return this;
    }

    public NodeSequence elts() {
        return sequenceAt(0);
    }
}
