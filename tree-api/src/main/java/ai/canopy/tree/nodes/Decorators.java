package ai.canopy.tree.nodes;

import ai.canopy.tree.NodeKind;
import ai.canopy.tree.NodeSequence;
import ai.canopy.tree.Position;
import ai.canopy.tree.PyNode;
import org.jetbrains.annotations.Nullable;

/** The decorator expressions of a function or class, outermost first. */
public final class Decorators extends PyNode {

    public Decorators(@Nullable Position position) {
        super(position);
    }

    public Decorators postinit(NodeSequence nodes) {
        complete(nodes);
        return this;
    }

    public NodeSequence nodes() {
        return sequenceAt(0);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.DECORATORS;
    }

    @Override
    protected PyNode bareCopy() {
        return new Decorators(position());
    }
}
