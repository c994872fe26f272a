package ai.canopy.tree.nodes;

import ai.canopy.tree.NodeKind;
import ai.canopy.tree.NodeSequence;
import ai.canopy.tree.Position;
import ai.canopy.tree.PyNode;
import org.jetbrains.annotations.Nullable;

/**
 * A {@code try} with a {@code finally} block. When the statement also has handlers, {@code body} holds a single
 * {@link TryExcept}.
 */
public final class TryFinally extends PyNode {

    public TryFinally(@Nullable Position position) {
        super(position);
    }

    public TryFinally postinit(NodeSequence body, NodeSequence finalbody) {
        complete(body, finalbody);
        return this;
    }

    public NodeSequence body() {
        return sequenceAt(0);
    }

    public NodeSequence finalbody() {
        return sequenceAt(1);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.TRY_FINALLY;
    }

    @Override
    protected PyNode bareCopy() {
        return new TryFinally(position());
    }
}
