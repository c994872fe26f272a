package ai.canopy.tree.nodes;

import ai.canopy.tree.NodeKind;
import ai.canopy.tree.NodeSequence;
import ai.canopy.tree.Position;
import ai.canopy.tree.PyNode;
import java.util.List;
import org.jetbrains.annotations.Nullable;

public final class TryExcept extends PyNode {

    public TryExcept(@Nullable Position position) {
        super(position);
    }

    public TryExcept postinit(NodeSequence body, NodeSequence handlers, NodeSequence orelse) {
        complete(body, handlers, orelse);
        return this;
    }

    public NodeSequence body() {
        return sequenceAt(0);
    }

    public List<ExceptHandler> handlers() {
        return elementsAt(1, ExceptHandler.class);
    }

    public NodeSequence orelse() {
        return sequenceAt(2);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.TRY_EXCEPT;
    }

    @Override
    protected PyNode bareCopy() {
        return new TryExcept(position());
    }
}
