package ai.canopy.tree.nodes;

import ai.canopy.tree.NodeKind;
import ai.canopy.tree.Position;
import ai.canopy.tree.PyNode;
import org.jetbrains.annotations.Nullable;

public final class AsyncWith extends With {

    public AsyncWith(@Nullable Position position) {
        super(position);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.ASYNC_WITH;
    }

    @Override
    protected PyNode bareCopy() {
        return new AsyncWith(position());
    }
}
