package ai.canopy.tree.nodes;

import ai.canopy.tree.NodeKind;
import ai.canopy.tree.Position;
import ai.canopy.tree.PyNode;
import org.jetbrains.annotations.Nullable;

public final class AsyncFor extends For {

    public AsyncFor(@Nullable Position position) {
        super(position);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.ASYNC_FOR;
    }

    @Override
    protected PyNode bareCopy() {
        return new AsyncFor(position());
    }
}
