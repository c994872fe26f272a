package ai.canopy.tree.nodes;

import ai.canopy.tree.NodeKind;
import ai.canopy.tree.Position;
import ai.canopy.tree.PyNode;
import org.jetbrains.annotations.Nullable;

/** An {@code async def} statement. */
public final class AsyncFunctionDef extends FunctionDef {

    public AsyncFunctionDef(@Nullable Position position, String name, @Nullable String doc) {
        super(position, name, doc);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.ASYNC_FUNCTION_DEF;
    }

    @Override
    protected PyNode bareCopy() {
        return new AsyncFunctionDef(position(), name(), doc());
    }
}
