package ai.canopy.tree.nodes;

import ai.canopy.tree.Context;
import ai.canopy.tree.NodeKind;
import ai.canopy.tree.Position;
import ai.canopy.tree.PyNode;
import java.util.Arrays;
import java.util.List;
import org.jetbrains.annotations.Nullable;

public final class Subscript extends PyNode {

    private final Context ctx;

    public Subscript(@Nullable Position position, Context ctx) {
        super(position);
        this.ctx = ctx;
    }

    public Subscript postinit(PyNode value, PyNode slice) {
        complete(value, slice);
        return this;
    }

    public PyNode value() {
        return nodeAt(0);
    }

    public PyNode slice() {
        return nodeAt(1);
    }

    public Context ctx() {
        return ctx;
    }

    @Override
    public NodeKind kind() {
        return NodeKind.SUBSCRIPT;
    }

    @Override
    protected PyNode bareCopy() {
        return new Subscript(position(), ctx);
    }

    @Override
    public List<@Nullable Object> otherFieldValues() {
        return Arrays.asList(ctx);
    }
}
