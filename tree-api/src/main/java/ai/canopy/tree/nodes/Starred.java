package ai.canopy.tree.nodes;

import ai.canopy.tree.Context;
import ai.canopy.tree.NodeKind;
import ai.canopy.tree.Position;
import ai.canopy.tree.PyNode;
import java.util.Arrays;
import java.util.List;
import org.jetbrains.annotations.Nullable;

public final class Starred extends PyNode {

    private final Context ctx;

    public Starred(@Nullable Position position, Context ctx) {
        super(position);
        this.ctx = ctx;
    }

    public Starred postinit(PyNode value) {
        complete(value);
        return this;
    }

    public PyNode value() {
        return nodeAt(0);
    }

    public Context ctx() {
        return ctx;
    }

    @Override
    public NodeKind kind() {
        return NodeKind.STARRED;
    }

    @Override
    protected PyNode bareCopy() {
        return new Starred(position(), ctx);
    }

    @Override
    public List<@Nullable Object> otherFieldValues() {
        return Arrays.asList(ctx);
    }
}
