package ai.canopy.tree.nodes;

import ai.canopy.tree.Context;
import ai.canopy.tree.NodeKind;
import ai.canopy.tree.Position;
import ai.canopy.tree.PyNode;
import java.util.Arrays;
import java.util.List;
import org.jetbrains.annotations.Nullable;

/** A {@code tuple} display, which may also be an assignment or deletion target. */
public final class Tuple extends BaseContainer {

    private final Context ctx;

    public Tuple(@Nullable Position position, Context ctx) {
        super(position);
        this.ctx = ctx;
    }

    public Context ctx() {
        return ctx;
    }

    @Override
    public NodeKind kind() {
        return NodeKind.TUPLE;
    }

    @Override
    protected PyNode bareCopy() {
        return new Tuple(position(), ctx);
    }

    @Override
    public List<@Nullable Object> otherFieldValues() {
        return Arrays.asList(ctx);
    }
}
