package ai.canopy.tree.nodes;

import ai.canopy.tree.Context;
import ai.canopy.tree.NodeKind;
import ai.canopy.tree.Position;
import ai.canopy.tree.PyNode;
import java.util.Arrays;
import java.util.List;
import org.jetbrains.annotations.Nullable;

/** A {@code list} display, which may also be an assignment or deletion target. */
public final class ListNode extends BaseContainer {

    private final Context ctx;

    public ListNode(@Nullable Position position, Context ctx) {
        super(position);
        this.ctx = ctx;
    }

    public Context ctx() {
        return ctx;
    }

    @Override
    public NodeKind kind() {
        return NodeKind.LIST;
    }

    @Override
    protected PyNode bareCopy() {
        return new ListNode(position(), ctx);
    }

    @Override
    public List<@Nullable Object> otherFieldValues() {
        return Arrays.asList(ctx);
    }
}
