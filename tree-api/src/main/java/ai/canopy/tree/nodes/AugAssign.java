package ai.canopy.tree.nodes;

import ai.canopy.tree.NodeKind;
import ai.canopy.tree.Position;
import ai.canopy.tree.PyNode;
import java.util.Arrays;
import java.util.List;
import org.jetbrains.annotations.Nullable;

/** Augmented assignment; {@code op} includes the trailing {@code =}, as in {@code +=}. */
public final class AugAssign extends PyNode {

    private final String op;

    public AugAssign(@Nullable Position position, String op) {
        super(position);
        this.op = op;
    }

    public AugAssign postinit(PyNode target, PyNode value) {
        complete(target, value);
        return this;
    }

    public PyNode target() {
        return nodeAt(0);
    }

    public PyNode value() {
        return nodeAt(1);
    }

    public String op() {
        return op;
    }

    @Override
    public NodeKind kind() {
        return NodeKind.AUG_ASSIGN;
    }

    @Override
    protected PyNode bareCopy() {
        return new AugAssign(position(), op);
    }

    @Override
    public List<@Nullable Object> otherFieldValues() {
        return Arrays.asList(op);
    }
}
