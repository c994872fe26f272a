package ai.canopy.tree.nodes;

import ai.canopy.tree.NodeKind;
import ai.canopy.tree.NodeSequence;
import ai.canopy.tree.Position;
import ai.canopy.tree.PyNode;
import java.util.Arrays;
import java.util.List;
import org.jetbrains.annotations.Nullable;

/** A chain of {@code and} or {@code or} operands sharing one operator. */
public final class BoolOp extends PyNode {

    private final String op;

    public BoolOp(@Nullable Position position, String op) {
        super(position);
        this.op = op;
    }

    public BoolOp postinit(NodeSequence values) {
        complete(values);
        return this;
    }

    public NodeSequence values() {
        return sequenceAt(0);
    }

    public String op() {
        return op;
    }

    @Override
    public NodeKind kind() {
        return NodeKind.BOOL_OP;
    }

    @Override
    protected PyNode bareCopy() {
        return new BoolOp(position(), op);
    }

    @Override
    public List<@Nullable Object> otherFieldValues() {
        return Arrays.asList(op);
    }
}
