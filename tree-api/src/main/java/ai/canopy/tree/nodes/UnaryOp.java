package ai.canopy.tree.nodes;

import ai.canopy.tree.NodeKind;
import ai.canopy.tree.Position;
import ai.canopy.tree.PyNode;
import java.util.Arrays;
import java.util.List;
import org.jetbrains.annotations.Nullable;

public final class UnaryOp extends PyNode {

    private final String op;

    public UnaryOp(@Nullable Position position, String op) {
        super(position);
        this.op = op;
    }

    public UnaryOp postinit(PyNode operand) {
        complete(operand);
        return this;
    }

    public PyNode operand() {
        return nodeAt(0);
    }

    public String op() {
        return op;
    }

    @Override
    public NodeKind kind() {
        return NodeKind.UNARY_OP;
    }

    @Override
    protected PyNode bareCopy() {
        return new UnaryOp(position(), op);
    }

    @Override
    public List<@Nullable Object> otherFieldValues() {
        return Arrays.asList(op);
    }
}
