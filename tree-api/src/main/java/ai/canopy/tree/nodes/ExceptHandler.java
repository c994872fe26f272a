package ai.canopy.tree.nodes;

import ai.canopy.tree.Empty;
import ai.canopy.tree.NodeKind;
import ai.canopy.tree.NodeSequence;
import ai.canopy.tree.Position;
import ai.canopy.tree.PyNode;
import java.util.List;
import java.util.Set;
import org.jetbrains.annotations.Nullable;

/** One {@code except} clause. {@code name} is an {@link AssignName} or {@link Empty}. */
public final class ExceptHandler extends PyNode {

    public ExceptHandler(@Nullable Position position) {
        super(position);
    }

    public ExceptHandler postinit(PyNode type, PyNode name, NodeSequence body) {
        complete(type, name, body);
        return this;
    }

    public PyNode type() {
        return nodeAt(0);
    }

    public PyNode name() {
        return nodeAt(1);
    }

    public NodeSequence body() {
        return sequenceAt(2);
    }

    /** True when this handler catches everything: it names no type, or one of {@code exceptionNames}. */
    public boolean catches(Set<String> exceptionNames) {
        PyNode handled = type();
        if (!handled.isPresent()) {
            return true;
        }
        List<PyNode> candidates = handled instanceof Tuple tuple ? tuple.elts() : List.of(handled);
        for (PyNode candidate : candidates) {
            if (candidate instanceof Name name && exceptionNames.contains(name.name())) {
                return true;
            }
        }
        return false;
    }

    @Override
    public NodeKind kind() {
        return NodeKind.EXCEPT_HANDLER;
    }

    @Override
    protected PyNode bareCopy() {
        return new ExceptHandler(position());
    }
}
