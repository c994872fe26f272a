package ai.canopy.tree.nodes;

import ai.canopy.tree.NodeKind;
import ai.canopy.tree.NodeSequence;
import ai.canopy.tree.Position;
import ai.canopy.tree.PyNode;
import org.jetbrains.annotations.Nullable;

/** A generator expression. */
public final class GeneratorExp extends BaseComprehension {

    public GeneratorExp(@Nullable Position position) {
        super(position);
    }

    public GeneratorExp postinit(NodeSequence generators, PyNode elt) {
        complete(generators, elt);
        return this;
    }

    public PyNode elt() {
        return nodeAt(1);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.GENERATOR_EXP;
    }

    @Override
    protected PyNode bareCopy() {
        return new GeneratorExp(position());
    }
}
