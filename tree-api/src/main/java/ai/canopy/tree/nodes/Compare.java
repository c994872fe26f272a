package ai.canopy.tree.nodes;

import ai.canopy.tree.NodeKind;
import ai.canopy.tree.NodeSequence;
import ai.canopy.tree.Position;
import ai.canopy.tree.PyNode;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import org.jetbrains.annotations.Nullable;

/** A comparison chain {@code left op1 c1 op2 c2 ...}; {@code ops} and {@code comparators} line up one to one. */
public final class Compare extends PyNode {

    private final List<String> ops;

    public Compare(@Nullable Position position, List<String> ops) {
        super(position);
        this.ops = List.copyOf(ops);
    }

    public Compare postinit(PyNode left, NodeSequence comparators) {
        if (comparators.size() != ops.size()) {
            throw new IllegalArgumentException(
                    "Compare has %d operators but %d comparators".formatted(ops.size(), comparators.size()));
        }
        complete(left, comparators);
        return this;
    }

    public PyNode left() {
        return nodeAt(0);
    }

    public NodeSequence comparators() {
        return sequenceAt(1);
    }

    public List<String> ops() {
        return ops;
    }

    public List<Map.Entry<String, PyNode>> pairs() {
        var comparators = comparators();
        var result = new ArrayList<Map.Entry<String, PyNode>>(ops.size());
        for (int i = 0; i < ops.size(); i++) {
            result.add(Map.entry(ops.get(i), comparators.get(i)));
        }
        return result;
    }

    @Override
    public NodeKind kind() {
        return NodeKind.COMPARE;
    }

    @Override
    protected PyNode bareCopy() {
        return new Compare(position(), ops);
    }

    @Override
    public List<@Nullable Object> otherFieldValues() {
        return Arrays.asList(ops);
    }
}
