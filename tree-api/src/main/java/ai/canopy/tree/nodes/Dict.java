package ai.canopy.tree.nodes;

import ai.canopy.tree.NodeKind;
import ai.canopy.tree.NodeSequence;
import ai.canopy.tree.Position;
import ai.canopy.tree.PyNode;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.jetbrains.annotations.Nullable;

/**
 * A dict display. {@code keys} and {@code values} have the same length; a {@code **mapping} entry has a
 * {@link DictUnpack} key.
 */
public final class Dict extends PyNode {

    public Dict(@Nullable Position position) {
        super(position);
    }

    public Dict postinit(NodeSequence keys, NodeSequence values) {
        if (keys.size() != values.size()) {
            throw new IllegalArgumentException(
                    "Dict has %d keys but %d values".formatted(keys.size(), values.size()));
        }
        complete(keys, values);
        return this;
    }

    public NodeSequence keys() {
        return sequenceAt(0);
    }

    public NodeSequence values() {
        return sequenceAt(1);
    }

    /** Key/value pairs in source order. */
    public List<Map.Entry<PyNode, PyNode>> entries() {
        var keys = keys();
        var values = values();
        var result = new ArrayList<Map.Entry<PyNode, PyNode>>(keys.size());
        for (int i = 0; i < keys.size(); i++) {
            result.add(Map.entry(keys.get(i), values.get(i)));
        }
        return result;
    }

    @Override
    public NodeKind kind() {
        return NodeKind.DICT;
    }

    @Override
    protected PyNode bareCopy() {
        return new Dict(position());
    }
}
