package ai.canopy.tree.nodes;

import ai.canopy.tree.NodeKind;
import ai.canopy.tree.Position;
import ai.canopy.tree.PyNode;
import java.util.Arrays;
import java.util.List;
import org.jetbrains.annotations.Nullable;

/** A keyword argument of a call or class definition. {@code arg} is null for {@code **mapping}. */
public final class Keyword extends PyNode {

    private final @Nullable String arg;

    public Keyword(@Nullable Position position, @Nullable String arg) {
        super(position);
        this.arg = arg;
    }

    public Keyword postinit(PyNode value) {
        complete(value);
        return this;
    }

    public PyNode value() {
        return nodeAt(0);
    }

    public @Nullable String arg() {
        return arg;
    }

    @Override
    public NodeKind kind() {
        return NodeKind.KEYWORD;
    }

    @Override
    protected PyNode bareCopy() {
        return new Keyword(position(), arg);
    }

    @Override
    public List<@Nullable Object> otherFieldValues() {
        return Arrays.asList(arg);
    }
}
