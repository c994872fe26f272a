package ai.canopy.tree.nodes;

import ai.canopy.tree.NodeKind;
import ai.canopy.tree.Position;
import ai.canopy.tree.PyNode;
import java.util.Arrays;
import java.util.List;
import org.jetbrains.annotations.Nullable;

/** A single declared parameter. {@code defaultValue} and {@code annotation} are {@link ai.canopy.tree.Empty} when absent. */
public final class Parameter extends PyNode {

    private final String name;

    public Parameter(@Nullable Position position, String name) {
        super(position);
        this.name = name;
    }

    public Parameter postinit(PyNode defaultValue, PyNode annotation) {
        complete(defaultValue, annotation);
        return this;
    }

    public PyNode defaultValue() {
        return nodeAt(0);
    }

    public PyNode annotation() {
        return nodeAt(1);
    }

    public String name() {
        return name;
    }

    public boolean hasDefault() {
        return defaultValue().isPresent();
    }

    @Override
    public NodeKind kind() {
        return NodeKind.PARAMETER;
    }

    @Override
    protected PyNode bareCopy() {
        return new Parameter(position(), name);
    }

    @Override
    public List<@Nullable Object> otherFieldValues() {
        return Arrays.asList(name);
    }

    @Override
    protected String label() {
        return name;
    }
}
