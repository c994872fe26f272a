package ai.canopy.tree.nodes;

import ai.canopy.tree.NodeKind;
import ai.canopy.tree.NodeSequence;
import ai.canopy.tree.Position;
import ai.canopy.tree.PyNode;
import java.util.Arrays;
import java.util.List;
import org.jetbrains.annotations.Nullable;

/** A {@code class} statement. {@code keywords} holds the keyword arguments of the base list, such as a metaclass. */
public final class ClassDef extends PyNode {

    private final String name;
    private final @Nullable String doc;

    public ClassDef(@Nullable Position position, String name, @Nullable String doc) {
        super(position);
        this.name = name;
        this.doc = doc;
    }

    public ClassDef postinit(PyNode decorators, NodeSequence bases, NodeSequence body, NodeSequence keywords) {
        complete(decorators, bases, body, keywords);
        return this;
    }

    public PyNode decorators() {
        return nodeAt(0);
    }

    public NodeSequence bases() {
        return sequenceAt(1);
    }

    public NodeSequence body() {
        return sequenceAt(2);
    }

    public List<Keyword> keywords() {
        return elementsAt(3, Keyword.class);
    }

    public String name() {
        return name;
    }

    public @Nullable String doc() {
        return doc;
    }

    @Override
    public NodeKind kind() {
        return NodeKind.CLASS_DEF;
    }

    @Override
    protected PyNode bareCopy() {
        return new ClassDef(position(), name, doc);
    }

    @Override
    public List<@Nullable Object> otherFieldValues() {
        return Arrays.asList(name, doc);
    }

    @Override
    protected String label() {
        return name;
    }
}
