package ai.canopy.tree;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.jetbrains.annotations.Nullable;

/**
 * Base class of every syntax tree node.
 *
 * <p>Nodes are built in two phases: the constructor takes the position and the non-child fields, and the variant's
 * {@code postinit} method (or the constructor itself for variants without child fields) supplies the child values
 * once. Reading children before that, or supplying them twice, is a programming error and throws
 * {@link IllegalStateException}.
 *
 * <p>Child values are never null; an absent optional child is {@link Empty#INSTANCE} and an absent list is an empty
 * {@link NodeSequence}. Completing a node sets the parent link of each child that does not have one yet, so a subtree
 * shared with a rebuilt copy keeps pointing into the tree it was first attached to. Use a zipper to navigate edited
 * trees.
 *
 * <p>Equality is structural: same variant, equal other fields and equal children, recursively. Positions and parent
 * links do not take part. Use identity-based collections where node identity matters.
 */
public abstract class PyNode implements TreeItem, Located<PyNode> {

    private final @Nullable Position position;
    private @Nullable PyNode parent;
    private @Nullable List<TreeItem> childValues;
    private int hash;

    protected PyNode(@Nullable Position position) {
        this.position = position;
    }

    public abstract NodeKind kind();

    /** A node of the same variant with the same position and other fields, and no children yet. */
    protected abstract PyNode bareCopy();

    /** Values of the other fields, in {@link NodeKind#otherFields()} order. Elements may be null. */
    public List<@Nullable Object> otherFieldValues() {
        return List.of();
    }

    protected final void complete(TreeItem... values) {
        completeAll(Arrays.asList(values));
    }

    // Not an overload of complete: a single NodeSequence argument must stay one child value.
    private void completeAll(List<? extends TreeItem> values) {
        if (childValues != null) {
            throw new IllegalStateException(kind().displayName() + " children were already supplied");
        }
        var fields = kind().childFields();
        if (values.size() != fields.size()) {
            throw new IllegalArgumentException("%s expects %d child values, got %d"
                    .formatted(kind().displayName(), fields.size(), values.size()));
        }
        var copy = new ArrayList<TreeItem>(values.size());
        for (int i = 0; i < values.size(); i++) {
            TreeItem value = values.get(i);
            if (value == null) {
                throw new IllegalArgumentException(
                        "Child field '%s' of %s is null".formatted(fields.get(i), kind().displayName()));
            }
            if (value instanceof PyNode child) {
                child.adopt(this);
            } else if (value instanceof NodeSequence sequence) {
                sequence.forEach(child -> child.adopt(this));
            } else {
                throw new IllegalArgumentException("Unsupported child value " + value.getClass().getName());
            }
            copy.add(value);
        }
        childValues = Collections.unmodifiableList(copy);
    }

    private void adopt(PyNode newParent) {
        if (parent == null && this != Empty.INSTANCE) {
            parent = newParent;
        }
    }

    public final boolean isCompleted() {
        return childValues != null;
    }

    /** Child-field values in declaration order. */
    public final List<TreeItem> childFieldValues() {
        var values = childValues;
        if (values == null) {
            throw new IllegalStateException(kind().displayName() + " was read before its children were supplied");
        }
        return values;
    }

    public final TreeItem childField(String field) {
        return childFieldValues().get(kind().childFieldIndex(field));
    }

    public final @Nullable Object otherField(String field) {
        int index = kind().otherFields().indexOf(field);
        if (index < 0) {
            throw new IllegalArgumentException(kind().displayName() + " has no field '" + field + "'");
        }
        return otherFieldValues().get(index);
    }

    protected final PyNode nodeAt(int index) {
        TreeItem value = childFieldValues().get(index);
        if (value instanceof PyNode node) {
            return node;
        }
        throw new IllegalStateException("Field '%s' of %s holds a sequence"
                .formatted(kind().childFields().get(index), kind().displayName()));
    }

    protected final NodeSequence sequenceAt(int index) {
        TreeItem value = childFieldValues().get(index);
        if (value instanceof NodeSequence sequence) {
            return sequence;
        }
        throw new IllegalStateException("Field '%s' of %s holds a single node"
                .formatted(kind().childFields().get(index), kind().displayName()));
    }

    protected final <T extends PyNode> List<T> elementsAt(int index, Class<T> type) {
        var sequence = sequenceAt(index);
        for (PyNode element : sequence) {
            if (!type.isInstance(element)) {
                throw new IllegalStateException("Field '%s' of %s holds a %s where %s was expected"
                        .formatted(kind().childFields().get(index), kind().displayName(),
                                element.kind().displayName(), type.getSimpleName()));
            }
        }
        @SuppressWarnings("unchecked")
        List<T> typed = (List<T>) (List<?>) sequence;
        return typed;
    }

    protected final <T extends PyNode> T nodeAt(int index, Class<T> type) {
        PyNode node = nodeAt(index);
        if (!type.isInstance(node)) {
            throw new IllegalStateException("Field '%s' of %s holds a %s where %s was expected"
                    .formatted(kind().childFields().get(index), kind().displayName(),
                            node.kind().displayName(), type.getSimpleName()));
        }
        return type.cast(node);
    }

    public final @Nullable Position position() {
        return position;
    }

    /** Start line, or 0 when the node carries no position. */
    public final int line() {
        return position == null ? 0 : position.line();
    }

    public final int column() {
        return position == null ? 0 : position.column();
    }

    public final @Nullable PyNode parent() {
        return parent;
    }

    @Override
    public final PyNode node() {
        return this;
    }

    @Override
    public final Optional<PyNode> parentLocation() {
        return Optional.ofNullable(parent);
    }

    /** Child nodes in field order, with sequences flattened and {@link Empty} values dropped. */
    public final List<PyNode> children() {
        var result = new ArrayList<PyNode>();
        for (TreeItem value : childFieldValues()) {
            if (value instanceof NodeSequence sequence) {
                result.addAll(sequence);
            } else if (value.isPresent()) {
                result.add((PyNode) value);
            }
        }
        return result;
    }

    /** The last non-empty child: the last element of a sequence field, or a single-node field. */
    public final Optional<PyNode> lastChild() {
        var values = childFieldValues();
        for (int i = values.size() - 1; i >= 0; i--) {
            TreeItem value = values.get(i);
            if (value instanceof NodeSequence sequence) {
                if (!sequence.isEmpty()) {
                    return Optional.of(sequence.get(sequence.size() - 1));
                }
            } else if (value.isPresent()) {
                return Optional.of((PyNode) value);
            }
        }
        return Optional.empty();
    }

    /** A new node of the same variant holding {@code values} as its children. */
    public final PyNode withChildren(List<? extends TreeItem> values) {
        var copy = bareCopy();
        copy.completeAll(values);
        return copy;
    }

    /** A new node equal to this one except that child field {@code field} holds {@code value}. */
    public final PyNode withChild(String field, TreeItem value) {
        var values = new ArrayList<TreeItem>(childFieldValues());
        values.set(kind().childFieldIndex(field), value);
        return withChildren(values);
    }

    /** Short label used in single-line renderings, such as a definition's or a name's identifier. */
    protected String label() {
        return "";
    }

    @Override
    public List<? extends TreeItem> items() {
        return childFieldValues();
    }

    @Override
    public TreeItem withItems(List<? extends TreeItem> items) {
        return withChildren(items);
    }

    @Override
    public boolean isPresent() {
        return true;
    }

    public String dump() {
        return TreeDump.dump(this, DumpOptions.DEFAULT);
    }

    public String dump(DumpOptions options) {
        return TreeDump.dump(this, options);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        var other = (PyNode) o;
        return kind() == other.kind()
                && otherFieldValues().equals(other.otherFieldValues())
                && childFieldValues().equals(other.childFieldValues());
    }

    @Override
    public int hashCode() {
        int h = hash;
        if (h == 0) {
            h = Objects.hash(kind(), otherFieldValues(), childFieldValues());
            hash = h;
        }
        return h;
    }

    @Override
    public String toString() {
        var label = label();
        var sb = new StringBuilder("<").append(kind().displayName());
        if (!label.isEmpty()) {
            sb.append('.').append(label);
        }
        if (position != null) {
            sb.append(" l.").append(position.line());
        }
        return sb.append('>').toString();
    }
}
