package ai.canopy.tree.zipper;

import ai.canopy.tree.Located;
import ai.canopy.tree.NodeSequence;
import ai.canopy.tree.PyNode;
import ai.canopy.tree.TreeItem;
import ai.canopy.tree.resolve.BlockRange;
import ai.canopy.tree.resolve.LineRangeResolver;
import ai.canopy.tree.resolve.ScopeResolver;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.Predicate;
import java.util.stream.Stream;
import org.jetbrains.annotations.Nullable;

/**
 * A persistent cursor into a syntax tree. The focus is a node or a sequence of sibling nodes; the path records the
 * siblings on either side and the chain of ancestors, so any ancestor can be rebuilt on the way back up.
 *
 * <p>Every operation returns a new cursor and leaves the receiver and the tree untouched. Moves with no destination
 * return {@link Optional#empty()}. After {@link #replace} or {@link #edit}, moving {@link #up()} builds fresh
 * ancestors holding the new children; unedited paths return the original ancestor objects.
 */
public final class Zipper implements Located<Zipper> {

    private record Path(
            PersistentList<TreeItem> left,
            PersistentList<TreeItem> right,
            PersistentList<TreeItem> ancestors,
            @Nullable Path parentPath,
            boolean changed) {

        Path withChanged() {
            return changed ? this : new Path(left, right, ancestors, parentPath, true);
        }
    }

    private final TreeItem focus;
    private final @Nullable Path path;

    public Zipper(TreeItem focus) {
        this(focus, null);
    }

    private Zipper(TreeItem focus, @Nullable Path path) {
        this.focus = Objects.requireNonNull(focus, "focus");
        this.path = path;
    }

    public TreeItem focus() {
        return focus;
    }

    /**
     * The focused node.
     *
     * @throws IllegalStateException if the focus is a sequence
     */
    @Override
    public PyNode node() {
        if (focus instanceof PyNode node) {
            return node;
        }
        throw new IllegalStateException("Cursor is focused on a sequence, not a node");
    }

    public boolean isSequence() {
        return focus instanceof NodeSequence;
    }

    /** True when this cursor or one of its siblings was replaced since its parent was last built. */
    public boolean isEdited() {
        return path != null && path.changed();
    }

    public int depth() {
        return path == null ? 0 : path.ancestors().size();
    }

    public Optional<Zipper> left() {
        if (path == null || path.left().isEmpty()) {
            return Optional.empty();
        }
        var moved = new Path(
                path.left().tail(), path.right().prepend(focus), path.ancestors(), path.parentPath(), path.changed());
        return Optional.of(new Zipper(path.left().head(), moved));
    }

    public Optional<Zipper> right() {
        if (path == null || path.right().isEmpty()) {
            return Optional.empty();
        }
        var moved = new Path(
                path.left().prepend(focus), path.right().tail(), path.ancestors(), path.parentPath(), path.changed());
        return Optional.of(new Zipper(path.right().head(), moved));
    }

    public Optional<Zipper> leftmost() {
        if (path == null || path.left().isEmpty()) {
            return Optional.empty();
        }
        var siblings = path.left().initial();
        var right = siblings.reverse().concat(path.right().prepend(focus));
        var moved = new Path(PersistentList.empty(), right, path.ancestors(), path.parentPath(), path.changed());
        return Optional.of(new Zipper(path.left().last(), moved));
    }

    public Optional<Zipper> rightmost() {
        if (path == null || path.right().isEmpty()) {
            return Optional.empty();
        }
        var siblings = path.right().initial();
        var left = siblings.reverse().concat(path.left().prepend(focus));
        var moved = new Path(left, PersistentList.empty(), path.ancestors(), path.parentPath(), path.changed());
        return Optional.of(new Zipper(path.right().last(), moved));
    }

    /** Moves to the first child of the focus. */
    public Optional<Zipper> down() {
        List<? extends TreeItem> children = focus.items();
        if (children.isEmpty()) {
            return Optional.empty();
        }
        PersistentList<TreeItem> ancestors = path == null ? PersistentList.empty() : path.ancestors();
        var moved = new Path(
                PersistentList.empty(),
                PersistentList.of(children.subList(1, children.size())),
                ancestors.prepend(focus),
                path,
                false);
        return Optional.of(new Zipper(children.get(0), moved));
    }

    /** Moves to the parent, rebuilding it if anything below was replaced. */
    public Optional<Zipper> up() {
        if (path == null || path.ancestors().isEmpty()) {
            return Optional.empty();
        }
        TreeItem parent = path.ancestors().head();
        if (!path.changed()) {
            return Optional.of(new Zipper(parent, path.parentPath()));
        }
        var children = path.left().reverse().concat(path.right().prepend(focus)).toList();
        var parentPath = path.parentPath();
        return Optional.of(new Zipper(parent.withItems(children), parentPath == null ? null : parentPath.withChanged()));
    }

    public Zipper root() {
        var location = this;
        while (location.path != null) {
            location = location.up().orElseThrow();
        }
        return location;
    }

    /** A cursor at the same position focused on {@code replacement}. */
    public Zipper replace(TreeItem replacement) {
        return new Zipper(replacement, path == null ? null : path.withChanged());
    }

    /** Replaces child field {@code field} of the focused node with {@code value}. */
    public Zipper edit(String field, TreeItem value) {
        return replace(node().withChild(field, value));
    }

    /**
     * A cursor at the deepest item that is an ancestor of both cursors, derived from this one. Items are compared by
     * identity and absent items never count as shared.
     */
    public Optional<Zipper> commonAncestor(Zipper other) {
        var mine = lineage();
        var theirs = other.lineage();
        int common = -1;
        for (int i = 0; i < Math.min(mine.size(), theirs.size()); i++) {
            TreeItem candidate = mine.get(i);
            if (candidate != theirs.get(i) || !candidate.isPresent()) {
                break;
            }
            common = i;
        }
        if (common < 0) {
            return Optional.empty();
        }
        var location = this;
        for (int steps = mine.size() - 1 - common; steps > 0; steps--) {
            location = location.up().orElseThrow();
        }
        return Optional.of(location);
    }

    /** Ancestors from the root inward, ending with the focus. */
    private List<TreeItem> lineage() {
        var result = new ArrayList<TreeItem>();
        result.add(focus);
        if (path != null) {
            path.ancestors().forEach(result::add);
        }
        Collections.reverse(result);
        return result;
    }

    /** Cursors at each child of the focus, produced lazily on every call. */
    public Stream<Zipper> children() {
        return Stream.iterate(down().orElse(null), Objects::nonNull, child -> child.right().orElse(null));
    }

    /** Cursors at each child node, with sequence fields expanded and absent children dropped. */
    public Stream<Zipper> nodeChildren() {
        return children()
                .flatMap(child -> child.isSequence() ? child.children() : Stream.of(child))
                .filter(child -> child.focus().isPresent());
    }

    /** The nearest enclosing node, skipping the sequence that holds the focus if there is one. */
    public Optional<Zipper> parent() {
        var up = up();
        if (up.isPresent() && up.get().isSequence()) {
            return up.get().up();
        }
        return up;
    }

    @Override
    public Optional<Zipper> parentLocation() {
        return parent();
    }

    public DescendantTraversal preorderDescendants(Predicate<Zipper> skip) {
        return DescendantTraversal.preorder(this, skip);
    }

    public DescendantTraversal preorderDescendants() {
        return preorderDescendants(location -> false);
    }

    public DescendantTraversal postorderDescendants(Predicate<Zipper> skip) {
        return DescendantTraversal.postorder(this, skip);
    }

    public DescendantTraversal postorderDescendants() {
        return postorderDescendants(location -> false);
    }

    /**
     * Cursors at every descendant node of {@code type}, in prefix order, not entering subtrees rooted at an instance
     * of one of {@code skipTypes}.
     */
    public Stream<Zipper> findDescendantsOfType(
            Class<? extends PyNode> type, Set<Class<? extends PyNode>> skipTypes) {
        Predicate<Zipper> skip = location -> skipTypes.stream().anyMatch(t -> t.isInstance(location.focus()));
        return preorderDescendants(skip).stream().filter(location -> type.isInstance(location.focus()));
    }

    public Zipper scope(ScopeResolver resolver) {
        return resolver.scope(nodeLocation());
    }

    public Zipper frame(ScopeResolver resolver) {
        return resolver.frame(nodeLocation());
    }

    public Zipper statement(ScopeResolver resolver) {
        return resolver.statement(nodeLocation());
    }

    public BlockRange blockRange(int line) {
        return LineRangeResolver.blockRange(node(), line);
    }

    private Zipper nodeLocation() {
        if (!isSequence()) {
            return this;
        }
        return up().orElseThrow(() -> new IllegalStateException("A detached sequence has no enclosing node"));
    }

    @Override
    public String toString() {
        return "Zipper(" + focus + (isEdited() ? ", edited)" : ")");
    }
}
