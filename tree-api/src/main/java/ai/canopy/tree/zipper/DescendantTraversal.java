package ai.canopy.tree.zipper;

import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.function.Predicate;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;
import org.jetbrains.annotations.Nullable;

/**
 * A lazy walk over the subtree under a cursor, in prefix or postfix order. Subtrees whose root cursor matches the skip
 * predicate are neither yielded nor entered.
 *
 * <p>After {@link #next()} the caller may hand back a different cursor with {@link #substitute(Zipper)}; the walk then
 * continues from that cursor, so edits made through it are carried along. {@link #result()} returns the root of the
 * walked subtree including any such edits.
 */
public final class DescendantTraversal implements Iterator<Zipper> {

    private enum Order {
        PREORDER,
        POSTORDER
    }

    private final Order order;
    private final Predicate<Zipper> skip;
    private final Zipper start;
    private @Nullable Zipper current;
    private @Nullable Zipper upcoming;
    private boolean advancePending;

    private DescendantTraversal(Order order, Zipper from, Predicate<Zipper> skip) {
        this.order = order;
        this.skip = skip;
        this.start = new Zipper(from.focus());
        this.upcoming = order == Order.PREORDER ? nextUnskipped(start) : nextPostorder(descend(start));
    }

    static DescendantTraversal preorder(Zipper from, Predicate<Zipper> skip) {
        return new DescendantTraversal(Order.PREORDER, from, skip);
    }

    static DescendantTraversal postorder(Zipper from, Predicate<Zipper> skip) {
        return new DescendantTraversal(Order.POSTORDER, from, skip);
    }

    @Override
    public boolean hasNext() {
        if (advancePending) {
            advancePending = false;
            assert current != null;
            upcoming = order == Order.PREORDER ? advancePreorder(current) : advancePostorder(current);
        }
        return upcoming != null;
    }

    @Override
    public Zipper next() {
        if (!hasNext()) {
            throw new NoSuchElementException();
        }
        current = upcoming;
        upcoming = null;
        advancePending = true;
        return current;
    }

    /**
     * Continues the walk from {@code replacement} instead of the cursor last returned by {@link #next()}.
     *
     * @throws IllegalStateException if called before {@code next()} or twice for the same element
     */
    public void substitute(Zipper replacement) {
        if (!advancePending) {
            throw new IllegalStateException("substitute() must directly follow next()");
        }
        current = replacement;
    }

    /** The root of the walked subtree, rebuilt with every substitution seen so far. */
    public Zipper result() {
        return current == null ? start : current.root();
    }

    public Stream<Zipper> stream() {
        return StreamSupport.stream(
                Spliterators.spliteratorUnknownSize(this, Spliterator.ORDERED | Spliterator.NONNULL), false);
    }

    private @Nullable Zipper advancePreorder(Zipper visited) {
        var child = visited.down();
        if (child.isPresent()) {
            return nextUnskipped(child.get());
        }
        return nextUnskipped(following(visited));
    }

    private @Nullable Zipper nextUnskipped(@Nullable Zipper candidate) {
        while (candidate != null && skip.test(candidate)) {
            candidate = following(candidate);
        }
        return candidate;
    }

    /** The next cursor in prefix order that is not inside the subtree of {@code location}. */
    private static @Nullable Zipper following(Zipper location) {
        var cursor = location;
        while (true) {
            var sibling = cursor.right();
            if (sibling.isPresent()) {
                return sibling.get();
            }
            var parent = cursor.up();
            if (parent.isEmpty()) {
                return null;
            }
            cursor = parent.get();
        }
    }

    private @Nullable Zipper advancePostorder(Zipper visited) {
        var sibling = visited.right();
        if (sibling.isPresent()) {
            return nextPostorder(descend(sibling.get()));
        }
        return nextPostorder(visited.up().orElse(null));
    }

    /** Follows first children down from {@code location} until a leaf or a skipped cursor. */
    private Zipper descend(Zipper location) {
        var cursor = location;
        while (!skip.test(cursor)) {
            var child = cursor.down();
            if (child.isEmpty()) {
                break;
            }
            cursor = child.get();
        }
        return cursor;
    }

    private @Nullable Zipper nextPostorder(@Nullable Zipper candidate) {
        var cursor = candidate;
        while (cursor != null && skip.test(cursor)) {
            var sibling = cursor.right();
            cursor = sibling.isPresent() ? descend(sibling.get()) : cursor.up().orElse(null);
        }
        return cursor;
    }
}
