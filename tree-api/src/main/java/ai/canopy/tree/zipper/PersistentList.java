package ai.canopy.tree.zipper;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

/**
 * An immutable singly linked list that shares structure between versions. Prepending, taking the head and taking the
 * tail are constant time; so is wrapping an existing immutable {@link List}, whose elements are then read in place.
 */
public abstract class PersistentList<T> implements Iterable<T> {

    private static final PersistentList<Object> NIL = new Nil<>();

    PersistentList() {}

    @SuppressWarnings("unchecked")
    public static <T> PersistentList<T> empty() {
        return (PersistentList<T>) NIL;
    }

    /** A list reading {@code items} in place. The caller must not mutate {@code items} afterwards. */
    public static <T> PersistentList<T> of(List<? extends T> items) {
        return items.isEmpty() ? empty() : new Slice<>(items, 0);
    }

    public abstract boolean isEmpty();

    /** @throws NoSuchElementException if the list is empty */
    public abstract T head();

    /** @throws NoSuchElementException if the list is empty */
    public abstract PersistentList<T> tail();

    public PersistentList<T> prepend(T value) {
        return new Cons<>(value, this);
    }

    public PersistentList<T> reverse() {
        PersistentList<T> result = empty();
        for (T item : this) {
            result = result.prepend(item);
        }
        return result;
    }

    /** This list followed by {@code suffix}; copies this list and shares {@code suffix}. */
    public PersistentList<T> concat(PersistentList<T> suffix) {
        if (suffix.isEmpty()) {
            return this;
        }
        PersistentList<T> result = suffix;
        for (T item : reverse()) {
            result = result.prepend(item);
        }
        return result;
    }

    public T last() {
        if (isEmpty()) {
            throw new NoSuchElementException("last of an empty list");
        }
        PersistentList<T> current = this;
        while (!current.tail().isEmpty()) {
            current = current.tail();
        }
        return current.head();
    }

    /** Every element but the last. */
    public PersistentList<T> initial() {
        if (isEmpty()) {
            throw new NoSuchElementException("initial of an empty list");
        }
        return reverse().tail().reverse();
    }

    public int size() {
        int size = 0;
        for (PersistentList<T> current = this; !current.isEmpty(); current = current.tail()) {
            size++;
        }
        return size;
    }

    public List<T> toList() {
        var result = new ArrayList<T>();
        forEach(result::add);
        return List.copyOf(result);
    }

    @Override
    public Iterator<T> iterator() {
        return new Iterator<>() {
            private PersistentList<T> current = PersistentList.this;

            @Override
            public boolean hasNext() {
                return !current.isEmpty();
            }

            @Override
            public T next() {
                T value = current.head();
                current = current.tail();
                return value;
            }
        };
    }

    @Override
    public String toString() {
        return toList().toString();
    }

    private static final class Nil<T> extends PersistentList<T> {
        @Override
        public boolean isEmpty() {
            return true;
        }

        @Override
        public T head() {
            throw new NoSuchElementException("head of an empty list");
        }

        @Override
        public PersistentList<T> tail() {
            throw new NoSuchElementException("tail of an empty list");
        }
    }

    private static final class Cons<T> extends PersistentList<T> {
        private final T head;
        private final PersistentList<T> tail;

        Cons(T head, PersistentList<T> tail) {
            this.head = head;
            this.tail = tail;
        }

        @Override
        public boolean isEmpty() {
            return false;
        }

        @Override
        public T head() {
            return head;
        }

        @Override
        public PersistentList<T> tail() {
            return tail;
        }
    }

    private static final class Slice<T> extends PersistentList<T> {
        private final List<? extends T> items;
        private final int offset;

        Slice(List<? extends T> items, int offset) {
            this.items = items;
            this.offset = offset;
        }

        @Override
        public boolean isEmpty() {
            return false;
        }

        @Override
        public T head() {
            return items.get(offset);
        }

        @Override
        public PersistentList<T> tail() {
            return offset + 1 < items.size() ? new Slice<>(items, offset + 1) : empty();
        }

        @Override
        public int size() {
            return items.size() - offset;
        }
    }
}
