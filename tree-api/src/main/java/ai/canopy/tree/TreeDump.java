package ai.canopy.tree;

import ai.canopy.tree.nodes.Const;
import ai.canopy.tree.nodes.ImportName;
import ai.canopy.tree.resolve.LineRangeResolver;
import ai.canopy.tree.resolve.ScopeResolver;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Set;
import java.util.StringJoiner;
import org.jetbrains.annotations.Nullable;

/**
 * Renders a tree as indented text, one field per line once a node has more than one field. Scalars are printed the
 * way Python would print them. A node reached twice is printed as a recursion marker the second time.
 */
public final class TreeDump {

    private final DumpOptions options;
    private final StringBuilder out = new StringBuilder();
    private final Set<PyNode> done = Collections.newSetFromMap(new IdentityHashMap<>());

    private TreeDump(DumpOptions options) {
        this.options = options;
    }

    public static String dump(PyNode node, DumpOptions options) {
        var dump = new TreeDump(options);
        dump.value(node, "", 1);
        return dump.out.toString();
    }

    /** Appends {@code value}; returns true when the output spans several lines. */
    private boolean value(@Nullable Object value, String indent, int depth) {
        if (value == Empty.INSTANCE) {
            out.append("Empty");
            return false;
        }
        if (value instanceof PyNode node) {
            return node(node, indent, depth);
        }
        if (value instanceof NodeSequence sequence) {
            return sequence(sequence, indent, depth);
        }
        return scalar(value, indent);
    }

    private boolean sequence(List<?> items, String indent, int depth) {
        String inner = indent + options.indent();
        out.append('[');
        boolean broken;
        if (items.isEmpty()) {
            broken = false;
        } else if (items.size() == 1) {
            broken = value(items.get(0), inner, depth);
        } else if (items.size() == 2) {
            broken = value(items.get(0), inner, depth);
            if (broken) {
                out.append(",\n").append(inner);
            } else {
                out.append(", ");
            }
            broken = value(items.get(1), inner, depth) || broken;
        } else {
            out.append('\n').append(inner);
            for (int i = 0; i < items.size() - 1; i++) {
                value(items.get(i), inner, depth);
                out.append(",\n").append(inner);
            }
            value(items.get(items.size() - 1), inner, depth);
            broken = true;
        }
        out.append(']');
        return broken;
    }

    private boolean node(PyNode node, String indent, int depth) {
        if (!done.add(node)) {
            out.append("<Recursion on ")
                    .append(node.kind().displayName())
                    .append(" with id=")
                    .append(identity(node))
                    .append('>');
            return false;
        }
        if (options.maxDepth() > 0 && depth > options.maxDepth()) {
            out.append("...");
            return false;
        }
        String inner = indent + options.indent();
        out.append(node.kind().displayName());
        if (options.showIdentity()) {
            out.append('<').append(identity(node)).append('>');
        }
        out.append('(');

        var names = new ArrayList<String>();
        var values = new ArrayList<@Nullable Object>();
        if (options.showPosition()) {
            names.add("line");
            values.add(node.line());
            names.add("column");
            values.add(node.column());
        }
        names.addAll(node.kind().otherFields());
        values.addAll(node.otherFieldValues());
        names.addAll(node.kind().childFields());
        values.addAll(node.childFieldValues());
        if (options.showDerivedState()) {
            addDerivedState(node, names, values);
        }

        boolean broken;
        if (names.isEmpty()) {
            broken = false;
        } else if (names.size() == 1) {
            out.append(names.get(0)).append('=');
            broken = value(values.get(0), inner, depth + 1);
        } else {
            out.append('\n').append(inner);
            for (int i = 0; i < names.size(); i++) {
                out.append(names.get(i)).append('=');
                value(values.get(i), inner, depth + 1);
                if (i < names.size() - 1) {
                    out.append(",\n").append(inner);
                }
            }
            broken = true;
        }
        out.append(')');
        return broken;
    }

    private void addDerivedState(PyNode node, List<String> names, List<@Nullable Object> values) {
        if (node == Empty.INSTANCE || !attachedToModule(node)) {
            return;
        }
        names.add("scope");
        values.add(new Verbatim(ScopeResolver.forDialect(options.dialect()).scope(node).toString()));
        names.add("lines");
        values.add(new Verbatim("(" + LineRangeResolver.firstLine(node) + ", " + LineRangeResolver.lastLine(node) + ")"));
    }

    private static boolean attachedToModule(PyNode node) {
        PyNode current = node;
        while (current.parent() != null) {
            current = current.parent();
        }
        return current.kind() == NodeKind.MODULE;
    }

    private boolean scalar(@Nullable Object value, String indent) {
        if (value instanceof String text) {
            int width = Math.max(options.maxWidth() - indent.length(), 1);
            var chunks = wrap(text, width);
            if (chunks.size() > 1) {
                out.append('(');
                for (int i = 0; i < chunks.size(); i++) {
                    if (i > 0) {
                        out.append('\n').append(indent).append(' ');
                    }
                    out.append(quote(chunks.get(i)));
                }
                out.append(')');
                return true;
            }
        }
        out.append(repr(value));
        return false;
    }

    private static List<String> wrap(String text, int width) {
        var chunks = new ArrayList<String>();
        if (quote(text).length() <= width) {
            chunks.add(text);
            return chunks;
        }
        var current = new StringBuilder();
        for (String word : text.split("(?<= )")) {
            if (current.length() > 0 && quote(current + word).length() > width) {
                chunks.add(current.toString());
                current.setLength(0);
            }
            current.append(word);
        }
        if (current.length() > 0) {
            chunks.add(current.toString());
        }
        return chunks;
    }

    /** Python's {@code repr} of a field value. */
    static String repr(@Nullable Object value) {
        if (value == null) {
            return "None";
        }
        if (value instanceof Boolean bool) {
            return bool ? "True" : "False";
        }
        if (value instanceof String text) {
            return quote(text);
        }
        if (value instanceof Const.Bytes bytes) {
            return "b" + quote(bytes.latin1());
        }
        if (value instanceof Path path) {
            return quote(path.toString());
        }
        if (value instanceof ImportName name) {
            return "(" + quote(name.name()) + ", " + repr(name.asName()) + ")";
        }
        if (value instanceof List<?> list) {
            var joiner = new StringJoiner(", ", "[", "]");
            list.forEach(item -> joiner.add(repr(item)));
            return joiner.toString();
        }
        return value.toString();
    }

    private static String quote(String text) {
        char quote = text.indexOf('\'') >= 0 && text.indexOf('"') < 0 ? '"' : '\'';
        var sb = new StringBuilder().append(quote);
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            switch (c) {
                case '\\' -> sb.append("\\\\");
                case '\n' -> sb.append("\\n");
                case '\r' -> sb.append("\\r");
                case '\t' -> sb.append("\\t");
                default -> {
                    if (c == quote) {
                        sb.append('\\').append(c);
                    } else if (c < 0x20 || c == 0x7f) {
                        sb.append(String.format("\\x%02x", (int) c));
                    } else {
                        sb.append(c);
                    }
                }
            }
        }
        return sb.append(quote).toString();
    }

    private static String identity(Object node) {
        return "0x" + Integer.toHexString(System.identityHashCode(node));
    }

    /** A derived value printed as is. */
    private record Verbatim(String text) {
        @Override
        public String toString() {
            return text;
        }
    }
}
