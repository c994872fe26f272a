package ai.canopy.tree.resolve;

import ai.canopy.tree.NodeSequence;
import ai.canopy.tree.PyNode;
import ai.canopy.tree.nodes.ClassDef;
import ai.canopy.tree.nodes.Decorators;
import ai.canopy.tree.nodes.ExceptHandler;
import ai.canopy.tree.nodes.For;
import ai.canopy.tree.nodes.FunctionDef;
import ai.canopy.tree.nodes.If;
import ai.canopy.tree.nodes.TryExcept;
import ai.canopy.tree.nodes.TryFinally;
import ai.canopy.tree.nodes.While;
import ai.canopy.tree.nodes.With;
import java.util.Optional;
import org.jetbrains.annotations.Nullable;

/**
 * Computes which source lines belong to the block of a node that contains a given line. Compound statements narrow
 * the range to the branch holding the line; everything else spans its own lines.
 */
public final class LineRangeResolver {

    private LineRangeResolver() {}

    /**
     * The first line of {@code node}. Modules start at line 0; functions and classes start at their keyword, after
     * any decorators.
     */
    public static int firstLine(PyNode node) {
        return switch (node.kind()) {
            case MODULE -> 0;
            case FUNCTION_DEF, ASYNC_FUNCTION_DEF -> skipDecorators(node.line(), ((FunctionDef) node).decorators());
            case CLASS_DEF -> skipDecorators(node.line(), ((ClassDef) node).decorators());
            default -> node.position() != null ? node.line() : firstPositionedLine(node);
        };
    }

    private static int skipDecorators(int line, PyNode decorators) {
        if (!(decorators instanceof Decorators list)) {
            return line;
        }
        int result = line;
        for (PyNode decorator : list.nodes()) {
            result += lastLine(decorator) - decorator.line() + 1;
        }
        return result;
    }

    private static int firstPositionedLine(PyNode node) {
        for (PyNode child : node.children()) {
            int line = firstLine(child);
            if (line > 0) {
                return line;
            }
        }
        return 0;
    }

    /** The line of the last token of {@code node}: the last line of its deepest last child. */
    public static int lastLine(PyNode node) {
        PyNode current = node;
        while (true) {
            var last = trailingChild(current);
            if (last.isEmpty()) {
                return firstLine(current);
            }
            current = last.get();
        }
    }

    // Definitions store their return annotation and class keywords after the body.
    private static Optional<PyNode> trailingChild(PyNode node) {
        return switch (node.kind()) {
            case FUNCTION_DEF, ASYNC_FUNCTION_DEF -> lastOf(((FunctionDef) node).body(), node);
            case CLASS_DEF -> lastOf(((ClassDef) node).body(), node);
            default -> node.lastChild();
        };
    }

    private static Optional<PyNode> lastOf(NodeSequence body, PyNode owner) {
        return body.isEmpty() ? owner.lastChild() : Optional.of(body.last());
    }

    /** The last line of the header of a compound statement, before its body begins. */
    public static int blockStartLastLine(PyNode node) {
        return switch (node.kind()) {
            case IF -> lastLine(((If) node).test());
            case WHILE -> lastLine(((While) node).test());
            case FOR, ASYNC_FOR -> lastLine(((For) node).iter());
            case WITH, ASYNC_WITH -> {
                var items = ((With) node).items();
                yield items.isEmpty() ? firstLine(node) : lastLine(items.get(items.size() - 1).contextExpr());
            }
            case FUNCTION_DEF, ASYNC_FUNCTION_DEF -> {
                var args = ((FunctionDef) node).args();
                yield args.children().isEmpty() ? firstLine(node) : lastLine(args);
            }
            case CLASS_DEF -> {
                var bases = ((ClassDef) node).bases();
                yield bases.isEmpty() ? firstLine(node) : lastLine(bases.last());
            }
            case EXCEPT_HANDLER -> {
                var handler = (ExceptHandler) node;
                if (handler.name().isPresent()) {
                    yield lastLine(handler.name());
                }
                yield handler.type().isPresent() ? lastLine(handler.type()) : firstLine(node);
            }
            default -> firstLine(node);
        };
    }

    /** The lines of the block of {@code node} that holds {@code line}. */
    public static BlockRange blockRange(PyNode node, int line) {
        return switch (node.kind()) {
            case MODULE, FUNCTION_DEF, ASYNC_FUNCTION_DEF, CLASS_DEF -> new BlockRange(firstLine(node), lastLine(node));
            case IF -> ifRange((If) node, line);
            case FOR, ASYNC_FOR -> elsedRange(node, line, ((For) node).orelse(), null);
            case WHILE -> elsedRange(node, line, ((While) node).orelse(), null);
            case TRY_EXCEPT -> tryExceptRange((TryExcept) node, line);
            case TRY_FINALLY -> tryFinallyRange((TryFinally) node, line);
            default -> new BlockRange(firstLine(node), lastLine(node));
        };
    }

    private static BlockRange ifRange(If node, int line) {
        var body = node.body();
        if (line == firstLine(body.get(0))) {
            return BlockRange.line(line);
        }
        if (line <= lastLine(body.last())) {
            return new BlockRange(line, lastLine(body.last()));
        }
        return elsedRange(node, line, node.orelse(), firstLine(body.get(0)) - 1);
    }

    private static BlockRange tryExceptRange(TryExcept node, int line) {
        Integer last = null;
        for (ExceptHandler handler : node.handlers()) {
            if (handler.type().isPresent() && line == firstLine(handler.type())) {
                return BlockRange.line(line);
            }
            var body = handler.body();
            if (firstLine(body.get(0)) <= line && line <= lastLine(body.last())) {
                return new BlockRange(line, lastLine(body.last()));
            }
            if (last == null) {
                last = firstLine(body.get(0)) - 1;
            }
        }
        return elsedRange(node, line, node.orelse(), last);
    }

    private static BlockRange tryFinallyRange(TryFinally node, int line) {
        PyNode child = node.body().get(0);
        if (child instanceof TryExcept inner
                && firstLine(inner) == firstLine(node)
                && line > firstLine(node)
                && line <= lastLine(inner)) {
            return tryExceptRange(inner, line);
        }
        return elsedRange(node, line, node.finalbody(), null);
    }

    /**
     * Shared rule for statements with an alternate block: the header line stands alone, a line inside the alternate
     * block runs to its end, and any other line runs to the line before the alternate block (or to {@code last}, or
     * the end of the node, when there is none).
     */
    private static BlockRange elsedRange(PyNode node, int line, NodeSequence orelse, @Nullable Integer last) {
        if (line == firstLine(node)) {
            return BlockRange.line(line);
        }
        if (!orelse.isEmpty()) {
            int alternateStart = firstLine(orelse.get(0));
            if (line >= alternateStart) {
                return new BlockRange(line, lastLine(orelse.last()));
            }
            return new BlockRange(line, alternateStart - 1);
        }
        return new BlockRange(line, last != null && last != 0 ? last : lastLine(node));
    }
}
