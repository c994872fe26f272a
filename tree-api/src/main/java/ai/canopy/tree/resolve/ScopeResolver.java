package ai.canopy.tree.resolve;

import ai.canopy.exception.NotSupportedException;
import ai.canopy.tree.Located;
import ai.canopy.tree.NodeKind;
import ai.canopy.tree.PyNode;
import ai.canopy.tree.PythonDialect;
import ai.canopy.tree.nodes.BaseComprehension;
import ai.canopy.tree.nodes.ClassDef;
import ai.canopy.tree.nodes.FunctionDef;
import ai.canopy.tree.nodes.Lambda;
import ai.canopy.tree.nodes.Module;
import ai.canopy.tree.nodes.Parameter;
import java.util.Optional;

/**
 * Finds the node that opens the lexical scope a node belongs to.
 *
 * <p>Works on any {@link Located}: plain nodes, whose parent links are followed, and zipper cursors, whose paths are
 * followed. Parameter defaults and annotations, return annotations, decorators and the first iterable of a
 * comprehension are evaluated in the scope around their owner, and resolve there.
 */
public final class ScopeResolver {

    public static final ScopeResolver PY3 = new ScopeResolver(PythonDialect.PY3);
    public static final ScopeResolver PY2 = new ScopeResolver(PythonDialect.PY2);

    private final PythonDialect dialect;

    public ScopeResolver(PythonDialect dialect) {
        this.dialect = dialect;
    }

    public static ScopeResolver forDialect(PythonDialect dialect) {
        return dialect == PythonDialect.PY3 ? PY3 : PY2;
    }

    public PythonDialect dialect() {
        return dialect;
    }

    public boolean introducesScope(PyNode node) {
        return switch (node.kind()) {
            case MODULE, FUNCTION_DEF, ASYNC_FUNCTION_DEF, CLASS_DEF, LAMBDA, GENERATOR_EXP, DICT_COMP, SET_COMP -> true;
            case LIST_COMP -> dialect.listComprehensionsHaveScope();
            default -> false;
        };
    }

    /**
     * The location of the nearest scope-introducing node for {@code location}, which is the location itself when its
     * node opens a scope.
     *
     * @throws IllegalStateException if the walk runs off a tree that has no enclosing scope node
     */
    public <L extends Located<L>> L scope(L location) {
        PyNode node = location.node();
        if (introducesScope(node)) {
            return location;
        }
        if (node.kind() == NodeKind.DECORATORS) {
            return scope(parentOf(parentOf(location)));
        }
        L parent = parentOf(location);
        return scopeByParent(parent, node).orElseGet(() -> scope(parent));
    }

    private <L extends Located<L>> Optional<L> scopeByParent(L parent, PyNode node) {
        PyNode owner = parent.node();
        switch (owner.kind()) {
            case FUNCTION_DEF, ASYNC_FUNCTION_DEF -> {
                if (dialect.supportsAnnotations() && ((FunctionDef) owner).returns() == node) {
                    return Optional.of(scope(parentOf(parent)));
                }
                return Optional.empty();
            }
            case PARAMETER -> {
                var parameter = (Parameter) owner;
                if (parameter.defaultValue() == node || parameter.annotation() == node) {
                    L function = parentOf(parentOf(parent));
                    return Optional.of(scope(parentOf(function)));
                }
                return Optional.empty();
            }
            case COMPREHENSION -> {
                L comprehension = parentOf(parent);
                var generators = ((BaseComprehension) comprehension.node()).generators();
                if (!generators.isEmpty() && generators.get(0).iter() == node) {
                    return Optional.of(scope(parentOf(comprehension)));
                }
                if (comprehension.node().kind() == NodeKind.LIST_COMP && !dialect.listComprehensionsHaveScope()) {
                    return Optional.of(scope(parentOf(comprehension)));
                }
                return Optional.empty();
            }
            default -> {
                return Optional.empty();
            }
        }
    }

    /** The nearest enclosing function, lambda, class or module, the location itself included. */
    public <L extends Located<L>> L frame(L location) {
        L current = location;
        while (!current.node().kind().isFrame()) {
            current = parentOf(current);
        }
        return current;
    }

    /** The statement holding {@code location}, or the module when it sits directly in one. */
    public <L extends Located<L>> L statement(L location) {
        L current = location;
        while (!(current.node().kind().isStatement() || current.node().kind() == NodeKind.MODULE)) {
            current = parentOf(current);
        }
        return current;
    }

    /**
     * The node that binds the name at {@code location}: the {@code for} of a loop target, the assignment of an
     * assigned name, and so on. Nodes that only pass a binding through, such as tuples and starred targets, defer to
     * their parent.
     */
    public <L extends Located<L>> L assignType(L location) {
        L current = location;
        while (passesBindingUp(current.node().kind())) {
            var parent = current.parentLocation();
            if (parent.isEmpty()) {
                break;
            }
            current = parent.get();
        }
        return current;
    }

    private static boolean passesBindingUp(NodeKind kind) {
        return switch (kind) {
            case DEL_NAME, ASSIGN_ATTR, DEL_ATTR, STARRED, WITH_ITEM, ASSIGN_NAME, PARAMETER, LIST, SET, TUPLE, DICT -> true;
            default -> false;
        };
    }

    /**
     * The dotted name of a module, class, function or lambda, built from the names of its enclosing frames.
     *
     * @throws NotSupportedException for any other node
     */
    public <L extends Located<L>> String qualifiedName(L location) throws NotSupportedException {
        PyNode node = location.node();
        String name = switch (node.kind()) {
            case MODULE -> ((Module) node).name();
            case CLASS_DEF -> ((ClassDef) node).name();
            case FUNCTION_DEF, ASYNC_FUNCTION_DEF -> ((FunctionDef) node).name();
            case LAMBDA -> Lambda.NAME;
            default -> throw new NotSupportedException(node.kind(), "a qualified name");
        };
        var parent = location.parentLocation();
        if (parent.isEmpty()) {
            return name;
        }
        return qualifiedName(frame(parent.get())) + "." + name;
    }

    private static <L extends Located<L>> L parentOf(L location) {
        return location.parentLocation()
                .orElseThrow(() -> new IllegalStateException(
                        location.node() + " is not attached to a tree with an enclosing scope"));
    }
}
