package ai.canopy.builder;

import static ai.canopy.builder.python.PythonTreeSitterNodeTypes.*;

import ai.canopy.exception.AstBuildingException;
import ai.canopy.tree.Empty;
import ai.canopy.tree.NodeSequence;
import ai.canopy.tree.Position;
import ai.canopy.tree.PyNode;
import ai.canopy.tree.nodes.Arguments;
import ai.canopy.tree.nodes.Parameter;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import org.jetbrains.annotations.Nullable;
import org.treesitter.TSNode;

/**
 * Builds the {@link Arguments} of a function or lambda from its raw parameter list.
 *
 * <p>Positional parameters and their defaults are collected apart and paired afterwards by right-aligning the defaults
 * against the parameters, the way Python itself only allows trailing defaults.
 */
final class ParameterBuilder {

    private record Declared(TSNode nameNode, String name, @Nullable TSNode annotation) {}

    private final TreeRebuilder rebuilder;

    private final List<Declared> positionalOnly = new ArrayList<>();
    private final List<Declared> positional = new ArrayList<>();
    private final List<PyNode> positionalDefaults = new ArrayList<>();
    private final List<Declared> keywordOnly = new ArrayList<>();
    private final List<PyNode> keywordOnlyDefaults = new ArrayList<>();
    private @Nullable Declared vararg;
    private @Nullable Declared kwarg;
    private boolean keywordOnlySection;
    private @Nullable TSNode firstDefault;

    ParameterBuilder(TreeRebuilder rebuilder) {
        this.rebuilder = rebuilder;
    }

    Arguments build(@Nullable TSNode parameters, Position position) throws AstBuildingException {
        if (parameters != null) {
            for (TSNode child : TreeRebuilder.namedChildren(parameters)) {
                accept(child);
            }
        }
        var all = new ArrayList<Declared>(positionalOnly);
        all.addAll(positional);
        var defaults = alignDefaults(all.size(), positionalDefaults, rebuilder);

        var posonlyNodes = new ArrayList<PyNode>();
        var argNodes = new ArrayList<PyNode>();
        for (int i = 0; i < all.size(); i++) {
            var parameter = parameter(all.get(i), defaults.get(i));
            (i < positionalOnly.size() ? posonlyNodes : argNodes).add(parameter);
        }
        var kwonlyNodes = new ArrayList<PyNode>();
        for (int i = 0; i < keywordOnly.size(); i++) {
            kwonlyNodes.add(parameter(keywordOnly.get(i), keywordOnlyDefaults.get(i)));
        }
        PyNode varargNode = vararg == null ? Empty.INSTANCE : parameter(vararg, Empty.INSTANCE);
        PyNode kwargNode = kwarg == null ? Empty.INSTANCE : parameter(kwarg, Empty.INSTANCE);
        return new Arguments(position).postinit(
                NodeSequence.copyOf(argNodes),
                varargNode,
                kwargNode,
                NodeSequence.copyOf(kwonlyNodes),
                NodeSequence.copyOf(posonlyNodes));
    }

    /**
     * Pads {@code defaults} on the left with {@link Empty} so that it lines up with {@code count} parameters.
     *
     * @throws AstBuildingException if there are more defaults than parameters
     */
    static List<PyNode> alignDefaults(int count, List<PyNode> defaults, TreeRebuilder rebuilder)
            throws AstBuildingException {
        if (defaults.size() > count) {
            throw rebuilder.buildingError(
                    "Got " + defaults.size() + " default values for " + count + " positional parameters");
        }
        var result = new ArrayList<PyNode>(Collections.nCopies(count - defaults.size(), Empty.INSTANCE));
        result.addAll(defaults);
        return result;
    }

    private void accept(TSNode child) throws AstBuildingException {
        switch (child.getType()) {
            case IDENTIFIER -> add(new Declared(child, rebuilder.text(child), null), null);
            case TYPED_PARAMETER -> typed(child);
            case DEFAULT_PARAMETER -> add(declared(rebuilder.requiredField(child, "name"), null),
                    rebuilder.requiredField(child, "value"));
            case TYPED_DEFAULT_PARAMETER -> add(
                    declared(rebuilder.requiredField(child, "name"), rebuilder.requiredField(child, "type")),
                    rebuilder.requiredField(child, "value"));
            case LIST_SPLAT_PATTERN -> {
                vararg = splatName(child, null);
                keywordOnlySection = true;
            }
            case DICTIONARY_SPLAT_PATTERN -> kwarg = splatName(child, null);
            case KEYWORD_SEPARATOR -> keywordOnlySection = true;
            case POSITIONAL_SEPARATOR -> {
                if (keywordOnlySection || !positionalOnly.isEmpty()) {
                    throw rebuilder.syntaxError(child, "invalid position of '/' in parameters");
                }
                positionalOnly.addAll(positional);
                positional.clear();
            }
            case TUPLE_PATTERN -> throw rebuilder.buildingError(
                    "Nested tuple parameters are not supported (at " + rebuilder.position(child) + ")");
            default -> throw rebuilder.buildingError(
                    "No conversion available for raw node kind '" + child.getType() + "' in parameters at "
                            + rebuilder.position(child));
        }
    }

    // A typed parameter wraps a plain name or one of the splat forms.
    private void typed(TSNode node) throws AstBuildingException {
        TSNode annotation = rebuilder.requiredField(node, "type");
        TSNode inner = rebuilder.single(node);
        switch (inner.getType()) {
            case LIST_SPLAT_PATTERN -> {
                vararg = splatName(inner, annotation);
                keywordOnlySection = true;
            }
            case DICTIONARY_SPLAT_PATTERN -> kwarg = splatName(inner, annotation);
            default -> add(declared(inner, annotation), null);
        }
    }

    private Declared declared(TSNode nameNode, @Nullable TSNode annotation) throws AstBuildingException {
        if (TUPLE_PATTERN.equals(nameNode.getType())) {
            throw rebuilder.buildingError(
                    "Nested tuple parameters are not supported (at " + rebuilder.position(nameNode) + ")");
        }
        return new Declared(nameNode, rebuilder.text(nameNode), annotation);
    }

    private Declared splatName(TSNode splat, @Nullable TSNode annotation) throws AstBuildingException {
        TSNode name = rebuilder.single(splat);
        return new Declared(name, rebuilder.text(name), annotation);
    }

    private void add(Declared declared, @Nullable TSNode defaultValue) throws AstBuildingException {
        if (keywordOnlySection) {
            keywordOnly.add(declared);
            keywordOnlyDefaults.add(defaultValue == null ? Empty.INSTANCE : rebuilder.expression(defaultValue));
            return;
        }
        if (defaultValue == null) {
            if (firstDefault != null) {
                throw rebuilder.syntaxError(declared.nameNode(), "non-default argument follows default argument");
            }
        } else {
            if (firstDefault == null) {
                firstDefault = defaultValue;
            }
            positionalDefaults.add(rebuilder.expression(defaultValue));
        }
        positional.add(declared);
    }

    private Parameter parameter(Declared declared, PyNode defaultValue) throws AstBuildingException {
        PyNode annotation = Empty.INSTANCE;
        if (declared.annotation() != null) {
            if (!rebuilder.dialect().supportsAnnotations()) {
                throw rebuilder.syntaxError(declared.annotation(), "parameter annotations are not supported");
            }
            annotation = rebuilder.expression(declared.annotation());
        }
        return new Parameter(rebuilder.position(declared.nameNode()), declared.name()).postinit(defaultValue, annotation);
    }
}
