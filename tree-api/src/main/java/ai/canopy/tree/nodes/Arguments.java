package ai.canopy.tree.nodes;

import ai.canopy.exception.NoDefaultException;
import ai.canopy.tree.Empty;
import ai.canopy.tree.NodeKind;
import ai.canopy.tree.NodeSequence;
import ai.canopy.tree.Position;
import ai.canopy.tree.PyNode;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.StringJoiner;
import org.jetbrains.annotations.Nullable;

/**
 * The parameter list of a function or lambda. {@code vararg} and {@code kwarg} hold a {@link Parameter} or
 * {@link Empty}; the other fields hold sequences of parameters.
 */
public final class Arguments extends PyNode {

    public Arguments(@Nullable Position position) {
        super(position);
    }

    public Arguments postinit(
            NodeSequence args, PyNode vararg, PyNode kwarg, NodeSequence keywordOnly, NodeSequence positionalOnly) {
        complete(args, vararg, kwarg, keywordOnly, positionalOnly);
        return this;
    }

    public List<Parameter> args() {
        return elementsAt(0, Parameter.class);
    }

    public PyNode vararg() {
        return nodeAt(1);
    }

    public PyNode kwarg() {
        return nodeAt(2);
    }

    public List<Parameter> keywordOnly() {
        return elementsAt(3, Parameter.class);
    }

    public List<Parameter> positionalOnly() {
        return elementsAt(4, Parameter.class);
    }

    public Optional<Parameter> varargParameter() {
        return vararg() instanceof Parameter parameter ? Optional.of(parameter) : Optional.empty();
    }

    public Optional<Parameter> kwargParameter() {
        return kwarg() instanceof Parameter parameter ? Optional.of(parameter) : Optional.empty();
    }

    /** Plain parameters followed by the positional-only ones. */
    public List<Parameter> positionalAndKeyword() {
        var result = new ArrayList<Parameter>(args());
        result.addAll(positionalOnly());
        return result;
    }

    /** The default of each entry of {@link #positionalAndKeyword()}, {@link Empty} where there is none. */
    public List<PyNode> defaults() {
        return positionalAndKeyword().stream().map(Parameter::defaultValue).toList();
    }

    /** The default of each keyword-only parameter, {@link Empty} where there is none. */
    public List<PyNode> keywordOnlyDefaults() {
        return keywordOnly().stream().map(Parameter::defaultValue).toList();
    }

    /**
     * The default value of the parameter called {@code name}.
     *
     * @throws NoDefaultException if there is no such parameter or it was declared without a default
     */
    public PyNode defaultValue(String name) throws NoDefaultException {
        for (Parameter parameter : declared()) {
            if (parameter.name().equals(name) && parameter.hasDefault()) {
                return parameter.defaultValue();
            }
        }
        throw new NoDefaultException(parent(), name);
    }

    public boolean isArgument(String name) {
        return declared().stream().anyMatch(parameter -> parameter.name().equals(name))
                || varargParameter().map(p -> p.name().equals(name)).orElse(false)
                || kwargParameter().map(p -> p.name().equals(name)).orElse(false);
    }

    /** Renders the parameter names with their markers, e.g. {@code a, /, b=..., *args, c, **kwargs}. */
    public String formatArgs() {
        var joiner = new StringJoiner(", ");
        var positionalOnly = positionalOnly();
        positionalOnly.forEach(parameter -> joiner.add(format(parameter)));
        if (!positionalOnly.isEmpty()) {
            joiner.add("/");
        }
        args().forEach(parameter -> joiner.add(format(parameter)));
        var vararg = varargParameter();
        if (vararg.isPresent()) {
            joiner.add("*" + vararg.get().name());
        } else if (!keywordOnly().isEmpty()) {
            joiner.add("*");
        }
        keywordOnly().forEach(parameter -> joiner.add(format(parameter)));
        kwargParameter().ifPresent(parameter -> joiner.add("**" + parameter.name()));
        return joiner.toString();
    }

    private static String format(Parameter parameter) {
        return parameter.hasDefault() ? parameter.name() + "=..." : parameter.name();
    }

    private List<Parameter> declared() {
        var result = new ArrayList<Parameter>(positionalAndKeyword());
        result.addAll(keywordOnly());
        return result;
    }

    @Override
    public NodeKind kind() {
        return NodeKind.ARGUMENTS;
    }

    @Override
    protected PyNode bareCopy() {
        return new Arguments(position());
    }
}
