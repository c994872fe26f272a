package ai.canopy.tree.nodes;

import java.util.ArrayList;
import java.util.List;

/** Nodes that declare parameters: function definitions and lambdas. */
public interface FunctionLike {

    String name();

    Arguments args();

    /** Parameter names in declaration order, including {@code *args} and {@code **kwargs}. */
    default List<String> argNames() {
        var args = args();
        var names = new ArrayList<String>();
        args.positionalOnly().forEach(parameter -> names.add(parameter.name()));
        args.args().forEach(parameter -> names.add(parameter.name()));
        args.varargParameter().ifPresent(parameter -> names.add(parameter.name()));
        args.keywordOnly().forEach(parameter -> names.add(parameter.name()));
        args.kwargParameter().ifPresent(parameter -> names.add(parameter.name()));
        return names;
    }
}
