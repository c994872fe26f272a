package ai.canopy.builder;

import static org.junit.jupiter.api.Assertions.*;

import ai.canopy.exception.AstBuildingException;
import ai.canopy.tree.Empty;
import ai.canopy.tree.PyNode;
import ai.canopy.tree.PythonDialect;
import ai.canopy.tree.nodes.Const;
import java.util.List;
import org.junit.jupiter.api.Test;

class ParameterBuilderTest {

    private final TreeRebuilder rebuilder = new TreeRebuilder(new SourceText(""), PythonDialect.PY3, "m", null);

    @Test
    void testDefaultsAlignWithTheLastParameters() throws AstBuildingException {
        var one = new Const(null, 1L);
        List<PyNode> aligned = ParameterBuilder.alignDefaults(3, List.of(one), rebuilder);
        assertEquals(List.of(Empty.INSTANCE, Empty.INSTANCE, one), aligned);
        assertEquals(List.of(), ParameterBuilder.alignDefaults(0, List.of(), rebuilder));
    }

    @Test
    void testTooManyDefaultsIsAnError() {
        List<PyNode> defaults = List.of(new Const(null, 1L), new Const(null, 2L));
        var error = assertThrows(AstBuildingException.class,
                () -> ParameterBuilder.alignDefaults(1, defaults, rebuilder));
        assertEquals("Got 2 default values for 1 positional parameters", error.getMessage());
        assertEquals("m", error.moduleName());
    }
}
