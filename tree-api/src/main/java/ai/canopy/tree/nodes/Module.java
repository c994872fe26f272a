package ai.canopy.tree.nodes;

import ai.canopy.exception.AstBuildingException;
import ai.canopy.exception.TooManyLevelsException;
import ai.canopy.tree.NodeKind;
import ai.canopy.tree.NodeSequence;
import ai.canopy.tree.Position;
import ai.canopy.tree.PyNode;
import ai.canopy.tree.PythonCodecs;
import ai.canopy.tree.PythonDialect;
import com.google.common.base.Joiner;
import com.google.common.base.Splitter;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import org.jetbrains.annotations.Nullable;

/**
 * The root of every tree built from source. Carries the module name, its docstring, and where its source came from:
 * inline text, a file, or both.
 */
public final class Module extends PyNode {

    private static final Splitter DOT_SPLITTER = Splitter.on('.');
    private static final Joiner DOT_JOINER = Joiner.on('.');

    private final String name;
    private final @Nullable String doc;
    private final @Nullable String fileEncoding;
    private final boolean isPackage;
    private final @Nullable String sourceCode;
    private final @Nullable Path sourceFile;

    public Module(
            String name,
            @Nullable String doc,
            @Nullable String fileEncoding,
            boolean isPackage,
            @Nullable String sourceCode,
            @Nullable Path sourceFile) {
        super(new Position(0, 0));
        if (sourceCode == null && sourceFile == null) {
            throw new IllegalArgumentException("Module " + name + " needs source text or a source file");
        }
        this.name = name;
        this.doc = doc;
        this.fileEncoding = fileEncoding;
        this.isPackage = isPackage;
        this.sourceCode = sourceCode;
        this.sourceFile = sourceFile;
    }

    public Module postinit(NodeSequence body) {
        complete(body);
        return this;
    }

    public NodeSequence body() {
        return sequenceAt(0);
    }

    public String name() {
        return name;
    }

    public @Nullable String doc() {
        return doc;
    }

    public @Nullable String fileEncoding() {
        return fileEncoding;
    }

    public boolean isPackage() {
        return isPackage;
    }

    public @Nullable String sourceCode() {
        return sourceCode;
    }

    public @Nullable Path sourceFile() {
        return sourceFile;
    }

    /**
     * Opens the module source. Inline text wins over the file and is encoded with the module's encoding. The caller
     * closes the stream.
     *
     * @throws AstBuildingException if the module's encoding names no known charset
     */
    public InputStream stream() throws IOException, AstBuildingException {
        if (sourceCode != null) {
            Charset charset = StandardCharsets.UTF_8;
            if (fileEncoding != null) {
                charset = PythonCodecs.charset(fileEncoding).orElseThrow(() ->
                        new AstBuildingException(name, sourceFile, "Unknown encoding '" + fileEncoding + "'"));
            }
            return new ByteArrayInputStream(sourceCode.getBytes(charset));
        }
        assert sourceFile != null;
        return Files.newInputStream(sourceFile);
    }

    /** Names imported from {@code __future__} at the top of the module. */
    public Set<String> futureImports() {
        var result = new LinkedHashSet<String>();
        var body = body();
        for (int i = 0; i < body.size(); i++) {
            PyNode statement = body.get(i);
            if (i == 0 && statement instanceof Expr) {
                continue;
            }
            if (!(statement instanceof ImportFrom importFrom) || !"__future__".equals(importFrom.modname())) {
                break;
            }
            importFrom.names().forEach(importName -> result.add(importName.name()));
        }
        return Set.copyOf(result);
    }

    public boolean absoluteImportActivated(PythonDialect dialect) {
        return dialect == PythonDialect.PY3 || futureImports().contains("absolute_import");
    }

    /** Resolves an import as Python 3 does: a null {@code level} means an absolute import. */
    public String relativeToAbsoluteName(String modname, @Nullable Integer level) throws TooManyLevelsException {
        return relativeToAbsoluteName(modname, level, PythonDialect.PY3);
    }

    /**
     * Turns a possibly relative import of {@code modname} from this module into an absolute module name.
     *
     * @param level number of leading dots, or null when none were written
     * @throws TooManyLevelsException if the import climbs above the top-level package
     */
    public String relativeToAbsoluteName(String modname, @Nullable Integer level, PythonDialect dialect)
            throws TooManyLevelsException {
        if (level == null && absoluteImportActivated(dialect)) {
            return modname;
        }
        List<String> parts = DOT_SPLITTER.splitToList(name);
        String packageName;
        if (level != null && level > 0) {
            int remaining = isPackage ? level - 1 : level;
            if (remaining > 0 && parts.size() - 1 < remaining) {
                throw new TooManyLevelsException(remaining, name);
            }
            packageName = DOT_JOINER.join(parts.subList(0, parts.size() - remaining));
        } else if (isPackage) {
            packageName = name;
        } else {
            packageName = parts.size() == 1 ? name : DOT_JOINER.join(parts.subList(0, parts.size() - 1));
        }
        if (packageName.isEmpty()) {
            return modname;
        }
        return modname.isEmpty() ? packageName : packageName + "." + modname;
    }

    @Override
    public NodeKind kind() {
        return NodeKind.MODULE;
    }

    @Override
    protected PyNode bareCopy() {
        return new Module(name, doc, fileEncoding, isPackage, sourceCode, sourceFile);
    }

    @Override
    public List<@Nullable Object> otherFieldValues() {
        return Arrays.asList(name, doc, fileEncoding, isPackage, sourceCode, sourceFile);
    }

    @Override
    protected String label() {
        return name;
    }
}
