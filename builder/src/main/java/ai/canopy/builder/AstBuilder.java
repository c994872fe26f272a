package ai.canopy.builder;

import static ai.canopy.builder.python.PythonTreeSitterNodeTypes.ERROR;
import static ai.canopy.builder.python.PythonTreeSitterNodeTypes.FALSE;
import static ai.canopy.builder.python.PythonTreeSitterNodeTypes.TRUE;

import ai.canopy.exception.AstBuildingException;
import ai.canopy.exception.AstSyntaxException;
import ai.canopy.tree.nodes.Module;
import ai.canopy.tree.zipper.Zipper;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;
import org.treesitter.TSNode;
import org.treesitter.TSParser;
import org.treesitter.TSTree;
import org.treesitter.TreeSitterPython;

/**
 * Entry points for building module trees from Python source text or files.
 *
 * <p>Text is dedented (when configured) and given a trailing newline, parsed with TreeSitter, checked for syntax
 * errors and then handed to a fresh {@link TreeRebuilder}. A failed build throws and yields no tree.
 */
public class AstBuilder {
    private static final Logger logger = LogManager.getLogger(AstBuilder.class);

    private static final String INIT_SUFFIX = ".__init__";
    private static final String INIT_FILE = "__init__.py";
    private static final int MAX_MASKED_TARGETS = 64;

    private final BuilderSettings settings;

    public AstBuilder() {
        this(BuilderSettings.load());
    }

    public AstBuilder(BuilderSettings settings) {
        this.settings = settings;
    }

    public BuilderSettings settings() {
        return settings;
    }

    /** Builds {@code code} as the anonymous module {@code ""} and wraps it in a zipper. */
    public Zipper parse(String code) throws AstBuildingException {
        return parse(code, "", null);
    }

    public Zipper parse(String code, String moduleName, @Nullable Path path) throws AstBuildingException {
        return new Zipper(buildFromText(code, moduleName, path));
    }

    /**
     * Builds a module from source text.
     *
     * <p>A module name ending in {@code .__init__} names a package: the suffix is dropped and the module is marked as
     * a package. Otherwise the module is a package when its path goes through an {@code __init__.py} file.
     */
    public Module buildFromText(String code, String moduleName, @Nullable Path path) throws AstBuildingException {
        return build(code, moduleName, path, "utf-8");
    }

    /**
     * Builds a module from a file, honouring a byte order mark or {@code coding:} declaration. The module name
     * defaults to the file name without its source suffix.
     *
     * @throws AstBuildingException if the file cannot be read, is not a recognised source file, or cannot be decoded
     */
    public Module buildFromFile(Path file, @Nullable String moduleName) throws AstBuildingException {
        String name = moduleName != null ? moduleName : defaultModuleName(file);
        if (settings.sourceSuffixes().stream().noneMatch(suffix -> file.getFileName().toString().endsWith(suffix))) {
            throw new AstBuildingException(name, file,
                    "Unable to load file " + file + ": not a source file (expected one of " + settings.sourceSuffixes() + ")");
        }
        byte[] data;
        try {
            data = Files.readAllBytes(file);
        } catch (IOException e) {
            throw AstBuildingException.failedImport(name, file, e);
        }
        var decoded = SourceEncoding.decode(data, settings.defaultEncoding(), name, file);
        logger.debug("Read {} ({} bytes) as {}", file, data.length, decoded.charset().name());
        return build(decoded.text(), name, file.toAbsolutePath(), decoded.charset().name().toLowerCase(Locale.ROOT));
    }

    private Module build(String code, String moduleName, @Nullable Path path, String fileEncoding)
            throws AstBuildingException {
        String name = moduleName;
        boolean isPackage;
        if (name.endsWith(INIT_SUFFIX)) {
            name = name.substring(0, name.length() - INIT_SUFFIX.length());
            isPackage = true;
        } else {
            isPackage = path != null && path.toString().contains(INIT_FILE);
        }

        String text = (settings.dedent() ? dedent(code) : code) + "\n";
        logger.debug("Building module '{}' from {} ({} dialect)", name, path == null ? "text" : path, settings.dialect());
        var source = new SourceText(text);

        TSParser parser = new TSParser();
        parser.setLanguage(new TreeSitterPython());
        TSTree tree = parser.parseString(null, text);
        if (settings.dialect().booleansAreNames()) {
            tree = maskBooleanTargets(parser, text, tree);
        }
        TSNode root = tree.getRootNode();
        checkSyntax(root, source, name, path);

        var rebuilder = new TreeRebuilder(source, settings.dialect(), name, path);
        return rebuilder.rebuild(root, isPackage, fileEncoding);
    }

    /**
     * The grammar always reads {@code True} and {@code False} as literals, so binding one of them fails to parse. While
     * the first parse error starts at such a literal, its first byte is masked to turn it into an identifier of the
     * same length and the text is parsed again. Byte offsets do not move and node text is still cut from the original
     * source, so the rebuilt name keeps its spelling.
     */
    private static TSTree maskBooleanTargets(TSParser parser, String text, TSTree tree) {
        byte[] masked = text.getBytes(StandardCharsets.UTF_8);
        TSTree current = tree;
        for (int attempt = 0; attempt < MAX_MASKED_TARGETS && current.getRootNode().hasError(); attempt++) {
            TSNode error = SourceText.findFirst(current.getRootNode(), n -> ERROR.equals(n.getType()));
            if (error == null) {
                break;
            }
            TSNode literal = SourceText.findFirst(error, AstBuilder::isBooleanLiteral);
            if (literal == null || literal.getStartByte() != error.getStartByte()) {
                break;
            }
            masked[literal.getStartByte()] = '_';
            logger.debug("Retrying parse with the boolean at byte {} read as a name", literal.getStartByte());
            current = parser.parseString(null, new String(masked, StandardCharsets.UTF_8));
        }
        return current;
    }

    private static boolean isBooleanLiteral(TSNode node) {
        String type = node.getType();
        return TRUE.equals(type) || FALSE.equals(type) || "True".equals(type) || "False".equals(type);
    }

    private static void checkSyntax(TSNode root, SourceText source, String moduleName, @Nullable Path path)
            throws AstSyntaxException {
        if (!root.hasError()) {
            return;
        }
        TSNode bad = SourceText.findFirst(root, n -> ERROR.equals(n.getType()) || n.isMissing());
        if (bad == null) {
            bad = root;
        }
        var point = bad.getStartPoint();
        String error = bad.isMissing()
                ? "missing '" + bad.getType() + "'"
                : "invalid syntax near '" + abbreviate(source.of(bad).strip()) + "'";
        throw new AstSyntaxException(
                moduleName, path, source.line(point.getRow()), point.getRow() + 1, point.getColumn(), error);
    }

    private static String abbreviate(String text) {
        String firstLine = text.lines().findFirst().orElse("");
        return firstLine.length() > 40 ? firstLine.substring(0, 40) + "..." : firstLine;
    }

    private String defaultModuleName(Path file) {
        String fileName = file.getFileName().toString();
        for (String suffix : settings.sourceSuffixes()) {
            if (fileName.endsWith(suffix)) {
                return fileName.substring(0, fileName.length() - suffix.length());
            }
        }
        return fileName;
    }

    /**
     * Removes the whitespace prefix common to every non-blank line. Lines holding only whitespace are emptied and do
     * not take part in finding the prefix.
     */
    static String dedent(String text) {
        String[] lines = text.split("\n", -1);
        String margin = null;
        for (String line : lines) {
            if (line.isBlank()) {
                continue;
            }
            int end = 0;
            while (end < line.length() && (line.charAt(end) == ' ' || line.charAt(end) == '\t')) {
                end++;
            }
            String indent = line.substring(0, end);
            if (margin == null) {
                margin = indent;
            } else {
                int common = 0;
                while (common < margin.length() && common < indent.length()
                        && margin.charAt(common) == indent.charAt(common)) {
                    common++;
                }
                margin = margin.substring(0, common);
            }
        }
        List<String> result = new ArrayList<>(lines.length);
        for (String line : lines) {
            if (line.isBlank()) {
                result.add("");
            } else {
                result.add(margin == null ? line : line.substring(margin.length()));
            }
        }
        return String.join("\n", result);
    }
}
