package ai.canopy.exception;

import java.nio.file.Path;
import org.jetbrains.annotations.Nullable;

/** The source text is not valid Python for the selected dialect. */
public class AstSyntaxException extends AstBuildingException {

    private final String source;
    private final int line;
    private final int column;
    private final String error;

    public AstSyntaxException(
            String moduleName, @Nullable Path path, String source, int line, int column, String error) {
        super(moduleName, path, "Parsing Python code failed:\n" + error + " (line " + line + ", column " + column + ")");
        this.source = source;
        this.line = line;
        this.column = column;
        this.error = error;
    }

    public String source() {
        return source;
    }

    /** 1-based line of the offending token. */
    public int line() {
        return line;
    }

    /** 0-based byte column of the offending token. */
    public int column() {
        return column;
    }

    public String error() {
        return error;
    }
}
