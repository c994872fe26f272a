package ai.canopy.exception;

import java.nio.file.Path;
import org.jetbrains.annotations.Nullable;

/** A module could not be turned into a syntax tree. */
public class AstBuildingException extends CanopyException {

    private final String moduleName;
    private final @Nullable Path path;

    public AstBuildingException(String moduleName, @Nullable Path path, String message) {
        super(message);
        this.moduleName = moduleName;
        this.path = path;
    }

    public AstBuildingException(String moduleName, @Nullable Path path, String message, Throwable cause) {
        super(message, cause);
        this.moduleName = moduleName;
        this.path = path;
    }

    public static AstBuildingException failedImport(String moduleName, @Nullable Path path, Throwable cause) {
        return new AstBuildingException(moduleName, path, "Failed to import module " + moduleName + ".", cause);
    }

    public String moduleName() {
        return moduleName;
    }

    public @Nullable Path path() {
        return path;
    }
}
