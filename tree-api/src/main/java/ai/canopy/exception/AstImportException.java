package ai.canopy.exception;

import java.nio.file.Path;
import org.jetbrains.annotations.Nullable;

/** A module name could not be resolved. */
public class AstImportException extends AstBuildingException {

    public AstImportException(String moduleName, @Nullable Path path, String message) {
        super(moduleName, path, message);
    }
}
