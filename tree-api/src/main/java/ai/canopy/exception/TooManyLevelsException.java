package ai.canopy.exception;

/** A relative import climbs above the top-level package of the importing module. */
public class TooManyLevelsException extends AstImportException {

    private final int level;

    public TooManyLevelsException(int level, String moduleName) {
        super(moduleName, null,
                "Relative import with too many levels (" + level + ") for module '" + moduleName + "'");
        this.level = level;
    }

    public int level() {
        return level;
    }
}
