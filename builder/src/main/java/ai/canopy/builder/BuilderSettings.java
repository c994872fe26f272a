package ai.canopy.builder;

import ai.canopy.tree.PythonDialect;
import com.google.common.base.Splitter;
import java.io.IOException;
import java.nio.charset.Charset;
import java.nio.charset.IllegalCharsetNameException;
import java.nio.charset.StandardCharsets;
import java.nio.charset.UnsupportedCharsetException;
import java.util.List;
import java.util.Locale;
import java.util.Properties;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Options for {@link AstBuilder}.
 *
 * <p>{@link #load()} reads {@code canopy.properties} from the classpath and lets JVM system properties with the same
 * keys override it. Values that fail to parse are logged and replaced by the defaults.
 *
 * @param dialect dialect assumed for the source
 * @param dedent strip common leading whitespace from source text before parsing it
 * @param defaultEncoding encoding of files that declare none
 * @param sourceSuffixes file name suffixes recognised as Python modules
 */
public record BuilderSettings(
        PythonDialect dialect, boolean dedent, Charset defaultEncoding, List<String> sourceSuffixes) {
    private static final Logger logger = LogManager.getLogger(BuilderSettings.class);

    static final String RESOURCE = "canopy.properties";
    static final String KEY_DIALECT = "canopy.dialect";
    static final String KEY_DEDENT = "canopy.build.dedent";
    static final String KEY_DEFAULT_ENCODING = "canopy.build.defaultEncoding";
    static final String KEY_SOURCE_SUFFIXES = "canopy.build.sourceSuffixes";

    public static final BuilderSettings DEFAULTS =
            new BuilderSettings(PythonDialect.PY3, true, StandardCharsets.UTF_8, List.of(".py", ".pyw"));

    public BuilderSettings {
        sourceSuffixes = List.copyOf(sourceSuffixes);
    }

    public static BuilderSettings load() {
        var props = new Properties();
        try (var in = BuilderSettings.class.getClassLoader().getResourceAsStream(RESOURCE)) {
            if (in != null) {
                props.load(in);
            } else {
                logger.debug("No {} on the classpath, using built-in defaults", RESOURCE);
            }
        } catch (IOException e) {
            logger.warn("Failed to load {}: {}", RESOURCE, e.getMessage());
        }
        for (String key : List.of(KEY_DIALECT, KEY_DEDENT, KEY_DEFAULT_ENCODING, KEY_SOURCE_SUFFIXES)) {
            var override = System.getProperty(key);
            if (override != null) {
                props.setProperty(key, override);
            }
        }
        return fromProperties(props);
    }

    static BuilderSettings fromProperties(Properties props) {
        return new BuilderSettings(
                parseDialect(props.getProperty(KEY_DIALECT)),
                parseBoolean(props.getProperty(KEY_DEDENT), KEY_DEDENT, DEFAULTS.dedent()),
                parseCharset(props.getProperty(KEY_DEFAULT_ENCODING)),
                parseSuffixes(props.getProperty(KEY_SOURCE_SUFFIXES)));
    }

    public BuilderSettings withDialect(PythonDialect newDialect) {
        return new BuilderSettings(newDialect, dedent, defaultEncoding, sourceSuffixes);
    }

    public BuilderSettings withDedent(boolean newDedent) {
        return new BuilderSettings(dialect, newDedent, defaultEncoding, sourceSuffixes);
    }

    private static PythonDialect parseDialect(String raw) {
        if (raw == null || raw.isBlank()) {
            return DEFAULTS.dialect();
        }
        try {
            return PythonDialect.valueOf(raw.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            logger.warn("Ignoring {}={}: expected PY2 or PY3", KEY_DIALECT, raw);
            return DEFAULTS.dialect();
        }
    }

    private static boolean parseBoolean(String raw, String key, boolean fallback) {
        if (raw == null || raw.isBlank()) {
            return fallback;
        }
        var value = raw.trim().toLowerCase(Locale.ROOT);
        if (value.equals("true") || value.equals("false")) {
            return Boolean.parseBoolean(value);
        }
        logger.warn("Ignoring {}={}: expected true or false", key, raw);
        return fallback;
    }

    private static Charset parseCharset(String raw) {
        if (raw == null || raw.isBlank()) {
            return DEFAULTS.defaultEncoding();
        }
        try {
            return Charset.forName(raw.trim());
        } catch (IllegalCharsetNameException | UnsupportedCharsetException e) {
            logger.warn("Ignoring {}={}: unknown charset", KEY_DEFAULT_ENCODING, raw);
            return DEFAULTS.defaultEncoding();
        }
    }

    private static List<String> parseSuffixes(String raw) {
        if (raw == null || raw.isBlank()) {
            return DEFAULTS.sourceSuffixes();
        }
        return Splitter.on(',').trimResults().omitEmptyStrings().splitToList(raw);
    }
}
