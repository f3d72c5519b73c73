package org.pragmatica.ddmm.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;

import java.util.List;

/**
 * Tool configuration read from the {@code ddmm} block of HOCON configuration.
 *
 * <pre>
 * ddmm {
 *   source-extension = ".ddmm"
 *   target-extension = ".py"
 *   cache-directory = "__ddmmcache__"
 *   display-name = "&lt;string&gt;"
 *   interpreter.command = ["python3"]
 * }
 * </pre>
 */
public record DdmmConfig(
    String sourceExtension,
    String targetExtension,
    String cacheDirectory,
    String displayName,
    List<String> interpreterCommand
) {
    private static final String ROOT_PATH = "ddmm";

    public static final DdmmConfig DEFAULT = from(ConfigFactory.defaultReference());

    public DdmmConfig {
        if (!sourceExtension.startsWith(".") || !targetExtension.startsWith(".")) {
            throw new IllegalArgumentException("File extensions must start with '.': "
                                               + sourceExtension + ", " + targetExtension);
        }
        if (sourceExtension.equals(targetExtension)) {
            throw new IllegalArgumentException("Source and target extensions must differ: " + sourceExtension);
        }
        if (interpreterCommand.isEmpty()) {
            throw new IllegalArgumentException("ddmm.interpreter.command must not be empty");
        }
        interpreterCommand = List.copyOf(interpreterCommand);
    }

    /**
     * Read from resolved configuration; missing keys fall back to the classpath reference defaults.
     */
    public static DdmmConfig from(Config config) {
        var ddmm = config.withFallback(ConfigFactory.defaultReference())
                         .getConfig(ROOT_PATH);
        return new DdmmConfig(ddmm.getString("source-extension"),
                              ddmm.getString("target-extension"),
                              ddmm.getString("cache-directory"),
                              ddmm.getString("display-name"),
                              ddmm.getStringList("interpreter.command"));
    }

    /**
     * Replace the source extension of {@code fileName} with the target extension.
     */
    public String targetName(String fileName) {
        return fileName.endsWith(sourceExtension)
               ? fileName.substring(0, fileName.length() - sourceExtension.length()) + targetExtension
               : fileName + targetExtension;
    }

    /**
     * Inverse of {@link #targetName(String)}: the source file name a cached file was produced from.
     */
    public String sourceName(String targetFileName) {
        return targetFileName.endsWith(targetExtension)
               ? targetFileName.substring(0, targetFileName.length() - targetExtension.length()) + sourceExtension
               : targetFileName + sourceExtension;
    }
}
