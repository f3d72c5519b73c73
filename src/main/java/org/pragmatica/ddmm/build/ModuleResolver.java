package org.pragmatica.ddmm.build;

import org.pragmatica.ddmm.lexer.Characters;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

/**
 * Resolves dotted module names to source files on a search path.
 *
 * <p>For {@code a.b.c} each search entry is tried in order: first the package file
 * {@code a/b/c/__init__<ext>}, then the module file {@code a/b/c<ext>}.
 */
public final class ModuleResolver {
    private static final Logger LOG = LoggerFactory.getLogger(ModuleResolver.class);
    static final String PACKAGE_INIT = "__init__";

    private final List<Path> searchPath;
    private final String sourceExtension;

    public ModuleResolver(List<Path> searchPath, String sourceExtension) {
        this.searchPath = List.copyOf(searchPath);
        this.sourceExtension = sourceExtension;
    }

    public Optional<Path> resolve(String moduleName) {
        var parts = split(moduleName);
        for (var entry : searchPath) {
            var base = entry;
            for (var part : parts) {
                base = base.resolve(part);
            }
            var packageInit = base.resolve(PACKAGE_INIT + sourceExtension);
            if (Files.isRegularFile(packageInit)) {
                LOG.debug("Resolved package {} to {}", moduleName, packageInit);
                return Optional.of(packageInit);
            }
            var moduleFile = base.resolveSibling(base.getFileName() + sourceExtension);
            if (Files.isRegularFile(moduleFile)) {
                LOG.debug("Resolved module {} to {}", moduleName, moduleFile);
                return Optional.of(moduleFile);
            }
        }
        LOG.debug("Module {} not found on {}", moduleName, searchPath);
        return Optional.empty();
    }

    private static List<String> split(String moduleName) {
        if (moduleName == null || moduleName.isBlank()) {
            throw new IllegalArgumentException("Module name must not be blank");
        }
        var parts = List.of(moduleName.split("\\.", -1));
        for (var part : parts) {
            if (part.isEmpty()) {
                throw new IllegalArgumentException("Empty component in module name '" + moduleName + "'");
            }
            if (!part.codePoints()
                     .allMatch(Characters::isIdentifierChar)) {
                throw new IllegalArgumentException("Invalid component '" + part + "' in module name '" + moduleName + "'");
            }
        }
        return parts;
    }
}
