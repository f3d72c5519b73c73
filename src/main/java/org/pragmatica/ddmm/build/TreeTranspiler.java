package org.pragmatica.ddmm.build;

import org.pragmatica.ddmm.Ddmm;
import org.pragmatica.ddmm.check.Diagnostic;
import org.pragmatica.ddmm.config.DdmmConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Transpiles the source files under a directory through a {@link TranspileCache}.
 *
 * <p>Directories named like the cache directory, and the cache root itself, are never scanned.
 * A file that cannot be read or written is logged and reported as failed; the rest of the tree is still built.
 * When the cache root is a dedicated cache directory, cached files whose source was deleted are removed.
 */
public final class TreeTranspiler {
    private static final Logger LOG = LoggerFactory.getLogger(TreeTranspiler.class);

    /**
     * Which directories below the source root are visited.
     */
    public enum Scope {
        /** Every directory. */
        TREE,
        /** Only directories that are packages, i.e. contain an {@code __init__} source file. */
        PACKAGES
    }

    private final TranspileCache cache;
    private final DdmmConfig config;
    private final boolean validate;
    private final Scope scope;

    public TreeTranspiler(TranspileCache cache, DdmmConfig config, boolean validate) {
        this(cache, config, validate, Scope.TREE);
    }

    /**
     * @param validate check bracket matching first and skip files with diagnostics
     */
    public TreeTranspiler(TranspileCache cache, DdmmConfig config, boolean validate, Scope scope) {
        this.cache = cache;
        this.config = config;
        this.validate = validate;
        this.scope = scope;
    }

    public BuildReport build(Path sourceRoot) throws IOException {
        var root = sourceRoot.toAbsolutePath()
                             .normalize();
        var written = new ArrayList<Path>();
        var upToDate = new ArrayList<Path>();
        var rejected = new LinkedHashMap<Path, List<Diagnostic>>();
        var failed = new ArrayList<Path>();

        for (var source : findSources(root, failed)) {
            try{
                if (validate) {
                    var diagnostics = Ddmm.checkBracketMatching(Files.readString(source, StandardCharsets.UTF_8),
                                                                source.toString());
                    if (!diagnostics.isEmpty()) {
                        LOG.warn("Skipping {}: {} bracket problem(s)", source, diagnostics.size());
                        rejected.put(source, diagnostics);
                        continue;
                    }
                }
                var entry = cache.transpile(root, source);
                (entry.written()
                 ? written
                 : upToDate).add(source);
            } catch (IOException e) {
                LOG.warn("Failed to transpile {}: {}", source, e.toString());
                failed.add(source);
            }
        }
        var removed = isDedicatedCache()
                      ? cache.prune(root)
                      : List.<Path>of();
        LOG.debug("Built {}: {} written, {} up to date, {} rejected, {} failed, {} removed",
                  root, written.size(), upToDate.size(), rejected.size(), failed.size(), removed.size());
        return new BuildReport(written, upToDate, rejected, failed, removed);
    }

    // An explicit output directory may hold unrelated files, so only a cache-named root is pruned
    private boolean isDedicatedCache() {
        var name = cache.cacheRoot()
                        .getFileName();
        return name != null && name.toString()
                                   .equals(config.cacheDirectory());
    }

    private List<Path> findSources(Path root, List<Path> failed) throws IOException {
        var cacheRoot = cache.cacheRoot()
                             .toAbsolutePath()
                             .normalize();
        var packageInit = ModuleResolver.PACKAGE_INIT + config.sourceExtension();
        var sources = new ArrayList<Path>();
        Files.walkFileTree(root, new SimpleFileVisitor<>() {
            @Override
            public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) {
                if (dir.equals(root)) {
                    return FileVisitResult.CONTINUE;
                }
                if (dir.startsWith(cacheRoot) || dir.getFileName()
                                                    .toString()
                                                    .equals(config.cacheDirectory())) {
                    return FileVisitResult.SKIP_SUBTREE;
                }
                if (scope == Scope.PACKAGES && !Files.isRegularFile(dir.resolve(packageInit))) {
                    return FileVisitResult.SKIP_SUBTREE;
                }
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
                if (attrs.isRegularFile() && file.getFileName()
                                                 .toString()
                                                 .endsWith(config.sourceExtension())) {
                    sources.add(file);
                }
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult visitFileFailed(Path file, IOException e) {
                LOG.warn("Cannot read {}: {}", file, e.toString());
                failed.add(file);
                return FileVisitResult.CONTINUE;
            }
        });
        Collections.sort(sources);
        return sources;
    }

    /**
     * Outcome of a tree build.
     *
     * @param rejected files skipped because of bracket diagnostics
     * @param failed   files or directories that could not be read or written
     * @param removed  stale cache files deleted because their source is gone
     */
    public record BuildReport(
        List<Path> written,
        List<Path> upToDate,
        Map<Path, List<Diagnostic>> rejected,
        List<Path> failed,
        List<Path> removed
    ) {
        public BuildReport {
            written = List.copyOf(written);
            upToDate = List.copyOf(upToDate);
            rejected = Collections.unmodifiableMap(new LinkedHashMap<>(rejected));
            failed = List.copyOf(failed);
            removed = List.copyOf(removed);
        }

        public boolean isSuccess() {
            return rejected.isEmpty() && failed.isEmpty();
        }
    }
}
