package org.pragmatica.ddmm.build;

import org.pragmatica.ddmm.Ddmm;
import org.pragmatica.ddmm.config.DdmmConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * On-disk cache of transformed sources, keyed by source modification time.
 *
 * <p>A source {@code <root>/pkg/mod.ddmm} is cached as {@code <cacheRoot>/pkg/mod.py}. The cached file carries
 * the source's exact last-modified time; it is reused only while the two times are equal, so any change
 * of the source timestamp, forwards or backwards, invalidates it.
 */
public final class TranspileCache {
    private static final Logger LOG = LoggerFactory.getLogger(TranspileCache.class);

    private final Path cacheRoot;
    private final DdmmConfig config;

    public TranspileCache(Path cacheRoot, DdmmConfig config) {
        this.cacheRoot = cacheRoot;
        this.config = config;
    }

    public Path cacheRoot() {
        return cacheRoot;
    }

    /**
     * Location of the cached form of {@code source}, which must lie under {@code sourceRoot}.
     */
    public Path targetOf(Path sourceRoot, Path source) {
        var relative = sourceRoot.toAbsolutePath()
                                 .normalize()
                                 .relativize(source.toAbsolutePath()
                                                   .normalize());
        if (relative.startsWith("..")) {
            throw new IllegalArgumentException(source + " is not under " + sourceRoot);
        }
        var target = cacheRoot.resolve(relative);
        return target.resolveSibling(config.targetName(target.getFileName()
                                                             .toString()));
    }

    /**
     * Source that {@code target}, a file under the cache root, was produced from.
     */
    public Path sourceOf(Path sourceRoot, Path target) {
        var relative = cacheRoot.relativize(target);
        var source = sourceRoot.resolve(relative);
        return source.resolveSibling(config.sourceName(source.getFileName()
                                                             .toString()));
    }

    public boolean isFresh(Path source, Path target) throws IOException {
        return Files.isRegularFile(target)
               && Files.getLastModifiedTime(target)
                       .equals(Files.getLastModifiedTime(source));
    }

    /**
     * Return the cached transformed file for {@code source}, transforming and writing it first if stale.
     */
    public Entry transpile(Path sourceRoot, Path source) throws IOException {
        var target = targetOf(sourceRoot, source);
        if (isFresh(source, target)) {
            LOG.debug("Cache hit for {}", source);
            return new Entry(source, target, false);
        }
        LOG.debug("Cache miss for {}", source);
        var modified = Files.getLastModifiedTime(source);
        var transformed = Ddmm.transform(Files.readString(source, StandardCharsets.UTF_8));
        var parent = target.getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Files.writeString(target, transformed, StandardCharsets.UTF_8);
        Files.setLastModifiedTime(target, modified);
        LOG.info("Wrote {}", target);
        return new Entry(source, target, true);
    }

    /**
     * Delete cached files whose source no longer exists, so they cannot shadow modules added later.
     *
     * @return deleted cache files
     */
    public List<Path> prune(Path sourceRoot) throws IOException {
        if (!Files.isDirectory(cacheRoot)) {
            return List.of();
        }
        List<Path> targets;
        try (var walk = Files.walk(cacheRoot)) {
            targets = walk.filter(Files::isRegularFile)
                          .filter(path -> path.getFileName()
                                              .toString()
                                              .endsWith(config.targetExtension()))
                          .sorted()
                          .toList();
        }
        var removed = new ArrayList<Path>();
        for (var target : targets) {
            if (!Files.exists(sourceOf(sourceRoot, target))) {
                Files.deleteIfExists(target);
                LOG.info("Removed stale {}", target);
                removed.add(target);
            }
        }
        return removed;
    }

    /**
     * @param written whether the cached file was (re)written by this call
     */
    public record Entry(Path source, Path target, boolean written) {}
}
