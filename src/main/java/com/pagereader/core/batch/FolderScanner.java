package com.pagereader.core.batch;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/** Изображения в папке (без подпапок), отфильтрованные по glob-маскам имени файла. */
public final class FolderScanner {
    private static final Logger log = LoggerFactory.getLogger(FolderScanner.class);

    public static final List<String> DEFAULT_PATTERNS =
            List.of("*.jpg", "*.jpeg", "*.png", "*.bmp", "*.gif");

    private final List<PathMatcher> matchers;

    public FolderScanner(List<String> patterns) {
        var pats = (patterns == null || patterns.isEmpty()) ? DEFAULT_PATTERNS : patterns;
        // регистр расширения не важен: сравниваем имя в нижнем регистре
        this.matchers = pats.stream()
                .map(p -> FileSystems.getDefault().getPathMatcher("glob:" + p.toLowerCase(Locale.ROOT)))
                .collect(Collectors.toList());
    }

    /** Файлы, отсортированные по имени. */
    public List<Path> scan(Path folder) {
        if (folder == null || !Files.isDirectory(folder)) {
            throw new IllegalArgumentException("Not a directory: " + folder);
        }
        try (Stream<Path> s = Files.list(folder)) {
            List<Path> found = s.filter(Files::isRegularFile)
                    .filter(this::matchesAny)
                    .sorted(Comparator.comparing(p -> p.getFileName().toString()))
                    .toList();
            log.info("Scan: {} images in {}", found.size(), folder);
            return found;
        } catch (IOException e) {
            throw new UncheckedIOException("Folder scan failed: " + folder, e);
        }
    }

    private boolean matchesAny(Path path) {
        var name = path.getFileName();
        if (name == null) return false;
        Path lower = Path.of(name.toString().toLowerCase(Locale.ROOT));
        for (var m : matchers) {
            if (m.matches(lower)) return true;
        }
        return false;
    }
}
