package org.calista.qualia.io;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import java.util.zip.GZIPInputStream;

/**
 * FileIO — единая точка файлового I/O: транскрипты, фреймбуки, JSONL-аудит, отчёты.
 *
 * - чтение .gz/.gzip транскриптов прозрачно
 * - атомарная запись через tmp-файл + move (отчёт либо целиком, либо никак)
 * - запись JSONL построчно одним коммитом
 */
public final class FileIO {
    private static final Logger log = LogManager.getLogger(FileIO.class);

    private final Charset charset;
    private final boolean atomicWrites;

    public FileIO() {
        this(StandardCharsets.UTF_8, true);
    }

    public FileIO(Charset charset, boolean atomicWrites) {
        this.charset = Objects.requireNonNull(charset, "charset");
        this.atomicWrites = atomicWrites;
    }

    public Charset charset() {
        return charset;
    }

    // ----------------------------
    // Read
    // ----------------------------

    /**
     * Reads a whole file. Gzip files are decompressed on the fly.
     *
     * @throws java.nio.file.NoSuchFileException if the file does not exist
     */
    public String readString(Path file) throws IOException {
        Objects.requireNonNull(file, "file");
        if (isGzip(file)) {
            try (InputStream in = new GZIPInputStream(Files.newInputStream(file))) {
                return new String(in.readAllBytes(), charset);
            }
        }
        return Files.readString(file, charset);
    }

    /** Regular files in {@code dir} whose name matches a glob, sorted by path. */
    public List<Path> glob(Path dir, String pattern) throws IOException {
        Objects.requireNonNull(dir, "dir");
        Objects.requireNonNull(pattern, "pattern");
        if (!Files.isDirectory(dir)) return List.of();

        PathMatcher matcher = dir.getFileSystem().getPathMatcher("glob:" + pattern);
        try (Stream<Path> s = Files.list(dir)) {
            return s.filter(Files::isRegularFile)
                    .filter(p -> matcher.matches(p.getFileName()))
                    .sorted()
                    .collect(Collectors.toList());
        }
    }

    // ----------------------------
    // Write
    // ----------------------------

    public void writeString(Path file, String content) throws IOException {
        Objects.requireNonNull(file, "file");
        Objects.requireNonNull(content, "content");
        ensureParentDir(file);

        if (!atomicWrites) {
            Files.writeString(file, content, charset, StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING);
            return;
        }
        Path tmp = tempSibling(file);
        Files.writeString(tmp, content, charset, StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING);
        atomicCommit(tmp, file);
    }

    /**
     * Writes lines (one record per line, blank lines skipped) and commits them in one step.
     */
    public void writeLines(Path file, List<String> lines) throws IOException {
        Objects.requireNonNull(file, "file");
        Objects.requireNonNull(lines, "lines");
        ensureParentDir(file);

        Path target = atomicWrites ? tempSibling(file) : file;
        try (BufferedWriter w = Files.newBufferedWriter(target, charset,
                StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING, StandardOpenOption.WRITE)) {
            for (String l : lines) {
                if (l == null || l.isBlank()) continue;
                w.write(l.strip());
                w.newLine();
            }
        }
        if (atomicWrites) atomicCommit(target, file);
        log.debug("writeLines: {} ({} lines)", file, lines.size());
    }

    public void ensureParentDir(Path file) throws IOException {
        Path parent = file.toAbsolutePath().getParent();
        if (parent != null) Files.createDirectories(parent);
    }

    // ----------------------------
    // Internals
    // ----------------------------

    private static Path tempSibling(Path target) {
        return target.resolveSibling(target.getFileName() + ".tmp");
    }

    private static void atomicCommit(Path tmp, Path target) throws IOException {
        try {
            Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            log.trace("atomicCommit: {} -> {} (ATOMIC)", tmp, target);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
            log.trace("atomicCommit: {} -> {} (NON-ATOMIC fallback)", tmp, target);
        }
    }

    private static boolean isGzip(Path file) {
        String name = file.getFileName().toString().toLowerCase(Locale.ROOT);
        return name.endsWith(".gz") || name.endsWith(".gzip");
    }
}
