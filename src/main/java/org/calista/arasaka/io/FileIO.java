package org.calista.arasaka.io;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.nio.file.*;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * FileIO: единая точка I/O для durable-хранилища поиска.
 *
 * <p>
 * Гарантии, на которые опирается checkpoint/journal слой:
 * </p>
 * - атомарная перезапись файла (tmp + ATOMIC_MOVE, fsync до и после move)
 * - durable append строки (fsync после каждой записи, если fsyncOnCommit)
 * - безопасный resolve внутри baseDir (anti path traversal)
 * - чтение JSONL с признаком "последняя строка дописана до конца"
 *
 * Без внешних зависимостей (кроме логгера).
 */
public final class FileIO {
    private static final Logger log = LogManager.getLogger(FileIO.class);

    // ----------------------------
    // Options / Builder
    // ----------------------------

    public static final class Options {
        public final Charset charset;
        public final boolean atomicWrites;
        public final boolean fsyncOnCommit;

        private Options(Builder b) {
            this.charset = b.charset;
            this.atomicWrites = b.atomicWrites;
            this.fsyncOnCommit = b.fsyncOnCommit;
        }

        public static Builder builder() {
            return new Builder();
        }

        public static final class Builder {
            private Charset charset = StandardCharsets.UTF_8;
            private boolean atomicWrites = true;
            private boolean fsyncOnCommit = true;

            public Builder charset(Charset v) {
                this.charset = Objects.requireNonNull(v);
                return this;
            }

            public Builder atomicWrites(boolean v) {
                this.atomicWrites = v;
                return this;
            }

            public Builder fsyncOnCommit(boolean v) {
                this.fsyncOnCommit = v;
                return this;
            }

            public Options build() {
                return new Options(this);
            }
        }
    }

    private final Path baseDir;
    private final Options opt;

    public FileIO(Path baseDir) {
        this(baseDir, Options.builder().build());
    }

    public FileIO(Path baseDir, Charset charset, boolean fsyncOnCommit) {
        this(baseDir, Options.builder()
                .charset(Objects.requireNonNull(charset, "charset"))
                .fsyncOnCommit(fsyncOnCommit)
                .build());
    }

    public FileIO(Path baseDir, Options options) {
        this.baseDir = Objects.requireNonNull(baseDir, "baseDir").toAbsolutePath().normalize();
        this.opt = Objects.requireNonNull(options, "options");
        log.debug("FileIO init: baseDir={}, charset={}, atomicWrites={}, fsyncOnCommit={}",
                this.baseDir, opt.charset, opt.atomicWrites, opt.fsyncOnCommit);
        try {
            ensureBaseDir();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to ensure base directory exists", e);
        }
    }

    // ----------------------------
    // Base dir / Resolve
    // ----------------------------

    public Path baseDir() {
        return baseDir;
    }

    public void ensureBaseDir() throws IOException {
        Files.createDirectories(baseDir);
    }

    /**
     * Резолвит относительный путь внутри baseDir и защищает от выхода через "..".
     * Абсолютные пути запрещены.
     */
    public Path resolve(String relative) {
        Objects.requireNonNull(relative, "relative");
        String sanitized = relative.replace('\\', '/');
        Path rel = Paths.get(sanitized);
        if (rel.isAbsolute()) throw new IllegalArgumentException("resolve(relative) does not accept absolute paths: " + relative);

        Path p = baseDir.resolve(rel).normalize().toAbsolutePath();
        if (!p.startsWith(baseDir)) throw new IllegalArgumentException("Path traversal detected: " + relative);
        return p;
    }

    public Path resolve(Path relative) {
        Objects.requireNonNull(relative, "relative");
        if (relative.isAbsolute()) throw new IllegalArgumentException("resolve(relative) does not accept absolute paths: " + relative);
        return resolve(relative.toString());
    }

    public void createDirectories(Path dir) throws IOException {
        if (dir == null) return;
        Files.createDirectories(dir);
    }

    public void ensureParentDir(Path file) throws IOException {
        Objects.requireNonNull(file, "file");
        Path parent = file.getParent();
        if (parent != null) Files.createDirectories(parent);
    }

    public boolean exists(Path file) {
        Objects.requireNonNull(file, "file");
        return Files.exists(file);
    }

    // ----------------------------
    // Text
    // ----------------------------

    public String readString(Path file) throws IOException {
        Objects.requireNonNull(file, "file");
        return Files.readString(file, opt.charset);
    }

    public Optional<String> readStringIfExists(Path file) throws IOException {
        Objects.requireNonNull(file, "file");
        if (!Files.exists(file)) return Optional.empty();
        return Optional.of(readString(file));
    }

    /**
     * Перезаписывает файл целиком. atomicWrites=true: пишет во временный файл и
     * переносит его поверх target, так что читатель видит либо старое, либо новое содержимое.
     */
    public void writeString(Path file, String content) throws IOException {
        Objects.requireNonNull(file, "file");
        Objects.requireNonNull(content, "content");
        ensureParentDir(file);

        if (!opt.atomicWrites) {
            Files.writeString(file, content, opt.charset,
                    StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING, StandardOpenOption.WRITE);
            return;
        }

        Path tmp = tempSibling(file);
        Files.writeString(tmp, content, opt.charset,
                StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING, StandardOpenOption.WRITE);
        atomicCommit(tmp, file);
    }

    /**
     * Дописывает строку + перевод строки. Запись одним write-вызовом,
     * fsync перед возвратом (если fsyncOnCommit): после return строка пережила crash.
     */
    public void appendLine(Path file, String line) throws IOException {
        Objects.requireNonNull(file, "file");
        Objects.requireNonNull(line, "line");
        ensureParentDir(file);

        ByteBuffer buf = ByteBuffer.wrap((line + "\n").getBytes(opt.charset));
        try (FileChannel ch = FileChannel.open(file,
                StandardOpenOption.CREATE, StandardOpenOption.WRITE, StandardOpenOption.APPEND)) {
            while (buf.hasRemaining()) ch.write(buf);
            if (opt.fsyncOnCommit) ch.force(true);
        }
    }

    // ----------------------------
    // JSONL helpers
    // ----------------------------

    public void appendJsonl(Path file, String jsonLine) throws IOException {
        Objects.requireNonNull(jsonLine, "jsonLine");
        String s = jsonLine.trim();
        if (s.isEmpty()) return;
        if (s.indexOf('\n') >= 0) throw new IllegalArgumentException("JSONL record must be a single line");
        appendLine(file, s);
    }

    /**
     * Читает JSONL целиком и сообщает, завершена ли последняя запись переводом строки.
     * Незавершённая последняя запись: след прерванного append.
     */
    public JsonlSnapshot readJsonlSnapshot(Path file) throws IOException {
        Objects.requireNonNull(file, "file");
        if (!Files.exists(file)) return new JsonlSnapshot(List.of(), true);

        String raw = readString(file);
        boolean terminated = raw.isEmpty() || raw.endsWith("\n");

        ArrayList<String> out = new ArrayList<>();
        for (String l : raw.split("\n", -1)) {
            String t = l.trim();
            if (!t.isEmpty()) out.add(t);
        }
        return new JsonlSnapshot(out, terminated);
    }

    public static final class JsonlSnapshot {
        public final List<String> records;
        /** false => последняя запись в records не дописана (torn tail). */
        public final boolean lastRecordComplete;

        JsonlSnapshot(List<String> records, boolean lastRecordComplete) {
            this.records = List.copyOf(records);
            this.lastRecordComplete = lastRecordComplete;
        }
    }

    // ----------------------------
    // Directories
    // ----------------------------

    public List<Path> listDirectories(Path dir) throws IOException {
        Objects.requireNonNull(dir, "dir");
        if (!Files.isDirectory(dir)) return List.of();
        try (Stream<Path> s = Files.list(dir)) {
            return s.filter(Files::isDirectory).sorted().collect(Collectors.toList());
        }
    }

    /**
     * Переносит директорию целиком (архивация). Target не должен существовать.
     */
    public void moveDirectory(Path source, Path target) throws IOException {
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(target, "target");
        ensureParentDir(target);
        try {
            Files.move(source, target, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(source, target);
        }
        if (opt.fsyncOnCommit) fsyncParentDir(target);
        log.debug("moveDirectory: {} -> {}", source, target);
    }

    // ----------------------------
    // Internals
    // ----------------------------

    private Path tempSibling(Path target) {
        String name = target.getFileName().toString();
        return target.resolveSibling(name + ".tmp");
    }

    private void atomicCommit(Path tmp, Path target) throws IOException {
        // fsync tmp до move: после crash target не должен оказаться пустым
        if (opt.fsyncOnCommit) fsyncFile(tmp);

        try {
            Files.move(tmp, target,
                    StandardCopyOption.REPLACE_EXISTING,
                    StandardCopyOption.ATOMIC_MOVE);
            if (opt.fsyncOnCommit) fsyncParentDir(target);
            log.trace("atomicCommit: {} -> {} (ATOMIC)", tmp, target);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
            if (opt.fsyncOnCommit) fsyncParentDir(target);
            log.trace("atomicCommit: {} -> {} (NON-ATOMIC fallback)", tmp, target);
        } finally {
            try {
                Files.deleteIfExists(tmp);
            } catch (IOException e) {
                log.debug("atomicCommit: tmp cleanup failed for {}: {}", tmp, e.toString());
            }
        }
    }

    private void fsyncFile(Path file) throws IOException {
        try (FileChannel ch = FileChannel.open(file, StandardOpenOption.READ)) {
            ch.force(true);
        }
    }

    private void fsyncParentDir(Path file) {
        Path parent = file.getParent();
        if (parent == null) return;
        // на Windows и части FS это невозможно, best-effort
        try (FileChannel ch = FileChannel.open(parent, StandardOpenOption.READ)) {
            ch.force(true);
        } catch (IOException e) {
            log.debug("fsyncParentDir ignored for {}: {}", parent, e.toString());
        }
    }
}
