package ai.attackframework.tools.configstore.utils;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

/**
 * Small file utilities used by the store and backups. Keeps raw NIO calls out of the
 * orchestration code.
 */
public final class FileUtil {

    private static final String TEMP_SUFFIX = ".tmp";

    /**
     * Utility class; not instantiable.
     */
    private FileUtil() {}

    /**
     * Creates each directory (and missing parents).
     * <p>
     * @param dirs directories to create
     * @throws IOException when a directory cannot be created
     */
    public static void ensureDirectories(Path... dirs) throws IOException {
        for (Path dir : dirs) {
            Files.createDirectories(dir);
        }
    }

    /**
     * Write UTF-8 text to a file, creating parent directories if necessary.
     * <p>
     * @param file    destination path
     * @param content content to write
     * @throws IOException when writing fails
     */
    public static void writeStringCreateDirs(Path file, String content) throws IOException {
        Path parent = file.getParent();
        if (parent != null) Files.createDirectories(parent);
        Files.writeString(file, content, StandardCharsets.UTF_8);
    }

    /**
     * Write UTF-8 text to a sibling temp file, then move it over {@code file}.
     * Readers (and file watchers) never observe a half-written file. Falls back to a
     * plain replacing move where the filesystem cannot move atomically.
     * <p>
     * @param file    destination path
     * @param content content to write
     * @throws IOException when writing or moving fails
     */
    public static void writeStringAtomic(Path file, String content) throws IOException {
        Path tmp = file.resolveSibling(file.getFileName() + TEMP_SUFFIX);
        writeStringCreateDirs(tmp, content);
        try {
            Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING);
        } finally {
            Files.deleteIfExists(tmp);
        }
    }

    /**
     * Read UTF-8 text from a file.
     * <p>
     * @param file file to read
     * @return file contents as string
     * @throws IOException when reading fails
     */
    public static String readString(Path file) throws IOException {
        return Files.readString(file, StandardCharsets.UTF_8);
    }
}
