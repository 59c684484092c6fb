package ai.attackframework.tools.configstore.watch;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.concurrent.TimeUnit;

/**
 * Change-detection fingerprint of a file: last-modified time and size.
 *
 * @param modifiedNanos last-modified time in nanoseconds since the epoch, at the
 *                      filesystem's resolution
 * @param size          size in bytes
 */
public record FileFingerprint(long modifiedNanos, long size) {

    /** Fingerprint that matches no existing file. */
    public static final FileFingerprint NONE = new FileFingerprint(Long.MIN_VALUE, -1L);

    /**
     * Reads the current fingerprint of {@code file}.
     *
     * @throws IOException when the attributes cannot be read
     */
    public static FileFingerprint of(Path file) throws IOException {
        BasicFileAttributes attrs = Files.readAttributes(file, BasicFileAttributes.class);
        return new FileFingerprint(attrs.lastModifiedTime().to(TimeUnit.NANOSECONDS), attrs.size());
    }
}
