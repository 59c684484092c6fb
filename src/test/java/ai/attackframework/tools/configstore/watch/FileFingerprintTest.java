package ai.attackframework.tools.configstore.watch;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class FileFingerprintTest {

    @TempDir
    Path dir;

    @Test
    void of_changesWithSizeAndModifiedTime() throws IOException {
        Path f = dir.resolve("c.jsonc");
        Files.writeString(f, "{}");
        FileFingerprint first = FileFingerprint.of(f);

        assertThat(FileFingerprint.of(f)).isEqualTo(first);

        Files.writeString(f, "{\"a\": 1}");
        Files.setLastModifiedTime(f, FileTime.fromMillis(Files.getLastModifiedTime(f).toMillis() + 2_000));
        FileFingerprint second = FileFingerprint.of(f);

        assertThat(second).isNotEqualTo(first);
        assertThat(second.size()).isEqualTo(8);
        assertThat(second).isNotEqualTo(FileFingerprint.NONE);
    }

    @Test
    void of_missingFile_throws() {
        assertThatThrownBy(() -> FileFingerprint.of(dir.resolve("missing"))).isInstanceOf(NoSuchFileException.class);
    }
}
