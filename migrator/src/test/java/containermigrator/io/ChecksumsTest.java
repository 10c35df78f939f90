package containermigrator.io;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ChecksumsTest {

    @TempDir
    Path tempDir;

    @Test
    @DisplayName("Should hash file contents as lowercase hex")
    void sha256OfKnownContent() throws IOException {
        Path file = Files.writeString(tempDir.resolve("abc.txt"), "abc", StandardCharsets.US_ASCII);

        assertThat(Checksums.sha256(file))
                .isEqualTo("ba7816bf8f01cfea414140de5dae2223b00361a396177a9cb410ff61f20015ad");
    }

    @Test
    @DisplayName("Should hash files larger than one buffer")
    void sha256OfLargeFile() throws IOException {
        byte[] bytes = new byte[200 * 1024];
        Path first = Files.write(tempDir.resolve("a.bin"), bytes);
        bytes[150 * 1024] = 1;
        Path second = Files.write(tempDir.resolve("b.bin"), bytes);

        assertThat(Checksums.sha256(first)).hasSize(64).isNotEqualTo(Checksums.sha256(second));
    }

    @Test
    void sha256OfMissingFileThrows() {
        assertThatThrownBy(() -> Checksums.sha256(tempDir.resolve("absent")))
                .isInstanceOf(IOException.class);
    }

    @Test
    @DisplayName("Should compare digests ignoring case and surrounding whitespace")
    void matchesIgnoresCase() {
        assertThat(Checksums.matches("ABCDEF01", " abcdef01\n")).isTrue();
        assertThat(Checksums.matches("abcdef01", "abcdef02")).isFalse();
        assertThat(Checksums.matches(null, "abcdef01")).isFalse();
        assertThat(Checksums.matches("abcdef01", null)).isFalse();
    }

    @Test
    @DisplayName("Should compare digests the same way under any default locale")
    void matchesUnderTurkishLocale() {
        Locale original = Locale.getDefault();
        Locale.setDefault(new Locale("tr", "TR"));
        try {
            assertThat(Checksums.matches("BA7816BF8F01CFEA", "ba7816bf8f01cfea")).isTrue();
        } finally {
            Locale.setDefault(original);
        }
    }
}
