package club.ppmc.ideshell.util;

import static org.junit.jupiter.api.Assertions.*;

import club.ppmc.ideshell.model.OutputEvent;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class TranscriptWriterTest {

    @TempDir
    Path logDir;

    @Test
    @DisplayName("default file name carries a second-resolution timestamp")
    void defaultFileName() {
        assertEquals("terminal_20240305_070809.txt",
                TranscriptWriter.defaultFileName(LocalDateTime.of(2024, 3, 5, 7, 8, 9)));
    }

    @Test
    @DisplayName("each event is written as KIND: message in UTF-8")
    void writesOneLinePerEvent() throws Exception {
        List<OutputEvent> events = List.of(
                OutputEvent.info("编译中"),
                OutputEvent.error("error: boom"),
                OutputEvent.success("done"));

        Path written = TranscriptWriter.write(logDir.resolve("nested"), "session.txt", events);

        assertEquals(logDir.resolve("nested").resolve("session.txt"), written);
        assertEquals(List.of("INFO: 编译中", "ERROR: error: boom", "SUCCESS: done"),
                Files.readAllLines(written, StandardCharsets.UTF_8));
    }

    @Test
    @DisplayName("a file name cannot escape the target directory")
    void stripsDirectoryComponents() throws Exception {
        Path written = TranscriptWriter.write(logDir, "../../escape.txt", List.of(OutputEvent.info("x")));

        assertEquals(logDir.resolve("escape.txt"), written);
    }

    @Test
    @DisplayName("a blank file name falls back to the default pattern")
    void blankNameUsesDefault() throws Exception {
        Path written = TranscriptWriter.write(logDir, " ", List.of());

        assertTrue(written.getFileName().toString().matches("terminal_\\d{8}_\\d{6}\\.txt"));
        assertTrue(Files.exists(written));
    }
}
