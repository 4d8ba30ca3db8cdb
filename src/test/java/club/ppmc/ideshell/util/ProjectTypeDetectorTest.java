package club.ppmc.ideshell.util;

import static org.junit.jupiter.api.Assertions.*;

import club.ppmc.ideshell.exception.EnvironmentConfigurationException;
import club.ppmc.ideshell.model.BackendType;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ProjectTypeDetectorTest {

    @TempDir
    Path projectDir;

    private final ProjectTypeDetector detector = new ProjectTypeDetector();

    @Test
    @DisplayName("Cargo.toml alone selects the package manager")
    void cargoOnly() throws Exception {
        Files.writeString(projectDir.resolve("Cargo.toml"), "[package]\nname = \"demo\"\n");

        assertEquals(Optional.of(BackendType.PACKAGE_MANAGER), detector.detect(projectDir));
    }

    @Test
    @DisplayName("any Gradle script selects the managed build tool")
    void gradleOnly() throws Exception {
        Files.writeString(projectDir.resolve("settings.gradle.kts"), "rootProject.name = \"demo\"\n");

        assertEquals(Optional.of(BackendType.MANAGED_BUILD_TOOL), detector.detect(projectDir));
        assertFalse(ProjectTypeDetector.hasGradleWrapper(projectDir));
    }

    @Test
    @DisplayName("both manifests select the hybrid pipeline")
    void bothManifests() throws Exception {
        Files.writeString(projectDir.resolve("Cargo.toml"), "");
        Files.writeString(projectDir.resolve("build.gradle"), "");

        assertEquals(Optional.of(BackendType.HYBRID), detector.detect(projectDir));
    }

    @Test
    @DisplayName("a directory named like a manifest does not count")
    void directoriesAreIgnored() throws Exception {
        Files.createDirectory(projectDir.resolve("Cargo.toml"));

        assertTrue(detector.detect(projectDir).isEmpty());
    }

    @Test
    @DisplayName("detectOrThrow reports the missing manifests")
    void detectOrThrowWithoutManifest() {
        var e = assertThrows(EnvironmentConfigurationException.class, () -> detector.detectOrThrow(projectDir));

        assertTrue(e.getMissingComponent().contains("Cargo.toml"));
        assertEquals("ENVIRONMENT_ERROR", e.toErrorData().get("type"));
    }
}
