package club.ppmc.ideshell.service.backend;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import club.ppmc.ideshell.exception.EnvironmentConfigurationException;
import club.ppmc.ideshell.exception.InvalidOperationException;
import club.ppmc.ideshell.model.BackendFamily;
import club.ppmc.ideshell.model.BuildOperation;
import club.ppmc.ideshell.model.BuildRequest;
import club.ppmc.ideshell.model.OutputEvent;
import club.ppmc.ideshell.model.OutputKind;
import club.ppmc.ideshell.model.RawLine;
import club.ppmc.ideshell.model.Settings;
import club.ppmc.ideshell.service.SettingsService;
import club.ppmc.ideshell.service.classify.OutputClassifier;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class NativeDriverAdapterTest {

    @TempDir
    Path projectDir;

    private NativeDriverAdapter adapter;

    @BeforeEach
    void setUp() throws Exception {
        var settings = new Settings();
        SettingsService settingsService = mock(SettingsService.class);
        when(settingsService.getSettings()).thenReturn(settings);
        adapter = new NativeDriverAdapter(settingsService);
        Files.writeString(projectDir.resolve("Cargo.toml"), "");
    }

    @Test
    void build() {
        assertEquals(
                List.of("rust-build-driver", "build", "--build-type", "release", "--project", projectDir.toString()),
                adapter.plan(projectDir, BuildRequest.build("release")).argv());
    }

    @Test
    void cleanAndTest() {
        assertEquals(List.of("rust-build-driver", "clean", "--project", projectDir.toString()),
                adapter.plan(projectDir, BuildRequest.of(BuildOperation.CLEAN)).argv());
        assertEquals(List.of("rust-build-driver", "test", "--project", projectDir.toString()),
                adapter.plan(projectDir, BuildRequest.of(BuildOperation.TEST)).argv());
    }

    @Test
    void crossTarget() {
        assertEquals(
                List.of("rust-build-driver", "build-target", "--target", "x86_64-linux-android",
                        "--build-type", "debug", "--project", projectDir.toString()),
                adapter.plan(projectDir, BuildRequest.crossTarget("x86_64-linux-android", null)).argv());
    }

    @Test
    @DisplayName("the driver does not manage dependencies")
    void dependencyOperationsUnsupported() {
        assertThrows(InvalidOperationException.class,
                () -> adapter.plan(projectDir, BuildRequest.addDependency("serde", null, null)));
        assertThrows(InvalidOperationException.class,
                () -> adapter.plan(projectDir, BuildRequest.removeDependency("serde")));
    }

    @Test
    void missingManifest(@TempDir Path emptyProject) {
        var e = assertThrows(EnvironmentConfigurationException.class,
                () -> adapter.plan(emptyProject, BuildRequest.build("debug")));
        assertEquals(BackendFamily.NATIVE_DRIVER, e.getFamily());
    }

    @Test
    @DisplayName("protocol prefixes win, then rustc diagnostic prefixes")
    void classification() {
        var classifier = new OutputClassifier();
        classifier.register(adapter.ruleTable());

        assertEquals(OutputKind.TASK, kind(classifier, RawLine.stdout("[TASK] compiling crate demo")));
        assertEquals(OutputKind.SUCCESS, kind(classifier, RawLine.stdout("[SUCCESS] no error found")));
        assertEquals(OutputKind.WARNING, kind(classifier, RawLine.stdout("[WARN] slow linker")));
        assertEquals(OutputKind.ERROR, kind(classifier, RawLine.stderr("[ERROR] link failed")));
        assertEquals(OutputKind.ERROR, kind(classifier, RawLine.stderr("error[E0425]: cannot find value `x`")));
        assertEquals(OutputKind.ERROR, kind(classifier, RawLine.stderr("error: linking with `cc` failed")));
        assertEquals(OutputKind.WARNING, kind(classifier, RawLine.stderr("warning: unused import: `std::fs`")));
        assertEquals(OutputKind.INFO, kind(classifier, RawLine.stderr("resolving toolchain")));

        OutputEvent artifact = classifier.classify(
                RawLine.stdout("[ARTIFACT] target/release/libdemo.so"), BackendFamily.NATIVE_DRIVER);
        assertEquals(OutputKind.ARTIFACT, artifact.kind());
        assertEquals("target/release/libdemo.so", artifact.artifactPath());
    }

    @Test
    @DisplayName("crate names containing error or warning are not diagnostics")
    void crateNamesAreNotDiagnostics() {
        var classifier = new OutputClassifier();
        classifier.register(adapter.ruleTable());

        assertEquals(OutputKind.TASK, kind(classifier, RawLine.stdout("   Compiling quick-error v2.0.1")));
        assertEquals(OutputKind.TASK, kind(classifier, RawLine.stderr("   Compiling error-chain v0.12.4")));
        assertEquals(OutputKind.INFO, kind(classifier, RawLine.stdout("  Downloaded error-code v3.2.0")));
        assertEquals(OutputKind.INFO, kind(classifier, RawLine.stdout("resolved no-warning-lint v1.0.0")));
    }

    private static OutputKind kind(OutputClassifier classifier, RawLine line) {
        return classifier.classify(line, BackendFamily.NATIVE_DRIVER).kind();
    }
}
