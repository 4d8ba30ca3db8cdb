package club.ppmc.ideshell.service.backend;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import club.ppmc.ideshell.exception.EnvironmentConfigurationException;
import club.ppmc.ideshell.exception.InvalidOperationException;
import club.ppmc.ideshell.model.BackendFamily;
import club.ppmc.ideshell.model.BuildOperation;
import club.ppmc.ideshell.model.BuildRequest;
import club.ppmc.ideshell.model.GradleTask;
import club.ppmc.ideshell.model.Invocation;
import club.ppmc.ideshell.model.OutputKind;
import club.ppmc.ideshell.model.RawLine;
import club.ppmc.ideshell.model.Settings;
import club.ppmc.ideshell.service.SettingsService;
import club.ppmc.ideshell.service.classify.OutputClassifier;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ManagedBuildToolAdapterTest {

    @TempDir
    Path projectDir;

    private ManagedBuildToolAdapter adapter;

    @BeforeEach
    void setUp() throws Exception {
        var settings = new Settings();
        settings.setGradleCommand("/opt/gradle/bin/gradle");
        SettingsService settingsService = mock(SettingsService.class);
        when(settingsService.getSettings()).thenReturn(settings);
        adapter = new ManagedBuildToolAdapter(settingsService);
        Files.writeString(projectDir.resolve("build.gradle.kts"), "plugins {}\n");
    }

    @Test
    @DisplayName("debug build maps to assembleDebug with plain console output")
    void debugBuild() {
        Invocation invocation = adapter.plan(projectDir, BuildRequest.build("debug"));

        assertEquals(BackendFamily.MANAGED_BUILD_TOOL, invocation.family());
        assertEquals(List.of("/opt/gradle/bin/gradle", "assembleDebug", "--console=plain"), invocation.argv());
        assertEquals(projectDir, invocation.workingDirectory());
    }

    @Test
    @DisplayName("the project wrapper is preferred over the configured command")
    void wrapperPreferred() throws Exception {
        Files.writeString(projectDir.resolve("gradlew"), "#!/bin/sh\n");

        Invocation invocation = adapter.plan(projectDir, BuildRequest.build("release"));

        assertEquals(List.of("./gradlew", "assembleRelease", "--console=plain"), invocation.argv());
    }

    @Test
    @DisplayName("other build types are passed through as task names, followed by extra arguments")
    void customTaskAndExtraArgs() {
        var request = new BuildRequest(
                BuildOperation.BUILD, "bundleRelease", List.of("--offline"), null, null, null, null, Map.of("CI", "1"));

        Invocation invocation = adapter.plan(projectDir, request);

        assertEquals(List.of("/opt/gradle/bin/gradle", "bundleRelease", "--console=plain", "--offline"),
                invocation.argv());
        assertEquals("1", invocation.environment().get("CI"));
    }

    @Test
    void cleanAndTest() {
        assertEquals("clean", adapter.plan(projectDir, BuildRequest.of(BuildOperation.CLEAN)).argv().get(1));
        assertEquals("test", adapter.plan(projectDir, BuildRequest.of(BuildOperation.TEST)).argv().get(1));
    }

    @Test
    @DisplayName("dependency management and cross-target builds are not supported")
    void unsupportedOperations() {
        var add = assertThrows(InvalidOperationException.class,
                () -> adapter.plan(projectDir, BuildRequest.addDependency("okhttp", null, null)));
        assertEquals(BuildOperation.ADD_DEPENDENCY, add.getOperation());
        assertEquals(BackendFamily.MANAGED_BUILD_TOOL, add.getFamily());

        assertThrows(InvalidOperationException.class,
                () -> adapter.plan(projectDir, BuildRequest.removeDependency("okhttp")));
        assertThrows(InvalidOperationException.class,
                () -> adapter.plan(projectDir, BuildRequest.crossTarget("aarch64-linux-android", "debug")));
    }

    @Test
    @DisplayName("a project without a Gradle script is rejected before planning")
    void missingBuildScript(@TempDir Path emptyProject) {
        var e = assertThrows(EnvironmentConfigurationException.class,
                () -> adapter.plan(emptyProject, BuildRequest.build("debug")));

        assertEquals("build.gradle", e.getMissingComponent());
        assertEquals(BackendFamily.MANAGED_BUILD_TOOL, e.getFamily());
    }

    @Test
    @DisplayName("packages in the build-type output directories are reported as artifacts")
    void findsArtifacts() throws Exception {
        Path apkDir = Files.createDirectories(projectDir.resolve("app/build/outputs/apk/debug"));
        Files.writeString(apkDir.resolve("app-debug.apk"), "apk");
        Files.writeString(apkDir.resolve("output-metadata.json"), "{}");
        Path releaseDir = Files.createDirectories(projectDir.resolve("app/build/outputs/apk/release"));
        Files.writeString(releaseDir.resolve("app-release.apk"), "apk");

        List<Path> artifacts = adapter.findArtifacts(projectDir, BuildRequest.build("debug"));

        assertEquals(List.of(apkDir.resolve("app-debug.apk")), artifacts);
        assertTrue(adapter.findArtifacts(projectDir, BuildRequest.of(BuildOperation.CLEAN)).isEmpty());
    }

    @Test
    @DisplayName("Gradle output is classified with the managed build tool table")
    void classification() {
        var classifier = new OutputClassifier();
        classifier.register(adapter.ruleTable());

        assertEquals(OutputKind.TASK, kind(classifier, RawLine.stdout("> Task :app:mergeDebugResources")));
        assertEquals(OutputKind.SUCCESS, kind(classifier, RawLine.stdout("BUILD SUCCESSFUL in 5s")));
        assertEquals(OutputKind.ERROR, kind(classifier, RawLine.stderr("FAILURE: Build failed with an exception.")));
        assertEquals(OutputKind.ERROR,
                kind(classifier, RawLine.stderr("e: file:///app/Main.kt:3:5 Unresolved reference: foo")));
        assertEquals(OutputKind.WARNING,
                kind(classifier, RawLine.stderr("Main.java:12: warning: [deprecation] foo() is deprecated")));
        assertEquals(OutputKind.INFO, kind(classifier, RawLine.stderr("Starting a Gradle Daemon")));
    }

    @Test
    @DisplayName("task listing runs tasks --all with plain console output")
    void listTasksInvocation() throws Exception {
        assertEquals(List.of("/opt/gradle/bin/gradle", "tasks", "--all", "--console=plain"),
                adapter.listTasks(projectDir).argv());

        Files.delete(projectDir.resolve("build.gradle.kts"));
        assertThrows(EnvironmentConfigurationException.class, () -> adapter.listTasks(projectDir));
    }

    @Test
    @DisplayName("the task listing is parsed by group and stops at the rules section")
    void parseTaskListing() throws Exception {
        Path fixture = Path.of(getClass().getResource("/fixtures/gradle-tasks-all.txt").toURI());

        List<GradleTask> tasks = ManagedBuildToolAdapter.parseTaskListing(
                Files.readAllLines(fixture, StandardCharsets.UTF_8));

        assertEquals(7, tasks.size());
        assertEquals(new GradleTask("androidDependencies", "Displays the Android dependencies of the project.",
                "Android"), tasks.get(0));
        assertEquals(new GradleTask("app:assembleDebug", "Assembles main output for variant debug", "Build"),
                tasks.get(3));
        assertEquals(new GradleTask("test", "Run unit tests for all variants.", "Verification"), tasks.get(5));
        assertEquals(new GradleTask("app:compileDebugAidl", "", "Other"), tasks.get(6));
        assertTrue(tasks.stream().noneMatch(task -> task.name().startsWith("Pattern")));
    }

    @Test
    void parseTaskListingWithoutTaskSection() {
        assertTrue(ManagedBuildToolAdapter.parseTaskListing(List.of("FAILURE: Build failed", "BUILD FAILED"))
                .isEmpty());
    }

    private static OutputKind kind(OutputClassifier classifier, RawLine line) {
        return classifier.classify(line, BackendFamily.MANAGED_BUILD_TOOL).kind();
    }
}
