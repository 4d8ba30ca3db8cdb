package club.ppmc.ideshell.service;

import static org.junit.jupiter.api.Assertions.*;

import club.ppmc.ideshell.exception.EnvironmentConfigurationException;
import club.ppmc.ideshell.exception.ProjectQueryException;
import club.ppmc.ideshell.model.CrateInfo;
import club.ppmc.ideshell.model.GradleTask;
import club.ppmc.ideshell.service.backend.ManagedBuildToolAdapter;
import club.ppmc.ideshell.service.backend.PackageManagerAdapter;
import club.ppmc.ideshell.util.ProcessExecutor;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.PosixFilePermissions;
import java.util.List;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ProjectInfoServiceTest {

    @TempDir
    Path workspace;

    private SettingsService settingsService;
    private ProcessExecutor processExecutor;
    private ProjectInfoService service;
    private Path project;

    @BeforeEach
    void setUp() throws Exception {
        settingsService = new SettingsService(
                workspace.toString(), "gradle", "cargo", "rust-build-driver", 600, ".ide/terminal-logs", "sh");
        settingsService.init();
        processExecutor = new ProcessExecutor();
        service = new ProjectInfoService(new ManagedBuildToolAdapter(settingsService),
                new PackageManagerAdapter(settingsService), processExecutor, settingsService);
        project = Files.createDirectories(workspace.resolve("demo"));
    }

    @AfterEach
    void tearDown() {
        processExecutor.shutdown();
    }

    private String fakeTool(String name, String body) throws Exception {
        Path bin = Files.createDirectories(workspace.resolve("bin"));
        Path script = bin.resolve(name);
        Files.writeString(script, "#!/bin/sh\n" + body + "\n");
        Files.setPosixFilePermissions(script, PosixFilePermissions.fromString("rwxr-xr-x"));
        return script.toString();
    }

    private Path fixture(String name) throws Exception {
        return Path.of(getClass().getResource("/fixtures/" + name).toURI());
    }

    @Test
    @DisplayName("Gradle tasks are listed from the tool's plain output")
    void listGradleTasks() throws Exception {
        Files.writeString(project.resolve("build.gradle"), "");
        settingsService.getSettings().setGradleCommand(fakeTool("gradle",
                "[ \"$1 $2 $3\" = 'tasks --all --console=plain' ] || exit 2\n"
                        + "echo 'Starting a Gradle Daemon' >&2\ncat '" + fixture("gradle-tasks-all.txt") + "'"));

        List<GradleTask> tasks = service.listGradleTasks("demo");

        assertEquals(7, tasks.size());
        assertEquals("app:assembleDebug", tasks.get(3).name());
    }

    @Test
    @DisplayName("crate info is read from cargo metadata for the project's own manifest")
    void crateInfo() throws Exception {
        Files.writeString(project.resolve("Cargo.toml"), "[package]\nname = \"demo\"\n");
        String json = Files.readString(fixture("cargo-metadata.json"))
                .replace("/work/demo/Cargo.toml", project.toAbsolutePath().normalize().resolve("Cargo.toml").toString());
        Path output = Files.writeString(workspace.resolve("metadata.json"), json);
        settingsService.getSettings().setCargoCommand(fakeTool("cargo", "cat '" + output + "'"));

        CrateInfo info = service.crateInfo("demo");

        assertEquals("demo", info.name());
        assertEquals(3, info.dependencies().size());
    }

    @Test
    @DisplayName("a failing tool is reported with its last stderr lines")
    void toolFailure() throws Exception {
        Files.writeString(project.resolve("Cargo.toml"), "");
        settingsService.getSettings().setCargoCommand(fakeTool("cargo",
                "echo 'error: failed to parse manifest' >&2\nexit 101"));

        ProjectQueryException e = assertThrows(ProjectQueryException.class, () -> service.crateInfo("demo"));

        assertTrue(e.getMessage().contains("101"), e.getMessage());
        assertEquals(List.of("error: failed to parse manifest"), e.getDiagnostics());
    }

    @Test
    @DisplayName("unparseable metadata is a query failure")
    void unparseableOutput() throws Exception {
        Files.writeString(project.resolve("Cargo.toml"), "");
        settingsService.getSettings().setCargoCommand(fakeTool("cargo", "echo 'not json'"));

        assertThrows(ProjectQueryException.class, () -> service.crateInfo("demo"));
    }

    @Test
    @DisplayName("a missing tool is a query failure")
    void missingTool() throws Exception {
        Files.writeString(project.resolve("build.gradle"), "");
        settingsService.getSettings().setGradleCommand(workspace.resolve("no-such-gradle").toString());

        assertThrows(ProjectQueryException.class, () -> service.listGradleTasks("demo"));
    }

    @Test
    @DisplayName("a project without the family's manifest is rejected before anything runs")
    void missingManifest() {
        assertThrows(EnvironmentConfigurationException.class, () -> service.listGradleTasks("demo"));
        assertThrows(EnvironmentConfigurationException.class, () -> service.crateInfo("demo"));
        assertThrows(EnvironmentConfigurationException.class, () -> service.crateInfo("missing"));
    }
}
