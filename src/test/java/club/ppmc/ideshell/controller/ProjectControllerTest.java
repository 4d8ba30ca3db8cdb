package club.ppmc.ideshell.controller;

import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

import club.ppmc.ideshell.exception.EnvironmentConfigurationException;
import club.ppmc.ideshell.exception.ProjectQueryException;
import club.ppmc.ideshell.model.BackendFamily;
import club.ppmc.ideshell.model.CrateDependency;
import club.ppmc.ideshell.model.CrateInfo;
import club.ppmc.ideshell.model.GradleTask;
import club.ppmc.ideshell.service.ProjectInfoService;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

@WebMvcTest(ProjectController.class)
class ProjectControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private ProjectInfoService projectInfoService;

    @Test
    void gradleTasks() throws Exception {
        when(projectInfoService.listGradleTasks("demo")).thenReturn(List.of(
                new GradleTask("app:assembleDebug", "Assembles main output for variant debug", "Build")));

        mockMvc.perform(get("/api/project/gradle-tasks").param("path", "demo"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].name").value("app:assembleDebug"))
                .andExpect(jsonPath("$[0].group").value("Build"));
    }

    @Test
    void crateInfo() throws Exception {
        when(projectInfoService.crateInfo("demo")).thenReturn(new CrateInfo("demo", "0.1.0", List.of(), null, "2021",
                List.of("bin"), List.of(new CrateDependency("serde", "^1.0", "normal", false, List.of("derive"))),
                List.of()));

        mockMvc.perform(get("/api/project/crate").param("path", "demo"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.name").value("demo"))
                .andExpect(jsonPath("$.description").value(""))
                .andExpect(jsonPath("$.dependencies[0].features[0]").value("derive"));
    }

    @Test
    @DisplayName("a missing manifest is a structured 400")
    void missingManifest() throws Exception {
        when(projectInfoService.crateInfo("demo")).thenThrow(new EnvironmentConfigurationException(
                "项目中未找到 Cargo.toml", "Cargo.toml", BackendFamily.PACKAGE_MANAGER));

        mockMvc.perform(get("/api/project/crate").param("path", "demo"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.missing").value("Cargo.toml"));
    }

    @Test
    @DisplayName("a failed query is a 500 carrying the tool's diagnostics")
    void queryFailure() throws Exception {
        when(projectInfoService.listGradleTasks("demo")).thenThrow(
                new ProjectQueryException("gradle tasks 执行失败 (退出码 1)", List.of("FAILURE: Build failed")));

        mockMvc.perform(get("/api/project/gradle-tasks").param("path", "demo"))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.diagnostics[0]").value("FAILURE: Build failed"));
    }
}
