/**
 * ProjectController.java
 *
 * 只读的项目查询接口：列出 Gradle 任务、读取 Cargo crate 信息。
 * 查询同步执行，不创建构建会话。
 */
package club.ppmc.ideshell.controller;

import club.ppmc.ideshell.exception.EnvironmentConfigurationException;
import club.ppmc.ideshell.exception.ProjectQueryException;
import club.ppmc.ideshell.service.ProjectInfoService;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/project")
@Slf4j
public class ProjectController {

    private final ProjectInfoService projectInfoService;

    public ProjectController(ProjectInfoService projectInfoService) {
        this.projectInfoService = projectInfoService;
    }

    @GetMapping("/gradle-tasks")
    public ResponseEntity<?> gradleTasks(@RequestParam String path) {
        try {
            return ResponseEntity.ok(projectInfoService.listGradleTasks(path));
        } catch (EnvironmentConfigurationException e) {
            return ResponseEntity.badRequest().body(e.toErrorData());
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(Map.of("message", e.getMessage()));
        } catch (ProjectQueryException e) {
            return queryFailed(e);
        }
    }

    @GetMapping("/crate")
    public ResponseEntity<?> crateInfo(@RequestParam String path) {
        try {
            return ResponseEntity.ok(projectInfoService.crateInfo(path));
        } catch (EnvironmentConfigurationException e) {
            return ResponseEntity.badRequest().body(e.toErrorData());
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(Map.of("message", e.getMessage()));
        } catch (ProjectQueryException e) {
            return queryFailed(e);
        }
    }

    private static ResponseEntity<?> queryFailed(ProjectQueryException e) {
        log.warn("项目查询失败: {}", e.getMessage());
        return ResponseEntity.internalServerError()
                .body(Map.of("message", e.getMessage(), "diagnostics", e.getDiagnostics()));
    }
}
