/**
 * BuildController.java
 *
 * 该控制器负责处理构建会话相关的HTTP请求：启动、取消、查询、轮询事件和清除。
 * 构建在后台执行，事件同时通过 WebSocket 主题 /topic/build/{id} 推送。
 */
package club.ppmc.ideshell.controller;

import club.ppmc.ideshell.exception.EnvironmentConfigurationException;
import club.ppmc.ideshell.exception.InvalidOperationException;
import club.ppmc.ideshell.exception.SessionBusyException;
import club.ppmc.ideshell.exception.SessionNotFoundException;
import club.ppmc.ideshell.model.BuildSessionSnapshot;
import club.ppmc.ideshell.model.BuildStartRequest;
import club.ppmc.ideshell.model.OutputEvent;
import club.ppmc.ideshell.service.BuildDispatcherService;
import jakarta.validation.Valid;
import java.util.List;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/build")
@Slf4j
public class BuildController {

    private final BuildDispatcherService buildDispatcherService;

    public BuildController(BuildDispatcherService buildDispatcherService) {
        this.buildDispatcherService = buildDispatcherService;
    }

    /**
     * 启动一个构建会话。请求被接受时返回 202 和会话快照。
     */
    @PostMapping
    public ResponseEntity<?> start(@Valid @RequestBody BuildStartRequest request) {
        try {
            BuildSessionSnapshot snapshot = buildDispatcherService.start(
                    request.projectPath(), request.backendType(), request.toBuildRequest());
            return ResponseEntity.status(HttpStatus.ACCEPTED).body(snapshot);
        } catch (EnvironmentConfigurationException e) {
            // 返回结构化的环境错误，前端据此提示用户缺少的组件
            return ResponseEntity.badRequest().body(e.toErrorData());
        } catch (InvalidOperationException | IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(Map.of("message", e.getMessage()));
        } catch (SessionBusyException e) {
            return ResponseEntity.status(HttpStatus.CONFLICT)
                    .body(Map.of("message", e.getMessage(), "sessionId", e.getSessionId()));
        }
    }

    @PostMapping("/{sessionId}/cancel")
    public ResponseEntity<?> cancel(@PathVariable String sessionId) {
        try {
            return ResponseEntity.ok(buildDispatcherService.cancel(sessionId));
        } catch (SessionNotFoundException e) {
            return notFound(e);
        }
    }

    @GetMapping
    public ResponseEntity<List<BuildSessionSnapshot>> list() {
        return ResponseEntity.ok(buildDispatcherService.listSessions());
    }

    @GetMapping("/{sessionId}")
    public ResponseEntity<?> get(@PathVariable String sessionId) {
        try {
            return ResponseEntity.ok(buildDispatcherService.getSession(sessionId));
        } catch (SessionNotFoundException e) {
            return notFound(e);
        }
    }

    /**
     * 轮询事件。
     *
     * @param from 从该下标开始返回，客户端传入已收到的事件数量即可增量获取。
     */
    @GetMapping("/{sessionId}/events")
    public ResponseEntity<?> events(@PathVariable String sessionId, @RequestParam(defaultValue = "0") int from) {
        try {
            List<OutputEvent> events = buildDispatcherService.events(sessionId, from);
            return ResponseEntity.ok(events);
        } catch (SessionNotFoundException e) {
            return notFound(e);
        }
    }

    @DeleteMapping("/{sessionId}")
    public ResponseEntity<?> delete(@PathVariable String sessionId) {
        try {
            buildDispatcherService.clearSession(sessionId);
            return ResponseEntity.ok(Map.of("message", "会话已清除。"));
        } catch (SessionNotFoundException e) {
            return notFound(e);
        } catch (SessionBusyException e) {
            return ResponseEntity.status(HttpStatus.CONFLICT).body(Map.of("message", e.getMessage()));
        }
    }

    /** 清除所有已结束的会话。 */
    @DeleteMapping
    public ResponseEntity<Map<String, Object>> clearFinished() {
        int removed = buildDispatcherService.clearFinished();
        return ResponseEntity.ok(Map.of("message", "已清除 " + removed + " 个已结束的会话。", "removed", removed));
    }

    private static ResponseEntity<Map<String, String>> notFound(SessionNotFoundException e) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(Map.of("message", e.getMessage()));
    }
}
