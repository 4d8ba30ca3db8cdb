/**
 * TerminalController.java
 *
 * 该控制器处理与终端会话的交互。
 * REST 端点负责会话的创建、关闭、命令执行、历史、书签和记录保存；
 * 同时监听来自客户端的 STOMP 消息，使前端可以通过 WebSocket 直接提交命令，输出经 /topic/terminal/{id} 推送。
 */
package club.ppmc.ideshell.controller;

import club.ppmc.ideshell.exception.SessionBusyException;
import club.ppmc.ideshell.exception.SessionNotFoundException;
import club.ppmc.ideshell.model.BookmarkRequest;
import club.ppmc.ideshell.model.CreateTerminalSessionRequest;
import club.ppmc.ideshell.model.TerminalCommandExecution;
import club.ppmc.ideshell.model.TerminalCommandRequest;
import club.ppmc.ideshell.model.TerminalSessionInfo;
import club.ppmc.ideshell.service.TerminalSessionService;
import jakarta.validation.Valid;
import java.io.IOException;
import java.nio.file.Path;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.lang.Nullable;
import org.springframework.messaging.handler.annotation.MessageMapping;
import org.springframework.messaging.handler.annotation.Payload;
import org.springframework.messaging.simp.SimpMessageHeaderAccessor;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/terminal/sessions")
@Slf4j
public class TerminalController {

    private final TerminalSessionService terminalSessionService;

    public TerminalController(TerminalSessionService terminalSessionService) {
        this.terminalSessionService = terminalSessionService;
    }

    @PostMapping
    public ResponseEntity<?> create(@RequestBody(required = false) @Nullable CreateTerminalSessionRequest request) {
        String workingDirectory = request != null ? request.workingDirectory() : null;
        Map<String, String> environment = request != null ? request.environment() : null;
        try {
            TerminalSessionInfo info = terminalSessionService.createSession(workingDirectory, environment);
            return ResponseEntity.status(HttpStatus.CREATED).body(info);
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(Map.of("message", e.getMessage()));
        }
    }

    @GetMapping
    public ResponseEntity<List<TerminalSessionInfo>> list() {
        return ResponseEntity.ok(terminalSessionService.listSessions());
    }

    @GetMapping("/{sessionId}")
    public ResponseEntity<?> get(@PathVariable String sessionId) {
        return handle(() -> terminalSessionService.getSession(sessionId));
    }

    @DeleteMapping("/{sessionId}")
    public ResponseEntity<?> close(@PathVariable String sessionId) {
        return handle(() -> {
            terminalSessionService.closeSession(sessionId);
            return Map.of("message", "终端会话已关闭。");
        });
    }

    /**
     * 在会话中执行一条命令。命令在后台运行，返回其执行记录；输出通过 WebSocket 推送。
     */
    @PostMapping("/{sessionId}/commands")
    public ResponseEntity<?> execute(@PathVariable String sessionId, @Valid @RequestBody TerminalCommandRequest request) {
        return handle(() -> terminalSessionService.execute(sessionId, request.command()).execution());
    }

    @PostMapping("/{sessionId}/stop")
    public ResponseEntity<?> stop(@PathVariable String sessionId) {
        return handle(() -> Map.of("stopped", terminalSessionService.stop(sessionId)));
    }

    @GetMapping("/{sessionId}/history")
    public ResponseEntity<?> history(@PathVariable String sessionId) {
        return handle(() -> terminalSessionService.history(sessionId));
    }

    /**
     * 历史导航。direction 为 previous 或 next，返回的 command 为 null 表示回到空白输入。
     */
    @GetMapping("/{sessionId}/history/{direction}")
    public ResponseEntity<?> navigateHistory(@PathVariable String sessionId, @PathVariable String direction) {
        return handle(() -> {
            var command = switch (direction) {
                case "previous" -> terminalSessionService.previousCommand(sessionId);
                case "next" -> terminalSessionService.nextCommand(sessionId);
                default -> throw new IllegalArgumentException("未知的方向: " + direction);
            };
            return Collections.singletonMap("command", command.orElse(null));
        });
    }

    @GetMapping("/{sessionId}/transcript")
    public ResponseEntity<?> transcript(@PathVariable String sessionId) {
        return handle(() -> terminalSessionService.transcript(sessionId));
    }

    @PostMapping("/{sessionId}/transcript")
    public ResponseEntity<?> saveTranscript(
            @PathVariable String sessionId, @RequestParam(required = false) String fileName) {
        try {
            Path file = terminalSessionService.saveTranscript(sessionId, fileName);
            return ResponseEntity.ok(Map.of("message", "终端记录已保存。", "path", file.toString()));
        } catch (SessionNotFoundException e) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body(Map.of("message", e.getMessage()));
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(Map.of("message", e.getMessage()));
        } catch (IOException e) {
            log.error("保存终端记录失败", e);
            return ResponseEntity.internalServerError()
                    .body(Map.of("message", "保存终端记录失败: " + e.getMessage()));
        }
    }

    @PostMapping("/{sessionId}/bookmarks")
    public ResponseEntity<?> bookmark(@PathVariable String sessionId, @Valid @RequestBody BookmarkRequest request) {
        return handle(() -> terminalSessionService.bookmark(
                sessionId, request.command(), request.description(), request.tags()));
    }

    @PostMapping("/{sessionId}/bookmarks/{bookmarkId}/run")
    public ResponseEntity<?> runBookmark(@PathVariable String sessionId, @PathVariable String bookmarkId) {
        return handle(() -> terminalSessionService.runBookmark(sessionId, bookmarkId).execution());
    }

    @GetMapping("/bookmarks")
    public ResponseEntity<?> listBookmarks() {
        return ResponseEntity.ok(terminalSessionService.listBookmarks());
    }

    @DeleteMapping("/bookmarks/{bookmarkId}")
    public ResponseEntity<?> removeBookmark(@PathVariable String bookmarkId) {
        if (!terminalSessionService.removeBookmark(bookmarkId)) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body(Map.of("message", "书签不存在: " + bookmarkId));
        }
        return ResponseEntity.ok(Map.of("message", "书签已删除。"));
    }

    @GetMapping("/history/recent")
    public ResponseEntity<?> recentHistory(@RequestParam(defaultValue = "50") int limit) {
        return ResponseEntity.ok(terminalSessionService.recentHistory(limit));
    }

    /**
     * 处理从前端通过 STOMP 提交的命令。
     * 未指定 sessionId 时为当前 WebSocket 连接创建一个新会话，连接断开时该会话会被关闭。
     *
     * @param request 包含会话ID和命令文本。
     * @param headerAccessor 消息头访问器，用于获取 WebSocket 会话ID。
     */
    @MessageMapping("/terminal/execute")
    public void executeOverWebSocket(@Payload TerminalCommandRequest request, SimpMessageHeaderAccessor headerAccessor) {
        String sessionId = request.sessionId();
        try {
            if (sessionId == null || sessionId.isBlank()) {
                sessionId = terminalSessionService
                        .createSession(null, null, headerAccessor.getSessionId())
                        .id();
                log.info("为 WebSocket 连接 {} 创建了终端会话 {}", headerAccessor.getSessionId(), sessionId);
            }
            TerminalCommandExecution execution = terminalSessionService.execute(sessionId, request.command()).execution();
            log.debug("已通过 WebSocket 提交终端命令 {}: {}", execution.id(), execution.command());
        } catch (SessionBusyException | SessionNotFoundException | IllegalArgumentException e) {
            // STOMP 消息没有响应体，拒绝原因只记录在日志中
            log.warn("终端会话 {} 的命令被拒绝: {}", sessionId, e.getMessage());
        }
    }

    private static ResponseEntity<?> handle(Supplier<?> action) {
        try {
            return ResponseEntity.ok(action.get());
        } catch (SessionNotFoundException e) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body(Map.of("message", e.getMessage()));
        } catch (SessionBusyException e) {
            return ResponseEntity.status(HttpStatus.CONFLICT).body(Map.of("message", e.getMessage()));
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(Map.of("message", e.getMessage()));
        }
    }
}
