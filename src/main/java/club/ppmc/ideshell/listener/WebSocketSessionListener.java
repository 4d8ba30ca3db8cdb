/**
 * WebSocketSessionListener.java
 *
 * 这是一个Spring事件监听器，负责处理WebSocket的连接和断开事件。
 * 客户端断开连接（无论是正常关闭还是意外掉线）时，关闭该连接创建的终端会话并终止其中的进程，
 * 避免后台残留无人接收输出的进程。
 */
package club.ppmc.ideshell.listener;

import club.ppmc.ideshell.service.TerminalSessionService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.messaging.SessionConnectedEvent;
import org.springframework.web.socket.messaging.SessionDisconnectEvent;

@Component
@Slf4j
public class WebSocketSessionListener {

    private final TerminalSessionService terminalSessionService;

    public WebSocketSessionListener(TerminalSessionService terminalSessionService) {
        this.terminalSessionService = terminalSessionService;
    }

    @EventListener
    public void handleWebSocketConnectListener(SessionConnectedEvent event) {
        log.debug("接收到新的 WebSocket 连接: {}", event.getMessage().getHeaders().get("simpSessionId"));
    }

    /**
     * 监听 WebSocket 连接断开事件。
     */
    @EventListener
    public void handleWebSocketDisconnectListener(SessionDisconnectEvent event) {
        String sessionId = event.getSessionId();
        if (sessionId != null) {
            int closed = terminalSessionService.closeSessionsOwnedBy(sessionId);
            log.info("WebSocket 连接断开，会话 ID: {}，已关闭 {} 个终端会话。", sessionId, closed);
        }
    }
}
