/**
 * WebSocketNotificationService.java
 *
 * 一个统一的WebSocket消息发送服务。
 * 该服务为应用提供一个单一、清晰的WebSocket通信出口，封装了 SimpMessagingTemplate 的使用细节。
 * 它负责将构建事件、构建状态和终端事件用 Gson 序列化后发送到前端对应的WebSocket主题(topic)上。
 */
package club.ppmc.ideshell.service;

import club.ppmc.ideshell.model.BuildSessionSnapshot;
import club.ppmc.ideshell.model.OutputEvent;
import club.ppmc.ideshell.model.TerminalCommandExecution;
import com.google.gson.Gson;
import lombok.extern.slf4j.Slf4j;
import org.springframework.messaging.MessagingException;
import org.springframework.messaging.simp.SimpMessagingTemplate;
import org.springframework.stereotype.Service;

@Service
@Slf4j
public class WebSocketNotificationService {

    private final SimpMessagingTemplate messagingTemplate;
    private final Gson gson;

    public WebSocketNotificationService(SimpMessagingTemplate messagingTemplate, Gson gson) {
        this.messagingTemplate = messagingTemplate;
        this.gson = gson;
    }

    /**
     * 发送一个构建事件到该会话的主题。
     * @param sessionId 构建会话ID。
     * @param event 已分类的输出事件。
     */
    public void sendBuildEvent(String sessionId, OutputEvent event) {
        sendMessage(String.format("/topic/build/%s", sessionId), gson.toJson(event));
    }

    /**
     * 发送构建会话的状态快照。
     */
    public void sendBuildStatus(BuildSessionSnapshot snapshot) {
        sendMessage(String.format("/topic/build/%s/status", snapshot.id()), gson.toJson(snapshot));
    }

    /**
     * 发送终端事件到特定终端会话的前端。
     * @param sessionId 终端会话ID。
     * @param event 终端输出事件。
     */
    public void sendTerminalEvent(String sessionId, OutputEvent event) {
        // 为每个终端会话创建一个唯一的topic
        sendMessage(String.format("/topic/terminal/%s", sessionId), gson.toJson(event));
    }

    /**
     * 终端命令结束时发送其最终状态。
     */
    public void sendTerminalStatus(String sessionId, TerminalCommandExecution execution) {
        sendMessage(String.format("/topic/terminal/%s/status", sessionId), gson.toJson(execution));
    }

    /**
     * 向指定的WebSocket主题发送一个通用载荷(payload)。
     * 推送失败只记录日志：事件已经保存在会话中，客户端可以通过 REST 接口补取。
     *
     * @param destination 目标WebSocket主题 (例如, "/topic/some-status")
     * @param payload 要发送的任何对象 (将被框架自动序列化为JSON)
     */
    public void sendMessage(String destination, Object payload) {
        try {
            messagingTemplate.convertAndSend(destination, payload);
        } catch (MessagingException e) {
            log.warn("向 {} 推送消息失败: {}", destination, e.getMessage());
        }
    }
}
