/**
 * WebSocketConfig.java
 *
 * 配置Spring WebSocket和STOMP消息代理。
 * 该类负责定义WebSocket端点，配置消息代理（broker），并设置心跳机制以保持连接稳定。
 * 构建事件推送到 /topic/build/{id}，终端事件推送到 /topic/terminal/{id}；
 * 客户端通过 /app/terminal/execute 发送终端命令。
 */
package club.ppmc.ideshell.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;
import org.springframework.messaging.simp.config.MessageBrokerRegistry;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;
import org.springframework.web.socket.config.annotation.EnableWebSocketMessageBroker;
import org.springframework.web.socket.config.annotation.StompEndpointRegistry;
import org.springframework.web.socket.config.annotation.WebSocketMessageBrokerConfigurer;

@Configuration
@EnableWebSocketMessageBroker
public class WebSocketConfig implements WebSocketMessageBrokerConfigurer {

    private final String[] allowedOriginPatterns;

    public WebSocketConfig(@Value("${app.cors.allowed-origin-patterns:*}") String[] allowedOriginPatterns) {
        this.allowedOriginPatterns = allowedOriginPatterns;
    }

    /**
     * 配置消息代理（Message Broker）。
     *
     * <p>`/topic` 用于广播构建和终端事件；`/app` 是客户端发送消息到 @MessageMapping 方法的前缀。
     * STOMP 心跳为 10 秒发送、10 秒接收。</p>
     */
    @Override
    public void configureMessageBroker(MessageBrokerRegistry config) {
        var taskScheduler = new ThreadPoolTaskScheduler();
        taskScheduler.setPoolSize(1);
        taskScheduler.setThreadNamePrefix("ws-heartbeat-thread-");
        taskScheduler.initialize();

        config.enableSimpleBroker("/topic")
                .setHeartbeatValue(new long[] {10000, 10000}) // 10秒心跳
                .setTaskScheduler(taskScheduler);
        config.setApplicationDestinationPrefixes("/app");
    }

    /**
     * 注册STOMP端点 `/ws`，并启用 SockJS 回退。
     * SockJS 每隔25秒发送一个心跳帧，防止反向代理因连接长时间空闲而将其关闭。
     */
    @Override
    public void registerStompEndpoints(StompEndpointRegistry registry) {
        registry
                .addEndpoint("/ws")
                .setAllowedOriginPatterns(allowedOriginPatterns)
                .withSockJS()
                .setHeartbeatTime(25000); // 传输层心跳，防止代理超时
    }
}
