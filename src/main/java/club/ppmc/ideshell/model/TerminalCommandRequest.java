/**
 * TerminalCommandRequest.java
 *
 * 终端命令请求，REST 端点和 STOMP 的 /app/terminal/execute 共用。
 * 通过 REST 提交时 sessionId 来自路径，请求体中的值会被忽略。
 */
package club.ppmc.ideshell.model;

import jakarta.validation.constraints.NotBlank;

public record TerminalCommandRequest(String sessionId, @NotBlank String command) {}
