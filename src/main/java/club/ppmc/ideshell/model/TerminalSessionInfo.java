/**
 * TerminalSessionInfo.java
 *
 * 终端会话的只读视图，用于 REST 响应。
 */
package club.ppmc.ideshell.model;

public record TerminalSessionInfo(
        String id, String workingDirectory, boolean active, boolean busy, long createdAt, int historySize) {}
