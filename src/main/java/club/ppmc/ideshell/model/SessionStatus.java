/**
 * SessionStatus.java
 *
 * 构建会话与终端命令共用的状态机: IDLE -> RUNNING -> {SUCCEEDED | FAILED | CANCELLED}。
 */
package club.ppmc.ideshell.model;

public enum SessionStatus {
    IDLE,
    RUNNING,
    SUCCEEDED,
    FAILED,
    CANCELLED;

    public boolean isTerminal() {
        return this == SUCCEEDED || this == FAILED || this == CANCELLED;
    }
}
