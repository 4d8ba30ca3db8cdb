/**
 * SessionNotFoundException.java
 *
 * 请求的构建会话、终端会话或书签不存在。
 */
package club.ppmc.ideshell.exception;

import lombok.Getter;

@Getter
public class SessionNotFoundException extends RuntimeException {

    private final String sessionId;

    public SessionNotFoundException(String sessionId) {
        super("会话不存在: " + sessionId);
        this.sessionId = sessionId;
    }

    public SessionNotFoundException(String sessionId, String message) {
        super(message);
        this.sessionId = sessionId;
    }
}
