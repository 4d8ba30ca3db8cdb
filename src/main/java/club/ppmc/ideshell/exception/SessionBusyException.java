/**
 * SessionBusyException.java
 *
 * 会话中已有一个存活的进程时，新的操作会被直接拒绝而不是排队，此时抛出该异常。
 */
package club.ppmc.ideshell.exception;

import lombok.Getter;

@Getter
public class SessionBusyException extends RuntimeException {

    /** 正在占用的会话 ID。 */
    private final String sessionId;

    public SessionBusyException(String sessionId, String message) {
        super(message);
        this.sessionId = sessionId;
    }
}
