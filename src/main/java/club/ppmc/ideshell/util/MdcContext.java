/**
 * MdcContext.java
 *
 * 管理日志 MDC 中与会话相关的键，使工作线程上的日志带上构建会话或终端会话的 ID。
 */
package club.ppmc.ideshell.util;

import org.slf4j.MDC;

public final class MdcContext {

    public static final String BUILD_SESSION_ID = "buildSessionId";
    public static final String TERMINAL_SESSION_ID = "terminalSessionId";

    private MdcContext() {}

    public static void setBuildSession(String sessionId) {
        MDC.put(BUILD_SESSION_ID, sessionId);
    }

    public static void setTerminalSession(String sessionId) {
        MDC.put(TERMINAL_SESSION_ID, sessionId);
    }

    public static void clear() {
        MDC.remove(BUILD_SESSION_ID);
        MDC.remove(TERMINAL_SESSION_ID);
    }
}
