/**
 * TerminalCommandExecution.java
 *
 * 终端中执行的一条命令的状态。命令结束后会产生一个带最终状态和退出码的新实例。
 */
package club.ppmc.ideshell.model;

/**
 * @param id 执行ID。
 * @param sessionId 所属终端会话。
 * @param command 用户输入的原始命令文本。
 * @param builtIn 是否为内置命令 (clear、cd、help)，内置命令不启动进程。
 * @param status 当前状态。
 * @param exitCode 进程退出码；内置命令、未启动或被取消时为 null。
 * @param startedAt 开始时间 (epoch 毫秒)。
 * @param completedAt 结束时间，未结束时为 null。
 */
public record TerminalCommandExecution(
        String id,
        String sessionId,
        String command,
        boolean builtIn,
        SessionStatus status,
        Integer exitCode,
        long startedAt,
        Long completedAt) {

    public static TerminalCommandExecution started(String id, String sessionId, String command, boolean builtIn) {
        return new TerminalCommandExecution(
                id, sessionId, command, builtIn, SessionStatus.RUNNING, null, System.currentTimeMillis(), null);
    }

    public TerminalCommandExecution finish(SessionStatus finalStatus, Integer finalExitCode) {
        return new TerminalCommandExecution(
                id, sessionId, command, builtIn, finalStatus, finalExitCode, startedAt, System.currentTimeMillis());
    }
}
