/**
 * ProcessOutcome.java
 *
 * 子进程结束后的结果。只有在进程退出且两个输出流均被完整读取之后才会产生。
 */
package club.ppmc.ideshell.model;

/**
 * @param exitCode 进程退出码。
 * @param timedOut 是否因长时间无输出被看门狗终止。
 * @param killed 是否被 kill() 主动终止 (包括超时)。
 */
public record ProcessOutcome(int exitCode, boolean timedOut, boolean killed) {

    public boolean isCleanExit() {
        return exitCode == 0 && !killed;
    }
}
