/**
 * TerminalSession.java
 *
 * 一个交互式终端会话：当前工作目录、环境变量、命令历史、输出记录，以及最多一个存活的前台进程。
 * 会话由 TerminalSessionService 创建和修改；"同一时刻只有一个前台命令"通过 busy 标志的 CAS 保证。
 */
package club.ppmc.ideshell.model;

import club.ppmc.ideshell.util.EnvironmentOverrides;
import club.ppmc.ideshell.util.ManagedProcess;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;
import lombok.Getter;

public final class TerminalSession {

    @Getter private final String id;
    @Getter private final long createdAt;
    @Getter private final CommandHistory history = new CommandHistory();
    /** 通过 STOMP 创建的会话记录其 WebSocket 会话ID，连接断开时一并关闭；REST 创建的会话为 null。 */
    @Getter private final String ownerId;

    private final Map<String, String> environment;
    private final List<OutputEvent> transcript = new ArrayList<>();
    private final AtomicBoolean busy = new AtomicBoolean(false);

    private volatile Path workingDirectory;
    private volatile boolean active = true;
    private ManagedProcess activeProcess;
    private boolean stopRequested;

    public TerminalSession(String id, Path workingDirectory, Map<String, String> environment, String ownerId) {
        this.id = id;
        this.ownerId = ownerId;
        this.createdAt = System.currentTimeMillis();
        this.workingDirectory = workingDirectory;
        this.environment = new HashMap<>(EnvironmentOverrides.copyOf(environment));
        this.environment.put("PWD", workingDirectory.toString());
    }

    public Path getWorkingDirectory() {
        return workingDirectory;
    }

    /** 切换工作目录并同步 PWD 环境变量。 */
    public synchronized void changeDirectory(Path directory) {
        this.workingDirectory = directory;
        environment.put("PWD", directory.toString());
    }

    public synchronized Map<String, String> environment() {
        return Map.copyOf(environment);
    }

    public synchronized String getenv(String name) {
        return environment.get(name);
    }

    public boolean isActive() {
        return active;
    }

    public boolean isBusy() {
        return busy.get();
    }

    /**
     * 尝试占用会话执行一条命令。
     *
     * @return 会话已关闭或已有命令在执行时返回 false。
     */
    public synchronized boolean tryAcquire() {
        if (!active || !busy.compareAndSet(false, true)) {
            return false;
        }
        stopRequested = false;
        return true;
    }

    public synchronized void release() {
        activeProcess = null;
        busy.set(false);
    }

    /**
     * @return 停止请求已经到达或会话已关闭时返回 false，调用方需要自行终止该进程。
     */
    public synchronized boolean attach(ManagedProcess process) {
        if (stopRequested || !active) {
            return false;
        }
        this.activeProcess = process;
        return true;
    }

    /**
     * 请求停止当前命令。
     *
     * @return 当前存活的进程，没有时为 null。
     */
    public synchronized ManagedProcess requestStop() {
        if (!busy.get()) {
            return null;
        }
        stopRequested = true;
        return activeProcess;
    }

    public synchronized boolean isStopRequested() {
        return stopRequested;
    }

    /**
     * 关闭会话，之后不再接受新命令。
     *
     * @return 需要终止的存活进程，没有时为 null。
     */
    public synchronized ManagedProcess close() {
        active = false;
        stopRequested = true;
        return activeProcess;
    }

    public synchronized void record(OutputEvent event) {
        transcript.add(event);
    }

    public synchronized void clearTranscript() {
        transcript.clear();
    }

    public synchronized List<OutputEvent> transcript() {
        return List.copyOf(transcript);
    }

    public TerminalSessionInfo info() {
        return new TerminalSessionInfo(id, workingDirectory.toString(), active, busy.get(), createdAt, history.size());
    }
}
