/**
 * ManagedProcess.java
 *
 * 对一个由 ProcessExecutor 启动的操作系统进程的不透明引用。
 * 它持有进程的 pid、启动时间、工作目录和参数向量，暴露合并后的行通道 (stdout 与 stderr 按到达顺序合并)
 * 以及一个在进程退出且输出被完全读取后才完成的结果 Future。
 * 只有创建它的 ProcessExecutor 会向其写入输出；任何持有者都可以调用幂等的 kill()。
 */
package club.ppmc.ideshell.util;

import club.ppmc.ideshell.model.ProcessOutcome;
import club.ppmc.ideshell.model.RawLine;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicBoolean;
import lombok.extern.slf4j.Slf4j;

@Slf4j
public final class ManagedProcess {

    private final Process process;
    private final Path workingDirectory;
    private final List<String> argv;
    private final Instant startedAt;
    private final EventStream<RawLine> lines = new EventStream<>();
    private final CompletableFuture<ProcessOutcome> outcome = new CompletableFuture<>();
    private final AtomicBoolean killed = new AtomicBoolean(false);
    private final AtomicBoolean timedOut = new AtomicBoolean(false);
    private volatile long lastOutputNanos;

    ManagedProcess(Process process, Path workingDirectory, List<String> argv) {
        this.process = process;
        this.workingDirectory = workingDirectory;
        this.argv = List.copyOf(argv);
        this.startedAt = Instant.now();
        this.lastOutputNanos = System.nanoTime();
    }

    public long pid() {
        return process.pid();
    }

    public Instant startedAt() {
        return startedAt;
    }

    public Path workingDirectory() {
        return workingDirectory;
    }

    public List<String> argv() {
        return argv;
    }

    /** 进程仍在运行，或其输出尚未被完全读取。 */
    public boolean isAlive() {
        return !outcome.isDone();
    }

    /** 合并后的输出行通道，进程结束且输出读完后自动完成。 */
    public EventStream<RawLine> lines() {
        return lines;
    }

    public CompletableFuture<ProcessOutcome> outcome() {
        return outcome;
    }

    /**
     * 强制终止进程及其所有子孙进程。对已经退出的进程调用是空操作。
     *
     * @return 本次调用是否真正发出了终止信号。
     */
    public boolean kill() {
        if (!process.isAlive()) {
            return false;
        }
        if (!killed.compareAndSet(false, true)) {
            return false;
        }
        log.info("正在终止进程 PID {}: {}", process.pid(), String.join(" ", argv));
        // 先终止子孙进程：sh -c 派生的子进程会继承输出管道，只杀父进程会让读取线程一直阻塞
        process.descendants().forEach(java.lang.ProcessHandle::destroyForcibly);
        process.destroyForcibly();
        return true;
    }

    void emit(RawLine line) {
        lastOutputNanos = System.nanoTime();
        lines.offer(line);
    }

    /** 由看门狗调用：超过空闲时限仍无输出时终止进程并标记超时。 */
    void expireIfIdle(Duration idleTimeout) {
        if (!process.isAlive() || outcome.isDone()) {
            return;
        }
        long idleNanos = System.nanoTime() - lastOutputNanos;
        if (idleNanos > idleTimeout.toNanos() && timedOut.compareAndSet(false, true)) {
            log.warn("进程 PID {} 已超过 {} 秒无输出，将被终止。", process.pid(), idleTimeout.toSeconds());
            kill();
        }
    }

    void finish(int exitCode) {
        lines.complete();
        outcome.complete(new ProcessOutcome(exitCode, timedOut.get(), killed.get()));
    }
}
