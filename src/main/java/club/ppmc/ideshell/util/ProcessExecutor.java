/**
 * ProcessExecutor.java
 *
 * 这是一个工具组件，负责以跨平台、安全的方式启动外部进程。
 * 它接受一个命令列表（而不是单个字符串）以避免因路径中存在空格而导致的解析问题。
 * 每个进程只有一个读取线程，它轮流轮询 stdout 与 stderr 两个管道，把完整的行按到达顺序合并进
 * ManagedProcess 的行通道并带上来源标记。一个看门狗定期检查空闲时间，终止长时间没有输出的进程。
 */
package club.ppmc.ideshell.util;

import club.ppmc.ideshell.exception.SpawnException;
import club.ppmc.ideshell.model.Invocation;
import club.ppmc.ideshell.model.RawLine;
import club.ppmc.ideshell.model.StreamSource;
import jakarta.annotation.PreDestroy;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.LockSupport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class ProcessExecutor {

    private static final Logger LOGGER = LoggerFactory.getLogger(ProcessExecutor.class);
    private static final Duration DEFAULT_WATCHDOG_INTERVAL = Duration.ofMillis(250);
    private static final long MIN_POLL_NANOS = TimeUnit.MICROSECONDS.toNanos(500);
    private static final long MAX_POLL_NANOS = TimeUnit.MILLISECONDS.toNanos(10);
    private static final int READ_CHUNK = 8192;

    private final ExecutorService readerPool = Executors.newCachedThreadPool(namedThreads("process-reader-"));
    private final ScheduledExecutorService watchdog =
            Executors.newSingleThreadScheduledExecutor(namedThreads("process-watchdog-"));
    private final Duration watchdogInterval;

    public ProcessExecutor() {
        this(DEFAULT_WATCHDOG_INTERVAL);
    }

    ProcessExecutor(Duration watchdogInterval) {
        this.watchdogInterval = watchdogInterval;
    }

    public ManagedProcess spawn(Invocation invocation, Duration idleTimeout) {
        return spawn(invocation.workingDirectory(), invocation.environment(), invocation.argv(), idleTimeout);
    }

    /**
     * 启动一个子进程并立即返回，输出在后台读取。
     *
     * @param workingDirectory 必须是一个已存在的目录。
     * @param environment 覆盖宿主环境的变量，未覆盖的变量继承自当前进程。
     * @param argv 参数向量，不能为空。
     * @param idleTimeout 无输出的最长时间；为 null、零或负数时不限制。
     * @return 新进程的句柄。
     * @throws SpawnException 工作目录无效或操作系统无法创建进程。
     */
    public ManagedProcess spawn(
            Path workingDirectory, Map<String, String> environment, List<String> argv, Duration idleTimeout) {
        if (argv == null || argv.isEmpty()) {
            throw new IllegalArgumentException("执行的命令不能为空。");
        }
        if (workingDirectory == null || !Files.isDirectory(workingDirectory)) {
            throw new SpawnException("工作目录不存在或不是目录: " + workingDirectory, argv, null);
        }

        LOGGER.info("在目录 {} 中执行命令: {}", workingDirectory.toAbsolutePath(), String.join(" ", argv));
        var processBuilder = new ProcessBuilder(argv).directory(workingDirectory.toFile());
        if (environment != null) {
            processBuilder.environment().putAll(environment);
        }

        Process process;
        try {
            process = processBuilder.start();
        } catch (IOException e) {
            LOGGER.error("启动命令 {} 失败", argv, e);
            throw new SpawnException("启动进程失败: " + e.getMessage(), argv, e);
        }

        var handle = new ManagedProcess(process, workingDirectory, argv);
        CompletableFuture<Void> reader = CompletableFuture.runAsync(() -> pump(process, handle), readerPool);

        ScheduledFuture<?> watch = null;
        if (idleTimeout != null && !idleTimeout.isZero() && !idleTimeout.isNegative()) {
            watch = watchdog.scheduleAtFixedRate(
                    () -> handle.expireIfIdle(idleTimeout),
                    watchdogInterval.toMillis(),
                    watchdogInterval.toMillis(),
                    TimeUnit.MILLISECONDS);
        }

        // 进程退出 并且 两个管道都读完之后才算结束，保证已缓冲的输出先于结束状态送达
        ScheduledFuture<?> finalWatch = watch;
        process.onExit()
                .thenCombine(reader, (p, v) -> p)
                .whenComplete((p, error) -> {
                    if (finalWatch != null) {
                        finalWatch.cancel(false);
                    }
                    int exitCode = process.isAlive() ? -1 : process.exitValue();
                    if (error != null) {
                        LOGGER.warn("等待进程 PID {} 结束时出错: {}", process.pid(), error.getMessage());
                    }
                    LOGGER.info("进程 PID {} 已退出，退出码: {}", process.pid(), exitCode);
                    handle.finish(exitCode);
                });
        return handle;
    }

    /**
     * 在一个线程里轮询两个管道，把完整的行按到达顺序交给 ManagedProcess。
     * 两个流都有待输出的行时逐行交替，从上一次没有输出的那个流开始；
     * 某个流暂时没有行时，先重新读取它一次，再输出另一个流的下一行。
     * 进程退出后两个管道都已无可读字节时，阻塞读取到 EOF。
     * 进程被强制终止时 JDK 会关闭两个流，此时只输出已经缓冲的内容。
     */
    private void pump(Process process, ManagedProcess handle) {
        var stdout = new LineBuffer(process.getInputStream(), StreamSource.STDOUT, handle.pid());
        var stderr = new LineBuffer(process.getErrorStream(), StreamSource.STDERR, handle.pid());
        byte[] chunk = new byte[READ_CHUNK];
        StreamSource lastEmitted = StreamSource.STDERR;
        long pollNanos = MIN_POLL_NANOS;
        while (!Thread.currentThread().isInterrupted()) {
            boolean read = stdout.fill(chunk);
            read |= stderr.fill(chunk);
            lastEmitted = interleave(stdout, stderr, lastEmitted, handle, chunk);
            if (read) {
                pollNanos = MIN_POLL_NANOS;
                continue;
            }
            if (!process.isAlive() || (stdout.isEnded() && stderr.isEnded())) {
                stdout.drainToEnd(chunk);
                stderr.drainToEnd(chunk);
                break;
            }
            LockSupport.parkNanos(pollNanos);
            // 空闲时逐步放慢轮询
            pollNanos = Math.min(pollNanos * 2, MAX_POLL_NANOS);
        }
        stdout.flushPartial();
        stderr.flushPartial();
        interleave(stdout, stderr, lastEmitted, handle, null);
    }

    /**
     * @param chunk 读取缓冲区；为 null 时不再读取管道，只输出已经缓冲的行。
     * @return 最后输出的行所属的流。
     */
    private static StreamSource interleave(
            LineBuffer stdout, LineBuffer stderr, StreamSource lastEmitted, ManagedProcess handle, byte[] chunk) {
        StreamSource last = lastEmitted;
        while (true) {
            LineBuffer preferred = last == StreamSource.STDOUT ? stderr : stdout;
            LineBuffer other = preferred == stdout ? stderr : stdout;
            if (!preferred.hasLines() && other.hasLines() && chunk != null) {
                preferred.fill(chunk);
            }
            LineBuffer next = preferred.hasLines() ? preferred : other;
            if (!next.hasLines()) {
                return last;
            }
            handle.emit(next.takeLine());
            last = next.source;
        }
    }

    /** 一个管道的读取状态：未读完的半行字节和已经完整的行。 */
    private static final class LineBuffer {

        private final InputStream stream;
        private final StreamSource source;
        private final long pid;
        private final ByteArrayOutputStream partial = new ByteArrayOutputStream();
        private final Deque<RawLine> lines = new ArrayDeque<>();
        private boolean ended;

        LineBuffer(InputStream stream, StreamSource source, long pid) {
            this.stream = stream;
            this.source = source;
            this.pid = pid;
        }

        /**
         * 只读取当前已经可读的字节，不阻塞。
         *
         * @return 是否读到了新的字节。
         */
        boolean fill(byte[] chunk) {
            if (ended) {
                return false;
            }
            try {
                int available = stream.available();
                if (available <= 0) {
                    return false;
                }
                int count = stream.read(chunk, 0, Math.min(available, chunk.length));
                if (count < 0) {
                    end();
                    return false;
                }
                accept(chunk, count);
                return count > 0;
            } catch (IOException e) {
                closed(e);
                return false;
            }
        }

        void drainToEnd(byte[] chunk) {
            try {
                int count;
                while (!ended && (count = stream.read(chunk)) != -1) {
                    accept(chunk, count);
                }
                end();
            } catch (IOException e) {
                closed(e);
            }
        }

        boolean isEnded() {
            return ended;
        }

        private void closed(IOException e) {
            // 进程被强制终止时读取流会被关闭，这是正常现象
            LOGGER.debug("读取进程 PID {} 的 {} 时出错: {}", pid, source, e.getMessage());
            end();
        }

        private void end() {
            ended = true;
            flushPartial();
        }

        private void accept(byte[] chunk, int count) {
            for (int i = 0; i < count; i++) {
                if (chunk[i] == '\n') {
                    completeLine();
                } else {
                    partial.write(chunk[i]);
                }
            }
        }

        void flushPartial() {
            if (partial.size() > 0) {
                completeLine();
            }
        }

        private void completeLine() {
            String text = partial.toString(StandardCharsets.UTF_8);
            if (text.endsWith("\r")) {
                text = text.substring(0, text.length() - 1);
            }
            lines.add(new RawLine(source, text));
            partial.reset();
        }

        boolean hasLines() {
            return !lines.isEmpty();
        }

        RawLine takeLine() {
            return lines.poll();
        }
    }

    private static ThreadFactory namedThreads(String prefix) {
        var counter = new AtomicInteger();
        return runnable -> {
            var thread = new Thread(runnable, prefix + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }

    @PreDestroy
    public void shutdown() {
        LOGGER.info("正在关闭 ProcessExecutor...");
        watchdog.shutdownNow();
        readerPool.shutdownNow();
    }
}
