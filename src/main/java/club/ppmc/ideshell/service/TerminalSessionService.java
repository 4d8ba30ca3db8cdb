/**
 * TerminalSessionService.java
 *
 * 该服务负责管理后端的交互式终端会话。每个会话有自己的工作目录、环境变量、命令历史和输出记录，
 * 同一时刻最多运行一个前台命令；命令通过配置的 shell 以 "sh -c <command>" 执行，
 * 输出使用 SHELL 规则表分类后写入该命令的事件流，并推送到 /topic/terminal/{id}。
 * clear、cd、help 是内置命令，由服务直接处理，不会启动进程。
 * 它依赖 SettingsService 来确定终端启动时的工作目录和超时时间，依赖 CommandBookmarkStore 保存历史与书签。
 */
package club.ppmc.ideshell.service;

import club.ppmc.ideshell.exception.SessionBusyException;
import club.ppmc.ideshell.exception.SessionNotFoundException;
import club.ppmc.ideshell.exception.SpawnException;
import club.ppmc.ideshell.model.BackendFamily;
import club.ppmc.ideshell.model.BookmarkedCommand;
import club.ppmc.ideshell.model.CommandHistoryEntry;
import club.ppmc.ideshell.model.OutputEvent;
import club.ppmc.ideshell.model.ProcessOutcome;
import club.ppmc.ideshell.model.RawLine;
import club.ppmc.ideshell.model.SessionStatus;
import club.ppmc.ideshell.model.TerminalCommandExecution;
import club.ppmc.ideshell.model.TerminalCommandResult;
import club.ppmc.ideshell.model.TerminalSession;
import club.ppmc.ideshell.model.TerminalSessionInfo;
import club.ppmc.ideshell.service.classify.OutputClassifier;
import club.ppmc.ideshell.service.store.CommandBookmarkStore;
import club.ppmc.ideshell.util.EventStream;
import club.ppmc.ideshell.util.ManagedProcess;
import club.ppmc.ideshell.util.MdcContext;
import club.ppmc.ideshell.util.ProcessExecutor;
import club.ppmc.ideshell.util.TranscriptWriter;
import jakarta.annotation.PreDestroy;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

@Service
@Slf4j
public class TerminalSessionService {

    /** 这些命令会长时间运行且可能长时间没有输出，不受空闲超时限制。 */
    static final List<String> LONG_RUNNING_PREFIXES = List.of(
            "top", "htop", "tail -f", "tail -F", "ping", "logcat", "adb logcat", "watch", "journalctl -f", "dmesg -w");

    private static final List<String> HELP_LINES = List.of(
            "内置命令:",
            "  clear        清空终端输出",
            "  cd [目录]    切换工作目录，省略参数时回到 HOME",
            "  help         显示本帮助",
            "其他命令会通过 shell 执行，例如: ls, git status, cargo build, ./gradlew assembleDebug");

    private final ProcessExecutor processExecutor;
    private final OutputClassifier classifier;
    private final SettingsService settingsService;
    private final CommandBookmarkStore bookmarkStore;
    private final WebSocketNotificationService notificationService;
    private final ExecutorService executorService = Executors.newCachedThreadPool();
    private final Map<String, TerminalSession> sessions = new ConcurrentHashMap<>();

    public TerminalSessionService(
            ProcessExecutor processExecutor,
            OutputClassifier classifier,
            SettingsService settingsService,
            CommandBookmarkStore bookmarkStore,
            WebSocketNotificationService notificationService) {
        this.processExecutor = processExecutor;
        this.classifier = classifier;
        this.settingsService = settingsService;
        this.bookmarkStore = bookmarkStore;
        this.notificationService = notificationService;
    }

    /**
     * 创建一个新的终端会话。
     *
     * @param workingDirectory 初始工作目录，相对路径基于工作区根目录解析；为空时使用工作区根目录。
     * @param environment 覆盖宿主环境的变量，可以为 null。
     */
    public TerminalSessionInfo createSession(String workingDirectory, Map<String, String> environment) {
        return createSession(workingDirectory, environment, null);
    }

    /**
     * 创建一个属于某个 WebSocket 连接的终端会话，连接断开时会话会被关闭。
     */
    public TerminalSessionInfo createSession(String workingDirectory, Map<String, String> environment, String ownerId) {
        Path workspaceRoot = settingsService.getWorkspaceRoot();
        Path directory;
        if (StringUtils.hasText(workingDirectory)) {
            Path requested = Paths.get(workingDirectory.trim());
            directory = (requested.isAbsolute() ? requested : workspaceRoot.resolve(requested)).normalize();
            if (!Files.isDirectory(directory)) {
                throw new IllegalArgumentException("目录未找到: " + workingDirectory);
            }
        } else {
            directory = workspaceRoot;
            try {
                Files.createDirectories(directory);
            } catch (IOException e) {
                throw new UncheckedIOException("无法创建工作区目录: " + directory, e);
            }
        }

        var session = new TerminalSession(
                UUID.randomUUID().toString(), directory, environment == null ? Map.of() : environment, ownerId);
        sessions.put(session.getId(), session);
        log.info("已在目录 {} 中创建终端会话 {}", directory, session.getId());
        return session.info();
    }

    /** 关闭会话并终止其中正在运行的命令。 */
    public void closeSession(String sessionId) {
        TerminalSession session = sessions.remove(sessionId);
        if (session == null) {
            throw new SessionNotFoundException(sessionId);
        }
        log.info("正在关闭终端会话 {}。", sessionId);
        ManagedProcess process = session.close();
        if (process != null) {
            process.kill();
        }
    }

    /**
     * 关闭某个 WebSocket 连接创建的所有终端会话。
     *
     * @return 被关闭的会话数量。
     */
    public int closeSessionsOwnedBy(String ownerId) {
        List<String> owned = sessions.values().stream()
                .filter(session -> ownerId.equals(session.getOwnerId()))
                .map(TerminalSession::getId)
                .toList();
        owned.forEach(this::closeQuietly);
        return owned.size();
    }

    private void closeQuietly(String sessionId) {
        TerminalSession session = sessions.remove(sessionId);
        if (session != null) {
            ManagedProcess process = session.close();
            if (process != null) {
                process.kill();
            }
        }
    }

    public TerminalSessionInfo getSession(String sessionId) {
        return require(sessionId).info();
    }

    public List<TerminalSessionInfo> listSessions() {
        return sessions.values().stream()
                .sorted(Comparator.comparingLong(TerminalSession::getCreatedAt))
                .map(TerminalSession::info)
                .toList();
    }

    /**
     * 在会话中执行一条命令。内置命令同步完成，其他命令在后台运行，调用立即返回。
     *
     * @throws SessionBusyException 会话中已有命令在运行。
     * @throws SessionNotFoundException 会话不存在。
     */
    public TerminalCommandResult execute(String sessionId, String commandText) {
        TerminalSession session = require(sessionId);
        String command = commandText == null ? "" : commandText.trim();
        if (command.isEmpty()) {
            throw new IllegalArgumentException("命令不能为空。");
        }
        if (!session.tryAcquire()) {
            throw new SessionBusyException(sessionId, "终端会话中已有命令正在运行: " + sessionId);
        }

        Optional<BuiltIn> builtIn = BuiltIn.parse(command);
        var execution = TerminalCommandExecution.started(
                UUID.randomUUID().toString(), sessionId, command, builtIn.isPresent());
        var stream = new EventStream<OutputEvent>();
        var completion = new CompletableFuture<TerminalCommandExecution>();

        if (builtIn.isPresent()) {
            SessionStatus status = SessionStatus.FAILED;
            try {
                status = runBuiltIn(session, builtIn.get(), stream);
            } finally {
                complete(session, execution.finish(status, null), stream, completion);
            }
            return new TerminalCommandResult(execution, stream, completion);
        }

        session.getHistory().add(command);
        recordHistory(session, command);
        try {
            executorService.submit(() -> runCommand(session, execution, stream, completion));
        } catch (RuntimeException e) {
            complete(session, execution.finish(SessionStatus.FAILED, null), stream, completion);
            throw e;
        }
        return new TerminalCommandResult(execution, stream, completion);
    }

    /**
     * 终止会话中正在运行的命令，该命令的最终状态为 CANCELLED。
     *
     * @return 是否有命令正在运行。
     */
    public boolean stop(String sessionId) {
        TerminalSession session = require(sessionId);
        if (!session.isBusy()) {
            return false;
        }
        ManagedProcess process = session.requestStop();
        if (process != null) {
            log.info("正在终止终端会话 {} 中的进程 PID {}", sessionId, process.pid());
            process.kill();
        }
        return true;
    }

    public List<String> history(String sessionId) {
        return require(sessionId).getHistory().entries();
    }

    public Optional<String> previousCommand(String sessionId) {
        return require(sessionId).getHistory().previous();
    }

    public Optional<String> nextCommand(String sessionId) {
        return require(sessionId).getHistory().next();
    }

    public List<OutputEvent> transcript(String sessionId) {
        return require(sessionId).transcript();
    }

    public BookmarkedCommand bookmark(String sessionId, String command, String description, List<String> tags) {
        require(sessionId);
        return bookmarkStore.addBookmark(command, description, tags);
    }

    public List<BookmarkedCommand> listBookmarks() {
        return bookmarkStore.listBookmarks();
    }

    public boolean removeBookmark(String bookmarkId) {
        return bookmarkStore.removeBookmark(bookmarkId);
    }

    public List<CommandHistoryEntry> recentHistory(int limit) {
        return bookmarkStore.recentHistory(limit);
    }

    /**
     * 回放一个书签。只有会话接受了命令，书签的使用次数才会增加。
     *
     * @throws SessionNotFoundException 会话或书签不存在。
     * @throws SessionBusyException 会话中已有命令在运行，此时使用次数不变。
     */
    public TerminalCommandResult runBookmark(String sessionId, String bookmarkId) {
        require(sessionId);
        BookmarkedCommand bookmark = bookmarkStore.findBookmark(bookmarkId)
                .orElseThrow(() -> new SessionNotFoundException(bookmarkId, "书签不存在: " + bookmarkId));
        TerminalCommandResult result = execute(sessionId, bookmark.getCommand());
        bookmarkStore.recordBookmarkUse(bookmarkId);
        return result;
    }

    /**
     * 把会话的输出记录保存到终端日志目录。
     *
     * @param fileName 文件名，为空时使用 terminal_yyyyMMdd_HHmmss.txt。
     * @return 写入的文件路径。
     */
    public Path saveTranscript(String sessionId, String fileName) throws IOException {
        TerminalSession session = require(sessionId);
        return TranscriptWriter.write(settingsService.getTerminalLogDir(), fileName, session.transcript());
    }

    private TerminalSession require(String sessionId) {
        TerminalSession session = sessionId == null ? null : sessions.get(sessionId);
        if (session == null) {
            throw new SessionNotFoundException(sessionId);
        }
        return session;
    }

    private void recordHistory(TerminalSession session, String command) {
        try {
            bookmarkStore.recordHistory(command, session.getWorkingDirectory().toString());
        } catch (UncheckedIOException e) {
            // 历史记录写入失败不影响命令执行
            log.warn("记录命令历史失败: {}", e.getMessage());
        }
    }

    private SessionStatus runBuiltIn(TerminalSession session, BuiltIn builtIn, EventStream<OutputEvent> stream) {
        return switch (builtIn.name()) {
            case "clear" -> {
                session.clearTranscript();
                OutputEvent clear = OutputEvent.clear();
                stream.offer(clear);
                notificationService.sendTerminalEvent(session.getId(), clear);
                yield SessionStatus.SUCCEEDED;
            }
            case "cd" -> changeDirectory(session, builtIn.argument(), stream);
            default -> {
                HELP_LINES.forEach(line -> emit(session, stream, OutputEvent.info(line)));
                yield SessionStatus.SUCCEEDED;
            }
        };
    }

    private SessionStatus changeDirectory(TerminalSession session, String argument, EventStream<OutputEvent> stream) {
        String home = homeDirectory(session);
        String target = argument;
        if (target.isEmpty() || target.equals("~")) {
            target = home;
        } else if (target.startsWith("~/")) {
            target = home + target.substring(1);
        }

        Path directory;
        try {
            Path requested = Paths.get(target);
            directory = (requested.isAbsolute() ? requested : session.getWorkingDirectory().resolve(requested))
                    .normalize();
        } catch (InvalidPathException e) {
            emit(session, stream, OutputEvent.error("cd: 无效的路径: " + argument));
            return SessionStatus.FAILED;
        }
        if (!Files.isDirectory(directory)) {
            emit(session, stream, OutputEvent.error("cd: 目录不存在: " + (argument.isEmpty() ? target : argument)));
            return SessionStatus.FAILED;
        }
        session.changeDirectory(directory);
        emit(session, stream, OutputEvent.success(directory.toString()));
        return SessionStatus.SUCCEEDED;
    }

    private static String homeDirectory(TerminalSession session) {
        String home = session.getenv("HOME");
        if (!StringUtils.hasText(home)) {
            home = System.getenv("HOME");
        }
        return StringUtils.hasText(home) ? home : System.getProperty("user.home");
    }

    private void runCommand(
            TerminalSession session,
            TerminalCommandExecution execution,
            EventStream<OutputEvent> stream,
            CompletableFuture<TerminalCommandExecution> completion) {
        MdcContext.setTerminalSession(session.getId());
        SessionStatus status = SessionStatus.FAILED;
        Integer exitCode = null;
        try {
            String command = execution.command();
            Duration idleTimeout = isLongRunning(command) ? Duration.ZERO : settingsService.getTerminalIdleTimeout();
            List<String> argv = List.of(settingsService.getSettings().getShell(), "-c", command);

            ManagedProcess process;
            try {
                process = processExecutor.spawn(session.getWorkingDirectory(), session.environment(), argv, idleTimeout);
            } catch (SpawnException e) {
                emit(session, stream, OutputEvent.error("无法执行命令: " + e.getMessage()));
                return;
            }
            if (!session.attach(process)) {
                process.kill();
                process.outcome().join();
                status = SessionStatus.CANCELLED;
                return;
            }

            boolean anyOutput = false;
            for (RawLine line : process.lines()) {
                anyOutput = true;
                emit(session, stream, classifier.classify(line, BackendFamily.SHELL));
            }
            ProcessOutcome outcome = process.outcome().join();

            if (outcome.timedOut()) {
                emit(session, stream, OutputEvent.error(String.format(
                        "命令超过 %d 秒没有输出，已被终止。", settingsService.getTerminalIdleTimeout().toSeconds())));
            } else if (session.isStopRequested() || outcome.killed()) {
                emit(session, stream, OutputEvent.warning("命令已被中断。"));
                status = SessionStatus.CANCELLED;
            } else {
                exitCode = outcome.exitCode();
                if (exitCode != 0 && !anyOutput) {
                    emit(session, stream, OutputEvent.error("命令执行失败，退出码: " + exitCode));
                }
                status = exitCode == 0 ? SessionStatus.SUCCEEDED : SessionStatus.FAILED;
            }
        } catch (RuntimeException e) {
            log.error("执行终端命令时发生意外错误", e);
            emit(session, stream, OutputEvent.error("内部错误: " + e.getMessage()));
        } finally {
            complete(session, execution.finish(status, exitCode), stream, completion);
            MdcContext.clear();
        }
    }

    static boolean isLongRunning(String command) {
        return LONG_RUNNING_PREFIXES.stream()
                .anyMatch(prefix -> command.equals(prefix) || command.startsWith(prefix + " "));
    }

    private void emit(TerminalSession session, EventStream<OutputEvent> stream, OutputEvent event) {
        session.record(event);
        stream.offer(event);
        notificationService.sendTerminalEvent(session.getId(), event);
    }

    // 先释放会话再完成 Future，调用方在 Future 完成后可以立即执行下一条命令
    private void complete(
            TerminalSession session,
            TerminalCommandExecution finished,
            EventStream<OutputEvent> stream,
            CompletableFuture<TerminalCommandExecution> completion) {
        session.release();
        stream.complete();
        notificationService.sendTerminalStatus(session.getId(), finished);
        completion.complete(finished);
    }

    @PreDestroy
    public void destroy() {
        log.info("正在关闭 TerminalSessionService。将终止所有终端会话中的进程。");
        List.copyOf(sessions.keySet()).forEach(this::closeQuietly);
        executorService.shutdownNow();
    }

    /** 解析出的内置命令。 */
    private record BuiltIn(String name, String argument) {

        static Optional<BuiltIn> parse(String command) {
            String[] parts = command.split("\\s+", 2);
            String name = parts[0];
            String argument = parts.length > 1 ? unquote(parts[1].trim()) : "";
            return switch (name) {
                case "clear", "help" -> parts.length == 1 ? Optional.of(new BuiltIn(name, "")) : Optional.empty();
                // 带有命令连接符的 cd 交给 shell 执行
                case "cd" -> argument.matches(".*[;&|].*") ? Optional.empty() : Optional.of(new BuiltIn(name, argument));
                default -> Optional.empty();
            };
        }

        private static String unquote(String value) {
            if (value.length() >= 2
                    && ((value.startsWith("\"") && value.endsWith("\"")) || (value.startsWith("'") && value.endsWith("'")))) {
                return value.substring(1, value.length() - 1);
            }
            return value;
        }
    }
}
