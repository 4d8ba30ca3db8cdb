/**
 * JsonFileCommandBookmarkStore.java
 *
 * CommandBookmarkStore 的默认实现，把书签和命令历史以 JSON 格式 (Jackson) 保存在工作区的 .ide 目录中。
 * 每次修改后立即写回文件；所有公共方法都在同一把锁上串行执行。
 */
package club.ppmc.ideshell.service.store;

import club.ppmc.ideshell.model.BookmarkedCommand;
import club.ppmc.ideshell.model.CommandHistoryEntry;
import club.ppmc.ideshell.service.SettingsService;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

@Component
@Slf4j
public class JsonFileCommandBookmarkStore implements CommandBookmarkStore {

    static final String BOOKMARKS_FILE = "bookmarks.json";
    static final String HISTORY_FILE = "command-history.json";
    static final int MAX_HISTORY = 1000;

    private final Path bookmarksFile;
    private final Path historyFile;
    private final ObjectMapper objectMapper = new ObjectMapper()
            .enable(SerializationFeature.INDENT_OUTPUT)
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);

    private final List<BookmarkedCommand> bookmarks;
    private final List<CommandHistoryEntry> history;

    @Autowired
    public JsonFileCommandBookmarkStore(SettingsService settingsService) {
        this(settingsService.getIdeDataDir());
    }

    public JsonFileCommandBookmarkStore(Path dataDir) {
        this.bookmarksFile = dataDir.resolve(BOOKMARKS_FILE);
        this.historyFile = dataDir.resolve(HISTORY_FILE);
        this.bookmarks = load(bookmarksFile, new TypeReference<List<BookmarkedCommand>>() {});
        this.history = load(historyFile, new TypeReference<List<CommandHistoryEntry>>() {});
    }

    @Override
    public synchronized BookmarkedCommand addBookmark(String command, String description, List<String> tags) {
        if (command == null || command.isBlank()) {
            throw new IllegalArgumentException("书签命令不能为空。");
        }
        long now = System.currentTimeMillis();
        var bookmark = new BookmarkedCommand();
        bookmark.setId(UUID.randomUUID().toString());
        bookmark.setCommand(command.trim());
        bookmark.setDescription(description == null ? "" : description.trim());
        if (tags != null) {
            bookmark.setTags(new ArrayList<>(tags));
        }
        bookmark.setCreatedAt(now);
        bookmark.setUpdatedAt(now);
        bookmarks.add(bookmark);
        save(bookmarksFile, bookmarks);
        log.info("已添加命令书签 {}: {}", bookmark.getId(), bookmark.getCommand());
        return copy(bookmark);
    }

    @Override
    public synchronized Optional<BookmarkedCommand> findBookmark(String id) {
        return find(id).map(this::copy);
    }

    @Override
    public synchronized List<BookmarkedCommand> listBookmarks() {
        return bookmarks.stream()
                .sorted(Comparator.comparing(BookmarkedCommand::isFavorite).reversed()
                        .thenComparing(Comparator.comparingInt(BookmarkedCommand::getUseCount).reversed())
                        .thenComparingLong(BookmarkedCommand::getCreatedAt))
                .map(this::copy)
                .toList();
    }

    @Override
    public synchronized boolean removeBookmark(String id) {
        boolean removed = bookmarks.removeIf(bookmark -> bookmark.getId().equals(id));
        if (removed) {
            save(bookmarksFile, bookmarks);
        }
        return removed;
    }

    @Override
    public synchronized Optional<BookmarkedCommand> setFavorite(String id, boolean favorite) {
        Optional<BookmarkedCommand> found = find(id);
        found.ifPresent(bookmark -> {
            bookmark.setFavorite(favorite);
            bookmark.setUpdatedAt(System.currentTimeMillis());
            save(bookmarksFile, bookmarks);
        });
        return found.map(this::copy);
    }

    @Override
    public synchronized Optional<BookmarkedCommand> recordBookmarkUse(String id) {
        Optional<BookmarkedCommand> found = find(id);
        found.ifPresent(bookmark -> {
            long now = System.currentTimeMillis();
            bookmark.setUseCount(bookmark.getUseCount() + 1);
            bookmark.setLastUsed(now);
            bookmark.setUpdatedAt(now);
            save(bookmarksFile, bookmarks);
        });
        return found.map(this::copy);
    }

    @Override
    public synchronized void recordHistory(String command, String workingDirectory) {
        long now = System.currentTimeMillis();
        CommandHistoryEntry entry = history.stream()
                .filter(existing -> existing.getCommand().equals(command))
                .findFirst()
                .orElseGet(() -> {
                    var created = new CommandHistoryEntry();
                    created.setId(UUID.randomUUID().toString());
                    created.setCommand(command);
                    created.setCreatedAt(now);
                    history.add(created);
                    return created;
                });
        entry.setWorkingDirectory(workingDirectory);
        entry.setUseCount(entry.getUseCount() + 1);
        entry.setLastUsed(now);
        if (history.size() > MAX_HISTORY) {
            history.sort(Comparator.comparing(CommandHistoryEntry::getLastUsed,
                    Comparator.nullsFirst(Comparator.naturalOrder())));
            history.subList(0, history.size() - MAX_HISTORY).clear();
        }
        save(historyFile, history);
    }

    @Override
    public synchronized List<CommandHistoryEntry> recentHistory(int limit) {
        return history.stream()
                .sorted(Comparator.comparing(CommandHistoryEntry::getLastUsed,
                        Comparator.nullsLast(Comparator.reverseOrder())))
                .limit(Math.max(0, limit))
                .map(this::copy)
                .toList();
    }

    @Override
    public synchronized void clearHistory() {
        history.clear();
        save(historyFile, history);
    }

    private Optional<BookmarkedCommand> find(String id) {
        return bookmarks.stream().filter(bookmark -> bookmark.getId().equals(id)).findFirst();
    }

    private <T> List<T> load(Path file, TypeReference<List<T>> type) {
        if (Files.notExists(file)) {
            return new ArrayList<>();
        }
        try {
            List<T> loaded = objectMapper.readValue(file.toFile(), type);
            log.info("已从 {} 加载 {} 条记录。", file, loaded.size());
            return new ArrayList<>(loaded);
        } catch (IOException e) {
            log.error("读取 {} 失败，将从空列表开始。", file, e);
            return new ArrayList<>();
        }
    }

    private void save(Path file, List<?> items) {
        try {
            Files.createDirectories(file.getParent());
            objectMapper.writeValue(file.toFile(), items);
        } catch (IOException e) {
            log.error("写入 {} 失败", file, e);
            throw new UncheckedIOException("保存命令数据失败: " + file, e);
        }
    }

    // 返回副本，避免调用方绕过存储直接修改内部状态
    private BookmarkedCommand copy(BookmarkedCommand source) {
        return objectMapper.convertValue(source, BookmarkedCommand.class);
    }

    private CommandHistoryEntry copy(CommandHistoryEntry source) {
        return objectMapper.convertValue(source, CommandHistoryEntry.class);
    }
}
