/**
 * CommandBookmarkStore.java
 *
 * 命令历史与书签的持久化接口。终端会话管理器只通过该接口读取、新增书签、增加使用次数和记录历史，
 * 存储引擎本身可以替换；默认实现为 JsonFileCommandBookmarkStore。
 * 实现必须是线程安全的，它是多个终端会话之间唯一共享的状态。
 */
package club.ppmc.ideshell.service.store;

import club.ppmc.ideshell.model.BookmarkedCommand;
import club.ppmc.ideshell.model.CommandHistoryEntry;
import java.util.List;
import java.util.Optional;

public interface CommandBookmarkStore {

    BookmarkedCommand addBookmark(String command, String description, List<String> tags);

    Optional<BookmarkedCommand> findBookmark(String id);

    /** 收藏的排在前面，其余按使用次数降序。 */
    List<BookmarkedCommand> listBookmarks();

    boolean removeBookmark(String id);

    Optional<BookmarkedCommand> setFavorite(String id, boolean favorite);

    /**
     * 使用次数加一并刷新最近使用时间。
     *
     * @return 更新后的书签，不存在时为空。
     */
    Optional<BookmarkedCommand> recordBookmarkUse(String id);

    void recordHistory(String command, String workingDirectory);

    /** 按最近使用时间降序返回最多 limit 条历史。 */
    List<CommandHistoryEntry> recentHistory(int limit);

    void clearHistory();
}
