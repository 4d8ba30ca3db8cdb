/**
 * CommandHistory.java
 *
 * 单个终端会话的命令历史。命令按执行顺序追加 (最新的在末尾)，无论执行结果如何。
 * previous()/next() 只是在列表上移动游标，从不修改列表本身；追加新命令后游标回到末尾之后。
 */
package club.ppmc.ideshell.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

public final class CommandHistory {

    public static final int DEFAULT_MAX_SIZE = 500;

    private final List<String> entries = new ArrayList<>();
    private final int maxSize;
    // entries.size() 表示游标位于最新命令之后
    private int cursor;

    public CommandHistory() {
        this(DEFAULT_MAX_SIZE);
    }

    public CommandHistory(int maxSize) {
        if (maxSize <= 0) {
            throw new IllegalArgumentException("maxSize 必须大于 0");
        }
        this.maxSize = maxSize;
    }

    public synchronized void add(String command) {
        entries.add(command);
        if (entries.size() > maxSize) {
            entries.remove(0);
        }
        cursor = entries.size();
    }

    /** 向更早的命令移动。已经在最早一条时停留在原处。 */
    public synchronized Optional<String> previous() {
        if (entries.isEmpty()) {
            return Optional.empty();
        }
        if (cursor > 0) {
            cursor--;
        }
        return Optional.of(entries.get(cursor));
    }

    /** 向更新的命令移动。越过最新一条后返回空，表示回到空白输入。 */
    public synchronized Optional<String> next() {
        if (cursor < entries.size() - 1) {
            cursor++;
            return Optional.of(entries.get(cursor));
        }
        cursor = entries.size();
        return Optional.empty();
    }

    public synchronized List<String> entries() {
        return List.copyOf(entries);
    }

    public synchronized int size() {
        return entries.size();
    }
}
