/**
 * CommandHistoryEntry.java
 *
 * 持久化的命令历史记录。相同命令文本只保留一条，重复执行时增加使用次数并刷新最近使用时间。
 */
package club.ppmc.ideshell.model;

import lombok.Data;

@Data
public class CommandHistoryEntry {

    private String id;
    private String command;
    private String workingDirectory;
    private int useCount;
    private Long lastUsed;
    private long createdAt;
}
