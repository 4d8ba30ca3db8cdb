/**
 * BookmarkedCommand.java
 *
 * 用户收藏的终端命令。由 CommandBookmarkStore 持久化，终端会话只负责新增和回放时增加使用次数。
 * 它是一个可变对象，以便于Jackson库进行序列化和反序列化。
 */
package club.ppmc.ideshell.model;

import java.util.ArrayList;
import java.util.List;
import lombok.Data;

@Data
public class BookmarkedCommand {

    private String id;
    private String command;
    private String description;
    private List<String> tags = new ArrayList<>();
    private boolean favorite;
    private int useCount;
    /** 最近一次回放的时间 (epoch 毫秒)，从未使用时为 null。 */
    private Long lastUsed;
    private long createdAt;
    private long updatedAt;
}
