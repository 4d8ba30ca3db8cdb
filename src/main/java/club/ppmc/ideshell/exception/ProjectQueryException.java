/**
 * ProjectQueryException.java
 *
 * 表示一次只读项目查询 (列出 Gradle 任务、读取 crate 信息) 没有得到可用结果：
 * 工具无法启动、以非零退出码结束、超时，或输出无法解析。
 */
package club.ppmc.ideshell.exception;

import java.util.List;
import lombok.Getter;

@Getter
public class ProjectQueryException extends RuntimeException {

    /** 工具写到 stderr 的最后几行，便于前端展示失败原因。 */
    private final List<String> diagnostics;

    public ProjectQueryException(String message, List<String> diagnostics) {
        super(message);
        this.diagnostics = diagnostics == null ? List.of() : List.copyOf(diagnostics);
    }

    public ProjectQueryException(String message, Throwable cause) {
        super(message, cause);
        this.diagnostics = List.of();
    }
}
