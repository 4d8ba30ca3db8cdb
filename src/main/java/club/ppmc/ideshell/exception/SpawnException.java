/**
 * SpawnException.java
 *
 * 表示操作系统未能创建子进程（可执行文件不存在、没有权限、工作目录无效等）。
 * 由 ProcessExecutor 抛出；构建调度器和终端会话会捕获它并转换为 FAILED 状态和一条 ERROR 事件，
 * 不会越过会话边界传播给调用方。
 */
package club.ppmc.ideshell.exception;

import java.util.List;
import lombok.Getter;

@Getter
public class SpawnException extends RuntimeException {

    /** 启动失败的参数向量。 */
    private final List<String> argv;

    public SpawnException(String message, List<String> argv, Throwable cause) {
        super(message, cause);
        this.argv = argv == null ? List.of() : List.copyOf(argv);
    }
}
