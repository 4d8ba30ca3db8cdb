/**
 * InvalidOperationException.java
 *
 * 表示请求的操作不被某个工具链家族支持，例如向托管构建工具请求添加依赖。
 * 由 BackendAdapter 在规划调用时抛出，此时尚未产生任何会话状态变化。
 */
package club.ppmc.ideshell.exception;

import club.ppmc.ideshell.model.BackendFamily;
import club.ppmc.ideshell.model.BuildOperation;
import lombok.Getter;

@Getter
public class InvalidOperationException extends RuntimeException {

    private final BackendFamily family;
    private final BuildOperation operation;

    public InvalidOperationException(BackendFamily family, BuildOperation operation) {
        super(String.format("%s 不支持操作 %s", family, operation));
        this.family = family;
        this.operation = operation;
    }
}
