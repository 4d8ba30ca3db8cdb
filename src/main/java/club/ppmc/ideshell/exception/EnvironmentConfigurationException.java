/**
 * EnvironmentConfigurationException.java
 *
 * 一个自定义的运行时异常，用于表示项目或工具链环境未正确配置。
 * 当后端适配器在规划调用前发现项目缺少该家族所需的清单文件 (如 Cargo.toml、build.gradle) 时抛出，
 * 此时构建请求被拒绝，不会产生任何会话。
 * 它携带了结构化的错误信息，以便 Controller 层可以将其转换为对前端友好的响应。
 */
package club.ppmc.ideshell.exception;

import club.ppmc.ideshell.model.BackendFamily;
import java.util.Map;
import lombok.Getter;

@Getter
public class EnvironmentConfigurationException extends RuntimeException {

    /** 缺失或无效的组件名称，例如 "Cargo.toml"。 */
    private final String missingComponent;

    /** 报告该问题的工具链家族。 */
    private final BackendFamily family;

    /**
     * 构造函数。
     * @param message 详细的错误信息，将展示给用户。
     * @param missingComponent 问题组件的标识符。
     * @param family 报告问题的家族。
     */
    public EnvironmentConfigurationException(String message, String missingComponent, BackendFamily family) {
        super(message);
        this.missingComponent = missingComponent;
        this.family = family;
    }

    /**
     * 将异常信息转换为一个Map，便于序列化为JSON。
     *
     * @return 包含结构化错误信息的Map。
     */
    public Map<String, Object> toErrorData() {
        return Map.of(
                "type", "ENVIRONMENT_ERROR",
                "message", getMessage(),
                "missing", getMissingComponent(),
                "family", getFamily() != null ? getFamily().name() : ""
        );
    }
}
