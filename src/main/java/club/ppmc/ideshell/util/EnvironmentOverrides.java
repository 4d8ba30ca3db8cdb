/**
 * EnvironmentOverrides.java
 *
 * 复制并校验客户端提交的环境变量覆盖。JSON 请求体中的 null 变量名或变量值会被拒绝，
 * 控制器据此返回 400，而不是在后续复制时抛出 NullPointerException。
 */
package club.ppmc.ideshell.util;

import java.util.List;
import java.util.Map;
import java.util.Objects;

public final class EnvironmentOverrides {

    private EnvironmentOverrides() {}

    /**
     * @param environment 可以为 null，视为没有覆盖。
     * @return 不可变的副本。
     * @throws IllegalArgumentException 某个变量名为空或变量值为 null。
     */
    public static Map<String, String> copyOf(Map<String, String> environment) {
        if (environment == null) {
            return Map.of();
        }
        environment.forEach((name, value) -> {
            if (name == null || name.isBlank()) {
                throw new IllegalArgumentException("环境变量名不能为空。");
            }
            if (value == null) {
                throw new IllegalArgumentException("环境变量 " + name + " 的值不能为 null。");
            }
        });
        return Map.copyOf(environment);
    }

    /**
     * 复制参数列表。
     *
     * @throws IllegalArgumentException 列表中含有 null 元素。
     */
    public static List<String> copyOfArguments(List<String> arguments, String what) {
        if (arguments == null) {
            return List.of();
        }
        if (arguments.stream().anyMatch(Objects::isNull)) {
            throw new IllegalArgumentException(what + " 中不能含有 null。");
        }
        return List.copyOf(arguments);
    }
}
