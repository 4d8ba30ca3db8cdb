/**
 * BackendFamily.java
 *
 * 工具链家族，同时也是 OutputClassifier 选择规则表的键。
 * SHELL 不对应任何构建后端，仅用于交互式终端会话的输出分类。
 */
package club.ppmc.ideshell.model;

public enum BackendFamily {
    MANAGED_BUILD_TOOL,
    PACKAGE_MANAGER,
    NATIVE_DRIVER,
    SHELL
}
