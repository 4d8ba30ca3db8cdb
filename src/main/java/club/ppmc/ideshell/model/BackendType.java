/**
 * BackendType.java
 *
 * 项目可选择的构建后端。HYBRID 固定为两阶段流水线：先原生驱动编译，再托管构建工具打包。
 */
package club.ppmc.ideshell.model;

import java.util.List;

public enum BackendType {
    MANAGED_BUILD_TOOL(List.of(BackendFamily.MANAGED_BUILD_TOOL)),
    PACKAGE_MANAGER(List.of(BackendFamily.PACKAGE_MANAGER)),
    HYBRID(List.of(BackendFamily.NATIVE_DRIVER, BackendFamily.MANAGED_BUILD_TOOL)),
    NATIVE_DRIVER_EXPERIMENTAL(List.of(BackendFamily.NATIVE_DRIVER));

    private final List<BackendFamily> stages;

    BackendType(List<BackendFamily> stages) {
        this.stages = stages;
    }

    /** 按执行顺序返回该后端包含的工具链家族。 */
    public List<BackendFamily> stages() {
        return stages;
    }
}
