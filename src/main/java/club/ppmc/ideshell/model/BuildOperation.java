/**
 * BuildOperation.java
 *
 * 可以向后端适配器请求的操作。并非每个家族都支持全部操作。
 */
package club.ppmc.ideshell.model;

public enum BuildOperation {
    BUILD,
    CLEAN,
    TEST,
    ADD_DEPENDENCY,
    REMOVE_DEPENDENCY,
    CROSS_TARGET_BUILD
}
