/**
 * CrateDependency.java
 *
 * Cargo 清单中声明的一个依赖。
 */
package club.ppmc.ideshell.model;

import java.util.List;

/**
 * @param requirement 版本要求，例如 "^1.0"。
 * @param kind "normal"、"dev" 或 "build"。
 */
public record CrateDependency(String name, String requirement, String kind, boolean optional, List<String> features) {

    public CrateDependency {
        features = features == null ? List.of() : List.copyOf(features);
    }
}
