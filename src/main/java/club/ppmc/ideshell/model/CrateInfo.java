/**
 * CrateInfo.java
 *
 * 从 "cargo metadata" 中提取的当前 crate 的描述信息，只读。
 */
package club.ppmc.ideshell.model;

import java.util.List;

/**
 * @param crateTypes 所有构建目标的 crate 类型，去重后按出现顺序排列，例如 ["cdylib", "bin"]。
 * @param features 清单中定义的特性名称，按字母顺序排列。
 */
public record CrateInfo(
        String name,
        String version,
        List<String> authors,
        String description,
        String edition,
        List<String> crateTypes,
        List<CrateDependency> dependencies,
        List<String> features) {

    public CrateInfo {
        authors = authors == null ? List.of() : List.copyOf(authors);
        description = description == null ? "" : description;
        crateTypes = crateTypes == null ? List.of() : List.copyOf(crateTypes);
        dependencies = dependencies == null ? List.of() : List.copyOf(dependencies);
        features = features == null ? List.of() : List.copyOf(features);
    }
}
