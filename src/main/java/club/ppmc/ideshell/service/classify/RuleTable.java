/**
 * RuleTable.java
 *
 * 某一工具链家族的有序规则表，以及未匹配行按来源流使用的默认类别。
 * 新增一个后端时只需提供一张新的规则表并注册到 OutputClassifier，无需改动共享的分类逻辑。
 */
package club.ppmc.ideshell.service.classify;

import club.ppmc.ideshell.model.BackendFamily;
import club.ppmc.ideshell.model.OutputKind;
import club.ppmc.ideshell.model.StreamSource;
import java.util.List;
import java.util.Objects;

/**
 * @param family 该表所属的家族。
 * @param rules 按优先级排列的规则，第一条命中的规则生效。
 * @param stdoutDefault stdout 上未命中任何规则的行的类别。
 * @param stderrDefault stderr 上未命中任何规则的行的类别。
 */
public record RuleTable(
        BackendFamily family, List<ClassificationRule> rules, OutputKind stdoutDefault, OutputKind stderrDefault) {

    public RuleTable {
        Objects.requireNonNull(family, "family");
        rules = List.copyOf(rules);
        stdoutDefault = stdoutDefault == null ? OutputKind.INFO : stdoutDefault;
        stderrDefault = stderrDefault == null ? OutputKind.INFO : stderrDefault;
    }

    public static RuleTable of(BackendFamily family, List<ClassificationRule> rules) {
        return new RuleTable(family, rules, OutputKind.INFO, OutputKind.INFO);
    }

    public OutputKind defaultFor(StreamSource source) {
        return source == StreamSource.STDERR ? stderrDefault : stdoutDefault;
    }
}
