/**
 * ClassificationRule.java
 *
 * 规则表中的一条规则：一个正则表达式映射到一个输出类别。
 * 规则是纯数据，不包含任何分支逻辑；匹配顺序由其在 RuleTable 中的位置决定。
 */
package club.ppmc.ideshell.service.classify;

import club.ppmc.ideshell.model.OutputKind;
import club.ppmc.ideshell.model.RawLine;
import club.ppmc.ideshell.model.StreamSource;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * @param name 规则名称，仅用于日志与调试。
 * @param pattern 在整行文本上执行 find() 的正则。
 * @param kind 匹配时产生的类别。
 * @param artifactGroup 产物路径所在的捕获组；非 ARTIFACT 规则为 0 (不提取)。
 * @param onlySource 仅匹配该来源的行；为 null 时两个流都匹配。
 */
public record ClassificationRule(
        String name, Pattern pattern, OutputKind kind, int artifactGroup, StreamSource onlySource) {

    public ClassificationRule {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(pattern, "pattern");
        Objects.requireNonNull(kind, "kind");
        if (kind == OutputKind.ARTIFACT && artifactGroup <= 0) {
            throw new IllegalArgumentException("ARTIFACT 规则必须指定产物路径的捕获组: " + name);
        }
    }

    public static ClassificationRule of(String name, String regex, OutputKind kind) {
        return new ClassificationRule(name, Pattern.compile(regex), kind, 0, null);
    }

    public static ClassificationRule onStderr(String name, String regex, OutputKind kind) {
        return new ClassificationRule(name, Pattern.compile(regex), kind, 0, StreamSource.STDERR);
    }

    public static ClassificationRule artifact(String name, String regex, int pathGroup) {
        return new ClassificationRule(name, Pattern.compile(regex), OutputKind.ARTIFACT, pathGroup, null);
    }

    /**
     * 尝试匹配一行输出。
     *
     * @return 匹配成功时返回 Matcher (已定位到匹配处)，否则为空。
     */
    public Optional<Matcher> match(RawLine line) {
        if (onlySource != null && onlySource != line.source()) {
            return Optional.empty();
        }
        Matcher matcher = pattern.matcher(line.text());
        return matcher.find() ? Optional.of(matcher) : Optional.empty();
    }
}
