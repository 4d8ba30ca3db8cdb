/**
 * OutputClassifier.java
 *
 * 输出分类器：把一行原始输出结合其所属的工具链家族，转换为带语义类别的 OutputEvent。
 * 分类完全由规则表驱动，每个家族一张表 (见 RuleTable)；分类本身是行文本、来源流和家族的纯函数。
 * 未命中任何规则的行使用表中该来源流的默认类别，绝不会被丢弃。
 * 后端规则表由 BackendAdapterRegistry 在启动时注册，终端使用的 SHELL 表在构造时注册。
 */
package club.ppmc.ideshell.service.classify;

import club.ppmc.ideshell.model.BackendFamily;
import club.ppmc.ideshell.model.OutputEvent;
import club.ppmc.ideshell.model.OutputKind;
import club.ppmc.ideshell.model.RawLine;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Matcher;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

@Component
@Slf4j
public class OutputClassifier {

    private final Map<BackendFamily, RuleTable> tables = new ConcurrentHashMap<>();

    public OutputClassifier() {
        register(ShellRuleTable.RULES);
    }

    /**
     * 注册或替换一个家族的规则表。
     */
    public void register(RuleTable table) {
        RuleTable previous = tables.put(table.family(), table);
        if (previous != null && previous != table) {
            log.info("家族 {} 的规则表已被替换。", table.family());
        }
    }

    public boolean hasTable(BackendFamily family) {
        return tables.containsKey(family);
    }

    public OutputEvent classify(RawLine line, BackendFamily family) {
        RuleTable table = tables.get(family);
        if (table == null) {
            log.warn("家族 {} 没有注册规则表，该行将按 INFO 处理。", family);
            return toEvent(line, OutputKind.INFO, null);
        }
        for (ClassificationRule rule : table.rules()) {
            var match = rule.match(line);
            if (match.isPresent()) {
                return toEvent(line, rule.kind(), artifactPath(rule, match.get()));
            }
        }
        return toEvent(line, table.defaultFor(line.source()), null);
    }

    private static String artifactPath(ClassificationRule rule, Matcher matcher) {
        if (rule.kind() != OutputKind.ARTIFACT || rule.artifactGroup() > matcher.groupCount()) {
            return null;
        }
        String path = matcher.group(rule.artifactGroup());
        return path == null ? null : path.trim();
    }

    private static OutputEvent toEvent(RawLine line, OutputKind kind, String artifactPath) {
        String text = line.text();
        List<String> errors = kind == OutputKind.ERROR ? List.of(text) : List.of();
        List<String> warnings = kind == OutputKind.WARNING ? List.of(text) : List.of();
        return new OutputEvent(kind, text, System.currentTimeMillis(), errors, warnings, artifactPath, line.source());
    }
}
