/**
 * ShellRuleTable.java
 *
 * 交互式终端使用的通用规则表。stderr 默认归为 ERROR，stdout 默认为 INFO；
 * 对交互式调用的 git、npm、pip、cargo、gradle 等子工具的常见前缀做启发式修正，
 * 例如 git 把 "Cloning into" 之类的进度信息写到 stderr，这些行会被降级为 INFO。
 */
package club.ppmc.ideshell.service.classify;

import static club.ppmc.ideshell.service.classify.ClassificationRule.of;
import static club.ppmc.ideshell.service.classify.ClassificationRule.onStderr;

import club.ppmc.ideshell.model.BackendFamily;
import club.ppmc.ideshell.model.OutputKind;
import java.util.List;

public final class ShellRuleTable {

    public static final RuleTable RULES = new RuleTable(
            BackendFamily.SHELL,
            List.of(
                    of("success-marker",
                            "^(Already up to date|Successfully (installed|built|uninstalled|tagged)|BUILD SUCCESSFUL"
                                    + "|\\s*Finished\\b|added \\d+ packages?)",
                            OutputKind.SUCCESS),
                    of("error-prefix",
                            "^(fatal:|error(\\[E\\d+\\])?:|npm ERR!|ERROR:|BUILD FAILED|FAILURE:|E: )",
                            OutputKind.ERROR),
                    of("warning-prefix", "^(warning(\\[\\w+\\])?:|npm WARN|WARNING:|W: )", OutputKind.WARNING),
                    of("git-hint", "^hint:", OutputKind.INFO),
                    of("gradle-task", "^> Task :\\S+", OutputKind.TASK),
                    of("cargo-progress",
                            "^\\s*(Compiling|Checking|Downloaded|Downloading|Updating|Locking|Adding|Removing|Running)\\s",
                            OutputKind.TASK),
                    onStderr("progress-on-stderr",
                            "^(Cloning into|remote:|Receiving objects|Resolving deltas|Counting objects"
                                    + "|Compressing objects|Unpacking objects|Writing objects|Enumerating objects"
                                    + "|Total \\d+|To \\S+|From \\S+|Switched to|Already on|Your branch|npm notice"
                                    + "|\\s*\\d+%|\\s+Blocking)",
                            OutputKind.INFO)),
            OutputKind.INFO,
            OutputKind.ERROR);

    private ShellRuleTable() {}
}
