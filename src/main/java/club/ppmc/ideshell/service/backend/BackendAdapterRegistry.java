/**
 * BackendAdapterRegistry.java
 *
 * 收集容器中所有的 BackendAdapter，按工具链家族索引，并在启动时把它们的规则表注册到 OutputClassifier。
 */
package club.ppmc.ideshell.service.backend;

import club.ppmc.ideshell.model.BackendFamily;
import club.ppmc.ideshell.service.classify.OutputClassifier;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

@Component
@Slf4j
public class BackendAdapterRegistry {

    private final Map<BackendFamily, BackendAdapter> adapters = new EnumMap<>(BackendFamily.class);

    public BackendAdapterRegistry(List<BackendAdapter> adapters, OutputClassifier classifier) {
        for (BackendAdapter adapter : adapters) {
            BackendAdapter previous = this.adapters.put(adapter.family(), adapter);
            if (previous != null) {
                throw new IllegalStateException("工具链家族 " + adapter.family() + " 注册了多个适配器: "
                        + previous.getClass().getSimpleName() + ", " + adapter.getClass().getSimpleName());
            }
            classifier.register(adapter.ruleTable());
            log.info("已注册后端适配器 {} ({})", adapter.getClass().getSimpleName(), adapter.family());
        }
    }

    /**
     * @throws IllegalStateException 该家族没有可用的适配器。
     */
    public BackendAdapter get(BackendFamily family) {
        BackendAdapter adapter = adapters.get(family);
        if (adapter == null) {
            throw new IllegalStateException("没有为 " + family + " 注册后端适配器。");
        }
        return adapter;
    }
}
