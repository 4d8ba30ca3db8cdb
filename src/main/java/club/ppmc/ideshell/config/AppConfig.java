/**
 * AppConfig.java
 *
 * Spring Boot 应用的基础配置类。
 * 主要用于定义一些应用级别的Bean。
 */
package club.ppmc.ideshell.config;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class AppConfig {

    /**
     * 定义一个全局的 Gson Bean。
     * 在WebSocket服务中用于将输出事件和会话快照转换为JSON字符串，确保与前端的兼容性。
     * 空字段 (如非产物事件的 artifactPath) 也会输出为 null，前端可以依赖固定的字段集合。
     *
     * @return 一个新的 Gson 实例。
     */
    @Bean
    public Gson gson() {
        return new GsonBuilder().serializeNulls().create();
    }
}
