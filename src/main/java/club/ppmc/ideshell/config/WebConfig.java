/**
 * WebConfig.java
 *
 * 该文件定义了全局的Spring Web MVC配置。
 * 目前，它的主要职责是配置跨域资源共享 (CORS)，以允许前端应用程序与后端API进行交互。
 * 允许的来源由 app.cors.allowed-origin-patterns 配置，默认允许任意来源。
 */
package club.ppmc.ideshell.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.CorsRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

@Configuration
public class WebConfig implements WebMvcConfigurer {

    private final String[] allowedOriginPatterns;

    public WebConfig(@Value("${app.cors.allowed-origin-patterns:*}") String[] allowedOriginPatterns) {
        this.allowedOriginPatterns = allowedOriginPatterns;
    }

    /**
     * 配置全局CORS（跨域资源共享）映射。
     * allowCredentials 为 true 时不能使用通配符来源，因此使用 allowedOriginPatterns。
     *
     * @param registry CORS配置注册表
     */
    @Override
    public void addCorsMappings(CorsRegistry registry) {
        registry.addMapping("/api/**")
                .allowedOriginPatterns(allowedOriginPatterns)
                .allowedMethods("GET", "POST", "PUT", "DELETE", "OPTIONS")
                .allowedHeaders("*")
                .allowCredentials(true);
    }
}
