/**
 * WebConfig.java
 *
 * REST 接口的跨域配置，允许在其他端口运行的笔记本前端查询工作池、会话与设置。
 */
package club.ppmc.kernel.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.CorsRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

@Configuration
public class WebConfig implements WebMvcConfigurer {

    private final String[] allowedOrigins;

    public WebConfig(@Value("${kernel.web.allowed-origins:*}") String[] allowedOrigins) {
        this.allowedOrigins = allowedOrigins;
    }

    @Override
    public void addCorsMappings(CorsRegistry registry) {
        // 只读查询用 GET，更新设置用 POST，取消和关闭会话分别是 POST 与 DELETE
        registry.addMapping("/api/kernel/**")
                .allowedOriginPatterns(allowedOrigins)
                .allowedMethods("GET", "POST", "DELETE");
        registry.addMapping("/api/settings")
                .allowedOriginPatterns(allowedOrigins)
                .allowedMethods("GET", "POST");
    }
}
