/**
 * IdeShellApplication.java
 *
 * Spring Boot 应用的主入口类。
 * 负责启动整个应用程序：构建调度、终端会话以及它们的 REST / STOMP 接口。
 */
package club.ppmc.ideshell;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class IdeShellApplication {

    public static void main(String[] args) {
        SpringApplication.run(IdeShellApplication.class, args);
    }
}
