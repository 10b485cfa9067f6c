package org.stepreduce;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

@SpringBootApplication
@ConfigurationPropertiesScan
public class StepReduceApplication {
    public static void main(String[] args) {
        ensureLogDirectory();
        SpringApplication.run(StepReduceApplication.class, args);
    }

    /**
     * 启动前创建日志目录，规则与 logback-spring.xml 一致：系统属性/环境变量 LOG_PATH，默认 ./logs。
     * <p>
     * stdout 被 MCP stdio 传输占用，日志只能写文件；目录创建失败时输出到 stderr 并继续启动。
     */
    static void ensureLogDirectory() {
        String logPath = System.getProperty("LOG_PATH");
        if (logPath == null || logPath.isBlank()) {
            logPath = System.getenv("LOG_PATH");
        }
        if (logPath == null || logPath.isBlank()) {
            logPath = "logs";
        }
        try {
            Files.createDirectories(Path.of(logPath));
        } catch (IOException e) {
            System.err.println("无法创建日志目录 " + logPath + "：" + e.getMessage());
        }
    }
}
