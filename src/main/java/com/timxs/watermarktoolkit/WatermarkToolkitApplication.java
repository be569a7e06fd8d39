package com.timxs.watermarktoolkit;

import com.timxs.watermarktoolkit.config.ProcessingSettings;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Bean;

/**
 * Watermark Toolkit 启动类
 * 非 Web 应用，命令行参数由 WatermarkCommandRunner 处理，退出码来自批处理结果
 *
 * @author Tim0x0
 * @since 1.0.0
 */
@SpringBootApplication
public class WatermarkToolkitApplication {

    public static void main(String[] args) {
        System.exit(SpringApplication.exit(SpringApplication.run(WatermarkToolkitApplication.class, args)));
    }

    /**
     * application.yml 中的默认处理设置
     */
    @Bean
    @ConfigurationProperties(prefix = "watermark-toolkit")
    public ProcessingSettings processingSettings() {
        return new ProcessingSettings();
    }
}
