package com.gunzi;

import com.gunzi.config.GameProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

/**
 * 滚子（六人找朋友升级）应用主入口
 */
@SpringBootApplication
@EnableConfigurationProperties(GameProperties.class)
public class GunziApplication {
    public static void main(String[] args) {
        SpringApplication.run(GunziApplication.class, args);
        System.out.println("\n=================================");
        System.out.println("滚子服务器启动成功！");
        System.out.println("访问: http://localhost:8080");
        System.out.println("=================================\n");
    }
}
