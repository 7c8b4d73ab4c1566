package com.cardhub.gameservice;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * game-service 启动入口。
 * 通过 @ConfigurationPropertiesScan 加载 cardhub.* 桌规配置。
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class GameServiceApplication {

    public static void main(String[] args) {
        SpringApplication.run(GameServiceApplication.class, args);
    }
}
