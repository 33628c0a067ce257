package com.connecthub.gameservice.platform.config;

import com.connecthub.gameservice.games.connect4.application.Connect4Runner;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * 四子棋相关 Bean 的装配：把配置与 JSON 序列化注入到对局入口中。
 */
@Configuration
@EnableConfigurationProperties(Connect4Properties.class)
public class Connect4Config {

    /**
     * 启动后自动开一局；connect4.runner.enabled=false 时不注册（测试用）。
     */
    @Bean
    @ConditionalOnProperty(prefix = "connect4.runner", name = "enabled", havingValue = "true", matchIfMissing = true)
    public Connect4Runner connect4Runner(Connect4Properties props, ObjectMapper objectMapper) {
        return new Connect4Runner(props, objectMapper);
    }
}
