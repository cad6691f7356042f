package com.deepansh.gameagent;

import com.deepansh.gameagent.config.GameAgentProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties(GameAgentProperties.class)
public class GameAgentApplication {
    public static void main(String[] args) {
        SpringApplication.run(GameAgentApplication.class, args);
    }
}
