package com.shellrelay.command;

import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class CommandConfig {

    @Bean
    @ConditionalOnMissingBean
    public SessionCommandStore sessionCommandStore(CommandProperties props) {
        return new InMemorySessionCommandStore(props.getHistoryLimit());
    }
}
