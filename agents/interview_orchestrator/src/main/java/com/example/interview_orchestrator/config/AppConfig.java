package com.example.interview_orchestrator.config;

import org.springframework.ai.chat.client.ChatClient;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
@EnableConfigurationProperties(InterviewProperties.class)
public class AppConfig {

    @Bean
    public ChatClient chatClient(ChatClient.Builder builder) {
        // every prompt carries its own transcript, so no chat memory advisor here
        return builder.build();
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
