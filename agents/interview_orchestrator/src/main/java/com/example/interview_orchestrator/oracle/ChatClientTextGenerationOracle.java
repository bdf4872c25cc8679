package com.example.interview_orchestrator.oracle;

import lombok.extern.slf4j.Slf4j;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.stereotype.Component;

@Slf4j
@Component
public class ChatClientTextGenerationOracle implements TextGenerationOracle {

    private final ChatClient chatClient;

    public ChatClientTextGenerationOracle(ChatClient chatClient) {
        this.chatClient = chatClient;
    }

    @Override
    public String generate(String prompt) {
        long started = System.currentTimeMillis();
        String content = chatClient.prompt()
                .user(prompt)
                .call()
                .content();
        log.debug("Oracle call finished in {} ms ({} chars)", System.currentTimeMillis() - started,
                content == null ? 0 : content.length());
        return content;
    }
}
