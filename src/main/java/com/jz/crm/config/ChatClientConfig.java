package com.jz.crm.config;


import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class ChatClientConfig {

    // stateless: the context window is assembled by the caller from ContextStore
    @Bean
    public ChatClient classifierChatClient(ChatModel chatModel) {
        return ChatClient.builder(chatModel).build();
    }

}
