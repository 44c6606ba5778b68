package com.jz.crm.memory;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ContextTurn {
    public static final String USER = "user";
    public static final String ASSISTANT = "assistant";

    private String role;                    // user / assistant
    private String content;

    public static ContextTurn user(String content) {
        return new ContextTurn(USER, content);
    }

    public static ContextTurn assistant(String content) {
        return new ContextTurn(ASSISTANT, content);
    }
}
