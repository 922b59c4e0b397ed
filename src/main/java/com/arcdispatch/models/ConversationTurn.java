package com.arcdispatch.models;

import java.util.Objects;

/**
 * One message of a conversation replayed to a stateless provider.
 */
public final class ConversationTurn {

    public enum Role {
        USER, ASSISTANT;

        public String wireName() {
            return this == USER ? "user" : "assistant";
        }
    }

    private final Role role;
    private final String content;

    public ConversationTurn(Role role, String content) {
        this.role = Objects.requireNonNull(role, "role");
        this.content = content != null ? content : "";
    }

    public static ConversationTurn user(String content) {
        return new ConversationTurn(Role.USER, content);
    }

    public static ConversationTurn assistant(String content) {
        return new ConversationTurn(Role.ASSISTANT, content);
    }

    public Role getRole() {
        return role;
    }

    public String getContent() {
        return content;
    }
}
