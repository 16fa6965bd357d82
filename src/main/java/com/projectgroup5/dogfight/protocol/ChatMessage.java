package com.projectgroup5.dogfight.protocol;

public class ChatMessage extends ClientMessage {
    private String text;

    public ChatMessage() {
    }

    public ChatMessage(String text) {
        this.text = text;
    }

    @Override
    public ClientMessageType getMessageType() {
        return ClientMessageType.CHAT;
    }

    @Override
    public void validate() {
        if (text == null || text.isBlank()) {
            throw new ValidationException("chat text is empty");
        }
    }

    public String getText() {
        return text;
    }

    public void setText(String text) {
        this.text = text;
    }
}
