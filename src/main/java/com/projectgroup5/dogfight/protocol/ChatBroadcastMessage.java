package com.projectgroup5.dogfight.protocol;

public class ChatBroadcastMessage extends ServerMessage {
    private String from;
    private String name;
    private String text;
    private long tick;

    public ChatBroadcastMessage() {
    }

    public ChatBroadcastMessage(String from, String name, String text, long tick) {
        this.from = from;
        this.name = name;
        this.text = text;
        this.tick = tick;
    }

    public String getFrom() {
        return from;
    }

    public void setFrom(String from) {
        this.from = from;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public String getText() {
        return text;
    }

    public void setText(String text) {
        this.text = text;
    }

    public long getTick() {
        return tick;
    }

    public void setTick(long tick) {
        this.tick = tick;
    }
}
