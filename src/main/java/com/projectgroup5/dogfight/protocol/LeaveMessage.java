package com.projectgroup5.dogfight.protocol;

public class LeaveMessage extends ClientMessage {

    @Override
    public ClientMessageType getMessageType() {
        return ClientMessageType.LEAVE;
    }
}
