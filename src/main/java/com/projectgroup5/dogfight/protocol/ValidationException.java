package com.projectgroup5.dogfight.protocol;

/**
 * 入站消息不合法（格式错误、序号不递增、越界移动、非所有者更新导弹等）
 * 处理方式：丢弃 + 日志，不改状态，连接保持
 */
public class ValidationException extends RuntimeException {

    public ValidationException(String message) {
        super(message);
    }

    public ValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
