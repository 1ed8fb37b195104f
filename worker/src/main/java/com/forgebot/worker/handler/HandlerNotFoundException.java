package com.forgebot.worker.handler;

public class HandlerNotFoundException extends RuntimeException {

    public HandlerNotFoundException(String handlerName) {
        super("No handler registered under name: " + handlerName);
    }
}
