package com.nginx.log.event;

@FunctionalInterface
public interface EventListener {

    void onEvent(LogIndexEvent event);
}
