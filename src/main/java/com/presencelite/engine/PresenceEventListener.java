package com.presencelite.engine;

@FunctionalInterface
public interface PresenceEventListener {

    void onEvent(PresenceEvent event);
}
