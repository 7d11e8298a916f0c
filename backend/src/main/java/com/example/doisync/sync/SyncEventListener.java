package com.example.doisync.sync;

@FunctionalInterface
public interface SyncEventListener {

    void onEvent(SyncEvent event);

    static SyncEventListener noop() {
        return event -> { };
    }
}
