package com.example.doisync.sync;

public enum FatalKind {
    FATAL_AUTH,
    FATAL_NETWORK,
    FATAL_LOCAL_UNAVAILABLE
}
