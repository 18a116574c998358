package com.fieldops.dismantle.realtime;

/** Lifecycle of one chat connection. CLOSED is terminal. */
public enum SessionState {
    CONNECTING,
    OPEN,
    CLOSED
}
