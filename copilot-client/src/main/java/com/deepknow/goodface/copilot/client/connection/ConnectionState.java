package com.deepknow.goodface.copilot.client.connection;

public enum ConnectionState {
    CONNECTING,
    CONNECTED,
    DISCONNECTED,
    ERROR
}
