package com.deepknow.goodface.copilot.domain.agent;

public interface SttConnector {

    String name();

    SttConnection create(SttOptions options, SttConnection.Listener listener);
}
