package com.deepknow.goodface.copilot.client.connection;

import java.net.URI;

public interface ChannelFactory {

    /**
     * 创建通道并开始异步连接，返回时通道处于 CONNECTING。
     */
    ClientChannel open(URI uri, ClientChannel.Handler handler);
}
