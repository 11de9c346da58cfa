package com.deepknow.goodface.copilot.client.connection;

import java.io.IOException;
import java.net.URI;
import java.util.ArrayList;
import java.util.List;

/**
 * 记录每次打开的通道；事件由测试通过 FakeChannel 手动触发。
 */
public class FakeChannelFactory implements ChannelFactory {
    public final List<FakeChannel> opened = new ArrayList<>();

    @Override
    public ClientChannel open(URI uri, ClientChannel.Handler handler) {
        FakeChannel channel = new FakeChannel(handler);
        opened.add(channel);
        return channel;
    }

    public FakeChannel last() {
        return opened.get(opened.size() - 1);
    }

    public static class FakeChannel implements ClientChannel {
        private ClientChannel.Handler handler;
        public ReadyState state = ReadyState.CONNECTING;
        public final List<String> texts = new ArrayList<>();
        public final List<byte[]> binaries = new ArrayList<>();
        public Integer closeCode;
        public String closeReason;
        public boolean detached;

        FakeChannel(ClientChannel.Handler handler) {
            this.handler = handler;
        }

        @Override
        public ReadyState readyState() {
            return state;
        }

        @Override
        public void sendText(String text) {
            texts.add(text);
        }

        @Override
        public void sendBinary(byte[] data) {
            binaries.add(data);
        }

        @Override
        public void close(int code, String reason) {
            closeCode = code;
            closeReason = reason;
            state = ReadyState.CLOSED;
        }

        @Override
        public void detachHandlers() {
            detached = true;
            handler = ClientChannel.Handler.NO_OP;
        }

        public void fireOpen() {
            state = ReadyState.OPEN;
            handler.onOpen();
        }

        public void fireText(String text) {
            handler.onText(text);
        }

        public void fireClose(int code) {
            state = ReadyState.CLOSED;
            handler.onClose(code, "");
        }

        public void fireError() {
            state = ReadyState.CLOSED;
            handler.onError(new IOException("connection refused"));
        }
    }
}
