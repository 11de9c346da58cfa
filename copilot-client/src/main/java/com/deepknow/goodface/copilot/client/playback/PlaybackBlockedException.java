package com.deepknow.goodface.copilot.client.playback;

/**
 * 播放被宿主环境拒绝（例如需要用户手势），稍后可通过 resume 重试。
 */
public class PlaybackBlockedException extends Exception {

    public PlaybackBlockedException(String message) {
        super(message);
    }

    public PlaybackBlockedException(String message, Throwable cause) {
        super(message, cause);
    }
}
