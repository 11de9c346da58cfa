package com.deepknow.goodface.copilot.domain.agent.stt;

import com.deepknow.goodface.copilot.domain.agent.SessionSchedulers;
import com.deepknow.goodface.copilot.domain.agent.SttConnector;
import com.deepknow.goodface.copilot.domain.agent.SttSessionListener;
import org.springframework.stereotype.Component;

/**
 * 每次 start_recording 创建一个全新的 {@link SttSession}。
 */
@Component
public class SttSessionFactory {
    private final SttConnector connector;
    private final SttConfigProperties props;
    private final SessionSchedulers schedulers;

    public SttSessionFactory(SttConnector connector, SttConfigProperties props, SessionSchedulers schedulers) {
        this.connector = connector;
        this.props = props;
        this.schedulers = schedulers;
    }

    public SttSession create(String wsSessionId, SttSessionListener listener) {
        return new SttSession(wsSessionId, connector, props.toOptions(), schedulers.scheduler(),
                props.getOpenTimeoutMs(), props.getCloseGraceMs(), listener);
    }
}
