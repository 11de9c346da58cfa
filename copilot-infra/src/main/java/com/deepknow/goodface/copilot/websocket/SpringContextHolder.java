package com.deepknow.goodface.copilot.websocket;

import org.springframework.context.ApplicationContext;
import org.springframework.context.ApplicationContextAware;
import org.springframework.stereotype.Component;

/**
 * 供容器实例化的 WebSocket 端点回查 Spring Bean。
 */
@Component
public class SpringContextHolder implements ApplicationContextAware {
    private static ApplicationContext ctx;

    @Override
    public void setApplicationContext(ApplicationContext applicationContext) {
        SpringContextHolder.ctx = applicationContext;
    }

    public static <T> T getBean(Class<T> clazz) {
        return ctx == null ? null : ctx.getBean(clazz);
    }
}
