package com.deepknow.goodface.copilot.domain.agent;

/**
 * 密钥解析：直接配置的 apiKey 优先，其次读取 apiKeyEnv 指定的环境变量。
 */
public final class ApiKeys {

    private ApiKeys() {}

    public static String resolve(String apiKey, String apiKeyEnv) {
        if (apiKey != null && !apiKey.isBlank()) {
            return apiKey.trim();
        }
        if (apiKeyEnv != null && !apiKeyEnv.isBlank()) {
            String v = System.getenv(apiKeyEnv);
            if (v != null && !v.isBlank()) {
                return v.trim();
            }
        }
        return null;
    }

    /**
     * 日志中只展示末 4 位。
     */
    public static String mask(String apiKey) {
        if (apiKey == null || apiKey.isEmpty()) {
            return "<none>";
        }
        return apiKey.length() <= 4 ? "****" : "****" + apiKey.substring(apiKey.length() - 4);
    }
}
