package com.deepknow.goodface.copilot.api.request;

import lombok.Data;

import java.io.Serializable;

@Data
public class FileUpdateRequest implements Serializable {
    private static final long serialVersionUID = 1L;

    private String filePath;
    private String content;
    private Long timestamp; // 客户端修改时间，毫秒；为空时取服务端时间
}
