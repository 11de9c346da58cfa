package com.deepknow.goodface.copilot.api.model;

import lombok.Data;

import java.io.Serializable;

@Data
public class FileSyncResult implements Serializable {
    private static final long serialVersionUID = 1L;

    private boolean success;
    private String filePath;
    private int cacheSize;
    private String message;
}
