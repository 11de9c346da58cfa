package com.deepknow.goodface.copilot.api.model;

import lombok.Data;

import java.io.Serializable;

@Data
public class CachedFileInfo implements Serializable {
    private static final long serialVersionUID = 1L;

    private String path;
    private int size;
    private long lastModified;
}
