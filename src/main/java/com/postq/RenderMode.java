package com.postq;

public enum RenderMode {
    HTML,
    MARKDOWN,
    NONE
}
