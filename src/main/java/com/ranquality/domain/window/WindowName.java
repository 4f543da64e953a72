package com.ranquality.domain.window;

public enum WindowName {
    BEFORE,
    AFTER,
    LAST
}
