package com.keystone.core.resources;

public enum LimitStatus {
    NORMAL,
    WARNING,
    EXCEEDED
}
