package org.stbridge.converter.report;

public enum LogLevel {
    DEBUG,
    INFO,
    WARN,
    ERROR
}
