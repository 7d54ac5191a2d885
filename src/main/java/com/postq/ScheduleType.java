package com.postq;

public enum ScheduleType {
    ONCE,
    RECURRING
}
