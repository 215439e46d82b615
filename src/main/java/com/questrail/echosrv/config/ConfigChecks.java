package com.questrail.echosrv.config;

import com.questrail.echosrv.error.EchoConfigException;

import java.time.Duration;

final class ConfigChecks
{
    private ConfigChecks() {
    }

    static void positive(Duration value, String name) {
        if (value == null) {
            throw new EchoConfigException(name + " must be set");
        }
        if (value.isZero() || value.isNegative()) {
            throw new EchoConfigException(name + " must be positive, got " + value);
        }
    }

    static void atLeastOne(long value, String name) {
        if (value < 1) {
            throw new EchoConfigException(name + " must be at least 1, got " + value);
        }
    }
}
