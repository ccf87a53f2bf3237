package io.stagecraft.core.report;

import io.stagecraft.core.util.WireEnum;

/// Origin of a {@link LogLine}.
public enum LogStream implements WireEnum {
    STDOUT("stdout"),
    STDERR("stderr"),
    SYSTEM("system");

    private final String wireValue;

    LogStream(String wireValue) {
        this.wireValue = wireValue;
    }

    @Override
    public String wireValue() {
        return wireValue;
    }
}
