package com.foo.tariff.exception;

import lombok.Getter;

@Getter
public class TariffNotFoundException extends TariffEngineException {

    private final String port;
    private final Long requestedVersion;

    public TariffNotFoundException(String port, Long requestedVersion) {
        super(buildMessage(port, requestedVersion));
        this.port = port;
        this.requestedVersion = requestedVersion;
    }

    private static String buildMessage(String port, Long requestedVersion) {
        if (requestedVersion != null) {
            return "No tariff schedule version %d covering port '%s'".formatted(requestedVersion, port);
        }
        return "No tariff schedule covering port '%s'".formatted(port);
    }
}
