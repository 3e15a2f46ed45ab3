package com.ecvi.riskengine.verify.http;

import java.util.List;

public record HostResolution(String host, List<String> addresses) {
    public HostResolution {
        addresses = addresses == null ? List.of() : List.copyOf(addresses);
    }

    public static HostResolution notFound(String host) {
        return new HostResolution(host, List.of());
    }

    public boolean resolvable() {
        return !addresses.isEmpty();
    }
}
