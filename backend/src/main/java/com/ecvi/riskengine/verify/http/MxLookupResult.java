package com.ecvi.riskengine.verify.http;

import java.util.List;

public record MxLookupResult(String domain, boolean domainExists, List<String> exchanges) {
    public MxLookupResult {
        exchanges = exchanges == null ? List.of() : List.copyOf(exchanges);
    }

    public boolean hasMx() {
        return !exchanges.isEmpty();
    }
}
