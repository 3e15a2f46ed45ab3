package com.ecvi.riskengine.verify.http;

import org.springframework.stereotype.Component;

import java.net.InetAddress;
import java.net.UnknownHostException;
import java.util.ArrayList;
import java.util.List;

@Component
public class InetAddressHostResolver implements HostResolver {

    @Override
    public HostResolution resolve(String host) {
        if (host == null || host.isBlank()) {
            return HostResolution.notFound(host);
        }
        try {
            InetAddress[] resolved = InetAddress.getAllByName(host.trim());
            List<String> addresses = new ArrayList<>();
            for (InetAddress address : resolved) {
                addresses.add(address.getHostAddress());
            }
            return new HostResolution(host, addresses);
        } catch (UnknownHostException e) {
            return HostResolution.notFound(host);
        } catch (SecurityException e) {
            throw new AdapterTransientException("resolver_error: " + e.getMessage(), e);
        }
    }
}
