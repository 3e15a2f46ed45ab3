package com.ecvi.riskengine.verify.http;

/**
 * Resolves a host name to its addresses. Implementations return an empty
 * {@link HostResolution} for names that do not exist and throw
 * {@link AdapterTransientException} when the resolver itself could not answer.
 */
public interface HostResolver {
    HostResolution resolve(String host);
}
