package com.example.usage;

/**
 * Supplies a bearer token valid for one subscription's tenant. Login and token refresh live
 * behind this seam; the fetcher only reads the token.
 */
@FunctionalInterface
public interface CredentialProvider {
    String bearerToken(String subscriptionId);
}
