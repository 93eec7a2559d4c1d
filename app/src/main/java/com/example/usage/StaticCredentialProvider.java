package com.example.usage;

public class StaticCredentialProvider implements CredentialProvider {
    private final String token;

    public StaticCredentialProvider(String token) {
        this.token = token;
    }

    @Override
    public String bearerToken(String subscriptionId) {
        if (token == null || token.isBlank()) {
            throw new UnauthorizedException("No access token configured for subscription " + subscriptionId, 0, 0);
        }
        return token.trim();
    }
}
