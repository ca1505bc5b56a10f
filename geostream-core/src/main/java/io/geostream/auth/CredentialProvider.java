package io.geostream.auth;

/**
 * Supplies the credentials used once per subscription attempt.
 *
 * <p>Where the secrets come from (file, environment, vault) is up to the implementation.
 * Called on every (re)connect, so rotated secrets are picked up without a restart.
 *
 * @see PropertiesFileCredentialProvider
 * @see EnvironmentCredentialProvider
 */
@FunctionalInterface
public interface CredentialProvider {

    /**
     * Returns the current credentials.
     *
     * @return the credentials (never null)
     * @throws AuthException if the credentials cannot be loaded
     */
    OAuthCredentials credentials();

    /**
     * Returns a provider that always supplies the given credentials.
     *
     * @param credentials the fixed credentials
     * @return a constant provider
     */
    static CredentialProvider of(OAuthCredentials credentials) {
        java.util.Objects.requireNonNull(credentials, "credentials");
        return () -> credentials;
    }
}
