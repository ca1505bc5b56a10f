/**
 * Credentials for the feed subscription.
 *
 * <p>{@link io.geostream.auth.CredentialProvider} supplies
 * {@link io.geostream.auth.OAuthCredentials} on each connect attempt;
 * {@link io.geostream.auth.AuthException} marks the one fatal failure class.
 */
package io.geostream.auth;
