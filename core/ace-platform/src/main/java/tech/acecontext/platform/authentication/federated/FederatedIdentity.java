package tech.acecontext.platform.authentication.federated;

/**
 * Identity claims returned by the federated provider.
 *
 * @param subject stable provider subject; becomes the tenant id
 * @param email   may be null when the provider withholds it
 */
public record FederatedIdentity(String subject, String email) {
}
