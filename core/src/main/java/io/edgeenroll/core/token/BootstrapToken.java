package io.edgeenroll.core.token;

/**
 * A join token handed to an operator for a new edge node: the CA pin followed
 * by the bearer credential, rendered as {@code <caHash>.<jwt>}. The edge node
 * checks the downloaded CA against {@code caHash} and sends only {@code jwt}
 * in its {@code Authorization} header.
 *
 * @param caHash hex SHA-256 of the CA certificate DER
 * @param jwt    the signed bearer credential
 */
public record BootstrapToken(String caHash, String jwt) {

    /** Splits a rendered join token back into its parts. */
    public static BootstrapToken parse(String joinToken) {
        int dot = joinToken == null ? -1 : joinToken.indexOf('.');
        if (dot <= 0 || dot == joinToken.length() - 1) {
            throw new IllegalArgumentException("join token must look like <caHash>.<jwt>");
        }
        return new BootstrapToken(joinToken.substring(0, dot), joinToken.substring(dot + 1));
    }

    @Override
    public String toString() {
        return caHash + "." + jwt;
    }
}
