package com.remotelink.gateway.auth;

/**
 * Login attempt.
 *
 * @param remoteAddr caller address, used for failure throttling; may be null
 */
public record Credentials(String username, String password, String remoteAddr) {

    @Override
    public String toString() {
        return "Credentials[username=" + username + ", remoteAddr=" + remoteAddr + "]";
    }
}
