package io.maia.client.auth;

/**
 * An authenticated session: bearer token, backend URL and the policy context the token was issued with.
 * Lives for a single command invocation.
 */
public record Session(String token, String backendUrl, AuthContext context) {

    @Override
    public String toString() {
        return "Session[token=***, backendUrl=" + backendUrl + ", context=" + context + "]";
    }
}
