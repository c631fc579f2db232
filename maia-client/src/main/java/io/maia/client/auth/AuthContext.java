package io.maia.client.auth;

import java.util.List;
import java.util.Map;

/**
 * Policy context returned by the identity provider together with a token. {@code auth} holds the
 * attributes of the issued token (token, user_id, project_id, domain_id, ...), {@code request}
 * the attributes that were asked for.
 */
public record AuthContext(Map<String, String> auth, Map<String, String> request, List<String> roles) {

    public static final String TOKEN = "token";
    public static final String USER_ID = "user_id";
    public static final String USER_NAME = "user_name";
    public static final String PROJECT_ID = "project_id";
    public static final String DOMAIN_ID = "domain_id";

    public AuthContext {
        auth = auth == null ? Map.of() : Map.copyOf(auth);
        request = request == null ? Map.of() : Map.copyOf(request);
        roles = roles == null ? List.of() : List.copyOf(roles);
    }

    public static AuthContext empty() {
        return new AuthContext(Map.of(), Map.of(), List.of());
    }

    public String token() {
        return auth.get(TOKEN);
    }

    /**
     * The project id if the token is project scoped, otherwise the domain id (which may be absent).
     */
    public String tenantId() {
        var projectId = auth.get(PROJECT_ID);
        return projectId != null ? projectId : auth.get(DOMAIN_ID);
    }

    @Override
    public String toString() {
        return "AuthContext[user=" + auth.get(USER_NAME) + "/" + auth.get(USER_ID) +
               ", tenant=" + tenantId() + ", roles=" + roles + "]";
    }
}
