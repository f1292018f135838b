package io.github.azauth.usercontext;

/**
 * The end user on whose behalf an inbound request is being served.
 *
 * <p>A context with a null login identifies a request that is associated with a session
 * but not with a particular user. An empty login identifies a user that cannot be
 * mapped to a directory account.
 */
public final class CurrentUserContext {

    private final String login;
    private final String idToken;
    private final String accessToken;

    /**
     * Creates a user context.
     *
     * @param login       the user's login name, or null when there is no user
     * @param idToken     the user's delegated ID token, or null
     * @param accessToken the user's access token, or null
     */
    public CurrentUserContext(String login, String idToken, String accessToken) {
        this.login = login;
        this.idToken = idToken;
        this.accessToken = accessToken;
    }

    public static CurrentUserContext of(String login, String idToken) {
        return new CurrentUserContext(login, idToken, null);
    }

    public String getLogin() {
        return login;
    }

    public String getIdToken() {
        return idToken;
    }

    public String getAccessToken() {
        return accessToken;
    }

    /**
     * Returns whether the context carries a user at all.
     */
    public boolean hasUser() {
        return login != null;
    }

    @Override
    public String toString() {
        return "CurrentUserContext{" +
                "login='" + login + '\'' +
                ", idToken=" + (idToken != null ? "***" : "null") +
                ", accessToken=" + (accessToken != null ? "***" : "null") +
                '}';
    }
}
