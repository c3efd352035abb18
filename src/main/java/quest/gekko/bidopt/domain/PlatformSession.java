package quest.gekko.bidopt.domain;

/**
 * Caller identity handed to the optimizer: the tenant that scopes settings and cooldown rows,
 * and the opaque ads platform credential. Single-tenant deployments use a fixed tenant id.
 */
public record PlatformSession(String tenantId, String accessToken) {

    public boolean hasCredential() {
        return accessToken != null && !accessToken.isBlank()
                && !"null".equals(accessToken) && !"undefined".equals(accessToken);
    }

    @Override
    public String toString() {
        return "PlatformSession[tenantId=" + tenantId + ", credential=" + (hasCredential() ? "***" : "none") + "]";
    }
}
