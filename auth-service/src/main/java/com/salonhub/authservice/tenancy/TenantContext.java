package com.salonhub.authservice.tenancy;

import com.salonhub.authservice.exceptions.InvalidTokenException;
import com.salonhub.authservice.services.VerifiedAccessToken;

import java.util.Objects;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * The tenant a unit of work runs under. A {@code null} tenant id means unscoped (super-admin) access.
 * <p>
 * There is no way to build one from a raw string: the tenant id comes either from a verified access
 * token or from an internal caller that names itself.
 */
public final class TenantContext {

    /** Allowed tenant id characters, also enforced where tenant ids are stored. */
    public static final String TENANT_ID_REGEX = "[a-zA-Z0-9_-]+";

    private static final Pattern TENANT_ID_FORMAT = Pattern.compile(TENANT_ID_REGEX);

    private final String tenantId;
    private final String origin;

    private TenantContext(String tenantId, String origin) {
        if (tenantId != null && !TENANT_ID_FORMAT.matcher(tenantId).matches()) {
            throw new IllegalArgumentException("Invalid tenant id format");
        }
        this.tenantId = tenantId;
        this.origin = origin;
    }

    /**
     * @throws InvalidTokenException if the token's tenant claim is not a well-formed tenant id
     */
    public static TenantContext fromVerifiedToken(VerifiedAccessToken token) {
        Objects.requireNonNull(token, "token");
        try {
            return new TenantContext(token.getTenantId(), "access-token:" + token.getUserId());
        } catch (IllegalArgumentException e) {
            throw new InvalidTokenException("Malformed tenant claim in token of user " + token.getUserId(), e);
        }
    }

    /**
     * Context for internal work that is not driven by a caller's token, such as scheduled jobs.
     */
    public static TenantContext system(String tenantId, String reason) {
        if (reason == null || reason.isBlank()) {
            throw new IllegalArgumentException("A system tenant context must state its reason");
        }
        return new TenantContext(tenantId, "system:" + reason);
    }

    public Optional<String> tenantId() {
        return Optional.ofNullable(tenantId);
    }

    public boolean isUnscoped() {
        return tenantId == null;
    }

    public String origin() {
        return origin;
    }

    /** Value written to the session variable. Unscoped access is the empty string. */
    String sessionValue() {
        return tenantId == null ? "" : tenantId;
    }

    @Override
    public String toString() {
        return "TenantContext[" + (tenantId == null ? "<unscoped>" : tenantId) + ", " + origin + "]";
    }
}
