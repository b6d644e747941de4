package beacon.core.model.identity;

import java.util.Set;

/**
 * Role names carried by identities.
 */
public final class Roles {

    public static final String SUPER_ADMIN = "super_admin";
    public static final String ADMIN = "admin";
    public static final String NGO_ADMIN = "ngo_admin";
    public static final String VOLUNTEER = "volunteer";
    public static final String DONOR = "donor";
    public static final String BENEFICIARY = "beneficiary";

    /** Roles allowed to operate on organization-wide data. */
    public static final Set<String> MANAGERS = Set.of(SUPER_ADMIN, ADMIN, NGO_ADMIN);

    private Roles() {}

    public static boolean isPlatformAdmin(String role) {
        return SUPER_ADMIN.equals(role) || ADMIN.equals(role);
    }
}
