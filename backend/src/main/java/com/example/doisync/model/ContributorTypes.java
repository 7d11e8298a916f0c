package com.example.doisync.model;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

public final class ContributorTypes {

    public static final String OTHER = "Other";
    public static final String CONTACT_PERSON = "ContactPerson";
    public static final String FUNDER = "Funder";
    public static final String CREATOR_ROLE = "Creator";

    /** Contributor types accepted by the registry schema (kernel-4). */
    public static final List<String> REGISTRY_TYPES = List.of(
            "ContactPerson", "DataCollector", "DataCurator", "DataManager",
            "Distributor", "Editor", "HostingInstitution", "Producer",
            "ProjectLeader", "ProjectManager", "ProjectMember",
            "RegistrationAgency", "RegistrationAuthority", "RelatedPerson",
            "Researcher", "ResearchGroup", "RightsHolder", "Sponsor",
            "Supervisor", "Translator", "WorkPackageLeader", OTHER);

    private static final Set<String> REGISTRY_SET = Set.copyOf(REGISTRY_TYPES);
    // local role table also knows the internal "pointOfContact" role
    private static final Set<String> LOCAL_ROLE_SET;

    static {
        HashSet<String> roles = new HashSet<>(REGISTRY_TYPES);
        roles.add("pointOfContact");
        LOCAL_ROLE_SET = Set.copyOf(roles);
    }

    private ContributorTypes() {}

    public static boolean isRegistryType(String type) {
        return type != null && REGISTRY_SET.contains(type);
    }

    public static boolean isLocalRole(String type) {
        return type != null && LOCAL_ROLE_SET.contains(type);
    }

    /**
     * The single type the registry stores for a contributor: the first desired type if valid, else "Other".
     */
    public static String registryTypeFor(List<String> desiredTypes) {
        if (desiredTypes == null || desiredTypes.isEmpty()) return OTHER;
        String first = desiredTypes.get(0);
        return isRegistryType(first) ? first : OTHER;
    }
}
