package gov.pmis.budget_ledger.approval;

import lombok.Value;

import java.util.Arrays;
import java.util.Locale;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * The acting user and the roles the authenticating gateway granted them.
 * Role names are compared case-insensitively.
 */
@Value
public class Approver {
    UUID userId;
    Set<String> roles;

    public static Approver of(UUID userId, Set<String> roles) {
        return new Approver(userId, roles.stream()
            .map(role -> role.trim().toUpperCase(Locale.ROOT))
            .filter(role -> !role.isEmpty())
            .collect(Collectors.toUnmodifiableSet()));
    }

    /**
     * Builds an approver from the gateway's {@code X-User-Id} and comma-separated
     * {@code X-User-Roles} headers. A missing roles header means no roles.
     */
    public static Approver fromHeaders(UUID userId, String rolesHeader) {
        if (rolesHeader == null || rolesHeader.isBlank()) {
            return new Approver(userId, Set.of());
        }
        return of(userId, Arrays.stream(rolesHeader.split(",")).collect(Collectors.toSet()));
    }

    public boolean hasRole(String role) {
        return role != null && roles.stream().anyMatch(held -> held.equalsIgnoreCase(role.trim()));
    }
}
