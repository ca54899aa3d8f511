package com.rentnest.tm30.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.security.oauth2.jwt.Jwt;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Identity of whoever is calling a TM30 endpoint: a signed-in user, an operator,
 * or an internal service presenting the shared key
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Tm30Caller {

    public static final Set<String> OPERATOR_ROLES = Set.of("ADMIN", "AGENT");

    private String userId;

    @Builder.Default
    private Set<String> roles = Set.of();

    /**
     * Value of the {@code X-API-Key} header, if any
     */
    private String apiKey;

    public boolean isOperator() {
        return roles.stream().anyMatch(OPERATOR_ROLES::contains);
    }

    /**
     * Build a caller from the (optional) authenticated JWT and the internal key header.
     * Roles are read from the {@code roles} claim, the same claim the security filter maps to authorities.
     */
    public static Tm30Caller from(Jwt jwt, String apiKey) {
        if (jwt == null) {
            return Tm30Caller.builder().apiKey(apiKey).build();
        }
        Set<String> roles = new HashSet<>();
        List<String> direct = jwt.getClaimAsStringList("roles");
        if (direct != null) {
            direct.forEach(r -> roles.add(normalizeRole(r)));
        }
        return Tm30Caller.builder()
                .userId(jwt.getSubject())
                .roles(Set.copyOf(roles))
                .apiKey(apiKey)
                .build();
    }

    private static String normalizeRole(String role) {
        String upper = role.toUpperCase();
        return upper.startsWith("ROLE_") ? upper.substring(5) : upper;
    }
}
