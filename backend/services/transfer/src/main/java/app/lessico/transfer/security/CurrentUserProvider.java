package app.lessico.transfer.security;

import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.stereotype.Component;

import java.util.Optional;

@Component
public class CurrentUserProvider {

    public Optional<String> getTenantId(Jwt jwt) {
        if (jwt == null) {
            return Optional.empty();
        }
        String claim = jwt.getClaimAsString("user_id");
        if (claim == null || claim.isBlank()) {
            return Optional.empty();
        }
        return Optional.of(claim.trim());
    }

    public String requireTenantId(Jwt jwt) {
        return getTenantId(jwt)
                .orElseThrow(() -> new IllegalStateException("user_id claim missing"));
    }
}
