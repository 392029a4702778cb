package com.crescent.gateway.core.auth;

import com.crescent.gateway.config.GatewayProperties;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class StaticCredentialValidatorTest {

    private final GatewayProperties properties = new GatewayProperties();
    private final StaticCredentialValidator validator = new StaticCredentialValidator(properties);

    private void addTenant(String id, String... keys) {
        GatewayProperties.Tenant tenant = new GatewayProperties.Tenant();
        tenant.setId(id);
        tenant.setApiKeys(Set.of(keys));
        properties.getAuth().getTenants().add(tenant);
    }

    @Test
    void shouldAcceptEveryCallerWhenNoKeysConfigured() {
        StepVerifier.create(validator.authenticate(null))
                .expectNext(CredentialValidator.ANONYMOUS_TENANT)
                .verifyComplete();
        StepVerifier.create(validator.authenticate("sk-anything"))
                .assertNext(tenant -> assertTrue(tenant.startsWith("key-"), tenant))
                .verifyComplete();
    }

    @Test
    void shouldMapTenantKeysToTheirTenant() {
        addTenant("team-a", "sk-a1", "sk-a2");
        properties.getAuth().getApiKeys().add("sk-shared");

        StepVerifier.create(validator.authenticate("sk-a2")).expectNext("team-a").verifyComplete();
        StepVerifier.create(validator.authenticate("sk-shared"))
                .expectNext(StaticCredentialValidator.defaultTenant("sk-shared"))
                .verifyComplete();
    }

    @Test
    void shouldRejectUnknownOrMissingCredentialOnceKeysConfigured() {
        addTenant("team-a", "sk-a1");

        StepVerifier.create(validator.authenticate("sk-other")).verifyComplete();
        StepVerifier.create(validator.authenticate(null)).verifyComplete();
    }

    @Test
    void shouldDeriveStableTenantFromKeyDigest() {
        String tenant = StaticCredentialValidator.defaultTenant("sk-client");

        assertEquals(tenant, StaticCredentialValidator.defaultTenant("sk-client"));
        assertEquals("key-".length() + 12, tenant.length());
        assertNotEquals(tenant, StaticCredentialValidator.defaultTenant("sk-client-2"));
        assertFalse(tenant.contains("sk-client"));
    }
}
