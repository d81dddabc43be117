package com.slb.staking_backend.modules.operator.service;

import com.slb.staking_backend.common.exception.AuthorizationException;
import com.slb.staking_backend.common.exception.ValidationException;
import com.slb.staking_backend.config.StakingProperties;
import com.slb.staking_backend.modules.operator.vo.OperatorVo;
import com.slb.staking_backend.support.FakeOperatorMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.*;

class OperatorRegistryTest {

    private static final String OWNER = "0x00000000000000000000000000000000000000aa";
    private static final String OPERATOR = "0x00000000000000000000000000000000000000bb";

    private OperatorRegistry registry;

    @BeforeEach
    void setup() {
        StakingProperties properties = new StakingProperties();
        properties.setOwnerAddress(OWNER);
        registry = new OperatorRegistry(new FakeOperatorMapper(), properties,
                Clock.fixed(Instant.parse("2024-03-01T00:00:00Z"), ZoneOffset.UTC));
    }

    @Test
    void unknownAddress_isNotOperator() {
        assertFalse(registry.isOperator(OPERATOR));
        assertFalse(registry.isOperator(null));
        assertThrows(AuthorizationException.class, () -> registry.requireOperator(OPERATOR, "deposit.assign"));
    }

    @Test
    void ownerEnablesAndDisablesOperator() {
        OperatorVo enabled = registry.setEnabled(OWNER, "0x00000000000000000000000000000000000000BB", true);
        assertEquals(OPERATOR, enabled.getAddress());
        assertTrue(registry.isOperator(OPERATOR));
        registry.requireOperator(OPERATOR, "deposit.assign");

        registry.setEnabled(OWNER, OPERATOR, false);
        assertFalse(registry.isOperator(OPERATOR));
        assertEquals(1, registry.list().size());
    }

    @Test
    void ownerCheck_ignoresAddressCase() {
        assertTrue(registry.isOwner("0x00000000000000000000000000000000000000AA"));
        assertFalse(registry.isOwner(OPERATOR));
    }

    @Test
    void nonOwnerCannotChangeWhitelist() {
        AuthorizationException ex = assertThrows(AuthorizationException.class,
                () -> registry.setEnabled(OPERATOR, OPERATOR, true));
        assertEquals("operator.update", ex.getGuard());
        assertFalse(registry.isOperator(OPERATOR));
    }

    @Test
    void malformedAddress_isRejected() {
        assertThrows(ValidationException.class, () -> registry.setEnabled(OWNER, "0x1234", true));
    }
}
