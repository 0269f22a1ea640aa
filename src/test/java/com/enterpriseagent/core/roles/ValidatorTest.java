package com.enterpriseagent.core.roles;

import com.enterpriseagent.core.model.Domain;
import com.enterpriseagent.core.model.ValidationReport;
import com.enterpriseagent.core.model.ValidationResult;
import com.enterpriseagent.core.state.RunState;
import com.enterpriseagent.core.validation.DomainValidator;
import com.enterpriseagent.core.validation.DomainValidators;
import com.enterpriseagent.core.validation.SecretsProvider;
import com.enterpriseagent.core.validation.ValidationRequest;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class ValidatorTest {

    private RoleFixtures fx;
    private DomainValidators validators;
    private Validator validator;

    @BeforeEach
    void setUp() {
        fx = RoleFixtures.offline();
        validators = mock(DomainValidators.class);
        validator = new Validator(fx.support, validators, new SecretsProvider(fx.toolProperties), fx.toolProperties);
    }

    @Test
    void delegatesToDomainCheckWithPackThreshold() {
        var pack = new DomainProperties.Pack();
        pack.setCoverageThreshold(0.9);
        fx.domainProperties.setPacks(Map.of("trading", pack));
        DomainValidator check = mock(DomainValidator.class);
        when(check.validate(any())).thenReturn(new ValidationResult(false, "risk", 0.0, Map.of()));
        when(validators.forDomain(Domain.TRADING)).thenReturn(check);

        ValidationReport report = validator.validate("strategy", "trading");

        assertFalse(report.raw().passes());
        var request = ArgumentCaptor.forClass(ValidationRequest.class);
        verify(check).validate(request.capture());
        assertEquals(0.9, request.getValue().coverageThreshold());
    }

    @Test
    void unknownDomainPasses() {
        ValidationReport report = validator.validate("anything", "astrology");

        assertTrue(report.raw().passes());
        assertEquals(Validator.NO_VALIDATOR, report.raw().reason());
        verifyNoInteractions(validators);
    }

    @Test
    void applyFlagsReflectionOnFailure() {
        DomainValidator check = request -> new ValidationResult(false, "too long", 0.0, Map.of());
        when(validators.forDomain(Domain.SOCIAL_MEDIA)).thenReturn(check);

        var update = validator.apply(RunState.of("t", "social_media", false).merge(Map.of("output", "post")));

        assertEquals(true, update.get("needsReflect"));
        assertInstanceOf(ValidationResult.class, update.get("validation"));
    }
}
