package com.phillippitts.blast.config.properties;

import com.phillippitts.blast.service.recovery.ErrorCategory;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validation;
import jakarta.validation.Validator;
import jakarta.validation.ValidatorFactory;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

class TelemetryPropertiesValidationTest {

    private static ValidatorFactory factory;
    private static Validator validator;

    @BeforeAll
    static void setUp() {
        factory = Validation.buildDefaultValidatorFactory();
        validator = factory.getValidator();
    }

    @AfterAll
    static void tearDown() {
        factory.close();
    }

    @Test
    void defaultsAreValid() {
        assertThat(validator.validate(new LogRouterProperties())).isEmpty();
        assertThat(validator.validate(new PerformanceProperties())).isEmpty();
        assertThat(validator.validate(new SerialLoggerProperties())).isEmpty();
        assertThat(validator.validate(new WatchdogProperties())).isEmpty();
        assertThat(validator.validate(new RecoveryProperties())).isEmpty();
    }

    @Test
    void rejectsZeroQueueCapacity() {
        LogRouterProperties props = new LogRouterProperties();
        props.setQueueCapacity(0);

        Set<ConstraintViolation<LogRouterProperties>> violations = validator.validate(props);

        assertThat(violations).extracting(ConstraintViolation::getMessage)
                .containsExactly("Queue capacity must be positive");
    }

    @Test
    void rejectsNegativeRetention() {
        LogRouterProperties props = new LogRouterProperties();
        props.setRetentionDays(-1);

        assertThat(validator.validate(props)).extracting(ConstraintViolation::getMessage)
                .containsExactly("Retention days must be >= 0");
    }

    @Test
    void rejectsNonPositiveDataLagThresholds() {
        PerformanceProperties props = new PerformanceProperties();
        props.setDataLagWarningMs(0);
        props.setDataLagCriticalMs(-5);

        assertThat(validator.validate(props)).extracting(ConstraintViolation::getMessage)
                .containsExactlyInAnyOrder("Data lag warning threshold must be positive",
                        "Data lag critical threshold must be positive");
    }

    @Test
    void rejectsNonPositiveIntervals() {
        PerformanceProperties props = new PerformanceProperties();
        props.setSampleIntervalSeconds(0);
        props.setLogIntervalSeconds(-1);

        assertThat(validator.validate(props)).hasSize(2);
    }

    @Test
    void rejectsInvalidCategoryPolicy() {
        RecoveryProperties props = new RecoveryProperties();
        RecoveryProperties.CategoryPolicy policy = RecoveryProperties.CategoryPolicy.defaultsFor(ErrorCategory.TIMEOUT);
        policy.setExponentialBase(0.5);
        props.getCategories().put(ErrorCategory.TIMEOUT, policy);

        assertThat(validator.validate(props)).extracting(ConstraintViolation::getMessage)
                .containsExactly("Exponential base must be >= 1.0");
    }

    @Test
    void categoryDefaultsFollowErrorCategoryBudgets() {
        RecoveryProperties props = new RecoveryProperties();

        assertThat(props.policyFor(ErrorCategory.CONNECTION_LOSS).getMaxAttempts()).isEqualTo(3);
        assertThat(props.policyFor(ErrorCategory.CONNECTION_LOSS).getInitialDelayMs()).isEqualTo(1000);
        assertThat(props.policyFor(ErrorCategory.TIMEOUT).getMaxAttempts()).isEqualTo(5);
        assertThat(props.policyFor(ErrorCategory.RESOURCE_EXHAUSTION).getInitialDelayMs()).isEqualTo(2000);
    }

    @Test
    void missingCategoryFallsBackToDefaults() {
        RecoveryProperties props = new RecoveryProperties();
        props.getCategories().remove(ErrorCategory.NETWORK);

        assertThat(props.policyFor(ErrorCategory.NETWORK).getMaxAttempts()).isEqualTo(5);
    }

    @Test
    void watchdogDefaultsDeclareStandComponents() {
        assertThat(new WatchdogProperties().getComponents())
                .containsEntry("data_acquisition", 10.0)
                .containsEntry("serial_communication", 15.0);
    }
}
