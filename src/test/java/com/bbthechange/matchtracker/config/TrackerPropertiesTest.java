package com.bbthechange.matchtracker.config;

import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validation;
import jakarta.validation.Validator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

class TrackerPropertiesTest {

    private Validator validator;

    @BeforeEach
    void setUp() {
        validator = Validation.buildDefaultValidatorFactory().getValidator();
    }

    @Test
    void defaults_AreValid() {
        TrackerProperties properties = new TrackerProperties();

        assertThat(validator.validate(properties)).isEmpty();
        assertThat(properties.getIntervalSteps())
                .extracting(TrackerProperties.IntervalStep::getIntervalMinutes)
                .containsExactly(5, 15, 60);
        assertThat(properties.getFetch().getMaxRetries()).isEqualTo(3);
        assertThat(properties.getNotifications().getMaxResultAttempts()).isEqualTo(10);
    }

    @Test
    void zeroMinimumInterval_IsRejected() {
        TrackerProperties properties = new TrackerProperties();
        properties.setMinIntervalMinutes(0);

        Set<ConstraintViolation<TrackerProperties>> violations = validator.validate(properties);

        assertThat(violations).extracting(v -> v.getPropertyPath().toString())
                .containsExactly("minIntervalMinutes");
    }

    @Test
    void nestedStepAndFetchValues_AreValidated() {
        TrackerProperties properties = new TrackerProperties();
        properties.setIntervalSteps(List.of(new TrackerProperties.IntervalStep(60, 0)));
        properties.getFetch().setMaxRetries(0);

        Set<ConstraintViolation<TrackerProperties>> violations = validator.validate(properties);

        assertThat(violations).extracting(v -> v.getPropertyPath().toString())
                .containsExactlyInAnyOrder("intervalSteps[0].intervalMinutes", "fetch.maxRetries");
    }
}
