package com.phillippitts.styleswap.config.properties;

import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validation;
import jakarta.validation.Validator;
import jakarta.validation.ValidatorFactory;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

class TransferPropertiesValidationTest {

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
        assertThat(validator.validate(new ImageBoundsProperties())).isEmpty();
        assertThat(validator.validate(new TransferConcurrencyProperties())).isEmpty();
        assertThat(validator.validate(new OutputStorageProperties())).isEmpty();
    }

    @Test
    void defaultAcquireTimeoutCoversQueuedTransfers() {
        TransferConcurrencyProperties concurrency = new TransferConcurrencyProperties();

        assertThat(concurrency.getMaxConcurrent()).isEqualTo(1);
        assertThat(concurrency.getAcquireTimeoutMs()).isEqualTo(300_000L);
    }

    @Test
    void rejectsMinimumAboveMaximum() {
        ImageBoundsProperties bounds = new ImageBoundsProperties();
        bounds.setMinSize(600);

        Set<ConstraintViolation<ImageBoundsProperties>> violations = validator.validate(bounds);

        assertThat(violations).extracting(ConstraintViolation::getMessage)
                .containsExactly("Minimum image size must not exceed maximum image size");
    }

    @Test
    void rejectsNonPositiveConcurrency() {
        TransferConcurrencyProperties concurrency = new TransferConcurrencyProperties();
        concurrency.setMaxConcurrent(0);
        concurrency.setAcquireTimeoutMs(-1);

        assertThat(validator.validate(concurrency)).hasSize(2);
    }

    @Test
    void rejectsBlankFilePrefix() {
        OutputStorageProperties output = new OutputStorageProperties();
        output.setFilePrefix(" ");

        assertThat(validator.validate(output)).extracting(ConstraintViolation::getMessage)
                .containsExactly("File prefix must not be blank");
    }
}
