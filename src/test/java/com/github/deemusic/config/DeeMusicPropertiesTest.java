package com.github.deemusic.config;

import com.github.deemusic.model.AudioQuality;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validation;
import jakarta.validation.Validator;
import jakarta.validation.ValidatorFactory;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Set;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("DeeMusicProperties")
class DeeMusicPropertiesTest {

    private static ValidatorFactory factory;
    private static Validator validator;

    @BeforeAll
    static void setUpValidator() {
        factory = Validation.buildDefaultValidatorFactory();
        validator = factory.getValidator();
    }

    @AfterAll
    static void closeValidator() {
        factory.close();
    }

    private static Set<String> invalidPaths(DeeMusicProperties properties) {
        return validator.validate(properties).stream()
                .map(ConstraintViolation::getPropertyPath)
                .map(Object::toString)
                .collect(Collectors.toSet());
    }

    @Test
    @DisplayName("defaults should be valid")
    void defaults() {
        DeeMusicProperties properties = new DeeMusicProperties();

        assertTrue(invalidPaths(properties).isEmpty());
        assertEquals(8, properties.getDownload().getConcurrentDownloads());
        assertEquals(AudioQuality.MP3_320, properties.getDownload().getQuality());
        assertEquals(3, properties.getRetry().getMaxRetries());
        assertEquals(2000, properties.getRetry().getInitialDelayMs());
        assertEquals(1000, properties.getScheduler().getIdlePollMs());
        assertFalse(properties.getCatalog().hasCredential());
    }

    @Test
    @DisplayName("should reject a worker pool outside 1..32")
    void workerBounds() {
        DeeMusicProperties properties = new DeeMusicProperties();

        properties.getDownload().setConcurrentDownloads(0);
        assertTrue(invalidPaths(properties).contains("download.concurrentDownloads"));

        properties.getDownload().setConcurrentDownloads(33);
        assertTrue(invalidPaths(properties).contains("download.concurrentDownloads"));
    }

    @Test
    @DisplayName("should reject negative retry settings")
    void retryBounds() {
        DeeMusicProperties properties = new DeeMusicProperties();
        properties.getRetry().setMaxRetries(-1);
        properties.getRetry().setMultiplier(0);

        Set<String> invalid = invalidPaths(properties);

        assertTrue(invalid.contains("retry.maxRetries"));
        assertTrue(invalid.contains("retry.multiplier"));
    }

    @Test
    @DisplayName("should reject a blank output directory")
    void blankOutputDir() {
        DeeMusicProperties properties = new DeeMusicProperties();
        properties.getDownload().setOutputDir(" ");

        assertTrue(invalidPaths(properties).contains("download.outputDir"));
    }

    @Test
    @DisplayName("a configured ARL should count as a credential")
    void credential() {
        DeeMusicProperties properties = new DeeMusicProperties();
        properties.getCatalog().setArl("abc123");

        assertTrue(properties.getCatalog().hasCredential());
    }
}
