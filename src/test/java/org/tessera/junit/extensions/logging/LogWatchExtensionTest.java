package org.tessera.junit.extensions.logging;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static org.tessera.junit.extensions.logging.LogLevel.ERROR;
import static org.tessera.junit.extensions.logging.LogLevel.INFO;
import static org.tessera.junit.extensions.logging.LogLevel.WARN;

/**
 * Tests the rules of LogWatchExtension and their isolation between test methods.
 * <p>
 * Every method logs something that would fail one of the other methods, so a
 * rule or event leaking across methods shows up as a failure.
 */
@Tag("unit")
@ExtendWith(LogWatchExtension.class)
class LogWatchExtensionTest {

    private static final Logger logger = LoggerFactory.getLogger(LogWatchExtensionTest.class);

    @Test
    @ExpectLog(level = ERROR, messagePattern = "Expected error \\d+")
    void expectedErrorIsTolerated() {
        logger.info("Some info");
        logger.error("Expected error 1");
    }

    @Test
    @ExpectLog(level = WARN, messagePattern = "Repeated warning", occurrences = 3)
    void expectedLogIsCounted() {
        logger.warn("Repeated warning");
        logger.warn("Repeated warning");
        logger.warn("Repeated warning");
    }

    @Test
    @ExpectLog(level = INFO, loggerPattern = "org.tessera.junit.extensions.logging.*",
               messagePattern = "Started .*")
    @ExpectLog(level = INFO, messagePattern = "Finished .*")
    void severalExpectationsOnOneMethod() {
        logger.info("Started run 7");
        logger.info("Finished run 7");
    }

    @Test
    @AllowLog(level = WARN, messagePattern = "First known warning")
    @AllowLog(level = WARN, messagePattern = "Second known warning")
    void allowedWarningsAreOptional() {
        logger.warn("Second known warning");
    }

    @Test
    @FailOnLog(level = ERROR)
    void warningsPassWhenOnlyErrorsFail() {
        logger.warn("Tolerated by the raised threshold");
    }

    @Test
    @FailOnLog(disabled = true)
    void disabledWatchToleratesEverything() {
        logger.warn("Unchecked warning");
        logger.error("Unchecked error");
    }

    @Test
    void nothingLeaksIntoAQuietTest() {
        logger.info("Only info here");
        logger.debug("And debug");
    }
}
