package com.provesql.test;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.TestInfo;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Base class for all tests.
 *
 * <p>Subclasses override {@link #doSetUp()} and {@link #doTearDown()} instead
 * of declaring their own lifecycle methods, and use {@link #logStep(String)}
 * to document Given/When/Then steps.
 */
public abstract class TestBase {

    protected final Logger logger = LoggerFactory.getLogger(getClass());

    private String testName;

    @BeforeEach
    public final void setUp(TestInfo testInfo) {
        testName = testInfo.getDisplayName();
        logger.debug("Starting test: {}", testName);
        doSetUp();
    }

    @AfterEach
    public final void tearDown() {
        doTearDown();
        logger.debug("Finished test: {}", testName);
    }

    /**
     * Per-test setup hook.
     */
    protected void doSetUp() {
    }

    /**
     * Per-test teardown hook.
     */
    protected void doTearDown() {
    }

    protected void logStep(String step) {
        logger.debug("[{}] {}", testName, step);
    }

    protected void logData(String label, Object value) {
        logger.debug("[{}] {}: {}", testName, label, value);
    }
}
