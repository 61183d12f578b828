package com.openrangelabs.donpetre.pipeline;

import org.junit.platform.suite.api.SelectPackages;
import org.junit.platform.suite.api.Suite;
import org.junit.platform.suite.api.SuiteDisplayName;

/**
 * Test suite for running all data ingestion tests
 *
 * Usage:
 * - Run all tests: mvn test
 * - Run specific suite: mvn test -Dtest=TestSuite
 */
@Suite
@SuiteDisplayName("Data Ingestion Core Test Suite")
@SelectPackages({
    "com.openrangelabs.donpetre.pipeline.fingerprint",
    "com.openrangelabs.donpetre.pipeline.model",
    "com.openrangelabs.donpetre.pipeline.processor",
    "com.openrangelabs.donpetre.pipeline.connector",
    "com.openrangelabs.donpetre.pipeline.storage",
    "com.openrangelabs.donpetre.pipeline.service",
    "com.openrangelabs.donpetre.pipeline.upload"
})
public class TestSuite {
    // JUnit 5 discovers and runs all tests in the selected packages
}
