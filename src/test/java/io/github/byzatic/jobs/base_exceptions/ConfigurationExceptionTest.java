package io.github.byzatic.jobs.base_exceptions;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ConfigurationExceptionTest {

    @Test
    void carriesKindKeyAndNeverRefires() {
        ConfigurationException e = new ConfigurationException(ConfigurationErrorKind.MISSING_PARAMETER, "FILE_NAME",
                "Required parameter 'FILE_NAME' not found in merged JobDataMap");

        assertEquals(ConfigurationErrorKind.MISSING_PARAMETER, e.getKind());
        assertEquals("FILE_NAME", e.getKey());
        assertFalse(e.refireImmediately());
        assertInstanceOf(JobExecutionException.class, e);
    }

    @Test
    void refireFlagIsExplicit() {
        Throwable cause = new IllegalStateException("transient");

        assertFalse(new JobExecutionException("failed", cause).refireImmediately());
        assertFalse(new JobExecutionException(cause, "failed").refireImmediately());
        assertTrue(new JobExecutionException("failed", cause, true).refireImmediately());
        assertSame(cause, new JobExecutionException(cause).getCause());
    }
}
