package net.vortexdevelopment.vbind.debug;

import net.vortexdevelopment.vbind.annotation.util.EnableDebug;
import net.vortexdevelopment.vbind.di.DependencyContainer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class DebugLoggerTest {

    @AfterEach
    void tearDown() {
        DebugLogger.clearAll();
    }

    @Test
    void enableDebugForTurnsOnLogging() {
        assertThat(DebugLogger.isEnabled(Quiet.class)).isFalse();

        DebugLogger.enableDebugFor(Quiet.class);

        assertThat(DebugLogger.isEnabled(Quiet.class)).isTrue();
    }

    @Test
    void containerEnablesAnnotatedComponents() {
        DependencyContainer container = new DependencyContainer();

        container.newInstance(Verbose.class);

        assertThat(DebugLogger.isEnabled(Verbose.class)).isTrue();
    }

    static class Quiet {
    }

    @EnableDebug
    static class Verbose {
    }
}
