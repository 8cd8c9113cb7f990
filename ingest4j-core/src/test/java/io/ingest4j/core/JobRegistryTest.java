package io.ingest4j.core;

import io.ingest4j.IngestionJob;
import io.ingest4j.TestJobs;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class JobRegistryTest {

    @Test
    void resolvesRegisteredJobsByName() {
        IngestionJob fx = TestJobs.named("fx_rates", (c, a) -> JobResult.empty());
        IngestionJob weather = TestJobs.named("weather", (c, a) -> JobResult.empty());

        JobRegistry registry = new JobRegistry(List.of(fx, weather));

        assertSame(fx, registry.getRequired("fx_rates"));
        assertTrue(registry.contains("weather"));
        assertFalse(registry.contains("sensors"));
        assertEquals(Set.of("fx_rates", "weather"), registry.names());
    }

    @Test
    void unknownNameIsConfigurationError() {
        JobRegistry registry = new JobRegistry(List.of());

        ConfigurationException e = assertThrows(ConfigurationException.class, () -> registry.getRequired("ghost"));
        assertTrue(e.getMessage().contains("ghost"));
    }

    @Test
    void duplicateNamesAreRejected() {
        List<IngestionJob> jobs = List.of(
                TestJobs.named("dup", (c, a) -> JobResult.empty()),
                TestJobs.named("dup", (c, a) -> JobResult.of(1))
        );

        assertThrows(ConfigurationException.class, () -> new JobRegistry(jobs));
    }
}
