package com.components.sourcing.cache;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class CacheCleanupJobTest {

    @Mock
    private SearchResultCache cache;

    @InjectMocks
    private CacheCleanupJob job;

    @Test
    void shouldPurgeExpiredEntries() {
        // Given
        when(cache.cleanupExpired()).thenReturn(4);
        when(cache.stats()).thenReturn(new CacheStats(3, 1, 0, 0, 2));

        // When
        job.purgeExpired();

        // Then
        verify(cache).cleanupExpired();
    }
}
