package tech.acecontext.platform.authentication.oauth;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

/**
 * Unit tests for ExpiredGrantCleanupJob.
 */
@ExtendWith(MockitoExtension.class)
class ExpiredGrantCleanupJobTest {

    @Mock
    private AuthorizationCodeRepository codeRepo;

    @Mock
    private RefreshTokenRepository refreshTokenRepo;

    @InjectMocks
    private ExpiredGrantCleanupJob job;

    @Test
    @DisplayName("purgeExpired should delete expired codes and refresh tokens with the same cutoff")
    void purgeExpired_shouldDeleteBothGrantKinds() {
        // Arrange
        when(codeRepo.deleteExpired(any())).thenReturn(3L);
        when(refreshTokenRepo.deleteExpired(any())).thenReturn(1L);
        Instant before = Instant.now();

        // Act
        job.purgeExpired();

        // Assert
        ArgumentCaptor<Instant> codeCutoff = ArgumentCaptor.forClass(Instant.class);
        ArgumentCaptor<Instant> tokenCutoff = ArgumentCaptor.forClass(Instant.class);
        verify(codeRepo).deleteExpired(codeCutoff.capture());
        verify(refreshTokenRepo).deleteExpired(tokenCutoff.capture());
        assertThat(codeCutoff.getValue()).isEqualTo(tokenCutoff.getValue());
        assertThat(codeCutoff.getValue()).isAfterOrEqualTo(before);
    }

    @Test
    @DisplayName("purgeExpired should run cleanly when nothing has expired")
    void purgeExpired_shouldSucceed_whenNothingExpired() {
        when(codeRepo.deleteExpired(any())).thenReturn(0L);
        when(refreshTokenRepo.deleteExpired(any())).thenReturn(0L);

        assertThatCode(() -> job.purgeExpired()).doesNotThrowAnyException();
    }
}
