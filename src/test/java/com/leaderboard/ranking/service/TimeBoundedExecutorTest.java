package com.leaderboard.ranking.service;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentMatchers;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class TimeBoundedExecutorTest {

    @Mock
    private ExecutorService executorService;

    @Mock
    private Future<String> future;

    @Test
    void testCall_SubMillisecondBudgetStillWaits() throws Exception {
        // Arrange
        doReturn(future).when(executorService).submit(ArgumentMatchers.<Callable<String>>any());
        when(future.get(400_000L, TimeUnit.NANOSECONDS)).thenReturn("standings");
        TimeBoundedExecutor executor = new TimeBoundedExecutor(executorService);

        // Act
        String result = executor.call(() -> "standings", Duration.ofNanos(400_000));

        // Assert
        assertEquals("standings", result);
        verify(future).get(400_000L, TimeUnit.NANOSECONDS);
    }

    @Test
    void testCall_TimeoutCancelsTask() throws Exception {
        // Arrange
        doReturn(future).when(executorService).submit(ArgumentMatchers.<Callable<String>>any());
        when(future.get(anyLong(), eq(TimeUnit.NANOSECONDS))).thenThrow(new TimeoutException());
        TimeBoundedExecutor executor = new TimeBoundedExecutor(executorService);

        // Act & Assert
        assertThrows(TimeoutException.class, () -> executor.call(() -> "standings", Duration.ofMillis(50)));
        verify(future).cancel(true);
    }

    @Test
    void testCall_NoTimeoutRunsInline() {
        // Arrange
        TimeBoundedExecutor executor = new TimeBoundedExecutor(executorService);

        // Act & Assert
        ExecutionException exception = assertThrows(ExecutionException.class,
            () -> executor.call(() -> {
                throw new IllegalStateException("record store down");
            }, null));
        assertEquals("record store down", exception.getCause().getMessage());
        verifyNoInteractions(executorService);
    }

    @Test
    void testCall_PooledCallReturnsValue() throws Exception {
        TimeBoundedExecutor executor = new TimeBoundedExecutor();
        try {
            assertEquals(Integer.valueOf(42), executor.call(() -> 42, Duration.ofSeconds(5)));
        } finally {
            executor.shutdown();
        }
    }
}
