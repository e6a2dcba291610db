package com.example.musicrecommend.application.service;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import com.example.musicrecommend.application.port.ListeningDataSource;
import com.example.musicrecommend.common.config.AppRecommendProperties;
import com.example.musicrecommend.common.exception.ListeningDataException;
import com.example.musicrecommend.domain.model.ListeningSignal;
import com.example.musicrecommend.domain.model.ListeningSnapshot;
import com.example.musicrecommend.domain.model.Track;
import java.util.Collections;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class ListeningSnapshotLoaderTest {

    private static final Track TRACK = new Track(1L, "A", "X", "en", Collections.singletonList("pop"), 0L, 0L);

    private ListeningDataSource dataSource;
    private ExecutorService executor;
    private AppRecommendProperties properties;
    private ListeningSnapshotLoader loader;

    @BeforeEach
    void setUp() {
        dataSource = mock(ListeningDataSource.class);
        executor = Executors.newFixedThreadPool(3);
        properties = new AppRecommendProperties();
        properties.setFetchTimeoutMs(2000L);
        loader = new ListeningSnapshotLoader(dataSource, executor, properties);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void readsShouldRunConcurrently() {
        // each read waits for the other two; sequential reads would never get past the latch
        CountDownLatch allStarted = new CountDownLatch(3);
        when(dataSource.listCatalog()).thenAnswer(invocation -> {
            arriveAndAwait(allStarted);
            return Collections.singletonList(TRACK);
        });
        when(dataSource.listHistory("u1")).thenAnswer(invocation -> {
            arriveAndAwait(allStarted);
            return Collections.singletonList(new ListeningSignal(1L, 3D));
        });
        when(dataSource.listLikedIds("u1")).thenAnswer(invocation -> {
            arriveAndAwait(allStarted);
            return Collections.singleton(1L);
        });

        ListeningSnapshot snapshot = loader.load("u1", true);

        assertEquals(1, snapshot.getCatalog().size());
        assertEquals(1, snapshot.getHistory().size());
        assertEquals(Collections.singleton(1L), snapshot.getLikedIds());
    }

    @Test
    void historyShouldNotBeReadWhenNotRequested() {
        when(dataSource.listCatalog()).thenReturn(Collections.singletonList(TRACK));
        when(dataSource.listLikedIds("u1")).thenReturn(Collections.<Long>emptySet());
        when(dataSource.listHistory("u1")).thenThrow(new IllegalStateException("must not be called"));

        ListeningSnapshot snapshot = loader.load("u1", false);

        assertTrue(snapshot.getHistory().isEmpty());
    }

    @Test
    void failedReadShouldReportItsSource() {
        when(dataSource.listCatalog()).thenReturn(Collections.singletonList(TRACK));
        when(dataSource.listHistory("u1")).thenThrow(new IllegalStateException("history table locked"));
        when(dataSource.listLikedIds("u1")).thenReturn(Collections.<Long>emptySet());

        ListeningDataException error = assertThrows(ListeningDataException.class, () -> loader.load("u1", true));

        assertEquals(ListeningDataException.Source.HISTORY, error.getSource());
        assertTrue(error.getCause() instanceof IllegalStateException);
    }

    @Test
    void nullReadResultShouldCountAsFailure() {
        when(dataSource.listCatalog()).thenReturn(null);

        ListeningDataException error = assertThrows(ListeningDataException.class, () -> loader.load(null, false));

        assertEquals(ListeningDataException.Source.CATALOG, error.getSource());
    }

    @Test
    void slowReadShouldTimeOut() {
        properties.setFetchTimeoutMs(50L);
        when(dataSource.listCatalog()).thenReturn(Collections.singletonList(TRACK));
        when(dataSource.listLikedIds("u1")).thenAnswer(invocation -> {
            Thread.sleep(2000L);
            return Collections.<Long>emptySet();
        });

        ListeningDataException error = assertThrows(ListeningDataException.class, () -> loader.load("u1", false));

        assertEquals(ListeningDataException.Source.LIKED, error.getSource());
    }

    @Test
    void timedOutReadShouldBeInterrupted() throws InterruptedException {
        properties.setFetchTimeoutMs(50L);
        CountDownLatch interrupted = new CountDownLatch(1);
        when(dataSource.listCatalog()).thenReturn(Collections.singletonList(TRACK));
        when(dataSource.listLikedIds("u1")).thenAnswer(invocation -> {
            try {
                Thread.sleep(10_000L);
            } catch (InterruptedException e) {
                interrupted.countDown();
            }
            return Collections.<Long>emptySet();
        });

        assertThrows(ListeningDataException.class, () -> loader.load("u1", false));

        assertTrue(interrupted.await(2, TimeUnit.SECONDS), "timed out read kept its fetch thread");
    }

    @Test
    void lastTrackReadFailureShouldBeWrapped() {
        when(dataSource.findLastTrackId("u1")).thenThrow(new IllegalStateException("gone"));

        ListeningDataException error = assertThrows(ListeningDataException.class, () -> loader.loadLastTrackId("u1"));

        assertEquals(ListeningDataException.Source.LISTENER, error.getSource());
    }

    private static void arriveAndAwait(CountDownLatch latch) throws InterruptedException {
        latch.countDown();
        if (!latch.await(1, TimeUnit.SECONDS)) {
            throw new IllegalStateException("reads did not overlap");
        }
    }
}
