package com.ttennebkram.imageeditor.session;

import com.ttennebkram.imageeditor.history.HistoryEmptyException;
import com.ttennebkram.imageeditor.model.FilterParameters;
import com.ttennebkram.imageeditor.model.FilterType;
import com.ttennebkram.imageeditor.model.RasterBuffer;
import com.ttennebkram.imageeditor.model.RasterSnapshot;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class SessionWorkerTest {

    @Mock
    private EditSession session;

    private SessionWorker worker;
    private final RasterSnapshot snapshot =
            new RasterSnapshot(RasterBuffer.blank(1, 1), null, true, false, true);

    @BeforeEach
    void setUp() {
        worker = new SessionWorker(session);
    }

    @AfterEach
    void tearDown() {
        worker.close();
    }

    @Test
    void rejectsSecondRequestWhileFirstIsRunning() throws Exception {
        CountDownLatch started = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        when(session.apply(any(), any())).thenAnswer(invocation -> {
            started.countDown();
            release.await(5, TimeUnit.SECONDS);
            return snapshot;
        });

        CompletableFuture<RasterSnapshot> first = worker.submitApply(FilterType.GAUSSIAN_BLUR, FilterParameters.defaults());
        assertThat(started.await(5, TimeUnit.SECONDS)).isTrue();
        assertThat(worker.isProcessing()).isTrue();

        CompletableFuture<RasterSnapshot> second = worker.submitUndo();

        assertThat(second).isCompletedExceptionally();
        assertThatThrownBy(second::get)
                .isInstanceOf(ExecutionException.class)
                .hasCauseInstanceOf(SessionBusyException.class);
        verify(session, never()).undo();

        release.countDown();
        assertThat(first.get(5, TimeUnit.SECONDS)).isSameAs(snapshot);
        assertThat(worker.isProcessing()).isFalse();
    }

    @Test
    void acceptsNextRequestOnceFirstCompletes() throws Exception {
        when(session.apply(any(), any())).thenReturn(snapshot);
        when(session.undo()).thenReturn(snapshot);

        worker.submitApply(FilterType.SEPIA, null).get(5, TimeUnit.SECONDS);
        RasterSnapshot result = worker.submitUndo().get(5, TimeUnit.SECONDS);

        assertThat(result).isSameAs(snapshot);
        verify(session).undo();
    }

    @Test
    void failedOperationReleasesTheFlag() throws Exception {
        when(session.redo()).thenThrow(new HistoryEmptyException("redo"));
        when(session.reset()).thenReturn(snapshot);

        CompletableFuture<RasterSnapshot> failed = worker.submitRedo();

        assertThatThrownBy(() -> failed.get(5, TimeUnit.SECONDS))
                .isInstanceOf(ExecutionException.class)
                .hasCauseInstanceOf(HistoryEmptyException.class);
        assertThat(worker.isProcessing()).isFalse();
        assertThat(worker.submitReset().get(5, TimeUnit.SECONDS)).isSameAs(snapshot);
    }

    @Test
    void previewDelegatesToReapplyLast() throws Exception {
        FilterParameters params = FilterParameters.defaults().withBrightness(25);
        when(session.reapplyLast(params)).thenReturn(snapshot);

        assertThat(worker.submitPreview(params).get(5, TimeUnit.SECONDS)).isSameAs(snapshot);
        verify(session).reapplyLast(params);
    }

    @Test
    void requestsAfterShutdownFail() {
        worker.shutdown();

        CompletableFuture<RasterSnapshot> future = worker.submitLoad(RasterBuffer.blank(1, 1));

        assertThat(future).isCompletedExceptionally();
        assertThat(worker.isProcessing()).isFalse();
    }
}
