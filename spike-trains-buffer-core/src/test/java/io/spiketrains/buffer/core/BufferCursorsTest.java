package io.spiketrains.buffer.core;

import io.spiketrains.core.SpikeCursor;
import io.spiketrains.core.SpikeRecord;
import io.spiketrains.core.SpikeTrainsException;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class BufferCursorsTest {

    private static final List<SpikeRecord> SPIKES = List.of(
            new SpikeRecord(1.0, "A", 1),
            new SpikeRecord(2.0, "A", 2));

    @Test
    void forgetsCursorsThatAreExhaustedOrClosed() {
        BufferCursors cursors = new BufferCursors("test buffer");
        SpikeCursor drained = cursors.track(SpikeCursor.of(SPIKES.iterator()));
        SpikeCursor abandoned = cursors.track(SpikeCursor.of(SPIKES.iterator()));
        assertThat(cursors.openCount()).isEqualTo(2);

        assertThat(drained.toList()).isEqualTo(SPIKES);
        abandoned.close();

        assertThat(cursors.openCount()).isZero();
    }

    @Test
    void closeAllReleasesOpenCursorsOnce() {
        BufferCursors cursors = new BufferCursors("test buffer");
        AtomicInteger closes = new AtomicInteger();
        SpikeCursor cursor = cursors.track(countingCloses(closes));

        cursors.closeAll();
        cursors.closeAll();

        assertThat(closes.get()).isEqualTo(1);
        assertThatThrownBy(cursor::hasNext)
                .isInstanceOf(SpikeTrainsException.BufferClosed.class)
                .hasMessageContaining("test buffer");
    }

    @Test
    void refusesNewCursorsAfterCloseAll() {
        BufferCursors cursors = new BufferCursors("test buffer");
        cursors.closeAll();
        AtomicInteger closes = new AtomicInteger();

        assertThatThrownBy(() -> cursors.track(countingCloses(closes)))
                .isInstanceOf(SpikeTrainsException.BufferClosed.class);
        assertThat(closes.get()).isEqualTo(1);
    }

    private static SpikeCursor countingCloses(AtomicInteger closes) {
        SpikeCursor delegate = SpikeCursor.of(SPIKES.iterator());
        return new SpikeCursor() {
            @Override
            public boolean hasNext() {
                return delegate.hasNext();
            }

            @Override
            public SpikeRecord next() {
                return delegate.next();
            }

            @Override
            public void close() {
                closes.incrementAndGet();
                delegate.close();
            }
        };
    }
}
