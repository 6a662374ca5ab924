package com.instaclustr.hasher.impl.scheduler;

import java.nio.file.Paths;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import com.instaclustr.hasher.impl.FileEvent;
import com.instaclustr.hasher.impl.FileState;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class EventStreamTest {

    private static final FileEvent EVENT = new FileEvent(Paths.get("/tmp/file"), FileState.inProgress(0));

    @Test
    public void testFullStreamRejectsWhenDisconnected() throws Exception {
        final EventStream stream = new EventStream(1);

        assertTrue(stream.send(EVENT, () -> false));
        assertFalse(stream.send(EVENT, () -> true));

        assertEquals(EVENT, stream.take());
        assertNull(stream.poll(10, TimeUnit.MILLISECONDS));
    }

    @Test
    public void testClosedStream() throws Exception {
        final EventStream stream = new EventStream(3);

        assertTrue(stream.send(EVENT, () -> false));
        stream.close();

        assertTrue(stream.isClosed());
        assertFalse(stream.send(EVENT, () -> false));
        assertNull(stream.poll(10, TimeUnit.MILLISECONDS));
        assertNull(stream.take());
    }

    @Test
    public void testEventsOfDisconnectedSenderAreDropped() throws Exception {
        final EventStream stream = new EventStream(2);
        final AtomicBoolean gone = new AtomicBoolean(false);
        final FileEvent other = new FileEvent(Paths.get("/tmp/other"), FileState.inProgress(0));

        assertTrue(stream.send(EVENT, gone::get));
        assertTrue(stream.send(other, () -> false));

        gone.set(true);

        assertEquals(other, stream.poll(10, TimeUnit.MILLISECONDS));
        assertNull(stream.poll(10, TimeUnit.MILLISECONDS));
    }

    @Test
    public void testPurgeFreesSpace() throws Exception {
        final EventStream stream = new EventStream(1);
        final AtomicBoolean gone = new AtomicBoolean(false);

        assertTrue(stream.send(EVENT, gone::get));
        gone.set(true);
        stream.purgeDisconnected();

        assertTrue(stream.send(EVENT, () -> false));
        assertEquals(EVENT, stream.take());
    }

    @Test
    public void testInvalidCapacity() {
        assertThrows(IllegalArgumentException.class, () -> new EventStream(0));
    }
}
