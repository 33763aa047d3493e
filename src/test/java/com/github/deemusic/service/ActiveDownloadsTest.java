package com.github.deemusic.service;

import com.github.deemusic.service.ActiveDownloads.Control;
import com.github.deemusic.service.ActiveDownloads.StopRequest;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("ActiveDownloads")
class ActiveDownloadsTest {

    private ActiveDownloads activeDownloads;

    @BeforeEach
    void setUp() {
        activeDownloads = new ActiveDownloads();
    }

    @Test
    @DisplayName("a new registration should carry no request")
    void newControlIsClear() {
        Control control = activeDownloads.register("a");

        assertFalse(control.isStopRequested());
        assertEquals(StopRequest.NONE, control.getRequest());
        assertTrue(activeDownloads.isActive("a"));
    }

    @Test
    @DisplayName("the worker should see a request made after it registered")
    void requestReachesWorker() {
        Control control = activeDownloads.register("a");

        activeDownloads.requestStop("a", StopRequest.PAUSE);

        assertTrue(control.isStopRequested());
        assertEquals(StopRequest.PAUSE, control.getRequest());
    }

    @Test
    @DisplayName("a request made just before registration should be kept")
    void earlyRequestKept() {
        activeDownloads.requestStop("a", StopRequest.CANCEL);

        assertEquals(StopRequest.CANCEL, activeDownloads.register("a").getRequest());
    }

    @Test
    @DisplayName("cancel should win over pause and pause over requeue")
    void strongerRequestWins() {
        Control control = activeDownloads.register("a");

        activeDownloads.requestStop("a", StopRequest.REQUEUE);
        activeDownloads.requestStop("a", StopRequest.CANCEL);
        activeDownloads.requestStop("a", StopRequest.PAUSE);

        assertEquals(StopRequest.CANCEL, control.getRequest());
    }

    @Test
    @DisplayName("stopping all should reach every registered worker")
    void stopAll() {
        Control first = activeDownloads.register("a");
        Control second = activeDownloads.register("b");
        activeDownloads.requestStop("b", StopRequest.PAUSE);

        activeDownloads.requestStopAll(StopRequest.REQUEUE);

        assertEquals(StopRequest.REQUEUE, first.getRequest());
        assertEquals(StopRequest.PAUSE, second.getRequest());
    }

    @Test
    @DisplayName("unregister should only remove the worker's own control")
    void unregisterOwnControlOnly() {
        Control stale = activeDownloads.register("a");
        activeDownloads.discard("a");
        Control current = activeDownloads.register("a");

        activeDownloads.unregister("a", stale);

        assertTrue(activeDownloads.isActive("a"));
        activeDownloads.unregister("a", current);
        assertFalse(activeDownloads.isActive("a"));
        assertTrue(activeDownloads.activeIds().isEmpty());
    }

    @Test
    @DisplayName("a new claim should not inherit the stop request of an earlier worker")
    void newClaimStartsClear() {
        Control removed = activeDownloads.register("a");
        activeDownloads.requestStop("a", StopRequest.CANCEL);

        Control reclaimed = activeDownloads.register("a");

        assertFalse(reclaimed.isStopRequested());
        assertEquals(StopRequest.CANCEL, removed.getRequest());

        activeDownloads.requestStop("a", StopRequest.PAUSE);
        assertEquals(StopRequest.PAUSE, reclaimed.getRequest());
        assertEquals(StopRequest.PAUSE, activeDownloads.requestFor("a"));

        activeDownloads.unregister("a", removed);
        assertTrue(activeDownloads.isActive("a"));
    }

    @Test
    @DisplayName("a held request should only reach the next registration")
    void heldRequestUsedOnce() {
        activeDownloads.requestStop("a", StopRequest.PAUSE);
        activeDownloads.requestStop("a", StopRequest.REQUEUE);

        Control first = activeDownloads.register("a");
        activeDownloads.unregister("a", first);

        assertEquals(StopRequest.PAUSE, first.getRequest());
        assertFalse(activeDownloads.register("a").isStopRequested());
    }

    @Test
    @DisplayName("requestFor should report NONE without a worker")
    void requestForWithoutWorker() {
        activeDownloads.requestStop("a", StopRequest.CANCEL);

        assertEquals(StopRequest.NONE, activeDownloads.requestFor("a"));
        assertEquals(Set.of(), activeDownloads.activeIds());
    }

    @Test
    @DisplayName("discard should drop a leftover request")
    void discardDropsRequest() {
        activeDownloads.requestStop("a", StopRequest.PAUSE);

        activeDownloads.discard("a");

        assertFalse(activeDownloads.register("a").isStopRequested());
    }
}
