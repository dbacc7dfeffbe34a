package com.logstore.storage.assignment;

import com.logstore.common.model.ChangeType;
import com.logstore.common.model.UnitMetadata;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Filtering, resolution and subscription lifecycle of registry assignment events
 */
public class AssignmentEventBridgeTest {

    private static final String NODE_ADDRESS = "0xaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaa";
    private static final String OTHER_NODE_ADDRESS = "0xbbbbbbbbbbbbbbbbbbbbbbbbbbbbbbbbbbbbbbbb";

    private StubRegistryClient registry;
    private List<Object[]> received;
    private AssignmentEventBridge bridge;

    @BeforeEach
    void setUp() {
        registry = new StubRegistryClient();
        received = new CopyOnWriteArrayList<>();
        bridge = new AssignmentEventBridge(NODE_ADDRESS, registry,
                (unit, changeType, watermark) -> received.add(new Object[]{unit, changeType, watermark}));
    }

    @AfterEach
    void tearDown() throws Exception {
        bridge.destroy().get(1, TimeUnit.SECONDS);
    }

    @Test
    void testStartRegistersBothListeners() {
        assertEquals(0, registry.listeners.size());

        bridge.start();

        assertEquals(2, registry.listeners.size());
        assertEquals(2, registry.onCalls.get());
    }

    @Test
    void testDestroyUnregistersBothListeners() throws Exception {
        bridge.start();

        bridge.destroy().get(1, TimeUnit.SECONDS);

        assertEquals(2, registry.offCalls.get());
        assertTrue(registry.listeners.isEmpty());
    }

    @Test
    void testDestroyWithoutStartIsNoop() throws Exception {
        CompletableFuture<Void> stopped = bridge.destroy();

        assertTrue(stopped.isDone());
        assertEquals(0, registry.offCalls.get());
    }

    @Test
    void testEventForThisNodeIsResolvedAndForwarded() {
        bridge.start();

        registry.fire(ChangeType.ADDED, "stream-2", NODE_ADDRESS, 1234L);

        assertEquals(1, received.size());
        UnitMetadata unit = (UnitMetadata) received.get(0)[0];
        assertEquals("stream-2", unit.getStreamId());
        assertEquals(4, unit.getPartitionCount());
        assertEquals(ChangeType.ADDED, received.get(0)[1]);
        assertEquals(1234L, received.get(0)[2]);
    }

    @Test
    void testRemovedEventCarriesRemovedType() {
        bridge.start();

        registry.fire(ChangeType.REMOVED, "stream-1", NODE_ADDRESS, 20L);

        assertEquals(1, received.size());
        assertEquals(ChangeType.REMOVED, received.get(0)[1]);
    }

    @Test
    void testAddressMatchIgnoresCase() {
        bridge.start();

        registry.fire(ChangeType.ADDED, "stream-1", NODE_ADDRESS.toUpperCase().replace("0X", "0x"), 5L);

        assertEquals(1, received.size());
    }

    @Test
    void testEventForAnotherNodeIsIgnored() {
        bridge.start();

        registry.fire(ChangeType.ADDED, "stream-1", OTHER_NODE_ADDRESS, 1234L);

        assertTrue(received.isEmpty());
        assertEquals(0, registry.lookupCalls.get());
    }

    @Test
    void testFailedLookupDropsEvent() {
        registry.lookupResponse = streamId ->
                CompletableFuture.failedFuture(new IllegalStateException("stream deleted"));
        bridge.start();

        registry.fire(ChangeType.ADDED, "stream-1", NODE_ADDRESS, 10L);

        assertEquals(1, registry.lookupCalls.get());
        assertTrue(received.isEmpty());
    }

    @Test
    void testMissingMetadataDropsEvent() {
        registry.lookupResponse = streamId -> CompletableFuture.completedFuture(null);
        bridge.start();

        registry.fire(ChangeType.ADDED, "stream-1", NODE_ADDRESS, 10L);

        assertEquals(1, registry.lookupCalls.get());
        assertTrue(received.isEmpty());
    }

    @Test
    void testLookupThrowingSynchronouslyDropsEvent() {
        registry.lookupResponse = streamId -> {
            throw new IllegalStateException("registry down");
        };
        bridge.start();

        assertDoesNotThrow(() -> registry.fire(ChangeType.ADDED, "stream-1", NODE_ADDRESS, 10L));
        assertTrue(received.isEmpty());
    }

    @Test
    void testLookupCompletingAfterDestroyIsDropped() throws Exception {
        CompletableFuture<UnitMetadata> pending = new CompletableFuture<>();
        registry.lookupResponse = streamId -> pending;
        bridge.start();
        registry.fire(ChangeType.ADDED, "stream-1", NODE_ADDRESS, 10L);

        CompletableFuture<Void> stopped = bridge.destroy();
        assertFalse(stopped.isDone(), "destroy must wait for the in-flight lookup");

        pending.complete(StubRegistryClient.stream("stream-1"));
        stopped.get(1, TimeUnit.SECONDS);

        assertTrue(received.isEmpty());
    }
}
