package in.staysync.engine.registry;

import in.staysync.domain.common.Channel;
import in.staysync.domain.common.ChannelCursor;
import in.staysync.domain.common.ConnectionState;
import in.staysync.domain.common.Identity;
import in.staysync.domain.common.MessageType;
import in.staysync.domain.event.EventFixtures;
import in.staysync.domain.stream.StreamMessage;
import in.staysync.metrics.StreamMetrics;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

/**
 * Unit tests for ConnectionRegistry fan-out and backpressure.
 *
 * Tests:
 * - Subscription reference counts follow register/unregister; unregister is idempotent
 * - Broadcast reaches only active subscribers of the channel with a matching filter
 * - A connection at its outstanding limit has messages dropped and is quarantined after N drops
 * - A failed send is reported to the listener
 * - Live messages are held during replay; those covered by the replay are discarded
 * - Holding more than the limit overflows into drops
 */
@ExtendWith(MockitoExtension.class)
class ConnectionRegistryTest {

    private static final ChannelCursor GUEST_1 = ChannelCursor.of(1L, Channel.GUEST);

    @Mock
    private StreamMetrics metrics;

    @Mock
    private DeliveryListener listener;

    private ConnectionRegistry registry;

    @BeforeEach
    void setUp() {
        registry = new ConnectionRegistry(metrics, 3);
        registry.setDeliveryListener(listener);
    }

    private Connection connect(long tenantId, Set<Channel> channels, Long filter, RecordingSink sink, int maxOutstanding) {
        Connection conn = new Connection(new Identity(tenantId, 7L, "ops"), channels, filter, sink, maxOutstanding);
        conn.transition(ConnectionState.CONNECTING, ConnectionState.ACTIVE);
        registry.register(conn);
        registry.releaseHeld(conn, Map.of());
        return conn;
    }

    private static Outbound batch(long seq, Long propertyId) {
        return filter -> {
            var env = EventFixtures.envelope(seq - 1, EventFixtures.guest(1L, propertyId, "g"));
            if (!env.visibleTo(filter)) {
                return null;
            }
            return new OutboundView(StreamMessage.batch(Channel.GUEST, seq, List.of(env)), 1);
        };
    }

    @Test
    void testSubscriptionCounts() {
        Connection a = connect(1L, Set.of(Channel.GUEST, Channel.FINANCE), null, new RecordingSink(), 10);
        Connection b = connect(1L, Set.of(Channel.GUEST), null, new RecordingSink(), 10);

        assertTrue(registry.hasSubscribers(GUEST_1));
        assertEquals(2, registry.connections(1L).size());
        assertEquals(2, registry.getStats().activeSubscriptions());

        assertTrue(registry.unregister(a));
        assertFalse(registry.unregister(a), "Second unregister is a no-op");
        assertTrue(registry.hasSubscribers(GUEST_1));
        assertFalse(registry.hasSubscribers(ChannelCursor.of(1L, Channel.FINANCE)));

        registry.unregister(b);
        assertFalse(registry.hasSubscribers(GUEST_1));
        assertEquals(0, registry.getStats().totalConnections());
        assertTrue(registry.connections(1L).isEmpty());
    }

    @Test
    void testBroadcastTargetsMatchingConnections() {
        RecordingSink subscribed = new RecordingSink();
        RecordingSink otherChannel = new RecordingSink();
        RecordingSink otherTenant = new RecordingSink();
        RecordingSink otherProperty = new RecordingSink();
        RecordingSink closing = new RecordingSink();
        connect(1L, Set.of(Channel.GUEST), 10L, subscribed, 10);
        connect(1L, Set.of(Channel.FINANCE), null, otherChannel, 10);
        connect(2L, Set.of(Channel.GUEST), null, otherTenant, 10);
        connect(1L, Set.of(Channel.GUEST), 20L, otherProperty, 10);
        connect(1L, Set.of(Channel.GUEST), null, closing, 10).beginClose();

        BroadcastResult result = registry.broadcast(GUEST_1, 5, batch(5, 10L));

        assertEquals(1, result.recipients());
        assertEquals(1, result.sent());
        assertEquals(1, subscribed.messages().size());
        assertTrue(otherChannel.messages().isEmpty());
        assertTrue(otherTenant.messages().isEmpty());
        assertTrue(otherProperty.messages().isEmpty());
        assertTrue(closing.messages().isEmpty());
        verify(metrics).recordEventsDelivered(Channel.GUEST, 1);
    }

    @Test
    void testSlowConsumerDroppedThenQuarantined() {
        RecordingSink slow = new RecordingSink();
        slow.hang();
        RecordingSink fast = new RecordingSink();
        Connection slowConn = connect(1L, Set.of(Channel.GUEST), null, slow, 2);
        connect(1L, Set.of(Channel.GUEST), null, fast, 2);

        for (int seq = 1; seq <= 5; seq++) {
            registry.broadcast(GUEST_1, seq, batch(seq, null));
        }

        assertEquals(2, slow.messages().size(), "Only the outstanding budget reaches the slow peer");
        assertEquals(5, fast.messages().size(), "Other connections are unaffected");
        assertEquals(3, slowConn.getConsecutiveDrops());
        assertTrue(slowConn.isQuarantined());
        verify(listener, times(1)).onQuarantine(slowConn);
        verify(metrics, times(3)).recordMessageDropped(Channel.GUEST);
        assertEquals(3, registry.getStats().droppedTotal());
        assertEquals(1, registry.getStats().quarantinedTotal());
    }

    @Test
    void testSuccessfulSendResetsDrops() {
        RecordingSink sink = new RecordingSink();
        Connection conn = connect(1L, Set.of(Channel.GUEST), null, sink, 1);
        conn.forceReserve();

        registry.broadcast(GUEST_1, 1, batch(1, null));
        assertEquals(1, conn.getConsecutiveDrops());

        conn.release();
        registry.broadcast(GUEST_1, 2, batch(2, null));
        assertEquals(0, conn.getConsecutiveDrops());
        assertEquals(0, conn.getOutstanding(), "Completed sends release their slot");
        verify(listener, never()).onQuarantine(any());
    }

    @Test
    void testSendFailureReported() {
        RecordingSink sink = new RecordingSink();
        sink.failAll();
        Connection conn = connect(1L, Set.of(Channel.GUEST), null, sink, 10);

        registry.broadcast(GUEST_1, 1, batch(1, null));

        verify(listener).onSendFailure(eq(conn), any(IllegalStateException.class));
        verify(metrics).recordSendFailure();
        assertEquals(0, conn.getOutstanding());
    }

    @Test
    void testHeldDuringReplayAndFilteredByHighWater() {
        RecordingSink sink = new RecordingSink();
        Connection conn = new Connection(new Identity(1L, 7L, "ops"), Set.of(Channel.GUEST), null, sink, 10);
        conn.transition(ConnectionState.CONNECTING, ConnectionState.ACTIVE);
        registry.register(conn);

        BroadcastResult first = registry.broadcast(GUEST_1, 4, batch(4, null));
        registry.broadcast(GUEST_1, 6, batch(6, null));

        assertEquals(1, first.sent());
        assertTrue(sink.messages().isEmpty(), "Nothing goes out while replaying");
        assertEquals(2, conn.heldCount());

        registry.releaseHeld(conn, Map.of(Channel.GUEST, 5L));

        List<StreamMessage> sent = sink.ofType(MessageType.BATCH);
        assertEquals(1, sent.size(), "Batch covered by the replay is discarded");
        assertEquals(6L, sent.get(0).seq());
        assertFalse(conn.isReplaying());

        registry.broadcast(GUEST_1, 7, batch(7, null));
        assertEquals(2, sink.messages().size(), "Live traffic flows after release");
    }

    @Test
    void testHeldOverflowCountsAsDrop() {
        Connection conn = new Connection(new Identity(1L, 7L, "ops"), Set.of(Channel.GUEST), null,
            new RecordingSink(), 1);
        conn.transition(ConnectionState.CONNECTING, ConnectionState.ACTIVE);
        registry.register(conn);

        registry.broadcast(GUEST_1, 1, batch(1, null));
        BroadcastResult second = registry.broadcast(GUEST_1, 2, batch(2, null));

        assertEquals(1, second.dropped());
        assertEquals(1, conn.heldCount());
        assertEquals(1, conn.getConsecutiveDrops());
    }

    @Test
    void testSendDirectBypassesLimit() {
        RecordingSink sink = new RecordingSink();
        sink.hang();
        Connection conn = connect(1L, Set.of(Channel.GUEST), null, sink, 1);

        registry.sendDirect(conn, StreamMessage.ping());
        registry.sendDirect(conn, StreamMessage.ack());

        assertEquals(2, sink.messages().size());
        assertEquals(2, conn.getOutstanding());
        assertEquals(0, conn.getConsecutiveDrops());
    }
}
