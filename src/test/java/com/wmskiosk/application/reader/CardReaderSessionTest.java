package com.wmskiosk.application.reader;

import com.wmskiosk.domain.model.ConnectResult;
import com.wmskiosk.domain.model.DeviceError;
import com.wmskiosk.domain.model.ReaderDeviceInfo;
import com.wmskiosk.domain.model.ReaderState;
import com.wmskiosk.domain.model.ReaderStatus;
import com.wmskiosk.domain.time.ManualMonotonicClock;
import com.wmskiosk.support.FakeCardReaderDevice;
import com.wmskiosk.support.FakeCardReaderProvider;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.function.BooleanSupplier;

import static org.junit.jupiter.api.Assertions.*;

final class CardReaderSessionTest {

    private static final Duration WAIT = Duration.ofSeconds(2);

    private ManualMonotonicClock clock;
    private FakeCardReaderProvider provider;
    private FakeCardReaderDevice device;
    private CardReaderSession session;

    @BeforeEach
    void setUp() {
        clock = new ManualMonotonicClock();
        device = new FakeCardReaderDevice("TS-HRW380");
        provider = new FakeCardReaderProvider()
                .withVisible(FakeCardReaderProvider.readerInfo())
                .withDevice(device);

        ReaderSettings settings = ReaderSettings.builder()
                .knownReaderName("TS-HRW")
                .readTimeoutMs(20)
                .joinTimeout(Duration.ofSeconds(1))
                .build();
        session = new CardReaderSession(provider, settings, clock, Clock.systemUTC());
    }

    @AfterEach
    void tearDown() {
        session.shutdown();
    }

    @Test
    void connectWithoutMatchingDeviceReportsUnavailable() {
        provider.clearVisible();
        provider.withVisible(FakeCardReaderProvider.otherInfo("USB Keyboard"));

        ConnectResult result = session.connect();

        assertFalse(result.isSuccess());
        assertEquals(Optional.of(DeviceError.DEVICE_UNAVAILABLE), result.error());
        assertEquals(ReaderState.DISCONNECTED, session.status().getState());
        assertNotNull(session.status().getLastError());
        assertEquals(0, provider.getOpenCount());
    }

    @Test
    void connectReportsOpenFailure() {
        provider.failingOpen("acceso denegado");

        ConnectResult result = session.connect();

        assertFalse(result.isSuccess());
        assertEquals(Optional.of(DeviceError.CONNECTION_FAILED), result.error());
        assertFalse(session.status().isConnected());
    }

    @Test
    void unexpectedOpenFailureIsReportedAsConnectionFailed() {
        provider.crashingOpen(new IllegalStateException("native open failed"));

        ConnectResult result = assertDoesNotThrow(() -> session.connect());

        assertFalse(result.isSuccess());
        assertEquals(Optional.of(DeviceError.CONNECTION_FAILED), result.error());
        assertEquals(ReaderState.DISCONNECTED, session.status().getState());
        assertTrue(session.status().getLastError().contains("native open failed"));

        provider.crashingOpen(null);
        assertTrue(session.connect().isSuccess());
    }

    @Test
    void connectStartsPollingAndReportsConnected() {
        ConnectResult result = session.connect();

        assertTrue(result.isSuccess());
        ReaderStatus status = session.status();
        assertEquals(ReaderState.CONNECTED, status.getState());
        assertTrue(status.isConnected());
        assertTrue(status.isMonitoring());
        assertEquals("TS-HRW380", status.getDeviceName());
    }

    @Test
    void connectWhileConnectedDoesNotReopen() {
        assertTrue(session.connect().isSuccess());
        assertTrue(session.connect().isSuccess());

        assertEquals(1, provider.getOpenCount());
    }

    @Test
    void selectDevicePrefersVidPidAndFallsBackToName() {
        ReaderSettings settings = ReaderSettings.defaults();
        ReaderDeviceInfo byName = FakeCardReaderProvider.otherInfo("ts-hrw380 HID");
        ReaderDeviceInfo exact = FakeCardReaderProvider.readerInfo();

        assertEquals(Optional.of(exact),
                CardReaderSession.selectDevice(List.of(byName, exact), settings));
        assertEquals(Optional.of(byName),
                CardReaderSession.selectDevice(List.of(FakeCardReaderProvider.otherInfo("Mouse"), byName), settings));
        assertTrue(CardReaderSession.selectDevice(List.of(), settings).isEmpty());
    }

    @Test
    void tokenSplitAcrossReportsIsDeliveredOnce() {
        device.thenReport("12345").thenReport("67890\r");
        session.connect();

        assertEquals(Optional.of("1234567890"), session.readCard(WAIT));
        assertEquals(Optional.empty(), session.readCard(Duration.ofMillis(200)));
    }

    @Test
    void repeatedCardWithinWindowIsNotQueued() {
        device.thenReport("CARD0001\r").thenReport("CARD0001\r");
        session.connect();

        assertEquals(Optional.of("CARD0001"), session.readCard(WAIT));
        awaitTrue(() -> !device.hasPendingSteps());
        assertEquals(Optional.empty(), session.readCard(Duration.ofMillis(200)));

        clock.advanceMillis(2000);
        device.thenReport("CARD0001\r");

        assertEquals(Optional.of("CARD0001"), session.readCard(WAIT));
    }

    @Test
    void consecutiveReadErrorsMoveToError() {
        device.thenFail("cable").thenFail("cable").thenFail("cable");
        session.connect();

        awaitTrue(() -> session.status().getState() == ReaderState.ERROR);

        ReaderStatus status = session.status();
        assertFalse(status.isConnected());
        assertFalse(status.isMonitoring());
        assertNotNull(status.getLastError());
        awaitTrue(() -> device.getCloseCount() == 1);
    }

    @Test
    void successfulReadResetsErrorCount() {
        device.thenFail("ruido").thenFail("ruido")
                .thenReport("CARD0001\r")
                .thenFail("ruido").thenFail("ruido");
        session.connect();

        assertEquals(Optional.of("CARD0001"), session.readCard(WAIT));
        awaitTrue(() -> !device.hasPendingSteps());
        assertEquals(Optional.empty(), session.readCard(Duration.ofMillis(100)));

        assertEquals(ReaderState.CONNECTED, session.status().getState());
    }

    @Test
    void reconnectAfterErrorOpensNewDevice() {
        device.thenFail("cable").thenFail("cable").thenFail("cable");
        session.connect();
        awaitTrue(() -> session.status().getState() == ReaderState.ERROR);

        FakeCardReaderDevice replacement = new FakeCardReaderDevice("TS-HRW380");
        replacement.thenReport("CARD0002\r");
        provider.withDevice(replacement);

        assertTrue(session.connect().isSuccess());
        assertEquals(Optional.of("CARD0002"), session.readCard(WAIT));
        assertEquals(2, provider.getOpenCount());
    }

    @Test
    void disconnectTwiceIsHarmless() {
        session.connect();

        session.disconnect();
        assertFalse(session.status().isConnected());

        session.disconnect();
        assertFalse(session.status().isConnected());
        assertEquals(ReaderState.DISCONNECTED, session.status().getState());
        assertEquals(1, device.getCloseCount());
    }

    @Test
    void disconnectWithoutConnectIsHarmless() {
        session.disconnect();

        assertFalse(session.status().isConnected());
        assertEquals(0, device.getCloseCount());
    }

    @Test
    void readCardWithoutConnectionTimesOutEmpty() {
        assertEquals(Optional.empty(), session.readCard(Duration.ofMillis(50)));
        assertEquals(Optional.empty(), session.tryReadCard());
    }

    @Test
    void monitoringDeliversCardsToCallback() throws Exception {
        List<String> cards = new CopyOnWriteArrayList<>();
        CountDownLatch delivered = new CountDownLatch(2);
        session.startMonitoring(card -> {
            cards.add(card);
            delivered.countDown();
        }, null);

        device.thenReport("CARD0001\r").thenReport("CARD0002\r");
        session.connect();

        assertTrue(delivered.await(2, TimeUnit.SECONDS));
        assertEquals(List.of("CARD0001", "CARD0002"), cards);
        assertTrue(session.status().isDispatching());

        session.stopMonitoring();
        assertFalse(session.status().isDispatching());
    }

    @Test
    void failingCallbackDoesNotStopDispatch() throws Exception {
        CountDownLatch delivered = new CountDownLatch(2);
        session.startMonitoring(card -> {
            delivered.countDown();
            throw new IllegalStateException("fallo de la UI");
        }, null);

        device.thenReport("CARD0001\r").thenReport("CARD0002\r");
        session.connect();

        assertTrue(delivered.await(2, TimeUnit.SECONDS));
    }

    @Test
    void statusCallbackSeesErrorTransition() {
        List<ReaderState> states = new CopyOnWriteArrayList<>();
        session.startMonitoring(card -> { }, status -> states.add(status.getState()));

        device.thenFail("cable").thenFail("cable").thenFail("cable");
        session.connect();

        awaitTrue(() -> states.contains(ReaderState.ERROR));
    }

    private static void awaitTrue(BooleanSupplier condition) {
        long deadline = System.nanoTime() + WAIT.toNanos();
        while (!condition.getAsBoolean()) {
            if (System.nanoTime() > deadline) {
                fail("La condición no se cumplió a tiempo");
            }
            try {
                Thread.sleep(10);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                fail("Interrumpido");
            }
        }
    }
}
