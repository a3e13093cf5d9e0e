package com.wmskiosk.application.service;

import com.wmskiosk.application.dto.AuthResultDto;
import com.wmskiosk.application.dto.EmployeeDto;
import com.wmskiosk.application.reader.CardReaderSession;
import com.wmskiosk.application.reader.ReaderSettings;
import com.wmskiosk.domain.model.AuthOutcome;
import com.wmskiosk.domain.model.Employee;
import com.wmskiosk.domain.model.EmployeeRole;
import com.wmskiosk.domain.time.ManualMonotonicClock;
import com.wmskiosk.support.FakeCardReaderDevice;
import com.wmskiosk.support.FakeCardReaderProvider;
import com.wmskiosk.support.RecordingEmployeeDirectory;
import com.wmskiosk.support.RecordingWebSocketHandler;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.util.List;
import java.util.stream.Collectors;

import static com.wmskiosk.support.RecordingEmployeeDirectory.employee;
import static org.junit.jupiter.api.Assertions.*;

final class KioskLoginServiceTest {

    private ManualMonotonicClock clock;
    private RecordingEmployeeDirectory directory;
    private RecordingWebSocketHandler webSocket;
    private FakeCardReaderDevice device;
    private CardReaderSession readerSession;
    private AuthenticationServiceImpl authService;

    @BeforeEach
    void setUp() {
        clock = new ManualMonotonicClock();
        Employee inactive = employee(3, "04CCCCCCCC", "Zoe", "Brandt", EmployeeRole.WORKER);
        inactive.setActive(false);
        directory = new RecordingEmployeeDirectory()
                .with(employee(1, "04A1B2C3D4", "Anna", "Schmidt", EmployeeRole.WORKER))
                .with(employee(2, "04FFEEDDCC", "ben", "Keller", EmployeeRole.SUPERVISOR))
                .with(inactive);
        webSocket = new RecordingWebSocketHandler();

        device = new FakeCardReaderDevice("TS-HRW380");
        FakeCardReaderProvider provider = new FakeCardReaderProvider()
                .withVisible(FakeCardReaderProvider.readerInfo())
                .withDevice(device);
        readerSession = new CardReaderSession(provider,
                ReaderSettings.builder().readTimeoutMs(20).build(), clock, Clock.systemUTC());
        authService = new AuthenticationServiceImpl(directory, AuthPolicy.defaults(), clock, Clock.systemUTC());
    }

    @AfterEach
    void tearDown() {
        readerSession.shutdown();
    }

    private KioskLoginService service(boolean allowManualLogin, boolean autoConnect) {
        return new KioskLoginService(readerSession, authService, directory, webSocket, allowManualLogin, autoConnect);
    }

    @Test
    void scannedCardIsAuthenticatedAndPublished() {
        KioskLoginService service = service(true, false);

        assertTrue(service.onCardScanned("04A1B2C3D4").isSuccess());

        assertEquals(List.of("04A1B2C3D4"), webSocket.getScannedCards());
        AuthResultDto published = webSocket.getAuthResults().get(0);
        assertEquals("SUCCESS", published.getOutcome());
        assertEquals("Anna Schmidt", published.getEmployee().getFullName());
    }

    @Test
    void rejectedCardIsPublishedAsUnauthorized() {
        KioskLoginService service = service(true, false);

        assertEquals(AuthOutcome.UNAUTHORIZED, service.onCardScanned("0400000000").getOutcome());
        assertFalse(webSocket.getAuthResults().get(0).isSuccess());
        assertNull(webSocket.getAuthResults().get(0).getEmployee());
    }

    @Test
    void manualLoginUsesFullName() {
        KioskLoginService service = service(true, false);

        assertTrue(service.loginManually(" Anna Schmidt ").isSuccess());
        assertEquals(1L, authService.getCurrentUser().orElseThrow().getId());
        assertTrue(webSocket.getScannedCards().isEmpty());
    }

    @Test
    void manualLoginCanBeDisabled() {
        KioskLoginService service = service(false, false);

        assertThrows(IllegalStateException.class, () -> service.loginManually("Anna Schmidt"));
        assertTrue(service.getManualIdentities().isEmpty());
        assertEquals(0, directory.getLookupCount());
    }

    @Test
    void manualLoginRequiresName() {
        KioskLoginService service = service(true, false);

        assertThrows(IllegalArgumentException.class, () -> service.loginManually("  "));
    }

    @Test
    void manualIdentitiesListActiveEmployeesSortedByName() {
        KioskLoginService service = service(true, false);

        List<String> names = service.getManualIdentities().stream()
                .map(EmployeeDto::getFullName)
                .collect(Collectors.toList());

        assertEquals(List.of("Anna Schmidt", "ben Keller"), names);
    }

    @Test
    void logoutPublishesSessionEnd() {
        KioskLoginService service = service(true, false);
        service.onCardScanned("04A1B2C3D4");

        assertTrue(service.logout());
        assertFalse(service.logout());

        assertEquals(List.of("Anna Schmidt:LOGOUT"), webSocket.getEndedSessions());
    }

    @Test
    void expiredSessionIsAnnouncedOnce() {
        KioskLoginService service = service(true, false);
        service.onCardScanned("04A1B2C3D4");

        clock.advanceMinutes(61);

        assertTrue(service.getCurrentUser().isEmpty());
        assertTrue(service.getCurrentUser().isEmpty());
        assertEquals(List.of("Anna Schmidt:EXPIRED"), webSocket.getEndedSessions());
    }

    @Test
    void startupConnectsReaderAndRoutesScansToLogin() throws Exception {
        KioskLoginService service = service(true, true);
        device.thenReport("04A1B2C3D4\r");

        service.init();

        long deadline = System.currentTimeMillis() + 2000;
        while ((webSocket.getAuthResults().isEmpty() || webSocket.getReaderStatuses().isEmpty())
                && System.currentTimeMillis() < deadline) {
            Thread.sleep(10);
        }

        assertTrue(readerSession.status().isConnected());
        assertEquals("SUCCESS", webSocket.getAuthResults().get(0).getOutcome());
        assertTrue(authService.isAuthenticated());
        assertFalse(webSocket.getReaderStatuses().isEmpty());
    }

    @Test
    void startupWithoutAutoConnectLeavesReaderAlone() {
        service(true, false).init();

        assertFalse(readerSession.status().isConnected());
        assertFalse(readerSession.status().isDispatching());
    }
}
