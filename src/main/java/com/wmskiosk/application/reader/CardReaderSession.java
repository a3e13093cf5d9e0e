package com.wmskiosk.application.reader;

import com.wmskiosk.domain.exception.CardReaderException;
import com.wmskiosk.domain.model.CardScanEvent;
import com.wmskiosk.domain.model.ConnectResult;
import com.wmskiosk.domain.model.DeviceError;
import com.wmskiosk.domain.model.ReaderDeviceInfo;
import com.wmskiosk.domain.model.ReaderState;
import com.wmskiosk.domain.model.ReaderStatus;
import com.wmskiosk.domain.port.CardReaderDevice;
import com.wmskiosk.domain.port.CardReaderProvider;
import com.wmskiosk.domain.time.MonotonicClock;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

/**
 * Gestor de la conexión con el lector de tarjetas.
 *
 * <p>Es dueño del dispositivo y del único hilo de lectura. Cada reporte pasa por
 * {@link FrameDecoder} y {@link DuplicateSuppressor} dentro del hilo de lectura, y las
 * tarjetas aceptadas se dejan en la {@link ScanQueue}, la única estructura compartida
 * entre hilos.</p>
 *
 * <p>Los callbacks de estado se ejecutan en un hilo notificador propio, de modo que el
 * hilo de lectura nunca ejecuta código del llamador.</p>
 */
@Slf4j
public class CardReaderSession {

    private static final Duration DISPATCH_POLL = Duration.ofMillis(200);

    private final CardReaderProvider provider;
    private final ReaderSettings settings;
    private final MonotonicClock monotonicClock;
    private final Clock wallClock;
    private final ScanQueue<CardScanEvent> scanQueue;
    private final ExecutorService notifier;

    // Serializa connect/disconnect; el hilo de lectura nunca lo toma
    private final Object lifecycleLock = new Object();

    // Protege state, worker, lastError y deviceName
    private final Object stateLock = new Object();
    private ReaderState state = ReaderState.DISCONNECTED;
    private PollWorker worker;
    private String lastError;
    private String deviceName;

    private final Object monitorLock = new Object();
    private Dispatcher dispatcher;
    private volatile Consumer<ReaderStatus> statusListener;

    public CardReaderSession(CardReaderProvider provider,
            ReaderSettings settings,
            MonotonicClock monotonicClock,
            Clock wallClock) {
        this.provider = Objects.requireNonNull(provider, "provider");
        this.settings = Objects.requireNonNull(settings, "settings");
        this.monotonicClock = Objects.requireNonNull(monotonicClock, "monotonicClock");
        this.wallClock = Objects.requireNonNull(wallClock, "wallClock");
        this.scanQueue = new ScanQueue<>(settings.getQueueCapacity());
        this.notifier = Executors.newSingleThreadExecutor(daemonThreads("card-reader-status"));
    }

    /**
     * Busca el lector, lo abre y arranca el hilo de lectura.
     * Si ya está conectado no hace nada.
     *
     * @return Resultado de la conexión; los fallos esperados no lanzan excepciones
     */
    public ConnectResult connect() {
        synchronized (lifecycleLock) {
            synchronized (stateLock) {
                if (state == ReaderState.CONNECTED && worker != null) {
                    log.warn("El lector ya está conectado: {}", deviceName);
                    return ConnectResult.connected(deviceName);
                }
            }

            // Desde ERROR el worker ya terminó; se limpia antes de reintentar
            tearDown();
            transitionTo(ReaderState.CONNECTING, null);

            Optional<ReaderDeviceInfo> match;
            try {
                List<ReaderDeviceInfo> devices = provider.enumerate();
                match = selectDevice(devices, settings);
                if (match.isEmpty()) {
                    log.error("Lector de tarjetas no encontrado (VID: 0x{}, PID: 0x{})",
                            String.format("%04X", settings.getVendorId()),
                            String.format("%04X", settings.getProductId()));
                    logAvailableDevices(devices);
                }
            } catch (RuntimeException e) {
                log.error("Error enumerando dispositivos: {}", e.getMessage(), e);
                match = Optional.empty();
            }

            if (match.isEmpty()) {
                String message = "Lector de tarjetas no encontrado";
                transitionTo(ReaderState.DISCONNECTED, message);
                return ConnectResult.failed(DeviceError.DEVICE_UNAVAILABLE, message);
            }

            ReaderDeviceInfo target = match.get();
            CardReaderDevice device;
            try {
                device = provider.open(target);
            } catch (CardReaderException e) {
                log.error("No se pudo abrir el lector {}: {}", target.describe(), e.getMessage());
                transitionTo(ReaderState.DISCONNECTED, e.getMessage());
                return ConnectResult.failed(DeviceError.CONNECTION_FAILED, e.getMessage());
            } catch (RuntimeException e) {
                // Fallos nativos de la librería del dispositivo
                String message = "Error inesperado abriendo el lector: " + e.getMessage();
                log.error("{} ({})", message, target.describe(), e);
                transitionTo(ReaderState.DISCONNECTED, message);
                return ConnectResult.failed(DeviceError.CONNECTION_FAILED, message);
            }

            PollWorker newWorker = new PollWorker(device);
            synchronized (stateLock) {
                worker = newWorker;
                state = ReaderState.CONNECTED;
                lastError = null;
                deviceName = device.name();
                newWorker.thread.start();
            }

            log.info("Lector conectado: {}", target.describe());
            publishStatus();
            return ConnectResult.connected(device.name());
        }
    }

    /**
     * Detiene el hilo de lectura y cierra el dispositivo.
     * Es idempotente y se puede llamar desde cualquier hilo y en cualquier estado.
     */
    public void disconnect() {
        synchronized (lifecycleLock) {
            ReaderState previous;
            synchronized (stateLock) {
                previous = state;
            }

            tearDown();

            synchronized (stateLock) {
                state = ReaderState.DISCONNECTED;
                deviceName = null;
            }
            scanQueue.clear();

            if (previous != ReaderState.DISCONNECTED) {
                log.info("Lector desconectado");
                publishStatus();
            }
        }
    }

    /**
     * Espera una tarjeta durante {@code timeout} como máximo.
     */
    public Optional<String> readCard(Duration timeout) {
        return scanQueue.pop(timeout).map(CardScanEvent::getCardId);
    }

    public Optional<String> tryReadCard() {
        return scanQueue.tryPop().map(CardScanEvent::getCardId);
    }

    /**
     * Arranca un hilo que entrega cada tarjeta a {@code onCard}. {@code onStatus} recibe
     * cada cambio de estado del lector. Si ya había callbacks se reemplazan.
     *
     * @param onCard   Callback de tarjeta, obligatorio
     * @param onStatus Callback de estado, puede ser null
     */
    public void startMonitoring(Consumer<String> onCard, Consumer<ReaderStatus> onStatus) {
        Objects.requireNonNull(onCard, "onCard");

        synchronized (monitorLock) {
            if (dispatcher != null) {
                log.warn("La monitorización ya estaba activa. Reemplazando callbacks...");
                stopDispatcher();
            }
            statusListener = onStatus;
            dispatcher = new Dispatcher(onCard);
            dispatcher.thread.start();
        }

        log.info("Monitorización de tarjetas iniciada");
        publishStatus();
    }

    /**
     * Detiene la entrega de tarjetas a los callbacks. La conexión sigue abierta.
     */
    public void stopMonitoring() {
        boolean stopped;
        synchronized (monitorLock) {
            stopped = stopDispatcher();
            statusListener = null;
        }
        if (stopped) {
            log.info("Monitorización de tarjetas detenida");
        }
    }

    public ReaderStatus status() {
        boolean dispatching;
        synchronized (monitorLock) {
            dispatching = dispatcher != null;
        }

        synchronized (stateLock) {
            boolean polling = worker != null && worker.thread.isAlive() && !worker.stopRequested.get();
            return ReaderStatus.builder()
                    .state(state)
                    .connected(state == ReaderState.CONNECTED)
                    .monitoring(polling)
                    .dispatching(dispatching)
                    .lastError(lastError)
                    .deviceName(deviceName)
                    .pendingScans(scanQueue.size())
                    .build();
        }
    }

    /**
     * Lista los dispositivos visibles, para diagnóstico.
     */
    public List<ReaderDeviceInfo> availableDevices() {
        return provider.enumerate();
    }

    /**
     * Libera todo: callbacks, conexión y el hilo notificador.
     */
    public void shutdown() {
        log.info("Liberando recursos del lector...");
        stopMonitoring();
        disconnect();
        notifier.shutdown();
    }

    /**
     * Elige el dispositivo: primero VID/PID exactos, después coincidencia parcial del nombre
     * de producto con los nombres conocidos (sin distinguir mayúsculas).
     */
    static Optional<ReaderDeviceInfo> selectDevice(List<ReaderDeviceInfo> devices, ReaderSettings settings) {
        if (devices == null || devices.isEmpty()) {
            return Optional.empty();
        }

        Optional<ReaderDeviceInfo> exact = devices.stream()
                .filter(d -> d.matches(settings.getVendorId(), settings.getProductId()))
                .findFirst();
        if (exact.isPresent()) {
            return exact;
        }

        return devices.stream()
                .filter(d -> d.getProductName() != null)
                .filter(d -> settings.getKnownReaderNames().stream()
                        .anyMatch(name -> d.getProductName().toUpperCase(Locale.ROOT)
                                .contains(name.toUpperCase(Locale.ROOT))))
                .findFirst();
    }

    private void logAvailableDevices(List<ReaderDeviceInfo> devices) {
        log.info("Dispositivos disponibles: {}", devices.size());
        for (ReaderDeviceInfo device : devices) {
            log.info("  {}", device.describe());
        }
    }

    /**
     * Para y cierra el worker actual, si lo hay.
     */
    private void tearDown() {
        PollWorker current;
        synchronized (stateLock) {
            current = worker;
            worker = null;
        }

        if (current == null) {
            return;
        }

        current.stopRequested.set(true);
        joinBounded(current.thread, "lectura");
        current.closeDevice();
    }

    /**
     * Llamado por el hilo de lectura al agotar los reintentos.
     */
    private void onPollFailure(PollWorker failed, String reason) {
        synchronized (stateLock) {
            if (worker != failed) {
                return;
            }
            worker = null;
            state = ReaderState.ERROR;
            lastError = reason;
        }

        failed.closeDevice();
        log.error("Lectura detenida tras {} errores consecutivos: {}",
                settings.getMaxConsecutiveErrors(), reason);
        publishStatus();
    }

    private void transitionTo(ReaderState newState, String error) {
        synchronized (stateLock) {
            state = newState;
            if (error != null) {
                lastError = error;
            }
        }
        publishStatus();
    }

    private void publishStatus() {
        Consumer<ReaderStatus> listener = statusListener;
        if (listener == null) {
            return;
        }

        ReaderStatus snapshot = status();
        try {
            notifier.execute(() -> {
                try {
                    listener.accept(snapshot);
                } catch (RuntimeException e) {
                    log.error("Error en callback de estado: {}", e.getMessage(), e);
                }
            });
        } catch (RejectedExecutionException e) {
            log.debug("Notificador detenido, estado {} no publicado", snapshot.getState());
        }
    }

    private boolean stopDispatcher() {
        Dispatcher current = dispatcher;
        dispatcher = null;
        if (current == null) {
            return false;
        }
        current.stopRequested.set(true);
        joinBounded(current.thread, "despacho");
        return true;
    }

    private void joinBounded(Thread thread, String role) {
        if (thread == Thread.currentThread()) {
            return;
        }
        try {
            thread.join(settings.getJoinTimeout().toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        if (thread.isAlive()) {
            log.warn("El hilo de {} no terminó en {} ms", role, settings.getJoinTimeout().toMillis());
        }
    }

    private static ThreadFactory daemonThreads(String name) {
        return runnable -> {
            Thread thread = new Thread(runnable, name);
            thread.setDaemon(true);
            return thread;
        };
    }

    /**
     * Hilo de lectura de una conexión. El decodificador y el supresor son locales a él.
     */
    private final class PollWorker implements Runnable {

        private final CardReaderDevice device;
        private final FrameDecoder decoder = new FrameDecoder(settings.getMinTokenLength());
        private final DuplicateSuppressor suppressor = new DuplicateSuppressor(settings.getSuppressionWindow());
        private final AtomicBoolean stopRequested = new AtomicBoolean(false);
        private final AtomicBoolean closed = new AtomicBoolean(false);
        private final Thread thread;

        private PollWorker(CardReaderDevice device) {
            this.device = device;
            this.thread = daemonThreads("card-reader-poll").newThread(this);
        }

        @Override
        public void run() {
            log.info("Iniciando loop de lectura del lector {}", device.name());
            int consecutiveErrors = 0;

            while (!stopRequested.get()) {
                byte[] report;
                try {
                    report = device.read(settings.getReadTimeoutMs());
                    consecutiveErrors = 0;
                } catch (RuntimeException e) {
                    if (stopRequested.get()) {
                        break;
                    }
                    consecutiveErrors++;
                    log.warn("Error de lectura ({}/{}): {}",
                            consecutiveErrors, settings.getMaxConsecutiveErrors(), e.getMessage());
                    if (consecutiveErrors >= settings.getMaxConsecutiveErrors()) {
                        onPollFailure(this, e.getMessage());
                        break;
                    }
                    continue;
                }

                if (report != null && report.length > 0) {
                    handleReport(report);
                }
            }

            log.info("Loop de lectura finalizado");
        }

        private void handleReport(byte[] report) {
            for (String token : decoder.feed(report)) {
                if (!suppressor.accept(token, monotonicClock.nowNanos())) {
                    log.debug("Lectura repetida ignorada: {}", token);
                    continue;
                }

                log.info("Tarjeta detectada: {}", token);
                scanQueue.push(CardScanEvent.of(token, wallClock.instant()))
                        .ifPresent(evicted -> log.warn("Cola de lecturas llena, descartada: {}",
                                evicted.getCardId()));
            }
        }

        private void closeDevice() {
            if (!closed.compareAndSet(false, true)) {
                return;
            }
            try {
                device.close();
                log.info("Lector {} cerrado", device.name());
            } catch (RuntimeException e) {
                log.error("Error cerrando el lector {}: {}", device.name(), e.getMessage());
            }
        }
    }

    /**
     * Hilo que vacía la cola hacia el callback de tarjetas.
     */
    private final class Dispatcher implements Runnable {

        private final Consumer<String> onCard;
        private final AtomicBoolean stopRequested = new AtomicBoolean(false);
        private final Thread thread;

        private Dispatcher(Consumer<String> onCard) {
            this.onCard = onCard;
            this.thread = daemonThreads("card-dispatcher").newThread(this);
        }

        @Override
        public void run() {
            while (!stopRequested.get() && !Thread.currentThread().isInterrupted()) {
                Optional<CardScanEvent> event = scanQueue.pop(DISPATCH_POLL);
                if (event.isEmpty()) {
                    continue;
                }
                try {
                    onCard.accept(event.get().getCardId());
                } catch (RuntimeException e) {
                    log.error("Error en callback de tarjeta: {}", e.getMessage(), e);
                }
            }
        }
    }
}
