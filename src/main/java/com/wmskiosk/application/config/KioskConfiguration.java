package com.wmskiosk.application.config;

import com.wmskiosk.application.reader.CardReaderSession;
import com.wmskiosk.application.reader.ReaderSettings;
import com.wmskiosk.application.service.AuthPolicy;
import com.wmskiosk.application.service.AuthenticationService;
import com.wmskiosk.application.service.AuthenticationServiceImpl;
import com.wmskiosk.domain.port.CardReaderProvider;
import com.wmskiosk.domain.port.EmployeeDirectory;
import com.wmskiosk.domain.time.MonotonicClock;
import com.wmskiosk.domain.time.SystemMonotonicClock;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.Duration;
import java.util.Arrays;
import java.util.stream.Collectors;

/**
 * Ensambla los núcleos (lector y autenticación) a partir de application.properties.
 * Los núcleos no dependen de Spring; aquí se traducen las propiedades a sus settings.
 */
@Configuration
public class KioskConfiguration {

    @Bean
    public MonotonicClock monotonicClock() {
        return SystemMonotonicClock.INSTANCE;
    }

    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }

    @Bean
    public ReaderSettings readerSettings(@Value("${kiosk.reader.vendor-id:0x25DD}") String vendorId,
            @Value("${kiosk.reader.product-id:0x3000}") String productId,
            @Value("${kiosk.reader.known-names:TS-HRW}") String[] knownNames,
            @Value("${kiosk.reader.read-timeout-ms:100}") int readTimeoutMs,
            @Value("${kiosk.reader.suppression-window-ms:2000}") long suppressionWindowMs,
            @Value("${kiosk.reader.queue-capacity:10}") int queueCapacity,
            @Value("${kiosk.reader.max-consecutive-errors:3}") int maxConsecutiveErrors,
            @Value("${kiosk.reader.join-timeout-ms:2000}") long joinTimeoutMs,
            @Value("${kiosk.reader.min-token-length:6}") int minTokenLength) {

        return ReaderSettings.builder()
                .vendorId(Integer.decode(vendorId.trim()))
                .productId(Integer.decode(productId.trim()))
                .knownReaderNames(Arrays.stream(knownNames)
                        .map(String::trim)
                        .filter(n -> !n.isEmpty())
                        .collect(Collectors.toList()))
                .readTimeoutMs(readTimeoutMs)
                .suppressionWindow(Duration.ofMillis(suppressionWindowMs))
                .queueCapacity(queueCapacity)
                .maxConsecutiveErrors(maxConsecutiveErrors)
                .joinTimeout(Duration.ofMillis(joinTimeoutMs))
                .minTokenLength(minTokenLength)
                .build();
    }

    @Bean(destroyMethod = "shutdown")
    public CardReaderSession cardReaderSession(CardReaderProvider provider,
            ReaderSettings readerSettings,
            MonotonicClock monotonicClock,
            Clock clock) {
        return new CardReaderSession(provider, readerSettings, monotonicClock, clock);
    }

    @Bean
    public AuthPolicy authPolicy(@Value("${kiosk.auth.max-attempts:5}") int maxAttempts,
            @Value("${kiosk.auth.lockout-minutes:15}") long lockoutMinutes,
            @Value("${kiosk.auth.session-timeout-minutes:60}") long sessionTimeoutMinutes) {
        return AuthPolicy.builder()
                .maxAttempts(maxAttempts)
                .lockoutWindow(Duration.ofMinutes(lockoutMinutes))
                .sessionTimeout(Duration.ofMinutes(sessionTimeoutMinutes))
                .build();
    }

    @Bean
    public AuthenticationService authenticationService(EmployeeDirectory employeeDirectory,
            AuthPolicy authPolicy,
            MonotonicClock monotonicClock,
            Clock clock) {
        return new AuthenticationServiceImpl(employeeDirectory, authPolicy, monotonicClock, clock);
    }
}
