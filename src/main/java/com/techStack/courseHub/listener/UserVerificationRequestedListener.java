package com.techStack.courseHub.listener;

import com.techStack.courseHub.event.UserVerificationRequestedEvent;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * Records verification requests. Sending the message itself belongs to the mail
 * integration, which this service does not ship.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class UserVerificationRequestedListener {

    private final MeterRegistry meterRegistry;

    @EventListener
    public void onVerificationRequested(UserVerificationRequestedEvent event) {
        meterRegistry.counter("users.verification.requested").increment();
        log.info("Verification requested for user {} at {}", event.getUid(), event.getRequestedAt());
    }
}
