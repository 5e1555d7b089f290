package io.github.drompincen.pocpilot.runtime.llm;

import io.github.drompincen.pocpilot.runtime.config.AssistantProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;

/**
 * Caps the number of turns a single tenant can have in flight against the model service.
 */
@Component
public class TenantTurnLimiter {

    private static final Logger log = LoggerFactory.getLogger(TenantTurnLimiter.class);

    private final Map<String, Semaphore> permits = new ConcurrentHashMap<>();
    private final int turnsPerTenant;
    private final Duration admissionWait;

    public TenantTurnLimiter(AssistantProperties properties) {
        this.turnsPerTenant = Math.max(1, properties.getTenantConcurrentTurns());
        this.admissionWait = properties.getAdmissionWait();
    }

    /** Waits up to the admission timeout; false means the tenant is at its limit. */
    public boolean tryAcquire(String tenantId) {
        Semaphore semaphore = permits.computeIfAbsent(tenantId, k -> new Semaphore(turnsPerTenant, true));
        try {
            boolean acquired = semaphore.tryAcquire(admissionWait.toMillis(), TimeUnit.MILLISECONDS);
            if (!acquired) {
                log.warn("Tenant {} is at its limit of {} concurrent assistant turns", tenantId, turnsPerTenant);
            }
            return acquired;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    public void release(String tenantId) {
        Semaphore semaphore = permits.get(tenantId);
        if (semaphore != null) {
            semaphore.release();
        }
    }

    public int availablePermits(String tenantId) {
        Semaphore semaphore = permits.get(tenantId);
        return semaphore != null ? semaphore.availablePermits() : turnsPerTenant;
    }
}
