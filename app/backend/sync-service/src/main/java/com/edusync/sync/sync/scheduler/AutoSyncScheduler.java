package com.edusync.sync.sync.scheduler;

import com.edusync.sync.common.config.EduSyncProperties;
import com.edusync.sync.credential.exception.CalendarAuthException;
import com.edusync.sync.reconcile.model.SyncBatchResult;
import com.edusync.sync.source.exception.SourceException;
import com.edusync.sync.sync.exception.SyncInProgressException;
import com.edusync.sync.sync.service.SyncOrchestrator;
import com.edusync.sync.tenant.service.TenantStateService;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * tenant별 자동 동기화 타이머
 *
 * tenant당 최대 하나의 주기 작업을 공유 스레드 풀에서 실행합니다.
 * 애플리케이션 시작 시 autoSyncEnabled인 tenant의 타이머를 복원합니다.
 */
@Slf4j
@Component
public class AutoSyncScheduler {

    private final SyncOrchestrator syncOrchestrator;
    private final TenantStateService tenantStateService;
    private final EduSyncProperties properties;

    private final ScheduledExecutorService executor;
    private final Map<String, ScheduledFuture<?>> timers = new ConcurrentHashMap<>();

    public AutoSyncScheduler(SyncOrchestrator syncOrchestrator,
                             TenantStateService tenantStateService,
                             EduSyncProperties properties) {
        this.syncOrchestrator = syncOrchestrator;
        this.tenantStateService = tenantStateService;
        this.properties = properties;
        this.executor = Executors.newScheduledThreadPool(properties.getSync().getSchedulerPoolSize(), threadFactory());
    }

    /**
     * 자동 동기화를 켭니다. 이미 타이머가 있으면 새로 만들지 않습니다.
     * 플래그 저장과 타이머 등록은 tenant 단위로 원자적으로 수행됩니다.
     */
    public void enable(String tenantId) {
        timers.compute(tenantId, (id, existing) -> {
            tenantStateService.setAutoSyncEnabled(id, true);
            return armIfAbsent(id, existing);
        });
    }

    /**
     * 이후 실행만 취소합니다. 실행 중인 패스는 중단하지 않습니다.
     * 플래그를 먼저 저장하고, 저장에 실패하면 타이머를 그대로 둡니다.
     */
    public void disable(String tenantId) {
        timers.compute(tenantId, (id, existing) -> {
            tenantStateService.setAutoSyncEnabled(id, false);
            if (existing != null) {
                existing.cancel(false);
                log.info("Auto-sync timer cancelled: tenantId={}", id);
            }
            return null;
        });
    }

    public boolean isScheduled(String tenantId) {
        ScheduledFuture<?> timer = timers.get(tenantId);
        return timer != null && !timer.isDone();
    }

    @EventListener(ApplicationReadyEvent.class)
    public void restoreTimers() {
        List<String> tenantIds = tenantStateService.findAutoSyncEnabledTenantIds();
        tenantIds.forEach(this::restore);
        log.info("Restored auto-sync timers: count={}", tenantIds.size());
    }

    @PreDestroy
    public void shutdown() {
        log.info("Stopping auto-sync scheduler: timers={}", timers.size());
        timers.values().forEach(timer -> timer.cancel(false));
        timers.clear();

        executor.shutdown();
        try {
            if (!executor.awaitTermination(10, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    /**
     * 조회 이후 비활성화된 tenant는 건너뜁니다.
     */
    private void restore(String tenantId) {
        timers.compute(tenantId, (id, existing) -> tenantStateService.get(id).isAutoSyncEnabled()
                ? armIfAbsent(id, existing)
                : existing);
    }

    private ScheduledFuture<?> armIfAbsent(String tenantId, ScheduledFuture<?> existing) {
        if (existing != null && !existing.isDone()) {
            log.debug("Auto-sync timer already scheduled: tenantId={}", tenantId);
            return existing;
        }
        long initialDelay = properties.getSync().getInitialDelay().toMillis();
        long interval = properties.getSync().getInterval().toMillis();
        log.info("Auto-sync timer scheduled: tenantId={}, interval={}", tenantId, properties.getSync().getInterval());
        return executor.scheduleAtFixedRate(() -> tick(tenantId), initialDelay, interval, TimeUnit.MILLISECONDS);
    }

    /**
     * 어떤 예외도 밖으로 전파하지 않습니다.
     */
    void tick(String tenantId) {
        try {
            SyncBatchResult result = syncOrchestrator.runOnce(tenantId);
            log.info("Auto-sync completed: tenantId={}, {}", tenantId, result.summary());
        } catch (SyncInProgressException e) {
            log.info("Auto-sync skipped, pass already running: tenantId={}", tenantId);
        } catch (CalendarAuthException e) {
            log.warn("Auto-sync failed, calendar authorization required: tenantId={}, reason={}",
                    tenantId, e.getReason());
        } catch (SourceException e) {
            log.warn("Auto-sync failed, source error: tenantId={}, reason={}", tenantId, e.getReason());
        } catch (Exception e) {
            log.error("Auto-sync failed unexpectedly: tenantId={}", tenantId, e);
        }
    }

    private static ThreadFactory threadFactory() {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, "auto-sync-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
