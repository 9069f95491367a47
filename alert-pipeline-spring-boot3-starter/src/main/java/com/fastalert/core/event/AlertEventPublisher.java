package com.fastalert.core.event;

import com.fastalert.config.AlertPipelineProperties;
import com.fastalert.core.metric.AlertMetrics;
import com.fastalert.core.spi.event.AlertEventListener;
import com.fastalert.model.event.AlertEvent;
import io.micrometer.core.instrument.util.NamedThreadFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

/**
 * 生命周期事件派发
 * exec 为空时在调用线程同步派发; 监听器异常只记录和计数
 */
public class AlertEventPublisher {

    private static final Logger log = LoggerFactory.getLogger(AlertEventPublisher.class);

    private final List<AlertEventListener> listeners = new CopyOnWriteArrayList<>();

    private final ExecutorService exec;

    private final AlertMetrics metrics;

    public AlertEventPublisher(Collection<? extends AlertEventListener> initial, ExecutorService exec, AlertMetrics metrics) {
        if (initial != null) {
            initial.forEach(this::addListener);
        }
        this.exec = exec;
        this.metrics = metrics;
    }

    /**
     * async=true 时建独立派发线程池, 队列满由调用线程派发
     */
    public static AlertEventPublisher create(AlertPipelineProperties.Events cfg,
                                             Collection<? extends AlertEventListener> listeners,
                                             AlertMetrics metrics) {
        ExecutorService exec = null;
        if (cfg.isAsync()) {
            exec = new ThreadPoolExecutor(
                    cfg.getPoolSize(),
                    cfg.getPoolSize(),
                    60L,
                    TimeUnit.SECONDS,
                    new ArrayBlockingQueue<>(cfg.getQueueCapacity()),
                    new NamedThreadFactory("alert-event"),
                    new ThreadPoolExecutor.CallerRunsPolicy());
        }
        return new AlertEventPublisher(listeners, exec, metrics);
    }

    public void addListener(AlertEventListener listener) {
        listeners.add(listener);
        log.info("[Alert-Event] listener {} registered", listener.name());
    }

    public boolean removeListener(String name) {
        return listeners.removeIf(l -> l.name().equals(name));
    }

    public List<AlertEventListener> getListeners() {
        return new ArrayList<>(listeners);
    }

    public void publish(AlertEvent event) {
        if (listeners.isEmpty()) {
            return;
        }
        if (exec == null) {
            dispatch(event);
            return;
        }
        if (exec.isShutdown()) {
            log.debug("[Alert-Event] publisher stopped, event={} alert={} skipped", event.getType(), event.getAlert().getId());
            return;
        }
        try {
            exec.execute(() -> dispatch(event));
        } catch (RejectedExecutionException rex) {
            // 与 shutdown 并发
            log.warn("[Alert-Event] event={} alert={} dropped: {}", event.getType(), event.getAlert().getId(), rex.toString());
            metrics.incEventFailed("rejected");
        }
    }

    private void dispatch(AlertEvent event) {
        for (AlertEventListener l : listeners) {
            try {
                if (!l.supports(event)) {
                    continue;
                }
                l.onEvent(event);
                metrics.incEventDispatched(event.getType().name());
            } catch (Exception e) {
                metrics.incEventFailed(l.name());
                log.error("[Alert-Event] listener={} event={} alert={} failed",
                        l.name(), event.getType(), event.getAlert().getId(), e);
            }
        }
    }

    /**
     * 停止接收新事件, 等待已排队的事件派发完毕
     */
    public void shutdown(long awaitMillis) {
        if (exec == null) {
            return;
        }
        exec.shutdown();
        try {
            if (!exec.awaitTermination(awaitMillis, TimeUnit.MILLISECONDS)) {
                exec.shutdownNow();
            }
        } catch (InterruptedException e) {
            exec.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
