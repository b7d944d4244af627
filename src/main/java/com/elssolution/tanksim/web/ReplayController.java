package com.elssolution.tanksim.web;

import com.elssolution.tanksim.alerts.AlertService;
import com.elssolution.tanksim.bus.EventBus;
import com.elssolution.tanksim.bus.EventSubscription;
import com.elssolution.tanksim.control.ReplayControlPlane;
import com.elssolution.tanksim.control.ReplayStartException;
import com.elssolution.tanksim.domain.ReplayEvent;
import com.elssolution.tanksim.service.ReplayStatusService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.util.List;
import java.util.Map;

@Slf4j
@RestController
public class ReplayController {

    public record StartRequest(Double delaySeconds, List<String> sources) {}

    public record EventsView(List<ReplayEvent> events, int returned) {}

    public record SourceListView(List<String> sources, String baseDir) {}

    private final ReplayControlPlane control;
    private final ReplayStatusService status;
    private final EventBus bus;
    private final StreamPump pump;
    private final AlertService alerts;

    @Value("${replay.data.baseDir:data}") private String baseDir;

    public ReplayController(ReplayControlPlane control,
                            ReplayStatusService status,
                            EventBus bus,
                            StreamPump pump,
                            AlertService alerts) {
        this.control = control;
        this.status = status;
        this.bus = bus;
        this.pump = pump;
        this.alerts = alerts;
    }

    // ---- Control ----

    @PostMapping("/start")
    public ReplayControlPlane.StartResult start(@RequestBody(required = false) StartRequest req) {
        StartRequest r = (req == null) ? new StartRequest(null, null) : req;
        return control.start(r.delaySeconds(), r.sources());
    }

    @PostMapping("/stop")
    public Map<String, String> stop() {
        control.stop();
        return Map.of("status", "stopped");
    }

    // ---- Queries ----

    @GetMapping("/events")
    public EventsView events(@RequestParam(name = "maxEvents", defaultValue = "200") int maxEvents) {
        List<ReplayEvent> events = bus.poll(maxEvents);
        return new EventsView(events, events.size());
    }

    @GetMapping("/latest")
    public ReplayStatusService.LatestView latest() {
        return status.buildLatestView();
    }

    @GetMapping("/status")
    public ReplayStatusService.StatusView getStatus() {
        return status.buildStatusView();
    }

    @GetMapping("/list")
    public SourceListView list() {
        return new SourceListView(control.getDefaultSources(), baseDir);
    }

    @GetMapping("/alerts")
    public AlertService.AlertsSnapshot getAlerts() {
        return alerts.snapshot();
    }

    // ---- Push stream ----

    @GetMapping(value = "/stream/sse", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public SseEmitter streamSse() {
        SseEmitter emitter = new SseEmitter(0L); // held open until the client goes away
        EventSubscription sub = pump.open("sse", new StreamPump.EventSink() {
            @Override
            public void send(String json) throws java.io.IOException {
                emitter.send(SseEmitter.event().data(json));
            }

            @Override
            public void heartbeat() throws java.io.IOException {
                emitter.send(SseEmitter.event().comment("keepalive"));
            }

            @Override
            public void complete() {
                emitter.complete();
            }
        });
        emitter.onCompletion(sub::close);
        emitter.onTimeout(sub::close);
        emitter.onError(t -> sub.close());
        return emitter;
    }

    // ---- Errors ----

    @ExceptionHandler(ReplayStartException.class)
    public ResponseEntity<Map<String, Object>> onStartRejected(ReplayStartException e) {
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(Map.of("errors", e.getErrors()));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, Object>> onBadArgument(IllegalArgumentException e) {
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(Map.of("error", String.valueOf(e.getMessage())));
    }
}
