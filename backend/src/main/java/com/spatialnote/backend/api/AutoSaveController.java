package com.spatialnote.backend.api;

import com.spatialnote.backend.domain.WindowPosition;
import com.spatialnote.backend.service.autosave.AutoSaveEvent;
import com.spatialnote.backend.service.autosave.AutoSavePipeline;
import com.spatialnote.backend.service.autosave.AutoSaveResult;
import com.spatialnote.backend.service.autosave.AutoSaveSettingsUpdate;
import com.spatialnote.backend.service.autosave.AutoSaveStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.*;

@RestController
@RequestMapping("/api/v1/autosave")
public class AutoSaveController {

    private final AutoSavePipeline pipeline;

    public AutoSaveController(AutoSavePipeline pipeline) {
        this.pipeline = pipeline;
    }

    public record EventReq(AutoSaveEvent.Kind kind, Integer windowId, WindowPosition position, String content) {}
    public record MovementReq(Integer windowId, WindowPosition position) {}

    @PostMapping("/events")
    public ResponseEntity<Map<String, Object>> event(@RequestBody EventReq req) {
        if (req == null) throw new IllegalArgumentException("event is required");
        AutoSaveEvent event = new AutoSaveEvent(req.kind(), req.windowId(), req.position(), req.content());
        pipeline.submit(event);
        return ResponseEntity.accepted().body(Map.of("queued", true));
    }

    @PostMapping("/movement")
    public Map<String, Object> movement(@RequestBody MovementReq req) {
        if (req == null || req.windowId() == null || req.position() == null) {
            throw new IllegalArgumentException("windowId and position are required");
        }
        return Map.of("tracked", pipeline.recordMovement(req.windowId(), req.position()));
    }

    @PostMapping("/save")
    public Map<String, Object> save() {
        List<AutoSaveResult> results = pipeline.triggerManualSave().join();
        return Map.of("results", results);
    }

    @GetMapping("/status")
    public AutoSaveStatus status() {
        return pipeline.status();
    }

    @PutMapping("/settings")
    public AutoSaveStatus settings(@RequestBody AutoSaveSettingsUpdate update) {
        pipeline.updateSettings(update);
        return pipeline.status();
    }
}
