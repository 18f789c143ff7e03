package com.spatialnote.backend.api;

import com.spatialnote.backend.api.dto.WindowCreateRequest;
import com.spatialnote.backend.domain.ExportTemplate;
import com.spatialnote.backend.domain.WindowPosition;
import com.spatialnote.backend.domain.WindowRecord;
import com.spatialnote.backend.domain.payload.ChartData;
import com.spatialnote.backend.domain.payload.DataFrameData;
import com.spatialnote.backend.domain.payload.Model3DData;
import com.spatialnote.backend.domain.payload.PointCloudData;
import com.spatialnote.backend.domain.payload.VolumeData;
import com.spatialnote.backend.repo.WindowPresenter;
import com.spatialnote.backend.repo.WindowRegistry;
import com.spatialnote.backend.service.autosave.AutoSaveEvent;
import com.spatialnote.backend.service.autosave.AutoSavePipeline;
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.*;

@RestController
@RequestMapping("/api/v1/windows")
public class WindowController {

    private final WindowRegistry registry;
    private final WindowPresenter presenter;
    private final AutoSavePipeline autosave;

    public WindowController(WindowRegistry registry, WindowPresenter presenter, AutoSavePipeline autosave) {
        this.registry = registry;
        this.presenter = presenter;
        this.autosave = autosave;
    }

    public record ContentReq(String content) {}
    public record TemplateReq(ExportTemplate template) {}
    public record StateReq(Boolean minimized, Boolean maximized, Double opacity) {}
    public record TagsReq(List<String> tags) {}
    public record TagReq(String tag) {}

    @GetMapping
    public Map<String, Object> list(@RequestParam(defaultValue = "false") boolean onlyOpen) {
        return Map.of("items", registry.listAll(onlyOpen));
    }

    @PostMapping
    public ResponseEntity<Map<String, Object>> create(@Valid @RequestBody WindowCreateRequest req) {
        WindowRecord created = registry.create(req.windowType, req.id, req.position);
        if (req.open) open(created.getId());
        return ResponseEntity.status(201).body(Map.of("item", created, "open", registry.isOpen(created.getId())));
    }

    @GetMapping("/{id}")
    public Map<String, Object> get(@PathVariable int id) {
        WindowRecord r = registry.find(id).orElseThrow(() -> notFound(id));
        return Map.of("item", r, "open", registry.isOpen(id));
    }

    @DeleteMapping("/{id}")
    public Map<String, Object> remove(@PathVariable int id) {
        require(registry.removeWindow(id), id);
        return Map.of("ok", true);
    }

    @DeleteMapping
    public Map<String, Object> clear() {
        registry.clearAll();
        return Map.of("ok", true);
    }

    // =========================
    // open / close
    // =========================

    @PostMapping("/{id}/open")
    public Map<String, Object> open(@PathVariable int id) {
        if (!registry.contains(id)) throw notFound(id);
        presenter.open(id);
        registry.markOpened(id);
        return Map.of("ok", true);
    }

    @PostMapping("/{id}/close")
    public Map<String, Object> close(@PathVariable int id) {
        if (!registry.contains(id)) throw notFound(id);
        registry.markClosed(id);
        autosave.submit(AutoSaveEvent.windowClosed(id));
        return Map.of("ok", true);
    }

    @PostMapping("/cleanup")
    public Map<String, Object> cleanup() {
        return Map.of("purged", registry.cleanupClosedWindows());
    }

    // =========================
    // updates
    // =========================

    @PutMapping("/{id}/position")
    public Map<String, Object> position(@PathVariable int id, @RequestBody WindowPosition position) {
        if (position == null) throw new IllegalArgumentException("position is required");
        require(registry.updatePosition(id, position), id);
        autosave.recordMovement(id, position);
        return Map.of("ok", true);
    }

    @PutMapping("/{id}/content")
    public Map<String, Object> content(@PathVariable int id, @RequestBody ContentReq body) {
        String content = body == null || body.content() == null ? "" : body.content();
        require(registry.updateContent(id, content), id);
        autosave.submit(AutoSaveEvent.contentChanged(id, content));
        return Map.of("ok", true);
    }

    @PutMapping("/{id}/template")
    public Map<String, Object> template(@PathVariable int id, @RequestBody TemplateReq body) {
        if (body == null || body.template() == null) throw new IllegalArgumentException("template is required");
        require(registry.updateTemplate(id, body.template()), id);
        return Map.of("ok", true);
    }

    @PutMapping("/{id}/state")
    public Map<String, Object> state(@PathVariable int id, @RequestBody StateReq body) {
        require(registry.updateState(id, body.minimized(), body.maximized(), body.opacity()), id);
        return Map.of("ok", true);
    }

    @PutMapping("/{id}/tags")
    public Map<String, Object> setTags(@PathVariable int id, @RequestBody TagsReq body) {
        require(registry.setTags(id, body == null ? null : body.tags()), id);
        return Map.of("ok", true);
    }

    @PostMapping("/{id}/tags")
    public Map<String, Object> addTag(@PathVariable int id, @RequestBody TagReq body) {
        if (!registry.contains(id)) throw notFound(id);
        return Map.of("added", registry.addTag(id, body == null ? null : body.tag()));
    }

    @DeleteMapping("/{id}/tags/{tag}")
    public Map<String, Object> removeTag(@PathVariable int id, @PathVariable String tag) {
        if (!registry.contains(id)) throw notFound(id);
        return Map.of("removed", registry.removeTag(id, tag));
    }

    @PutMapping("/{id}/payload/dataframe")
    public Map<String, Object> dataFrame(@PathVariable int id, @RequestBody DataFrameData data) {
        require(registry.updateDataFrame(id, data), id);
        return Map.of("ok", true);
    }

    @PutMapping("/{id}/payload/chart")
    public Map<String, Object> chart(@PathVariable int id, @RequestBody ChartData data) {
        require(registry.updateChart(id, data), id);
        return Map.of("ok", true);
    }

    @PutMapping("/{id}/payload/pointcloud")
    public Map<String, Object> pointCloud(@PathVariable int id, @RequestBody PointCloudData data) {
        require(registry.updatePointCloud(id, data), id);
        return Map.of("ok", true);
    }

    @PutMapping("/{id}/payload/volume")
    public Map<String, Object> volume(@PathVariable int id, @RequestBody VolumeData data) {
        require(registry.updateVolume(id, data), id);
        return Map.of("ok", true);
    }

    @PutMapping("/{id}/payload/model3d")
    public Map<String, Object> model3d(@PathVariable int id, @RequestBody Model3DData data) {
        require(registry.updateModel3D(id, data), id);
        return Map.of("ok", true);
    }

    private static void require(boolean applied, int id) {
        if (!applied) throw notFound(id);
    }

    private static NoSuchElementException notFound(int id) {
        return new NoSuchElementException("window not found: " + id);
    }
}
