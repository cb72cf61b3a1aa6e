package org.smileyface.minespec.controller;

import org.smileyface.minespec.harvest.ProcessorStatus;
import org.smileyface.minespec.harvest.WorkItem;
import org.smileyface.minespec.model.RimpullCurve;
import org.smileyface.minespec.model.ValidatedSpec;
import org.smileyface.minespec.qa.EquipmentReport;
import org.smileyface.minespec.service.HarvestService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api")
class SpecController {

    private final HarvestService harvestService;

    SpecController(HarvestService harvestService) {
        this.harvestService = harvestService;
    }

    @GetMapping("/specs")
    public List<ValidatedSpec> specs(@RequestParam(required = false) String brand,
                                     @RequestParam(required = false) String model) {
        return harvestService.getSpecs(brand, model);
    }

    @GetMapping("/rimpull/{brand}/{model}")
    public ResponseEntity<RimpullCurve> rimpull(@PathVariable String brand, @PathVariable String model) {
        return ResponseEntity.of(harvestService.getRimpull(brand, model));
    }

    @GetMapping("/equipment/{brand}/{model}/report")
    public EquipmentReport report(@PathVariable String brand, @PathVariable String model) {
        return harvestService.equipmentReport(brand, model);
    }

    @PostMapping("/harvest")
    public ResponseEntity<ProcessorStatus> harvest(@RequestBody WorkItem item) {
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(harvestService.submit(item));
    }

    @GetMapping("/harvest")
    public List<ProcessorStatus> statuses() {
        return harvestService.getStatuses();
    }

    @DeleteMapping("/harvest/{brand}")
    public Map<String, Object> cancel(@PathVariable String brand) {
        return Map.of("brand", brand, "cancelled", harvestService.cancelBrand(brand));
    }

    @ExceptionHandler({IllegalArgumentException.class, HttpMessageNotReadableException.class})
    public ResponseEntity<Map<String, String>> badRequest(Exception e) {
        Throwable cause = e;
        while (cause.getCause() != null && cause != cause.getCause()) {
            cause = cause.getCause();
        }
        String message = cause.getMessage() != null ? cause.getMessage() : e.getClass().getSimpleName();
        return ResponseEntity.badRequest().body(Map.of("error", message));
    }
}
