package org.smileyface.minespec.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.smileyface.minespec.harvest.HarvestManager;
import org.smileyface.minespec.harvest.ProcessorStatus;
import org.smileyface.minespec.harvest.WorkItem;
import org.smileyface.minespec.model.RimpullCurve;
import org.smileyface.minespec.model.ValidatedSpec;
import org.smileyface.minespec.qa.EquipmentReport;
import org.smileyface.minespec.store.SpecRepository;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;

/**
 * Entry point for harvesting and for reading results: queues work items on the {@link HarvestManager}
 * and answers queries from the {@link SpecRepository}.
 */
@Service
public class HarvestService {

    private static final Logger log = LoggerFactory.getLogger(HarvestService.class);

    private final HarvestManager harvestManager;
    private final SpecRepository repository;
    private final SpecPipeline pipeline;

    public HarvestService(HarvestManager harvestManager, SpecRepository repository, SpecPipeline pipeline) {
        this.harvestManager = harvestManager;
        this.repository = repository;
        this.pipeline = pipeline;
    }

    /**
     * Queues one machine for harvesting.
     *
     * @throws IllegalArgumentException when the item has no URL
     */
    public ProcessorStatus submit(WorkItem item) {
        if (item.urls().isEmpty()) {
            throw new IllegalArgumentException("at least one url is required for " + item.label());
        }
        String id = harvestManager.submit(item);
        return harvestManager.getStatus(id)
                .orElseThrow(() -> new IllegalStateException("no status for submitted item " + id));
    }

    public int cancelBrand(String brand) {
        if (brand == null || brand.isBlank()) {
            throw new IllegalArgumentException("brand must not be blank");
        }
        int n = harvestManager.cancelBrand(brand);
        log.info("Cancellation of brand {} stopped {} item(s)", brand, n);
        return n;
    }

    public List<ProcessorStatus> getStatuses() {
        return harvestManager.getStatuses();
    }

    public List<ValidatedSpec> getSpecs(String brand, String model) {
        return repository.getSpecs(brand, model);
    }

    public Optional<RimpullCurve> getRimpull(String brand, String model) {
        return repository.getRimpull(brand, model);
    }

    /**
     * Cross-parameter checks and core-parameter completeness of one machine's stored records.
     */
    public EquipmentReport equipmentReport(String brand, String model) {
        List<ValidatedSpec> specs = repository.getSpecs(brand, model);
        String b = specs.isEmpty() ? brand : specs.get(0).getBrand();
        String m = specs.isEmpty() ? model : specs.get(0).getModel();
        return pipeline.qa().checkEquipment(b, m, specs);
    }
}
