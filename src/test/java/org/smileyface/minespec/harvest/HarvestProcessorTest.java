package org.smileyface.minespec.harvest;

import org.junit.jupiter.api.Test;
import org.smileyface.minespec.model.ScoredCandidate;
import org.smileyface.minespec.model.SpecKey;
import org.smileyface.minespec.model.SpecStatus;
import org.smileyface.minespec.model.ValidatedSpec;
import org.smileyface.minespec.service.SpecPipeline;
import org.smileyface.minespec.store.InMemorySpecRepository;
import org.smileyface.minespec.testutil.StubDocumentFetcher;
import org.smileyface.minespec.testutil.TestPipelines;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.function.BiFunction;

import static org.assertj.core.api.Assertions.assertThat;

class HarvestProcessorTest {

    private static final String OEM = "https://www.cat.com/793f";
    private static final String DEALER = "https://www.finning.com/793f";
    private static final String MISSING = "https://www.cat.com/gone";

    private final SpecPipeline pipeline = TestPipelines.defaultPipeline();

    private static StubDocumentFetcher twoSources() {
        return new StubDocumentFetcher()
                .page(OEM, "", List.of(List.of(
                        List.of("Operating weight", "180 000 kg"),
                        List.of("Engine model", "Cat C175-16"))))
                .page(DEALER, "Operating weight: 181,000 kg", List.of());
    }

    @Test
    void storesRecordsReconciledAcrossAllDocuments() {
        StubDocumentFetcher fetcher = twoSources();
        InMemorySpecRepository repo = new InMemorySpecRepository();
        HarvestProcessor p = new HarvestProcessor("p1", new WorkItem("Caterpillar", "793F", List.of(OEM, DEALER, MISSING)),
                fetcher, pipeline, repo, 5_000);

        p.run();

        ProcessorStatus status = p.getStatus();
        assertThat(status.getState()).isEqualTo(ProcessorState.COMPLETED);
        assertThat(status.getDocumentsProcessed()).isEqualTo(2);
        assertThat(status.getRecordsStored()).isEqualTo(2);
        assertThat(status.getStartedAt()).isNotNull();
        assertThat(status.getFinishedAt()).isNotNull();

        List<ValidatedSpec> specs = repo.getSpecs("Caterpillar", "793F");
        assertThat(specs).extracting(ValidatedSpec::getParameterName)
                .containsExactly("engine_model", "operating_weight_kg");
        ValidatedSpec weight = specs.get(1);
        assertThat(weight.getStatus()).isEqualTo(SpecStatus.VALIDATED);
        assertThat(weight.getSupportingCandidates()).hasSize(2);
        assertThat(fetcher.requested()).containsExactly(OEM, DEALER, MISSING);
    }

    @Test
    void stoppedBeforeStartDoesNothing() {
        StubDocumentFetcher fetcher = twoSources();
        InMemorySpecRepository repo = new InMemorySpecRepository();
        HarvestProcessor p = new HarvestProcessor("p2", new WorkItem("Caterpillar", "793F", List.of(OEM)),
                fetcher, pipeline, repo, 5_000);

        p.stop();
        p.run();

        assertThat(p.getStatus().getState()).isEqualTo(ProcessorState.STOPPED);
        assertThat(fetcher.requested()).isEmpty();
        assertThat(repo.getSpecs(null, null)).isEmpty();
    }

    @Test
    void stopDuringFetchCancelsAndStoresNothing() throws Exception {
        StubDocumentFetcher fetcher = twoSources().hold(DEALER);
        InMemorySpecRepository repo = new InMemorySpecRepository();
        HarvestProcessor p = new HarvestProcessor("p3", new WorkItem("Caterpillar", "793F", List.of(OEM, DEALER)),
                fetcher, pipeline, repo, 30_000);

        Thread worker = new Thread(p);
        worker.start();
        long deadline = System.currentTimeMillis() + 5_000;
        while (fetcher.pending().isEmpty() && System.currentTimeMillis() < deadline) {
            Thread.sleep(10);
        }
        p.stop();
        worker.join(5_000);

        assertThat(worker.isAlive()).isFalse();
        assertThat(p.getStatus().getState()).isEqualTo(ProcessorState.STOPPED);
        assertThat(fetcher.pending()).allSatisfy(f -> assertThat(f.isCancelled()).isTrue());
        assertThat(repo.getSpecs(null, null)).isEmpty();
    }

    @Test
    void slowFetchesAreLeftBehindAtTheBarrier() {
        StubDocumentFetcher fetcher = twoSources().hold(DEALER);
        InMemorySpecRepository repo = new InMemorySpecRepository();
        HarvestProcessor p = new HarvestProcessor("p4", new WorkItem("Caterpillar", "793F", List.of(OEM, DEALER)),
                fetcher, pipeline, repo, 200);

        p.run();

        assertThat(p.getStatus().getState()).isEqualTo(ProcessorState.COMPLETED);
        assertThat(p.getStatus().getDocumentsProcessed()).isEqualTo(1);
        assertThat(fetcher.pending()).allSatisfy(f -> assertThat(f.isCancelled()).isTrue());
    }

    @Test
    void failedKeyDoesNotBlockOthers() {
        InMemorySpecRepository repo = new InMemorySpecRepository() {
            @Override
            public Optional<ValidatedSpec> mergeAndReconcile(SpecKey key, Collection<ScoredCandidate> candidates,
                                                             BiFunction<SpecKey, List<ScoredCandidate>, Optional<ValidatedSpec>> derive) {
                if (key.parameterName().equals("engine_model")) {
                    throw new IllegalStateException("store unavailable");
                }
                return super.mergeAndReconcile(key, candidates, derive);
            }
        };
        HarvestProcessor p = new HarvestProcessor("p5", new WorkItem("Caterpillar", "793F", List.of(OEM, DEALER)),
                twoSources(), pipeline, repo, 5_000);

        p.run();

        ProcessorStatus status = p.getStatus();
        assertThat(status.getState()).isEqualTo(ProcessorState.ERROR);
        assertThat(status.getKeysFailed()).isEqualTo(1);
        assertThat(status.getLastError()).contains("store unavailable");
        assertThat(repo.getSpecs("Caterpillar", "793F")).extracting(ValidatedSpec::getParameterName)
                .containsExactly("operating_weight_kg");
    }
}
