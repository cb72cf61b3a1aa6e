package org.smileyface.minespec.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.smileyface.minespec.extractor.SpecExtractor;
import org.smileyface.minespec.model.RawDocument;
import org.smileyface.minespec.model.RimpullCurve;
import org.smileyface.minespec.model.ScoredCandidate;
import org.smileyface.minespec.model.SourceTier;
import org.smileyface.minespec.model.SpecKey;
import org.smileyface.minespec.model.ValidatedSpec;
import org.smileyface.minespec.qa.CurveReport;
import org.smileyface.minespec.qa.QaOutcome;
import org.smileyface.minespec.qa.QaPipeline;
import org.smileyface.minespec.scoring.ConfidenceScorer;
import org.smileyface.minespec.scoring.SourceClassifier;
import org.smileyface.minespec.validation.CrossValidator;
import org.smileyface.minespec.validation.RimpullReconciler;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * The document-to-record chain without any I/O: extraction, scoring, reconciliation and QA.
 * Every method is a pure function of its arguments and the engine configuration, so it can run on
 * any thread.
 */
public class SpecPipeline {

    private static final Logger log = LoggerFactory.getLogger(SpecPipeline.class);

    private final SpecExtractor extractor;
    private final SourceClassifier classifier;
    private final ConfidenceScorer scorer;
    private final CrossValidator validator;
    private final RimpullReconciler rimpullReconciler;
    private final QaPipeline qa;

    public SpecPipeline(SpecExtractor extractor, SourceClassifier classifier, ConfidenceScorer scorer,
                        CrossValidator validator, RimpullReconciler rimpullReconciler, QaPipeline qa) {
        this.extractor = Objects.requireNonNull(extractor, "extractor");
        this.classifier = Objects.requireNonNull(classifier, "classifier");
        this.scorer = Objects.requireNonNull(scorer, "scorer");
        this.validator = Objects.requireNonNull(validator, "validator");
        this.rimpullReconciler = Objects.requireNonNull(rimpullReconciler, "rimpullReconciler");
        this.qa = Objects.requireNonNull(qa, "qa");
    }

    /** What one document contributes to a machine. */
    public record DocumentResult(SourceTier tier, List<ScoredCandidate> candidates, List<RimpullCurve> curves) {
        public DocumentResult {
            candidates = List.copyOf(candidates);
            curves = List.copyOf(curves);
        }
    }

    /**
     * Extracts and scores everything one document says about a machine. Curves carry the document's tier.
     */
    public DocumentResult process(RawDocument doc, String brand, String model) {
        SourceTier tier = classifier.classify(doc, brand);
        SpecExtractor.ExtractionResult extracted = extractor.extractAll(doc, brand, model);
        List<ScoredCandidate> scored = scorer.scoreAll(extracted.candidates(), tier);
        List<RimpullCurve> curves = new ArrayList<>();
        for (RimpullCurve c : extracted.curves()) {
            curves.add(c.with(tier, List.of()));
        }
        log.debug("{} ({}): {} candidates, {} curves", doc.getUrl(), tier, scored.size(), curves.size());
        return new DocumentResult(tier, scored, curves);
    }

    /**
     * Reconciles the full candidate set of a key and passes the record through QA. A record that
     * fails QA is returned with status REJECTED.
     */
    public Optional<ValidatedSpec> derive(SpecKey key, List<ScoredCandidate> candidates) {
        return validator.reconcileKey(key, candidates).map(spec -> {
            QaOutcome outcome = qa.check(spec);
            if (!outcome.isAccepted()) {
                log.info("QA rejected {}: {}", key.id(), outcome.spec().getStatusReason());
            }
            return outcome.spec();
        });
    }

    /**
     * Reconciles and checks candidates of any number of keys at once, ordered by key.
     */
    public List<ValidatedSpec> deriveAll(List<ScoredCandidate> candidates) {
        List<ValidatedSpec> out = new ArrayList<>();
        for (ValidatedSpec spec : validator.reconcile(candidates)) {
            out.add(qa.check(spec).spec());
        }
        return out;
    }

    /**
     * Merges the source curves of one machine; curves QA finds unusable are left out.
     */
    public Optional<RimpullCurve> mergeCurves(List<RimpullCurve> curves) {
        List<RimpullCurve> usable = new ArrayList<>();
        for (RimpullCurve c : curves) {
            CurveReport report = qa.checkCurve(c);
            if (report.usable()) {
                usable.add(c);
            } else {
                log.debug("Dropping curve from {}: {}", c.getSourceDocumentRef(), report.warnings());
            }
        }
        return rimpullReconciler.merge(usable);
    }

    public QaPipeline qa() {
        return qa;
    }
}
