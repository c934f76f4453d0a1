package com.helmsman.core.engine;

import com.helmsman.core.advice.DetailsWriter;
import com.helmsman.core.advice.RecommendationGenerator;
import com.helmsman.core.advice.RiskAssessor;
import com.helmsman.core.catalog.PatternCatalog;
import com.helmsman.core.classify.DocumentClassifier;
import com.helmsman.core.classify.DocumentTypeDetector;
import com.helmsman.core.classify.PriorityResolver;
import com.helmsman.core.config.ProcessingProperties;
import com.helmsman.core.extract.EntityExtractor;
import com.helmsman.core.extract.KeywordExtractor;
import com.helmsman.core.extract.Summarizer;
import com.helmsman.core.logging.MdcContext;
import com.helmsman.core.model.Classification;
import com.helmsman.core.model.ClassificationCategory;
import com.helmsman.core.model.DocumentType;
import com.helmsman.core.model.PriorityLevel;
import com.helmsman.core.model.ProcessingResult;
import com.helmsman.core.text.TextPreprocessor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Runs one document through the full analysis pipeline and assembles the
 * {@link ProcessingResult}.
 * <p>
 * Ordinary input never fails: weak or noisy text degrades to a low-confidence
 * routine maintenance result. Summary and keyword steps fall back to plain
 * truncation and word lists when they fail; such steps are listed under the
 * {@value #META_DEGRADED_STEPS} metadata key. Any other unexpected failure
 * yields the error result described by {@link #errorResult(String, String, String)}.
 */
@Service
public class DocumentProcessor {

    private static final Logger log = LoggerFactory.getLogger(DocumentProcessor.class);

    public static final String META_ORIGINAL_LENGTH = "original_length";
    public static final String META_PROCESSED_LENGTH = "processed_length";
    public static final String META_PROCESSING_VERSION = "processing_version";
    public static final String META_CATALOG_VERSION = "catalog_version";
    public static final String META_DEGRADED_STEPS = "degraded_steps";
    public static final String META_ERROR = "error";

    static final String ERROR_SUMMARY = "Error processing document";
    static final String ERROR_RISK = "Unable to assess risk due to processing error";
    static final List<String> ERROR_ACTIONS = List.of("Review document manually", "Check system logs");

    private final TextPreprocessor preprocessor;
    private final DocumentClassifier classifier;
    private final PriorityResolver priorityResolver;
    private final DocumentTypeDetector documentTypeDetector;
    private final EntityExtractor entityExtractor;
    private final KeywordExtractor keywordExtractor;
    private final Summarizer summarizer;
    private final RecommendationGenerator recommendationGenerator;
    private final RiskAssessor riskAssessor;
    private final DetailsWriter detailsWriter;
    private final PatternCatalog catalog;
    private final ProcessingProperties properties;
    private final IdGenerator idGenerator;
    private final Clock clock;

    public DocumentProcessor(TextPreprocessor preprocessor,
                             DocumentClassifier classifier,
                             PriorityResolver priorityResolver,
                             DocumentTypeDetector documentTypeDetector,
                             EntityExtractor entityExtractor,
                             KeywordExtractor keywordExtractor,
                             Summarizer summarizer,
                             RecommendationGenerator recommendationGenerator,
                             RiskAssessor riskAssessor,
                             DetailsWriter detailsWriter,
                             PatternCatalog catalog,
                             ProcessingProperties properties,
                             IdGenerator idGenerator,
                             Clock clock) {
        this.preprocessor = preprocessor;
        this.classifier = classifier;
        this.priorityResolver = priorityResolver;
        this.documentTypeDetector = documentTypeDetector;
        this.entityExtractor = entityExtractor;
        this.keywordExtractor = keywordExtractor;
        this.summarizer = summarizer;
        this.recommendationGenerator = recommendationGenerator;
        this.riskAssessor = riskAssessor;
        this.detailsWriter = detailsWriter;
        this.catalog = catalog;
        this.properties = properties;
        this.idGenerator = idGenerator;
        this.clock = clock;
    }

    public ProcessingResult process(String text) {
        return process(text, null, null);
    }

    /**
     * Analyzes one document.
     *
     * @param text             raw document text, already validated by the caller
     * @param documentTypeHint caller-supplied type hint, inferred from the text when null or unknown
     * @param vesselId         vessel identifier passed through to the result, may be null
     * @return the assembled result, never null. Log lines written meanwhile
     *         carry the document and vessel MDC keys, which are removed on return.
     * @throws NullPointerException if {@code text} is null
     */
    public ProcessingResult process(String text, String documentTypeHint, String vesselId) {
        Objects.requireNonNull(text, "text");
        String id = idGenerator.nextId();
        MdcContext.setDocument(id, vesselId);
        try {
            return analyze(id, text, documentTypeHint, vesselId);
        } catch (RuntimeException e) {
            log.error("Processing of document {} failed", id, e);
            return errorResult(id, e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName(), vesselId);
        } finally {
            MdcContext.clear();
        }
    }

    private ProcessingResult analyze(String id, String text, String documentTypeHint, String vesselId) {
        log.debug("Processing document {} of length {}", id, text.length());

        String cleaned = preprocessor.normalize(text);

        Classification classification = classifier.classify(cleaned);
        ClassificationCategory category = classification.category();

        int maxLength = properties.getSummaryMaxLength();
        StepOutcome<String> summary = StepOutcome.attempt("summary",
                () -> summarizer.summarize(cleaned, maxLength),
                () -> Summarizer.truncate(cleaned, maxLength));
        var entities = entityExtractor.extract(cleaned);
        StepOutcome<List<String>> keywords = StepOutcome.attempt("keywords",
                () -> keywordExtractor.extract(cleaned),
                () -> keywordExtractor.fallback(cleaned));

        PriorityLevel priority = priorityResolver.resolve(cleaned, category);
        List<String> actions = recommendationGenerator.recommend(category, priority);
        String risk = riskAssessor.assess(category, priority, cleaned);
        String details = detailsWriter.write(category, priority, cleaned);
        DocumentType documentType = documentTypeDetector.resolve(documentTypeHint, cleaned);

        var metadata = new LinkedHashMap<String, Object>();
        metadata.put(META_ORIGINAL_LENGTH, text.length());
        metadata.put(META_PROCESSED_LENGTH, cleaned.length());
        metadata.put(META_PROCESSING_VERSION, properties.getProcessingVersion());
        metadata.put(META_CATALOG_VERSION, catalog.version());
        List<String> degradedSteps = new ArrayList<>();
        if (summary.degraded()) {
            degradedSteps.add("summary");
        }
        if (keywords.degraded()) {
            degradedSteps.add("keywords");
        }
        if (!degradedSteps.isEmpty()) {
            metadata.put(META_DEGRADED_STEPS, List.copyOf(degradedSteps));
        }

        var result = new ProcessingResult(
                id,
                summary.value(),
                details,
                category,
                priority,
                classification.confidence(),
                new LinkedHashSet<>(keywords.value()),
                entities,
                actions,
                risk,
                documentType,
                vesselId,
                Instant.now(clock),
                metadata);

        log.info("Document {} processed: {} / {} (confidence {})",
                id, category, priority, String.format("%.2f", classification.confidence()));
        return result;
    }

    /**
     * Result returned when the pipeline fails outright.
     */
    ProcessingResult errorResult(String id, String errorMessage, String vesselId) {
        return new ProcessingResult(
                id,
                ERROR_SUMMARY,
                "An error occurred during processing: " + errorMessage,
                DocumentClassifier.FALLBACK_CATEGORY,
                PriorityLevel.LOW,
                0.0,
                new LinkedHashSet<>(),
                Map.of(),
                ERROR_ACTIONS,
                ERROR_RISK,
                null,
                vesselId,
                Instant.now(clock),
                Map.of(META_ERROR, errorMessage));
    }
}
