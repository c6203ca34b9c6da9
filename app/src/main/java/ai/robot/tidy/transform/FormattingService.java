package ai.robot.tidy.transform;

import ai.robot.tidy.config.FormattingContext;
import ai.robot.tidy.model.Document;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs one pipeline over a batch of documents. A failing document is reported and the batch continues.
 */
public class FormattingService {

    private static final Logger LOGGER = LoggerFactory.getLogger(FormattingService.class);

    private final FormattingPipeline pipeline;
    private final FormattingContext context;

    public FormattingService(FormattingPipeline pipeline, FormattingContext context) {
        this.pipeline = Objects.requireNonNull(pipeline, "pipeline");
        this.context = Objects.requireNonNull(context, "context");
    }

    public FormattingOutcome formatAll(List<Document> documents) {
        if (documents == null || documents.isEmpty()) {
            return new FormattingOutcome(List.of(), List.of());
        }
        List<FormattingResult> results = new ArrayList<>();
        List<String> failed = new ArrayList<>();
        for (Document document : documents) {
            try {
                FormattingResult result = pipeline.format(document, context);
                if (result.changed()) {
                    LOGGER.info("Reformatted {}", result.source());
                }
                results.add(result);
            } catch (FormattingException ex) {
                LOGGER.error("Formatting failed for {}: {}", document.source(), ex.getMessage(), ex);
                failed.add(document.source());
            }
        }
        LOGGER.info("{} documents processed, {} changed, {} failed",
                documents.size(), results.stream().filter(FormattingResult::changed).count(), failed.size());
        return new FormattingOutcome(results, failed);
    }
}
