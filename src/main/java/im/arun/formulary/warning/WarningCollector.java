package im.arun.formulary.warning;

import im.arun.formulary.model.ExtractionWarning;
import im.arun.formulary.model.WarningReason;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Append-only record of every line that could not be placed in the hierarchy.
 */
public class WarningCollector {
    private static final Logger logger = LoggerFactory.getLogger(WarningCollector.class);

    private final List<ExtractionWarning> warnings = new ArrayList<>();

    public ExtractionWarning record(int pageNumber, String rawText, WarningReason reason, String context) {
        ExtractionWarning warning = new ExtractionWarning(pageNumber, rawText, reason, context);
        warnings.add(warning);
        logger.debug("Page {}: {} '{}'", pageNumber, reason.getCode(), rawText);
        return warning;
    }

    public List<ExtractionWarning> getWarnings() {
        return Collections.unmodifiableList(warnings);
    }

    public long count(WarningReason reason) {
        return warnings.stream().filter(warning -> warning.getReason() == reason).count();
    }

    public int size() {
        return warnings.size();
    }
}
