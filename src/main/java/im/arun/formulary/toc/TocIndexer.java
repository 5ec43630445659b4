package im.arun.formulary.toc;

import im.arun.formulary.classify.ClassifiedLine;
import im.arun.formulary.model.LineRole;
import im.arun.formulary.model.TocEntry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Collects the printed table of contents in document order, independent of the category tree.
 * Entries are not deduplicated; indexes legitimately list a label more than once.
 */
public class TocIndexer {
    private static final Logger logger = LoggerFactory.getLogger(TocIndexer.class);

    private final List<TocEntry> entries = new ArrayList<>();

    /**
     * @return true when the line was added to the index
     */
    public boolean accept(ClassifiedLine line) {
        if (line.getRole() != LineRole.TOC_ENTRY) {
            return false;
        }
        Optional<TocEntry> entry = TocLineParser.parse(line.getText());
        if (entry.isEmpty()) {
            logger.debug("Skipping TOC line without page reference on page {}: {}", line.getPageNumber(), line.getText());
            return false;
        }
        entries.add(entry.get());
        return true;
    }

    public List<TocEntry> getEntries() {
        return Collections.unmodifiableList(entries);
    }
}
