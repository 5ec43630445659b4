package im.arun.formulary.classify;

import lombok.Value;

import java.util.List;

/**
 * Classified lines of one page, in reading order.
 */
@Value
public class PageClassification {
    int pageNumber;
    boolean tocPage;
    List<ClassifiedLine> lines;
}
