package im.arun.formulary.warning;

import im.arun.formulary.model.ExtractionWarning;
import im.arun.formulary.model.WarningReason;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class WarningCollectorTest {

    @Test
    void recordsWarningsInOrderAndCountsByReason() {
        WarningCollector collector = new WarningCollector();

        collector.record(3, "Amoxicillin 1", WarningReason.ROW_BEFORE_SUBCATEGORY, "ANTIBIOTICS");
        collector.record(4, "A B C D", WarningReason.MALFORMED_ROW, null);
        collector.record(5, "Ampicillin 2", WarningReason.ROW_BEFORE_SUBCATEGORY, null);

        assertThat(collector.size()).isEqualTo(3);
        assertThat(collector.count(WarningReason.ROW_BEFORE_SUBCATEGORY)).isEqualTo(2);
        assertThat(collector.getWarnings()).extracting(ExtractionWarning::getPageNumber).containsExactly(3, 4, 5);
        assertThat(collector.getWarnings().get(0).getContext()).isEqualTo("ANTIBIOTICS");
    }

    @Test
    void exposesReadOnlyView() {
        WarningCollector collector = new WarningCollector();
        collector.record(1, "x", WarningReason.MALFORMED_ROW, null);

        assertThatThrownBy(() -> collector.getWarnings().clear()).isInstanceOf(UnsupportedOperationException.class);
    }
}
