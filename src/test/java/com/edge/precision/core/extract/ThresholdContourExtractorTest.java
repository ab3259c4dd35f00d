package com.edge.precision.core.extract;

import com.edge.precision.config.PrecisionConfig;
import com.edge.precision.core.model.BoundingBox;
import com.edge.precision.support.SyntheticImages;
import org.junit.jupiter.api.Test;
import org.opencv.core.Mat;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class ThresholdContourExtractorTest {
    private final ThresholdContourExtractor extractor = new ThresholdContourExtractor(new PrecisionConfig.ExtractionConfig());

    @Test
    void extract_darkPartOnLightBackground_returnsOuterContour() {
        Mat image = SyntheticImages.filledRect(300, 300, 100, 100, 200, 200);

        ExtractionResult result = extractor.extract(image);

        assertThat(result.isSuccess()).isTrue();
        BoundingBox box = result.getContour().getBoundingBox();
        assertThat(box.getMinX()).isCloseTo(100.0, within(2.0));
        assertThat(box.getMaxX()).isCloseTo(200.0, within(2.0));
        assertThat(box.getMinY()).isCloseTo(100.0, within(2.0));
        assertThat(box.getMaxY()).isCloseTo(200.0, within(2.0));
        assertThat(result.getArea()).isCloseTo(10000.0, within(500.0));
    }

    @Test
    void extract_blankImage_fails() {
        ExtractionResult result = extractor.extract(SyntheticImages.blank(200, 200));

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.getReason()).isIn("no_contour", "contour_too_small");
    }

    @Test
    void extract_nullImage_fails() {
        ExtractionResult result = extractor.extract(null);

        assertThat(result.getReason()).isEqualTo("empty_image");
    }

    @Test
    void extract_specks_areTooSmall() {
        Mat image = SyntheticImages.filledRect(400, 400, 10, 10, 12, 12);

        ExtractionResult result = extractor.extract(image);

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.getReason()).isEqualTo("contour_too_small");
    }
}
