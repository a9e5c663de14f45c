package com.example.drawingdiff.model;

import org.junit.jupiter.api.Test;

import java.awt.image.BufferedImage;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PageImageTest {

    @Test
    void shouldConvertForeignEncodingToBgr() {
        BufferedImage argb = new BufferedImage(20, 10, BufferedImage.TYPE_INT_ARGB);

        PageImage page = PageImage.of(argb, "A-101", Revision.OLD, 2);

        assertThat(page.raster().getType()).isEqualTo(BufferedImage.TYPE_3BYTE_BGR);
        assertThat(page.width()).isEqualTo(20);
        assertThat(page.height()).isEqualTo(10);
    }

    @Test
    void shouldDescribePageForLogs() {
        BufferedImage raster = new BufferedImage(1, 1, PageImage.PIXEL_ENCODING);

        assertThat(new PageImage(raster, " A-101 ", Revision.NEW, 3).describe()).isEqualTo("new page 3 (A-101)");
        assertThat(new PageImage(raster, "  ", Revision.OLD, 0).describe()).isEqualTo("old page 0 (<unidentified>)");
    }

    @Test
    void shouldRejectMixedRevisionsInPair() {
        BufferedImage raster = new BufferedImage(1, 1, PageImage.PIXEL_ENCODING);
        PageImage first = new PageImage(raster, "A-1", Revision.OLD, 0);
        PageImage second = new PageImage(raster, "A-1", Revision.OLD, 1);

        assertThatThrownBy(() -> new DrawingPair("A-1", first, second))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
