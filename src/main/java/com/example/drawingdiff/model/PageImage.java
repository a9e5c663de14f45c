package com.example.drawingdiff.model;

import java.awt.Graphics2D;
import java.awt.image.BufferedImage;
import java.util.Locale;
import java.util.Objects;

/**
 * One rasterized drawing page as delivered by the rasterization collaborator. The expected pixel
 * encoding is {@link BufferedImage#TYPE_3BYTE_BGR}; use {@link #of} to convert other rasters. The
 * raster is never written to by the comparison pipeline.
 *
 * @param raster     decoded page pixels
 * @param identifier sheet identifier extracted upstream, may be {@code null} or blank
 * @param revision   side of the comparison
 * @param pageIndex  zero-based position inside the source document
 */
public record PageImage(BufferedImage raster, String identifier, Revision revision, int pageIndex) {

    public static final int PIXEL_ENCODING = BufferedImage.TYPE_3BYTE_BGR;

    public PageImage {
        Objects.requireNonNull(raster, "raster");
        Objects.requireNonNull(revision, "revision");
        if (pageIndex < 0) {
            throw new IllegalArgumentException("Page index must not be negative");
        }
    }

    public static PageImage of(BufferedImage source, String identifier, Revision revision, int pageIndex) {
        Objects.requireNonNull(source, "source");
        if (source.getType() == PIXEL_ENCODING) {
            return new PageImage(source, identifier, revision, pageIndex);
        }
        BufferedImage converted = new BufferedImage(source.getWidth(), source.getHeight(), PIXEL_ENCODING);
        Graphics2D graphics = converted.createGraphics();
        try {
            graphics.drawImage(source, 0, 0, null);
        } finally {
            graphics.dispose();
        }
        return new PageImage(converted, identifier, revision, pageIndex);
    }

    public int width() {
        return raster.getWidth();
    }

    public int height() {
        return raster.getHeight();
    }

    public boolean hasIdentifier() {
        return identifier != null && !identifier.isBlank();
    }

    /**
     * Label used in log lines and outcome details.
     */
    public String describe() {
        String label = hasIdentifier() ? identifier.trim() : "<unidentified>";
        return String.format(Locale.ROOT, "%s page %d (%s)", revision.name().toLowerCase(Locale.ROOT), pageIndex, label);
    }
}
