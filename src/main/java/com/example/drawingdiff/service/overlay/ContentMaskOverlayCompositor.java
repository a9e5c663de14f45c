package com.example.drawingdiff.service.overlay;

import com.example.drawingdiff.config.DrawingDiffProperties;
import com.example.drawingdiff.model.OverlayImage;
import com.example.drawingdiff.util.MatConversions;
import org.opencv.core.Core;
import org.opencv.core.CvType;
import org.opencv.core.Mat;
import org.opencv.core.Scalar;
import org.opencv.imgproc.Imgproc;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.awt.image.BufferedImage;
import java.util.Locale;

/**
 * Classifies every pixel from two binary content masks, {@code intensity < contentThreshold} on
 * each page, and nothing else:
 *
 * <ul>
 *     <li>old only: {@link DiffClass#REMOVED}</li>
 *     <li>new only: {@link DiffClass#ADDED}</li>
 *     <li>both: {@link DiffClass#UNCHANGED}</li>
 *     <li>neither: left as {@link DiffClass#BACKGROUND}</li>
 * </ul>
 */
public class ContentMaskOverlayCompositor implements OverlayCompositor {

    private static final Logger log = LoggerFactory.getLogger(ContentMaskOverlayCompositor.class);

    private final DrawingDiffProperties.Overlay settings;

    public ContentMaskOverlayCompositor(DrawingDiffProperties.Overlay settings) {
        this.settings = settings;
    }

    @Override
    public OverlayImage composite(BufferedImage alignedOld, BufferedImage current) {
        if (alignedOld.getWidth() != current.getWidth() || alignedOld.getHeight() != current.getHeight()) {
            throw new IllegalArgumentException(String.format(Locale.ROOT,
                    "Overlay inputs differ in size: %dx%d vs %dx%d",
                    alignedOld.getWidth(), alignedOld.getHeight(), current.getWidth(), current.getHeight()));
        }
        Mat oldBgr = MatConversions.toBgrMat(alignedOld, "aligned old page");
        Mat newBgr = MatConversions.toBgrMat(current, "new page");
        Mat oldGray = new Mat();
        Mat newGray = new Mat();
        Mat oldContent = new Mat();
        Mat newContent = new Mat();
        Mat oldAbsent = new Mat();
        Mat newAbsent = new Mat();
        Mat removed = new Mat();
        Mat added = new Mat();
        Mat common = new Mat();
        Mat difference = new Mat();
        Mat overlay = new Mat(current.getHeight(), current.getWidth(), CvType.CV_8UC3, DiffClass.BACKGROUND.scalar());
        try {
            Imgproc.cvtColor(oldBgr, oldGray, Imgproc.COLOR_BGR2GRAY);
            Imgproc.cvtColor(newBgr, newGray, Imgproc.COLOR_BGR2GRAY);

            Scalar threshold = new Scalar(settings.contentThreshold());
            Core.compare(oldGray, threshold, oldContent, Core.CMP_LT);
            Core.compare(newGray, threshold, newContent, Core.CMP_LT);
            Core.bitwise_not(oldContent, oldAbsent);
            Core.bitwise_not(newContent, newAbsent);

            Core.bitwise_and(oldContent, newAbsent, removed);
            Core.bitwise_and(newContent, oldAbsent, added);
            Core.bitwise_and(oldContent, newContent, common);

            overlay.setTo(DiffClass.REMOVED.scalar(), removed);
            overlay.setTo(DiffClass.ADDED.scalar(), added);
            overlay.setTo(DiffClass.UNCHANGED.scalar(), common);

            long removedPixels = Core.countNonZero(removed);
            long addedPixels = Core.countNonZero(added);
            long unchangedPixels = Core.countNonZero(common);
            boolean changesDetected = removedPixels + addedPixels > settings.minChangedPixels();

            Core.absdiff(oldGray, newGray, difference);
            double similarity = 1.0 - Core.mean(difference).val[0] / 255.0;

            log.debug("Overlay classified {} removed, {} added, {} unchanged pixels (changes: {})",
                    removedPixels, addedPixels, unchangedPixels, changesDetected);
            return new OverlayImage(MatConversions.toBufferedImage(overlay),
                    removedPixels, addedPixels, unchangedPixels, changesDetected,
                    Math.max(0.0, Math.min(1.0, similarity)));
        } finally {
            for (Mat mat : new Mat[] {oldBgr, newBgr, oldGray, newGray, oldContent, newContent,
                    oldAbsent, newAbsent, removed, added, common, difference, overlay}) {
                mat.release();
            }
        }
    }
}
