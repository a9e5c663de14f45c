package com.example.drawingdiff.service.matching;

import com.example.drawingdiff.model.ComparisonBatch;
import com.example.drawingdiff.model.DrawingPair;
import com.example.drawingdiff.model.PageImage;
import com.example.drawingdiff.model.Revision;
import com.example.drawingdiff.util.IdentifierNormalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Pairs old and new pages by identifier through a hash index over the new pages. Pages without an
 * identifier are listed as unidentified and never paired. When one side repeats an identifier, the
 * first page carrying it is paired and the later ones are reported as unmatched, so an identifier
 * never ends up in two pairs.
 */
@Component
public class DrawingMatcher {

    private static final Logger log = LoggerFactory.getLogger(DrawingMatcher.class);

    public ComparisonBatch match(List<PageImage> oldPages, List<PageImage> newPages) {
        List<PageImage> unidentifiedOld = new ArrayList<>();
        List<PageImage> unidentifiedNew = new ArrayList<>();
        List<String> unmatchedNew = new ArrayList<>();

        Map<String, PageImage> newIndex = new HashMap<>();
        for (PageImage page : newPages) {
            requireRevision(page, Revision.NEW);
            String key = IdentifierNormalizer.normalize(page.identifier());
            if (key == null) {
                unidentifiedNew.add(page);
            } else if (newIndex.putIfAbsent(key, page) != null) {
                log.warn("Duplicate identifier '{}' on {}, only the first new page is paired", key, page.describe());
            }
        }

        List<DrawingPair> pairs = new ArrayList<>();
        List<String> unmatchedOld = new ArrayList<>();
        Set<String> paired = new HashSet<>();
        for (PageImage page : oldPages) {
            requireRevision(page, Revision.OLD);
            String key = IdentifierNormalizer.normalize(page.identifier());
            if (key == null) {
                unidentifiedOld.add(page);
                continue;
            }
            PageImage counterpart = newIndex.get(key);
            if (counterpart != null && paired.add(key)) {
                pairs.add(new DrawingPair(key, page, counterpart));
            } else {
                if (counterpart != null) {
                    log.warn("Duplicate identifier '{}' on {}, only the first old page is paired", key, page.describe());
                }
                unmatchedOld.add(page.identifier().strip());
            }
        }

        for (PageImage page : newPages) {
            String key = IdentifierNormalizer.normalize(page.identifier());
            if (key != null && (newIndex.get(key) != page || !paired.contains(key))) {
                unmatchedNew.add(page.identifier().strip());
            }
        }

        log.info("Paired {} drawings; {} only in old, {} only in new, {} old and {} new pages unidentified",
                pairs.size(), unmatchedOld.size(), unmatchedNew.size(), unidentifiedOld.size(), unidentifiedNew.size());
        return new ComparisonBatch(pairs, unmatchedOld, unmatchedNew, unidentifiedOld, unidentifiedNew);
    }

    private static void requireRevision(PageImage page, Revision expected) {
        if (page.revision() != expected) {
            throw new IllegalArgumentException(page.describe() + " was passed as a " + expected.name().toLowerCase(Locale.ROOT) + " page");
        }
    }
}
