package com.pocketplan.forecast.preview;

import com.pocketplan.forecast.config.PocketplanProperties;
import com.pocketplan.forecast.model.AmountPattern;
import com.pocketplan.forecast.model.DateWindow;
import com.pocketplan.forecast.model.Occurrence;
import com.pocketplan.forecast.occurrence.OccurrenceGenerator;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Windowed occurrence timeline for patterns that may not be saved yet. Goes through the same generator
 * as the forecast.
 */
@Service
public class TimelinePreviewService {

    private static final Logger log = LoggerFactory.getLogger(TimelinePreviewService.class);

    private final OccurrenceGenerator occurrenceGenerator;
    private final PocketplanProperties properties;

    public TimelinePreviewService(OccurrenceGenerator occurrenceGenerator, PocketplanProperties properties) {
        this.occurrenceGenerator = occurrenceGenerator;
        this.properties = properties;
    }

    public List<Occurrence> preview(List<AmountPattern> patterns, DateWindow window) {
        int maxRangeDays = properties.preview().maxRangeDays();
        if (window.lengthInDays() > maxRangeDays) {
            throw new IllegalArgumentException("preview window cannot exceed " + maxRangeDays + " days");
        }
        List<Occurrence> occurrences = occurrenceGenerator.generateAll(patterns, window);
        log.debug("Preview: {} patterns expanded to {} occurrences in {}..{}",
                patterns.size(), occurrences.size(), window.from(), window.to());
        return occurrences;
    }
}
