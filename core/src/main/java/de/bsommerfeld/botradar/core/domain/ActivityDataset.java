package de.bsommerfeld.botradar.core.domain;

import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * One analysis run's worth of activity data, as delivered by an ingestion
 * collaborator. Any component may be empty; {@code null} components are
 * normalized to empty collections.
 *
 * @param timelines   account id to raw post timestamps, unsorted
 * @param posts       flat batch of post texts
 * @param connections account id to the ids it is connected to
 */
public record ActivityDataset(
        Map<String, List<String>> timelines,
        List<String> posts,
        Map<String, List<String>> connections) {

    public ActivityDataset {
        timelines = timelines != null ? timelines : Collections.emptyMap();
        posts = posts != null ? posts : Collections.emptyList();
        connections = connections != null ? connections : Collections.emptyMap();
    }

    public static ActivityDataset empty() {
        return new ActivityDataset(null, null, null);
    }
}
