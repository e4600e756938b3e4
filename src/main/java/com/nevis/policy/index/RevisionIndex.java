package com.nevis.policy.index;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-process cache of per-document timelines. Derived data: everything here can be rebuilt from
 * the revision table.
 *
 * <p>Timelines are versioned by the document's {@code timeline_version}. A publication older than
 * the held timeline is dropped, so out-of-order after-commit callbacks cannot roll a document back.
 * Assumes a single service instance; a second instance would not see this one's publications.</p>
 */
@Slf4j
@Component
public class RevisionIndex {

    private final ConcurrentHashMap<String, RevisionTimeline> timelines = new ConcurrentHashMap<>();

    public Optional<RevisionTimeline> find(String source) {
        return Optional.ofNullable(timelines.get(source));
    }

    public void publish(RevisionTimeline timeline) {
        timelines.merge(timeline.source(), timeline, (held, offered) -> {
            if (offered.version() < held.version()) {
                log.debug("Dropping stale timeline for {}: v{} < v{}", offered.source(), offered.version(), held.version());
                return held;
            }
            return offered;
        });
    }

    public void clear() {
        timelines.clear();
    }
}
