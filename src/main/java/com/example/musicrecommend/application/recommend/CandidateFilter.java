package com.example.musicrecommend.application.recommend;

import com.example.musicrecommend.domain.EmptyReason;
import com.example.musicrecommend.domain.model.ExclusionSet;
import com.example.musicrecommend.domain.model.Outcome;
import com.example.musicrecommend.domain.model.Track;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import org.springframework.stereotype.Component;

@Component
public class CandidateFilter {

    /**
     * Drops excluded tracks, the current track and repeated ids from the catalog.
     *
     * @param currentTrackId track playing now, or {@code null} outside contextual mode
     */
    public Outcome<List<Track>> filter(List<Track> catalog, ExclusionSet exclusions, Long currentTrackId) {
        if (catalog == null || catalog.isEmpty()) {
            return Outcome.empty(EmptyReason.NO_CANDIDATES, "catalog is empty");
        }
        ExclusionSet safeExclusions = exclusions == null ? ExclusionSet.empty() : exclusions;
        Set<Long> seen = new HashSet<>();
        List<Track> candidates = new ArrayList<>(catalog.size());
        for (Track track : catalog) {
            if (track == null) {
                continue;
            }
            Long id = track.getId();
            if (safeExclusions.contains(id) || id.equals(currentTrackId) || !seen.add(id)) {
                continue;
            }
            candidates.add(track);
        }
        if (candidates.isEmpty()) {
            return Outcome.empty(EmptyReason.NO_CANDIDATES,
                    "all " + catalog.size() + " catalog tracks excluded");
        }
        return Outcome.of(candidates);
    }
}
