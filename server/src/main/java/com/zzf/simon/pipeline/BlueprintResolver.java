package com.zzf.simon.pipeline;

import com.zzf.simon.session.Session;
import com.zzf.simon.store.DocumentStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

@Slf4j
@Component
@RequiredArgsConstructor
public class BlueprintResolver {
    static final String COLLECTION = "coaches";

    private final DocumentStore store;

    public CoachBlueprint resolve(Session session) {
        String coachId = session.getCoachId();
        if (coachId == null || coachId.isBlank()) {
            return CoachBlueprint.defaultBlueprint();
        }
        return store.get(COLLECTION, coachId, CoachBlueprint.class).orElseGet(() -> {
            log.info("coach.missing coach={} session={} using=default", coachId, session.getId());
            return CoachBlueprint.defaultBlueprint();
        });
    }
}
