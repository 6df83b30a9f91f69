package io.interviews.core.campaign;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/// In-memory campaign repository (default implementation).
///
/// @implNote Uses ConcurrentHashMap for thread-safety.
public final class InMemoryCampaignRepository implements CampaignRepository {

    private final Map<String, Campaign> storage = new ConcurrentHashMap<>();

    @Override
    public void save(Campaign campaign) {
        Objects.requireNonNull(campaign, "campaign must not be null");
        storage.put(campaign.id(), campaign);
    }

    @Override
    public Optional<Campaign> findById(String id) {
        Objects.requireNonNull(id, "id must not be null");
        return Optional.ofNullable(storage.get(id));
    }

    @Override
    public List<Campaign> findByQuestionnaire(String questionnaireId) {
        Objects.requireNonNull(questionnaireId, "questionnaireId must not be null");
        return storage.values().stream()
                .filter(c -> c.questionnaireId().equals(questionnaireId))
                .toList();
    }
}
