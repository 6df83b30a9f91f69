package io.interviews.core.interview;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/// In-memory interview repository (default implementation).
///
/// Stores the live {@link Interview} objects; callers serialize mutations per interview.
///
/// @implNote Uses ConcurrentHashMap for thread-safety.
public final class InMemoryInterviewRepository implements InterviewRepository {

    private final Map<String, Interview> storage = new ConcurrentHashMap<>();

    @Override
    public void save(Interview interview) {
        Objects.requireNonNull(interview, "interview must not be null");
        storage.put(interview.getId(), interview);
    }

    @Override
    public Optional<Interview> findById(String id) {
        Objects.requireNonNull(id, "id must not be null");
        return Optional.ofNullable(storage.get(id));
    }

    @Override
    public List<Interview> findByCampaign(String campaignId) {
        Objects.requireNonNull(campaignId, "campaignId must not be null");
        return storage.values().stream()
                .filter(i -> i.getCampaignId().equals(campaignId))
                .toList();
    }

    @Override
    public boolean delete(String id) {
        Objects.requireNonNull(id, "id must not be null");
        return storage.remove(id) != null;
    }

    /// Clears all data (useful for testing).
    public void clear() {
        storage.clear();
    }
}
