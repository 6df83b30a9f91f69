package io.interviews.core.interview;

import java.util.List;
import java.util.Optional;

/// Storage for interviews.
///
/// @see InMemoryInterviewRepository for the default implementation
public interface InterviewRepository {

    /// Saves an interview, replacing any with the same id.
    ///
    /// @param interview the interview, not null
    void save(Interview interview);

    /// Finds an interview by id.
    ///
    /// @param id interview id, not null
    /// @return the interview if found, empty otherwise
    Optional<Interview> findById(String id);

    /// Lists the interviews of a campaign.
    ///
    /// @param campaignId campaign id, not null
    /// @return list, never null (may be empty)
    List<Interview> findByCampaign(String campaignId);

    /// Deletes an interview.
    ///
    /// @param id interview id, not null
    /// @return true if it existed
    boolean delete(String id);
}
