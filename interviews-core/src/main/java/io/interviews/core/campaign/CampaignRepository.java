package io.interviews.core.campaign;

import java.util.List;
import java.util.Optional;

/// Storage for campaigns.
///
/// @see InMemoryCampaignRepository for the default implementation
public interface CampaignRepository {

    /// Saves a campaign, replacing any with the same id.
    ///
    /// @param campaign the campaign, not null
    void save(Campaign campaign);

    /// Finds a campaign by id.
    ///
    /// @param id campaign id, not null
    /// @return the campaign if found, empty otherwise
    Optional<Campaign> findById(String id);

    /// Lists the campaigns of a questionnaire.
    ///
    /// @param questionnaireId questionnaire id, not null
    /// @return list, never null (may be empty)
    List<Campaign> findByQuestionnaire(String questionnaireId);
}
