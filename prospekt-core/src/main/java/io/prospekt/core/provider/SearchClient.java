package io.prospekt.core.provider;

import java.util.List;

/// Web search collaborator consumed by the research and contact discovery stages.
///
/// @see io.prospekt.core.provider.simulated.SimulatedSearchClient
public interface SearchClient {

    /// Runs a search query.
    ///
    /// @param query free-text query, not null
    /// @return hits in relevance order, never null, possibly empty
    /// @throws ProviderException if the search backend fails; the kind tells callers
    /// whether a retry can help
    List<SearchHit> search(String query);
}
