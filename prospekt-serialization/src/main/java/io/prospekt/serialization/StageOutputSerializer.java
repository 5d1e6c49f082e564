package io.prospekt.serialization;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import io.prospekt.core.stage.StageOutput;
import io.prospekt.core.stage.StageOutput.CompanyProfile;
import io.prospekt.core.stage.StageOutput.ContactRoster;
import io.prospekt.core.stage.StageOutput.MarketAnalysis;
import io.prospekt.core.stage.StageOutput.OutreachDrafts;
import java.io.IOException;
import java.io.Serial;

/// Serializes the `StageOutput` sealed hierarchy with a `"type"` discriminator field
/// holding the id of the producing stage.
///
/// Emitted JSON shape per subtype:
/// - **`CompanyProfile`**: `{"type":"research","companyName":"...","overview":"...",
///   "industry":"...","website":"...","keyFacts":[...],"recentNews":[...],"sources":[...]}`
/// - **`MarketAnalysis`**: `{"type":"analysis","analysis":"...","keyChallenges":[...],
///   "opportunities":[...],"recommendedApproach":"..."}`
/// - **`ContactRoster`**: `{"type":"contact-discovery","totalFound":n,"contacts":[...]}`
/// - **`OutreachDrafts`**: `{"type":"outreach","emails":[...]}`
///
/// Nested records (`NewsItem`, `SearchHit`, `Contact`, `EmailDraft`) use Jackson's
/// default record handling.
///
/// @implNote Package-private. Registered by {@link ProspektJacksonModule}.
/// @see StageOutputDeserializer for the inverse operation
class StageOutputSerializer extends StdSerializer<StageOutput> {

    @Serial private static final long serialVersionUID = -7361062593404877412L;

    StageOutputSerializer() {
        super(StageOutput.class);
    }

    /// Writes the output to JSON, selecting fields by the concrete subtype.
    ///
    /// @param output the output to serialize, not null
    /// @param gen the JSON generator, not null
    /// @param provider the serializer provider, not null
    /// @throws IOException if the generator encounters a write error
    @Override
    public void serialize(StageOutput output, JsonGenerator gen, SerializerProvider provider)
            throws IOException {
        gen.writeStartObject();
        gen.writeStringField("type", output.stage().id());

        if (output instanceof CompanyProfile profile) {
            gen.writeStringField("companyName", profile.companyName());
            gen.writeStringField("overview", profile.overview());
            gen.writeStringField("industry", profile.industry());
            gen.writeStringField("website", profile.website());
            provider.defaultSerializeField("keyFacts", profile.keyFacts(), gen);
            provider.defaultSerializeField("recentNews", profile.recentNews(), gen);
            provider.defaultSerializeField("sources", profile.sources(), gen);
        } else if (output instanceof MarketAnalysis analysis) {
            gen.writeStringField("analysis", analysis.analysis());
            provider.defaultSerializeField("keyChallenges", analysis.keyChallenges(), gen);
            provider.defaultSerializeField("opportunities", analysis.opportunities(), gen);
            gen.writeStringField("recommendedApproach", analysis.recommendedApproach());
        } else if (output instanceof ContactRoster roster) {
            gen.writeNumberField("totalFound", roster.totalFound());
            provider.defaultSerializeField("contacts", roster.contacts(), gen);
        } else if (output instanceof OutreachDrafts drafts) {
            provider.defaultSerializeField("emails", drafts.emails(), gen);
        }

        gen.writeEndObject();
    }
}
