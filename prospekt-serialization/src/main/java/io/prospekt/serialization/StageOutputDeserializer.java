package io.prospekt.serialization;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;
import io.prospekt.core.provider.SearchHit;
import io.prospekt.core.stage.Contact;
import io.prospekt.core.stage.EmailDraft;
import io.prospekt.core.stage.NewsItem;
import io.prospekt.core.stage.StageName;
import io.prospekt.core.stage.StageOutput;
import io.prospekt.core.stage.StageOutput.CompanyProfile;
import io.prospekt.core.stage.StageOutput.ContactRoster;
import io.prospekt.core.stage.StageOutput.MarketAnalysis;
import io.prospekt.core.stage.StageOutput.OutreachDrafts;
import java.io.IOException;
import java.io.Serial;
import java.util.List;

/// Deserializes the `StageOutput` sealed hierarchy using the `"type"` discriminator.
///
/// Each variant is constructed directly from `JsonNode` values; nested lists are
/// converted with `convertValue`. Missing text fields become empty strings and missing
/// lists become empty lists, matching the record constructors.
///
/// @implNote Package-private. Registered by {@link ProspektJacksonModule}.
/// @see StageOutputSerializer for the inverse operation
class StageOutputDeserializer extends StdDeserializer<StageOutput> {

    @Serial private static final long serialVersionUID = 5504918338104125077L;

    StageOutputDeserializer() {
        super(StageOutput.class);
    }

    /// Reads the `"type"` field and dispatches to the matching variant constructor.
    ///
    /// @param p the JSON parser positioned at the start of the output object, not null
    /// @param ctx the deserialization context, not null
    /// @return the deserialized output, never null
    /// @throws IOException if the type is absent or unknown
    @Override
    public StageOutput deserialize(JsonParser p, DeserializationContext ctx) throws IOException {
        ObjectMapper mapper = (ObjectMapper) p.getCodec();
        JsonNode root = mapper.readTree(p);

        JsonNode typeNode = root.get("type");
        if (typeNode == null) {
            throw new IOException("StageOutput is missing its 'type' field");
        }
        StageName stage;
        try {
            stage = StageName.fromId(typeNode.asText());
        } catch (IllegalArgumentException e) {
            throw new IOException("Unknown StageOutput type: " + typeNode.asText(), e);
        }

        return switch (stage) {
            case RESEARCH ->
                    new CompanyProfile(
                            text(root, "companyName"),
                            text(root, "overview"),
                            text(root, "industry"),
                            text(root, "website"),
                            list(mapper, root, "keyFacts", new TypeReference<List<String>>() {}),
                            list(mapper, root, "recentNews", new TypeReference<List<NewsItem>>() {}),
                            list(mapper, root, "sources", new TypeReference<List<SearchHit>>() {}));
            case ANALYSIS ->
                    new MarketAnalysis(
                            text(root, "analysis"),
                            list(mapper, root, "keyChallenges", new TypeReference<List<String>>() {}),
                            list(mapper, root, "opportunities", new TypeReference<List<String>>() {}),
                            text(root, "recommendedApproach"));
            case CONTACT_DISCOVERY ->
                    new ContactRoster(
                            root.path("totalFound").asInt(),
                            list(mapper, root, "contacts", new TypeReference<List<Contact>>() {}));
            case OUTREACH ->
                    new OutreachDrafts(
                            list(mapper, root, "emails", new TypeReference<List<EmailDraft>>() {}));
        };
    }

    private static String text(JsonNode root, String field) {
        JsonNode node = root.get(field);
        return node == null || node.isNull() ? "" : node.asText();
    }

    private static <T> List<T> list(
            ObjectMapper mapper, JsonNode root, String field, TypeReference<List<T>> type) {
        JsonNode node = root.get(field);
        if (node == null || node.isNull()) {
            return List.of();
        }
        return mapper.convertValue(node, type);
    }
}
