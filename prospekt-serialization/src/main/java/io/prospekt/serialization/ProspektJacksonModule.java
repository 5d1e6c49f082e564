package io.prospekt.serialization;

import com.fasterxml.jackson.databind.module.SimpleModule;
import io.prospekt.core.cache.CacheEntry;
import io.prospekt.core.report.Report;
import io.prospekt.core.stage.StageName;
import io.prospekt.core.stage.StageOutput;
import io.prospekt.core.subject.Subject;
import io.prospekt.serialization.mixin.CacheEntryMixin;
import io.prospekt.serialization.mixin.ReportMixin;
import io.prospekt.serialization.mixin.SubjectMixin;
import java.io.Serial;

/// Jackson `SimpleModule` that registers all Prospekt serialization configuration in one
/// place.
///
/// **Custom serializer/deserializer pairs**:
/// - `StageOutput` - `StageOutputSerializer` / `StageOutputDeserializer`, discriminator:
///   `"type"` holding the producing stage id
/// - `StageName` - written as its id (`"contact-discovery"`), both as a value and as a
///   map key
///
/// **Mixins** (records bound through their canonical constructors):
/// - `Report` - stable property order, unknown properties ignored
/// - `Subject` - only `key` and `displayName` are written
/// - `CacheEntry` - stable property order
///
/// @implNote All registrations are explicit; no classpath scanning.
/// @see ReportSerializer for the convenience factory API
public class ProspektJacksonModule extends SimpleModule {

    @Serial private static final long serialVersionUID = 3318794465104470192L;

    public ProspektJacksonModule() {
        super("ProspektJacksonModule");

        addSerializer(StageOutput.class, new StageOutputSerializer());
        addDeserializer(StageOutput.class, new StageOutputDeserializer());

        addSerializer(StageName.class, new StageNameSerializer());
        addDeserializer(StageName.class, new StageNameDeserializer());
        addKeySerializer(StageName.class, new StageNameSerializer.Key());
        addKeyDeserializer(StageName.class, new StageNameDeserializer.Key());
    }

    /// Applies mixin annotations to the record types written to disk.
    ///
    /// @param context the setup context provided by Jackson, not null
    @Override
    public void setupModule(SetupContext context) {
        super.setupModule(context);

        context.setMixInAnnotations(Report.class, ReportMixin.class);
        context.setMixInAnnotations(Subject.class, SubjectMixin.class);
        context.setMixInAnnotations(CacheEntry.class, CacheEntryMixin.class);
    }
}
