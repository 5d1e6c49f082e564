package io.prospekt.serialization.mixin;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/// Jackson mixin fixing the field order of `Report` documents and tolerating fields
/// written by newer versions.
///
/// Applied to `Report.class` via `ProspektJacksonModule.setupModule()`. The record's
/// canonical constructor is used for deserialization, so collection defaults and null
/// checks apply to restored reports exactly as to fresh ones.
///
/// @implNote Derived accessors such as `companyProfile()` and `elapsed()` are not
/// bean-style getters and are never written.
///
/// @see io.prospekt.serialization.ProspektJacksonModule
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonPropertyOrder({
    "subject",
    "runId",
    "status",
    "startedAt",
    "finishedAt",
    "servedFromCache",
    "outputs",
    "errors",
    "skipped",
    "stageDurations"
})
public abstract class ReportMixin {}
