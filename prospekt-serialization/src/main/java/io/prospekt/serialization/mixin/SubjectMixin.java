package io.prospekt.serialization.mixin;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/// Jackson mixin for `Subject`: writes the normalized key before the display name.
///
/// @see io.prospekt.serialization.ProspektJacksonModule
@JsonPropertyOrder({"key", "displayName"})
public abstract class SubjectMixin {}
