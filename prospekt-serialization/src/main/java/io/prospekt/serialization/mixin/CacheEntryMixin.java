package io.prospekt.serialization.mixin;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/// Jackson mixin for `CacheEntry` as stored in the cache file.
///
/// Puts the key and timestamp ahead of the (large) report so the file stays scannable.
///
/// @see io.prospekt.serialization.JsonFileReportCache
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonPropertyOrder({"key", "createdAt", "report"})
public abstract class CacheEntryMixin {}
