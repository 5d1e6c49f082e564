package io.prospekt.serialization;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.prospekt.core.report.Report;

/// Utility class for serializing and deserializing Prospekt reports to/from JSON.
///
/// Provides a pre-configured `ObjectMapper` with all necessary modules for handling
/// the sealed stage output hierarchy and `java.time` types (`Duration`, `Instant`).
///
/// ### Usage
/// ```java
/// String json = ReportSerializer.toJson(report);
/// Report restored = ReportSerializer.fromJson(json);
/// ObjectMapper mapper = ReportSerializer.createMapper();
/// ```
///
/// @implNote Thread-safe. The mapper is created per call via `createMapper()`;
/// long-lived components such as {@link JsonFileReportCache} keep their own.
///
/// @see ProspektJacksonModule for the registered type handlers
public final class ReportSerializer {

    private ReportSerializer() {}

    /// Serializes a report to pretty-printed JSON.
    ///
    /// @param report the report to serialize, not null
    /// @return JSON string representation, never null
    /// @throws IllegalArgumentException if serialization fails
    public static String toJson(Report report) {
        try {
            return createMapper().writeValueAsString(report);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to serialize report: " + e.getMessage(), e);
        }
    }

    /// Deserializes a report from JSON.
    ///
    /// @param json JSON string, not null
    /// @return deserialized report, never null
    /// @throws IllegalArgumentException if deserialization fails
    public static Report fromJson(String json) {
        try {
            return createMapper().readValue(json, Report.class);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException(
                    "Failed to deserialize report: " + e.getMessage(), e);
        }
    }

    /// Creates an ObjectMapper configured for report serialization.
    ///
    /// Registers:
    /// - `ProspektJacksonModule` for stage names and the stage output hierarchy
    /// - `JavaTimeModule` for `Duration` and `Instant` fields
    /// - `FAIL_ON_UNKNOWN_PROPERTIES` disabled for forward compatibility
    /// - Timestamps and durations written as ISO-8601 strings
    ///
    /// @return configured ObjectMapper, never null
    public static ObjectMapper createMapper() {
        return new ObjectMapper()
                .registerModule(new ProspektJacksonModule())
                .registerModule(new JavaTimeModule())
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(SerializationFeature.WRITE_DURATIONS_AS_TIMESTAMPS)
                .enable(SerializationFeature.INDENT_OUTPUT);
    }
}
