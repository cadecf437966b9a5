package com.papertrail.core.report;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.papertrail.core.analytics.ConcentrationMetric;
import com.papertrail.core.model.RedFlag;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStream;
import java.io.UncheckedIOException;

/**
 * Writes an {@link AnalysisReport} as snake_case JSON with ISO-8601 dates.
 */
public class JsonReportExporter {
    private static final Logger log = LoggerFactory.getLogger(JsonReportExporter.class);

    private final ObjectMapper objectMapper;

    public JsonReportExporter() {
        this.objectMapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE)
                .setSerializationInclusion(JsonInclude.Include.NON_NULL)
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .enable(SerializationFeature.INDENT_OUTPUT)
                .addMixIn(RedFlag.class, RedFlagMixIn.class)
                .addMixIn(ConcentrationMetric.class, ConcentrationMetricMixIn.class);
    }

    public String toJson(AnalysisReport report) {
        try {
            return objectMapper.writeValueAsString(report);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Failed to serialize report " + report.runId(), e);
        }
    }

    public void write(AnalysisReport report, OutputStream out) throws IOException {
        objectMapper.writeValue(out, report);
        log.info("report.exported runId={} entities={}", report.runId(), report.entities().size());
    }

    ObjectMapper getObjectMapper() {
        return objectMapper;
    }

    @JsonIgnoreProperties({"primarySubjectId", "primary_subject_id"})
    private abstract static class RedFlagMixIn {
    }

    @JsonIgnoreProperties({"defined", "monopoly"})
    private abstract static class ConcentrationMetricMixIn {
    }
}
