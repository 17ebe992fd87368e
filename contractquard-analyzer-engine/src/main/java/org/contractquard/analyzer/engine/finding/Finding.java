package org.contractquard.analyzer.engine.finding;

import org.contractquard.analyzer.ir.element.SourceLocation;

import java.util.*;

/**
 * A single reported issue. The identifier is stable: analysing the same input twice produces the same
 * identifiers, and the engine uses it to deduplicate.
 *
 * @param category   free-form vulnerability or quality tag, e.g. {@code dead_code}
 * @param detector   name of the analysis that produced the finding
 * @param confidence between 0 and 1
 */
public record Finding(String id,
                      String title,
                      String description,
                      Severity severity,
                      SourceLocation location,
                      String category,
                      String detector,
                      double confidence,
                      String recommendation,
                      List<String> references,
                      Map<String, Object> metadata) {

    public Finding {
        Objects.requireNonNull(id);
        Objects.requireNonNull(title);
        Objects.requireNonNull(severity);
        if (confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException("Confidence out of range: " + confidence);
        }
        references = references == null ? List.of() : List.copyOf(references);
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
    }

    @Override
    public String toString() {
        return severity + " " + id + " @" + location;
    }

    public static class Builder {
        private final String id;
        private String title;
        private String description = "";
        private Severity severity = Severity.INFO;
        private SourceLocation location;
        private String category;
        private String detector = "unknown";
        private double confidence = 1.0;
        private String recommendation;
        private final List<String> references = new ArrayList<>();
        private final Map<String, Object> metadata = new HashMap<>();

        public Builder(String id) {
            this.id = id;
        }

        public Builder setTitle(String title) {
            this.title = title;
            return this;
        }

        public Builder setDescription(String description) {
            this.description = description;
            return this;
        }

        public Builder setSeverity(Severity severity) {
            this.severity = severity;
            return this;
        }

        public Builder setLocation(SourceLocation location) {
            this.location = location;
            return this;
        }

        public Builder setCategory(String category) {
            this.category = category;
            return this;
        }

        public Builder setDetector(String detector) {
            this.detector = detector;
            return this;
        }

        public Builder setConfidence(double confidence) {
            this.confidence = confidence;
            return this;
        }

        public Builder setRecommendation(String recommendation) {
            this.recommendation = recommendation;
            return this;
        }

        public Builder addReference(String reference) {
            references.add(reference);
            return this;
        }

        public Builder putMetadata(String key, Object value) {
            if (value != null) metadata.put(key, value);
            return this;
        }

        public Finding build() {
            return new Finding(id, title, description, severity, location, category, detector, confidence,
                    recommendation, references, metadata);
        }
    }
}
