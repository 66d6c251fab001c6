package nl.uu.medical.diagnosis.spi;

import java.util.Optional;

/**
 * Public facts about a disease fetched from an external knowledge base. Any field may be absent.
 */
public record DiseaseInfo(String description, String imageUrl, String wikipediaUrl) {

    public Optional<String> descriptionValue() {
        return Optional.ofNullable(description);
    }

    public Optional<String> imageUrlValue() {
        return Optional.ofNullable(imageUrl);
    }

    public Optional<String> wikipediaUrlValue() {
        return Optional.ofNullable(wikipediaUrl);
    }
}
