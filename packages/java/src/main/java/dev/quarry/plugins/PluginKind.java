package dev.quarry.plugins;

/**
 * The four plugin namespaces.
 */
public enum PluginKind {
    VALIDATOR("Validator", "validators"),
    POST_PROCESSOR("PostProcessor", "post-processors"),
    OCR_BACKEND("OCR backend", "OCR backends"),
    DOCUMENT_EXTRACTOR("Document extractor", "document extractors");

    private final String displayName;
    private final String pluralName;

    PluginKind(String displayName, String pluralName) {
        this.displayName = displayName;
        this.pluralName = pluralName;
    }

    public String displayName() {
        return displayName;
    }

    public String pluralName() {
        return pluralName;
    }
}
