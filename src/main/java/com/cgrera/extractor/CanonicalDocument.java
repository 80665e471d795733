package com.cgrera.extractor;

/**
 * Entry of the canonical document list. The URL may temporarily hold a placeholder sentinel (the visible
 * "Preview" label, "NA") until artifact capture back-propagates the resolved source URL.
 */
public class CanonicalDocument {
    private String fieldKey;
    private String name;
    private String documentType;
    private String url;
    private String uploadedOn;

    public CanonicalDocument() {}

    public CanonicalDocument(String fieldKey, String name, String documentType, String url, String uploadedOn) {
        this.fieldKey = fieldKey;
        this.name = name;
        this.documentType = documentType;
        this.url = url;
        this.uploadedOn = uploadedOn;
    }

    public String getFieldKey() { return fieldKey; }
    public void setFieldKey(String fieldKey) { this.fieldKey = fieldKey; }
    public String getName() { return name; }
    public void setName(String name) { this.name = name; }
    public String getDocumentType() { return documentType; }
    public void setDocumentType(String documentType) { this.documentType = documentType; }
    public String getUrl() { return url; }
    public void setUrl(String url) { this.url = url; }
    public String getUploadedOn() { return uploadedOn; }
    public void setUploadedOn(String uploadedOn) { this.uploadedOn = uploadedOn; }
}
