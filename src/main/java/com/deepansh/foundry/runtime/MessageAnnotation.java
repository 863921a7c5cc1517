package com.deepansh.foundry.runtime;

/**
 * Annotation attached to a text content item. Only url_citation entries carry title/url.
 */
public record MessageAnnotation(String type, String title, String url) {

    public static final String URL_CITATION = "url_citation";

    public boolean isUrlCitation() {
        return URL_CITATION.equals(type);
    }
}
