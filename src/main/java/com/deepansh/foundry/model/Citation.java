package com.deepansh.foundry.model;

/** A url_citation annotation surfaced to the caller. Title may be empty. */
public record Citation(String title, String url) {
}
