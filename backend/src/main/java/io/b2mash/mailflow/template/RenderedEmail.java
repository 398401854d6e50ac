package io.b2mash.mailflow.template;

/** Output of template rendering, ready to be frozen on a delivery log and handed to transport. */
public record RenderedEmail(String subject, String htmlBody, String textBody) {}
