package dev.hrats.model;

public record RenderedEmail(String subject, String body) {
}
