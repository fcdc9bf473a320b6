package com.teamA.cra.common.notification.template;

public record RenderedEmail(String subject, String html) {
}
