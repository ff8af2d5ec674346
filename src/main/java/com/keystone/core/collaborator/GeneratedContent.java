package com.keystone.core.collaborator;

/**
 * Content returned by the generation collaborator for one step.
 */
public record GeneratedContent(String content) {

    public GeneratedContent {
        content = content == null ? "" : content;
    }
}
