package dev.vibeshowcase.service;

import dev.vibeshowcase.repository.ProjectSort;

/**
 * Listing filters as received from the client; every field is optional free text.
 */
public record ProjectQuery(String tag, String search, String authorUsername, ProjectSort sort) {

    public ProjectQuery {
        sort = sort != null ? sort : ProjectSort.TRENDING;
    }

    public static ProjectQuery of(String tag, String search, String authorUsername, String sort) {
        return new ProjectQuery(tag, search, authorUsername, ProjectSort.fromParam(sort));
    }
}
