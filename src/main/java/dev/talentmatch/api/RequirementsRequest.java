package dev.talentmatch.api;

/** JSON body of a requirement extraction request. */
public record RequirementsRequest(String jobDescription) {}
