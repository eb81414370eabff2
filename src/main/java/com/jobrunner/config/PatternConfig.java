package com.jobrunner.config;

/**
 * Additional blocking-operation pattern for static job analysis.
 *
 * @param name   Category name
 * @param regex  Java regular expression matched against job code
 * @param weight Score added when the pattern matches
 */
public record PatternConfig(String name, String regex, int weight) {

    public static final int DEFAULT_WEIGHT = 2;
}
