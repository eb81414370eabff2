package com.jobrunner.analysis;

import java.util.regex.Pattern;

/**
 * A category of blocking operation recognised in job code.
 *
 * @param name   Category name reported in analysis logs
 * @param regex  Pattern matched against source text or class-file symbols
 * @param weight Contribution to the blocking score when matched
 */
public record BlockingPattern(String name, Pattern regex, int weight) {

    public static BlockingPattern of(String name, String regex, int weight) {
        return new BlockingPattern(name, Pattern.compile(regex, Pattern.CASE_INSENSITIVE), weight);
    }

    public boolean matches(String text) {
        return regex.matcher(text).find();
    }
}
