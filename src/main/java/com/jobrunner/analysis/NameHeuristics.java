package com.jobrunner.analysis;

import com.jobrunner.core.ExecutionTier;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Guesses a tier from the job's simple type name.
 */
final class NameHeuristics {

    private static final List<Pattern> HEAVY = compile(
            "Process.*Video",
            "Generate.*Report",
            "Export.*Large",
            "Compress.*Archive",
            "Backup.*Database",
            "Import.*Bulk",
            "Migrate.*Data");

    private static final List<Pattern> LIGHT = compile(
            "Send.*Email",
            "Send.*Notification",
            "Update.*Cache",
            "Log.*Event",
            "Dispatch.*Event",
            "Trigger.*Webhook");

    private NameHeuristics() {
    }

    static Optional<ExecutionTier> classify(String typeName) {
        String simpleName = simpleName(typeName);
        for (Pattern pattern : HEAVY) {
            if (pattern.matcher(simpleName).find()) {
                return Optional.of(ExecutionTier.ISOLATED);
            }
        }
        for (Pattern pattern : LIGHT) {
            if (pattern.matcher(simpleName).find()) {
                return Optional.of(ExecutionTier.INLINE);
            }
        }
        return Optional.empty();
    }

    static String simpleName(String typeName) {
        int cut = Math.max(typeName.lastIndexOf('.'), typeName.lastIndexOf('$'));
        return cut >= 0 ? typeName.substring(cut + 1) : typeName;
    }

    private static List<Pattern> compile(String... regexes) {
        return Arrays.stream(regexes)
                .map(r -> Pattern.compile(r, Pattern.CASE_INSENSITIVE))
                .toList();
    }
}
