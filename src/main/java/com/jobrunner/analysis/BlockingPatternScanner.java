package com.jobrunner.analysis;

import com.jobrunner.config.PatternConfig;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Scores job code by the blocking operations it mentions.
 *
 * <p>Patterns are written against identifiers so they hit both Java source and the
 * symbol table of a compiled class. Each category counts once.
 */
public class BlockingPatternScanner {

    private static final List<BlockingPattern> BUILT_IN = List.of(
            BlockingPattern.of("sleep", "\\b(sleep|parkNanos|parkUntil)\\b", 10),
            BlockingPattern.of("video_processing", "\\b(ffmpeg|ffprobe|transcode|video|x264)\\b", 8),
            BlockingPattern.of("pdf_generation",
                    "\\b(pdfbox|PDDocument|itextpdf|PdfWriter|PdfDocument|openhtmltopdf|wkhtmltopdf)\\b", 8),
            BlockingPattern.of("image_processing",
                    "\\b(BufferedImage|ImageIO|Graphics2D|AffineTransformOp|ConvolveOp|imgscalr|Thumbnails)\\b", 6),
            BlockingPattern.of("encryption",
                    "\\b(Cipher|SecretKeyFactory|PBEKeySpec|KeyPairGenerator|BCrypt|Argon2)\\b", 6),
            BlockingPattern.of("http_sync",
                    "\\b(HttpURLConnection|HttpClient|openConnection|openStream|RestTemplate|OkHttpClient)\\b", 5),
            BlockingPattern.of("shell_exec", "\\b(ProcessBuilder|getRuntime)\\b", 5),
            BlockingPattern.of("large_files",
                    "\\b(readAllBytes|readAllLines|FileChannel|RandomAccessFile|transferTo)\\b", 4),
            BlockingPattern.of("db_heavy", "\\b(executeBatch|addBatch|batchUpdate|setFetchSize)\\b", 3)
    );

    private final List<BlockingPattern> patterns;

    public BlockingPatternScanner() {
        this(BUILT_IN);
    }

    public BlockingPatternScanner(List<BlockingPattern> patterns) {
        this.patterns = List.copyOf(patterns);
    }

    /**
     * Built-in catalogue plus configured extras.
     */
    public static BlockingPatternScanner withExtras(List<PatternConfig> extras) {
        List<BlockingPattern> all = new ArrayList<>(BUILT_IN);
        for (PatternConfig extra : extras) {
            all.add(BlockingPattern.of(extra.name(), extra.regex(), extra.weight()));
        }
        return new BlockingPatternScanner(all);
    }

    public static List<BlockingPattern> builtIn() {
        return BUILT_IN;
    }

    public ScanResult scan(String text) {
        if (text == null || text.isEmpty()) {
            return new ScanResult(0, Collections.emptyList());
        }
        int score = 0;
        List<String> matched = new ArrayList<>();
        for (BlockingPattern pattern : patterns) {
            if (pattern.matches(text)) {
                score += pattern.weight();
                matched.add(pattern.name());
            }
        }
        return new ScanResult(score, matched);
    }

    public List<BlockingPattern> getPatterns() {
        return patterns;
    }

    /**
     * @param score   Sum of matched category weights
     * @param matched Names of matched categories, catalogue order
     */
    public record ScanResult(int score, List<String> matched) {

        public ScanResult {
            matched = List.copyOf(matched);
        }
    }
}
