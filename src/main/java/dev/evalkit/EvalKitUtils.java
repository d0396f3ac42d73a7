package dev.evalkit;

import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Arrays;
import java.util.HexFormat;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;
import javax.annotation.Nonnull;

public class EvalKitUtils {
    /** Deep link to a run's report on the dashboard, if a dashboard is configured. */
    public static Optional<URI> reportUri(Optional<String> dashboardUrl, @Nonnull String runId) {
        return dashboardUrl.map(
                base -> {
                    var trimmed = base.endsWith("/") ? base.substring(0, base.length() - 1) : base;
                    return URI.create("%s/runs/%s".formatted(trimmed, runId));
                });
    }

    public static List<String> parseCsv(String csv) {
        if (csv == null || csv.isBlank()) {
            return List.of();
        }
        return Arrays.stream(csv.split("\\s*,\\s*"))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .collect(Collectors.toList());
    }

    public static String sha256Hex(String value) {
        try {
            var digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(value.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            // every JRE ships SHA-256
            throw new IllegalStateException(e);
        }
    }
}
