package com.parallel.reduction;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

public final class CsvExporter {

    static final String HEADER = "strategy,workers,dataset_length,elapsed_seconds,total,verified,failure";

    private CsvExporter() {
    }

    public static void write(Path path, List<TimingSample> samples) throws IOException {
        if (path.getParent() != null) {
            Files.createDirectories(path.getParent());
        }
        List<String> lines = new ArrayList<>();
        lines.add(HEADER);
        for (TimingSample s : samples) {
            lines.add(String.join(",",
                    sanitize(s.strategy()),
                    String.valueOf(s.workers()),
                    String.valueOf(s.datasetLength()),
                    String.format(Locale.ROOT, "%.9f", s.elapsedSeconds()),
                    s.failed() ? "" : String.valueOf(s.total()),
                    String.valueOf(s.verified()),
                    sanitize(s.failure())));
        }
        Files.write(path, lines);
    }

    private static String sanitize(String value) {
        if (value == null) {
            return "";
        }
        return value.replace(",", " ");
    }
}
