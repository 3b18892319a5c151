package com.webharvest.app;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/** 한 줄에 URL 하나. 빈 줄과 '#' 주석은 건너뛴다. 정규화/검증은 크롤러 몫. */
public final class SeedFile {

    private SeedFile() {}

    public static List<String> load(Path path) throws IOException {
        if (!Files.isRegularFile(path)) {
            throw new NoSuchFileException(path.toAbsolutePath().toString(), null, "seed file not found");
        }
        return parse(Files.readAllLines(path, StandardCharsets.UTF_8));
    }

    static List<String> parse(List<String> lines) {
        List<String> out = new ArrayList<>();
        for (String line : lines) {
            String s = line.strip();
            if (s.startsWith("\uFEFF")) s = s.substring(1).strip();
            if (s.isEmpty() || s.startsWith("#")) continue;
            out.add(s);
        }
        return List.copyOf(out);
    }
}
